package by.greenmobile.wavepackcalc.service.compliance;

import by.greenmobile.wavepackcalc.entity.ComplianceResult;
import by.greenmobile.wavepackcalc.entity.SolveResult;
import by.greenmobile.wavepackcalc.entity.WavepackParameters;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

/**
 * Pass/fail checks printed in the report: pressure drop against the caller's limit,
 * shielding at the check frequency against the EMI requirement.
 *
 * Reads only the finished SolveResult; never recomputes physics.
 */
@Service
@Slf4j
public class ComplianceService {

    private final double checkFrequencyHz;
    private final double minShieldingDb;

    public ComplianceService(@Value("${compliance.shielding.frequency-hz:1.0e9}") double checkFrequencyHz,
                             @Value("${compliance.shielding.min-db:80}") double minShieldingDb) {
        this.checkFrequencyHz = checkFrequencyHz;
        this.minShieldingDb = minShieldingDb;
    }

    public double getMinShieldingDb() {
        return minShieldingDb;
    }

    public ComplianceResult evaluate(WavepackParameters inputs, SolveResult r) {
        double limitPsi = inputs.getDpLimitPsi() != null ? inputs.getDpLimitPsi() : 0.0;
        double dpPsi = r.getDeltaPPsi();
        boolean dpOk = dpPsi <= limitPsi;
        double margin = limitPsi > 0 ? 100.0 * (limitPsi - dpPsi) / limitPsi : 0.0;

        int idx = closestIndex(r.getFrequencies(), checkFrequencyHz);
        double freq = idx >= 0 ? r.getFrequencies().get(idx) : checkFrequencyHz;
        double se = idx >= 0 ? r.getShieldingDb().get(idx) : 0.0;
        boolean seOk = se >= minShieldingDb;

        // SE grows linearly with channel length at fixed frequency
        Double requiredLengthIn = null;
        if (!seOk && se > 0) {
            requiredLengthIn = r.getLengthFt() * 12.0 * (minShieldingDb / se);
        }

        String rec = recommendation(dpOk, dpPsi, limitPsi, seOk, freq, se, requiredLengthIn);

        log.info("Compliance: dP={} psi (limit {}, ok={}), SE@{} Hz={} dB (min {}, ok={})",
                dpPsi, limitPsi, dpOk, freq, se, minShieldingDb, seOk);

        return new ComplianceResult(dpOk, dpPsi, limitPsi, margin, freq, se, minShieldingDb, seOk,
                requiredLengthIn, rec);
    }

    private String recommendation(boolean dpOk, double dpPsi, double limitPsi,
                                  boolean seOk, double freq, double se, Double requiredLengthIn) {
        if (dpOk && seOk) return "";

        StringBuilder sb = new StringBuilder();
        if (!dpOk) {
            sb.append("Pressure drop ").append(fmt3(dpPsi)).append(" psi exceeds the ")
                    .append(fmt3(limitPsi)).append(" psi limit: enlarge the channel cross-section, ")
                    .append("shorten the channels or lower the target velocity. ");
        }
        if (!seOk) {
            sb.append("Shielding at ").append(fmtFreq(freq)).append(" is ").append(fmt1(se))
                    .append(" dB, below the ").append(fmt1(minShieldingDb)).append(" dB requirement");
            if (requiredLengthIn != null) {
                sb.append(": increase channel length to ≈ ").append(fmt2(requiredLengthIn)).append(" in");
            }
            sb.append(". ");
        }
        return sb.toString().trim();
    }

    private static int closestIndex(List<Double> freqs, double target) {
        if (freqs == null || freqs.isEmpty()) return -1;
        int best = 0;
        double bestDist = Double.MAX_VALUE;
        for (int i = 0; i < freqs.size(); i++) {
            // decades: compare on a log scale
            double d = Math.abs(Math.log10(freqs.get(i)) - Math.log10(target));
            if (d < bestDist) {
                bestDist = d;
                best = i;
            }
        }
        return best;
    }

    private static String fmtFreq(double hz) {
        if (hz >= 1e9) return fmt2(hz / 1e9) + " GHz";
        if (hz >= 1e6) return fmt2(hz / 1e6) + " MHz";
        return fmt2(hz / 1e3) + " kHz";
    }

    private static String fmt1(double v) { return String.format(Locale.US, "%.1f", v); }
    private static String fmt2(double v) { return String.format(Locale.US, "%.2f", v); }
    private static String fmt3(double v) { return String.format(Locale.US, "%.3f", v); }
}
