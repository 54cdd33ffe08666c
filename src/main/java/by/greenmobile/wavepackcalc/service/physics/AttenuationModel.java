package by.greenmobile.wavepackcalc.service.physics;

import by.greenmobile.wavepackcalc.entity.GeometrySpec;
import by.greenmobile.wavepackcalc.entity.MaterialProperties;
import by.greenmobile.wavepackcalc.exception.DomainException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Waveguide-below-cutoff shielding of a single channel.
 *
 * IMPORTANT:
 * - at or below cutoff the attenuation constant is clamped to 1.0 1/m. This is a floor,
 *   not the evanescent-mode decay constant, so SE values below cutoff are nominal.
 * - above cutoff alpha = (2π/c)·sqrt(μr·εr·(f² − fc²)).
 * - SE = 20·log10(exp(α·L)), evaluated as 20·α·L·log10(e) so long channels do not overflow exp().
 */
@Service
@Slf4j
public class AttenuationModel {

    public static final double SPEED_OF_LIGHT = 2.998e8;

    /** First root of J1', TE11 mode of a circular guide. */
    public static final double TE11_ROOT = 1.8412;

    public static final double FLOOR_ALPHA = 1.0;

    private static final double LOG10_E = Math.log10(Math.E);

    public AttenuationResult attenuate(GeometrySpec g, MaterialProperties m, List<Double> frequencies) {
        double fc = cutoffFrequency(g, m);

        List<Double> se = new ArrayList<>(frequencies.size());
        for (double f : frequencies) {
            se.add(shieldingEffectiveness(f, fc, g.getLength(), m));
        }

        log.debug("Attenuation {}: fc={} GHz, SE={}", g.getShape(), fc / 1e9, se);
        return new AttenuationResult(fc, List.copyOf(frequencies), List.copyOf(se));
    }

    public double cutoffFrequency(GeometrySpec g, MaterialProperties m) {
        switch (g.getShape()) {
            case RECTANGULAR:
                return cutoffRectangular(g.getWidth(), g.getHeight(), m);
            case CIRCULAR_INLINE:
            case CIRCULAR_STAGGERED:
                return cutoffCircular(g.getDiameter(), m);
            default:
                throw new IllegalStateException("Unhandled shape " + g.getShape());
        }
    }

    public double cutoffRectangular(double a, double b, MaterialProperties m) {
        if (a <= 0) throw new DomainException("a", a, "Channel width must be positive");
        if (b <= 0) throw new DomainException("b", b, "Channel height must be positive");
        return (SPEED_OF_LIGHT / 2.0)
                * Math.sqrt((1.0 / a) * (1.0 / a) + (1.0 / b) * (1.0 / b))
                / Math.sqrt(mediumFactor(m));
    }

    public double cutoffCircular(double diameter, MaterialProperties m) {
        if (diameter <= 0) throw new DomainException("diameter", diameter, "Channel diameter must be positive");
        return (TE11_ROOT * SPEED_OF_LIGHT) / (Math.PI * diameter * Math.sqrt(mediumFactor(m)));
    }

    public double attenuationConstant(double frequency, double cutoff, MaterialProperties m) {
        if (frequency <= cutoff) {
            return FLOOR_ALPHA;
        }
        return (2.0 * Math.PI / SPEED_OF_LIGHT)
                * Math.sqrt(mediumFactor(m) * (frequency * frequency - cutoff * cutoff));
    }

    public double shieldingEffectiveness(double frequency, double cutoff, double length, MaterialProperties m) {
        double alpha = attenuationConstant(frequency, cutoff, m);
        return 20.0 * alpha * length * LOG10_E;
    }

    /** One point per decade, 10^startDecade .. 10^endDecade Hz inclusive. */
    public static List<Double> decadeSweep(int startDecade, int endDecade) {
        if (endDecade < startDecade) {
            throw new IllegalArgumentException("Sweep end decade " + endDecade + " < start " + startDecade);
        }
        List<Double> out = new ArrayList<>(endDecade - startDecade + 1);
        for (int d = startDecade; d <= endDecade; d++) {
            out.add(Math.pow(10.0, d));
        }
        return List.copyOf(out);
    }

    private static double mediumFactor(MaterialProperties m) {
        double k = m.getRelativePermeability() * m.getRelativePermittivity();
        if (!(k > 0)) {
            throw new DomainException("material", m.getName(), "μr·εr must be positive for " + m.getName());
        }
        return k;
    }
}
