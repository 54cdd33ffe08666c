package by.greenmobile.wavepackcalc.service.physics;

import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cutoff frequency (Hz) and the shielding-effectiveness curve (dB) over the sweep.
 */
@Value
public class AttenuationResult {
    double cutoffFrequency;
    List<Double> frequencies;
    List<Double> shieldingDb;

    /** SE keyed by frequency, in sweep order. */
    public Map<Double, Double> curve() {
        Map<Double, Double> m = new LinkedHashMap<>();
        for (int i = 0; i < frequencies.size(); i++) {
            m.put(frequencies.get(i), shieldingDb.get(i));
        }
        return Collections.unmodifiableMap(m);
    }
}
