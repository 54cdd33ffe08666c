package by.greenmobile.wavepackcalc.entity;

import lombok.Value;

import java.util.List;

/**
 * Ordered temperature samples of one fluid, min to max.
 * The means collapse the sweep into one representative operating point.
 */
@Value
public class TemperatureProfile {
    List<TemperatureSample> samples;
    double meanDensity;
    double meanViscosity;

    public TemperatureProfile(List<TemperatureSample> samples) {
        this.samples = List.copyOf(samples);

        double rhoSum = 0.0;
        double muSum = 0.0;
        for (TemperatureSample s : this.samples) {
            rhoSum += s.getDensity();
            muSum += s.getViscosity();
        }
        int n = Math.max(1, this.samples.size());
        this.meanDensity = rhoSum / n;
        this.meanViscosity = muSum / n;
    }

    public int size() {
        return samples.size();
    }
}
