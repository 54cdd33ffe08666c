package by.greenmobile.wavepackcalc.service.engine;

import by.greenmobile.wavepackcalc.entity.FluidProperties;
import by.greenmobile.wavepackcalc.entity.TemperatureProfile;
import by.greenmobile.wavepackcalc.entity.TemperatureSample;
import by.greenmobile.wavepackcalc.exception.DomainException;
import by.greenmobile.wavepackcalc.exception.InvalidInputException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Temperature-dependent fluid properties over [T_min, T_max].
 *
 * Library values are treated as the reference point (273.15 K):
 * - density scales like an ideal gas: rho0 * (Tref / T)
 * - viscosity follows a Sutherland-shaped law with S = 110 K.
 *   The constant is the one for air; liquids get the same curve as a simplification.
 */
@Component
@Slf4j
public class TemperatureInterpolator {

    public static final double REFERENCE_TEMPERATURE_K = 273.15;
    public static final double SUTHERLAND_CONSTANT_K = 110.0;

    public TemperatureProfile interpolate(FluidProperties base, double minF, double maxF, int sampleCount) {
        if (sampleCount < 2) {
            throw new InvalidInputException("sampleCount", sampleCount,
                    "Temperature interpolation needs at least 2 samples, got " + sampleCount);
        }

        double minK = Units.fahrenheitToKelvin(minF);
        double maxK = Units.fahrenheitToKelvin(maxF);
        if (minK <= 0) {
            throw new DomainException("T_min_F", minF, "T_min_F is at or below absolute zero: " + minF);
        }
        if (maxK <= 0) {
            throw new DomainException("T_max_F", maxF, "T_max_F is at or below absolute zero: " + maxF);
        }

        double step = (maxK - minK) / (sampleCount - 1);
        List<TemperatureSample> samples = new ArrayList<>(sampleCount);
        for (int i = 0; i < sampleCount; i++) {
            double t = minK + i * step;
            samples.add(new TemperatureSample(t, density(base, t), viscosity(base, t)));
        }

        TemperatureProfile profile = new TemperatureProfile(samples);
        log.debug("Profile {}: {}..{} K, n={}, mean rho={} kg/m³, mean mu={} Pa·s",
                base.getName(), minK, maxK, sampleCount, profile.getMeanDensity(), profile.getMeanViscosity());
        return profile;
    }

    public double density(FluidProperties base, double temperatureK) {
        return base.getDensity() * (REFERENCE_TEMPERATURE_K / temperatureK);
    }

    public double viscosity(FluidProperties base, double temperatureK) {
        return base.getViscosity()
                * Math.pow(temperatureK / REFERENCE_TEMPERATURE_K, 1.5)
                * (REFERENCE_TEMPERATURE_K + SUTHERLAND_CONSTANT_K)
                / (temperatureK + SUTHERLAND_CONSTANT_K);
    }
}
