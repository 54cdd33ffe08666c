package by.greenmobile.wavepackcalc.service.physics;

import by.greenmobile.wavepackcalc.exception.DomainException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Reynolds number, Darcy friction factor and Darcy–Weisbach pressure drop for one channel.
 * All channels of the array are assumed hydraulically identical (uniform flow),
 * so one channel's drop is the array's drop.
 *
 * SI units throughout.
 */
@Service
@Slf4j
public class FlowSolver {

    /** Re below this is laminar; Re == 2300 already uses the turbulent branch. */
    public static final double LAMINAR_LIMIT = 2300.0;

    public FlowResult solveChannel(double density, double viscosity, double velocity,
                                   double length, double hydraulicDiameter, double roughness) {
        double re = reynolds(density, velocity, hydraulicDiameter, viscosity);
        double f = frictionFactor(re, roughness, hydraulicDiameter);
        double dp = pressureDrop(density, velocity, length, hydraulicDiameter, f);

        log.debug("Channel: Re={}, f={}, dP={} Pa (Dh={} m, L={} m)", re, f, dp, hydraulicDiameter, length);
        return new FlowResult(re, f, dp);
    }

    public double reynolds(double density, double velocity, double hydraulicDiameter, double viscosity) {
        requirePositive("density", density);
        requirePositive("velocity", velocity);
        requirePositive("hydraulicDiameter", hydraulicDiameter);
        requirePositive("viscosity", viscosity);
        return density * velocity * hydraulicDiameter / viscosity;
    }

    /**
     * Laminar: 64/Re. Turbulent: explicit Swamee–Jain fit of Colebrook–White,
     * no iteration and therefore no convergence failure.
     */
    public double frictionFactor(double reynolds, double roughness, double hydraulicDiameter) {
        requirePositive("reynolds", reynolds);
        if (reynolds < LAMINAR_LIMIT) {
            return 64.0 / reynolds;
        }
        requirePositive("hydraulicDiameter", hydraulicDiameter);
        double arg = roughness / (3.7 * hydraulicDiameter) + 5.74 / Math.pow(reynolds, 0.9);
        double lg = Math.log10(arg);
        return 0.25 / (lg * lg);
    }

    public double pressureDrop(double density, double velocity, double length,
                               double hydraulicDiameter, double frictionFactor) {
        requirePositive("hydraulicDiameter", hydraulicDiameter);
        return frictionFactor * (length / hydraulicDiameter) * 0.5 * density * velocity * velocity;
    }

    private static void requirePositive(String field, double v) {
        if (!(v > 0) || Double.isInfinite(v)) {
            throw new DomainException(field, v, field + " must be a positive finite number, got " + v);
        }
    }
}
