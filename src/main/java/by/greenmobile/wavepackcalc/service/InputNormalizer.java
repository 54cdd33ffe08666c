package by.greenmobile.wavepackcalc.service;

import by.greenmobile.wavepackcalc.entity.GeometrySpec;
import by.greenmobile.wavepackcalc.entity.OperatingConditions;
import by.greenmobile.wavepackcalc.entity.ShapeVariant;
import by.greenmobile.wavepackcalc.entity.WavepackParameters;
import by.greenmobile.wavepackcalc.entity.WeightUnit;
import by.greenmobile.wavepackcalc.exception.DomainException;
import by.greenmobile.wavepackcalc.exception.InvalidInputException;
import by.greenmobile.wavepackcalc.service.engine.Units;
import org.springframework.stereotype.Component;

import java.util.Arrays;

/**
 * First step of a solve: presence/number checks on the raw configuration and
 * conversion of every linear quantity to metres (velocity to m/s, pressure to Pa).
 *
 * Missing or non-finite values are INVALID_INPUT; present but physically meaningless
 * values (zero length, negative velocity) are DOMAIN errors.
 */
@Component
public class InputNormalizer {

    public NormalizedInput normalize(WavepackParameters p) {
        if (p == null) {
            throw new InvalidInputException("body", null, "Input configuration is missing");
        }

        ShapeVariant shape = ShapeVariant.fromLabel(p.getShape())
                .orElseThrow(() -> new InvalidInputException("shape", p.getShape(),
                        "Unknown shape '" + p.getShape() + "', expected one of "
                                + Arrays.toString(Arrays.stream(ShapeVariant.values()).map(ShapeVariant::getLabel).toArray())));

        double aIn = positive("a_in", number("a_in", p.getWidthIn()));
        // b is not part of a circular channel: the diameter is used for both directions
        double bIn = shape.isCircular() ? aIn : positive("b_in", number("b_in", p.getHeightIn()));
        double tIn = positive("t_in", number("t_in", p.getWallThicknessIn()));
        double lIn = positive("L_in", number("L_in", p.getLengthIn()));

        double velFts = positive("vel_target_fts", number("vel_target_fts", p.getVelocityTargetFts()));
        double dpPsi = nonNegative("dp_limit_psi", number("dp_limit_psi", p.getDpLimitPsi()));
        double tMinF = number("T_min_F", p.getMinTemperatureF());
        double tMaxF = number("T_max_F", p.getMaxTemperatureF());

        String material = text("material", p.getMaterial());
        String fluid = text("fluid", p.getFluid());

        GeometrySpec geometry = new GeometrySpec(
                shape,
                Units.inchesToMeters(aIn),
                Units.inchesToMeters(bIn),
                Units.inchesToMeters(tIn),
                Units.inchesToMeters(lIn)
        );
        OperatingConditions conditions = new OperatingConditions(
                Units.feetPerSecondToMetersPerSecond(velFts),
                Units.psiToPascal(dpPsi),
                tMinF,
                tMaxF
        );
        WeightUnit unit = p.getWeightUnit() != null ? p.getWeightUnit() : WeightUnit.LBM;

        return new NormalizedInput(geometry, conditions, material, fluid, unit);
    }

    private static double number(String field, Double v) {
        if (v == null) {
            throw new InvalidInputException(field, null, "Required numeric field '" + field + "' is missing");
        }
        if (v.isNaN() || v.isInfinite()) {
            throw new InvalidInputException(field, v, "Field '" + field + "' must be a finite number, got " + v);
        }
        return v;
    }

    private static double positive(String field, double v) {
        if (v <= 0) {
            throw new DomainException(field, v, "Field '" + field + "' must be positive, got " + v);
        }
        return v;
    }

    // a zero budget is a legal request: it sizes to a single channel
    private static double nonNegative(String field, double v) {
        if (v < 0) {
            throw new DomainException(field, v, "Field '" + field + "' must not be negative, got " + v);
        }
        return v;
    }

    private static String text(String field, String v) {
        if (v == null || v.isBlank()) {
            throw new InvalidInputException(field, v, "Required field '" + field + "' is missing");
        }
        return v.trim();
    }
}
