package by.greenmobile.wavepackcalc.service;

import by.greenmobile.wavepackcalc.entity.GeometrySpec;
import by.greenmobile.wavepackcalc.entity.OperatingConditions;
import by.greenmobile.wavepackcalc.entity.WeightUnit;
import lombok.Value;

/**
 * Validated input converted to SI. Material and fluid are still names: resolving them is the
 * property library's job.
 */
@Value
public class NormalizedInput {
    GeometrySpec geometry;
    OperatingConditions conditions;
    String material;
    String fluid;
    WeightUnit weightUnit;
}
