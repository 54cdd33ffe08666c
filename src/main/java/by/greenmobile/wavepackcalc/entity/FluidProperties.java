package by.greenmobile.wavepackcalc.entity;

import lombok.Value;

/**
 * Baseline fluid properties at the library reference point.
 * density in kg/m³, viscosity (dynamic) in Pa·s.
 */
@Value
public class FluidProperties {
    String name;
    double density;
    double viscosity;
}
