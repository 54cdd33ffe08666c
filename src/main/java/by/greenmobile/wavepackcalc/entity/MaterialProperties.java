package by.greenmobile.wavepackcalc.entity;

import lombok.Value;

/**
 * Wall material of the array.
 * density in kg/m³, roughness in m, permittivity/permeability are relative (dimensionless).
 */
@Value
public class MaterialProperties {
    String name;
    double density;
    double relativePermittivity;
    double relativePermeability;
    double roughness;
}
