package by.greenmobile.wavepackcalc.entity;

import lombok.Value;

@Value
public class TemperatureSample {
    /** Absolute temperature, K. */
    double temperature;
    double density;
    double viscosity;
}
