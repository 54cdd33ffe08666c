package by.greenmobile.wavepackcalc.service.engine;

import lombok.Value;

/**
 * Layout, envelope (m, m³) and mass (kg) of the whole array.
 */
@Value
public class ArraySynthesis {
    ArrayLayout layout;
    double envelopeWidth;
    double envelopeHeight;
    double envelopeVolume;
    double voidVolume;
    double mass;
}
