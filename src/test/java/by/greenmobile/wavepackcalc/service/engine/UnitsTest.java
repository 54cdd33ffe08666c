package by.greenmobile.wavepackcalc.service.engine;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class UnitsTest {

    @Test
    @DisplayName("inch -> metre -> inch returns the original value")
    void inchRoundTrip() {
        for (double in : new double[]{0.001, 0.05, 1.0, 2.0, 6.0, 144.0, 12345.678}) {
            double back = Units.metersToInches(Units.inchesToMeters(in));
            assertEquals(in, back, Math.ulp(in) * 4, "round trip for " + in);
        }
    }

    @Test
    @DisplayName("Fixed conversion factors")
    void factors() {
        assertEquals(0.0254, Units.inchesToMeters(1.0), 0.0);
        assertEquals(0.3048, Units.feetPerSecondToMetersPerSecond(1.0), 0.0);
        assertEquals(6894.76, Units.psiToPascal(1.0), 1e-9);
        assertEquals(0.5, Units.metersToFeet(Units.inchesToMeters(6.0)), 1e-12);
    }

    @Test
    @DisplayName("Fahrenheit/Kelvin reference points")
    void temperatures() {
        assertEquals(273.15, Units.fahrenheitToKelvin(32.0), 1e-9);
        assertEquals(373.15, Units.fahrenheitToKelvin(212.0), 1e-9);
        assertEquals(0.0, Units.fahrenheitToKelvin(-459.67), 1e-9);
        assertEquals(68.0, Units.kelvinToFahrenheit(Units.fahrenheitToKelvin(68.0)), 1e-9);
    }
}
