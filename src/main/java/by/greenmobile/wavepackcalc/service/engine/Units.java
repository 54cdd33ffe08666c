package by.greenmobile.wavepackcalc.service.engine;

/**
 * Unit conversions between the imperial input/output contract and the SI values used internally.
 */
public final class Units {

    public static final double IN_TO_M = 0.0254;
    public static final double FT_TO_M = 0.3048;
    public static final double PSI_TO_PA = 6894.76;
    public static final double PA_TO_PSI = 1.0 / PSI_TO_PA;

    /** Offset between °F and °R. */
    private static final double RANKINE_OFFSET = 459.67;

    private Units() {} // utility class

    public static double inchesToMeters(double in) {
        return in * IN_TO_M;
    }

    public static double metersToInches(double m) {
        return m / IN_TO_M;
    }

    public static double metersToFeet(double m) {
        return m / FT_TO_M;
    }

    public static double feetPerSecondToMetersPerSecond(double fts) {
        return fts * FT_TO_M;
    }

    public static double metersPerSecondToFeetPerSecond(double mps) {
        return mps / FT_TO_M;
    }

    public static double psiToPascal(double psi) {
        return psi * PSI_TO_PA;
    }

    public static double pascalToPsi(double pa) {
        return pa * PA_TO_PSI;
    }

    public static double fahrenheitToKelvin(double f) {
        return (f + RANKINE_OFFSET) * 5.0 / 9.0;
    }

    public static double kelvinToFahrenheit(double k) {
        return k * 9.0 / 5.0 - RANKINE_OFFSET;
    }
}
