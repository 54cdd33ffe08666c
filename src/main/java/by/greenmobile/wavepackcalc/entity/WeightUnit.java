package by.greenmobile.wavepackcalc.entity;

public enum WeightUnit {
    LBM(2.20462),
    KG(1.0);

    private final double perKilogram;

    WeightUnit(double perKilogram) {
        this.perKilogram = perKilogram;
    }

    public double fromKilograms(double kg) {
        return kg * perKilogram;
    }
}
