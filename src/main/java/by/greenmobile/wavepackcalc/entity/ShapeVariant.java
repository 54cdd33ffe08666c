package by.greenmobile.wavepackcalc.entity;

import java.util.Locale;
import java.util.Optional;

/**
 * Channel cross-section and packing.
 * The open-area ratio depends only on the variant.
 */
public enum ShapeVariant {

    RECTANGULAR("Rectangular", 1.0),
    CIRCULAR_INLINE("Circular-Inline", Math.PI / 4.0),
    /** Hexagonal close packing efficiency 0.9069 applied on top of the inline ratio. */
    CIRCULAR_STAGGERED("Circular-Staggered", 0.9069 * (Math.PI / 4.0));

    private final String label;
    private final double openAreaRatio;

    ShapeVariant(String label, double openAreaRatio) {
        this.label = label;
        this.openAreaRatio = openAreaRatio;
    }

    public String getLabel() {
        return label;
    }

    public double getOpenAreaRatio() {
        return openAreaRatio;
    }

    public boolean isCircular() {
        return this != RECTANGULAR;
    }

    /**
     * Exact match on the wire label ("Circular-Inline") or on the constant name ("CIRCULAR_INLINE"),
     * case-insensitive. Partial strings like "Circular" do not match anything.
     */
    public static Optional<ShapeVariant> fromLabel(String raw) {
        if (raw == null) return Optional.empty();
        String s = raw.trim();
        for (ShapeVariant v : values()) {
            if (v.label.equalsIgnoreCase(s) || v.name().equals(s.toUpperCase(Locale.ROOT))) {
                return Optional.of(v);
            }
        }
        return Optional.empty();
    }
}
