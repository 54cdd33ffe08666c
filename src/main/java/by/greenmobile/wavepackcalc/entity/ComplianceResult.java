package by.greenmobile.wavepackcalc.entity;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class ComplianceResult {

    /** Achieved drop ≤ limit. */
    private boolean pressureDropMet;

    private double pressureDropPsi;

    private double pressureDropLimitPsi;

    /** (limit − achieved) / limit, %. Negative when the limit is exceeded. */
    private double pressureMarginPercent;

    /** Sweep point the shielding check was read at (closest to the configured check frequency), Hz. */
    private double shieldingFrequencyHz;

    private double shieldingDb;

    private double shieldingRequirementDb;

    private boolean shieldingMet;

    /** Channel length that reaches the shielding requirement at the check frequency, in. Null when already met. */
    private Double requiredLengthIn;

    /** Human-readable advice; empty when everything passes. */
    private String recommendation;

    public boolean isCompliant() {
        return pressureDropMet && shieldingMet;
    }
}
