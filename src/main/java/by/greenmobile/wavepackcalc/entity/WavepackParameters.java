package by.greenmobile.wavepackcalc.entity;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Raw input configuration, exactly as the caller supplies it.
 *
 * Units:
 * - lengths: inch
 * - velocity: ft/s
 * - pressure: psi
 * - temperature: °F
 *
 * Fields are boxed on purpose: a missing value must be reported, not silently read as 0.
 * The JSON names are part of the public contract.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WavepackParameters {

    /** Channel width (rectangular) or diameter (circular), in. */
    @JsonProperty("a_in")
    private Double widthIn;

    /** Channel height, in. Ignored for circular shapes. */
    @JsonProperty("b_in")
    private Double heightIn;

    /** Wall thickness around each channel, in. */
    @JsonProperty("t_in")
    private Double wallThicknessIn;

    /** Channel length (flow direction), in. */
    @JsonProperty("L_in")
    private Double lengthIn;

    /** Rectangular / Circular-Inline / Circular-Staggered. */
    @JsonProperty("shape")
    private String shape;

    @JsonProperty("material")
    private String material;

    @JsonProperty("fluid")
    private String fluid;

    @JsonProperty("vel_target_fts")
    private Double velocityTargetFts;

    @JsonProperty("dp_limit_psi")
    private Double dpLimitPsi;

    @JsonProperty("T_min_F")
    private Double minTemperatureF;

    @JsonProperty("T_max_F")
    private Double maxTemperatureF;

    /** Unit of {@code total_weight} in the result; LBM when absent. */
    @JsonProperty("weight_unit")
    private WeightUnit weightUnit;

    /** Form defaults: the reference Air / Stainless Steel rectangular case. */
    public static WavepackParameters defaults() {
        return WavepackParameters.builder()
                .widthIn(2.0)
                .heightIn(1.0)
                .wallThicknessIn(0.05)
                .lengthIn(6.0)
                .shape(ShapeVariant.RECTANGULAR.getLabel())
                .material("Stainless Steel")
                .fluid("Air")
                .velocityTargetFts(50.0)
                .dpLimitPsi(5.0)
                .minTemperatureF(32.0)
                .maxTemperatureF(212.0)
                .weightUnit(WeightUnit.LBM)
                .build();
    }
}
