package by.greenmobile.wavepackcalc.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Output of one solve. Built once by the facade and never mutated afterwards.
 *
 * The first block of fields is the public contract (names fixed),
 * the rest are diagnostics shown in the form and the report.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class SolveResult {

    /** [rows, columns]. */
    @JsonProperty("array_dims")
    List<Integer> arrayDims;

    @JsonProperty("velocity_fts")
    double velocityFts;

    @JsonProperty("deltaP_psi")
    double deltaPPsi;

    @JsonProperty("fc_GHz")
    double cutoffGhz;

    /** dB, aligned with {@link #frequencies}. */
    @JsonProperty("SE_db")
    List<Double> shieldingDb;

    /** Hz. */
    @JsonProperty("freqs")
    List<Double> frequencies;

    @JsonProperty("total_weight_lbm")
    double totalWeightLbm;

    @JsonProperty("a_in")
    double widthIn;

    @JsonProperty("b_in")
    double heightIn;

    @JsonProperty("t_in")
    double wallThicknessIn;

    @JsonProperty("L_ft")
    double lengthFt;

    // ===== diagnostics =====

    @JsonProperty("shape")
    String shape;

    @JsonProperty("material")
    String material;

    @JsonProperty("fluid")
    String fluid;

    @JsonProperty("reynolds")
    double reynolds;

    @JsonProperty("friction_factor")
    double frictionFactor;

    @JsonProperty("flow_regime")
    String flowRegime;

    @JsonProperty("hydraulic_diameter_in")
    double hydraulicDiameterIn;

    @JsonProperty("open_area_ratio")
    double openAreaRatio;

    @JsonProperty("channels_required")
    int channelsRequired;

    @JsonProperty("channels_provisioned")
    int channelsProvisioned;

    /** Required channels that did not fit the square layout (TRUNCATE policy only). */
    @JsonProperty("channel_shortfall")
    int channelShortfall;

    @JsonProperty("envelope_width_in")
    double envelopeWidthIn;

    @JsonProperty("envelope_height_in")
    double envelopeHeightIn;

    @JsonProperty("mean_density_kgm3")
    double meanDensity;

    @JsonProperty("mean_viscosity_pas")
    double meanViscosity;

    @JsonProperty("total_weight")
    double totalWeight;

    @JsonProperty("weight_unit")
    WeightUnit weightUnit;

    @JsonProperty("temperature_sweep")
    List<TemperaturePoint> temperatureSweep;

    @JsonIgnore
    public int getRows() {
        return arrayDims.get(0);
    }

    @JsonIgnore
    public int getColumns() {
        return arrayDims.get(1);
    }
}
