package by.greenmobile.wavepackcalc.entity;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Payload of POST /report: what was asked, what was computed, and optional
 * images rendered by the client (base64, plain or as a {@code data:} URI).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReportRequest {

    @JsonProperty("inputs")
    private WavepackParameters inputs;

    @JsonProperty("results")
    private SolveResult results;

    /** Isometric / face schematic. */
    @JsonProperty("schematic")
    private String schematic;

    /** Pressure and velocity vs temperature chart. */
    @JsonProperty("chartPT")
    private String pressureChart;

    /** Attenuation vs frequency chart. */
    @JsonProperty("chartAF")
    private String attenuationChart;
}
