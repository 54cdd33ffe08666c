package by.greenmobile.wavepackcalc.entity;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Flow through the representative channel at one temperature of the profile.
 */
@Value
@Builder
@Jacksonized
public class TemperaturePoint {

    @JsonProperty("T_F")
    double temperatureF;

    @JsonProperty("density_kgm3")
    double density;

    @JsonProperty("viscosity_pas")
    double viscosity;

    @JsonProperty("reynolds")
    double reynolds;

    @JsonProperty("deltaP_psi")
    double pressureDropPsi;
}
