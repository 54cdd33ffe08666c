package by.greenmobile.wavepackcalc.service.physics;

import lombok.Value;

/**
 * Hydraulics of one representative channel. pressureDrop in Pa.
 */
@Value
public class FlowResult {
    double reynolds;
    double frictionFactor;
    double pressureDrop;

    public boolean isLaminar() {
        return reynolds < FlowSolver.LAMINAR_LIMIT;
    }

    public String regime() {
        return isLaminar() ? "LAMINAR" : "TURBULENT";
    }
}
