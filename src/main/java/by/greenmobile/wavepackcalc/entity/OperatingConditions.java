package by.greenmobile.wavepackcalc.entity;

import lombok.Value;

/**
 * velocity in m/s, pressure-drop limit in Pa, temperatures stay in °F as entered.
 */
@Value
public class OperatingConditions {
    double targetVelocity;
    double pressureDropLimit;
    double minTemperatureF;
    double maxTemperatureF;
}
