package by.greenmobile.wavepackcalc.service.engine;

import lombok.Value;

/**
 * Square channel grid. {@code shortfall = required - provisioned}, never negative.
 */
@Value
public class ArrayLayout {
    int rows;
    int columns;
    int requiredChannels;

    public int getProvisionedChannels() {
        return rows * columns;
    }

    public int getShortfall() {
        return Math.max(0, requiredChannels - getProvisionedChannels());
    }
}
