package by.greenmobile.wavepackcalc.entity;

/**
 * How a required channel count that is not a perfect square maps onto the square array.
 */
public enum LayoutPolicy {
    /** side = ceil(sqrt(N)): never under-provisions flow capacity. */
    ROUND_UP,
    /** side = floor(sqrt(N)): the missing channels are reported as a shortfall. */
    TRUNCATE
}
