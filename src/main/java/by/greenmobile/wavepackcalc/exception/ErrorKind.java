package by.greenmobile.wavepackcalc.exception;

/**
 * Category of a failed solve. Serialized as-is into the error body.
 */
public enum ErrorKind {
    /** Missing / non-numeric field, unknown shape label, sample count below 2. */
    INVALID_INPUT,
    /** Material or fluid name absent from the property library. */
    UNKNOWN_LOOKUP,
    /** Physically undefined computation (non-positive dimension, velocity, viscosity...). */
    DOMAIN
}
