package by.greenmobile.wavepackcalc.exception;

/**
 * Computation that has no physical meaning for the given values, e.g. zero velocity or a non-positive dimension.
 */
public class DomainException extends WavepackException {

    public DomainException(String field, Object value, String message) {
        super(ErrorKind.DOMAIN, field, value, message);
    }
}
