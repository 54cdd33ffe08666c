package by.greenmobile.wavepackcalc.exception;

/**
 * Fluid or material name that the property library does not know.
 */
public class UnknownLookupException extends WavepackException {

    public UnknownLookupException(String field, Object value, String message) {
        super(ErrorKind.UNKNOWN_LOOKUP, field, value, message);
    }
}
