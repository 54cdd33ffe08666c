package by.greenmobile.wavepackcalc.exception;

/**
 * Missing, non-numeric or otherwise unusable input value.
 */
public class InvalidInputException extends WavepackException {

    public InvalidInputException(String field, Object value, String message) {
        super(ErrorKind.INVALID_INPUT, field, value, message);
    }
}
