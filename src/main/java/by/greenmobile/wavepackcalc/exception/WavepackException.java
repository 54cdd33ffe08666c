package by.greenmobile.wavepackcalc.exception;

import lombok.Getter;

/**
 * Base of every failure raised by the solver.
 * Carries the kind, the offending field and its value, so the HTTP layer can report
 * a structured error instead of a bare stack trace.
 */
@Getter
public abstract class WavepackException extends RuntimeException {

    private final ErrorKind kind;
    private final String field;
    private final transient Object value;

    protected WavepackException(ErrorKind kind, String field, Object value, String message) {
        super(message);
        this.kind = kind;
        this.field = field;
        this.value = value;
    }
}
