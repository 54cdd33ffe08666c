package by.greenmobile.wavepackcalc.controller;

import by.greenmobile.wavepackcalc.exception.ErrorKind;
import by.greenmobile.wavepackcalc.exception.WavepackException;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON error body for the API endpoints:
 * {@code {timestamp, status, error, kind, field, value, message}}.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * Invalid input, unknown material/fluid or a physically impossible configuration.
     * Log: WARN, the request is at fault, no stack trace.
     */
    @ExceptionHandler(WavepackException.class)
    public ResponseEntity<Object> handleWavepackException(WavepackException ex) {
        log.warn("Rejected input: kind={} field={} value={} msg={}",
                ex.getKind(), ex.getField(), ex.getValue(), ex.getMessage());

        HttpStatus status = statusOf(ex.getKind());
        return ResponseEntity.status(status).body(body(status, ex.getKind(), ex.getField(), ex.getValue(), ex.getMessage()));
    }

    /**
     * Body that Jackson could not bind, e.g. {@code "a_in": "wide"}.
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Object> handleUnreadable(HttpMessageNotReadableException ex) {
        String field = null;
        Object value = null;
        if (ex.getCause() instanceof JsonMappingException jme) {
            field = lastField(jme.getPath());
            if (jme instanceof InvalidFormatException ife) {
                value = ife.getValue();
            }
        }
        log.warn("Unreadable request body: field={} msg={}", field, ex.getMostSpecificCause().getMessage());

        String message = field != null
                ? "Field '" + field + "' has the wrong type"
                : "Request body is not valid JSON";
        return ResponseEntity.badRequest().body(body(HttpStatus.BAD_REQUEST, ErrorKind.INVALID_INPUT, field, value, message));
    }

    /**
     * Framework errors that already know their status (missing session result, wrong method or media type).
     */
    @ExceptionHandler({ResponseStatusException.class,
            HttpRequestMethodNotSupportedException.class,
            HttpMediaTypeNotSupportedException.class})
    public ResponseEntity<Object> handleFrameworkError(Exception ex) {
        HttpStatusCode code = ((ErrorResponse) ex).getStatusCode();
        log.warn("Request failed with {}: {}", code.value(), ex.getMessage());

        HttpStatus status = HttpStatus.resolve(code.value());
        Map<String, Object> b = new LinkedHashMap<>();
        b.put("timestamp", LocalDateTime.now());
        b.put("status", code.value());
        b.put("error", status != null ? status.getReasonPhrase() : "Error");
        b.put("message", ((ErrorResponse) ex).getBody().getDetail());
        return ResponseEntity.status(code).body(b);
    }

    /**
     * Everything else.
     * Log: ERROR with the full stack trace.
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Object> handleGeneralErrors(Exception ex) {
        log.error("Unexpected error while handling request", ex);

        Map<String, Object> b = new LinkedHashMap<>();
        b.put("timestamp", LocalDateTime.now());
        b.put("status", 500);
        b.put("error", "Internal Server Error");
        b.put("message", "An unexpected error occurred. Please contact support referencing this timestamp.");
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(b);
    }

    static HttpStatus statusOf(ErrorKind kind) {
        return switch (kind) {
            case INVALID_INPUT, UNKNOWN_LOOKUP -> HttpStatus.BAD_REQUEST;
            case DOMAIN -> HttpStatus.UNPROCESSABLE_ENTITY;
        };
    }

    private static String lastField(List<JsonMappingException.Reference> path) {
        for (int i = path.size() - 1; i >= 0; i--) {
            String name = path.get(i).getFieldName();
            if (name != null) return name;
        }
        return null;
    }

    // Map.of rejects nulls, field/value are often absent
    private static Map<String, Object> body(HttpStatus status, ErrorKind kind, String field, Object value, String message) {
        Map<String, Object> b = new LinkedHashMap<>();
        b.put("timestamp", LocalDateTime.now());
        b.put("status", status.value());
        b.put("error", status.getReasonPhrase());
        b.put("kind", kind.name());
        b.put("field", field);
        b.put("value", value);
        b.put("message", message);
        return b;
    }
}
