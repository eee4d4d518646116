package uk.gegc.creatorbilling.shared.exception;

import java.util.Collections;
import java.util.Map;

/**
 * Malformed input rejected before any state is touched.
 */
public class ValidationException extends RuntimeException {

    private final Map<String, String> errors;

    public ValidationException(String message) {
        this(message, Collections.emptyMap());
    }

    public ValidationException(String message, Map<String, String> errors) {
        super(message);
        this.errors = errors == null ? Collections.emptyMap() : Map.copyOf(errors);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
        this.errors = Collections.emptyMap();
    }

    public Map<String, String> getErrors() {
        return errors;
    }
}
