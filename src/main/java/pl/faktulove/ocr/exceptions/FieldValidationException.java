package pl.faktulove.ocr.exceptions;

import jakarta.ws.rs.core.Response;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Caller input failed field-level validation. Never retried.
 */
public class FieldValidationException extends PipelineException {

    private final Map<String, String> fieldErrors;

    public FieldValidationException(Map<String, String> fieldErrors) {
        super("ValidationError", Response.Status.BAD_REQUEST,
                "Validation failed for field(s): " + String.join(", ", fieldErrors.keySet()));
        this.fieldErrors = Collections.unmodifiableMap(new LinkedHashMap<>(fieldErrors));
    }

    public Map<String, String> getFieldErrors() {
        return fieldErrors;
    }
}
