package pl.faktulove.ocr.exceptions;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * Error body returned for every {@link PipelineException}.
 *
 * @param error stable error code, e.g. {@code QuotaExceeded}
 * @param message human-readable reason
 * @param fieldErrors field name to message, only for validation errors
 * @param retryAfterSeconds seconds to back off, only for quota errors
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
    String error,
    String message,
    Map<String, String> fieldErrors,
    Long retryAfterSeconds
) {}
