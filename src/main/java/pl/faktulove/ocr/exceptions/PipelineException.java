package pl.faktulove.ocr.exceptions;

import jakarta.ws.rs.core.Response;

/**
 * Base type for errors returned synchronously to a caller of the pipeline.
 * Errors that happen while a task is processed are recorded on the task instead.
 */
public abstract class PipelineException extends RuntimeException {

    private final String errorCode;
    private final Response.Status status;

    protected PipelineException(String errorCode, Response.Status status, String message) {
        super(message);
        this.errorCode = errorCode;
        this.status = status;
    }

    protected PipelineException(String errorCode, Response.Status status, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.status = status;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public Response.Status getStatus() {
        return status;
    }
}
