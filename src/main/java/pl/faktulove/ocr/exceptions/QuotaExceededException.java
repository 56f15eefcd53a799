package pl.faktulove.ocr.exceptions;

import jakarta.ws.rs.core.Response;

/**
 * The owner has used up the upload quota of the current window.
 */
public class QuotaExceededException extends PipelineException {

    private final long retryAfterSeconds;

    public QuotaExceededException(String ownerId, int limit, long retryAfterSeconds) {
        super("QuotaExceeded", Response.Status.TOO_MANY_REQUESTS,
                String.format("Upload limit of %d documents per minute reached for %s", limit, ownerId));
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
