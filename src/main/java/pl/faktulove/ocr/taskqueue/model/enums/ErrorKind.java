package pl.faktulove.ocr.taskqueue.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Classification of a processing failure recorded on a task.
 */
public enum ErrorKind {
    ENGINE_TRANSIENT("EngineFailure.Transient", true),
    ENGINE_PERMANENT("EngineFailure.Permanent", false),
    TIMEOUT("Timeout", true),
    LEASE_EXPIRED("LeaseExpired", true),
    CORRUPT_DOCUMENT("CorruptDocument", false),
    STORAGE("Storage", true),
    INTERNAL("Internal", true);

    private final String code;
    private final boolean transientFailure;

    ErrorKind(String code, boolean transientFailure) {
        this.code = code;
        this.transientFailure = transientFailure;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * Transient failures are retried with backoff until the attempt cap is reached.
     */
    public boolean isTransient() {
        return transientFailure;
    }
}
