package pl.faktulove.ocr.taskqueue.model.enums;

/**
 * Lifecycle of a {@link pl.faktulove.ocr.taskqueue.model.ProcessingTask}.
 */
public enum TaskState {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
