package pl.faktulove.ocr.taskqueue.services;

/**
 * Outcome of a lease-guarded write.
 */
public enum LeaseStatus {
    /** The lease is still held and the write was applied. */
    HELD,
    /** The owner cancelled the task. */
    CANCELLED,
    /** The lease expired or was taken over. */
    LOST;

    public boolean isHeld() {
        return this == HELD;
    }
}
