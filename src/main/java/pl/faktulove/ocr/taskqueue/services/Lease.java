package pl.faktulove.ocr.taskqueue.services;

/**
 * A worker's time-bounded claim on a task. The token identifies this particular lease;
 * a re-lease of the same task after expiry gets a new one.
 */
public record Lease(String taskId, String documentId, String ownerId, String workerId, String token, int attempt) {
}
