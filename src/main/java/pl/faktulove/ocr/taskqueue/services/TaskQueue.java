package pl.faktulove.ocr.taskqueue.services;

import pl.faktulove.ocr.taskqueue.model.ProcessingTask;
import pl.faktulove.ocr.taskqueue.model.enums.ErrorKind;
import pl.faktulove.ocr.taskqueue.model.enums.ProcessingStage;

import java.util.Optional;

/**
 * Shared queue of processing tasks with lease-based exclusivity and at-least-once delivery.
 *
 * <p>Every lease-guarded call succeeds only while the caller still holds an unexpired
 * lease on the task; otherwise nothing is written and the returned status says why.
 */
public interface TaskQueue {

    /**
     * Creates a {@code PENDING} task for the document.
     *
     * @throws pl.faktulove.ocr.exceptions.InvalidTaskStateException if the document
     *         already has a non-terminal task
     */
    ProcessingTask enqueue(String documentId, String ownerId);

    /**
     * Claims the next task for the worker, or nothing if no task is claimable right now.
     */
    Optional<Lease> lease(String workerId);

    LeaseStatus heartbeat(Lease lease);

    /**
     * Records a reached stage. Progress never moves backwards within an attempt.
     */
    LeaseStatus reportProgress(Lease lease, ProcessingStage stage);

    LeaseStatus complete(Lease lease, String resultId);

    /**
     * Records the failure; transient kinds below the attempt cap go back to
     * {@code PENDING} after a backoff, everything else ends {@code FAILED}.
     */
    LeaseStatus fail(Lease lease, ErrorKind kind, String message);

    /**
     * @throws pl.faktulove.ocr.exceptions.ResourceNotFoundException if the task does not exist
     * @throws pl.faktulove.ocr.exceptions.InvalidTaskStateException if the task already ended
     */
    ProcessingTask cancel(String taskId);

    /**
     * Requeues or fails tasks whose worker stopped heart-beating.
     *
     * @return number of tasks reclaimed
     */
    int reapExpiredLeases();

    long queueDepth();
}
