package pl.faktulove.ocr.taskqueue.repositories;

import pl.faktulove.ocr.taskqueue.model.ProcessingTask;
import pl.faktulove.ocr.taskqueue.model.enums.TaskState;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Persistence of {@link ProcessingTask} rows. Reads return detached copies; writes after
 * insert only happen through {@link #compareAndSet(ProcessingTask)}.
 */
public interface TaskStore {

    /**
     * @throws pl.faktulove.ocr.exceptions.InvalidTaskStateException if the document
     *         already has a non-terminal task
     */
    void insert(ProcessingTask task);

    Optional<ProcessingTask> get(String taskId);

    List<ProcessingTask> getAll(Collection<String> taskIds);

    /**
     * The single non-terminal task of a document, if any.
     */
    Optional<ProcessingTask> findActiveForDocument(String documentId);

    /**
     * Tasks of a document, newest first.
     */
    List<ProcessingTask> findByDocument(String documentId);

    /**
     * Distinct owners of claimable tasks: pending tasks past their {@code notBefore} and
     * processing tasks whose lease expired.
     */
    List<String> findClaimableOwners(LocalDateTime now);

    /**
     * Claimable tasks of one owner, oldest first.
     */
    List<ProcessingTask> findClaimableForOwner(String ownerId, LocalDateTime now, int limit);

    List<ProcessingTask> findExpiredLeases(LocalDateTime now, int limit);

    List<ProcessingTask> findEndedBefore(Collection<TaskState> states, LocalDateTime cutoff);

    /**
     * Writes the task if the stored version still equals {@code task.getVersion()}.
     * On success the version of both the stored row and {@code task} is incremented.
     *
     * @return false when another writer got there first
     */
    boolean compareAndSet(ProcessingTask task);

    long countInState(TaskState state);
}
