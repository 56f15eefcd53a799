package pl.faktulove.ocr.taskqueue.repositories;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import io.quarkus.panache.common.Page;
import io.quarkus.panache.common.Parameters;
import io.quarkus.panache.common.Sort;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.persistence.PersistenceException;
import jakarta.transaction.Transactional;
import org.hibernate.exception.ConstraintViolationException;
import pl.faktulove.ocr.exceptions.InvalidTaskStateException;
import pl.faktulove.ocr.taskqueue.model.ProcessingTask;
import pl.faktulove.ocr.taskqueue.model.enums.TaskState;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Panache repository for ProcessingTask, used as the lease table of the task queue.
 */
@ApplicationScoped
public class ProcessingTaskRepository implements PanacheRepositoryBase<ProcessingTask, String>, TaskStore {

    private static final List<TaskState> ACTIVE_STATES = List.of(TaskState.PENDING, TaskState.PROCESSING);

    private static final String CLAIMABLE = "(state = :pending and (notBefore is null or notBefore <= :now)) " +
            "or (state = :processing and leaseExpiry <= :now)";

    @Override
    @Transactional
    public void insert(ProcessingTask task) {
        try {
            persistAndFlush(task);
        } catch (PersistenceException e) {
            if (isConstraintViolation(e)) {
                throw new InvalidTaskStateException(
                        "Document " + task.getDocumentId() + " already has an active task");
            }
            throw e;
        }
    }

    @Override
    @Transactional
    public Optional<ProcessingTask> get(String taskId) {
        return findByIdOptional(taskId).map(ProcessingTask::copy);
    }

    @Override
    @Transactional
    public List<ProcessingTask> getAll(Collection<String> taskIds) {
        if (taskIds.isEmpty()) return List.of();
        return find("id in ?1", taskIds).stream().map(ProcessingTask::copy).toList();
    }

    @Override
    @Transactional
    public Optional<ProcessingTask> findActiveForDocument(String documentId) {
        return find("documentId = ?1 and state in ?2", documentId, ACTIVE_STATES)
                .firstResultOptional()
                .map(ProcessingTask::copy);
    }

    @Override
    @Transactional
    public List<ProcessingTask> findByDocument(String documentId) {
        return find("documentId", Sort.descending("createdAt"), documentId)
                .stream().map(ProcessingTask::copy).toList();
    }

    @Override
    @Transactional
    public List<String> findClaimableOwners(LocalDateTime now) {
        return getEntityManager()
                .createQuery("select distinct t.ownerId from ProcessingTask t where " + CLAIMABLE, String.class)
                .setParameter("pending", TaskState.PENDING)
                .setParameter("processing", TaskState.PROCESSING)
                .setParameter("now", now)
                .getResultList();
    }

    @Override
    @Transactional
    public List<ProcessingTask> findClaimableForOwner(String ownerId, LocalDateTime now, int limit) {
        return find("ownerId = :owner and (" + CLAIMABLE + ")",
                Sort.ascending("createdAt"),
                Parameters.with("owner", ownerId)
                        .and("pending", TaskState.PENDING)
                        .and("processing", TaskState.PROCESSING)
                        .and("now", now))
                .page(Page.ofSize(limit))
                .stream().map(ProcessingTask::copy).toList();
    }

    @Override
    @Transactional
    public List<ProcessingTask> findExpiredLeases(LocalDateTime now, int limit) {
        return find("state = ?1 and leaseExpiry <= ?2", Sort.ascending("leaseExpiry"), TaskState.PROCESSING, now)
                .page(Page.ofSize(limit))
                .stream().map(ProcessingTask::copy).toList();
    }

    @Override
    @Transactional
    public List<ProcessingTask> findEndedBefore(Collection<TaskState> states, LocalDateTime cutoff) {
        return find("state in ?1 and updatedAt < ?2", states, cutoff)
                .stream().map(ProcessingTask::copy).toList();
    }

    @Override
    @Transactional
    public boolean compareAndSet(ProcessingTask task) {
        int updated = update("state = :state, activeDocumentId = :activeDocumentId, progressPercent = :progress, attemptCount = :attempts, " +
                        "lastErrorKind = :errorKind, lastErrorMessage = :errorMessage, " +
                        "leaseOwner = :leaseOwner, leaseToken = :leaseToken, leaseExpiry = :leaseExpiry, " +
                        "notBefore = :notBefore, resultId = :resultId, updatedAt = :updatedAt, " +
                        "version = version + 1 where id = :id and version = :version",
                Parameters.with("state", task.getState())
                        .and("activeDocumentId", task.getActiveDocumentId())
                        .and("progress", task.getProgressPercent())
                        .and("attempts", task.getAttemptCount())
                        .and("errorKind", task.getLastErrorKind())
                        .and("errorMessage", task.getLastErrorMessage())
                        .and("leaseOwner", task.getLeaseOwner())
                        .and("leaseToken", task.getLeaseToken())
                        .and("leaseExpiry", task.getLeaseExpiry())
                        .and("notBefore", task.getNotBefore())
                        .and("resultId", task.getResultId())
                        .and("updatedAt", task.getUpdatedAt())
                        .and("id", task.getId())
                        .and("version", task.getVersion()));
        if (updated == 1) {
            task.setVersion(task.getVersion() + 1);
            return true;
        }
        return false;
    }

    @Override
    @Transactional
    public long countInState(TaskState state) {
        return count("state", state);
    }

    private static boolean isConstraintViolation(Throwable e) {
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof ConstraintViolationException) return true;
        }
        return false;
    }
}
