package pl.faktulove.ocr.taskqueue.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;
import pl.faktulove.ocr.config.OcrPipelineConfig;
import pl.faktulove.ocr.exceptions.InvalidTaskStateException;
import pl.faktulove.ocr.exceptions.ResourceNotFoundException;
import pl.faktulove.ocr.taskqueue.model.ProcessingTask;
import pl.faktulove.ocr.taskqueue.model.enums.ErrorKind;
import pl.faktulove.ocr.taskqueue.model.enums.ProcessingStage;
import pl.faktulove.ocr.taskqueue.model.enums.TaskState;
import pl.faktulove.ocr.taskqueue.repositories.TaskStore;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;

/**
 * {@link TaskQueue} over a database lease table. The task row is the lease record and
 * every write is a compare-and-swap on its version column, so any number of worker
 * threads or processes can share the table.
 */
@JBossLog
@ApplicationScoped
public class LeaseTableTaskQueue implements TaskQueue {

    @Inject
    TaskStore taskStore;

    @Inject
    TaskStateMachine stateMachine;

    @Inject
    RetryPolicy retryPolicy;

    @Inject
    OcrPipelineConfig config;

    @Inject
    Clock clock;

    final FairOwnerRotation rotation = new FairOwnerRotation();

    @Override
    public ProcessingTask enqueue(String documentId, String ownerId) {
        taskStore.findActiveForDocument(documentId).ifPresent(active -> {
            throw new InvalidTaskStateException(
                    "Document " + documentId + " already has active task " + active.getId());
        });
        ProcessingTask task = new ProcessingTask(documentId, ownerId, now());
        taskStore.insert(task);
        log.infof("Enqueued task %s for document %s (owner %s)", task.getId(), documentId, ownerId);
        return task.copy();
    }

    @Override
    public Optional<Lease> lease(String workerId) {
        LocalDateTime now = now();
        for (String ownerId : rotation.order(taskStore.findClaimableOwners(now))) {
            for (ProcessingTask task : taskStore.findClaimableForOwner(ownerId, now, config.queue().claimBatchSize())) {
                Optional<Lease> lease = tryLease(task, workerId, now);
                if (lease.isPresent()) {
                    rotation.served(ownerId);
                    return lease;
                }
            }
        }
        return Optional.empty();
    }

    private Optional<Lease> tryLease(ProcessingTask task, String workerId, LocalDateTime now) {
        if (task.getState() == TaskState.PROCESSING) {
            if (task.getAttemptCount() >= retryPolicy.maxAttempts()) {
                failExpiredLease(task, now);
                return Optional.empty();
            }
            log.warnf("Task %s reclaimed from %s after lease expiry", task.getId(), task.getLeaseOwner());
            task.recordError(ErrorKind.LEASE_EXPIRED, "Lease of worker " + task.getLeaseOwner() + " expired");
        }

        stateMachine.transition(task, TaskState.PROCESSING, now);
        task.setAttemptCount(task.getAttemptCount() + 1);
        task.setProgressPercent(0);
        task.setLeaseOwner(workerId);
        task.setLeaseToken(UUID.randomUUID().toString());
        task.setLeaseExpiry(now.plus(config.queue().leaseTtl()));
        task.setNotBefore(null);

        if (!taskStore.compareAndSet(task)) {
            log.debugf("Task %s claimed concurrently, trying next candidate", task.getId());
            return Optional.empty();
        }
        log.infof("Worker %s leased task %s (attempt %d)", workerId, task.getId(), task.getAttemptCount());
        return Optional.of(new Lease(task.getId(), task.getDocumentId(), task.getOwnerId(),
                workerId, task.getLeaseToken(), task.getAttemptCount()));
    }

    @Override
    public LeaseStatus heartbeat(Lease lease) {
        return guarded(lease, task -> task.setLeaseExpiry(now().plus(config.queue().leaseTtl())));
    }

    @Override
    public LeaseStatus reportProgress(Lease lease, ProcessingStage stage) {
        return guarded(lease, task -> {
            task.setProgressPercent(Math.max(task.getProgressPercent(), stage.getPercent()));
            task.setLeaseExpiry(now().plus(config.queue().leaseTtl()));
        });
    }

    @Override
    public LeaseStatus complete(Lease lease, String resultId) {
        LeaseStatus status = guarded(lease, task -> {
            stateMachine.transition(task, TaskState.COMPLETED, now());
            task.setProgressPercent(ProcessingStage.PERSISTED.getPercent());
            task.setResultId(resultId);
            task.clearLease();
        });
        if (status.isHeld()) {
            log.infof("Task %s completed with result %s", lease.taskId(), resultId);
        }
        return status;
    }

    @Override
    public LeaseStatus fail(Lease lease, ErrorKind kind, String message) {
        boolean[] requeued = new boolean[1];
        LeaseStatus status = guarded(lease, task -> {
            LocalDateTime now = now();
            task.recordError(kind, message);
            task.clearLease();
            if (retryPolicy.shouldRetry(kind, task.getAttemptCount())) {
                Duration backoff = retryPolicy.backoffFor(task.getAttemptCount());
                stateMachine.transition(task, TaskState.PENDING, now);
                task.setNotBefore(now.plus(backoff));
                requeued[0] = true;
            } else {
                stateMachine.transition(task, TaskState.FAILED, now);
                requeued[0] = false;
            }
        });
        if (status.isHeld()) {
            if (requeued[0]) {
                log.warnf("Task %s attempt %d failed (%s), requeued with backoff %s",
                        lease.taskId(), lease.attempt(), kind.getCode(), retryPolicy.backoffFor(lease.attempt()));
            } else {
                log.errorf("Task %s failed permanently after attempt %d (%s): %s",
                        lease.taskId(), lease.attempt(), kind.getCode(), message);
            }
        }
        return status;
    }

    @Override
    public ProcessingTask cancel(String taskId) {
        for (;;) {
            ProcessingTask task = taskStore.get(taskId)
                    .orElseThrow(() -> new ResourceNotFoundException("Task", taskId));
            if (task.getState().isTerminal()) {
                throw new InvalidTaskStateException("Task " + taskId + " already ended as " + task.getState());
            }
            stateMachine.transition(task, TaskState.CANCELLED, now());
            task.clearLease();
            if (taskStore.compareAndSet(task)) {
                log.infof("Task %s cancelled", taskId);
                return task;
            }
        }
    }

    @Override
    public int reapExpiredLeases() {
        LocalDateTime now = now();
        int reclaimed = 0;
        for (ProcessingTask task : taskStore.findExpiredLeases(now, config.queue().claimBatchSize())) {
            if (task.getAttemptCount() >= retryPolicy.maxAttempts()) {
                if (failExpiredLease(task, now)) reclaimed++;
                continue;
            }
            String previousOwner = task.getLeaseOwner();
            task.recordError(ErrorKind.LEASE_EXPIRED, "Lease of worker " + previousOwner + " expired");
            stateMachine.transition(task, TaskState.PENDING, now);
            task.clearLease();
            task.setNotBefore(now);
            if (taskStore.compareAndSet(task)) {
                log.warnf("Task %s requeued after lease of %s expired", task.getId(), previousOwner);
                reclaimed++;
            }
        }
        return reclaimed;
    }

    @Override
    public long queueDepth() {
        return taskStore.countInState(TaskState.PENDING);
    }

    private boolean failExpiredLease(ProcessingTask task, LocalDateTime now) {
        task.recordError(ErrorKind.LEASE_EXPIRED,
                "Lease of worker " + task.getLeaseOwner() + " expired on the last attempt");
        stateMachine.transition(task, TaskState.FAILED, now);
        task.clearLease();
        boolean written = taskStore.compareAndSet(task);
        if (written) {
            log.errorf("Task %s failed: lease expired after %d attempts", task.getId(), task.getAttemptCount());
        }
        return written;
    }

    private LeaseStatus guarded(Lease lease, Consumer<ProcessingTask> mutation) {
        for (;;) {
            Optional<ProcessingTask> current = taskStore.get(lease.taskId());
            if (current.isEmpty()) {
                return LeaseStatus.LOST;
            }
            ProcessingTask task = current.get();
            if (task.getState() == TaskState.CANCELLED) {
                return LeaseStatus.CANCELLED;
            }
            if (!task.isLeasedBy(lease.token(), now())) {
                return LeaseStatus.LOST;
            }
            mutation.accept(task);
            task.setUpdatedAt(now());
            if (taskStore.compareAndSet(task)) {
                return LeaseStatus.HELD;
            }
        }
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
