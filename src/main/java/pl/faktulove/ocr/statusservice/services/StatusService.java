package pl.faktulove.ocr.statusservice.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import pl.faktulove.ocr.config.OcrPipelineConfig;
import pl.faktulove.ocr.exceptions.FieldValidationException;
import pl.faktulove.ocr.exceptions.OwnershipException;
import pl.faktulove.ocr.exceptions.ResourceNotFoundException;
import pl.faktulove.ocr.security.UserContext;
import pl.faktulove.ocr.statusservice.dto.LastError;
import pl.faktulove.ocr.statusservice.dto.QueueStatisticsResponse;
import pl.faktulove.ocr.statusservice.dto.TaskStatusResponse;
import pl.faktulove.ocr.taskqueue.model.ProcessingTask;
import pl.faktulove.ocr.taskqueue.model.enums.TaskState;
import pl.faktulove.ocr.taskqueue.repositories.TaskStore;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Read-only view of task progress for the task owner. Never writes; any number of
 * callers may poll concurrently.
 */
@ApplicationScoped
public class StatusService {

    public static final int MAX_BULK_IDS = 50;

    static final long POLL_PENDING_MILLIS = 3000;
    static final long POLL_PROCESSING_MILLIS = 1000;

    @Inject
    TaskStore taskStore;

    @Inject
    UserContext userContext;

    @Inject
    EtaEstimator etaEstimator;

    @Inject
    ProcessingStatistics statistics;

    @Inject
    OcrPipelineConfig config;

    /**
     * @throws ResourceNotFoundException if the task does not exist
     * @throws OwnershipException        if the caller does not own the task's document
     */
    public TaskStatusResponse getStatus(String taskId, String callerId) {
        ProcessingTask task = taskStore.get(taskId)
                .orElseThrow(() -> new ResourceNotFoundException("Task", taskId));
        if (!isOwner(task, callerId)) {
            throw new OwnershipException("Task", taskId);
        }
        return toResponse(task, queueDepthFor(task));
    }

    /**
     * Statuses of several tasks at once. Unknown ids and tasks of other owners are left out.
     */
    public List<TaskStatusResponse> getStatuses(List<String> taskIds, String callerId) {
        LinkedHashSet<String> ids = new LinkedHashSet<>(taskIds);
        if (ids.size() > MAX_BULK_IDS) {
            throw new FieldValidationException(Map.of("ids", "At most " + MAX_BULK_IDS + " task ids per request"));
        }
        List<ProcessingTask> tasks = taskStore.getAll(ids).stream()
                .filter(task -> isOwner(task, callerId))
                .toList();
        long depth = tasks.stream().anyMatch(t -> t.getState() == TaskState.PENDING)
                ? taskStore.countInState(TaskState.PENDING)
                : 0;
        return tasks.stream().map(task -> toResponse(task, depth)).toList();
    }

    public QueueStatisticsResponse getStatistics() {
        return new QueueStatisticsResponse(
                taskStore.countInState(TaskState.PENDING),
                taskStore.countInState(TaskState.PROCESSING),
                taskStore.countInState(TaskState.COMPLETED),
                taskStore.countInState(TaskState.FAILED),
                taskStore.countInState(TaskState.CANCELLED),
                config.worker().concurrency(),
                statistics.meanTaskSeconds());
    }

    private boolean isOwner(ProcessingTask task, String callerId) {
        String owner = userContext.ownerOf(task.getDocumentId()).orElse(task.getOwnerId());
        return owner.equals(callerId);
    }

    private long queueDepthFor(ProcessingTask task) {
        return task.getState() == TaskState.PENDING ? taskStore.countInState(TaskState.PENDING) : 0;
    }

    private TaskStatusResponse toResponse(ProcessingTask task, long queueDepth) {
        return new TaskStatusResponse(
                task.getId(),
                task.getDocumentId(),
                task.getState(),
                task.getProgressPercent(),
                etaEstimator.forState(task.getState(), task.getProgressPercent(), queueDepth),
                task.getState() == TaskState.COMPLETED ? task.getResultId() : null,
                task.getAttemptCount(),
                lastError(task),
                pollInterval(task.getState()),
                task.getCreatedAt(),
                task.getUpdatedAt());
    }

    private static LastError lastError(ProcessingTask task) {
        if (task.getLastErrorKind() == null || task.getState() == TaskState.COMPLETED
                || task.getState() == TaskState.CANCELLED) {
            return null;
        }
        LastError.Advice advice = task.getState() == TaskState.FAILED ? LastError.Advice.REUPLOAD : LastError.Advice.WAIT;
        return new LastError(task.getLastErrorKind(), task.getLastErrorMessage(), advice);
    }

    private static long pollInterval(TaskState state) {
        return switch (state) {
            case PENDING -> POLL_PENDING_MILLIS;
            case PROCESSING -> POLL_PROCESSING_MILLIS;
            case COMPLETED, FAILED, CANCELLED -> 0;
        };
    }
}
