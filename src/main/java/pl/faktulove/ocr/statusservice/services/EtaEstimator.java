package pl.faktulove.ocr.statusservice.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import pl.faktulove.ocr.config.OcrPipelineConfig;
import pl.faktulove.ocr.taskqueue.model.enums.ProcessingStage;
import pl.faktulove.ocr.taskqueue.model.enums.TaskState;

/**
 * Heuristic time-to-completion estimates.
 */
@ApplicationScoped
public class EtaEstimator {

    @Inject
    ProcessingStatistics statistics;

    @Inject
    OcrPipelineConfig config;

    /**
     * ETA of a task waiting in a queue of {@code queueDepth} pending tasks (itself included):
     * the queue drains through all worker slots at the historical mean task duration.
     */
    public long forQueuedTask(long queueDepth) {
        int workers = Math.max(1, config.worker().concurrency());
        double seconds = Math.max(1, queueDepth) * statistics.meanTaskSeconds() / workers;
        return (long) Math.ceil(seconds);
    }

    /**
     * ETA of a running task: the mean durations of the stages it has not reached yet.
     */
    public long forRunningTask(int progressPercent) {
        double seconds = 0;
        for (ProcessingStage stage : ProcessingStage.values()) {
            if (stage.getPercent() > progressPercent) {
                seconds += statistics.meanStageSeconds(stage);
            }
        }
        return (long) Math.ceil(seconds);
    }

    public long forState(TaskState state, int progressPercent, long queueDepth) {
        return switch (state) {
            case PENDING -> forQueuedTask(queueDepth);
            case PROCESSING -> forRunningTask(progressPercent);
            case COMPLETED, FAILED, CANCELLED -> 0;
        };
    }
}
