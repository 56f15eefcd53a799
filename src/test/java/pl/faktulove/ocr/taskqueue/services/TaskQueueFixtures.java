package pl.faktulove.ocr.taskqueue.services;

import pl.faktulove.ocr.config.OcrPipelineConfig;
import pl.faktulove.ocr.security.UserContext;
import pl.faktulove.ocr.taskqueue.repositories.TaskStore;

import java.time.Clock;

/**
 * Wires queue services for tests outside this package.
 */
public final class TaskQueueFixtures {

    private TaskQueueFixtures() {
    }

    public static RetryPolicy retryPolicy(OcrPipelineConfig config) {
        RetryPolicy retryPolicy = new RetryPolicy();
        retryPolicy.config = config;
        return retryPolicy;
    }

    public static LeaseTableTaskQueue leaseTableQueue(TaskStore taskStore, OcrPipelineConfig config, Clock clock) {
        LeaseTableTaskQueue queue = new LeaseTableTaskQueue();
        queue.taskStore = taskStore;
        queue.stateMachine = new TaskStateMachine();
        queue.retryPolicy = retryPolicy(config);
        queue.config = config;
        queue.clock = clock;
        return queue;
    }

    public static TaskCommandService commandService(TaskStore taskStore, TaskQueue taskQueue, UserContext userContext) {
        TaskCommandService service = new TaskCommandService();
        service.taskStore = taskStore;
        service.taskQueue = taskQueue;
        service.userContext = userContext;
        return service;
    }
}
