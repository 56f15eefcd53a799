package pl.faktulove.ocr.taskqueue.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;
import pl.faktulove.ocr.exceptions.OwnershipException;
import pl.faktulove.ocr.exceptions.ResourceNotFoundException;
import pl.faktulove.ocr.security.UserContext;
import pl.faktulove.ocr.taskqueue.model.ProcessingTask;
import pl.faktulove.ocr.taskqueue.repositories.TaskStore;

/**
 * Owner-initiated commands on a task.
 */
@JBossLog
@ApplicationScoped
public class TaskCommandService {

    @Inject
    TaskStore taskStore;

    @Inject
    TaskQueue taskQueue;

    @Inject
    UserContext userContext;

    /**
     * Marks a pending or running task as cancelled. A running worker notices at its next
     * stage boundary and stops without writing a result.
     */
    public ProcessingTask cancel(String taskId, String callerId) {
        ProcessingTask task = taskStore.get(taskId)
                .orElseThrow(() -> new ResourceNotFoundException("Task", taskId));
        String owner = userContext.ownerOf(task.getDocumentId()).orElse(task.getOwnerId());
        if (!owner.equals(callerId)) {
            throw new OwnershipException("Task", taskId);
        }
        log.infof("User %s cancels task %s (state %s)", callerId, taskId, task.getState());
        return taskQueue.cancel(taskId);
    }
}
