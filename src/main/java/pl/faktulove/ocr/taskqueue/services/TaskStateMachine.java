package pl.faktulove.ocr.taskqueue.services;

import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.jbosslog.JBossLog;
import pl.faktulove.ocr.exceptions.InvalidTaskStateException;
import pl.faktulove.ocr.taskqueue.model.ProcessingTask;
import pl.faktulove.ocr.taskqueue.model.enums.TaskState;

import java.time.LocalDateTime;

/**
 * State machine for processing task lifecycle transitions.
 *
 * Valid state transitions:
 * PENDING → PROCESSING → COMPLETED
 *    ↘         ↓  ↘
 *  CANCELLED  PENDING  FAILED
 *              (requeue)
 * PROCESSING → CANCELLED
 *
 * Terminal states (no transitions out): COMPLETED, FAILED, CANCELLED
 */
@JBossLog
@ApplicationScoped
public class TaskStateMachine {

    /**
     * Validate if a state transition is allowed.
     *
     * @param from The current state
     * @param to The target state
     * @return true if transition is allowed, false otherwise
     */
    public boolean canTransition(TaskState from, TaskState to) {
        return switch (from) {
            case PENDING -> to == TaskState.PROCESSING || to == TaskState.CANCELLED;
            case PROCESSING -> to == TaskState.PENDING || to == TaskState.COMPLETED
                    || to == TaskState.FAILED || to == TaskState.CANCELLED
                    || to == TaskState.PROCESSING; // re-lease after an expired lease
            case COMPLETED, FAILED, CANCELLED -> false;
        };
    }

    /**
     * Move a task to a new state, without persisting it.
     *
     * @throws InvalidTaskStateException if the transition is not allowed
     */
    public void transition(ProcessingTask task, TaskState newState, LocalDateTime now) {
        TaskState currentState = task.getState();
        if (!canTransition(currentState, newState)) {
            String msg = String.format("Invalid task transition %s → %s for task %s",
                    currentState, newState, task.getId());
            log.warn(msg);
            throw new InvalidTaskStateException(msg);
        }
        task.setState(newState);
        task.setUpdatedAt(now);
        log.debugf("Task %s transitioned: %s → %s", task.getId(), currentState, newState);
    }
}
