package pl.faktulove.ocr.workerpool;

import pl.faktulove.ocr.taskqueue.services.LeaseStatus;

/**
 * The attempt stopped at a stage boundary because the task was cancelled or the lease
 * is no longer held. Nothing more may be written for the task.
 */
public class AttemptAbortedException extends Exception {

    private final LeaseStatus leaseStatus;

    public AttemptAbortedException(String taskId, LeaseStatus leaseStatus) {
        super("Attempt on task " + taskId + " aborted: " + leaseStatus);
        this.leaseStatus = leaseStatus;
    }

    public LeaseStatus getLeaseStatus() {
        return leaseStatus;
    }
}
