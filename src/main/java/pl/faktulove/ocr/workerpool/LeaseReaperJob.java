package pl.faktulove.ocr.workerpool;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;
import pl.faktulove.ocr.taskqueue.services.TaskQueue;

/**
 * Returns tasks of crashed workers to the queue once their lease has expired.
 */
@JBossLog
@ApplicationScoped
public class LeaseReaperJob {

    @Inject
    TaskQueue taskQueue;

    @Scheduled(every = "${ocr.queue.lease-ttl:60s}", delayed = "30s", concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void reap() {
        int reclaimed = taskQueue.reapExpiredLeases();
        if (reclaimed > 0) {
            log.infof("Reclaimed %d task(s) with expired leases", reclaimed);
        }
    }
}
