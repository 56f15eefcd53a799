package pl.faktulove.ocr.workerpool;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;
import pl.faktulove.ocr.config.OcrPipelineConfig;

@JBossLog
@ApplicationScoped
public class TaskDispatchJob {

    @Inject
    OcrWorkerPool workerPool;

    @Inject
    OcrPipelineConfig config;

    @Scheduled(every = "${ocr.worker.poll-interval:2s}", concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void dispatch() {
        if (!config.worker().enabled()) {
            return;
        }
        int started = workerPool.dispatch();
        if (started > 0) {
            log.debugf("Dispatched %d task(s), %d slot(s) free", started, workerPool.freeSlots());
        }
    }
}
