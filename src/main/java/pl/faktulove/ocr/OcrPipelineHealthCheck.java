package pl.faktulove.ocr;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.Readiness;
import pl.faktulove.ocr.taskqueue.services.TaskQueue;
import pl.faktulove.ocr.workerpool.OcrWorkerPool;

@Readiness
@ApplicationScoped
public class OcrPipelineHealthCheck implements HealthCheck {

    @Inject
    TaskQueue taskQueue;

    @Inject
    OcrWorkerPool workerPool;

    @Override
    public HealthCheckResponse call() {
        try {
            return HealthCheckResponse.named("ocr-pipeline")
                    .up()
                    .withData("queueDepth", taskQueue.queueDepth())
                    .withData("freeWorkerSlots", workerPool.freeSlots())
                    .withData("workerSlots", workerPool.totalSlots())
                    .build();
        } catch (RuntimeException e) {
            return HealthCheckResponse.named("ocr-pipeline")
                    .down()
                    .withData("error", String.valueOf(e.getMessage()))
                    .build();
        }
    }
}
