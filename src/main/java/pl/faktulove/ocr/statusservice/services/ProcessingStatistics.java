package pl.faktulove.ocr.statusservice.services;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import pl.faktulove.ocr.config.OcrPipelineConfig;
import pl.faktulove.ocr.taskqueue.model.enums.ProcessingStage;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Historical processing durations, kept as Micrometer timers. Workers record how long each
 * stage and each successful attempt took; ETAs are derived from the means. Until a timer
 * has samples the configured default stage duration is assumed.
 */
@ApplicationScoped
public class ProcessingStatistics {

    static final String STAGE_TIMER = "ocr.stage.duration";
    static final String TASK_TIMER = "ocr.task.duration";
    static final String OUTCOME_COUNTER = "ocr.task.outcome";

    @Inject
    MeterRegistry registry;

    @Inject
    OcrPipelineConfig config;

    public void recordStage(ProcessingStage stage, Duration duration) {
        stageTimer(stage).record(duration);
    }

    public void recordTask(Duration duration) {
        registry.timer(TASK_TIMER).record(duration);
    }

    /**
     * @param outcome completed, requeued, failed, cancelled, lost
     */
    public void recordOutcome(String outcome) {
        registry.counter(OUTCOME_COUNTER, "outcome", outcome).increment();
    }

    public double meanStageSeconds(ProcessingStage stage) {
        Timer timer = stageTimer(stage);
        if (timer.count() == 0) {
            return config.eta().defaultStageSeconds();
        }
        return timer.mean(TimeUnit.MILLISECONDS) / 1000.0;
    }

    public double meanTaskSeconds() {
        Timer timer = registry.timer(TASK_TIMER);
        if (timer.count() == 0) {
            return (double) config.eta().defaultStageSeconds() * ProcessingStage.values().length;
        }
        return timer.mean(TimeUnit.MILLISECONDS) / 1000.0;
    }

    private Timer stageTimer(ProcessingStage stage) {
        return registry.timer(STAGE_TIMER, "stage", stage.name().toLowerCase());
    }
}
