package pl.faktulove.ocr.statusservice.services;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import pl.faktulove.ocr.config.OcrPipelineConfig;
import pl.faktulove.ocr.security.UserContext;
import pl.faktulove.ocr.taskqueue.repositories.TaskStore;

/**
 * Wires status services for tests outside this package.
 */
public final class StatusFixtures {

    private StatusFixtures() {
    }

    public static ProcessingStatistics statistics(OcrPipelineConfig config) {
        ProcessingStatistics statistics = new ProcessingStatistics();
        statistics.registry = new SimpleMeterRegistry();
        statistics.config = config;
        return statistics;
    }

    public static EtaEstimator etaEstimator(ProcessingStatistics statistics, OcrPipelineConfig config) {
        EtaEstimator estimator = new EtaEstimator();
        estimator.statistics = statistics;
        estimator.config = config;
        return estimator;
    }

    public static StatusService statusService(TaskStore taskStore, UserContext userContext,
                                              ProcessingStatistics statistics, OcrPipelineConfig config) {
        StatusService service = new StatusService();
        service.taskStore = taskStore;
        service.userContext = userContext;
        service.etaEstimator = etaEstimator(statistics, config);
        service.statistics = statistics;
        service.config = config;
        return service;
    }
}
