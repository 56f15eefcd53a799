package pl.faktulove.ocr.support;

import pl.faktulove.ocr.config.OcrPipelineConfig;

import java.time.Duration;
import java.util.List;

/**
 * Settable {@link OcrPipelineConfig} with the production defaults.
 */
public class TestPipelineConfig implements OcrPipelineConfig {

    public long maxSizeBytes = 10 * 1024 * 1024;
    public List<String> allowedMimeTypes = List.of("application/pdf", "image/jpeg", "image/png", "image/tiff");
    public int quotaPerMinute = 10;

    public Duration leaseTtl = Duration.ofSeconds(60);
    public int maxAttempts = 3;
    public Duration backoffInitial = Duration.ofSeconds(60);
    public double backoffMultiplier = 2;
    public Duration backoffMax = Duration.ofHours(1);
    public int claimBatchSize = 100;

    public boolean workerEnabled = true;
    public int concurrency = 4;
    public Duration attemptTimeout = Duration.ofMinutes(5);
    public Duration pollInterval = Duration.ofSeconds(2);

    public double reviewThreshold = 70;
    public double validationBoost = 10;
    public double conflictPenalty = 30;
    public double autoApproveThreshold = 95;

    public long defaultStageSeconds = 5;
    public int failedDocumentDays = 7;

    @Override
    public Upload upload() {
        return new Upload() {
            @Override
            public long maxSizeBytes() {
                return maxSizeBytes;
            }

            @Override
            public List<String> allowedMimeTypes() {
                return allowedMimeTypes;
            }

            @Override
            public int quotaPerMinute() {
                return quotaPerMinute;
            }
        };
    }

    @Override
    public Queue queue() {
        return new Queue() {
            @Override
            public Duration leaseTtl() {
                return leaseTtl;
            }

            @Override
            public int maxAttempts() {
                return maxAttempts;
            }

            @Override
            public Duration backoffInitial() {
                return backoffInitial;
            }

            @Override
            public double backoffMultiplier() {
                return backoffMultiplier;
            }

            @Override
            public Duration backoffMax() {
                return backoffMax;
            }

            @Override
            public int claimBatchSize() {
                return claimBatchSize;
            }
        };
    }

    @Override
    public Worker worker() {
        return new Worker() {
            @Override
            public boolean enabled() {
                return workerEnabled;
            }

            @Override
            public int concurrency() {
                return concurrency;
            }

            @Override
            public Duration attemptTimeout() {
                return attemptTimeout;
            }

            @Override
            public Duration pollInterval() {
                return pollInterval;
            }
        };
    }

    @Override
    public Engine engine() {
        return new Engine() {
            @Override
            public String language() {
                return "pol";
            }

            @Override
            public List<String> preprocessing() {
                return List.of("deskew", "binarize");
            }
        };
    }

    @Override
    public Confidence confidence() {
        return new Confidence() {
            @Override
            public double reviewThreshold() {
                return reviewThreshold;
            }

            @Override
            public double validationBoost() {
                return validationBoost;
            }

            @Override
            public double conflictPenalty() {
                return conflictPenalty;
            }

            @Override
            public double autoApproveThreshold() {
                return autoApproveThreshold;
            }
        };
    }

    @Override
    public Eta eta() {
        return () -> defaultStageSeconds;
    }

    @Override
    public Retention retention() {
        return () -> failedDocumentDays;
    }
}
