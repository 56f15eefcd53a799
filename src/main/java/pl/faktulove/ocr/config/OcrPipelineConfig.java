package pl.faktulove.ocr.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.time.Duration;
import java.util.List;

/**
 * Configuration for the OCR intake pipeline.
 *
 * <p>Example configuration in application.properties:
 * <pre>
 * ocr.upload.max-size-bytes=10485760
 * ocr.queue.lease-ttl=60s
 * ocr.queue.max-attempts=3
 * ocr.worker.concurrency=4
 * ocr.confidence.review-threshold=70
 * </pre>
 */
@ConfigMapping(prefix = "ocr")
public interface OcrPipelineConfig {

    Upload upload();

    Queue queue();

    Worker worker();

    Engine engine();

    Confidence confidence();

    Eta eta();

    Retention retention();

    interface Upload {

        /**
         * Largest accepted document. Default: 10 MB
         */
        @WithDefault("10485760")
        long maxSizeBytes();

        @WithDefault("application/pdf,image/jpeg,image/png,image/tiff")
        List<String> allowedMimeTypes();

        /**
         * Uploads admitted per owner in one minute.
         */
        @WithDefault("10")
        int quotaPerMinute();
    }

    interface Queue {

        @WithDefault("60s")
        Duration leaseTtl();

        /**
         * Attempts a task gets before it ends FAILED. The attempt that
         * reaches this number is the last one.
         */
        @WithDefault("3")
        int maxAttempts();

        @WithDefault("60s")
        Duration backoffInitial();

        @WithDefault("2")
        double backoffMultiplier();

        @WithDefault("1h")
        Duration backoffMax();

        /**
         * Candidate tasks read per lease attempt; fairness is applied within this window.
         */
        @WithDefault("100")
        int claimBatchSize();
    }

    interface Worker {

        @WithDefault("true")
        boolean enabled();

        @WithDefault("4")
        int concurrency();

        /**
         * Hard wall-clock budget of a single attempt.
         */
        @WithDefault("5m")
        Duration attemptTimeout();

        @WithDefault("2s")
        Duration pollInterval();
    }

    interface Engine {

        /**
         * Recognition language passed to the OCR server.
         */
        @WithDefault("pol")
        String language();

        @WithDefault("deskew,binarize")
        List<String> preprocessing();
    }

    interface Confidence {

        /**
         * Aggregate confidence below this flags the result for review.
         */
        @WithDefault("70")
        double reviewThreshold();

        @WithDefault("10")
        double validationBoost();

        @WithDefault("30")
        double conflictPenalty();

        @WithDefault("95")
        double autoApproveThreshold();
    }

    interface Eta {

        /**
         * Assumed duration of a stage before any history is recorded.
         */
        @WithDefault("5")
        long defaultStageSeconds();
    }

    interface Retention {

        @WithDefault("7")
        int failedDocumentDays();
    }
}
