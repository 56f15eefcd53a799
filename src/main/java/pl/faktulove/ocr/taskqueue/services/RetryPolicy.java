package pl.faktulove.ocr.taskqueue.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import pl.faktulove.ocr.config.OcrPipelineConfig;
import pl.faktulove.ocr.taskqueue.model.enums.ErrorKind;

import java.time.Duration;

/**
 * Exponential backoff with a cap on the number of attempts.
 */
@ApplicationScoped
public class RetryPolicy {

    @Inject
    OcrPipelineConfig config;

    /**
     * Whether a task that just failed its {@code attemptCount}-th attempt with the given
     * kind goes back to the queue.
     */
    public boolean shouldRetry(ErrorKind kind, int attemptCount) {
        return kind.isTransient() && attemptCount < config.queue().maxAttempts();
    }

    /**
     * Delay before the next attempt: initial × multiplier^(attempt-1), capped.
     */
    public Duration backoffFor(int attemptCount) {
        OcrPipelineConfig.Queue queue = config.queue();
        double factor = Math.pow(queue.backoffMultiplier(), Math.max(0, attemptCount - 1));
        double millis = queue.backoffInitial().toMillis() * factor;
        long maxMillis = queue.backoffMax().toMillis();
        if (Double.isInfinite(millis) || millis >= maxMillis) {
            return queue.backoffMax();
        }
        return Duration.ofMillis((long) millis);
    }

    public int maxAttempts() {
        return config.queue().maxAttempts();
    }
}
