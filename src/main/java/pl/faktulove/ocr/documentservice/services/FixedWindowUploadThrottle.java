package pl.faktulove.ocr.documentservice.services;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import pl.faktulove.ocr.config.OcrPipelineConfig;

import java.time.Clock;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Counts uploads per owner in fixed one-minute windows. The counter is replaced when a
 * new window starts; all updates go through {@link ConcurrentMap#compute}.
 *
 * <p>Counters live in this JVM. Behind a load balancer with several gateway instances
 * each instance enforces the quota on its own, so an owner can reach the limit once per
 * instance.
 */
@ApplicationScoped
public class FixedWindowUploadThrottle implements UploadThrottle {

    static final long WINDOW_MILLIS = 60_000;

    @Inject
    OcrPipelineConfig config;

    @Inject
    Clock clock;

    private final ConcurrentMap<String, Window> windows = new ConcurrentHashMap<>();

    @Override
    public ThrottleDecision tryAcquire(String ownerId) {
        long now = clock.millis();
        long windowStart = now - now % WINDOW_MILLIS;
        int limit = config.upload().quotaPerMinute();
        boolean[] acquired = new boolean[1];

        windows.compute(ownerId, (owner, window) -> {
            Window current = window == null || window.start() != windowStart ? new Window(windowStart, 0) : window;
            if (current.count() < limit) {
                acquired[0] = true;
                return new Window(windowStart, current.count() + 1);
            }
            return current;
        });

        if (acquired[0]) {
            return ThrottleDecision.allow();
        }
        long remainingMillis = windowStart + WINDOW_MILLIS - now;
        return ThrottleDecision.deny((remainingMillis + 999) / 1000);
    }

    @Override
    public void release(String ownerId) {
        long now = clock.millis();
        long windowStart = now - now % WINDOW_MILLIS;
        windows.computeIfPresent(ownerId, (owner, window) ->
                window.start() == windowStart && window.count() > 0
                        ? new Window(windowStart, window.count() - 1)
                        : window);
    }

    /**
     * Drops counters of windows that have closed.
     */
    @Scheduled(every = "5m", concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void evictExpired() {
        long now = clock.millis();
        long windowStart = now - now % WINDOW_MILLIS;
        windows.values().removeIf(window -> window.start() < windowStart);
    }

    private record Window(long start, int count) {
    }
}
