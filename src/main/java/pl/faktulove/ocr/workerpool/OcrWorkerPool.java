package pl.faktulove.ocr.workerpool;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;
import pl.faktulove.ocr.config.OcrPipelineConfig;
import pl.faktulove.ocr.statusservice.services.ProcessingStatistics;
import pl.faktulove.ocr.taskqueue.model.enums.ErrorKind;
import pl.faktulove.ocr.taskqueue.services.Lease;
import pl.faktulove.ocr.taskqueue.services.LeaseStatus;
import pl.faktulove.ocr.taskqueue.services.RetryPolicy;
import pl.faktulove.ocr.taskqueue.services.TaskQueue;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed number of worker slots pulling from the shared {@link TaskQueue}.
 *
 * <p>Each attempt runs on its own thread with a hard wall-clock budget. While it runs the
 * lease is refreshed every third of its TTL. An attempt that overruns is interrupted and
 * recorded as a {@link ErrorKind#TIMEOUT}.
 */
@JBossLog
@ApplicationScoped
public class OcrWorkerPool {

    @Inject
    TaskQueue taskQueue;

    @Inject
    OcrDocumentPipeline pipeline;

    @Inject
    RetryPolicy retryPolicy;

    @Inject
    ProcessingStatistics statistics;

    @Inject
    OcrPipelineConfig config;

    private Semaphore slots;
    private ExecutorService supervisorExecutor;
    private ExecutorService attemptExecutor;
    private ScheduledExecutorService heartbeatExecutor;
    private String workerPrefix;
    private final AtomicInteger workerSequence = new AtomicInteger();

    @PostConstruct
    void init() {
        int concurrency = Math.max(1, config.worker().concurrency());
        slots = new Semaphore(concurrency);
        supervisorExecutor = Executors.newFixedThreadPool(concurrency, named("ocr-supervisor"));
        attemptExecutor = Executors.newCachedThreadPool(named("ocr-attempt"));
        heartbeatExecutor = Executors.newSingleThreadScheduledExecutor(named("ocr-heartbeat"));
        workerPrefix = hostName() + "-" + UUID.randomUUID().toString().substring(0, 8);
        log.infof("OcrWorkerPool initialized: worker=%s, slots=%d, attemptTimeout=%s, leaseTtl=%s",
                workerPrefix, concurrency, config.worker().attemptTimeout(), config.queue().leaseTtl());
    }

    @PreDestroy
    void shutdown() {
        supervisorExecutor.shutdownNow();
        attemptExecutor.shutdownNow();
        heartbeatExecutor.shutdownNow();
    }

    /**
     * Leases tasks for all free slots and starts their attempts.
     *
     * @return number of attempts started
     */
    public int dispatch() {
        int started = 0;
        while (slots.tryAcquire()) {
            Optional<Lease> lease;
            try {
                lease = taskQueue.lease(nextWorkerId());
            } catch (RuntimeException e) {
                slots.release();
                log.errorf(e, "Leasing a task failed");
                break;
            }
            if (lease.isEmpty()) {
                slots.release();
                break;
            }
            Lease claimed = lease.get();
            try {
                supervisorExecutor.execute(() -> {
                    try {
                        runAttempt(claimed);
                    } finally {
                        slots.release();
                    }
                });
                started++;
            } catch (RejectedExecutionException e) {
                slots.release();
                log.warnf("Worker pool shutting down, task %s will be reclaimed after its lease expires", claimed.taskId());
                break;
            }
        }
        return started;
    }

    public int freeSlots() {
        return slots.availablePermits();
    }

    public int totalSlots() {
        return Math.max(1, config.worker().concurrency());
    }

    /**
     * Runs one attempt on the calling thread's behalf and records its outcome.
     */
    void runAttempt(Lease lease) {
        log.infof("Worker %s starts task %s (attempt %d)", lease.workerId(), lease.taskId(), lease.attempt());
        Duration timeout = config.worker().attemptTimeout();
        long heartbeatMillis = Math.max(1, config.queue().leaseTtl().toMillis() / 3);
        ScheduledFuture<?> heartbeat = heartbeatExecutor.scheduleAtFixedRate(
                () -> heartbeat(lease), heartbeatMillis, heartbeatMillis, TimeUnit.MILLISECONDS);
        Future<String> attempt = attemptExecutor.submit(() -> pipeline.run(lease));
        try {
            attempt.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            statistics.recordOutcome("completed");
        } catch (TimeoutException e) {
            attempt.cancel(true);
            log.warnf("Task %s attempt %d exceeded %s", lease.taskId(), lease.attempt(), timeout);
            recordFailure(lease, ErrorKind.TIMEOUT, "Processing exceeded the time limit of " + timeout.toSeconds() + "s");
        } catch (ExecutionException e) {
            handleFailure(lease, e.getCause());
        } catch (InterruptedException e) {
            attempt.cancel(true);
            Thread.currentThread().interrupt();
            recordFailure(lease, ErrorKind.INTERNAL, "Worker stopped during processing");
        } finally {
            heartbeat.cancel(false);
        }
    }

    private void handleFailure(Lease lease, Throwable cause) {
        if (cause instanceof AttemptAbortedException aborted) {
            LeaseStatus status = aborted.getLeaseStatus();
            log.infof("Task %s attempt %d stopped: %s", lease.taskId(), lease.attempt(), status);
            statistics.recordOutcome(status == LeaseStatus.CANCELLED ? "cancelled" : "lost");
        } else if (cause instanceof ProcessingFailure failure) {
            recordFailure(lease, failure.getKind(), failure.getMessage());
        } else {
            log.errorf(cause, "Unexpected error processing task %s", lease.taskId());
            recordFailure(lease, ErrorKind.INTERNAL, "Unexpected error: " + cause.getMessage());
        }
    }

    private void recordFailure(Lease lease, ErrorKind kind, String message) {
        LeaseStatus status = taskQueue.fail(lease, kind, message);
        if (!status.isHeld()) {
            log.infof("Failure of task %s not recorded, lease %s", lease.taskId(), status);
            statistics.recordOutcome(status == LeaseStatus.CANCELLED ? "cancelled" : "lost");
            return;
        }
        statistics.recordOutcome(retryPolicy.shouldRetry(kind, lease.attempt()) ? "requeued" : "failed");
    }

    private void heartbeat(Lease lease) {
        try {
            LeaseStatus status = taskQueue.heartbeat(lease);
            if (!status.isHeld()) {
                log.debugf("Heartbeat of task %s: %s", lease.taskId(), status);
            }
        } catch (RuntimeException e) {
            log.warnf(e, "Heartbeat of task %s failed", lease.taskId());
        }
    }

    private String nextWorkerId() {
        return workerPrefix + "-" + workerSequence.incrementAndGet();
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static String hostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            return "ocr-worker";
        }
    }
}
