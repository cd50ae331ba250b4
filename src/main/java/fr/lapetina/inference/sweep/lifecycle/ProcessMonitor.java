package fr.lapetina.inference.sweep.lifecycle;

import fr.lapetina.inference.sweep.infrastructure.process.ProcessRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Background failure monitor for managed processes.
 *
 * Periodically polls the registry and raises the cancellation flag as soon as a critical
 * process has failed. Stops polling once the flag is raised.
 */
public final class ProcessMonitor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProcessMonitor.class);

    private final ProcessRegistry registry;
    private final CancellationFlag cancellationFlag;
    private final Duration checkInterval;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public ProcessMonitor(ProcessRegistry registry, CancellationFlag cancellationFlag, Duration checkInterval) {
        this.registry = registry;
        this.cancellationFlag = cancellationFlag;
        this.checkInterval = checkInterval;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "process-monitor");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Starts the periodic polling.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            scheduler.scheduleWithFixedDelay(
                    this::checkProcesses,
                    checkInterval.toMillis(),
                    checkInterval.toMillis(),
                    TimeUnit.MILLISECONDS
            );
            log.info("Process monitor started: jobId={}, interval={}", registry.getJobId(), checkInterval);
        }
    }

    /**
     * Runs one polling cycle.
     */
    public void checkProcesses() {
        if (!running.get() || cancellationFlag.isCancelled()) {
            return;
        }

        try {
            if (registry.checkFailures()) {
                log.error("Critical process failure detected, cancelling run: jobId={}", registry.getJobId());
                cancellationFlag.cancel(CancellationReason.CRITICAL_FAILURE, "critical process failed");
            }
        } catch (Exception e) {
            log.error("Error while polling processes", e);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
            log.info("Process monitor stopped");
        } else {
            scheduler.shutdownNow();
        }
    }
}
