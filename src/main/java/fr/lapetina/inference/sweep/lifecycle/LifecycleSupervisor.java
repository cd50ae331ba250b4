package fr.lapetina.inference.sweep.lifecycle;

import fr.lapetina.inference.sweep.infrastructure.process.ProcessRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Ties the failure monitor and operator interrupts to one cancellation flag.
 *
 * The JVM shutdown hook (SIGINT, SIGTERM) raises the flag, runs registry cleanup exactly once and
 * then waits, bounded, for the orchestrator to finish its own cleanup and failure report.
 * Repeated interrupts while cleanup is in progress are ignored.
 */
public final class LifecycleSupervisor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LifecycleSupervisor.class);

    private final ProcessRegistry registry;
    private final CancellationFlag cancellationFlag;
    private final ProcessMonitor monitor;
    private final Duration shutdownWait;
    private final AtomicBoolean interruptHandled = new AtomicBoolean(false);
    private final CountDownLatch runFinished = new CountDownLatch(1);

    private volatile Thread shutdownHook;

    public LifecycleSupervisor(
            ProcessRegistry registry,
            CancellationFlag cancellationFlag,
            Duration monitorInterval,
            Duration shutdownWait
    ) {
        this.registry = registry;
        this.cancellationFlag = cancellationFlag;
        this.monitor = new ProcessMonitor(registry, cancellationFlag, monitorInterval);
        this.shutdownWait = shutdownWait;
    }

    /**
     * Starts the monitor and, optionally, registers the JVM shutdown hook.
     */
    public void start(boolean installShutdownHook) {
        monitor.start();
        if (installShutdownHook) {
            Thread hook = new Thread(this::onShutdown, "sweep-shutdown");
            Runtime.getRuntime().addShutdownHook(hook);
            shutdownHook = hook;
            log.debug("Shutdown hook installed: jobId={}", registry.getJobId());
        }
    }

    /**
     * Handles an operator interrupt: raises the flag and stops all processes.
     *
     * @param source what delivered the interrupt, for the log
     * @return true if this call handled it, false if an interrupt was already handled
     */
    public boolean onInterrupt(String source) {
        if (!interruptHandled.compareAndSet(false, true)) {
            log.warn("Interrupt already handled, ignoring: source={}", source);
            return false;
        }
        log.warn("Interrupt received, stopping run: source={}, jobId={}", source, registry.getJobId());
        cancellationFlag.cancel(CancellationReason.OPERATOR_INTERRUPT, "interrupted by " + source);
        registry.cleanup();
        return true;
    }

    private void onShutdown() {
        onInterrupt("shutdown hook");
        try {
            if (!runFinished.await(shutdownWait.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Run did not finish within {} after interrupt", shutdownWait);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Signals that the orchestrator finished, releasing a waiting shutdown hook.
     */
    public void markRunFinished() {
        runFinished.countDown();
    }

    public boolean isInterrupted() {
        return interruptHandled.get();
    }

    public CancellationFlag getCancellationFlag() {
        return cancellationFlag;
    }

    public ProcessMonitor getMonitor() {
        return monitor;
    }

    @Override
    public void close() {
        monitor.close();
        Thread hook = shutdownHook;
        if (hook != null) {
            shutdownHook = null;
            try {
                Runtime.getRuntime().removeShutdownHook(hook);
            } catch (IllegalStateException e) {
                // JVM is already shutting down, the hook is running
                log.debug("Shutdown in progress, hook left in place");
            }
        }
    }
}
