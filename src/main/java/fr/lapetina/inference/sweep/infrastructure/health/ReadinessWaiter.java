package fr.lapetina.inference.sweep.infrastructure.health;

import fr.lapetina.inference.sweep.exception.CriticalProcessFailureException;
import fr.lapetina.inference.sweep.exception.HealthCheckTimeoutException;
import fr.lapetina.inference.sweep.exception.SweepCancelledException;
import fr.lapetina.inference.sweep.lifecycle.CancellationFlag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.BooleanSupplier;

/**
 * Bounded readiness polling: at most {@code attempts} checks, {@code interval} apart.
 *
 * The cancellation flag is checked before every attempt and the pause between attempts sleeps on
 * the flag, so a cancellation ends the wait within one check instead of at the timeout bound.
 */
public final class ReadinessWaiter {

    private static final Logger log = LoggerFactory.getLogger(ReadinessWaiter.class);

    private final ReadinessProbe probe;
    private final CancellationFlag cancellationFlag;

    public ReadinessWaiter(ReadinessProbe probe, CancellationFlag cancellationFlag) {
        this.probe = probe;
        this.cancellationFlag = cancellationFlag;
    }

    public void awaitPort(String host, int port, int attempts, Duration interval) {
        String target = host + ":" + port;
        log.info("Waiting for port: target={}, attempts={}, interval={}", target, attempts, interval);
        await(target, () -> probe.isPortOpen(host, port), attempts, interval);
        log.info("Port is open: target={}", target);
    }

    public void awaitHealthy(String host, int port, int expectedWorkers, int attempts, Duration interval) {
        String target = "http://" + host + ":" + port + "/health";
        log.info("Waiting for health: target={}, expectedWorkers={}, attempts={}, interval={}",
                target, expectedWorkers, attempts, interval);
        await(target, () -> probe.isHealthy(host, port, expectedWorkers), attempts, interval);
        log.info("Service is healthy: target={}", target);
    }

    /**
     * Polls {@code check} until it passes.
     *
     * @throws HealthCheckTimeoutException     if every attempt failed
     * @throws CriticalProcessFailureException if the monitor cancelled the run meanwhile
     * @throws SweepCancelledException         if the operator interrupted the run meanwhile
     */
    public void await(String target, BooleanSupplier check, int attempts, Duration interval) {
        for (int attempt = 1; attempt <= attempts; attempt++) {
            throwIfCancelled(target);
            if (check.getAsBoolean()) {
                log.debug("Ready: target={}, attempt={}", target, attempt);
                return;
            }
            if (attempt < attempts && cancellationFlag.await(interval)) {
                throwIfCancelled(target);
            }
        }
        throw new HealthCheckTimeoutException(target, attempts, interval);
    }

    private void throwIfCancelled(String target) {
        if (cancellationFlag.isCancelled()) {
            log.warn("Stopped waiting: target={}, reason={}", target, cancellationFlag.getReason().orElse(null));
            cancellationFlag.throwIfCancelled("waiting for " + target);
        }
    }
}
