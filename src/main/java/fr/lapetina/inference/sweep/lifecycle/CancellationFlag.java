package fr.lapetina.inference.sweep.lifecycle;

import fr.lapetina.inference.sweep.exception.CriticalProcessFailureException;
import fr.lapetina.inference.sweep.exception.SweepCancelledException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Shared, one-shot cancellation signal observed cooperatively by every wait of a run.
 *
 * The first {@link #cancel} wins and its reason is kept. Waiters sleep on the flag itself, so a
 * cancellation wakes them immediately instead of at the end of their poll interval.
 */
public final class CancellationFlag {

    private static final Logger log = LoggerFactory.getLogger(CancellationFlag.class);

    private final AtomicReference<CancellationReason> reason = new AtomicReference<>();
    private final CountDownLatch cancelled = new CountDownLatch(1);
    private volatile String detail;

    /**
     * Raises the flag.
     *
     * @return true if this call raised it, false if it was already raised
     */
    public boolean cancel(CancellationReason reason, String detail) {
        if (this.reason.compareAndSet(null, reason)) {
            this.detail = detail;
            cancelled.countDown();
            log.info("Cancellation requested: reason={}, detail={}", reason, detail);
            return true;
        }
        return false;
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    public Optional<CancellationReason> getReason() {
        return Optional.ofNullable(reason.get());
    }

    public Optional<String> getDetail() {
        return Optional.ofNullable(detail);
    }

    /**
     * Sleeps up to {@code timeout}, returning early when the flag is raised.
     * An interrupt of the calling thread is treated as an operator interrupt.
     *
     * @return true if the flag is raised
     */
    public boolean await(Duration timeout) {
        try {
            return cancelled.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel(CancellationReason.OPERATOR_INTERRUPT, "thread interrupted");
            return true;
        }
    }

    /**
     * Unwinds the caller when the flag is raised.
     *
     * @param activity what the caller was doing, for the exception message
     * @throws CriticalProcessFailureException if the monitor raised the flag
     * @throws SweepCancelledException         for any other reason
     */
    public void throwIfCancelled(String activity) {
        CancellationReason current = reason.get();
        if (current == null) {
            return;
        }
        if (current == CancellationReason.CRITICAL_FAILURE) {
            throw new CriticalProcessFailureException("Critical process failed while " + activity);
        }
        throw new SweepCancelledException("Run cancelled while " + activity + ": " + getDetail().orElse(current.name()));
    }

    @Override
    public String toString() {
        return "CancellationFlag{reason=" + reason.get() + ", detail=" + detail + '}';
    }
}
