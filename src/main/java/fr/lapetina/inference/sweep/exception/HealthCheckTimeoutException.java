package fr.lapetina.inference.sweep.exception;

import fr.lapetina.inference.sweep.domain.model.ErrorType;

import java.time.Duration;

/**
 * Exception raised when a readiness probe did not succeed within its attempt budget.
 */
public final class HealthCheckTimeoutException extends SweepException {

    private final String target;

    public HealthCheckTimeoutException(String target, int attempts, Duration interval) {
        super(ErrorType.HEALTH_CHECK_TIMEOUT, String.format(
                "%s not ready after %d attempts (interval %s)", target, attempts, interval));
        this.target = target;
    }

    public String getTarget() {
        return target;
    }
}
