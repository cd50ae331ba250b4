package fr.lapetina.inference.sweep.exception;

import fr.lapetina.inference.sweep.domain.model.ErrorType;

/**
 * Exception raised when a critical process terminated while the run depended on it.
 */
public final class CriticalProcessFailureException extends SweepException {

    public CriticalProcessFailureException(String message) {
        super(ErrorType.CRITICAL_PROCESS_FAILURE, message);
    }
}
