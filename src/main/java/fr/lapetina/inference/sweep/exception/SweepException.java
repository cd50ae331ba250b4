package fr.lapetina.inference.sweep.exception;

import fr.lapetina.inference.sweep.domain.model.ErrorType;

/**
 * Base class for every failure a sweep run can report.
 */
public class SweepException extends RuntimeException {

    private final ErrorType errorType;

    public SweepException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public SweepException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }
}
