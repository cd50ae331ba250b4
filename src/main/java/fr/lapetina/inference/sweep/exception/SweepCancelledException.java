package fr.lapetina.inference.sweep.exception;

import fr.lapetina.inference.sweep.domain.model.ErrorType;

/**
 * Exception raised when the operator stops the run while a stage is still in progress.
 */
public final class SweepCancelledException extends SweepException {

    public SweepCancelledException(String message) {
        super(ErrorType.CANCELLED, message);
    }
}
