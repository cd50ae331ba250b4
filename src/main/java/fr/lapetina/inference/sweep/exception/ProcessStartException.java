package fr.lapetina.inference.sweep.exception;

import fr.lapetina.inference.sweep.domain.model.ErrorType;

/**
 * Exception thrown when a process could not be started on its machine.
 */
public final class ProcessStartException extends SweepException {

    private final String node;

    public ProcessStartException(String node, String message, Throwable cause) {
        super(ErrorType.PROCESS_START, "Failed to start process on " + node + ": " + message, cause);
        this.node = node;
    }

    public String getNode() {
        return node;
    }
}
