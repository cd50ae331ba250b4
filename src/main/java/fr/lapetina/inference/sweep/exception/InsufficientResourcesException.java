package fr.lapetina.inference.sweep.exception;

import fr.lapetina.inference.sweep.domain.model.ErrorType;

/**
 * Exception thrown when the requested endpoints need more machines than are available.
 */
public final class InsufficientResourcesException extends SweepException {

    private final long requiredNodes;
    private final int availableNodes;

    public InsufficientResourcesException(long requiredNodes, int availableNodes) {
        super(ErrorType.INSUFFICIENT_RESOURCES, String.format(
                "Insufficient nodes: %d required, %d available", requiredNodes, availableNodes));
        this.requiredNodes = requiredNodes;
        this.availableNodes = availableNodes;
    }

    public long getRequiredNodes() {
        return requiredNodes;
    }

    public int getAvailableNodes() {
        return availableNodes;
    }
}
