package fr.lapetina.inference.sweep.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * An endpoint together with the processes it owns, in node-rank order.
 */
public record EndpointTopology(Endpoint endpoint, List<WorkerProcess> processes) {

    public EndpointTopology {
        Objects.requireNonNull(endpoint, "endpoint is required");
        processes = List.copyOf(processes);
        if (processes.size() != endpoint.numNodes()) {
            throw new IllegalArgumentException("Endpoint " + endpoint.key() + " spans "
                    + endpoint.numNodes() + " nodes but owns " + processes.size() + " processes");
        }
    }

    public WorkerProcess leader() {
        return processes.get(0);
    }
}
