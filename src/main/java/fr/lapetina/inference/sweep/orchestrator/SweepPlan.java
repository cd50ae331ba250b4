package fr.lapetina.inference.sweep.orchestrator;

import fr.lapetina.inference.sweep.domain.model.Endpoint;
import fr.lapetina.inference.sweep.domain.model.EndpointTopology;
import fr.lapetina.inference.sweep.domain.model.ResourceRequest;
import fr.lapetina.inference.sweep.domain.model.WorkerProcess;

import java.util.List;

/**
 * Endpoints and worker processes of a run, computed before anything is launched.
 */
public record SweepPlan(ResourceRequest request, List<EndpointTopology> topology) {

    public SweepPlan {
        topology = List.copyOf(topology);
    }

    public List<Endpoint> endpoints() {
        return topology.stream().map(EndpointTopology::endpoint).toList();
    }

    public List<WorkerProcess> processes() {
        return topology.stream()
                .flatMap(t -> t.processes().stream())
                .toList();
    }
}
