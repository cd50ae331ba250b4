package fr.lapetina.inference.sweep.domain.allocation;

import fr.lapetina.inference.sweep.domain.model.Endpoint;
import fr.lapetina.inference.sweep.domain.model.EndpointTopology;
import fr.lapetina.inference.sweep.domain.model.WorkerProcess;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.IntStream;

/**
 * Expands endpoints into one worker process per machine.
 *
 * Each process of an endpoint owns {@code totalGpus / numNodes} local GPUs starting at ordinal 0.
 * System ports are handed out from {@code basePort} upward across the whole job, so they are
 * unique within the job regardless of machine.
 */
public final class ProcessTopologyBuilder {

    public static final int DEFAULT_BASE_PORT = 8081;

    /**
     * Builds the flat process list, in endpoint order and increasing node rank.
     */
    public List<WorkerProcess> build(List<Endpoint> endpoints, int basePort) {
        return buildTopology(endpoints, basePort).stream()
                .flatMap(topology -> topology.processes().stream())
                .toList();
    }

    /**
     * Builds the processes grouped under the endpoint that owns them.
     */
    public List<EndpointTopology> buildTopology(List<Endpoint> endpoints, int basePort) {
        List<EndpointTopology> topology = new ArrayList<>(endpoints.size());
        int portOffset = 0;

        for (Endpoint endpoint : endpoints) {
            List<Integer> gpuIndices = IntStream.range(0, endpoint.gpusPerNode()).boxed().toList();
            List<WorkerProcess> processes = new ArrayList<>(endpoint.numNodes());

            for (int rank = 0; rank < endpoint.numNodes(); rank++) {
                processes.add(new WorkerProcess(
                        endpoint.nodes().get(rank),
                        rank,
                        gpuIndices,
                        endpoint.mode(),
                        endpoint.index(),
                        basePort + portOffset++
                ));
            }
            topology.add(new EndpointTopology(endpoint, processes));
        }
        return topology;
    }
}
