package fr.lapetina.inference.sweep.domain.allocation;

import fr.lapetina.inference.sweep.domain.model.Endpoint;
import fr.lapetina.inference.sweep.domain.model.ResourceRequest;
import fr.lapetina.inference.sweep.domain.model.WorkerMode;
import fr.lapetina.inference.sweep.exception.ConfigurationException;
import fr.lapetina.inference.sweep.exception.InsufficientResourcesException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Assigns machines to logical endpoints.
 *
 * Roles are processed in the fixed order prefill, decode, agg. A single cursor walks the
 * machine list left to right; a machine is handed out once and the cursor never wraps.
 * An endpoint that fits on one machine takes a whole machine, a larger one takes
 * {@code gpus / gpusPerNode} consecutive machines with the first as leader.
 *
 * The whole request is validated before any machine is handed out, so a failing request
 * never produces a partial allocation.
 */
public final class EndpointAllocator {

    private static final Logger log = LoggerFactory.getLogger(EndpointAllocator.class);

    private static final List<WorkerMode> ALLOCATION_ORDER =
            List.of(WorkerMode.PREFILL, WorkerMode.DECODE, WorkerMode.AGG);

    public List<Endpoint> allocate(
            int numPrefill,
            int numDecode,
            int numAgg,
            int gpusPerPrefill,
            int gpusPerDecode,
            int gpusPerAgg,
            int gpusPerNode,
            List<String> availableNodes
    ) {
        return allocate(
                new ResourceRequest(numPrefill, numDecode, numAgg,
                        gpusPerPrefill, gpusPerDecode, gpusPerAgg, gpusPerNode),
                availableNodes);
    }

    /**
     * Allocates endpoints for the request.
     *
     * @param request        validated role counts and GPU requirements
     * @param availableNodes ordered candidate machines
     * @return prefill endpoints, then decode, then agg, each in increasing index order
     * @throws ConfigurationException         if a role's GPU requirement cannot be laid out on whole machines
     * @throws InsufficientResourcesException if the request needs more machines than available
     */
    public List<Endpoint> allocate(ResourceRequest request, List<String> availableNodes) {
        long requiredNodes = 0;
        for (WorkerMode mode : ALLOCATION_ORDER) {
            if (request.count(mode) > 0) {
                long roleNodes = (long) request.count(mode)
                        * nodesPerEndpoint(mode, request.gpusPer(mode), request.gpusPerNode());
                requiredNodes = saturatedAdd(requiredNodes, roleNodes);
            }
        }
        if (requiredNodes > availableNodes.size()) {
            throw new InsufficientResourcesException(requiredNodes, availableNodes.size());
        }

        List<Endpoint> endpoints = new ArrayList<>(request.totalWorkers());
        int cursor = 0;

        for (WorkerMode mode : ALLOCATION_ORDER) {
            int count = request.count(mode);
            if (count == 0) {
                continue;
            }
            int gpus = request.gpusPer(mode);
            int span = nodesPerEndpoint(mode, gpus, request.gpusPerNode());

            for (int index = 0; index < count; index++) {
                List<String> nodes = availableNodes.subList(cursor, cursor + span);
                cursor += span;
                Endpoint endpoint = new Endpoint(mode, index, nodes, gpus);
                endpoints.add(endpoint);
                log.debug("Endpoint allocated: endpoint={}, nodes={}, totalGpus={}",
                        endpoint.key(), endpoint.nodes(), gpus);
            }
        }

        log.info("Allocated {} endpoints on {} of {} nodes (prefill={}, decode={}, agg={})",
                endpoints.size(), cursor, availableNodes.size(),
                request.numPrefill(), request.numDecode(), request.numAgg());
        return endpoints;
    }

    private static long saturatedAdd(long a, long b) {
        try {
            return Math.addExact(a, b);
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    static int nodesPerEndpoint(WorkerMode mode, int gpus, int gpusPerNode) {
        if (gpus <= 0) {
            throw new ConfigurationException(String.format(
                    "%s GPU requirement must be > 0, got %d", mode, gpus));
        }
        if (gpus <= gpusPerNode) {
            return 1;
        }
        if (gpus % gpusPerNode != 0) {
            throw new ConfigurationException(String.format(
                    "%s GPU requirement %d is not divisible by per-node GPU count %d", mode, gpus, gpusPerNode));
        }
        return gpus / gpusPerNode;
    }
}
