package fr.lapetina.inference.sweep.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * One logical serving unit of a role, possibly spanning several machines.
 *
 * @param mode      serving role
 * @param index     0-based index, unique within the role
 * @param nodes     machines in rank order; the first one is the leader
 * @param totalGpus GPUs owned by the whole endpoint
 */
public record Endpoint(
        WorkerMode mode,
        int index,
        List<String> nodes,
        int totalGpus
) {
    public Endpoint {
        Objects.requireNonNull(mode, "mode is required");
        Objects.requireNonNull(nodes, "nodes are required");
        if (nodes.isEmpty()) {
            throw new IllegalArgumentException("An endpoint needs at least one node");
        }
        if (index < 0) {
            throw new IllegalArgumentException("index must be >= 0: " + index);
        }
        if (totalGpus <= 0) {
            throw new IllegalArgumentException("totalGpus must be > 0: " + totalGpus);
        }
        nodes = List.copyOf(nodes);
    }

    public int numNodes() {
        return nodes.size();
    }

    public String leaderNode() {
        return nodes.get(0);
    }

    public int gpusPerNode() {
        return totalGpus / nodes.size();
    }

    public boolean isMultiNode() {
        return nodes.size() > 1;
    }

    /**
     * Short identifier such as {@code prefill_0}.
     */
    public String key() {
        return mode.label() + "_" + index;
    }
}
