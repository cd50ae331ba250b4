package fr.lapetina.inference.sweep.domain.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * One physical worker process: the slice of an endpoint that runs on a single machine.
 *
 * @param node          machine the process runs on
 * @param nodeRank      position of {@code node} within the endpoint's node list
 * @param gpuIndices    local GPU ordinals owned by the process
 * @param endpointMode  role of the owning endpoint
 * @param endpointIndex index of the owning endpoint
 * @param sysPort       control port, unique within the job
 */
public record WorkerProcess(
        String node,
        int nodeRank,
        List<Integer> gpuIndices,
        WorkerMode endpointMode,
        int endpointIndex,
        int sysPort
) {
    public WorkerProcess {
        Objects.requireNonNull(node, "node is required");
        Objects.requireNonNull(endpointMode, "endpointMode is required");
        gpuIndices = List.copyOf(gpuIndices);
    }

    /**
     * Registry name of the process, e.g. {@code decode_2_gpu-node-07}.
     */
    public String name() {
        return endpointMode.label() + "_" + endpointIndex + "_" + node;
    }

    public String cudaVisibleDevices() {
        return gpuIndices.stream()
                .map(String::valueOf)
                .collect(Collectors.joining(","));
    }

    /**
     * Device mask to export when the process owns only part of its machine.
     *
     * @param gpusPerNode GPUs physically present on the machine
     */
    public Optional<String> deviceMask(int gpusPerNode) {
        if (gpuIndices.size() < gpusPerNode) {
            return Optional.of(cudaVisibleDevices());
        }
        return Optional.empty();
    }
}
