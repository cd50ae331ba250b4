package fr.lapetina.inference.sweep.domain.model;

import fr.lapetina.inference.sweep.exception.ConfigurationException;

/**
 * Validated resource request: how many endpoints of each role and how many GPUs each one needs.
 */
public record ResourceRequest(
        int numPrefill,
        int numDecode,
        int numAgg,
        int gpusPerPrefill,
        int gpusPerDecode,
        int gpusPerAgg,
        int gpusPerNode
) {
    public ResourceRequest {
        if (gpusPerNode <= 0) {
            throw new ConfigurationException("gpusPerNode must be > 0, got " + gpusPerNode);
        }
        if (numPrefill < 0 || numDecode < 0 || numAgg < 0) {
            throw new ConfigurationException(String.format(
                    "Worker counts must be >= 0: prefill=%d, decode=%d, agg=%d", numPrefill, numDecode, numAgg));
        }
    }

    /**
     * Derives GPUs per endpoint from node budgets, i.e. {@code roleNodes * gpusPerNode / roleWorkers}.
     * A role without workers is given a full machine so the value stays meaningful.
     */
    public static ResourceRequest fromNodeBudget(
            int gpusPerNode,
            int prefillNodes, int prefillWorkers,
            int decodeNodes, int decodeWorkers,
            int aggNodes, int aggWorkers
    ) {
        if (gpusPerNode <= 0) {
            throw new ConfigurationException("gpusPerNode must be > 0, got " + gpusPerNode);
        }
        return new ResourceRequest(
                prefillWorkers,
                decodeWorkers,
                aggWorkers,
                gpusPerWorker(WorkerMode.PREFILL, prefillNodes, prefillWorkers, gpusPerNode),
                gpusPerWorker(WorkerMode.DECODE, decodeNodes, decodeWorkers, gpusPerNode),
                gpusPerWorker(WorkerMode.AGG, aggNodes, aggWorkers, gpusPerNode),
                gpusPerNode
        );
    }

    private static int gpusPerWorker(WorkerMode mode, int nodes, int workers, int gpusPerNode) {
        if (workers <= 0) {
            return gpusPerNode;
        }
        long totalGpus = (long) nodes * gpusPerNode;
        if (totalGpus <= 0) {
            throw new ConfigurationException(String.format(
                    "%d %s workers requested but %d %s nodes given", workers, mode, nodes, mode));
        }
        if (totalGpus % workers != 0) {
            throw new ConfigurationException(String.format(
                    "%d %s GPUs (%d nodes x %d) cannot be split evenly across %d workers",
                    totalGpus, mode, nodes, gpusPerNode, workers));
        }
        long perWorker = totalGpus / workers;
        if (perWorker > Integer.MAX_VALUE) {
            throw new ConfigurationException(String.format(
                    "%d %s GPUs per worker (%d nodes x %d / %d) exceeds the supported range",
                    perWorker, mode, nodes, gpusPerNode, workers));
        }
        return (int) perWorker;
    }

    public int count(WorkerMode mode) {
        return switch (mode) {
            case PREFILL -> numPrefill;
            case DECODE -> numDecode;
            case AGG -> numAgg;
        };
    }

    public int gpusPer(WorkerMode mode) {
        return switch (mode) {
            case PREFILL -> gpusPerPrefill;
            case DECODE -> gpusPerDecode;
            case AGG -> gpusPerAgg;
        };
    }

    public int totalWorkers() {
        return numPrefill + numDecode + numAgg;
    }
}
