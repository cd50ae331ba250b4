package fr.lapetina.inference.sweep.infrastructure.config;

import fr.lapetina.inference.sweep.exception.ConfigurationException;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Machine roles for a run.
 *
 * @param head    runs NATS, etcd and the frontend
 * @param bench   runs the benchmark client
 * @param workers worker candidates in allocation order
 */
public record Nodes(String head, String bench, List<String> workers) {

    public Nodes {
        workers = List.copyOf(workers);
    }

    /**
     * Assigns roles from an ordered machine list. Duplicates are dropped, first occurrence wins.
     *
     * @param benchmarkOnSeparateNode reserve the first machine for the benchmark client
     */
    public static Nodes fromNodeList(List<String> nodeList, boolean benchmarkOnSeparateNode) {
        List<String> unique = new ArrayList<>(new LinkedHashSet<>(nodeList));
        if (unique.isEmpty()) {
            throw new ConfigurationException("No nodes available for the run");
        }

        if (benchmarkOnSeparateNode) {
            if (unique.size() < 2) {
                throw new ConfigurationException("A separate benchmark node requires at least 2 nodes");
            }
            return new Nodes(unique.get(1), unique.get(0), unique.subList(1, unique.size()));
        }
        return new Nodes(unique.get(0), unique.get(0), unique);
    }
}
