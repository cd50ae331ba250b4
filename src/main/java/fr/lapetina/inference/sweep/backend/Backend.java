package fr.lapetina.inference.sweep.backend;

import fr.lapetina.inference.sweep.domain.model.Endpoint;
import fr.lapetina.inference.sweep.domain.model.EndpointTopology;
import fr.lapetina.inference.sweep.domain.model.ResourceRequest;
import fr.lapetina.inference.sweep.domain.model.WorkerProcess;
import fr.lapetina.inference.sweep.infrastructure.config.RuntimeContext;

import java.nio.file.Path;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * A serving engine: how its workers are placed and how each one is started.
 *
 * Implementations must be stateless and thread-safe.
 */
public interface Backend {

    /**
     * Returns the backend name as used in configuration.
     */
    String getName();

    String getServedModelName();

    List<Endpoint> allocateEndpoints(ResourceRequest request, List<String> availableNodes);

    List<EndpointTopology> buildTopology(List<Endpoint> endpoints, int basePort);

    /**
     * Builds the command line of one worker process.
     *
     * @param process        the process to start
     * @param topology       the endpoint owning the process
     * @param runtime        run context
     * @param leaderIp       address of the endpoint's leader machine
     * @param dumpConfigPath where the worker writes its resolved config, or null
     */
    List<String> buildWorkerCommand(
            WorkerProcess process,
            EndpointTopology topology,
            RuntimeContext runtime,
            String leaderIp,
            Path dumpConfigPath
    );

    /**
     * Describes the frontend that routes requests to the allocated endpoints.
     *
     * @param endpoints all allocated endpoints
     * @param ipOf      resolves a machine name to its address
     */
    FrontendLaunch buildFrontend(List<Endpoint> endpoints, UnaryOperator<String> ipOf);
}
