package fr.lapetina.inference.sweep.backend;

import fr.lapetina.inference.sweep.domain.allocation.EndpointAllocator;
import fr.lapetina.inference.sweep.domain.allocation.ProcessTopologyBuilder;
import fr.lapetina.inference.sweep.domain.model.Endpoint;
import fr.lapetina.inference.sweep.domain.model.EndpointTopology;
import fr.lapetina.inference.sweep.domain.model.ResourceRequest;
import fr.lapetina.inference.sweep.domain.model.WorkerMode;
import fr.lapetina.inference.sweep.domain.model.WorkerProcess;
import fr.lapetina.inference.sweep.infrastructure.config.RuntimeContext;
import fr.lapetina.inference.sweep.infrastructure.config.SweepConfig;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.UnaryOperator;

/**
 * SGLang workers behind either the Dynamo frontend or the SGLang router.
 *
 * Per-role flags are the {@code shared} section overlaid by the role section and are rendered as
 * sorted kebab-case options: {@code true} becomes a bare flag, {@code false} and null are dropped,
 * a list becomes the flag followed by its items.
 */
public final class SGLangBackend implements Backend {

    public static final String NAME = "sglang";

    private final String servedModelName;
    private final boolean useSglangRouter;
    private final int distInitPort;
    private final SweepConfig.FrontendConfig frontend;
    private final Map<String, Object> sharedConfig;
    private final Map<WorkerMode, Map<String, Object>> modeConfigs;
    private final EndpointAllocator allocator = new EndpointAllocator();
    private final ProcessTopologyBuilder topologyBuilder = new ProcessTopologyBuilder();

    private SGLangBackend(Builder builder) {
        this.servedModelName = builder.servedModelName;
        this.useSglangRouter = builder.frontend.isUseSglangRouter();
        this.distInitPort = builder.distInitPort;
        this.frontend = builder.frontend;
        this.sharedConfig = copy(builder.sharedConfig);
        Map<WorkerMode, Map<String, Object>> configs = new LinkedHashMap<>();
        configs.put(WorkerMode.PREFILL, copy(builder.prefillConfig));
        configs.put(WorkerMode.DECODE, copy(builder.decodeConfig));
        configs.put(WorkerMode.AGG, copy(builder.aggConfig));
        this.modeConfigs = Collections.unmodifiableMap(configs);
    }

    /**
     * Creates the backend from the {@code model}, {@code backend} and {@code frontend} sections.
     */
    public static SGLangBackend fromConfig(SweepConfig config) {
        SweepConfig.BackendConfig backend = config.getBackend();
        return builder()
                .servedModelName(servedModelName(config.getModel()))
                .distInitPort(backend.getDistInitPort())
                .frontend(config.getFrontend())
                .sharedConfig(backend.getShared())
                .prefillConfig(backend.getPrefill())
                .decodeConfig(backend.getDecode())
                .aggConfig(backend.getAggregated())
                .build();
    }

    static String servedModelName(SweepConfig.ModelConfig model) {
        if (model.getServedModelName() != null && !model.getServedModelName().isBlank()) {
            return model.getServedModelName();
        }
        Path fileName = Paths.get(model.getPath()).getFileName();
        return fileName == null ? model.getPath() : fileName.toString();
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public String getServedModelName() {
        return servedModelName;
    }

    public boolean isUseSglangRouter() {
        return useSglangRouter;
    }

    @Override
    public List<Endpoint> allocateEndpoints(ResourceRequest request, List<String> availableNodes) {
        return allocator.allocate(request, availableNodes);
    }

    @Override
    public List<EndpointTopology> buildTopology(List<Endpoint> endpoints, int basePort) {
        return topologyBuilder.buildTopology(endpoints, basePort);
    }

    /**
     * Shared flags overlaid by the flags of {@code mode}.
     */
    public Map<String, Object> configFor(WorkerMode mode) {
        Map<String, Object> merged = new LinkedHashMap<>(sharedConfig);
        merged.putAll(modeConfigs.get(mode));
        return merged;
    }

    @Override
    public List<String> buildWorkerCommand(
            WorkerProcess process,
            EndpointTopology topology,
            RuntimeContext runtime,
            String leaderIp,
            Path dumpConfigPath
    ) {
        WorkerMode mode = process.endpointMode();
        Endpoint endpoint = topology.endpoint();

        List<String> command = new ArrayList<>();
        command.add("python3");
        command.add("-m");
        command.add(useSglangRouter ? "sglang.launch_server" : "dynamo.sglang");
        command.add("--model-path");
        command.add(runtime.modelPath().toString());
        command.add("--served-model-name");
        command.add(servedModelName);
        command.add("--host");
        command.add("0.0.0.0");

        if (mode != WorkerMode.AGG && !useSglangRouter) {
            command.add("--disaggregation-mode");
            command.add(mode.label());
        }

        if (endpoint.isMultiNode()) {
            command.add("--dist-init-addr");
            command.add(leaderIp + ":" + distInitPort);
            command.add("--nnodes");
            command.add(String.valueOf(endpoint.numNodes()));
            command.add("--node-rank");
            command.add(String.valueOf(process.nodeRank()));
        }

        if (dumpConfigPath != null && !useSglangRouter) {
            command.add("--dump-config-to");
            command.add(dumpConfigPath.toString());
        }

        command.addAll(toCliArgs(configFor(mode)));
        return command;
    }

    @Override
    public FrontendLaunch buildFrontend(List<Endpoint> endpoints, UnaryOperator<String> ipOf) {
        if (useSglangRouter) {
            return new FrontendLaunch("sglang_router", "router", buildRouterCommand(endpoints, ipOf));
        }
        return new FrontendLaunch("frontend", "frontend", buildDynamoFrontendCommand());
    }

    List<String> buildDynamoFrontendCommand() {
        List<String> command = new ArrayList<>(List.of(
                "python3", "-m", "dynamo.frontend", "--http-port=" + frontend.getHttpPort()));
        command.addAll(toExtraArgs(frontend.getDynamoFrontendArgs()));
        return command;
    }

    List<String> buildRouterCommand(List<Endpoint> endpoints, UnaryOperator<String> ipOf) {
        List<String> command = new ArrayList<>(List.of(
                "python", "-m", "sglang_router.launch_router", "--pd-disaggregation"));

        for (Endpoint endpoint : endpoints) {
            if (endpoint.mode() == WorkerMode.PREFILL) {
                command.add("--prefill");
                command.add("http://" + ipOf.apply(endpoint.leaderNode()) + ":" + frontend.getServerPort());
                command.add(String.valueOf(frontend.getBootstrapPort()));
            }
        }
        for (Endpoint endpoint : endpoints) {
            if (endpoint.mode() == WorkerMode.DECODE) {
                command.add("--decode");
                command.add("http://" + ipOf.apply(endpoint.leaderNode()) + ":" + frontend.getServerPort());
            }
        }

        command.add("--host");
        command.add("0.0.0.0");
        command.add("--port");
        command.add(String.valueOf(frontend.getHttpPort()));
        command.addAll(toExtraArgs(frontend.getSglangRouterArgs()));
        return command;
    }

    /**
     * Renders worker flags, sorted by key, snake_case keys turned into kebab-case options.
     */
    static List<String> toCliArgs(Map<String, Object> config) {
        List<String> args = new ArrayList<>();
        for (Map.Entry<String, Object> entry : new TreeMap<>(config).entrySet()) {
            String flag = "--" + entry.getKey().replace('_', '-');
            Object value = entry.getValue();

            if (value instanceof Boolean enabled) {
                if (enabled) {
                    args.add(flag);
                }
            } else if (value instanceof Collection<?> items) {
                args.add(flag);
                items.forEach(item -> args.add(String.valueOf(item)));
            } else if (value != null) {
                args.add(flag);
                args.add(String.valueOf(value));
            }
        }
        return args;
    }

    /**
     * Renders frontend pass-through options in declaration order, keys used verbatim.
     */
    static List<String> toExtraArgs(Map<String, Object> extra) {
        List<String> args = new ArrayList<>();
        if (extra == null) {
            return args;
        }
        extra.forEach((key, value) -> {
            if (Boolean.TRUE.equals(value)) {
                args.add("--" + key);
            } else if (value != null && !Boolean.FALSE.equals(value)) {
                args.add("--" + key);
                args.add(String.valueOf(value));
            }
        });
        return args;
    }

    private static Map<String, Object> copy(Map<String, Object> source) {
        return source == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String servedModelName;
        private int distInitPort = 29500;
        private SweepConfig.FrontendConfig frontend = new SweepConfig.FrontendConfig();
        private Map<String, Object> sharedConfig = Map.of();
        private Map<String, Object> prefillConfig = Map.of();
        private Map<String, Object> decodeConfig = Map.of();
        private Map<String, Object> aggConfig = Map.of();

        public Builder servedModelName(String servedModelName) {
            this.servedModelName = servedModelName;
            return this;
        }

        public Builder distInitPort(int distInitPort) {
            this.distInitPort = distInitPort;
            return this;
        }

        public Builder frontend(SweepConfig.FrontendConfig frontend) {
            this.frontend = frontend;
            return this;
        }

        public Builder sharedConfig(Map<String, Object> sharedConfig) {
            this.sharedConfig = sharedConfig;
            return this;
        }

        public Builder prefillConfig(Map<String, Object> prefillConfig) {
            this.prefillConfig = prefillConfig;
            return this;
        }

        public Builder decodeConfig(Map<String, Object> decodeConfig) {
            this.decodeConfig = decodeConfig;
            return this;
        }

        public Builder aggConfig(Map<String, Object> aggConfig) {
            this.aggConfig = aggConfig;
            return this;
        }

        public SGLangBackend build() {
            if (servedModelName == null || servedModelName.isBlank()) {
                throw new IllegalStateException("servedModelName is required");
            }
            return new SGLangBackend(this);
        }
    }
}
