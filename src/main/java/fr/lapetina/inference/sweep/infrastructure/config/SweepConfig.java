package fr.lapetina.inference.sweep.infrastructure.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root configuration object for a sweep run.
 * Designed to be populated from YAML.
 */
public class SweepConfig {

    private String name = "sweep";
    private ModelConfig model = new ModelConfig();
    private ResourcesConfig resources = new ResourcesConfig();
    private List<String> nodes = new ArrayList<>();
    private List<String> extraMounts = new ArrayList<>();
    private Map<String, String> environment = new LinkedHashMap<>();
    private String logDirBase = "logs";
    private LauncherConfig launcher = new LauncherConfig();
    private BackendConfig backend = new BackendConfig();
    private InfrastructureConfig infrastructure = new InfrastructureConfig();
    private FrontendConfig frontend = new FrontendConfig();
    private BenchmarkConfig benchmark = new BenchmarkConfig();
    private TimeoutsConfig timeouts = new TimeoutsConfig();
    private MonitorConfig monitor = new MonitorConfig();
    private CleanupConfig cleanup = new CleanupConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public ModelConfig getModel() { return model; }
    public void setModel(ModelConfig model) { this.model = model; }

    public ResourcesConfig getResources() { return resources; }
    public void setResources(ResourcesConfig resources) { this.resources = resources; }

    public List<String> getNodes() { return nodes; }
    public void setNodes(List<String> nodes) { this.nodes = nodes; }

    public List<String> getExtraMounts() { return extraMounts; }
    public void setExtraMounts(List<String> extraMounts) { this.extraMounts = extraMounts; }

    public Map<String, String> getEnvironment() { return environment; }
    public void setEnvironment(Map<String, String> environment) { this.environment = environment; }

    public String getLogDirBase() { return logDirBase; }
    public void setLogDirBase(String logDirBase) { this.logDirBase = logDirBase; }

    public LauncherConfig getLauncher() { return launcher; }
    public void setLauncher(LauncherConfig launcher) { this.launcher = launcher; }

    public BackendConfig getBackend() { return backend; }
    public void setBackend(BackendConfig backend) { this.backend = backend; }

    public InfrastructureConfig getInfrastructure() { return infrastructure; }
    public void setInfrastructure(InfrastructureConfig infrastructure) { this.infrastructure = infrastructure; }

    public FrontendConfig getFrontend() { return frontend; }
    public void setFrontend(FrontendConfig frontend) { this.frontend = frontend; }

    public BenchmarkConfig getBenchmark() { return benchmark; }
    public void setBenchmark(BenchmarkConfig benchmark) { this.benchmark = benchmark; }

    public TimeoutsConfig getTimeouts() { return timeouts; }
    public void setTimeouts(TimeoutsConfig timeouts) { this.timeouts = timeouts; }

    public MonitorConfig getMonitor() { return monitor; }
    public void setMonitor(MonitorConfig monitor) { this.monitor = monitor; }

    public CleanupConfig getCleanup() { return cleanup; }
    public void setCleanup(CleanupConfig cleanup) { this.cleanup = cleanup; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Model and container image.
     */
    public static class ModelConfig {
        private String path;
        private String container;
        private String servedModelName;

        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }

        public String getContainer() { return container; }
        public void setContainer(String container) { this.container = container; }

        public String getServedModelName() { return servedModelName; }
        public void setServedModelName(String servedModelName) { this.servedModelName = servedModelName; }
    }

    /**
     * Worker counts and node budgets per role.
     */
    public static class ResourcesConfig {
        private int gpusPerNode = 8;
        private int prefillNodes = 0;
        private int decodeNodes = 0;
        private int aggNodes = 0;
        private int prefillWorkers = 0;
        private int decodeWorkers = 0;
        private int aggWorkers = 0;
        private boolean benchmarkOnSeparateNode = false;

        public int getGpusPerNode() { return gpusPerNode; }
        public void setGpusPerNode(int gpusPerNode) { this.gpusPerNode = gpusPerNode; }

        public int getPrefillNodes() { return prefillNodes; }
        public void setPrefillNodes(int prefillNodes) { this.prefillNodes = prefillNodes; }

        public int getDecodeNodes() { return decodeNodes; }
        public void setDecodeNodes(int decodeNodes) { this.decodeNodes = decodeNodes; }

        public int getAggNodes() { return aggNodes; }
        public void setAggNodes(int aggNodes) { this.aggNodes = aggNodes; }

        public int getPrefillWorkers() { return prefillWorkers; }
        public void setPrefillWorkers(int prefillWorkers) { this.prefillWorkers = prefillWorkers; }

        public int getDecodeWorkers() { return decodeWorkers; }
        public void setDecodeWorkers(int decodeWorkers) { this.decodeWorkers = decodeWorkers; }

        public int getAggWorkers() { return aggWorkers; }
        public void setAggWorkers(int aggWorkers) { this.aggWorkers = aggWorkers; }

        /** Reserves the first machine for the benchmark client; the head moves to the second one. */
        public boolean isBenchmarkOnSeparateNode() { return benchmarkOnSeparateNode; }
        public void setBenchmarkOnSeparateNode(boolean benchmarkOnSeparateNode) {
            this.benchmarkOnSeparateNode = benchmarkOnSeparateNode;
        }
    }

    /**
     * How processes reach their machines: "srun" on a SLURM allocation, "local" for development.
     */
    public static class LauncherConfig {
        private String type = "srun";

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }
    }

    /**
     * Serving backend and its per-role flags.
     */
    public static class BackendConfig {
        private String type = "sglang";
        private int basePort = 8081;
        private int distInitPort = 29500;
        private Map<String, Object> shared = new LinkedHashMap<>();
        private Map<String, Object> prefill = new LinkedHashMap<>();
        private Map<String, Object> decode = new LinkedHashMap<>();
        private Map<String, Object> aggregated = new LinkedHashMap<>();

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }

        public int getBasePort() { return basePort; }
        public void setBasePort(int basePort) { this.basePort = basePort; }

        public int getDistInitPort() { return distInitPort; }
        public void setDistInitPort(int distInitPort) { this.distInitPort = distInitPort; }

        public Map<String, Object> getShared() { return shared; }
        public void setShared(Map<String, Object> shared) { this.shared = shared; }

        public Map<String, Object> getPrefill() { return prefill; }
        public void setPrefill(Map<String, Object> prefill) { this.prefill = prefill; }

        public Map<String, Object> getDecode() { return decode; }
        public void setDecode(Map<String, Object> decode) { this.decode = decode; }

        public Map<String, Object> getAggregated() { return aggregated; }
        public void setAggregated(Map<String, Object> aggregated) { this.aggregated = aggregated; }
    }

    /**
     * Head node services (NATS and etcd).
     */
    public static class InfrastructureConfig {
        private String setupScript;
        private List<String> command = new ArrayList<>();
        private int natsPort = 4222;
        private int etcdPort = 2379;

        public String getSetupScript() { return setupScript; }
        public void setSetupScript(String setupScript) { this.setupScript = setupScript; }

        public List<String> getCommand() { return command; }
        public void setCommand(List<String> command) { this.command = command; }

        public int getNatsPort() { return natsPort; }
        public void setNatsPort(int natsPort) { this.natsPort = natsPort; }

        public int getEtcdPort() { return etcdPort; }
        public void setEtcdPort(int etcdPort) { this.etcdPort = etcdPort; }
    }

    /**
     * Frontend selection and ports.
     */
    public static class FrontendConfig {
        private boolean useSglangRouter = false;
        private int httpPort = 8000;
        private int serverPort = 30000;
        private int bootstrapPort = 30001;
        private Map<String, Object> dynamoFrontendArgs = new LinkedHashMap<>();
        private Map<String, Object> sglangRouterArgs = new LinkedHashMap<>();

        public boolean isUseSglangRouter() { return useSglangRouter; }
        public void setUseSglangRouter(boolean useSglangRouter) { this.useSglangRouter = useSglangRouter; }

        public int getHttpPort() { return httpPort; }
        public void setHttpPort(int httpPort) { this.httpPort = httpPort; }

        public int getServerPort() { return serverPort; }
        public void setServerPort(int serverPort) { this.serverPort = serverPort; }

        public int getBootstrapPort() { return bootstrapPort; }
        public void setBootstrapPort(int bootstrapPort) { this.bootstrapPort = bootstrapPort; }

        public Map<String, Object> getDynamoFrontendArgs() { return dynamoFrontendArgs; }
        public void setDynamoFrontendArgs(Map<String, Object> args) { this.dynamoFrontendArgs = args; }

        public Map<String, Object> getSglangRouterArgs() { return sglangRouterArgs; }
        public void setSglangRouterArgs(Map<String, Object> args) { this.sglangRouterArgs = args; }
    }

    /**
     * Benchmark stage: "manual" keeps the servers up until interrupted, "command" runs a client.
     */
    public static class BenchmarkConfig {
        private String type = "manual";
        private List<String> command = new ArrayList<>();
        private long pollIntervalMs = 5000;

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }

        public List<String> getCommand() { return command; }
        public void setCommand(List<String> command) { this.command = command; }

        public long getPollIntervalMs() { return pollIntervalMs; }
        public void setPollIntervalMs(long pollIntervalMs) { this.pollIntervalMs = pollIntervalMs; }
    }

    /**
     * Readiness wait bounds.
     */
    public static class TimeoutsConfig {
        private int portWaitAttempts = 60;
        private long portWaitIntervalMs = 1000;
        private int healthWaitAttempts = 60;
        private long healthWaitIntervalMs = 10000;

        public int getPortWaitAttempts() { return portWaitAttempts; }
        public void setPortWaitAttempts(int portWaitAttempts) { this.portWaitAttempts = portWaitAttempts; }

        public long getPortWaitIntervalMs() { return portWaitIntervalMs; }
        public void setPortWaitIntervalMs(long portWaitIntervalMs) { this.portWaitIntervalMs = portWaitIntervalMs; }

        public int getHealthWaitAttempts() { return healthWaitAttempts; }
        public void setHealthWaitAttempts(int healthWaitAttempts) { this.healthWaitAttempts = healthWaitAttempts; }

        public long getHealthWaitIntervalMs() { return healthWaitIntervalMs; }
        public void setHealthWaitIntervalMs(long healthWaitIntervalMs) { this.healthWaitIntervalMs = healthWaitIntervalMs; }
    }

    /**
     * Background failure monitor.
     */
    public static class MonitorConfig {
        private long intervalMs = 2000;

        public long getIntervalMs() { return intervalMs; }
        public void setIntervalMs(long intervalMs) { this.intervalMs = intervalMs; }
    }

    /**
     * Shutdown of managed processes.
     */
    public static class CleanupConfig {
        private long gracePeriodMs = 10000;

        public long getGracePeriodMs() { return gracePeriodMs; }
        public void setGracePeriodMs(long gracePeriodMs) { this.gracePeriodMs = gracePeriodMs; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "sweep";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }
    }
}
