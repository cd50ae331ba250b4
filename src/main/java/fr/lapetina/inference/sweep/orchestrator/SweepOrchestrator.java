package fr.lapetina.inference.sweep.orchestrator;

import fr.lapetina.inference.sweep.backend.Backend;
import fr.lapetina.inference.sweep.backend.FrontendLaunch;
import fr.lapetina.inference.sweep.domain.model.EndpointTopology;
import fr.lapetina.inference.sweep.domain.model.ProcessState;
import fr.lapetina.inference.sweep.domain.model.ProcessStatus;
import fr.lapetina.inference.sweep.domain.model.ResourceRequest;
import fr.lapetina.inference.sweep.domain.model.WorkerProcess;
import fr.lapetina.inference.sweep.exception.SweepException;
import fr.lapetina.inference.sweep.infrastructure.config.ConfigLoader;
import fr.lapetina.inference.sweep.infrastructure.config.HostResolver;
import fr.lapetina.inference.sweep.infrastructure.config.RuntimeContext;
import fr.lapetina.inference.sweep.infrastructure.config.SweepConfig;
import fr.lapetina.inference.sweep.infrastructure.health.ReadinessProbe;
import fr.lapetina.inference.sweep.infrastructure.health.ReadinessWaiter;
import fr.lapetina.inference.sweep.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.inference.sweep.infrastructure.process.LaunchSpec;
import fr.lapetina.inference.sweep.infrastructure.process.ManagedProcess;
import fr.lapetina.inference.sweep.infrastructure.process.ProcessRegistry;
import fr.lapetina.inference.sweep.infrastructure.process.RemoteProcessHandle;
import fr.lapetina.inference.sweep.infrastructure.process.RemoteProcessLauncher;
import fr.lapetina.inference.sweep.lifecycle.CancellationFlag;
import fr.lapetina.inference.sweep.lifecycle.CancellationReason;
import fr.lapetina.inference.sweep.lifecycle.LifecycleSupervisor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs one sweep: head infrastructure, workers, frontend, benchmark, cleanup.
 *
 * Stages run sequentially on the calling thread. Every launched process is registered as soon as
 * it starts, so the background monitor and cleanup always see it. Cleanup runs exactly once,
 * whichever path leaves the stages.
 */
public final class SweepOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(SweepOrchestrator.class);

    static final String HEAD_INFRASTRUCTURE_NAME = "head_infrastructure";
    static final String BENCHMARK_NAME = "benchmark";
    static final Path SETUP_SCRIPT_CONTAINER_PATH = Paths.get("/tmp/setup_head.py");
    static final String METRICS_FILE = "metrics.prom";

    private static final Duration SHUTDOWN_WAIT_MARGIN = Duration.ofSeconds(30);

    private final SweepConfig config;
    private final RuntimeContext runtime;
    private final Backend backend;
    private final RemoteProcessLauncher launcher;
    private final HostResolver hostResolver;
    private final MetricsRegistry metrics;
    private final boolean installShutdownHook;

    private final CancellationFlag cancellationFlag;
    private final ProcessRegistry registry;
    private final LifecycleSupervisor supervisor;
    private final ReadinessWaiter waiter;

    private final AtomicReference<SweepStage> stage = new AtomicReference<>(SweepStage.INIT);
    private final AtomicBoolean started = new AtomicBoolean(false);
    private SweepPlan plan;

    private SweepOrchestrator(Builder builder) {
        this.config = Objects.requireNonNull(builder.config, "config is required");
        this.runtime = Objects.requireNonNull(builder.runtime, "runtime is required");
        this.backend = Objects.requireNonNull(builder.backend, "backend is required");
        this.launcher = Objects.requireNonNull(builder.launcher, "launcher is required");
        ReadinessProbe probe = Objects.requireNonNull(builder.probe, "probe is required");
        this.hostResolver = builder.hostResolver;
        this.metrics = builder.metrics;
        this.installShutdownHook = builder.installShutdownHook;

        Duration gracePeriod = Duration.ofMillis(config.getCleanup().getGracePeriodMs());
        this.cancellationFlag = new CancellationFlag();
        this.registry = new ProcessRegistry(runtime.jobId(), gracePeriod);
        this.supervisor = new LifecycleSupervisor(
                registry,
                cancellationFlag,
                Duration.ofMillis(config.getMonitor().getIntervalMs()),
                gracePeriod.plus(SHUTDOWN_WAIT_MARGIN)
        );
        this.waiter = new ReadinessWaiter(probe, cancellationFlag);
    }

    /**
     * Allocates endpoints and expands them into processes. Computed once.
     *
     * @throws SweepException if the request cannot be laid out on the available machines
     */
    public synchronized SweepPlan plan() {
        if (plan == null) {
            ResourceRequest request = ConfigLoader.toResourceRequest(config.getResources());
            List<EndpointTopology> topology = backend.buildTopology(
                    backend.allocateEndpoints(request, runtime.nodes().workers()),
                    config.getBackend().getBasePort());
            plan = new SweepPlan(request, topology);
        }
        return plan;
    }

    /**
     * Runs the whole sweep.
     *
     * @return 0 on success, 1 on failure
     * @throws IllegalStateException if called more than once
     */
    public int run() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("A sweep orchestrator runs only once");
        }

        banner("Sweep Orchestrator");
        log.info("Job ID: {}", runtime.jobId());
        log.info("Run name: {}", runtime.runName());
        log.info("Head node: {}", runtime.nodes().head());
        log.info("Worker nodes: {}", String.join(", ", runtime.nodes().workers()));
        log.info("Log directory: {}", runtime.logDir());

        SweepPlan sweepPlan;
        try {
            sweepPlan = plan();
        } catch (SweepException e) {
            log.error("Planning failed, nothing launched: type={}, error={}", e.getErrorType(), e.getMessage());
            transition(SweepStage.FAILED);
            supervisor.markRunFinished();
            return 1;
        }

        if (metrics != null) {
            registry.addTerminationListener(metrics::recordProcessTermination);
            metrics.registerManagedProcesses(registry::size);
            metrics.registerRunningProcesses(registry::runningCount);
        }
        supervisor.start(installShutdownHook);

        int exitCode = 1;
        try {
            runStage(SweepStage.HEAD_INFRASTRUCTURE, this::startHeadInfrastructure);
            runStage(SweepStage.WORKERS, () -> startWorkers(sweepPlan));
            runStage(SweepStage.FRONTEND, () -> startFrontend(sweepPlan));

            transition(SweepStage.BENCHMARK);
            long benchmarkStart = System.nanoTime();
            try {
                exitCode = runBenchmark(sweepPlan);
            } finally {
                recordStage(SweepStage.BENCHMARK, benchmarkStart);
            }
        } catch (SweepException e) {
            log.error("Sweep failed: stage={}, type={}, error={}", stage.get(), e.getErrorType(), e.getMessage());
            exitCode = 1;
        } catch (RuntimeException e) {
            log.error("Unexpected error during sweep: stage={}", stage.get(), e);
            exitCode = 1;
        } finally {
            exitCode = cleanup(exitCode);
        }
        return exitCode;
    }

    /**
     * Stops the run as an operator interrupt would: raises the flag and stops every process.
     */
    public void stop() {
        supervisor.onInterrupt("stop request");
    }

    /**
     * Builds every launch of the run without starting anything.
     *
     * @return launch specs by process name, in launch order
     */
    public Map<String, LaunchSpec> dryRun() {
        SweepPlan sweepPlan = plan();
        Map<String, LaunchSpec> launches = new LinkedHashMap<>();
        launches.put(HEAD_INFRASTRUCTURE_NAME, headInfrastructureSpec());
        for (EndpointTopology topology : sweepPlan.topology()) {
            String leaderIp = hostResolver.resolve(topology.endpoint().leaderNode());
            for (WorkerProcess process : topology.processes()) {
                launches.put(process.name(), workerSpec(process, topology, leaderIp));
            }
        }
        FrontendLaunch frontend = backend.buildFrontend(sweepPlan.endpoints(), hostResolver::resolve);
        launches.put(frontend.name(), frontendSpec(frontend));
        if (isCommandBenchmark()) {
            launches.put(BENCHMARK_NAME, benchmarkSpec());
        }

        banner("Dry run: " + runtime.runName());
        launches.forEach((name, spec) -> log.info("[dry-run] name={}, node={}, log={}, command={}",
                name, spec.node(), spec.outputFile(), String.join(" ", spec.command())));
        log.info("[dry-run] {} endpoints, {} processes, nothing launched",
                sweepPlan.endpoints().size(), launches.size());
        return launches;
    }

    // ---- stages ----

    private void startHeadInfrastructure() {
        banner("Starting head node infrastructure");
        String head = runtime.nodes().head();
        log.info("Head node: {}", head);

        launch(HEAD_INFRASTRUCTURE_NAME, headInfrastructureSpec(), true);

        SweepConfig.InfrastructureConfig infra = config.getInfrastructure();
        SweepConfig.TimeoutsConfig timeouts = config.getTimeouts();
        Duration interval = Duration.ofMillis(timeouts.getPortWaitIntervalMs());
        waiter.awaitPort(head, infra.getNatsPort(), timeouts.getPortWaitAttempts(), interval);
        log.info("NATS is ready: port={}", infra.getNatsPort());
        waiter.awaitPort(head, infra.getEtcdPort(), timeouts.getPortWaitAttempts(), interval);
        log.info("etcd is ready: port={}", infra.getEtcdPort());
    }

    private void startWorkers(SweepPlan sweepPlan) {
        banner("Starting backend workers");
        int launched = 0;
        for (EndpointTopology topology : sweepPlan.topology()) {
            String leaderIp = hostResolver.resolve(topology.endpoint().leaderNode());
            for (WorkerProcess process : topology.processes()) {
                log.info("Starting {} worker {} on {}", process.endpointMode(), process.endpointIndex(), process.node());
                launch(process.name(), workerSpec(process, topology, leaderIp), true);
                launched++;
            }
        }
        log.info("Started {} worker processes", launched);
    }

    private void startFrontend(SweepPlan sweepPlan) {
        banner("Starting frontend");
        FrontendLaunch frontend = backend.buildFrontend(sweepPlan.endpoints(), hostResolver::resolve);
        log.info("Starting {} on {}", frontend.name(), runtime.nodes().head());
        launch(frontend.name(), frontendSpec(frontend), true);
    }

    private int runBenchmark(SweepPlan sweepPlan) {
        banner("Running benchmark");
        String head = runtime.nodes().head();
        int httpPort = config.getFrontend().getHttpPort();
        int expectedWorkers = sweepPlan.request().totalWorkers();
        SweepConfig.TimeoutsConfig timeouts = config.getTimeouts();

        log.info("Waiting for server health (expecting {} workers)...", expectedWorkers);
        waiter.awaitHealthy(head, httpPort, expectedWorkers,
                timeouts.getHealthWaitAttempts(), Duration.ofMillis(timeouts.getHealthWaitIntervalMs()));
        log.info("Server is healthy");

        return isCommandBenchmark() ? runCommandBenchmark() : runManualBenchmark(head, httpPort);
    }

    private int runManualBenchmark(String head, int httpPort) {
        Duration pollInterval = Duration.ofMillis(config.getBenchmark().getPollIntervalMs());
        log.info("Benchmark type is 'manual', server is ready for testing");
        log.info("Frontend URL: http://{}:{}", head, httpPort);
        log.info("Interrupt the job (Ctrl+C or scancel) to stop it");

        while (!cancellationFlag.isCancelled()) {
            if (registry.checkFailures()) {
                log.error("Worker failure detected during manual mode");
                cancellationFlag.cancel(CancellationReason.CRITICAL_FAILURE, "critical process failed in manual mode");
                return 1;
            }
            cancellationFlag.await(pollInterval);
        }

        CancellationReason reason = cancellationFlag.getReason().orElse(CancellationReason.OPERATOR_INTERRUPT);
        if (reason == CancellationReason.CRITICAL_FAILURE) {
            log.error("Manual mode ended by a critical process failure");
            return 1;
        }
        log.info("Manual mode stopped: reason={}", reason);
        return 0;
    }

    private int runCommandBenchmark() {
        Duration pollInterval = Duration.ofMillis(config.getBenchmark().getPollIntervalMs());
        ManagedProcess benchmark = launch(BENCHMARK_NAME, benchmarkSpec(), false);

        while (true) {
            if (registry.checkFailures()) {
                log.error("Critical process failed while the benchmark was running");
                cancellationFlag.cancel(CancellationReason.CRITICAL_FAILURE, "critical process failed during benchmark");
                return 1;
            }

            ProcessStatus status = benchmark.getStatus();
            if (status.state() == ProcessState.EXITED) {
                if (status.exitCode() == 0) {
                    log.info("Benchmark completed successfully");
                    return 0;
                }
                log.error("Benchmark failed: status={}, log={}", status, benchmark.getLogFile());
                return 1;
            }
            if (status.state() == ProcessState.KILLED) {
                log.error("Benchmark was stopped before completing");
                return 1;
            }

            if (cancellationFlag.await(pollInterval)) {
                cancellationFlag.throwIfCancelled("running the benchmark");
            }
        }
    }

    private int cleanup(int exitCode) {
        transition(SweepStage.CLEANUP);
        banner("Cleanup");
        long cleanupStart = System.nanoTime();
        try {
            cancellationFlag.cancel(CancellationReason.RUN_COMPLETE, "run finished with exit code " + exitCode);
            supervisor.close();
            registry.cleanup();

            if (exitCode != 0) {
                registry.reportFailures();
            }
        } catch (RuntimeException e) {
            log.warn("Error during cleanup, continuing", e);
        } finally {
            recordStage(SweepStage.CLEANUP, cleanupStart);
            if (metrics != null) {
                metrics.writeTo(runtime.logDir().resolve(METRICS_FILE));
            }
            transition(exitCode == 0 ? SweepStage.SUCCESS : SweepStage.FAILED);
            supervisor.markRunFinished();
        }

        if (exitCode == 0) {
            log.info("Sweep completed successfully: runName={}", runtime.runName());
        } else {
            log.error("Sweep failed: runName={}, exitCode={}, logDir={}", runtime.runName(), exitCode, runtime.logDir());
        }
        return exitCode;
    }

    // ---- launch specs ----

    private LaunchSpec headInfrastructureSpec() {
        SweepConfig.InfrastructureConfig infra = config.getInfrastructure();
        Map<Path, Path> mounts = new LinkedHashMap<>(runtime.containerMounts());
        List<String> command;

        if (!infra.getCommand().isEmpty()) {
            command = format(infra.getCommand());
        } else {
            Path script = Paths.get(infra.getSetupScript()).toAbsolutePath().normalize();
            String scriptPath = script.toString();
            if (runtime.containerImage() != null) {
                mounts.put(script, SETUP_SCRIPT_CONTAINER_PATH);
                scriptPath = SETUP_SCRIPT_CONTAINER_PATH.toString();
            }
            command = List.of("python3", scriptPath,
                    "--name", config.getName(),
                    "--log-dir", runtime.logDir().toString());
        }

        return new LaunchSpec(
                runtime.nodes().head(),
                command,
                logFile("infrastructure_" + runtime.jobId()),
                runtime.environment(),
                runtime.containerImage(),
                mounts
        );
    }

    private LaunchSpec workerSpec(WorkerProcess process, EndpointTopology topology, String leaderIp) {
        Path dumpConfig = runtime.logDir().resolve(process.endpointMode().label()
                + "_config_" + process.endpointIndex() + "_" + process.node() + ".json");
        List<String> command = backend.buildWorkerCommand(process, topology, runtime, leaderIp, dumpConfig);

        return new LaunchSpec(
                process.node(),
                command,
                logFile(process.name() + "_" + runtime.jobId()),
                workerEnvironment(process),
                runtime.containerImage(),
                runtime.containerMounts()
        );
    }

    private LaunchSpec frontendSpec(FrontendLaunch frontend) {
        return new LaunchSpec(
                runtime.nodes().head(),
                frontend.command(),
                logFile(frontend.logPrefix() + "_" + runtime.jobId()),
                discoveryEnvironment(),
                runtime.containerImage(),
                runtime.containerMounts()
        );
    }

    private LaunchSpec benchmarkSpec() {
        return new LaunchSpec(
                runtime.nodes().bench(),
                format(config.getBenchmark().getCommand()),
                logFile(BENCHMARK_NAME + "_" + runtime.jobId()),
                discoveryEnvironment(),
                runtime.containerImage(),
                runtime.containerMounts()
        );
    }

    /**
     * Environment of one worker: discovery services, system port and, when the process owns only
     * part of its machine, a device mask.
     */
    Map<String, String> workerEnvironment(WorkerProcess process) {
        Map<String, String> env = discoveryEnvironment();
        env.put("HEAD_NODE_IP", runtime.headNodeIp());
        env.put("DYN_SYSTEM_PORT", String.valueOf(process.sysPort()));
        process.deviceMask(runtime.gpusPerNode())
                .ifPresent(mask -> env.put("CUDA_VISIBLE_DEVICES", mask));
        return env;
    }

    private Map<String, String> discoveryEnvironment() {
        SweepConfig.InfrastructureConfig infra = config.getInfrastructure();
        String head = runtime.nodes().head();
        Map<String, String> env = new LinkedHashMap<>(runtime.environment());
        env.put("ETCD_ENDPOINTS", "http://" + head + ":" + infra.getEtcdPort());
        env.put("NATS_SERVER", "nats://" + head + ":" + infra.getNatsPort());
        return env;
    }

    private List<String> format(List<String> template) {
        Map<String, String> extra = Map.of("http_port", String.valueOf(config.getFrontend().getHttpPort()));
        return template.stream()
                .map(arg -> runtime.format(arg, extra))
                .toList();
    }

    private Path logFile(String baseName) {
        return runtime.logDir().resolve(baseName + ".log");
    }

    private boolean isCommandBenchmark() {
        return "command".equalsIgnoreCase(config.getBenchmark().getType());
    }

    // ---- plumbing ----

    /**
     * Starts a process and registers it before doing anything else.
     */
    private ManagedProcess launch(String name, LaunchSpec spec, boolean critical) {
        cancellationFlag.throwIfCancelled("starting " + name);
        log.info("Launching process: name={}, node={}, log={}", name, spec.node(), spec.outputFile());
        log.info("Command: {}", String.join(" ", spec.command()));

        RemoteProcessHandle handle = launcher.start(spec);
        ManagedProcess process = ManagedProcess.builder()
                .name(name)
                .node(spec.node())
                .handle(handle)
                .logFile(spec.outputFile())
                .critical(critical)
                .build();
        try {
            registry.add(process);
        } catch (IllegalStateException e) {
            handle.kill();
            throw e;
        }
        return process;
    }

    private void runStage(SweepStage next, Runnable body) {
        cancellationFlag.throwIfCancelled("entering stage " + next);
        transition(next);
        long start = System.nanoTime();
        try {
            body.run();
        } finally {
            recordStage(next, start);
        }
    }

    private void transition(SweepStage next) {
        SweepStage previous = stage.getAndSet(next);
        log.debug("Stage transition: from={}, to={}", previous, next);
    }

    private void recordStage(SweepStage completed, long startNanos) {
        if (metrics != null) {
            metrics.recordStageDuration(completed.name().toLowerCase(Locale.ROOT), Duration.ofNanos(System.nanoTime() - startNanos));
        }
    }

    private static void banner(String title) {
        log.info("");
        log.info("==== {} ====", title);
    }

    public SweepStage getStage() {
        return stage.get();
    }

    public ProcessRegistry getRegistry() {
        return registry;
    }

    public CancellationFlag getCancellationFlag() {
        return cancellationFlag;
    }

    public LifecycleSupervisor getSupervisor() {
        return supervisor;
    }

    public RuntimeContext getRuntime() {
        return runtime;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private SweepConfig config;
        private RuntimeContext runtime;
        private Backend backend;
        private RemoteProcessLauncher launcher;
        private ReadinessProbe probe;
        private HostResolver hostResolver = HostResolver.dns();
        private MetricsRegistry metrics;
        private boolean installShutdownHook = false;

        public Builder config(SweepConfig config) {
            this.config = config;
            return this;
        }

        public Builder runtime(RuntimeContext runtime) {
            this.runtime = runtime;
            return this;
        }

        public Builder backend(Backend backend) {
            this.backend = backend;
            return this;
        }

        public Builder launcher(RemoteProcessLauncher launcher) {
            this.launcher = launcher;
            return this;
        }

        public Builder probe(ReadinessProbe probe) {
            this.probe = probe;
            return this;
        }

        public Builder hostResolver(HostResolver hostResolver) {
            this.hostResolver = hostResolver;
            return this;
        }

        /**
         * Optional; no metrics are recorded without it.
         */
        public Builder metrics(MetricsRegistry metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder installShutdownHook(boolean installShutdownHook) {
            this.installShutdownHook = installShutdownHook;
            return this;
        }

        public SweepOrchestrator build() {
            return new SweepOrchestrator(this);
        }
    }
}
