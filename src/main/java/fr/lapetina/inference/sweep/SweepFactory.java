package fr.lapetina.inference.sweep;

import fr.lapetina.inference.sweep.backend.Backend;
import fr.lapetina.inference.sweep.backend.SGLangBackend;
import fr.lapetina.inference.sweep.exception.ConfigurationException;
import fr.lapetina.inference.sweep.infrastructure.config.ConfigLoader;
import fr.lapetina.inference.sweep.infrastructure.config.HostResolver;
import fr.lapetina.inference.sweep.infrastructure.config.Nodes;
import fr.lapetina.inference.sweep.infrastructure.config.RuntimeContext;
import fr.lapetina.inference.sweep.infrastructure.config.SlurmEnvironment;
import fr.lapetina.inference.sweep.infrastructure.config.SweepConfig;
import fr.lapetina.inference.sweep.infrastructure.health.HttpReadinessProbe;
import fr.lapetina.inference.sweep.infrastructure.health.ReadinessProbe;
import fr.lapetina.inference.sweep.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.inference.sweep.infrastructure.process.LocalProcessLauncher;
import fr.lapetina.inference.sweep.infrastructure.process.RemoteProcessLauncher;
import fr.lapetina.inference.sweep.infrastructure.process.SrunProcessLauncher;
import fr.lapetina.inference.sweep.orchestrator.SweepOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;

/**
 * Factory for creating a fully-wired sweep orchestrator from configuration.
 *
 * <p>Usage:
 * <pre>{@code
 * try (SweepFactory factory = SweepFactory.create("sweep.yaml", false)) {
 *     int exitCode = factory.getOrchestrator().run();
 * }
 * }</pre>
 */
public class SweepFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SweepFactory.class);

    static final String LOCAL_JOB_ID = "local";

    private final SweepConfig config;
    private final RuntimeContext runtime;
    private final Backend backend;
    private final RemoteProcessLauncher launcher;
    private final MetricsRegistry metricsRegistry;
    private final SweepOrchestrator orchestrator;

    protected SweepFactory(
            SweepConfig config,
            SlurmEnvironment slurm,
            HostResolver hostResolver,
            RemoteProcessLauncher launcherOverride,
            ReadinessProbe probeOverride,
            boolean dryRun,
            boolean installShutdownHook
    ) {
        this.config = config;
        log.info("Initializing SweepFactory: name={}, backend={}, launcher={}",
                config.getName(), config.getBackend().getType(), config.getLauncher().getType());

        String jobId = resolveJobId(slurm, dryRun);
        Nodes nodes = Nodes.fromNodeList(resolveNodeList(slurm), config.getResources().isBenchmarkOnSeparateNode());
        this.runtime = RuntimeContext.create(config, jobId, nodes, hostResolver, LocalDateTime.now(), !dryRun);

        this.backend = createBackend();
        this.launcher = launcherOverride != null ? launcherOverride : createLauncher();
        ReadinessProbe probe = probeOverride != null ? probeOverride : new HttpReadinessProbe();

        this.metricsRegistry = config.getMetrics().isEnabled()
                ? new MetricsRegistry(config.getMetrics().getPrefix())
                : null;

        this.orchestrator = SweepOrchestrator.builder()
                .config(config)
                .runtime(runtime)
                .backend(backend)
                .launcher(launcher)
                .probe(probe)
                .hostResolver(hostResolver)
                .metrics(metricsRegistry)
                .installShutdownHook(installShutdownHook)
                .build();

        log.info("SweepFactory initialized: jobId={}, workerNodes={}", jobId, nodes.workers().size());
    }

    /**
     * Creates a factory from the configuration file, reading the job from the SLURM environment.
     *
     * @param dryRun when true, a missing SLURM job is tolerated
     */
    public static SweepFactory create(String configPath, boolean dryRun) {
        SweepConfig config = new ConfigLoader(configPath).load();
        return new SweepFactory(config, SlurmEnvironment.fromSystem(), HostResolver.dns(),
                null, null, dryRun, !dryRun);
    }

    private String resolveJobId(SlurmEnvironment slurm, boolean dryRun) {
        return slurm.jobId().orElseGet(() -> {
            if (isLocalLauncher() || dryRun) {
                log.info("No SLURM job, using job id '{}'", LOCAL_JOB_ID);
                return LOCAL_JOB_ID;
            }
            throw new ConfigurationException("Not running in SLURM (SLURM_JOB_ID not set)");
        });
    }

    private List<String> resolveNodeList(SlurmEnvironment slurm) {
        if (!config.getNodes().isEmpty()) {
            log.info("Using nodes from configuration: {}", config.getNodes());
            return config.getNodes();
        }
        List<String> allocated = slurm.nodeList();
        if (!allocated.isEmpty()) {
            log.info("Using nodes from SLURM allocation: {}", allocated);
            return allocated;
        }
        if (isLocalLauncher()) {
            return List.of("localhost");
        }
        throw new ConfigurationException("No nodes configured and SLURM_NODELIST is empty");
    }

    private Backend createBackend() {
        String type = config.getBackend().getType().toLowerCase(Locale.ROOT);
        return switch (type) {
            case SGLangBackend.NAME -> SGLangBackend.fromConfig(config);
            default -> throw new ConfigurationException("Unsupported backend: " + type);
        };
    }

    private RemoteProcessLauncher createLauncher() {
        return isLocalLauncher() ? new LocalProcessLauncher() : new SrunProcessLauncher();
    }

    private boolean isLocalLauncher() {
        return "local".equalsIgnoreCase(config.getLauncher().getType());
    }

    public SweepOrchestrator getOrchestrator() {
        return orchestrator;
    }

    public SweepConfig getConfig() {
        return config;
    }

    public RuntimeContext getRuntime() {
        return runtime;
    }

    public Backend getBackend() {
        return backend;
    }

    public RemoteProcessLauncher getLauncher() {
        return launcher;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    @Override
    public void close() {
        log.info("Shutting down SweepFactory...");

        try {
            orchestrator.getSupervisor().close();
        } catch (Exception e) {
            log.warn("Error closing lifecycle supervisor", e);
        }

        if (metricsRegistry != null) {
            try {
                metricsRegistry.close();
            } catch (Exception e) {
                log.warn("Error closing metrics registry", e);
            }
        }

        log.info("SweepFactory shut down");
    }
}
