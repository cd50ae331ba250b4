package fr.lapetina.inference.sweep.infrastructure.metrics;

import fr.lapetina.inference.sweep.infrastructure.process.ManagedProcess;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Run metrics using Micrometer.
 *
 * Provides:
 * - Stage duration timers
 * - Process termination counters by role and state
 * - Managed process gauge
 * - Prometheus text output, written to the log directory at the end of the run
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    private final ConcurrentHashMap<String, Timer> stageTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> terminationCounters = new ConcurrentHashMap<>();

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        new JvmMemoryMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("sweep");
    }

    /**
     * Records how long an orchestrator stage took.
     */
    public void recordStageDuration(String stage, Duration duration) {
        stageTimers.computeIfAbsent(stage, k ->
                Timer.builder(prefix + "_stage_duration")
                        .description("Orchestrator stage duration")
                        .tag("stage", stage)
                        .register(registry)
        ).record(duration);
    }

    /**
     * Counts a process reaching a terminal state. The role is the name up to the first underscore.
     */
    public void recordProcessTermination(ManagedProcess process) {
        String role = roleOf(process.getName());
        String state = process.getStatus().state().name();
        terminationCounters.computeIfAbsent(role + ":" + state, k ->
                Counter.builder(prefix + "_process_terminations_total")
                        .description("Managed processes that reached a terminal state")
                        .tag("role", role)
                        .tag("state", state)
                        .register(registry)
        ).increment();
    }

    /**
     * Registers a gauge for the number of managed processes.
     */
    public void registerManagedProcesses(Supplier<Number> count) {
        Gauge.builder(prefix + "_managed_processes", count, s -> s.get().doubleValue())
                .description("Processes tracked by the registry")
                .register(registry);
    }

    /**
     * Registers a gauge for the number of running managed processes.
     */
    public void registerRunningProcesses(Supplier<Number> count) {
        Gauge.builder(prefix + "_running_processes", count, s -> s.get().doubleValue())
                .description("Tracked processes still running")
                .register(registry);
    }

    static String roleOf(String processName) {
        int separator = processName.indexOf('_');
        return separator > 0 ? processName.substring(0, separator) : processName;
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Writes the scrape output to a file. Failures are logged, never thrown.
     */
    public void writeTo(Path file) {
        try {
            Files.writeString(file, scrape(), StandardCharsets.UTF_8);
            log.info("Metrics written: path={}", file);
        } catch (IOException e) {
            log.warn("Cannot write metrics: path={}, error={}", file, e.getMessage());
        }
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
