package fr.lapetina.inference.sweep.infrastructure.config;

import fr.lapetina.inference.sweep.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Every runtime value of a run, computed once at startup and passed explicitly to the components
 * that need it.
 *
 * @param jobId           scheduler job id
 * @param runName         {@code name_jobId}
 * @param nodes           machine roles
 * @param headNodeIp      address of the head node
 * @param logDir          per-run log directory
 * @param resultsDir      benchmark results directory inside {@code logDir}
 * @param modelPath       model location on the host
 * @param containerImage  container image, null when processes run outside containers
 * @param gpusPerNode     GPUs physically present on each machine
 * @param containerMounts host path to container path
 * @param environment     extra variables exported to every process
 */
public record RuntimeContext(
        String jobId,
        String runName,
        Nodes nodes,
        String headNodeIp,
        Path logDir,
        Path resultsDir,
        Path modelPath,
        String containerImage,
        int gpusPerNode,
        Map<Path, Path> containerMounts,
        Map<String, String> environment
) {
    private static final Logger log = LoggerFactory.getLogger(RuntimeContext.class);

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    public RuntimeContext {
        containerMounts = Collections.unmodifiableMap(new LinkedHashMap<>(containerMounts));
        environment = Collections.unmodifiableMap(new LinkedHashMap<>(environment));
    }

    /**
     * Computes the context and creates the log and results directories.
     */
    public static RuntimeContext create(
            SweepConfig config,
            String jobId,
            Nodes nodes,
            HostResolver hostResolver,
            LocalDateTime startedAt
    ) {
        return create(config, jobId, nodes, hostResolver, startedAt, true);
    }

    /**
     * Computes the context; the directories are only created when {@code createDirectories} is set,
     * so a dry run leaves the filesystem untouched.
     */
    public static RuntimeContext create(
            SweepConfig config,
            String jobId,
            Nodes nodes,
            HostResolver hostResolver,
            LocalDateTime startedAt,
            boolean createDirectories
    ) {
        SweepConfig.ResourcesConfig resources = config.getResources();
        String dirSuffix;
        if (resources.getPrefillWorkers() > 0) {
            dirSuffix = resources.getPrefillWorkers() + "P_" + Math.max(resources.getDecodeWorkers(), 1) + "D";
        } else if (resources.getAggWorkers() > 0) {
            dirSuffix = resources.getAggWorkers() + "A";
        } else {
            dirSuffix = "1P_1D";
        }

        Path logDir = Paths.get(config.getLogDirBase())
                .toAbsolutePath()
                .normalize()
                .resolve(jobId + "_" + dirSuffix + "_" + TIMESTAMP.format(startedAt));
        Path resultsDir = logDir.resolve("results");
        if (createDirectories) {
            try {
                Files.createDirectories(resultsDir);
            } catch (IOException e) {
                throw new ConfigurationException("Cannot create log directory " + logDir, e);
            }
        }

        Path modelPath = Paths.get(config.getModel().getPath()).toAbsolutePath().normalize();

        Map<Path, Path> mounts = new LinkedHashMap<>();
        mounts.put(modelPath, Paths.get("/model"));
        mounts.put(logDir, Paths.get("/logs"));
        mounts.put(resultsDir, Paths.get("/results"));
        for (String spec : config.getExtraMounts()) {
            String[] parts = spec.split(":", 2);
            mounts.put(Paths.get(parts[0]).toAbsolutePath().normalize(), Paths.get(parts[1]));
        }

        String container = config.getModel().getContainer();
        String containerImage = container == null || container.isBlank()
                ? null
                : Paths.get(container).toAbsolutePath().normalize().toString();

        RuntimeContext context = new RuntimeContext(
                jobId,
                config.getName() + "_" + jobId,
                nodes,
                hostResolver.resolve(nodes.head()),
                logDir,
                resultsDir,
                modelPath,
                containerImage,
                resources.getGpusPerNode(),
                mounts,
                config.getEnvironment()
        );
        log.info("Runtime context created: runName={}, head={}, headIp={}, logDir={}",
                context.runName(), nodes.head(), context.headNodeIp(), logDir);
        return context;
    }

    /**
     * Mounts as {@code host:container,host:container}.
     */
    public String containerMountsSpec() {
        return containerMounts.entrySet().stream()
                .map(e -> e.getKey() + ":" + e.getValue())
                .collect(Collectors.joining(","));
    }

    /**
     * Substitutes {@code {job_id}}, {@code {run_name}}, {@code {head_node}}, {@code {head_node_ip}},
     * {@code {log_dir}}, {@code {results_dir}}, {@code {model_path}} and any extra placeholders.
     */
    public String format(String template, Map<String, String> extra) {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("job_id", jobId);
        values.put("run_name", runName);
        values.put("head_node", nodes.head());
        values.put("head_node_ip", headNodeIp);
        values.put("log_dir", logDir.toString());
        values.put("results_dir", resultsDir.toString());
        values.put("model_path", modelPath.toString());
        values.putAll(extra);

        String result = template;
        for (Map.Entry<String, String> entry : values.entrySet()) {
            result = result.replace("{" + entry.getKey() + "}", entry.getValue());
        }
        return result;
    }
}
