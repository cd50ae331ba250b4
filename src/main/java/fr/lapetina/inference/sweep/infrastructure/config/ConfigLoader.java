package fr.lapetina.inference.sweep.infrastructure.config;

import fr.lapetina.inference.sweep.domain.model.ResourceRequest;
import fr.lapetina.inference.sweep.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Set;

/**
 * Configuration loader.
 *
 * Supports:
 * - Loading from file system, falling back to the classpath
 * - Validation of the sections the run cannot start without
 * - Conversion of the resource section into a {@link ResourceRequest}
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private static final Set<String> BACKEND_TYPES = Set.of("sglang");
    private static final Set<String> LAUNCHER_TYPES = Set.of("srun", "local");
    private static final Set<String> BENCHMARK_TYPES = Set.of("manual", "command");

    private final Path configPath;
    private final Yaml yaml;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(SweepConfig.class, loaderOptions));
    }

    /**
     * Loads and validates configuration from file or classpath.
     *
     * @return The loaded configuration
     * @throws ConfigurationException if loading or validation fails
     */
    public SweepConfig load() {
        SweepConfig config = loadFromPath();
        validate(config);
        return config;
    }

    private SweepConfig loadFromPath() {
        // Try file system first
        if (Files.exists(configPath)) {
            return loadFromFile(configPath);
        }

        // Try classpath
        String classpathResource = configPath.toString();
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return parse(is, classpathResource);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    private SweepConfig loadFromFile(Path path) {
        log.info("Loading configuration from file: {}", path);
        try (InputStream is = Files.newInputStream(path)) {
            return parse(is, path.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        }
    }

    /**
     * Loads and validates configuration from an input stream.
     */
    public SweepConfig loadFromStream(InputStream inputStream) {
        SweepConfig config = parse(inputStream, "stream");
        validate(config);
        return config;
    }

    private SweepConfig parse(InputStream is, String source) {
        try {
            SweepConfig config = yaml.load(is);
            if (config == null) {
                throw new ConfigurationException("Configuration is empty: " + source);
            }
            return config;
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid configuration in " + source + ": " + e.getMessage(), e);
        }
    }

    /**
     * Checks the settings a run cannot start without.
     *
     * @throws ConfigurationException on the first invalid setting
     */
    public static void validate(SweepConfig config) {
        if (isBlank(config.getName())) {
            throw new ConfigurationException("name is required");
        }
        if (isBlank(config.getModel().getPath())) {
            throw new ConfigurationException("model.path is required");
        }
        requireOneOf("backend.type", config.getBackend().getType(), BACKEND_TYPES);
        requireOneOf("launcher.type", config.getLauncher().getType(), LAUNCHER_TYPES);
        requireOneOf("benchmark.type", config.getBenchmark().getType(), BENCHMARK_TYPES);

        if (isSrun(config) && isBlank(config.getModel().getContainer())) {
            throw new ConfigurationException("model.container is required with the srun launcher");
        }
        if ("command".equals(normalize(config.getBenchmark().getType()))
                && config.getBenchmark().getCommand().isEmpty()) {
            throw new ConfigurationException("benchmark.command is required for benchmark type 'command'");
        }
        if (isBlank(config.getInfrastructure().getSetupScript()) && config.getInfrastructure().getCommand().isEmpty()) {
            throw new ConfigurationException("infrastructure.setupScript or infrastructure.command is required");
        }
        if (config.getTimeouts().getPortWaitAttempts() <= 0 || config.getTimeouts().getHealthWaitAttempts() <= 0) {
            throw new ConfigurationException("timeouts attempts must be > 0");
        }
        if (config.getMonitor().getIntervalMs() <= 0) {
            throw new ConfigurationException("monitor.intervalMs must be > 0");
        }
        for (String mount : config.getExtraMounts()) {
            if (!mount.contains(":")) {
                throw new ConfigurationException("extraMounts entry must be host:container, got " + mount);
            }
        }

        // Fails fast on GPU arithmetic
        toResourceRequest(config.getResources());
    }

    /**
     * Converts the resource section into a validated request.
     */
    public static ResourceRequest toResourceRequest(SweepConfig.ResourcesConfig resources) {
        return ResourceRequest.fromNodeBudget(
                resources.getGpusPerNode(),
                resources.getPrefillNodes(), resources.getPrefillWorkers(),
                resources.getDecodeNodes(), resources.getDecodeWorkers(),
                resources.getAggNodes(), resources.getAggWorkers()
        );
    }

    static boolean isSrun(SweepConfig config) {
        return "srun".equals(normalize(config.getLauncher().getType()));
    }

    private static void requireOneOf(String key, String value, Set<String> allowed) {
        if (value == null || !allowed.contains(normalize(value))) {
            throw new ConfigurationException(key + " must be one of " + allowed + ", got " + value);
        }
    }

    private static String normalize(String value) {
        return value == null ? null : value.toLowerCase(Locale.ROOT);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
