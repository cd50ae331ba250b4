package fr.lapetina.inference.sweep.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Reads the job id and machine list of the current SLURM allocation.
 *
 * The only place that looks at scheduler environment variables; everything downstream gets the
 * values through {@link RuntimeContext}.
 */
public final class SlurmEnvironment {

    private static final Logger log = LoggerFactory.getLogger(SlurmEnvironment.class);

    private static final List<String> EXPAND_COMMAND = List.of("scontrol", "show", "hostnames");
    private static final Duration EXPAND_TIMEOUT = Duration.ofSeconds(30);

    private final Map<String, String> environment;
    private final List<String> expandCommand;
    private final Duration expandTimeout;

    public SlurmEnvironment(Map<String, String> environment) {
        this(environment, EXPAND_COMMAND, EXPAND_TIMEOUT);
    }

    SlurmEnvironment(Map<String, String> environment, List<String> expandCommand, Duration expandTimeout) {
        this.environment = Map.copyOf(environment);
        this.expandCommand = List.copyOf(expandCommand);
        this.expandTimeout = expandTimeout;
    }

    public static SlurmEnvironment fromSystem() {
        return new SlurmEnvironment(System.getenv());
    }

    public Optional<String> jobId() {
        String jobId = environment.get("SLURM_JOB_ID");
        if (jobId == null || jobId.isBlank()) {
            jobId = environment.get("SLURM_JOBID");
        }
        return Optional.ofNullable(jobId).filter(id -> !id.isBlank());
    }

    /**
     * Expands {@code SLURM_NODELIST} into hostnames with {@code scontrol show hostnames}.
     * Falls back to splitting on commas when scontrol is unavailable.
     */
    public List<String> nodeList() {
        String raw = environment.getOrDefault("SLURM_NODELIST", "");
        if (raw.isBlank()) {
            return List.of();
        }

        Path output = null;
        try {
            // output goes to a file so the bounded wait below cannot be blocked by a full pipe
            output = Files.createTempFile("slurm-nodelist", ".txt");
            List<String> command = new ArrayList<>(expandCommand);
            command.add(raw);
            Process process = new ProcessBuilder(command)
                    .redirectErrorStream(true)
                    .redirectOutput(output.toFile())
                    .start();
            if (process.waitFor(expandTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                if (process.exitValue() == 0) {
                    return parseHostnames(Files.readString(output, StandardCharsets.UTF_8));
                }
                log.warn("scontrol could not expand node list, using it verbatim: nodelist={}, exitCode={}",
                        raw, process.exitValue());
            } else {
                process.destroyForcibly();
                log.warn("scontrol timed out after {}, using node list verbatim: nodelist={}", expandTimeout, raw);
            }
        } catch (IOException e) {
            log.warn("scontrol unavailable, using node list verbatim: nodelist={}, error={}", raw, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while expanding node list: nodelist={}", raw);
        } finally {
            deleteQuietly(output);
        }
        return parseHostnames(raw.replace(',', '\n'));
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Could not delete {}: {}", file, e.getMessage());
        }
    }

    static List<String> parseHostnames(String output) {
        return Arrays.stream(output.split("\\R"))
                .map(String::trim)
                .filter(line -> !line.isEmpty())
                .toList();
    }
}
