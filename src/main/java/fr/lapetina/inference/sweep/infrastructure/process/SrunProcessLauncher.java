package fr.lapetina.inference.sweep.infrastructure.process;

import fr.lapetina.inference.sweep.exception.ProcessStartException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Starts processes on machines of the current SLURM allocation with {@code srun}.
 */
public final class SrunProcessLauncher implements RemoteProcessLauncher {

    private static final Logger log = LoggerFactory.getLogger(SrunProcessLauncher.class);

    @Override
    public RemoteProcessHandle start(LaunchSpec spec) {
        List<String> command = buildCommand(spec);
        log.debug("Launching via srun: node={}, command={}", spec.node(), command);

        // the step writes to --output itself; srun's own diagnostics get a file of their own
        ProcessBuilder builder = new ProcessBuilder(command)
                .redirectErrorStream(true)
                .redirectOutput(ProcessBuilder.Redirect.appendTo(clientLogFile(spec.outputFile()).toFile()));
        builder.environment().putAll(spec.environment());

        try {
            Process process = builder.start();
            log.info("Process started: node={}, pid={}, output={}", spec.node(), process.pid(), spec.outputFile());
            return new OsProcessHandle(process);
        } catch (IOException e) {
            throw new ProcessStartException(spec.node(), e.getMessage(), e);
        }
    }

    /**
     * Sibling of the step's output file that receives the srun client's own output,
     * e.g. {@code frontend_42.log} gives {@code frontend_42.srun.log}.
     */
    static Path clientLogFile(Path outputFile) {
        String name = outputFile.getFileName().toString();
        String base = name.endsWith(".log") ? name.substring(0, name.length() - ".log".length()) : name;
        return outputFile.resolveSibling(base + ".srun.log");
    }

    /**
     * Builds the full srun invocation for a spec.
     */
    public List<String> buildCommand(LaunchSpec spec) {
        List<String> command = new ArrayList<>();
        command.add("srun");
        command.add("--overlap");
        command.add("--nodes=1");
        command.add("--ntasks=1");
        command.add("--nodelist=" + spec.node());
        command.add("--output=" + spec.outputFile());

        if (spec.containerImage() != null) {
            command.add("--container-image=" + spec.containerImage());
            command.add("--no-container-entrypoint");
            command.add("--no-container-mount-home");
            if (!spec.containerMounts().isEmpty()) {
                command.add("--container-mounts=" + spec.containerMounts().entrySet().stream()
                        .map(e -> e.getKey() + ":" + e.getValue())
                        .collect(Collectors.joining(",")));
            }
        }

        // srun passes the caller's environment, including the variables set on the builder
        command.add("--export=ALL");
        command.addAll(spec.command());
        return command;
    }
}
