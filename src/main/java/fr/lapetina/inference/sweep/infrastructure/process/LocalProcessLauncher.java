package fr.lapetina.inference.sweep.infrastructure.process;

import fr.lapetina.inference.sweep.exception.ProcessStartException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Runs every process on this machine, ignoring the target node and container settings.
 * Meant for development runs on a single workstation.
 */
public final class LocalProcessLauncher implements RemoteProcessLauncher {

    private static final Logger log = LoggerFactory.getLogger(LocalProcessLauncher.class);

    @Override
    public RemoteProcessHandle start(LaunchSpec spec) {
        ProcessBuilder builder = new ProcessBuilder(spec.command())
                .redirectErrorStream(true)
                .redirectOutput(ProcessBuilder.Redirect.appendTo(spec.outputFile().toFile()));
        builder.environment().putAll(spec.environment());

        try {
            Process process = builder.start();
            log.info("Local process started: requestedNode={}, pid={}, output={}",
                    spec.node(), process.pid(), spec.outputFile());
            return new OsProcessHandle(process);
        } catch (IOException e) {
            throw new ProcessStartException(spec.node(), e.getMessage(), e);
        }
    }
}
