package fr.lapetina.inference.sweep.backend;

import java.util.List;

/**
 * Frontend process to start on the head machine.
 *
 * @param name      registry name
 * @param logPrefix log file name before {@code _<jobId>.log}
 * @param command   program and arguments
 */
public record FrontendLaunch(String name, String logPrefix, List<String> command) {

    public FrontendLaunch {
        command = List.copyOf(command);
    }
}
