package fr.lapetina.inference.sweep.infrastructure.process;

import fr.lapetina.inference.sweep.domain.model.ProcessStatus;

import java.nio.file.Path;
import java.util.List;

/**
 * Diagnostic summary of a failed process.
 *
 * @param name    registry name
 * @param node    machine it ran on
 * @param logFile its output file
 * @param status  terminal status, including the exit code
 * @param logTail last lines of the output file, empty if unreadable
 */
public record FailureReport(
        String name,
        String node,
        Path logFile,
        ProcessStatus status,
        List<String> logTail
) {
    public FailureReport {
        logTail = List.copyOf(logTail);
    }
}
