package fr.lapetina.inference.sweep.infrastructure.process;

import java.util.OptionalInt;

/**
 * Handle on a process started on some machine.
 *
 * Implementations must be safe to call from the monitor thread and the orchestrator thread,
 * although {@link ProcessRegistry} serializes all calls in practice.
 */
public interface RemoteProcessHandle {

    /**
     * Non-blocking liveness check.
     */
    boolean isAlive();

    /**
     * Exit code once the process has terminated, empty while it runs.
     */
    OptionalInt exitCode();

    /**
     * Asks the process to stop (SIGTERM).
     */
    void terminate();

    /**
     * Stops the process unconditionally (SIGKILL).
     */
    void kill();
}
