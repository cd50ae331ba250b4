package fr.lapetina.inference.sweep.domain.model;

/**
 * Lifecycle state of a managed process.
 *
 * RUNNING: still alive as far as the last poll knows
 * EXITED: terminated on its own with an exit code
 * KILLED: terminated by cleanup (graceful signal or forced kill)
 */
public enum ProcessState {
    RUNNING,
    EXITED,
    KILLED
}
