package fr.lapetina.inference.sweep.orchestrator;

/**
 * Stages of a sweep run, in execution order.
 *
 * Any failure before CLEANUP jumps straight to CLEANUP, which always runs once and ends in
 * SUCCESS or FAILED.
 */
public enum SweepStage {
    INIT,
    HEAD_INFRASTRUCTURE,
    WORKERS,
    FRONTEND,
    BENCHMARK,
    CLEANUP,
    SUCCESS,
    FAILED;

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED;
    }
}
