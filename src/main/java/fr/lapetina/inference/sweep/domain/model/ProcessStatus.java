package fr.lapetina.inference.sweep.domain.model;

import java.util.Objects;

/**
 * Observed status of a managed process. Transitions only leave {@link ProcessState#RUNNING}.
 *
 * @param state    lifecycle state
 * @param exitCode exit code for {@link ProcessState#EXITED}, last known code (if any) for
 *                 {@link ProcessState#KILLED}, null while running
 */
public record ProcessStatus(ProcessState state, Integer exitCode) {

    public static final ProcessStatus RUNNING = new ProcessStatus(ProcessState.RUNNING, null);

    public ProcessStatus {
        Objects.requireNonNull(state, "state is required");
        if (state == ProcessState.EXITED && exitCode == null) {
            throw new IllegalArgumentException("An exited process needs an exit code");
        }
    }

    public static ProcessStatus exited(int exitCode) {
        return new ProcessStatus(ProcessState.EXITED, exitCode);
    }

    public static ProcessStatus killed(Integer exitCode) {
        return new ProcessStatus(ProcessState.KILLED, exitCode);
    }

    public boolean isRunning() {
        return state == ProcessState.RUNNING;
    }

    public boolean isTerminal() {
        return state != ProcessState.RUNNING;
    }

    @Override
    public String toString() {
        return switch (state) {
            case RUNNING -> "Running";
            case EXITED -> "Exited(" + exitCode + ")";
            case KILLED -> exitCode == null ? "Killed" : "Killed(" + exitCode + ")";
        };
    }
}
