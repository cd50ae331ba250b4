package fr.lapetina.inference.sweep.infrastructure.process;

import java.util.OptionalInt;

/**
 * {@link RemoteProcessHandle} over a local {@link Process}. For srun-launched processes the local
 * process is the srun client, which forwards signals to the remote task.
 */
public final class OsProcessHandle implements RemoteProcessHandle {

    private final Process process;

    public OsProcessHandle(Process process) {
        this.process = process;
    }

    @Override
    public boolean isAlive() {
        return process.isAlive();
    }

    @Override
    public OptionalInt exitCode() {
        if (process.isAlive()) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(process.exitValue());
    }

    @Override
    public void terminate() {
        process.destroy();
    }

    @Override
    public void kill() {
        process.destroyForcibly();
    }

    public long pid() {
        return process.pid();
    }

    @Override
    public String toString() {
        return "OsProcessHandle{pid=" + process.pid() + ", alive=" + process.isAlive() + '}';
    }
}
