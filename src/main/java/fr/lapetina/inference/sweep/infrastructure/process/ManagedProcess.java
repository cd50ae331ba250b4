package fr.lapetina.inference.sweep.infrastructure.process;

import fr.lapetina.inference.sweep.domain.model.ProcessState;
import fr.lapetina.inference.sweep.domain.model.ProcessStatus;

import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A running process tracked by the {@link ProcessRegistry}.
 *
 * Status only moves out of RUNNING, once, to EXITED or KILLED.
 * Thread-safe for concurrent polling from the monitor and the orchestrator.
 */
public final class ManagedProcess {

    private final String name;
    private final String node;
    private final RemoteProcessHandle handle;
    private final Path logFile;
    private final boolean critical;

    private final AtomicReference<ProcessStatus> status = new AtomicReference<>(ProcessStatus.RUNNING);

    private ManagedProcess(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "Process name is required");
        this.node = Objects.requireNonNull(builder.node, "Node is required");
        this.handle = Objects.requireNonNull(builder.handle, "Process handle is required");
        this.logFile = Objects.requireNonNull(builder.logFile, "Log file is required");
        this.critical = builder.critical;
    }

    public String getName() {
        return name;
    }

    public String getNode() {
        return node;
    }

    public Path getLogFile() {
        return logFile;
    }

    public boolean isCritical() {
        return critical;
    }

    public ProcessStatus getStatus() {
        return status.get();
    }

    RemoteProcessHandle getHandle() {
        return handle;
    }

    /**
     * Observes the handle without blocking.
     *
     * @return true if this call moved the process from RUNNING to EXITED
     */
    boolean refresh() {
        if (status.get().isTerminal() || handle.isAlive()) {
            return false;
        }
        int exitCode = handle.exitCode().orElse(-1);
        return status.compareAndSet(ProcessStatus.RUNNING, ProcessStatus.exited(exitCode));
    }

    /**
     * Records that cleanup stopped the process.
     *
     * @return true if the process was still RUNNING
     */
    boolean markKilled() {
        Integer exitCode = handle.exitCode().isPresent() ? handle.exitCode().getAsInt() : null;
        return status.compareAndSet(ProcessStatus.RUNNING, ProcessStatus.killed(exitCode));
    }

    /**
     * A process has failed when it exited on its own with a non-zero code, or exited at all
     * while being critical. Processes stopped by cleanup never count as failed.
     */
    public boolean isFailed() {
        ProcessStatus current = status.get();
        return current.state() == ProcessState.EXITED && (critical || current.exitCode() != 0);
    }

    @Override
    public String toString() {
        return "ManagedProcess{" +
                "name='" + name + '\'' +
                ", node='" + node + '\'' +
                ", critical=" + critical +
                ", status=" + status.get() +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String name;
        private String node;
        private RemoteProcessHandle handle;
        private Path logFile;
        private boolean critical = true;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder node(String node) {
            this.node = node;
            return this;
        }

        public Builder handle(RemoteProcessHandle handle) {
            this.handle = handle;
            return this;
        }

        public Builder logFile(Path logFile) {
            this.logFile = logFile;
            return this;
        }

        public Builder critical(boolean critical) {
            this.critical = critical;
            return this;
        }

        public ManagedProcess build() {
            return new ManagedProcess(this);
        }
    }
}
