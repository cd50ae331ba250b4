package fr.lapetina.inference.sweep.infrastructure.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Owner of every managed process of a run.
 *
 * Once added, a process handle is only polled and signalled through this registry. All access to
 * the process map, including polling and termination, happens under one lock shared by the
 * orchestrator thread, the monitor thread and the shutdown hook.
 */
public final class ProcessRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProcessRegistry.class);

    static final int LOG_TAIL_LINES = 20;
    private static final Duration EXIT_POLL_INTERVAL = Duration.ofMillis(100);
    private static final Duration KILL_WAIT = Duration.ofSeconds(5);

    private final String jobId;
    private final Duration gracePeriod;
    private final Map<String, ManagedProcess> processes = new LinkedHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final List<Consumer<ManagedProcess>> terminationListeners = new CopyOnWriteArrayList<>();

    public ProcessRegistry(String jobId, Duration gracePeriod) {
        this.jobId = jobId;
        this.gracePeriod = gracePeriod;
    }

    public String getJobId() {
        return jobId;
    }

    /**
     * Registers a process under its name.
     *
     * @throws IllegalStateException if the name is already registered
     */
    public void add(ManagedProcess process) {
        lock.lock();
        try {
            if (processes.containsKey(process.getName())) {
                throw new IllegalStateException("Process already registered: " + process.getName());
            }
            processes.put(process.getName(), process);
            log.info("Process registered: name={}, node={}, critical={}, log={}",
                    process.getName(), process.getNode(), process.isCritical(), process.getLogFile());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Registers several processes. Nothing is registered if any name collides.
     *
     * @throws IllegalStateException on a name collision or a key that is not the process name
     */
    public void addAll(Map<String, ManagedProcess> named) {
        lock.lock();
        try {
            for (Map.Entry<String, ManagedProcess> entry : named.entrySet()) {
                if (!entry.getKey().equals(entry.getValue().getName())) {
                    throw new IllegalStateException("Key " + entry.getKey()
                            + " does not match process name " + entry.getValue().getName());
                }
                if (processes.containsKey(entry.getKey())) {
                    throw new IllegalStateException("Process already registered: " + entry.getKey());
                }
            }
            named.values().forEach(this::add);
        } finally {
            lock.unlock();
        }
    }

    public Optional<ManagedProcess> get(String name) {
        lock.lock();
        try {
            return Optional.ofNullable(processes.get(name));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Snapshot of all processes in registration order.
     */
    public List<ManagedProcess> getProcesses() {
        lock.lock();
        try {
            return new ArrayList<>(processes.values());
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return processes.size();
        } finally {
            lock.unlock();
        }
    }

    public int runningCount() {
        return (int) getProcesses().stream()
                .filter(p -> p.getStatus().isRunning())
                .count();
    }

    /**
     * Polls every process without blocking.
     *
     * @return true if at least one critical process has failed
     */
    public boolean checkFailures() {
        lock.lock();
        try {
            boolean criticalFailure = false;
            for (ManagedProcess process : processes.values()) {
                try {
                    if (process.refresh()) {
                        onExited(process);
                    }
                } catch (RuntimeException e) {
                    log.warn("Failed to poll process: name={}, error={}", process.getName(), e.getMessage());
                    continue;
                }
                if (process.isCritical() && process.isFailed()) {
                    criticalFailure = true;
                }
            }
            return criticalFailure;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops every process that is still running: graceful signal first, then a forced kill for
     * whatever survives the grace period. Idempotent, never throws.
     */
    public void cleanup() {
        lock.lock();
        try {
            List<ManagedProcess> running = new ArrayList<>();
            for (ManagedProcess process : processes.values()) {
                try {
                    if (process.refresh()) {
                        onExited(process);
                    }
                } catch (RuntimeException e) {
                    log.warn("Failed to poll process during cleanup: name={}, error={}",
                            process.getName(), e.getMessage());
                }
                if (process.getStatus().isRunning()) {
                    running.add(process);
                }
            }

            if (running.isEmpty()) {
                log.debug("Cleanup: no running processes, jobId={}", jobId);
                return;
            }

            log.info("Cleanup: terminating {} running processes, gracePeriod={}", running.size(), gracePeriod);
            for (ManagedProcess process : running) {
                signal(process, "terminate", RemoteProcessHandle::terminate);
            }

            awaitExit(running, gracePeriod);

            List<ManagedProcess> killed = new ArrayList<>();
            for (ManagedProcess process : running) {
                if (isAlive(process)) {
                    log.warn("Process survived grace period, killing: name={}, node={}",
                            process.getName(), process.getNode());
                    signal(process, "kill", RemoteProcessHandle::kill);
                    killed.add(process);
                }
            }
            if (!killed.isEmpty()) {
                awaitExit(killed, gracePeriod.compareTo(KILL_WAIT) < 0 ? gracePeriod : KILL_WAIT);
            }

            int stopped = 0;
            for (ManagedProcess process : running) {
                if (isAlive(process)) {
                    // left RUNNING so the next cleanup signals it again
                    log.warn("Process still alive after kill: name={}, node={}",
                            process.getName(), process.getNode());
                    continue;
                }
                stopped++;
                if (process.markKilled()) {
                    notifyListeners(process);
                }
            }
            log.info("Cleanup complete: jobId={}, stopped={}, survivors={}",
                    jobId, stopped, running.size() - stopped);
        } catch (RuntimeException e) {
            log.warn("Cleanup error, continuing: jobId={}", jobId, e);
        } finally {
            lock.unlock();
        }
    }

    private void awaitExit(List<ManagedProcess> running, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (running.stream().anyMatch(this::isAlive)) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return;
            }
            try {
                Thread.sleep(Math.min(EXIT_POLL_INTERVAL.toMillis(), Math.max(1, remaining / 1_000_000)));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted during grace period, killing remaining processes");
                return;
            }
        }
    }

    private boolean isAlive(ManagedProcess process) {
        try {
            return process.getHandle().isAlive();
        } catch (RuntimeException e) {
            log.warn("Liveness check failed: name={}, error={}", process.getName(), e.getMessage());
            return false;
        }
    }

    private void signal(ManagedProcess process, String action, Consumer<RemoteProcessHandle> signal) {
        try {
            signal.accept(process.getHandle());
            log.debug("Process signalled: name={}, action={}", process.getName(), action);
        } catch (RuntimeException e) {
            log.warn("Failed to {} process: name={}, node={}, error={}",
                    action, process.getName(), process.getNode(), e.getMessage());
        }
    }

    /**
     * Collects and logs every process in a failed state.
     */
    public List<FailureReport> reportFailures() {
        List<ManagedProcess> failed = getProcesses().stream()
                .filter(ManagedProcess::isFailed)
                .toList();

        if (failed.isEmpty()) {
            log.info("No failed processes recorded: jobId={}", jobId);
            return List.of();
        }

        List<FailureReport> reports = new ArrayList<>(failed.size());
        log.error("{} process(es) failed in job {}", failed.size(), jobId);
        for (ManagedProcess process : failed) {
            FailureReport report = new FailureReport(
                    process.getName(),
                    process.getNode(),
                    process.getLogFile(),
                    process.getStatus(),
                    readTail(process.getLogFile(), LOG_TAIL_LINES)
            );
            reports.add(report);

            log.error("Failed process: name={}, node={}, status={}, log={}",
                    report.name(), report.node(), report.status(), report.logFile());
            for (String line : report.logTail()) {
                log.error("  | {}", line);
            }
        }
        return reports;
    }

    static List<String> readTail(Path file, int maxLines) {
        if (!Files.isReadable(file)) {
            return List.of();
        }
        Deque<String> tail = new ArrayDeque<>(maxLines);
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(Files.newInputStream(file), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (tail.size() == maxLines) {
                    tail.removeFirst();
                }
                tail.addLast(line);
            }
        } catch (IOException e) {
            log.warn("Cannot read log file: path={}, error={}", file, e.getMessage());
            return List.of();
        }
        return new ArrayList<>(tail);
    }

    /**
     * Adds a listener called once per process when it reaches a terminal state.
     */
    public void addTerminationListener(Consumer<ManagedProcess> listener) {
        terminationListeners.add(listener);
    }

    private void onExited(ManagedProcess process) {
        if (process.isFailed()) {
            log.error("Process failed: name={}, node={}, critical={}, status={}, log={}",
                    process.getName(), process.getNode(), process.isCritical(),
                    process.getStatus(), process.getLogFile());
        } else {
            log.info("Process completed: name={}, node={}, status={}",
                    process.getName(), process.getNode(), process.getStatus());
        }
        notifyListeners(process);
    }

    private void notifyListeners(ManagedProcess process) {
        for (Consumer<ManagedProcess> listener : terminationListeners) {
            try {
                listener.accept(process);
            } catch (Exception e) {
                log.error("Error notifying termination listener", e);
            }
        }
    }
}
