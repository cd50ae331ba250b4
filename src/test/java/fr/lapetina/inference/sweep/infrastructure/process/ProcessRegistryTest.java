package fr.lapetina.inference.sweep.infrastructure.process;

import fr.lapetina.inference.sweep.domain.model.ProcessState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProcessRegistryTest {

    @TempDir
    Path logDir;

    private ProcessRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ProcessRegistry("4242", Duration.ofMillis(200));
    }

    private ManagedProcess add(String name, FakeProcessHandle handle, boolean critical) {
        ManagedProcess process = ManagedProcess.builder()
                .name(name)
                .node("n1")
                .handle(handle)
                .logFile(logDir.resolve(name + ".log"))
                .critical(critical)
                .build();
        registry.add(process);
        return process;
    }

    @Nested
    @DisplayName("Registration")
    class Registration {

        @Test
        @DisplayName("should keep processes in registration order")
        void shouldKeepOrder() {
            add("head_infrastructure", FakeProcessHandle.running(), true);
            add("prefill_0_n1", FakeProcessHandle.running(), true);
            add("frontend", FakeProcessHandle.running(), true);

            assertThat(registry.getProcesses()).extracting(ManagedProcess::getName)
                    .containsExactly("head_infrastructure", "prefill_0_n1", "frontend");
            assertThat(registry.size()).isEqualTo(3);
            assertThat(registry.get("frontend")).isPresent();
            assertThat(registry.getJobId()).isEqualTo("4242");
        }

        @Test
        @DisplayName("should reject a duplicate name")
        void shouldRejectDuplicateName() {
            add("frontend", FakeProcessHandle.running(), true);

            assertThatThrownBy(() -> add("frontend", FakeProcessHandle.running(), true))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("frontend");
        }

        @Test
        @DisplayName("should register nothing from a batch containing a collision")
        void shouldRegisterBatchAtomically() {
            add("decode_0_n2", FakeProcessHandle.running(), true);

            Map<String, ManagedProcess> batch = new LinkedHashMap<>();
            for (String name : List.of("decode_1_n3", "decode_0_n2")) {
                batch.put(name, ManagedProcess.builder()
                        .name(name).node("n").handle(FakeProcessHandle.running())
                        .logFile(logDir.resolve(name + ".log")).build());
            }

            assertThatThrownBy(() -> registry.addAll(batch)).isInstanceOf(IllegalStateException.class);
            assertThat(registry.size()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Failure detection")
    class FailureDetection {

        @Test
        @DisplayName("should report no failure while everything runs")
        void shouldReportNoFailureWhileRunning() {
            add("prefill_0_n1", FakeProcessHandle.running(), true);
            add("decode_0_n2", FakeProcessHandle.running(), true);

            assertThat(registry.checkFailures()).isFalse();
        }

        @Test
        @DisplayName("should ignore a non-critical process completing with code 0")
        void shouldIgnoreCleanNonCriticalExit() {
            add("prefill_0_n1", FakeProcessHandle.running(), true);
            add("benchmark", FakeProcessHandle.exited(0), false);

            assertThat(registry.checkFailures()).isFalse();
            assertThat(registry.get("benchmark").orElseThrow().getStatus().state()).isEqualTo(ProcessState.EXITED);
        }

        @Test
        @DisplayName("should detect a critical process exiting with a non-zero code")
        void shouldDetectCriticalNonZeroExit() {
            FakeProcessHandle handle = FakeProcessHandle.running();
            add("decode_0_n2", handle, true);
            assertThat(registry.checkFailures()).isFalse();

            handle.exit(1);

            assertThat(registry.checkFailures()).isTrue();
            assertThat(registry.checkFailures()).isTrue();
        }

        @Test
        @DisplayName("should detect a long-running critical process exiting with code 0")
        void shouldDetectCriticalCleanExit() {
            add("frontend", FakeProcessHandle.exited(0), true);

            assertThat(registry.checkFailures()).isTrue();
        }

        @Test
        @DisplayName("should not escalate a failed non-critical process")
        void shouldNotEscalateNonCriticalFailure() {
            add("benchmark", FakeProcessHandle.exited(3), false);

            assertThat(registry.checkFailures()).isFalse();
            assertThat(registry.get("benchmark").orElseThrow().isFailed()).isTrue();
        }

        @Test
        @DisplayName("should notify termination listeners once per process")
        void shouldNotifyListenersOnce() {
            List<String> terminated = new ArrayList<>();
            registry.addTerminationListener(p -> terminated.add(p.getName()));
            FakeProcessHandle handle = FakeProcessHandle.running();
            add("decode_0_n2", handle, true);

            handle.exit(1);
            registry.checkFailures();
            registry.checkFailures();
            registry.cleanup();

            assertThat(terminated).containsExactly("decode_0_n2");
        }
    }

    @Nested
    @DisplayName("Cleanup")
    class Cleanup {

        @Test
        @DisplayName("should terminate running processes and skip exited ones")
        void shouldTerminateRunningOnly() {
            FakeProcessHandle running = FakeProcessHandle.running();
            FakeProcessHandle exited = FakeProcessHandle.exited(1);
            add("prefill_0_n1", running, true);
            add("decode_0_n2", exited, true);

            registry.cleanup();

            assertThat(running.terminateCalls()).isEqualTo(1);
            assertThat(running.killCalls()).isZero();
            assertThat(exited.signalCount()).isZero();
            assertThat(registry.get("prefill_0_n1").orElseThrow().getStatus().state()).isEqualTo(ProcessState.KILLED);
            assertThat(registry.get("decode_0_n2").orElseThrow().getStatus().state()).isEqualTo(ProcessState.EXITED);
            assertThat(registry.runningCount()).isZero();
        }

        @Test
        @DisplayName("should force-kill processes surviving the grace period")
        void shouldKillSurvivors() {
            FakeProcessHandle stubborn = FakeProcessHandle.running().ignoringTerminate();
            add("frontend", stubborn, true);

            long start = System.nanoTime();
            registry.cleanup();
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

            assertThat(stubborn.terminateCalls()).isEqualTo(1);
            assertThat(stubborn.killCalls()).isEqualTo(1);
            assertThat(elapsed).isGreaterThanOrEqualTo(Duration.ofMillis(150));
        }

        @Test
        @DisplayName("should send no further signals on a second call")
        void shouldBeIdempotent() {
            FakeProcessHandle first = FakeProcessHandle.running();
            FakeProcessHandle second = FakeProcessHandle.running().ignoringTerminate();
            add("prefill_0_n1", first, true);
            add("decode_0_n2", second, true);

            registry.cleanup();
            int signals = first.signalCount() + second.signalCount();
            registry.cleanup();

            assertThat(first.signalCount() + second.signalCount()).isEqualTo(signals);
        }

        @Test
        @DisplayName("should never throw when signalling fails")
        void shouldNeverThrow() {
            FakeProcessHandle broken = FakeProcessHandle.running()
                    .failingSignals(new IllegalStateException("srun gone"));
            FakeProcessHandle healthy = FakeProcessHandle.running();
            add("prefill_0_n1", broken, true);
            add("decode_0_n2", healthy, true);

            assertThatCode(registry::cleanup).doesNotThrowAnyException();
            assertThat(healthy.terminateCalls()).isEqualTo(1);
            assertThat(broken.killCalls()).isEqualTo(1);
        }

        @Test
        @DisplayName("should leave a process that survives the kill running and retry it on the next call")
        void shouldRetrySurvivors() {
            FakeProcessHandle unkillable = FakeProcessHandle.running()
                    .failingSignals(new IllegalStateException("srun gone"));
            ManagedProcess process = add("frontend", unkillable, true);
            List<ManagedProcess> notified = new ArrayList<>();
            registry.addTerminationListener(notified::add);

            registry.cleanup();
            int signalsAfterFirst = unkillable.signalCount();

            assertThat(process.getStatus().state()).isEqualTo(ProcessState.RUNNING);
            assertThat(registry.runningCount()).isEqualTo(1);
            assertThat(notified).isEmpty();

            registry.cleanup();

            assertThat(unkillable.signalCount()).isGreaterThan(signalsAfterFirst);
            assertThat(process.getStatus().state()).isEqualTo(ProcessState.RUNNING);
        }

        @Test
        @DisplayName("should mark a process killed once it is gone")
        void shouldMarkKilledOnceGone() {
            FakeProcessHandle unkillable = FakeProcessHandle.running()
                    .failingSignals(new IllegalStateException("srun gone"));
            ManagedProcess process = add("frontend", unkillable, true);

            registry.cleanup();
            unkillable.exit(137);
            registry.cleanup();

            assertThat(process.getStatus().state()).isIn(ProcessState.EXITED, ProcessState.KILLED);
            assertThat(registry.runningCount()).isZero();
        }

        @Test
        @DisplayName("should do nothing on an empty registry")
        void shouldHandleEmptyRegistry() {
            assertThatCode(registry::cleanup).doesNotThrowAnyException();
        }
    }

    @Nested
    @DisplayName("Failure report")
    class FailureReportTests {

        @Test
        @DisplayName("should list failed processes with their log tail")
        void shouldReportFailedProcesses() throws IOException {
            add("prefill_0_n1", FakeProcessHandle.running(), true);
            add("decode_0_n2", FakeProcessHandle.exited(137), true);
            String log = IntStream.rangeClosed(1, 30)
                    .mapToObj(i -> "line " + i)
                    .collect(Collectors.joining("\n"));
            Files.writeString(logDir.resolve("decode_0_n2.log"), log);
            registry.checkFailures();

            List<FailureReport> reports = registry.reportFailures();

            assertThat(reports).hasSize(1);
            FailureReport report = reports.get(0);
            assertThat(report.name()).isEqualTo("decode_0_n2");
            assertThat(report.node()).isEqualTo("n1");
            assertThat(report.logFile()).isEqualTo(logDir.resolve("decode_0_n2.log"));
            assertThat(report.status().exitCode()).isEqualTo(137);
            assertThat(report.logTail()).hasSize(ProcessRegistry.LOG_TAIL_LINES);
            assertThat(report.logTail()).first().isEqualTo("line 11");
            assertThat(report.logTail()).last().isEqualTo("line 30");
        }

        @Test
        @DisplayName("should report a missing log file as an empty tail")
        void shouldTolerateMissingLog() {
            add("frontend", FakeProcessHandle.exited(1), true);
            registry.checkFailures();

            assertThat(registry.reportFailures()).singleElement()
                    .satisfies(r -> assertThat(r.logTail()).isEmpty());
        }

        @Test
        @DisplayName("should report nothing when no process failed")
        void shouldReportNothing() {
            add("benchmark", FakeProcessHandle.exited(0), false);
            registry.cleanup();

            assertThat(registry.reportFailures()).isEmpty();
        }
    }
}
