package fr.lapetina.inference.sweep.infrastructure.process;

import fr.lapetina.inference.sweep.exception.ProcessStartException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisabledOnOs(OS.WINDOWS)
class LocalProcessLauncherTest {

    @TempDir
    Path logDir;

    private final LocalProcessLauncher launcher = new LocalProcessLauncher();

    private static void awaitExit(RemoteProcessHandle handle) throws InterruptedException {
        long deadline = System.nanoTime() + Duration.ofSeconds(10).toNanos();
        while (handle.isAlive() && System.nanoTime() < deadline) {
            Thread.sleep(20);
        }
    }

    @Test
    @DisplayName("should report the exit code of a finished process")
    void shouldReportExitCode() throws Exception {
        LaunchSpec spec = new LaunchSpec("localhost", List.of("sh", "-c", "echo \"$SWEEP_MARKER\"; exit 3"),
                logDir.resolve("out.log"), Map.of("SWEEP_MARKER", "hello"), null, Map.of());

        RemoteProcessHandle handle = launcher.start(spec);
        awaitExit(handle);

        assertThat(handle.isAlive()).isFalse();
        assertThat(handle.exitCode()).hasValue(3);
        assertThat(Files.readString(logDir.resolve("out.log"))).contains("hello");
    }

    @Test
    @DisplayName("should stop a running process with the graceful signal")
    void shouldTerminateRunningProcess() throws Exception {
        LaunchSpec spec = new LaunchSpec("localhost", List.of("sleep", "30"),
                logDir.resolve("sleep.log"), Map.of(), null, Map.of());

        RemoteProcessHandle handle = launcher.start(spec);
        assertThat(handle.isAlive()).isTrue();
        assertThat(handle.exitCode()).isEmpty();

        handle.terminate();
        awaitExit(handle);

        assertThat(handle.isAlive()).isFalse();
    }

    @Test
    @DisplayName("should surface a missing program as a start failure")
    void shouldFailForMissingProgram() {
        LaunchSpec spec = new LaunchSpec("localhost", List.of("/nonexistent/sweep-binary"),
                logDir.resolve("missing.log"), Map.of(), null, Map.of());

        assertThatThrownBy(() -> launcher.start(spec))
                .isInstanceOfSatisfying(ProcessStartException.class,
                        e -> assertThat(e.getNode()).isEqualTo("localhost"));
    }
}
