package fr.lapetina.inference.sweep.infrastructure.process;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SrunProcessLauncherTest {

    private final SrunProcessLauncher launcher = new SrunProcessLauncher();

    @Test
    @DisplayName("should wrap the command in a single-task srun step on the target node")
    void shouldBuildContainerizedStep() {
        Map<Path, Path> mounts = new LinkedHashMap<>();
        mounts.put(Path.of("/lustre/models/r1"), Path.of("/model"));
        mounts.put(Path.of("/home/me/logs/42"), Path.of("/logs"));
        LaunchSpec spec = new LaunchSpec(
                "gpu-03",
                List.of("python3", "-m", "dynamo.frontend", "--http-port=8000"),
                Path.of("/home/me/logs/42/frontend_42.log"),
                Map.of("NATS_SERVER", "nats://gpu-01:4222"),
                "/containers/sglang.sqsh",
                mounts
        );

        List<String> command = launcher.buildCommand(spec);

        assertThat(command).containsExactly(
                "srun",
                "--overlap",
                "--nodes=1",
                "--ntasks=1",
                "--nodelist=gpu-03",
                "--output=/home/me/logs/42/frontend_42.log",
                "--container-image=/containers/sglang.sqsh",
                "--no-container-entrypoint",
                "--no-container-mount-home",
                "--container-mounts=/lustre/models/r1:/model,/home/me/logs/42:/logs",
                "--export=ALL",
                "python3", "-m", "dynamo.frontend", "--http-port=8000"
        );
    }

    @Test
    @DisplayName("should keep srun client output out of the step's output file")
    void shouldSeparateClientLog() {
        Path output = Path.of("/home/me/logs/42/frontend_42.log");

        Path clientLog = SrunProcessLauncher.clientLogFile(output);

        assertThat(clientLog).isEqualTo(Path.of("/home/me/logs/42/frontend_42.srun.log"));
        assertThat(clientLog).isNotEqualTo(output);
        assertThat(SrunProcessLauncher.clientLogFile(Path.of("/tmp/out")))
                .isEqualTo(Path.of("/tmp/out.srun.log"));
    }

    @Test
    @DisplayName("should omit container options without an image")
    void shouldOmitContainerOptions() {
        LaunchSpec spec = new LaunchSpec("n1", List.of("hostname"), Path.of("/tmp/out.log"),
                Map.of(), null, Map.of(Path.of("/a"), Path.of("/b")));

        List<String> command = launcher.buildCommand(spec);

        assertThat(command).noneMatch(arg -> arg.startsWith("--container"));
        assertThat(command).endsWith("--export=ALL", "hostname");
    }
}
