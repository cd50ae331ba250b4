package fr.lapetina.inference.sweep.infrastructure.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class RuntimeContextTest {

    private static final LocalDateTime STARTED_AT = LocalDateTime.of(2024, 1, 2, 3, 4, 5);

    @TempDir
    Path logBase;

    private SweepConfig config(int prefillWorkers, int decodeWorkers, int aggWorkers) {
        SweepConfig config = new SweepConfig();
        config.setName("sweep");
        config.setLogDirBase(logBase.toString());
        config.getModel().setPath("/models/llama");
        config.getResources().setPrefillWorkers(prefillWorkers);
        config.getResources().setDecodeWorkers(decodeWorkers);
        config.getResources().setAggWorkers(aggWorkers);
        config.setExtraMounts(List.of("/data/sets:/datasets"));
        config.setEnvironment(Map.of("HF_HOME", "/cache"));
        return config;
    }

    private RuntimeContext create(SweepConfig config) {
        Nodes nodes = Nodes.fromNodeList(List.of("n1", "n2"), false);
        return RuntimeContext.create(config, "42", nodes, host -> "10.0.0." + host.substring(1), STARTED_AT);
    }

    @Test
    @DisplayName("should create the log and results directories")
    void shouldCreateDirectories() {
        RuntimeContext context = create(config(1, 2, 0));

        assertThat(context.logDir()).isEqualTo(logBase.toAbsolutePath().normalize()
                .resolve("42_1P_2D_20240102_030405"));
        assertThat(context.logDir()).isDirectory();
        assertThat(context.resultsDir()).isDirectory().isEqualTo(context.logDir().resolve("results"));
        assertThat(context.runName()).isEqualTo("sweep_42");
        assertThat(context.headNodeIp()).isEqualTo("10.0.0.1");
        assertThat(context.containerImage()).isNull();
        assertThat(context.environment()).containsEntry("HF_HOME", "/cache");
    }

    @Test
    @DisplayName("should compute the directories without creating them when asked not to")
    void shouldSkipDirectoryCreation() {
        Nodes nodes = Nodes.fromNodeList(List.of("n1", "n2"), false);

        RuntimeContext context = RuntimeContext.create(config(1, 2, 0), "42", nodes,
                HostResolver.identity(), STARTED_AT, false);

        assertThat(context.logDir()).isEqualTo(logBase.toAbsolutePath().normalize()
                .resolve("42_1P_2D_20240102_030405"));
        assertThat(context.logDir()).doesNotExist();
        assertThat(context.resultsDir()).doesNotExist();
    }

    @Test
    @DisplayName("should name the directory after the worker layout")
    void shouldNameDirectoryAfterLayout() {
        assertThat(create(config(0, 0, 3)).logDir().getFileName().toString()).startsWith("42_3A_");
        assertThat(create(config(2, 0, 0)).logDir().getFileName().toString()).startsWith("42_2P_1D_");
        assertThat(create(config(0, 0, 0)).logDir().getFileName().toString()).startsWith("42_1P_1D_");
    }

    @Test
    @DisplayName("should mount model, logs, results and extra paths")
    void shouldBuildMounts() {
        RuntimeContext context = create(config(1, 1, 0));

        assertThat(context.containerMounts()).containsExactly(
                Map.entry(Paths.get("/models/llama").toAbsolutePath().normalize(), Paths.get("/model")),
                Map.entry(context.logDir(), Paths.get("/logs")),
                Map.entry(context.resultsDir(), Paths.get("/results")),
                Map.entry(Paths.get("/data/sets").toAbsolutePath().normalize(), Paths.get("/datasets"))
        );
        assertThat(context.containerMountsSpec()).startsWith(context.modelPath() + ":/model,");
    }

    @Test
    @DisplayName("should substitute run placeholders and extra values")
    void shouldFormatTemplates() {
        RuntimeContext context = create(config(1, 1, 0));

        String formatted = context.format("{run_name} {head_node}:{http_port} {job_id} {unknown}",
                Map.of("http_port", "8000"));

        assertThat(formatted).isEqualTo("sweep_42 n1:8000 42 {unknown}");
        assertThat(context.format("{results_dir}/out.json", Map.of()))
                .isEqualTo(context.resultsDir() + "/out.json");
    }
}
