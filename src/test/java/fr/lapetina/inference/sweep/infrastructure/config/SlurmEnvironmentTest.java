package fr.lapetina.inference.sweep.infrastructure.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SlurmEnvironmentTest {

    @Test
    @DisplayName("should read the job id from SLURM_JOB_ID first")
    void shouldReadJobId() {
        SlurmEnvironment env = new SlurmEnvironment(Map.of("SLURM_JOB_ID", "1234", "SLURM_JOBID", "999"));

        assertThat(env.jobId()).contains("1234");
    }

    @Test
    @DisplayName("should fall back to SLURM_JOBID")
    void shouldFallBackToLegacyVariable() {
        SlurmEnvironment env = new SlurmEnvironment(Map.of("SLURM_JOB_ID", " ", "SLURM_JOBID", "999"));

        assertThat(env.jobId()).contains("999");
    }

    @Test
    @DisplayName("should have no job id outside an allocation")
    void shouldHaveNoJobIdOutsideAllocation() {
        assertThat(new SlurmEnvironment(Map.of()).jobId()).isEmpty();
        assertThat(new SlurmEnvironment(Map.of()).nodeList()).isEmpty();
    }

    @Test
    @DisplayName("should expand a plain comma separated node list")
    void shouldExpandPlainNodeList() {
        SlurmEnvironment env = new SlurmEnvironment(Map.of("SLURM_NODELIST", "gpu-01,gpu-02"));

        assertThat(env.nodeList()).containsExactly("gpu-01", "gpu-02");
    }

    @Test
    @DisplayName("should fall back to the raw node list when expansion hangs")
    void shouldFallBackWhenExpansionHangs() {
        // "sleep 30" stands in for an scontrol that never returns
        SlurmEnvironment env = new SlurmEnvironment(
                Map.of("SLURM_NODELIST", "30"), List.of("sleep"), Duration.ofMillis(200));

        long start = System.nanoTime();
        List<String> nodes = env.nodeList();
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

        assertThat(nodes).containsExactly("30");
        assertThat(elapsed).isLessThan(Duration.ofSeconds(10));
    }

    @Test
    @DisplayName("should fall back to the raw node list when the expander exits non-zero")
    void shouldFallBackOnExpanderFailure() {
        SlurmEnvironment env = new SlurmEnvironment(
                Map.of("SLURM_NODELIST", "gpu-01,gpu-02"), List.of("false"), Duration.ofSeconds(5));

        assertThat(env.nodeList()).containsExactly("gpu-01", "gpu-02");
    }

    @Test
    @DisplayName("should parse scontrol output ignoring blank lines")
    void shouldParseHostnames() {
        assertThat(SlurmEnvironment.parseHostnames("gpu-01\n\n  gpu-02  \r\ngpu-03\n"))
                .containsExactly("gpu-01", "gpu-02", "gpu-03");
    }
}
