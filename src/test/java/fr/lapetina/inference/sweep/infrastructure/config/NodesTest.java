package fr.lapetina.inference.sweep.infrastructure.config;

import fr.lapetina.inference.sweep.exception.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NodesTest {

    @Test
    @DisplayName("should use the first machine as head and benchmark node")
    void shouldShareFirstNode() {
        Nodes nodes = Nodes.fromNodeList(List.of("n1", "n2", "n3"), false);

        assertThat(nodes.head()).isEqualTo("n1");
        assertThat(nodes.bench()).isEqualTo("n1");
        assertThat(nodes.workers()).containsExactly("n1", "n2", "n3");
    }

    @Test
    @DisplayName("should reserve the first machine for the benchmark when asked")
    void shouldReserveBenchmarkNode() {
        Nodes nodes = Nodes.fromNodeList(List.of("n1", "n2", "n3"), true);

        assertThat(nodes.bench()).isEqualTo("n1");
        assertThat(nodes.head()).isEqualTo("n2");
        assertThat(nodes.workers()).containsExactly("n2", "n3");
    }

    @Test
    @DisplayName("should drop duplicate machines keeping the first occurrence")
    void shouldDeduplicate() {
        Nodes nodes = Nodes.fromNodeList(List.of("n2", "n1", "n2", "n3", "n1"), false);

        assertThat(nodes.workers()).containsExactly("n2", "n1", "n3");
    }

    @Test
    @DisplayName("should fail without machines")
    void shouldRejectEmptyList() {
        assertThatThrownBy(() -> Nodes.fromNodeList(List.of(), false))
                .isInstanceOf(ConfigurationException.class);
        assertThatThrownBy(() -> Nodes.fromNodeList(List.of("n1"), true))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("at least 2");
    }
}
