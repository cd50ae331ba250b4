package fr.lapetina.inference.sweep.lifecycle;

import fr.lapetina.inference.sweep.exception.CriticalProcessFailureException;
import fr.lapetina.inference.sweep.exception.SweepCancelledException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CancellationFlagTest {

    private final CancellationFlag flag = new CancellationFlag();

    @Test
    @DisplayName("should keep the first reason")
    void shouldKeepFirstReason() {
        assertThat(flag.isCancelled()).isFalse();

        assertThat(flag.cancel(CancellationReason.CRITICAL_FAILURE, "decode_0 died")).isTrue();
        assertThat(flag.cancel(CancellationReason.OPERATOR_INTERRUPT, "ctrl-c")).isFalse();

        assertThat(flag.isCancelled()).isTrue();
        assertThat(flag.getReason()).contains(CancellationReason.CRITICAL_FAILURE);
        assertThat(flag.getDetail()).contains("decode_0 died");
    }

    @Test
    @DisplayName("should wait the full timeout while not cancelled")
    void shouldWaitFullTimeout() {
        long start = System.nanoTime();

        assertThat(flag.await(Duration.ofMillis(100))).isFalse();

        assertThat(Duration.ofNanos(System.nanoTime() - start)).isGreaterThanOrEqualTo(Duration.ofMillis(90));
    }

    @Test
    @DisplayName("should return before the timeout once cancelled")
    void shouldWakeOnCancel() throws Exception {
        CompletableFuture<Boolean> waiter = CompletableFuture.supplyAsync(() -> flag.await(Duration.ofSeconds(30)));
        Thread.sleep(50);
        long start = System.nanoTime();

        flag.cancel(CancellationReason.OPERATOR_INTERRUPT, "test");

        assertThat(waiter.get(5, TimeUnit.SECONDS)).isTrue();
        assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("should treat a thread interrupt as an operator interrupt")
    void shouldTreatThreadInterruptAsCancellation() {
        Thread.currentThread().interrupt();
        try {
            assertThat(flag.await(Duration.ofSeconds(10))).isTrue();
            assertThat(flag.getReason()).contains(CancellationReason.OPERATOR_INTERRUPT);
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    @DisplayName("should map the reason to the matching exception")
    void shouldThrowMatchingException() {
        assertThatCode(() -> flag.throwIfCancelled("waiting")).doesNotThrowAnyException();

        CancellationFlag critical = new CancellationFlag();
        critical.cancel(CancellationReason.CRITICAL_FAILURE, "frontend exited");
        assertThatThrownBy(() -> critical.throwIfCancelled("waiting for etcd"))
                .isInstanceOf(CriticalProcessFailureException.class)
                .hasMessageContaining("waiting for etcd");

        flag.cancel(CancellationReason.OPERATOR_INTERRUPT, "SIGINT");
        assertThatThrownBy(() -> flag.throwIfCancelled("starting frontend"))
                .isInstanceOf(SweepCancelledException.class)
                .hasMessageContaining("SIGINT");
    }
}
