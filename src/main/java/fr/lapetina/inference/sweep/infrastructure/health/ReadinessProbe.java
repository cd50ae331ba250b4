package fr.lapetina.inference.sweep.infrastructure.health;

/**
 * Single, non-blocking readiness checks against a service. Polling and timeouts belong to
 * {@link ReadinessWaiter}.
 */
public interface ReadinessProbe {

    /**
     * Whether a TCP connection to {@code host:port} can be opened.
     */
    boolean isPortOpen(String host, int port);

    /**
     * Whether the HTTP health endpoint on {@code host:port} answers and reports at least
     * {@code expectedWorkers} registered workers.
     */
    boolean isHealthy(String host, int port, int expectedWorkers);
}
