package fr.lapetina.inference.sweep.infrastructure.health;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Readiness checks over plain sockets and the frontend's {@code /health} endpoint.
 *
 * The health body is a JSON object. When it carries an {@code instances} or {@code workers}
 * array, the number of entries is compared with the expected worker count; a 200 response
 * without either array counts as ready.
 */
public class HttpReadinessProbe implements ReadinessProbe {

    private static final Logger log = LoggerFactory.getLogger(HttpReadinessProbe.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Duration connectTimeout;
    private final Duration requestTimeout;

    public HttpReadinessProbe(Duration connectTimeout, Duration requestTimeout) {
        this.connectTimeout = connectTimeout;
        this.requestTimeout = requestTimeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .build();
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public HttpReadinessProbe() {
        this(Duration.ofSeconds(2), Duration.ofSeconds(5));
    }

    @Override
    public boolean isPortOpen(String host, int port) {
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(host, port), (int) connectTimeout.toMillis());
            return true;
        } catch (IOException e) {
            log.debug("Port not open: host={}, port={}, error={}", host, port, e.getMessage());
            return false;
        }
    }

    @Override
    public boolean isHealthy(String host, int port, int expectedWorkers) {
        URI uri = URI.create("http://" + host + ":" + port + "/health");
        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(requestTimeout)
                .GET()
                .build();

        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                log.debug("Health check failed: uri={}, status={}", uri, response.statusCode());
                return false;
            }
            int workers = countWorkers(response.body());
            if (workers < 0) {
                log.debug("Health check passed without worker list: uri={}", uri);
                return true;
            }
            log.debug("Health check: uri={}, workers={}, expected={}", uri, workers, expectedWorkers);
            return workers >= expectedWorkers;
        } catch (IOException e) {
            log.debug("Health check error: uri={}, error={}", uri, e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * @return number of registered workers, or -1 when the body does not list them
     */
    int countWorkers(String body) {
        if (body == null || body.isBlank()) {
            return -1;
        }
        try {
            JsonNode root = objectMapper.readTree(body);
            for (String field : new String[] {"instances", "workers"}) {
                JsonNode list = root.path(field);
                if (list.isArray()) {
                    return list.size();
                }
            }
            return -1;
        } catch (IOException e) {
            log.debug("Health body is not JSON: error={}", e.getMessage());
            return -1;
        }
    }
}
