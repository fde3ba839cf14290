package in.tradewell.infrastructure.metrics;

import in.tradewell.domain.session.GateReason;
import in.tradewell.domain.session.InstrumentUniverse;
import in.tradewell.domain.session.SymbolAssignment;
import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test for the /metrics and /health endpoints.
 */
class MetricsServerTest {

    private static final int TEST_PORT = 19191;

    private MetricsServer server;
    private SessionMetrics metrics;
    private HttpClient httpClient;

    @BeforeEach
    void setUp() {
        metrics = new SessionMetrics(new CollectorRegistry());
        server = new MetricsServer("localhost", TEST_PORT, metrics);
        server.start();
        httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build();
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.close();
        }
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create("http://localhost:" + TEST_PORT + path))
            .GET()
            .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void testMetricsEndpointExposesSessionMetrics() throws Exception {
        metrics.recordGateDecision(GateReason.READY);
        SymbolAssignment assignment = new SymbolAssignment(2,
            Map.of("AAPL", 0, "MSFT", 1), List.of(List.of("AAPL"), List.of("MSFT")));
        metrics.recordAssignment(InstrumentUniverse.of(List.of("AAPL", "MSFT")).size(), assignment);
        metrics.recordWorkerStarted("consumer");

        HttpResponse<String> response = get("/metrics");

        assertEquals(200, response.statusCode());
        assertTrue(response.headers().firstValue("Content-Type").orElse("").contains("text/plain"));
        String body = response.body();
        assertTrue(body.contains("session_gate_decisions_total{reason=\"READY\",} 1.0"), body);
        assertTrue(body.contains("session_worker_count 2.0"), body);
        assertTrue(body.contains("session_universe_size 2.0"), body);
        assertTrue(body.contains("session_shard_symbols{shard=\"1\",} 1.0"), body);
        assertTrue(body.contains("session_workers_started_total{role=\"consumer\",} 1.0"), body);
    }

    @Test
    void testMetricsEndpointFiltersByName() throws Exception {
        metrics.recordWorkerStarted("scanner");

        String body = get("/metrics?name%5B%5D=session_workers_started_total").body();

        assertTrue(body.contains("session_workers_started_total{role=\"scanner\",} 1.0"), body);
        assertFalse(body.contains("session_universe_size"), body);
    }

    @Test
    void testHealthEndpoint() throws Exception {
        HttpResponse<String> response = get("/health");

        assertEquals(200, response.statusCode());
        assertEquals("{\"status\":\"UP\"}", response.body());
    }
}
