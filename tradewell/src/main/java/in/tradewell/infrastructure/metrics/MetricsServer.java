package in.tradewell.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * Small Undertow server exposing {@code /metrics} and {@code /health}.
 *
 * {@code /metrics} answers in the Prometheus text format; repeated
 * {@code name[]} query parameters restrict the output to those families:
 * <pre>
 * GET /metrics?name[]=session_worker_count
 *
 * # HELP session_worker_count Number of consumer workers in the current run
 * # TYPE session_worker_count gauge
 * session_worker_count 4.0
 * </pre>
 */
public final class MetricsServer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MetricsServer.class);

    private final Undertow server;
    private final CollectorRegistry registry;
    private final int port;

    public MetricsServer(String host, int port, SessionMetrics metrics) {
        this.port = port;
        this.registry = metrics.getRegistry();
        this.server = Undertow.builder()
            .addHttpListener(port, host)
            .setHandler(Handlers.path()
                .addExactPath("/metrics", this::serveMetrics)
                .addExactPath("/health", exchange -> {
                    exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
                    exchange.getResponseSender().send("{\"status\":\"UP\"}");
                }))
            .build();
    }

    public void start() {
        server.start();
        log.info("✓ Metrics endpoint listening on port {}", port);
    }

    @Override
    public void close() {
        server.stop();
        log.info("Metrics endpoint stopped");
    }

    private void serveMetrics(HttpServerExchange exchange) {
        Deque<String> names = exchange.getQueryParameters().get("name[]");
        Set<String> included = names == null ? Set.of() : new HashSet<>(names);
        try {
            StringWriter writer = new StringWriter();
            TextFormat.write004(writer, included.isEmpty()
                ? registry.metricFamilySamples()
                : registry.filteredMetricFamilySamples(included));

            exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, TextFormat.CONTENT_TYPE_004);
            exchange.getResponseSender().send(writer.toString());
        } catch (IOException e) {
            log.error("[METRICS] Failed to export metrics: {}", e.getMessage(), e);
            exchange.setStatusCode(500);
            exchange.getResponseSender().send("Error exporting metrics: " + e.getMessage());
        }
    }
}
