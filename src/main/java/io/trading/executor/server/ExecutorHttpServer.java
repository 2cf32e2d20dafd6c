package io.trading.executor.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.trading.executor.config.ExecutorConfig;
import io.trading.executor.config.StrategyBinding;
import io.trading.executor.core.ExecutionGateway;
import io.trading.executor.error.InvalidRequestException;
import io.trading.executor.model.ExecutionRequest;
import io.trading.executor.model.ExecutionResponse;
import io.trading.executor.model.HealthReport;
import io.trading.executor.model.HealthStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.StringWriter;
import java.io.Writer;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * HTTP server for the executor: the exec and health calls plus Prometheus metrics and the
 * active configuration.
 *
 * Invalid requests get a 400 with a JSON error body; every accepted request gets a 200 with
 * its ExecutionResponse, whatever the execution's status.
 */
public class ExecutorHttpServer implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ExecutorHttpServer.class);

    private final int port;
    private final ExecutionGateway gateway;
    private final ExecutorConfig config;
    private final CollectorRegistry registry;
    private final RequestCodec codec;
    private final ObjectMapper objectMapper;
    private final long startTime;
    private HttpServer server;
    private ExecutorService requestThreads;

    public ExecutorHttpServer(int port, ExecutionGateway gateway, ExecutorConfig config, CollectorRegistry registry) {
        this.port = port;
        this.gateway = gateway;
        this.config = config;
        this.registry = registry;
        this.codec = new RequestCodec();
        this.objectMapper = new ObjectMapper();
        this.startTime = System.currentTimeMillis();
    }

    /**
     * Starts the HTTP server.
     */
    public void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress(port), 0);

        server.createContext("/api/exec", handleExec());
        server.createContext("/api/health", handleHealth());
        server.createContext("/api/config", handleConfig());
        server.createContext("/health", handleHealthSimple());
        server.createContext("/metrics", handleMetrics());

        // exec blocks for up to max_timeout, so requests need their own threads
        AtomicInteger threadCount = new AtomicInteger();
        requestThreads = Executors.newCachedThreadPool(r -> {
            Thread thread = new Thread(r, "http-request-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        server.setExecutor(requestThreads);
        server.start();

        LOGGER.info("HTTP server started on port {}", getPort());
        LOGGER.info("  Exec:       POST http://localhost:{}/api/exec", getPort());
        LOGGER.info("  API Health: http://localhost:{}/api/health", getPort());
        LOGGER.info("  API Config: http://localhost:{}/api/config", getPort());
        LOGGER.info("  Health:     http://localhost:{}/health", getPort());
        LOGGER.info("  Prometheus: http://localhost:{}/metrics", getPort());
    }

    /**
     * Bound port; differs from the configured one when that was 0.
     */
    public int getPort() {
        return server != null ? server.getAddress().getPort() : port;
    }

    private HttpHandler handleExec() {
        return exchange -> {
            if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendJsonResponse(exchange, 405, codec.encodeError("Use POST"));
                return;
            }
            try {
                String body;
                try (InputStream is = exchange.getRequestBody()) {
                    body = new String(is.readAllBytes(), StandardCharsets.UTF_8);
                }
                ExecutionRequest request = codec.decodeRequest(body);
                ExecutionResponse response = gateway.exec(request);
                sendJsonResponse(exchange, 200, codec.encodeResponse(response));
            } catch (InvalidRequestException e) {
                sendJsonResponse(exchange, 400, codec.encodeError(e.getMessage()));
            } catch (Exception e) {
                LOGGER.error("Error handling exec request", e);
                sendJsonResponse(exchange, 500, "{\"error\":\"Internal server error\"}");
            }
        };
    }

    private HttpHandler handleHealth() {
        return exchange -> {
            try {
                HealthReport report = gateway.health();
                int status = report.status() == HealthStatus.UNHEALTHY ? 503 : 200;
                sendJsonResponse(exchange, status, codec.encodeHealth(report));
            } catch (Exception e) {
                LOGGER.error("Error handling health request", e);
                sendJsonResponse(exchange, 500, "{\"error\":\"Internal server error\"}");
            }
        };
    }

    private HttpHandler handleHealthSimple() {
        return exchange -> {
            try {
                boolean ok = gateway.health().status() != HealthStatus.UNHEALTHY;
                sendResponse(exchange, ok ? 200 : 503, "text/plain", ok ? "OK" : "FAIL");
            } catch (Exception e) {
                LOGGER.error("Error serving health", e);
                exchange.sendResponseHeaders(500, -1);
            }
        };
    }

    private HttpHandler handleConfig() {
        return exchange -> {
            try {
                ConfigInfo configInfo = new ConfigInfo(
                    config.executorId(),
                    System.currentTimeMillis() - startTime,
                    config.healthCheckMs(),
                    config.dedupRetentionMs(),
                    config.dedupMaxEntries(),
                    config.timeoutGraceMs(),
                    config.venues().stream().sorted().collect(Collectors.toList()),
                    config.strategies().stream().map(StrategyBinding::toString).collect(Collectors.toList())
                );

                String response = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(configInfo);
                sendJsonResponse(exchange, 200, response);
            } catch (Exception e) {
                LOGGER.error("Error handling config request", e);
                sendJsonResponse(exchange, 500, "{\"error\":\"Internal server error\"}");
            }
        };
    }

    private HttpHandler handleMetrics() {
        return exchange -> {
            try {
                Writer writer = new StringWriter();
                TextFormat.write004(writer, registry.metricFamilySamples());
                sendResponse(exchange, 200, TextFormat.CONTENT_TYPE_004, writer.toString());
            } catch (Exception e) {
                LOGGER.error("Error serving metrics", e);
                exchange.sendResponseHeaders(500, -1);
            }
        };
    }

    private void sendJsonResponse(HttpExchange exchange, int statusCode, String response) throws IOException {
        exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
        sendResponse(exchange, statusCode, "application/json", response);
    }

    private void sendResponse(HttpExchange exchange, int statusCode, String contentType, String response) throws IOException {
        byte[] bytes = response.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(statusCode, bytes.length);

        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    @Override
    public void close() {
        if (server != null) {
            server.stop(0);
            LOGGER.info("HTTP server stopped");
        }
        if (requestThreads != null) {
            requestThreads.shutdown();
            try {
                if (!requestThreads.awaitTermination(5, TimeUnit.SECONDS)) {
                    requestThreads.shutdownNow();
                }
            } catch (InterruptedException e) {
                requestThreads.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    private record ConfigInfo(String executorId, long uptimeMs, int healthCheckMs, long dedupRetentionMs,
                              int dedupMaxEntries, long timeoutGraceMs, List<String> venues, List<String> strategies) {}
}
