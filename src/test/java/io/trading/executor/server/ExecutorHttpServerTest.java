package io.trading.executor.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.prometheus.client.CollectorRegistry;
import io.trading.executor.config.ExecutorConfig;
import io.trading.executor.core.ExecutionGateway;
import io.trading.executor.lookup.ConfigLookupService;
import io.trading.executor.lookup.DescriptorLocator;
import io.trading.executor.lookup.DescriptorParser;
import io.trading.executor.metrics.ExecutorMetrics;
import io.trading.executor.model.Bar;
import io.trading.executor.strategy.Strategy;
import io.trading.executor.strategy.StrategyContext;
import io.trading.executor.strategy.StrategyRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Exercises the HTTP endpoints against a server on an ephemeral port.
 */
class ExecutorHttpServerTest {

    private static final String EXEC_BODY = """
        {
          "exec_id": "http-1",
          "max_timeout": 2,
          "trigger_type": "market_data",
          "trigger_detail": {"timestamp": 1704103200000, "symbol": "BTCUSDT", "timeframe": "1h"},
          "market_data_context": [{"symbol": "BTCUSDT", "timeframe": "1h", "bars": [
            {"open_time": 1704099600000, "close_time": 1704103199999,
             "open": "100", "high": "101", "low": "99", "close": "100.50", "volume": "3"}]}],
          "account": {"account_id": "acc-1", "total_net_value": "10000", "available_cash": "10000"},
          "exchange": "binance",
          "strategy_id": "buyer"
        }
        """;

    @TempDir
    Path configDir;

    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient client = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(2)).build();
    private final CollectorRegistry registry = new CollectorRegistry();
    private ExecutionGateway gateway;
    private ExecutorHttpServer server;

    @BeforeEach
    void setUp() throws Exception {
        StrategyRegistry strategies = new StrategyRegistry();
        strategies.register("buyer", () -> context -> { });
        strategies.register("buyer-on-bar", BuyOnBar::new);
        ExecutorConfig config = ExecutorConfig.builder().httpPort(0).build();
        gateway = new ExecutionGateway(config, strategies,
            new ConfigLookupService(new DescriptorLocator(List.of(configDir)), new DescriptorParser()),
            new ExecutorMetrics(registry, false));
        server = new ExecutorHttpServer(0, gateway, config, registry);
        server.start();
    }

    @AfterEach
    void tearDown() {
        server.close();
        gateway.close();
    }

    private HttpResponse<String> get(String path) throws Exception {
        return client.send(HttpRequest.newBuilder(uri(path)).GET().build(), HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        return client.send(HttpRequest.newBuilder(uri(path))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body))
            .build(), HttpResponse.BodyHandlers.ofString());
    }

    private URI uri(String path) {
        return URI.create("http://localhost:" + server.getPort() + path);
    }

    @Test
    void testExecReturnsResponse() throws Exception {
        HttpResponse<String> response = post("/api/exec",
            EXEC_BODY.replace("\"buyer\"", "\"buyer-on-bar\""));

        assertEquals(200, response.statusCode());
        JsonNode json = mapper.readTree(response.body());
        assertEquals("SUCCESS", json.get("status").asText());
        JsonNode order = json.get("order_op_event").get(0).get("order");
        assertEquals("http-1_1", order.get("unique_id").asText());
        assertEquals(0, new BigDecimal("0.5").compareTo(new BigDecimal(order.get("quantity").asText())));
    }

    @Test
    void testInvalidRequestIs400() throws Exception {
        HttpResponse<String> malformed = post("/api/exec", "{ nope");
        assertEquals(400, malformed.statusCode());
        assertTrue(mapper.readTree(malformed.body()).has("error"));

        HttpResponse<String> unknownVenue = post("/api/exec", EXEC_BODY.replace("binance", "nasdaq"));
        assertEquals(400, unknownVenue.statusCode());
        assertTrue(unknownVenue.body().contains("nasdaq"));
    }

    @Test
    void testExecRequiresPost() throws Exception {
        assertEquals(405, get("/api/exec").statusCode());
    }

    @Test
    void testHealthEndpoints() throws Exception {
        HttpResponse<String> simple = get("/health");
        assertEquals(200, simple.statusCode());
        assertEquals("OK", simple.body());

        HttpResponse<String> detailed = get("/api/health");
        assertEquals(200, detailed.statusCode());
        assertEquals("HEALTHY", mapper.readTree(detailed.body()).get("status").asText());

        gateway.close();
        assertEquals(503, get("/health").statusCode());
        assertEquals(503, get("/api/health").statusCode());
    }

    @Test
    void testConfigEndpoint() throws Exception {
        HttpResponse<String> response = get("/api/config");

        assertEquals(200, response.statusCode());
        JsonNode json = mapper.readTree(response.body());
        assertEquals("executor-0", json.get("executorId").asText());
        assertEquals(3, json.get("venues").size());
    }

    @Test
    void testMetricsEndpoint() throws Exception {
        post("/api/exec", EXEC_BODY);

        HttpResponse<String> response = get("/metrics");

        assertEquals(200, response.statusCode());
        assertTrue(response.body().contains("executor_executions_total{status=\"SUCCESS\",} 1.0"), response.body());
    }

    static class BuyOnBar implements Strategy {
        @Override
        public void initialize(StrategyContext context) {
        }

        @Override
        public void onBar(StrategyContext context, Bar bar) {
            context.orderBuy("BTCUSDT", new BigDecimal("0.5"));
        }
    }
}
