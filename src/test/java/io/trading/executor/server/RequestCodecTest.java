package io.trading.executor.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.trading.executor.error.InvalidRequestException;
import io.trading.executor.model.ExecutionRequest;
import io.trading.executor.model.ExecutionResponse;
import io.trading.executor.model.HealthReport;
import io.trading.executor.model.HealthStatus;
import io.trading.executor.model.MarketDataTrigger;
import io.trading.executor.model.Order;
import io.trading.executor.model.OrderOperation;
import io.trading.executor.model.OrderStatus;
import io.trading.executor.model.OrderStatusTrigger;
import io.trading.executor.model.OrderType;
import io.trading.executor.model.RiskManageTrigger;
import io.trading.executor.model.Side;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for RequestCodec.
 */
class RequestCodecTest {

    private final RequestCodec codec = new RequestCodec();
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void testDecodeMarketDataRequest() {
        String json = """
            {
              "exec_id": "e-1",
              "max_timeout": 1.5,
              "trigger_type": "market_data",
              "trigger_detail": {"timestamp": 1704103200000, "symbol": "BTCUSDT", "timeframe": "1h"},
              "market_data_context": [{
                "symbol": "BTCUSDT",
                "timeframe": "1h",
                "bars": [{"open_time": 1704099600000, "close_time": 1704103199999,
                          "open": "100.1", "high": 101, "low": 99.5, "close": "100.50", "volume": 12}]
              }],
              "account": {
                "account_id": "acc-1",
                "total_net_value": "10000",
                "available_cash": 9000,
                "positions": [{"symbol": "BTCUSDT", "quantity": "0.5", "average_cost_price": "95"}]
              },
              "incomplete_orders": [{"order_id": "o-1", "unique_id": "c-1", "symbol": "BTCUSDT",
                                     "side": "BUY", "order_type": "LIMIT", "quantity": "1",
                                     "price": "98", "status": "NEW"}],
              "exchange": "binance",
              "strategy_id": "dual_ma",
              "strategy_param": {"fast": 5, "symbol": "BTCUSDT", "weights": [1, 2]}
            }
            """;

        ExecutionRequest request = codec.decodeRequest(json);

        assertEquals("e-1", request.execId());
        assertEquals(1500, request.maxTimeoutMillis());
        MarketDataTrigger trigger = assertInstanceOf(MarketDataTrigger.class, request.trigger());
        assertEquals(1704103200000L, trigger.timestamp());
        assertEquals("1h", trigger.timeframe());
        assertEquals(0, new BigDecimal("100.50").compareTo(request.marketData().get(0).bars().get(0).close()));
        assertEquals(0, new BigDecimal("99.5").compareTo(request.marketData().get(0).bars().get(0).low()));
        assertEquals(0, new BigDecimal("0.5").compareTo(request.account().positionQuantity("BTCUSDT")));
        Order order = request.incompleteOrders().get(0);
        assertEquals(0, new BigDecimal("98").compareTo(order.limitPrice()));
        assertEquals(OrderType.LIMIT, order.orderType());
        assertTrue(request.completedOrders().isEmpty());
        assertEquals("5", request.strategyParams().get("fast"));
        assertEquals("[1,2]", request.strategyParams().get("weights"));
    }

    @Test
    void testDecodeOtherTriggersAndStringParams() {
        ExecutionRequest risk = codec.decodeRequest("""
            {"exec_id": "e-2", "max_timeout": 3, "trigger_type": 2,
             "trigger_detail": {"timestamp": 1, "risk_event_type": 4, "remark": "drawdown"},
             "account": {"account_id": "acc-1"}, "exchange": "okx",
             "strategy_param": "{\\"fast\\": \\"7\\"}"}
            """);
        RiskManageTrigger trigger = assertInstanceOf(RiskManageTrigger.class, risk.trigger());
        assertEquals(4, trigger.riskEventType());
        assertEquals("drawdown", trigger.remark());
        assertEquals("7", risk.strategyParams().get("fast"));
        assertNull(risk.strategyId());

        ExecutionRequest status = codec.decodeRequest("""
            {"exec_id": "e-3", "max_timeout": 3, "trigger_type": "ORDER_STATUS",
             "trigger_detail": {"timestamp": 1, "order_id": "o-1"},
             "account": {"account_id": "acc-1"}, "exchange": "okx", "strategy_param": ""}
            """);
        assertEquals("o-1", assertInstanceOf(OrderStatusTrigger.class, status.trigger()).orderId());
        assertTrue(status.strategyParams().isEmpty());
    }

    @Test
    void testMalformedBodies() {
        assertThrows(InvalidRequestException.class, () -> codec.decodeRequest("{ nope"));
        assertThrows(InvalidRequestException.class, () -> codec.decodeRequest("[]"));
        assertThrows(InvalidRequestException.class, () -> codec.decodeRequest("""
            {"exec_id": "e-1", "trigger_type": "weather"}
            """));
        InvalidRequestException badParams = assertThrows(InvalidRequestException.class, () -> codec.decodeRequest("""
            {"exec_id": "e-1", "trigger_type": 1, "strategy_param": [1]}
            """));
        assertEquals("e-1", badParams.getExecId());
        assertThrows(InvalidRequestException.class, () -> codec.decodeRequest("""
            {"exec_id": "e-1", "trigger_type": 1, "market_data_context": {}}
            """));
        assertThrows(InvalidRequestException.class, () -> codec.decodeRequest("""
            {"exec_id": "e-1", "trigger_type": 1, "account": {"account_id": "a", "available_cash": "lots"}}
            """));
    }

    @Test
    void testEncodeResponse() throws Exception {
        Order order = new Order("", "e-1_1", "BTCUSDT", Side.BUY, OrderType.LIMIT, new BigDecimal("1.0"),
            new BigDecimal("100.5"), OrderStatus.NEW, BigDecimal.ZERO, null, null, null);
        ExecutionResponse response = ExecutionResponse.completed(
            List.of(OrderOperation.create(order)), List.of("callback failed"));

        JsonNode json = mapper.readTree(codec.encodeResponse(response));

        assertEquals("PARTIAL_SUCCESS", json.get("status").asText());
        assertEquals("", json.get("error_message").asText());
        assertEquals("callback failed", json.get("warnings").get(0).asText());
        JsonNode op = json.get("order_op_event").get(0);
        assertEquals("CREATE", op.get("op_type").asText());
        assertEquals("e-1_1", op.get("order").get("unique_id").asText());
        assertEquals("1.0", op.get("order").get("quantity").asText());
        assertEquals("100.5", op.get("order").get("limit_price").asText());
        assertEquals("GTC", op.get("order").get("time_in_force").asText());
    }

    @Test
    void testEncodeFailedResponseAndHealth() throws Exception {
        JsonNode failed = mapper.readTree(codec.encodeResponse(ExecutionResponse.failed("Timeout", List.of())));
        assertEquals("FAILED", failed.get("status").asText());
        assertEquals("Timeout", failed.get("error_message").asText());
        assertEquals(0, failed.get("order_op_event").size());

        JsonNode health = mapper.readTree(codec.encodeHealth(
            new HealthReport(HealthStatus.DEGRADED, "slow", List.of("exec e-1"))));
        assertEquals("DEGRADED", health.get("status").asText());
        assertEquals("exec e-1", health.get("details").get(0).asText());
    }
}
