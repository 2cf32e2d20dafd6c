package io.trading.executor.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.trading.executor.error.InvalidRequestException;
import io.trading.executor.model.Account;
import io.trading.executor.model.Bar;
import io.trading.executor.model.ExecutionRequest;
import io.trading.executor.model.ExecutionResponse;
import io.trading.executor.model.HealthReport;
import io.trading.executor.model.MarketDataContext;
import io.trading.executor.model.MarketDataTrigger;
import io.trading.executor.model.Order;
import io.trading.executor.model.OrderOperation;
import io.trading.executor.model.OrderStatus;
import io.trading.executor.model.OrderStatusTrigger;
import io.trading.executor.model.OrderType;
import io.trading.executor.model.Position;
import io.trading.executor.model.RiskManageTrigger;
import io.trading.executor.model.Side;
import io.trading.executor.model.Trigger;
import io.trading.executor.model.TriggerType;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * JSON wire format of the executor, using snake_case field names.
 *
 * Request:
 * <pre>
 * {
 *   "exec_id": "e-1",
 *   "max_timeout": 1.5,
 *   "trigger_type": "market_data",
 *   "trigger_detail": {"timestamp": 1700000000000, "symbol": "BTCUSDT", "timeframe": "1h"},
 *   "market_data_context": [{"symbol": "BTCUSDT", "timeframe": "1h", "bars": [...]}],
 *   "account": {"account_id": "acc-1", "positions": [...]},
 *   "incomplete_orders": [...],
 *   "completed_orders": [...],
 *   "exchange": "binance",
 *   "strategy_id": "dual_ma",
 *   "strategy_param": {"fast": "5"}
 * }
 * </pre>
 *
 * Decimal fields accept numbers or numeric strings. Any structural problem is reported as an
 * {@link InvalidRequestException}.
 */
public class RequestCodec {

    private final ObjectMapper objectMapper;

    public RequestCodec() {
        this(new ObjectMapper().enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS));
    }

    public RequestCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws InvalidRequestException if the body is not a well-formed request
     */
    public ExecutionRequest decodeRequest(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new InvalidRequestException("request body is not valid JSON: " + e.getOriginalMessage());
        }
        if (root == null || !root.isObject()) {
            throw new InvalidRequestException("request body must be a JSON object");
        }

        String execId = text(root, "exec_id");
        try {
            return new ExecutionRequest(
                execId,
                root.path("max_timeout").asDouble(0),
                decodeTrigger(root),
                decodeList(root, "market_data_context", this::decodeMarketData),
                decodeAccount(root.get("account")),
                decodeList(root, "incomplete_orders", this::decodeOrder),
                decodeList(root, "completed_orders", this::decodeOrder),
                text(root, "exchange"),
                text(root, "strategy_id"),
                decodeParams(root.get("strategy_param"))
            );
        } catch (IllegalArgumentException e) {
            throw new InvalidRequestException(execId, e.getMessage());
        }
    }

    private Trigger decodeTrigger(JsonNode root) {
        JsonNode typeNode = root.get("trigger_type");
        if (typeNode == null || typeNode.isNull()) {
            return null;
        }
        TriggerType type = TriggerType.fromWire(typeNode.asText());
        JsonNode detail = root.path("trigger_detail");
        long timestamp = detail.has("timestamp") ? detail.path("timestamp").asLong(0) : root.path("timestamp").asLong(0);
        return switch (type) {
            case MARKET_DATA -> new MarketDataTrigger(timestamp, text(detail, "symbol"), text(detail, "timeframe"));
            case RISK_MANAGE -> new RiskManageTrigger(timestamp, detail.path("risk_event_type").asInt(0),
                text(detail, "remark"));
            case ORDER_STATUS -> new OrderStatusTrigger(timestamp, text(detail, "order_id"));
        };
    }

    private MarketDataContext decodeMarketData(JsonNode node) {
        List<Bar> bars = new ArrayList<>();
        for (JsonNode bar : node.path("bars")) {
            bars.add(new Bar(
                bar.path("open_time").asLong(0),
                bar.path("close_time").asLong(0),
                decimal(bar, "open"),
                decimal(bar, "high"),
                decimal(bar, "low"),
                decimal(bar, "close"),
                decimal(bar, "volume")
            ));
        }
        return new MarketDataContext(text(node, "symbol"), text(node, "timeframe"), bars);
    }

    private Account decodeAccount(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        List<Position> positions = new ArrayList<>();
        for (JsonNode position : node.path("positions")) {
            positions.add(new Position(
                text(position, "symbol"),
                decimal(position, "quantity"),
                decimal(position, "average_cost_price"),
                decimal(position, "unrealized_pnl")
            ));
        }
        return new Account(
            text(node, "account_id"),
            decimal(node, "total_net_value"),
            decimal(node, "available_cash"),
            decimal(node, "leverage"),
            positions
        );
    }

    private Order decodeOrder(JsonNode node) {
        BigDecimal limitPrice = decimal(node, "limit_price");
        return new Order(
            text(node, "order_id"),
            text(node, "unique_id"),
            text(node, "symbol"),
            Side.fromString(text(node, "side")),
            OrderType.fromString(text(node, "order_type")),
            decimal(node, "quantity"),
            limitPrice != null ? limitPrice : decimal(node, "price"),
            OrderStatus.fromString(text(node, "status")),
            decimal(node, "executed_quantity"),
            decimal(node, "avg_fill_price"),
            decimal(node, "commission"),
            text(node, "cancel_reason")
        );
    }

    /**
     * Strategy params are a flat JSON object, given inline or as a JSON string. Scalar values
     * are kept as their text; nested values as their JSON text.
     */
    private Map<String, String> decodeParams(JsonNode node) {
        if (node == null || node.isNull()) {
            return Map.of();
        }
        JsonNode params = node;
        if (node.isTextual()) {
            if (node.asText().isBlank()) {
                return Map.of();
            }
            try {
                params = objectMapper.readTree(node.asText());
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException("strategy_param is not valid JSON: " + e.getOriginalMessage());
            }
        }
        if (!params.isObject()) {
            throw new IllegalArgumentException("strategy_param must be a JSON object");
        }
        Map<String, String> values = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = params.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (!value.isNull()) {
                values.put(field.getKey(), value.isValueNode() ? value.asText() : value.toString());
            }
        }
        return values;
    }

    private <T> List<T> decodeList(JsonNode root, String field, Function<JsonNode, T> decoder) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (!node.isArray()) {
            throw new IllegalArgumentException(field + " must be an array");
        }
        List<T> items = new ArrayList<>(node.size());
        for (JsonNode item : node) {
            items.add(decoder.apply(item));
        }
        return items;
    }

    public String encodeResponse(ExecutionResponse response) throws JsonProcessingException {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("status", response.status().name());
        root.put("error_message", response.errorMessage());
        ArrayNode warnings = root.putArray("warnings");
        response.warnings().forEach(warnings::add);
        ArrayNode operations = root.putArray("order_op_event");
        for (OrderOperation operation : response.orderOperations()) {
            ObjectNode op = operations.addObject();
            op.put("op_type", operation.opType().name());
            encodeOrder(op.putObject("order"), operation.order());
        }
        return objectMapper.writeValueAsString(root);
    }

    public String encodeHealth(HealthReport report) throws JsonProcessingException {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("status", report.status().name());
        root.put("message", report.message());
        ArrayNode details = root.putArray("details");
        report.details().forEach(details::add);
        return objectMapper.writeValueAsString(root);
    }

    public String encodeError(String message) throws JsonProcessingException {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("error", message);
        return objectMapper.writeValueAsString(root);
    }

    private static void encodeOrder(ObjectNode node, Order order) {
        node.put("order_id", order.orderId());
        node.put("unique_id", order.uniqueId());
        node.put("symbol", order.symbol());
        node.put("side", order.side().name());
        node.put("order_type", order.orderType().name());
        node.put("quantity", order.quantity().toPlainString());
        if (order.limitPrice() != null) {
            node.put("limit_price", order.limitPrice().toPlainString());
        }
        node.put("status", order.status().name());
        node.put("executed_quantity", order.executedQuantity().toPlainString());
        node.put("time_in_force", "GTC");
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static BigDecimal decimal(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.decimalValue();
        }
        String text = value.asText().trim();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return new BigDecimal(text);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(field + " is not a number: " + text);
        }
    }
}
