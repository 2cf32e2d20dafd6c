package io.trading.executor.lookup;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.trading.executor.error.MalformedDescriptorException;
import io.trading.executor.model.CommissionRate;
import io.trading.executor.model.TradingRule;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Parses venue descriptor files: a JSON object mapping instrument symbol to a flat record
 * of numeric fields.
 *
 * Numbers and numeric strings are both accepted; anything else is malformed.
 */
public class DescriptorParser {

    private static final String[] TRADING_RULE_FIELDS = {
        "min_quantity", "quantity_step", "min_price", "price_tick",
        "price_precision", "quantity_precision"
    };
    private static final String[] COMMISSION_FIELDS = {"maker_fee_rate", "taker_fee_rate"};

    private final ObjectMapper objectMapper;
    private final Runnable onParse;
    private final AtomicLong parseCount = new AtomicLong(0);

    public DescriptorParser() {
        this(new ObjectMapper(), () -> { });
    }

    /**
     * @param objectMapper Mapper used to read files
     * @param onParse      Invoked after every file read, e.g. to feed a metric
     */
    public DescriptorParser(ObjectMapper objectMapper, Runnable onParse) {
        this.objectMapper = objectMapper;
        this.onParse = onParse;
    }

    /**
     * Reads a descriptor file into its per-symbol entries.
     *
     * @throws MalformedDescriptorException if the file is not a JSON object of objects
     */
    public Map<String, JsonNode> parse(Path file) {
        parseCount.incrementAndGet();
        onParse.run();

        JsonNode root;
        try {
            root = objectMapper.readTree(Files.readAllBytes(file));
        } catch (JsonProcessingException e) {
            throw new MalformedDescriptorException(file, "invalid JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new MalformedDescriptorException(file, "unreadable: " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedDescriptorException(file, "top level must be an object keyed by symbol");
        }

        Map<String, JsonNode> entries = new HashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            entries.put(field.getKey(), field.getValue());
        }
        return entries;
    }

    public TradingRule toTradingRule(Path file, String symbol, JsonNode entry) {
        requireObject(file, symbol, entry);
        for (String field : TRADING_RULE_FIELDS) {
            requireField(file, symbol, entry, field);
        }
        try {
            return new TradingRule(
                symbol,
                decimal(file, symbol, entry, "min_quantity"),
                decimal(file, symbol, entry, "quantity_step"),
                decimal(file, symbol, entry, "min_price"),
                decimal(file, symbol, entry, "price_tick"),
                integer(file, symbol, entry, "price_precision"),
                integer(file, symbol, entry, "quantity_precision"),
                entry.has("max_leverage") ? decimal(file, symbol, entry, "max_leverage") : BigDecimal.ONE
            );
        } catch (IllegalArgumentException e) {
            throw new MalformedDescriptorException(file, symbol + ": " + e.getMessage(), e);
        }
    }

    public CommissionRate toCommissionRate(Path file, String symbol, JsonNode entry) {
        requireObject(file, symbol, entry);
        for (String field : COMMISSION_FIELDS) {
            requireField(file, symbol, entry, field);
        }
        try {
            return new CommissionRate(
                symbol,
                decimal(file, symbol, entry, "maker_fee_rate"),
                decimal(file, symbol, entry, "taker_fee_rate")
            );
        } catch (IllegalArgumentException e) {
            throw new MalformedDescriptorException(file, symbol + ": " + e.getMessage(), e);
        }
    }

    /**
     * Number of files parsed since construction.
     */
    public long getParseCount() {
        return parseCount.get();
    }

    private static void requireObject(Path file, String symbol, JsonNode entry) {
        if (entry == null || !entry.isObject()) {
            throw new MalformedDescriptorException(file, symbol + ": entry must be an object");
        }
    }

    private static void requireField(Path file, String symbol, JsonNode entry, String field) {
        JsonNode value = entry.get(field);
        if (value == null || value.isNull()) {
            throw new MalformedDescriptorException(file, symbol + ": missing required field " + field);
        }
    }

    private static BigDecimal decimal(Path file, String symbol, JsonNode entry, String field) {
        JsonNode value = entry.get(field);
        if (value.isNumber()) {
            return value.decimalValue();
        }
        if (value.isTextual()) {
            try {
                return new BigDecimal(value.textValue().trim());
            } catch (NumberFormatException e) {
                throw new MalformedDescriptorException(file, symbol + ": " + field + " is not numeric", e);
            }
        }
        throw new MalformedDescriptorException(file, symbol + ": " + field + " must be a number, got " + value.getNodeType());
    }

    private static int integer(Path file, String symbol, JsonNode entry, String field) {
        BigDecimal value = decimal(file, symbol, entry, field);
        try {
            return value.intValueExact();
        } catch (ArithmeticException e) {
            throw new MalformedDescriptorException(file, symbol + ": " + field + " must be an integer", e);
        }
    }
}
