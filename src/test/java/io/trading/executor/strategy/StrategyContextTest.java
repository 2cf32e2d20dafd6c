package io.trading.executor.strategy;

import io.trading.executor.TestRequests;
import io.trading.executor.error.InsufficientDataException;
import io.trading.executor.error.NotFoundException;
import io.trading.executor.lookup.ConfigLookupService;
import io.trading.executor.lookup.DescriptorLocator;
import io.trading.executor.lookup.DescriptorParser;
import io.trading.executor.model.Bar;
import io.trading.executor.model.ExecutionRequest;
import io.trading.executor.model.Order;
import io.trading.executor.model.OrderOpType;
import io.trading.executor.model.OrderOperation;
import io.trading.executor.model.OrderType;
import io.trading.executor.model.Side;
import io.trading.executor.model.TradingRule;
import io.trading.executor.scheduler.MarketPhase;
import io.trading.executor.scope.ExecutionScope;
import io.trading.executor.scope.ScopeKey;
import io.trading.executor.scope.ScopeManager;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for StrategyContext.
 */
class StrategyContextTest {

    @TempDir
    Path configDir;

    private final ScopeKey key = new ScopeKey("acc-1", "test");
    private ScopeManager scopeManager;
    private StrategyInstance instance;
    private ExecutionScope scope;

    @BeforeEach
    void setUp() throws IOException {
        Path rules = Files.createDirectories(configDir.resolve("trading_rules"));
        Files.writeString(rules.resolve("binance.json"), """
            {
              "BTCUSDT": {
                "min_quantity": "0.001",
                "quantity_step": "0.001",
                "min_price": "0.01",
                "price_tick": "0.01",
                "price_precision": 2,
                "quantity_precision": 3
              }
            }
            """);
        scopeManager = new ScopeManager(new ConfigLookupService(
            new DescriptorLocator(List.of(configDir)), new DescriptorParser()));
        instance = new StrategyInstance(key, context -> { });
    }

    @AfterEach
    void tearDown() {
        if (scope != null) {
            scope.close();
        }
    }

    private StrategyContext open(ExecutionRequest request) {
        scope = scopeManager.open(key, request, instance);
        return scope.context();
    }

    @Test
    void testRequestAccessors() {
        StrategyContext context = open(TestRequests.request("ctx-1").param("fast", "3").build());

        assertEquals("ctx-1", context.execId());
        assertEquals("test", context.strategyId());
        assertEquals("binance", context.venue());
        assertEquals("acc-1", context.account().accountId());
        assertEquals("3", context.param("fast", "5"));
        assertEquals("10", context.param("slow", "10"));
        assertEquals(TestRequests.TIMESTAMP, context.currentTime().toEpochMilli());
        assertEquals(List.of("BTCUSDT"), context.symbols());
    }

    @Test
    void testCurrentBarFollowsTriggerSeries() {
        StrategyContext context = open(TestRequests.request("ctx-2")
            .bars("ETHUSDT", "1h", TestRequests.hourlyBars("2000"))
            .bars("BTCUSDT", "1h", TestRequests.hourlyBars("99", "101"))
            .build());

        Bar bar = context.currentBar().orElseThrow();
        assertEquals(0, new BigDecimal("101").compareTo(bar.close()));
    }

    @Test
    void testHistoryAndMissingData() {
        StrategyContext context = open(TestRequests.request("ctx-3")
            .bars("BTCUSDT", "1h", TestRequests.hourlyBars("1", "2", "3"))
            .build());

        List<Bar> bars = context.history("BTCUSDT", 2, "1h");
        assertEquals(2, bars.size());
        assertEquals(0, new BigDecimal("3").compareTo(bars.get(1).close()));

        assertThrows(InsufficientDataException.class, () -> context.history("BTCUSDT", 4, "1h"));
        assertThrows(InsufficientDataException.class, () -> context.history("BTCUSDT", 1, "4h"));
        assertThrows(InsufficientDataException.class, () -> context.instrument("ETHUSDT"));
    }

    @Test
    void testOrdersGetSequentialUniqueIds() {
        StrategyContext context = open(TestRequests.request("ctx-4").build());

        Order market = context.orderBuy("BTCUSDT", new BigDecimal("0.5"));
        Order limit = context.orderSell("BTCUSDT", new BigDecimal("0.25"), new BigDecimal("105"));

        assertEquals("ctx-4_1", market.uniqueId());
        assertEquals(OrderType.MARKET, market.orderType());
        assertNull(market.limitPrice());
        assertEquals("ctx-4_2", limit.uniqueId());
        assertEquals(OrderType.LIMIT, limit.orderType());
        assertEquals(Side.SELL, limit.side());

        List<OrderOperation> operations = context.orderOperations();
        assertEquals(2, operations.size());
        assertEquals(market, operations.get(0).order());
        assertEquals(limit, operations.get(1).order());
    }

    @Test
    void testInvalidOrdersAreRejected() {
        StrategyContext context = open(TestRequests.request("ctx-5").build());

        assertThrows(IllegalArgumentException.class, () -> context.orderBuy("BTCUSDT", BigDecimal.ZERO));
        assertThrows(IllegalArgumentException.class, () -> context.orderBuy("", BigDecimal.ONE));
        assertThrows(IllegalArgumentException.class,
            () -> context.orderBuy("BTCUSDT", BigDecimal.ONE, new BigDecimal("-1")));
        assertTrue(context.orderOperations().isEmpty());
    }

    @Test
    void testCancelAndModifyWorkingOrders() {
        StrategyContext context = open(TestRequests.request("ctx-6")
            .incomplete(TestRequests.workingOrder("o-1", "BTCUSDT", Side.BUY, "1", "99"))
            .build());

        assertTrue(context.cancelOrder("o-1-c"));
        assertFalse(context.cancelOrder("missing"));
        assertTrue(context.modifyOrder("o-1", null, new BigDecimal("98")));
        assertFalse(context.modifyOrder("missing", BigDecimal.ONE, null));

        List<OrderOperation> operations = context.orderOperations();
        assertEquals(2, operations.size());
        assertEquals(OrderOpType.CANCEL, operations.get(0).opType());
        assertEquals("o-1", operations.get(0).order().orderId());
        assertEquals(OrderOpType.MODIFY, operations.get(1).opType());
        assertEquals(0, BigDecimal.ONE.compareTo(operations.get(1).order().quantity()));
        assertEquals(0, new BigDecimal("98").compareTo(operations.get(1).order().limitPrice()));
    }

    @Test
    void testOrderValueSizesAgainstPrice() {
        StrategyContext context = open(TestRequests.request("ctx-7").build());

        Order buy = context.orderValue("BTCUSDT", new BigDecimal("201"), null);
        assertEquals(Side.BUY, buy.side());
        assertEquals(OrderType.MARKET, buy.orderType());
        assertEquals(0, new BigDecimal("2").compareTo(buy.quantity()));

        Order sell = context.orderValue("BTCUSDT", new BigDecimal("-50"), new BigDecimal("100"));
        assertEquals(Side.SELL, sell.side());
        assertEquals(0, new BigDecimal("0.5").compareTo(sell.quantity()));
    }

    @Test
    void testOrderValueRoundsStocksToWholeShares() {
        StrategyContext context = open(TestRequests.request("ctx-8").build());

        Order order = context.orderValue("000001.XSHE", new BigDecimal("250"), new BigDecimal("100"));
        assertEquals(0, new BigDecimal("2").compareTo(order.quantity()));

        assertThrows(IllegalArgumentException.class,
            () -> context.orderValue("000001.XSHE", new BigDecimal("50"), new BigDecimal("100")));
    }

    @Test
    void testOrderTargetTradesDifference() {
        StrategyContext context = open(TestRequests.request("ctx-9").position("BTCUSDT", "1.5").build());

        Order sell = context.orderTarget("BTCUSDT", new BigDecimal("0.5"), null).orElseThrow();
        assertEquals(Side.SELL, sell.side());
        assertEquals(0, BigDecimal.ONE.compareTo(sell.quantity()));

        Optional<Order> none = context.orderTarget("BTCUSDT", new BigDecimal("1.5"), null);
        assertTrue(none.isEmpty());
        assertEquals(1, context.orderOperations().size());
    }

    @Test
    void testDescriptorLookupUsesRequestVenue() {
        StrategyContext context = open(TestRequests.request("ctx-10").build());

        TradingRule rule = context.tradingRule("BTCUSDT");
        assertEquals(0, new BigDecimal("0.001").compareTo(rule.quantityStep()));
        assertThrows(NotFoundException.class, () -> context.tradingRule("DOGEUSDT"));
        assertThrows(NotFoundException.class, () -> context.commissionRate("BTCUSDT"));
    }

    @Test
    void testRunDailyOnlyDuringInitialize() {
        StrategyContext context = open(TestRequests.request("ctx-11").build());

        assertThrows(IllegalStateException.class,
            () -> context.runDaily(ctx -> { }, MarketPhase.OPEN, null));

        instance.getScheduler().beginRegistration();
        assertEquals("daily_1", context.runDaily(ctx -> { }, MarketPhase.OPEN, null).name());
        assertEquals("close", context.runDaily("close", ctx -> { }, MarketPhase.AFTER_CLOSE, null).name());
        instance.getScheduler().endRegistration();
    }

    @Test
    void testClosedScopeRejectsEveryCall() {
        StrategyContext context = open(TestRequests.request("ctx-12").build());
        scope.close();

        assertThrows(IllegalStateException.class, () -> context.orderBuy("BTCUSDT", BigDecimal.ONE));
        assertThrows(IllegalStateException.class, context::account);
        assertThrows(IllegalStateException.class, context::state);
        assertThrows(IllegalStateException.class, () -> context.history("BTCUSDT", 1, "1h"));
        assertThrows(IllegalStateException.class, context::logger);
    }
}
