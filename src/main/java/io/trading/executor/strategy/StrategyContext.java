package io.trading.executor.strategy;

import io.trading.executor.lookup.ConfigLookupService;
import io.trading.executor.model.Account;
import io.trading.executor.model.Bar;
import io.trading.executor.model.CommissionRate;
import io.trading.executor.model.ExecutionRequest;
import io.trading.executor.model.Fill;
import io.trading.executor.model.InstrumentInfo;
import io.trading.executor.model.MarketDataTrigger;
import io.trading.executor.model.MarketType;
import io.trading.executor.model.Order;
import io.trading.executor.model.OrderOperation;
import io.trading.executor.model.OrderStatus;
import io.trading.executor.model.OrderType;
import io.trading.executor.model.Side;
import io.trading.executor.model.TradingRule;
import io.trading.executor.model.Trigger;
import io.trading.executor.scheduler.MarketPhase;
import io.trading.executor.scheduler.PeriodicCallback;
import io.trading.executor.scope.ExecutionScope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Everything a strategy may do during one execution.
 *
 * Every call goes through the owning {@link ExecutionScope}; once that scope is closed, all
 * of them throw {@link IllegalStateException}.
 */
public class StrategyContext {

    private static final BigDecimal TARGET_TOLERANCE = new BigDecimal("1e-8");
    private static final int QUANTITY_SCALE = 8;

    private final ExecutionScope scope;
    private final ConfigLookupService lookupService;
    private final Logger logger;

    public StrategyContext(ExecutionScope scope, ConfigLookupService lookupService) {
        this.scope = scope;
        this.lookupService = lookupService;
        this.logger = LoggerFactory.getLogger("strategy." + scope.getKey().strategyId());
    }

    // Request

    public String execId() {
        return request().execId();
    }

    public String strategyId() {
        return scope.getKey().strategyId();
    }

    public String venue() {
        return request().exchange();
    }

    public Account account() {
        return request().account();
    }

    public Trigger trigger() {
        return request().trigger();
    }

    public Map<String, String> params() {
        return request().strategyParams();
    }

    public String param(String name, String defaultValue) {
        return params().getOrDefault(name, defaultValue);
    }

    public Instant currentTime() {
        return Instant.ofEpochMilli(request().trigger().timestamp());
    }

    /**
     * Bar of the series that fired the trigger, or the latest bar of the first series.
     */
    public Optional<Bar> currentBar() {
        if (request().trigger() instanceof MarketDataTrigger marketData
            && marketData.symbol() != null && marketData.timeframe() != null) {
            Optional<Bar> bar = scope.dataAdapter().latestBar(marketData.symbol(), marketData.timeframe());
            if (bar.isPresent()) {
                return bar;
            }
        }
        return scope.dataAdapter().currentBar();
    }

    // Data

    public List<Bar> history(String symbol, int count, String timeframe) {
        return scope.dataAdapter().history(symbol, count, timeframe);
    }

    public InstrumentInfo instrument(String symbol) {
        return scope.dataAdapter().instrumentMetadata(symbol);
    }

    public Map<String, Fill> trades() {
        return scope.dataAdapter().trades();
    }

    public List<String> symbols() {
        return scope.dataAdapter().symbols();
    }

    public List<Order> incompleteOrders() {
        return scope.dataAdapter().incompleteOrders();
    }

    public List<Order> completedOrders() {
        return scope.dataAdapter().completedOrders();
    }

    // Descriptors

    public TradingRule tradingRule(String symbol) {
        String venue = venue();
        return lookupService.tradingRule(venue, symbol);
    }

    public CommissionRate commissionRate(String symbol) {
        String venue = venue();
        return lookupService.commissionRate(venue, symbol);
    }

    // Orders

    /**
     * Market buy.
     */
    public Order orderBuy(String symbol, BigDecimal quantity) {
        return orderBuy(symbol, quantity, null);
    }

    /**
     * Buy; a limit order when {@code price} is given, a market order otherwise.
     */
    public Order orderBuy(String symbol, BigDecimal quantity, BigDecimal price) {
        return submit(symbol, Side.BUY, quantity, price);
    }

    public Order orderSell(String symbol, BigDecimal quantity) {
        return orderSell(symbol, quantity, null);
    }

    public Order orderSell(String symbol, BigDecimal quantity, BigDecimal price) {
        return submit(symbol, Side.SELL, quantity, price);
    }

    /**
     * Requests cancellation of a working order.
     *
     * @return false if no incomplete order has that id
     */
    public boolean cancelOrder(String orderId) {
        Optional<Order> working = findIncomplete(orderId);
        if (working.isEmpty()) {
            logger.warn("Cancel ignored, no working order {}", orderId);
            return false;
        }
        scope.addOrderOperation(OrderOperation.cancel(working.get()));
        return true;
    }

    /**
     * Requests a quantity and/or price change on a working order. Null keeps the current value.
     *
     * @return false if no incomplete order has that id
     */
    public boolean modifyOrder(String orderId, BigDecimal quantity, BigDecimal price) {
        Optional<Order> working = findIncomplete(orderId);
        if (working.isEmpty()) {
            logger.warn("Modify ignored, no working order {}", orderId);
            return false;
        }
        Order current = working.get();
        BigDecimal newQuantity = quantity != null ? quantity : current.quantity();
        if (newQuantity.signum() <= 0) {
            throw new IllegalArgumentException("quantity must be positive: " + newQuantity);
        }
        Order modified = new Order(current.orderId(), current.uniqueId(), current.symbol(), current.side(),
            current.orderType(), newQuantity, price != null ? price : current.limitPrice(), current.status(),
            current.executedQuantity(), current.avgFillPrice(), current.commission(), null);
        scope.addOrderOperation(OrderOperation.modify(modified));
        return true;
    }

    /**
     * Buys (positive value) or sells (negative value) {@code |value| / price} units. Stock
     * markets round down to whole shares.
     *
     * @param price Limit price, or null to size against the current bar's close as a market order
     * @throws IllegalArgumentException if the resulting quantity is not positive
     */
    public Order orderValue(String symbol, BigDecimal value, BigDecimal price) {
        BigDecimal reference = price != null ? price : referencePrice(symbol);
        if (reference.signum() <= 0) {
            throw new IllegalArgumentException("price must be positive: " + reference);
        }
        BigDecimal quantity = roundQuantity(symbol, value.abs().divide(reference, QUANTITY_SCALE, RoundingMode.DOWN));
        if (quantity.signum() <= 0) {
            throw new IllegalArgumentException(String.format(
                "order value %s at price %s gives no tradable quantity for %s", value, reference, symbol));
        }
        Side side = value.signum() >= 0 ? Side.BUY : Side.SELL;
        return submit(symbol, side, quantity, price);
    }

    /**
     * Trades the difference between the current position and {@code targetQuantity}.
     *
     * @return the created order, or empty when the position is already at target
     */
    public Optional<Order> orderTarget(String symbol, BigDecimal targetQuantity, BigDecimal price) {
        BigDecimal delta = roundQuantity(symbol, targetQuantity.subtract(account().positionQuantity(symbol)));
        if (delta.abs().compareTo(TARGET_TOLERANCE) < 0) {
            return Optional.empty();
        }
        Side side = delta.signum() > 0 ? Side.BUY : Side.SELL;
        return Optional.of(submit(symbol, side, delta.abs(), price));
    }

    /**
     * Order operations emitted so far in this execution.
     */
    public List<OrderOperation> orderOperations() {
        return scope.orderOperations();
    }

    // State and scheduling

    public StrategyState state() {
        return scope.state();
    }

    public Logger logger() {
        scope.request();
        return logger;
    }

    /**
     * Registers a daily callback. Only legal inside {@link Strategy#initialize}.
     *
     * @param referenceInstrument Instrument whose market defines the phase, null for the
     *                            trigger's instrument
     */
    public PeriodicCallback runDaily(ScheduledTask task, MarketPhase phase, String referenceInstrument) {
        return runDaily(null, task, phase, referenceInstrument);
    }

    public PeriodicCallback runDaily(String name, ScheduledTask task, MarketPhase phase, String referenceInstrument) {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
        if (phase == null) {
            throw new IllegalArgumentException("phase cannot be null");
        }
        StrategyInstance instance = scope.instance();
        String callbackName = name != null ? name : "daily_" + (instance.getScheduler().getCallbacks().size() + 1);
        return instance.getScheduler().register(callbackName, task, phase, referenceInstrument);
    }

    private Order submit(String symbol, Side side, BigDecimal quantity, BigDecimal price) {
        if (symbol == null || symbol.isEmpty()) {
            throw new IllegalArgumentException("symbol cannot be null or empty");
        }
        if (quantity == null || quantity.signum() <= 0) {
            throw new IllegalArgumentException("quantity must be positive: " + quantity);
        }
        if (price != null && price.signum() <= 0) {
            throw new IllegalArgumentException("price must be positive: " + price);
        }
        String uniqueId = scope.getExecId() + "_" + scope.nextOrderSequence();
        Order order = new Order("", uniqueId, symbol, side, price != null ? OrderType.LIMIT : OrderType.MARKET,
            quantity, price, OrderStatus.NEW, BigDecimal.ZERO, null, null, null);
        scope.addOrderOperation(OrderOperation.create(order));
        logger.debug("{} {} {} @ {} ({})", side, quantity.toPlainString(), symbol,
            price != null ? price.toPlainString() : "market", uniqueId);
        return order;
    }

    private Optional<Order> findIncomplete(String orderId) {
        return scope.dataAdapter().incompleteOrders().stream()
            .filter(order -> order.matches(orderId))
            .findFirst();
    }

    private BigDecimal referencePrice(String symbol) {
        for (String timeframe : instrument(symbol).timeframes()) {
            Optional<Bar> bar = scope.dataAdapter().latestBar(symbol, timeframe);
            if (bar.isPresent()) {
                return bar.get().close();
            }
        }
        throw new IllegalArgumentException("no price available for " + symbol);
    }

    private BigDecimal roundQuantity(String symbol, BigDecimal quantity) {
        if (marketTypeOf(symbol).isStock()) {
            return quantity.setScale(0, RoundingMode.DOWN);
        }
        return quantity;
    }

    private MarketType marketTypeOf(String symbol) {
        MarketType override = MarketType.parse(params().get("market_type"));
        return override != null ? override : MarketType.detect(symbol);
    }

    private ExecutionRequest request() {
        return scope.request();
    }
}
