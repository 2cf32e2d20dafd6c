package io.trading.executor.example;

import io.trading.executor.error.InsufficientDataException;
import io.trading.executor.error.NotFoundException;
import io.trading.executor.model.Bar;
import io.trading.executor.model.MarketDataTrigger;
import io.trading.executor.model.TradingRule;
import io.trading.executor.scheduler.MarketPhase;
import io.trading.executor.strategy.Strategy;
import io.trading.executor.strategy.StrategyContext;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.List;

/**
 * Dual moving average crossover.
 *
 * Buys when the fast average crosses above the slow one and the account is flat or short;
 * sells the whole position when it crosses below. Params: {@code fast} (5), {@code slow}
 * (10), {@code quantity} (0.01), {@code timeframe} (trigger's, else 1h).
 */
public class DualMovingAverageStrategy implements Strategy {

    static final String STATE_LAST_SIGNAL = "last_signal";
    static final String STATE_TRADING_DAYS = "trading_days";

    @Override
    public void initialize(StrategyContext context) {
        if (fast(context) <= 0 || fast(context) >= slow(context)) {
            throw new IllegalArgumentException("fast must be positive and below slow");
        }
        context.runDaily("daily_summary", this::afterClose, MarketPhase.AFTER_CLOSE, null);
        context.logger().info("Dual MA initialized: fast={}, slow={}", fast(context), slow(context));
    }

    @Override
    public void beforeTrading(StrategyContext context) {
        int days = context.state().getOrDefault(STATE_TRADING_DAYS, Integer.class, 0);
        context.state().put(STATE_TRADING_DAYS, days + 1);
    }

    @Override
    public void onBar(StrategyContext context, Bar bar) {
        String symbol = symbol(context);
        if (symbol == null) {
            return;
        }
        int fast = fast(context);
        int slow = slow(context);
        List<Bar> bars;
        try {
            bars = context.history(symbol, slow + 1, timeframe(context));
        } catch (InsufficientDataException e) {
            context.logger().info("Waiting for data: {}", e.getMessage());
            return;
        }

        BigDecimal prevFast = average(bars.subList(slow - fast, slow), fast);
        BigDecimal prevSlow = average(bars.subList(0, slow), slow);
        BigDecimal currFast = average(bars.subList(slow + 1 - fast, slow + 1), fast);
        BigDecimal currSlow = average(bars.subList(1, slow + 1), slow);

        boolean goldenCross = prevFast.compareTo(prevSlow) <= 0 && currFast.compareTo(currSlow) > 0;
        boolean deathCross = prevFast.compareTo(prevSlow) >= 0 && currFast.compareTo(currSlow) < 0;
        BigDecimal position = context.account().positionQuantity(symbol);

        if (goldenCross && position.signum() <= 0) {
            context.logger().info("Golden cross on {} at {}", symbol, bar.close());
            context.orderBuy(symbol, quantity(context, symbol));
            context.state().put(STATE_LAST_SIGNAL, "buy");
        } else if (deathCross && position.signum() > 0) {
            context.logger().info("Death cross on {} at {}", symbol, bar.close());
            context.orderSell(symbol, position);
            context.state().put(STATE_LAST_SIGNAL, "sell");
        }
    }

    private void afterClose(StrategyContext context) {
        context.logger().info("Day closed, last signal: {}",
            context.state().getOrDefault(STATE_LAST_SIGNAL, String.class, "none"));
    }

    private static BigDecimal average(List<Bar> bars, int count) {
        BigDecimal sum = BigDecimal.ZERO;
        for (Bar bar : bars) {
            sum = sum.add(bar.close());
        }
        return sum.divide(BigDecimal.valueOf(count), MathContext.DECIMAL64);
    }

    /**
     * Configured quantity, rounded down to the venue's quantity step when a trading rule is
     * available.
     */
    private static BigDecimal quantity(StrategyContext context, String symbol) {
        BigDecimal quantity = new BigDecimal(context.param("quantity", "0.01"));
        try {
            TradingRule rule = context.tradingRule(symbol);
            BigDecimal steps = quantity.divide(rule.quantityStep(), 0, RoundingMode.DOWN);
            BigDecimal rounded = steps.multiply(rule.quantityStep());
            return rounded.max(rule.minQuantity()).max(rule.quantityStep());
        } catch (NotFoundException e) {
            context.logger().debug("No trading rule for {}, using raw quantity", symbol);
            return quantity;
        }
    }

    private static String symbol(StrategyContext context) {
        String symbol = context.param("symbol", null);
        if (symbol != null) {
            return symbol;
        }
        if (context.trigger() instanceof MarketDataTrigger marketData && marketData.symbol() != null) {
            return marketData.symbol();
        }
        List<String> symbols = context.symbols();
        return symbols.isEmpty() ? null : symbols.get(0);
    }

    private static String timeframe(StrategyContext context) {
        String timeframe = context.param("timeframe", null);
        if (timeframe != null) {
            return timeframe;
        }
        if (context.trigger() instanceof MarketDataTrigger marketData && marketData.timeframe() != null) {
            return marketData.timeframe();
        }
        return "1h";
    }

    private static int fast(StrategyContext context) {
        return Integer.parseInt(context.param("fast", "5"));
    }

    private static int slow(StrategyContext context) {
        return Integer.parseInt(context.param("slow", "10"));
    }
}
