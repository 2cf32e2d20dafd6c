package io.trading.executor.core;

import io.trading.executor.model.Bar;
import io.trading.executor.model.ExecutionRequest;
import io.trading.executor.model.MarketDataTrigger;
import io.trading.executor.model.Order;
import io.trading.executor.model.OrderStatusTrigger;
import io.trading.executor.model.RiskManageTrigger;
import io.trading.executor.model.Trigger;
import io.trading.executor.strategy.Strategy;
import io.trading.executor.strategy.StrategyContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Routes a trigger to the matching strategy entry point.
 */
public class TriggerDispatcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(TriggerDispatcher.class);

    /**
     * Invokes the entry point for the request's trigger.
     *
     * @return false if the entry point was skipped for lack of input (a market-data trigger
     *         with no bars)
     */
    public boolean dispatch(Strategy strategy, StrategyContext context, ExecutionRequest request) throws Exception {
        Trigger trigger = request.trigger();
        switch (trigger.type()) {
            case MARKET_DATA -> {
                Optional<Bar> bar = context.currentBar();
                if (bar.isEmpty()) {
                    LOGGER.debug("[{}] No bars for {}, skipping onBar", request.execId(), trigger);
                    return false;
                }
                strategy.onBar(context, bar.get());
            }
            case ORDER_STATUS -> strategy.onOrderStatus(context, resolveOrder((OrderStatusTrigger) trigger, request));
            case RISK_MANAGE -> strategy.onRiskEvent(context, (RiskManageTrigger) trigger);
        }
        return true;
    }

    /**
     * The order named by the trigger among incomplete then completed orders; failing that the
     * first incomplete order; failing that an empty placeholder.
     */
    static Order resolveOrder(OrderStatusTrigger trigger, ExecutionRequest request) {
        String orderId = trigger.orderId();
        if (orderId != null && !orderId.isEmpty()) {
            for (Order order : request.incompleteOrders()) {
                if (order.matches(orderId)) {
                    return order;
                }
            }
            for (Order order : request.completedOrders()) {
                if (order.matches(orderId)) {
                    return order;
                }
            }
        }
        if (!request.incompleteOrders().isEmpty()) {
            return request.incompleteOrders().get(0);
        }
        return Order.empty();
    }

    /**
     * Instrument whose market times the trigger: the trigger's own symbol for market data,
     * otherwise the first market-data series.
     */
    static String referenceInstrument(ExecutionRequest request) {
        if (request.trigger() instanceof MarketDataTrigger marketData
            && marketData.symbol() != null && !marketData.symbol().isEmpty()) {
            return marketData.symbol();
        }
        if (!request.marketData().isEmpty()) {
            return request.marketData().get(0).symbol();
        }
        return "";
    }
}
