package io.trading.executor.data;

import io.trading.executor.model.Bar;
import io.trading.executor.model.Fill;
import io.trading.executor.model.InstrumentInfo;
import io.trading.executor.model.Order;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only data access for strategy code, scoped to one execution.
 * Implementations never perform I/O.
 */
public interface DataAdapter {

    /**
     * Returns the last {@code count} bars of a series, oldest first.
     *
     * @param symbol    Instrument symbol
     * @param count     Number of bars, must be positive
     * @param timeframe Resolution (e.g. "1h")
     * @throws io.trading.executor.error.InsufficientDataException if the series is absent
     *         or holds fewer than {@code count} bars
     */
    List<Bar> history(String symbol, int count, String timeframe);

    /**
     * @throws io.trading.executor.error.InsufficientDataException if the symbol is absent
     */
    InstrumentInfo instrumentMetadata(String symbol);

    /**
     * Fills keyed by order id, for every known order with executed quantity.
     */
    Map<String, Fill> trades();

    /**
     * Symbols present in the snapshot, sorted.
     */
    List<String> symbols();

    /**
     * Latest bar of a specific series, if the request carries it.
     */
    Optional<Bar> latestBar(String symbol, String timeframe);

    /**
     * Latest bar of the first series, if any.
     */
    Optional<Bar> currentBar();

    List<Order> incompleteOrders();

    List<Order> completedOrders();
}
