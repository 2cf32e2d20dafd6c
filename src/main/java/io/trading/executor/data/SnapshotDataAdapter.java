package io.trading.executor.data;

import io.trading.executor.error.InsufficientDataException;
import io.trading.executor.model.Bar;
import io.trading.executor.model.ExecutionRequest;
import io.trading.executor.model.Fill;
import io.trading.executor.model.InstrumentInfo;
import io.trading.executor.model.MarketDataContext;
import io.trading.executor.model.MarketType;
import io.trading.executor.model.Order;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * {@link DataAdapter} over the market-data snapshots of a single request.
 *
 * Built fresh per scope; every index is computed once in the constructor and is immutable
 * afterwards, so instances share nothing with each other.
 */
public class SnapshotDataAdapter implements DataAdapter {

    private final Map<SeriesKey, List<Bar>> series;
    private final Map<String, List<String>> timeframesBySymbol;
    private final MarketType marketTypeOverride;
    private final List<Order> incompleteOrders;
    private final List<Order> completedOrders;
    private final Map<String, Fill> trades;
    private final Bar currentBar;

    public SnapshotDataAdapter(ExecutionRequest request) {
        this(request.marketData(), request.incompleteOrders(), request.completedOrders(),
            MarketType.parse(request.strategyParams().get("market_type")));
    }

    /**
     * @param marketData         Snapshots, one per instrument/resolution pair
     * @param incompleteOrders   Working orders
     * @param completedOrders    Terminal orders
     * @param marketTypeOverride Market type applied to every symbol, null to detect by suffix
     */
    public SnapshotDataAdapter(List<MarketDataContext> marketData, List<Order> incompleteOrders,
                               List<Order> completedOrders, MarketType marketTypeOverride) {
        Map<SeriesKey, List<Bar>> seriesMap = new HashMap<>();
        Map<String, List<String>> timeframes = new LinkedHashMap<>();
        for (MarketDataContext context : marketData) {
            SeriesKey key = new SeriesKey(context.symbol(), context.timeframe());
            // first snapshot for a series wins
            if (seriesMap.putIfAbsent(key, context.bars()) == null) {
                timeframes.computeIfAbsent(context.symbol(), s -> new ArrayList<>()).add(context.timeframe());
            }
        }
        this.series = Collections.unmodifiableMap(seriesMap);

        Map<String, List<String>> frozen = new LinkedHashMap<>();
        timeframes.forEach((symbol, list) -> frozen.put(symbol, List.copyOf(list)));
        this.timeframesBySymbol = Collections.unmodifiableMap(frozen);

        this.marketTypeOverride = marketTypeOverride;
        this.incompleteOrders = List.copyOf(incompleteOrders);
        this.completedOrders = List.copyOf(completedOrders);
        this.trades = Collections.unmodifiableMap(indexFills(this.completedOrders, this.incompleteOrders));

        Bar latest = null;
        if (!marketData.isEmpty() && !marketData.get(0).bars().isEmpty()) {
            List<Bar> bars = marketData.get(0).bars();
            latest = bars.get(bars.size() - 1);
        }
        this.currentBar = latest;
    }

    @Override
    public List<Bar> history(String symbol, int count, String timeframe) {
        if (count <= 0) {
            throw new IllegalArgumentException("count must be positive: " + count);
        }
        List<Bar> bars = series.get(new SeriesKey(symbol, timeframe));
        if (bars == null) {
            throw new InsufficientDataException(symbol, "no " + timeframe + " series in request");
        }
        if (bars.size() < count) {
            throw new InsufficientDataException(symbol,
                String.format("requested %d %s bars, snapshot holds %d", count, timeframe, bars.size()));
        }
        return bars.subList(bars.size() - count, bars.size());
    }

    @Override
    public Optional<Bar> latestBar(String symbol, String timeframe) {
        List<Bar> bars = series.get(new SeriesKey(symbol, timeframe));
        if (bars == null || bars.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(bars.get(bars.size() - 1));
    }

    @Override
    public InstrumentInfo instrumentMetadata(String symbol) {
        List<String> timeframes = timeframesBySymbol.get(symbol);
        if (timeframes == null) {
            throw new InsufficientDataException(symbol, "symbol not present in request");
        }
        long first = Long.MAX_VALUE;
        long last = 0;
        for (String timeframe : timeframes) {
            List<Bar> bars = series.get(new SeriesKey(symbol, timeframe));
            if (!bars.isEmpty()) {
                first = Math.min(first, bars.get(0).openTime());
                last = Math.max(last, bars.get(bars.size() - 1).closeTime());
            }
        }
        MarketType marketType = marketTypeOverride != null ? marketTypeOverride : MarketType.detect(symbol);
        return new InstrumentInfo(symbol, marketType, timeframes, first == Long.MAX_VALUE ? 0 : first, last);
    }

    @Override
    public Map<String, Fill> trades() {
        return trades;
    }

    @Override
    public List<String> symbols() {
        return List.copyOf(new TreeSet<>(timeframesBySymbol.keySet()));
    }

    @Override
    public Optional<Bar> currentBar() {
        return Optional.ofNullable(currentBar);
    }

    @Override
    public List<Order> incompleteOrders() {
        return incompleteOrders;
    }

    @Override
    public List<Order> completedOrders() {
        return completedOrders;
    }

    private static Map<String, Fill> indexFills(List<Order> completed, List<Order> incomplete) {
        Map<String, Fill> fills = new LinkedHashMap<>();
        for (List<Order> orders : List.of(completed, incomplete)) {
            for (Order order : orders) {
                if (order.executedQuantity().signum() > 0) {
                    Fill fill = Fill.fromOrder(order);
                    fills.putIfAbsent(fill.orderId(), fill);
                }
            }
        }
        return fills;
    }

    private record SeriesKey(String symbol, String timeframe) {}
}
