package io.trading.executor.strategy;

import io.trading.executor.error.StrategyLoadException;
import io.trading.executor.scope.ScopeKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Known strategies and their live instances.
 *
 * Strategies are registered by id with a factory; the first registered id is the default
 * for requests that name none. Instances are created lazily, one per (account, strategy)
 * pair, and replaced when retired.
 */
public class StrategyRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(StrategyRegistry.class);

    private final Map<String, Supplier<Strategy>> factories = new LinkedHashMap<>();
    private final ConcurrentHashMap<ScopeKey, StrategyInstance> instances = new ConcurrentHashMap<>();

    public synchronized void register(String strategyId, Supplier<Strategy> factory) {
        if (strategyId == null || strategyId.isEmpty()) {
            throw new IllegalArgumentException("strategyId cannot be null or empty");
        }
        if (factory == null) {
            throw new IllegalArgumentException("factory cannot be null");
        }
        if (factories.putIfAbsent(strategyId, factory) != null) {
            throw new IllegalArgumentException("Strategy already registered: " + strategyId);
        }
        LOGGER.info("Registered strategy {}", strategyId);
    }

    /**
     * Registers a strategy class by name. The class must implement {@link Strategy} and have
     * a public no-arg constructor.
     *
     * @throws StrategyLoadException if the class cannot be loaded or instantiated
     */
    public void registerClass(String strategyId, String className) {
        Class<? extends Strategy> type;
        try {
            Class<?> loaded = Class.forName(className);
            if (!Strategy.class.isAssignableFrom(loaded)) {
                throw new StrategyLoadException(strategyId, className + " does not implement Strategy");
            }
            type = loaded.asSubclass(Strategy.class);
            type.getConstructor();
        } catch (ClassNotFoundException e) {
            throw new StrategyLoadException(strategyId, "class not found: " + className, e);
        } catch (NoSuchMethodException e) {
            throw new StrategyLoadException(strategyId, className + " has no public no-arg constructor", e);
        }
        register(strategyId, () -> instantiate(strategyId, type));
    }

    public synchronized boolean contains(String strategyId) {
        return factories.containsKey(strategyId);
    }

    /**
     * Id used when a request names no strategy, null when none is registered.
     */
    public synchronized String getDefaultStrategyId() {
        return factories.isEmpty() ? null : factories.keySet().iterator().next();
    }

    public synchronized Set<String> getStrategyIds() {
        return Set.copyOf(factories.keySet());
    }

    public synchronized int size() {
        return factories.size();
    }

    /**
     * Live instance for the pair, creating it if absent or retired.
     *
     * @throws IllegalArgumentException if the strategy id is unknown
     */
    public StrategyInstance instanceFor(ScopeKey key) {
        Supplier<Strategy> factory;
        synchronized (this) {
            factory = factories.get(key.strategyId());
        }
        if (factory == null) {
            throw new IllegalArgumentException("Unknown strategy: " + key.strategyId());
        }
        return instances.compute(key, (k, existing) -> {
            if (existing != null && !existing.isRetired()) {
                return existing;
            }
            if (existing != null) {
                LOGGER.warn("[{}] Replacing retired strategy instance", k);
            }
            return new StrategyInstance(k, factory.get());
        });
    }

    /**
     * Retires the instance so that the pair's next execution starts from a fresh one.
     */
    public void retire(StrategyInstance instance) {
        instance.retire();
        LOGGER.warn("[{}] Strategy instance retired", instance.getKey());
    }

    public int getInstanceCount() {
        return instances.size();
    }

    private static Strategy instantiate(String strategyId, Class<? extends Strategy> type) {
        try {
            return type.getConstructor().newInstance();
        } catch (ReflectiveOperationException e) {
            throw new StrategyLoadException(strategyId, "cannot instantiate " + type.getName(), e);
        }
    }
}
