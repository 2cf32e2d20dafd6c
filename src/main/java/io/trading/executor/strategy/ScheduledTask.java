package io.trading.executor.strategy;

/**
 * Body of a periodic callback.
 */
@FunctionalInterface
public interface ScheduledTask {

    void run(StrategyContext context) throws Exception;
}
