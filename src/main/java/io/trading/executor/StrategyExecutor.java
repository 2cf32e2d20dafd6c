package io.trading.executor;

import io.trading.executor.config.ExecutorConfig;
import io.trading.executor.core.ExecutorController;
import org.agrona.concurrent.ShutdownSignalBarrier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main entry point for the Strategy Executor application.
 */
public class StrategyExecutor {

    private static final Logger LOGGER = LoggerFactory.getLogger(StrategyExecutor.class);

    public static void main(String[] args) {
        LOGGER.info("========================================");
        LOGGER.info("   Strategy Executor Starting...");
        LOGGER.info("========================================");

        try {
            ExecutorConfig config = ExecutorConfig.fromEnv();
            LOGGER.info("Configuration loaded:");
            LOGGER.info("  Executor ID: {}", config.executorId());
            LOGGER.info("  HTTP Port: {}", config.httpPort());
            LOGGER.info("  Strategies: {}", config.strategies());
            LOGGER.info("  Descriptor override: {}", config.configDir() == null ? "-" : config.configDir());

            ExecutorController controller = new ExecutorController(config);
            controller.start();

            ShutdownSignalBarrier shutdownBarrier = controller.getShutdownBarrier();

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                LOGGER.info("Shutdown hook triggered");
                shutdownBarrier.signal();
            }));

            controller.waitForShutdown();
            controller.close();

        } catch (Exception e) {
            LOGGER.error("Fatal error in Strategy Executor", e);
            System.exit(1);
        }

        LOGGER.info("Strategy Executor exited");
    }
}
