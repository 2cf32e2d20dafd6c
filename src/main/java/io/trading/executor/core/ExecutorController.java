package io.trading.executor.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.trading.executor.config.ExecutorConfig;
import io.trading.executor.config.StrategyBinding;
import io.trading.executor.lookup.ConfigLookupService;
import io.trading.executor.lookup.DescriptorLocator;
import io.trading.executor.lookup.DescriptorParser;
import io.trading.executor.metrics.ExecutorMetrics;
import io.trading.executor.server.ExecutorHttpServer;
import io.trading.executor.strategy.StrategyRegistry;
import org.agrona.CloseHelper;
import org.agrona.concurrent.ShutdownSignalBarrier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Main controller for the Strategy Executor.
 * Wires the lookup service, strategy registry, gateway, health monitor and HTTP server.
 */
public class ExecutorController implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ExecutorController.class);

    private final ExecutorConfig config;
    private final ExecutorMetrics metrics;
    private final ConfigLookupService lookupService;
    private final StrategyRegistry registry;
    private final ExecutionGateway gateway;
    private final HealthMonitor healthMonitor;
    private final ExecutorHttpServer httpServer;
    private final ShutdownSignalBarrier shutdownBarrier;

    public ExecutorController(ExecutorConfig config) {
        this(config, new ExecutorMetrics());
    }

    public ExecutorController(ExecutorConfig config, ExecutorMetrics metrics) {
        this.config = config;
        this.metrics = metrics;

        DescriptorParser parser = new DescriptorParser(new ObjectMapper(), metrics::recordDescriptorParse);
        this.lookupService = new ConfigLookupService(DescriptorLocator.standard(config.configDir()), parser);

        this.registry = new StrategyRegistry();
        for (StrategyBinding binding : config.strategies()) {
            registry.registerClass(binding.strategyId(), binding.className());
        }

        this.gateway = new ExecutionGateway(config, registry, lookupService, metrics);
        this.healthMonitor = new HealthMonitor(config.healthCheckMs(), gateway::health, metrics);
        this.httpServer = new ExecutorHttpServer(config.httpPort(), gateway, config, metrics.getRegistry());
        this.shutdownBarrier = new ShutdownSignalBarrier();

        LOGGER.info("Executor controller initialized: {}", config.executorId());
    }

    /**
     * Starts the health monitor and the HTTP server.
     */
    public void start() throws IOException {
        LOGGER.info("Starting Strategy Executor...");

        healthMonitor.start();
        healthMonitor.performHealthCheck();
        httpServer.start();

        LOGGER.info("Strategy Executor started successfully");
        logStatus();
    }

    /**
     * Waits for shutdown signal.
     */
    public void waitForShutdown() {
        LOGGER.info("Executor running. Press Ctrl+C to shutdown.");
        shutdownBarrier.await();

        LOGGER.info("Shutdown signal received");
    }

    /**
     * Stops the executor gracefully.
     */
    public void shutdown() {
        LOGGER.info("Shutting down Strategy Executor...");
        CloseHelper.closeAll(httpServer, healthMonitor, gateway);
        LOGGER.info("Strategy Executor shutdown complete");
    }

    @Override
    public void close() {
        shutdown();
    }

    /**
     * Logs current executor status.
     */
    public void logStatus() {
        LOGGER.info("=== Executor Status ===");
        LOGGER.info("Executor ID: {}", config.executorId());
        LOGGER.info("HTTP Port: {}", httpServer.getPort());
        LOGGER.info("Venues: {}", config.venues());
        LOGGER.info("Strategies: {} (default {})", registry.getStrategyIds(), registry.getDefaultStrategyId());
        LOGGER.info("Strategy instances: {}", registry.getInstanceCount());
        LOGGER.info("Dedup records: {}", gateway.getDedupCache().size());
        LOGGER.info("Descriptor cache entries: {}, parses: {}",
            lookupService.getCacheSize(), lookupService.getParser().getParseCount());
        healthMonitor.logSummary();
        LOGGER.info("=====================");
    }

    /**
     * Gets the shutdown barrier for external signal handling.
     */
    public ShutdownSignalBarrier getShutdownBarrier() {
        return shutdownBarrier;
    }

    public ExecutionGateway getGateway() {
        return gateway;
    }

    public ConfigLookupService getLookupService() {
        return lookupService;
    }

    public ExecutorHttpServer getHttpServer() {
        return httpServer;
    }

    public ExecutorMetrics getMetrics() {
        return metrics;
    }
}
