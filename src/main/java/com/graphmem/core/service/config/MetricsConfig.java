package com.graphmem.core.service.config;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.context.annotation.Configuration;

import java.util.function.Supplier;

/**
 * Metrics configuration for the graph memory service.
 *
 * Provides custom metrics for message ingestion, consolidation and simulations.
 */
@Configuration
@Getter
public class MetricsConfig {

    private final MeterRegistry registry;

    // Counters
    private final Counter messagesRecorded;
    private final Counter messagesDegraded;
    private final Counter messagesReconciled;
    private final Counter consolidationsCompleted;
    private final Counter simulationsSubmitted;
    private final Counter simulationsCompleted;
    private final Counter simulationsFailed;
    private final Counter simulationsCancelled;
    private final Counter simulationsCommitted;

    // Timers
    private final Timer consolidationTimer;
    private final Timer generationTimer;

    public MetricsConfig(MeterRegistry registry) {
        this.registry = registry;

        this.messagesRecorded = Counter.builder("graphmem.messages.recorded")
                .description("Number of short-term messages recorded")
                .register(registry);

        this.messagesDegraded = Counter.builder("graphmem.messages.degraded")
                .description("Number of messages written to the fallback cache")
                .register(registry);

        this.messagesReconciled = Counter.builder("graphmem.messages.reconciled")
                .description("Number of fallback messages written through after recovery")
                .register(registry);

        this.consolidationsCompleted = Counter.builder("graphmem.consolidation.count")
                .description("Number of knowledge nodes created by consolidation")
                .register(registry);

        this.simulationsSubmitted = simulationCounter("submitted");
        this.simulationsCompleted = simulationCounter("completed");
        this.simulationsFailed = simulationCounter("failed");
        this.simulationsCancelled = simulationCounter("cancelled");
        this.simulationsCommitted = simulationCounter("committed");

        this.consolidationTimer = Timer.builder("graphmem.consolidation.duration")
                .description("Time taken for consolidation")
                .register(registry);

        this.generationTimer = Timer.builder("graphmem.generator.duration")
                .description("Time taken for text-completion calls")
                .register(registry);
    }

    /**
     * Registers a gauge for store size monitoring.
     *
     * @param name the metric name
     * @param description the metric description
     * @param sizeSupplier supplier for the current size
     */
    public void registerStoreGauge(String name, String description, Supplier<Number> sizeSupplier) {
        Gauge.builder(name, sizeSupplier)
                .description(description)
                .register(registry);
    }

    private Counter simulationCounter(String outcome) {
        return Counter.builder("graphmem.simulation.jobs")
                .description("Simulation jobs by outcome")
                .tag("outcome", outcome)
                .register(registry);
    }
}
