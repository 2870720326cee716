package com.flagship.finance_tracker.observability;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Centralized metrics for ledger operations.
 *
 * Metrics exposed:
 * - ledger.mutations: Counter of engine mutations, tagged by operation and outcome
 * - ledger.persistence.failures: Counter of snapshot load/save failures
 * - debt.payoff.simulation.duration: Timer for payoff projections
 * - ledger.net_worth: Gauge of the active profile's net worth
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;
    private final Timer simulationTimer;
    private final AtomicReference<BigDecimal> netWorth = new AtomicReference<>(BigDecimal.ZERO);

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.simulationTimer = Timer.builder("debt.payoff.simulation.duration")
                .description("Time taken to project debt payoff")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);

        Gauge.builder("ledger.net_worth", netWorth, ref -> ref.get().doubleValue())
                .description("Net worth of the active profile")
                .register(registry);
    }

    /**
     * Records an engine mutation with its outcome.
     * Uses registry.counter() for efficient meter lookup/creation.
     */
    public void recordMutation(String operation, String outcome) {
        registry.counter("ledger.mutations",
                "operation", sanitizeTag(operation),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordPersistenceFailure(String operation) {
        registry.counter("ledger.persistence.failures",
                "operation", sanitizeTag(operation)
        ).increment();
    }

    public <T> T timeSimulation(Supplier<T> simulation) {
        return simulationTimer.record(simulation);
    }

    public void updateNetWorth(BigDecimal value) {
        netWorth.set(value != null ? value : BigDecimal.ZERO);
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.toLowerCase().replaceAll("[^a-z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
