package com.flagship.finance_tracker.payoff;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Debt payoff simulator tests.
 *
 * These tests verify that:
 * - One simulated month applies interest, then minimums, then the leftover budget
 * - An allocation below the minimums short-circuits without simulating
 * - The loop always terminates and balances never grow under a sufficient budget
 */
class DebtPayoffSimulatorTest {

    private static final LocalDate START = LocalDate.of(2024, 3, 1);
    private static final double EPSILON = 1e-9;

    private final DebtPayoffSimulator simulator = new DebtPayoffSimulator();

    private final DebtInput debtA = new DebtInput("A", "Store card", 500, 25, 0.24, 600);
    private final DebtInput debtB = new DebtInput("B", "Car loan", 1000, 40, 0.12, 1000);

    // Helper methods for test output
    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    @Test
    @DisplayName("Snowball month 1: interest, minimums, then leftover to the smallest balance")
    void testSnowballFirstMonth() {
        printTestHeader("Snowball First Month");

        DebtPayoffResult result = simulator.simulate(List.of(debtB, debtA), DebtPayoffMode.SNOWBALL, 100, START);

        assertFalse(result.isInsufficientAllocation());
        assertEquals("A", result.getDebts().get(0).getId());
        assertEquals("B", result.getDebts().get(1).getId());

        PayoffMonth first = result.getSchedule().get(0);
        printOutput("Month 1", first);
        assertEquals(1, first.getMonth());
        assertEquals(LocalDate.of(2024, 4, 1), first.getDate());
        assertEquals(450.0, first.getBalances().get("A"), EPSILON);
        assertEquals(970.0, first.getBalances().get("B"), EPSILON);
        assertEquals(1420.0, first.getTotalRemaining(), EPSILON);
        assertEquals(65.0, result.getTotalMinimumPayments(), EPSILON);
    }

    @Test
    @DisplayName("Snowball projects payoff dates and progress toward the next debt")
    void testSnowballProjection() {
        DebtPayoffResult result = simulator.simulate(List.of(debtA, debtB), DebtPayoffMode.SNOWBALL, 100, START);

        DebtProjection a = result.getDebts().get(0);
        DebtProjection b = result.getDebts().get(1);
        assertNotNull(a.getEstimatedPayoffDate());
        assertNotNull(b.getEstimatedPayoffDate());
        assertTrue(a.getEstimatedPayoffDate().isBefore(b.getEstimatedPayoffDate()));
        assertEquals(b.getEstimatedPayoffDate(), result.getOverallEstimatedDebtFreeDate());

        assertEquals("A", result.getNextDebtId());
        assertEquals(a.getEstimatedPayoffDate(), result.getNextDebtEstimatedPayoffDate());
        assertEquals(1.0 / 6.0, result.getProgressToNextDebt(), EPSILON);
        assertEquals(10.0, a.getEstimatedMonthlyInterest(), EPSILON);

        PayoffMonth last = result.getSchedule().get(result.getSchedule().size() - 1);
        assertEquals(b.getEstimatedPayoffDate(), last.getDate());
        assertEquals(0.0, last.getTotalRemaining(), EPSILON);
    }

    @Test
    @DisplayName("Allocation below combined minimums returns immediately with the first debt as target")
    void testInsufficientAllocation() {
        printTestHeader("Insufficient Allocation");

        DebtPayoffResult result = simulator.simulate(List.of(debtB, debtA), DebtPayoffMode.SNOWBALL, 50, START);
        printOutput("Result", result);

        assertTrue(result.isInsufficientAllocation());
        assertEquals("A", result.getNextDebtId());
        assertTrue(result.getSchedule().isEmpty());
        assertNull(result.getOverallEstimatedDebtFreeDate());
        assertTrue(result.getDebts().stream().allMatch(d -> d.getEstimatedPayoffDate() == null));
        assertEquals(1.0 / 6.0, result.getProgressToNextDebt(), EPSILON);
    }

    @Test
    @DisplayName("Zero allocation is insufficient even with no minimums")
    void testZeroAllocationInsufficient() {
        DebtInput noMinimum = new DebtInput("C", "Family loan", 200, 0, 0, 200);

        DebtPayoffResult result = simulator.simulate(List.of(noMinimum), DebtPayoffMode.AVALANCHE, 0, START);

        assertTrue(result.isInsufficientAllocation());
        assertEquals("C", result.getNextDebtId());
        assertEquals(0.0, result.getProgressTotalPaid(), EPSILON);
    }

    @Test
    @DisplayName("Avalanche orders by APR descending and keeps input order on ties")
    void testAvalancheOrdering() {
        DebtInput low = new DebtInput("low", "Low", 100, 5, 0.05, 100);
        DebtInput highFirst = new DebtInput("high1", "High 1", 900, 5, 0.29, 900);
        DebtInput highSecond = new DebtInput("high2", "High 2", 50, 5, 0.29, 50);

        List<DebtInput> ordered = DebtPayoffSimulator.order(List.of(low, highFirst, highSecond), DebtPayoffMode.AVALANCHE);

        assertEquals(List.of("high1", "high2", "low"), ordered.stream().map(DebtInput::getId).toList());
    }

    @Test
    @DisplayName("Avalanche reports aggregate progress and no next debt")
    void testAvalancheProgress() {
        DebtPayoffResult result = simulator.simulate(List.of(debtA, debtB), DebtPayoffMode.AVALANCHE, 200, START);

        assertEquals("A", result.getDebts().get(0).getId());
        assertNull(result.getNextDebtId());
        assertEquals(1 - 1500.0 / 1600.0, result.getProgressTotalPaid(), EPSILON);
        assertNotNull(result.getOverallEstimatedDebtFreeDate());
    }

    @Test
    @DisplayName("Non-positive balances are ignored and negative fields clamp to zero")
    void testNormalization() {
        DebtInput paidOff = new DebtInput("paid", "Paid", 0, 10, 0.1, 100);
        DebtInput overpaid = new DebtInput("over", "Over", -20, 10, 0.1, 100);
        DebtInput odd = new DebtInput("odd", "Odd", 100, -5, -0.1, -50);

        DebtPayoffResult result = simulator.simulate(List.of(paidOff, overpaid, odd), DebtPayoffMode.SNOWBALL, 50, START);

        assertEquals(1, result.getDebts().size());
        DebtProjection projection = result.getDebts().get(0);
        assertEquals("odd", projection.getId());
        assertEquals(0.0, projection.getMinimumPayment(), EPSILON);
        assertEquals(0.0, projection.getApr(), EPSILON);
        assertEquals(0.0, projection.getStartingBalance(), EPSILON);
        assertEquals(0.0, result.getProgressToNextDebt(), EPSILON);
        assertEquals(2, result.getSchedule().size());
    }

    @Test
    @DisplayName("Simulation stops after 600 months when interest outpaces payments")
    void testTermination() {
        printTestHeader("Termination");

        DebtInput runaway = new DebtInput("R", "Runaway", 10000, 10, 0.24, 10000);

        DebtPayoffResult result = simulator.simulate(List.of(runaway), DebtPayoffMode.SNOWBALL, 10, START);
        printOutput("Months simulated", result.getSchedule().size());

        assertEquals(DebtPayoffSimulator.MAX_MONTHS, result.getSchedule().size());
        assertNull(result.getDebts().get(0).getEstimatedPayoffDate());
        assertNull(result.getOverallEstimatedDebtFreeDate());
    }

    @Test
    @DisplayName("Balances never increase and payoff dates never move once stamped")
    void testMonotonicity() {
        DebtPayoffResult result = simulator.simulate(List.of(debtA, debtB), DebtPayoffMode.SNOWBALL, 100, START);

        Map<String, Double> previous = new HashMap<>(Map.of("A", 500.0, "B", 1000.0));
        Map<String, LocalDate> firstZero = new HashMap<>();

        for (PayoffMonth month : result.getSchedule()) {
            for (Map.Entry<String, Double> entry : month.getBalances().entrySet()) {
                assertTrue(entry.getValue() <= previous.get(entry.getKey()) + EPSILON,
                        "balance grew for " + entry.getKey() + " in month " + month.getMonth());
                previous.put(entry.getKey(), entry.getValue());
                if (entry.getValue() == 0.0) {
                    firstZero.putIfAbsent(entry.getKey(), month.getDate());
                }
            }
        }

        for (DebtProjection debt : result.getDebts()) {
            assertEquals(firstZero.get(debt.getId()), debt.getEstimatedPayoffDate());
        }
    }

    @Test
    @DisplayName("No debts means nothing to simulate")
    void testNoDebts() {
        DebtPayoffResult result = simulator.simulate(List.of(), DebtPayoffMode.SNOWBALL, 100, START);

        assertFalse(result.isInsufficientAllocation());
        assertTrue(result.getDebts().isEmpty());
        assertTrue(result.getSchedule().isEmpty());
        assertNull(result.getNextDebtId());
        assertNull(result.getOverallEstimatedDebtFreeDate());
    }
}
