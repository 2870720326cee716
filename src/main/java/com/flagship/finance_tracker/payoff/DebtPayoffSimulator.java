package com.flagship.finance_tracker.payoff;

import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Month-by-month debt amortization projection.
 *
 * Each simulated month:
 * 1. Interest accrues on every debt with a balance ({@code balance * apr / 12})
 * 2. Minimum payments are made in priority order
 * 3. Whatever is left of the monthly allocation goes to the first debt in
 *    priority order that is still owed
 *
 * A debt is considered paid once its balance is at or below one cent. The
 * threshold absorbs floating point drift from compounding over long horizons.
 * The loop stops when every debt is paid or after {@link #MAX_MONTHS} months.
 *
 * Pure and read-only: it never touches ledger state.
 */
@Component
public class DebtPayoffSimulator {

    public static final int MAX_MONTHS = 600;
    public static final double PAID_OFF_THRESHOLD = 0.01;

    /**
     * Projects payoff for the given debts.
     *
     * @param debtsInput debts with owed amounts as positive balances; non-positive balances are ignored
     * @param mode ordering strategy
     * @param monthlyAllocation total budget per month across all debts
     * @param startMonth first day of the current month; month {@code n} of the projection is {@code startMonth + n months}
     * @return projection result, or an insufficient-allocation result if the budget cannot cover minimums
     */
    public DebtPayoffResult simulate(List<DebtInput> debtsInput, DebtPayoffMode mode,
                                     double monthlyAllocation, LocalDate startMonth) {
        List<DebtInput> ordered = order(normalize(debtsInput), mode);

        double totalMinimums = ordered.stream().mapToDouble(DebtInput::getMinimumPayment).sum();

        if (monthlyAllocation < totalMinimums || monthlyAllocation <= 0) {
            return insufficientAllocation(ordered, mode, totalMinimums);
        }

        List<WorkingDebt> working = new ArrayList<>();
        for (DebtInput debt : ordered) {
            working.add(new WorkingDebt(debt));
        }

        DebtPayoffResult.DebtPayoffResultBuilder result = DebtPayoffResult.builder()
            .mode(mode)
            .totalMinimumPayments(totalMinimums)
            .insufficientAllocation(false);

        int month = 0;
        while (anyOwed(working) && month < MAX_MONTHS) {
            month += 1;
            LocalDate currentMonthDate = startMonth.plusMonths(month);

            for (WorkingDebt debt : working) {
                if (debt.balance <= 0) {
                    continue;
                }
                debt.balance += debt.balance * (debt.input.getApr() / 12);
            }

            double remainingBudget = monthlyAllocation;
            for (WorkingDebt debt : working) {
                if (debt.balance <= 0) {
                    continue;
                }
                double payment = Math.min(debt.balance, debt.input.getMinimumPayment());
                debt.balance -= payment;
                remainingBudget -= payment;
                debt.stampIfPaid(currentMonthDate);
            }

            if (remainingBudget > 0) {
                WorkingDebt target = firstOwed(working);
                if (target != null) {
                    double extra = Math.min(target.balance, remainingBudget);
                    target.balance -= extra;
                    target.stampIfPaid(currentMonthDate);
                }
            }

            result.month(snapshotMonth(month, currentMonthDate, working));
        }

        LocalDate overall = null;
        for (WorkingDebt debt : working) {
            result.debt(projection(debt.input, debt.payoffDate));
            if (debt.payoffDate != null && (overall == null || debt.payoffDate.isAfter(overall))) {
                overall = debt.payoffDate;
            }
        }
        result.overallEstimatedDebtFreeDate(overall);

        WorkingDebt next = working.isEmpty() ? null : working.get(0);
        if (mode == DebtPayoffMode.SNOWBALL && next != null) {
            result.nextDebtId(next.input.getId())
                .nextDebtEstimatedPayoffDate(next.payoffDate)
                .progressToNextDebt(progressOf(next.input));
        }
        if (mode == DebtPayoffMode.AVALANCHE) {
            result.progressTotalPaid(aggregateProgress(ordered));
        }

        return result.build();
    }

    private DebtPayoffResult insufficientAllocation(List<DebtInput> ordered, DebtPayoffMode mode, double totalMinimums) {
        DebtInput target = ordered.isEmpty() ? null : ordered.get(0);

        DebtPayoffResult.DebtPayoffResultBuilder result = DebtPayoffResult.builder()
            .mode(mode)
            .totalMinimumPayments(totalMinimums)
            .insufficientAllocation(true)
            .nextDebtId(target != null ? target.getId() : null);

        for (DebtInput debt : ordered) {
            result.debt(projection(debt, null));
        }
        if (mode == DebtPayoffMode.SNOWBALL && target != null) {
            result.progressToNextDebt(progressOf(target));
        }
        if (mode == DebtPayoffMode.AVALANCHE) {
            result.progressTotalPaid(aggregateProgress(ordered));
        }
        return result.build();
    }

    private static List<DebtInput> normalize(List<DebtInput> debts) {
        List<DebtInput> normalized = new ArrayList<>();
        for (DebtInput debt : debts) {
            if (debt.getBalance() <= 0) {
                continue;
            }
            normalized.add(new DebtInput(
                debt.getId(),
                debt.getName(),
                debt.getBalance(),
                Math.max(0, debt.getMinimumPayment()),
                Math.max(0, debt.getApr()),
                Math.max(0, debt.getStartingBalance())
            ));
        }
        return normalized;
    }

    static List<DebtInput> order(List<DebtInput> debts, DebtPayoffMode mode) {
        List<DebtInput> ordered = new ArrayList<>(debts);
        Comparator<DebtInput> comparator = mode == DebtPayoffMode.SNOWBALL
            ? Comparator.comparingDouble(DebtInput::getBalance)
            : Comparator.comparingDouble(DebtInput::getApr).reversed();
        ordered.sort(comparator);
        return ordered;
    }

    private static DebtProjection projection(DebtInput debt, LocalDate payoffDate) {
        return new DebtProjection(
            debt.getId(),
            debt.getName(),
            debt.getBalance(),
            debt.getMinimumPayment(),
            debt.getApr(),
            debt.getStartingBalance(),
            debt.getBalance() * (debt.getApr() / 12),
            payoffDate
        );
    }

    private static double progressOf(DebtInput debt) {
        if (debt.getStartingBalance() <= 0) {
            return 0;
        }
        return clamp(1 - debt.getBalance() / debt.getStartingBalance());
    }

    private static double aggregateProgress(List<DebtInput> debts) {
        double totalStarting = 0;
        double totalRemaining = 0;
        for (DebtInput debt : debts) {
            totalStarting += debt.getStartingBalance();
            totalRemaining += debt.getBalance();
        }
        return totalStarting > 0 ? clamp(1 - totalRemaining / totalStarting) : 0;
    }

    private static double clamp(double value) {
        return Math.max(0, Math.min(1, value));
    }

    private static boolean anyOwed(List<WorkingDebt> debts) {
        return firstOwed(debts) != null;
    }

    private static WorkingDebt firstOwed(List<WorkingDebt> debts) {
        for (WorkingDebt debt : debts) {
            if (debt.balance > PAID_OFF_THRESHOLD) {
                return debt;
            }
        }
        return null;
    }

    private static PayoffMonth snapshotMonth(int month, LocalDate date, List<WorkingDebt> debts) {
        Map<String, Double> balances = new LinkedHashMap<>();
        double total = 0;
        for (WorkingDebt debt : debts) {
            balances.put(debt.input.getId(), debt.balance);
            total += debt.balance;
        }
        return new PayoffMonth(month, date, balances, total);
    }

    private static final class WorkingDebt {
        private final DebtInput input;
        private double balance;
        private LocalDate payoffDate;

        private WorkingDebt(DebtInput input) {
            this.input = input;
            this.balance = input.getBalance();
        }

        // First stamp wins
        private void stampIfPaid(LocalDate date) {
            if (balance <= PAID_OFF_THRESHOLD && payoffDate == null) {
                balance = 0;
                payoffDate = date;
            }
        }
    }
}
