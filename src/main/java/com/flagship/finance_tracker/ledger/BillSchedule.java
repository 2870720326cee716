package com.flagship.finance_tracker.ledger;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Due-date arithmetic for bills.
 */
public final class BillSchedule {

    private BillSchedule() {
        // Utility class
    }

    /**
     * Next due date after paying a recurring bill. Bills without a due date
     * are scheduled from the payment date.
     */
    public static LocalDate nextDueDate(Bill bill, LocalDate paidOn) {
        LocalDate base = bill.getDueDate() != null ? bill.getDueDate() : paidOn;
        BillFrequency frequency = bill.getFrequency() != null ? bill.getFrequency() : BillFrequency.MONTHLY;
        return frequency.advance(base);
    }

    public static DueStatus dueStatus(LocalDate dueDate, LocalDate today) {
        if (dueDate == null) {
            return new DueStatus("No due date", DueStatus.Tone.MUTED);
        }

        long diffDays = ChronoUnit.DAYS.between(today, dueDate);

        if (diffDays < 0) {
            long overdueBy = Math.abs(diffDays);
            return new DueStatus(
                String.format("Overdue by %d day%s", overdueBy, overdueBy == 1 ? "" : "s"),
                DueStatus.Tone.DANGER);
        }
        if (diffDays == 0) {
            return new DueStatus("Due today", DueStatus.Tone.WARNING);
        }
        if (diffDays == 1) {
            return new DueStatus("Due tomorrow", DueStatus.Tone.WARNING);
        }
        if (diffDays <= 7) {
            return new DueStatus(String.format("Due in %d days", diffDays), DueStatus.Tone.WARNING);
        }
        return new DueStatus("Due " + dueDate, DueStatus.Tone.MUTED);
    }
}
