package com.flagship.finance_tracker.ledger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class BillScheduleTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 6, 10);

    private static Bill bill(LocalDate dueDate, BillFrequency frequency) {
        return Bill.builder()
            .id("b1")
            .name("Rent")
            .amount(new BigDecimal("1500"))
            .dueDate(dueDate)
            .accountId("a1")
            .frequency(frequency)
            .build();
    }

    @Test
    @DisplayName("Next due date advances by the bill's frequency")
    void testNextDueDate() {
        LocalDate due = LocalDate.of(2024, 6, 1);

        assertEquals(LocalDate.of(2024, 6, 8), BillSchedule.nextDueDate(bill(due, BillFrequency.WEEKLY), TODAY));
        assertEquals(LocalDate.of(2024, 6, 15), BillSchedule.nextDueDate(bill(due, BillFrequency.BIWEEKLY), TODAY));
        assertEquals(LocalDate.of(2024, 7, 1), BillSchedule.nextDueDate(bill(due, BillFrequency.MONTHLY), TODAY));
    }

    @Test
    @DisplayName("A bill without a due date is scheduled from the payment date")
    void testNextDueDateWithoutDueDate() {
        assertEquals(LocalDate.of(2024, 7, 10), BillSchedule.nextDueDate(bill(null, BillFrequency.MONTHLY), TODAY));
        assertEquals(LocalDate.of(2024, 7, 10), BillSchedule.nextDueDate(bill(null, null), TODAY));
    }

    @Test
    @DisplayName("Due status labels and tones")
    void testDueStatus() {
        assertEquals(new DueStatus("No due date", DueStatus.Tone.MUTED), BillSchedule.dueStatus(null, TODAY));
        assertEquals(new DueStatus("Overdue by 1 day", DueStatus.Tone.DANGER),
            BillSchedule.dueStatus(TODAY.minusDays(1), TODAY));
        assertEquals(new DueStatus("Overdue by 3 days", DueStatus.Tone.DANGER),
            BillSchedule.dueStatus(TODAY.minusDays(3), TODAY));
        assertEquals(new DueStatus("Due today", DueStatus.Tone.WARNING), BillSchedule.dueStatus(TODAY, TODAY));
        assertEquals(new DueStatus("Due tomorrow", DueStatus.Tone.WARNING),
            BillSchedule.dueStatus(TODAY.plusDays(1), TODAY));
        assertEquals(new DueStatus("Due in 7 days", DueStatus.Tone.WARNING),
            BillSchedule.dueStatus(TODAY.plusDays(7), TODAY));
        assertEquals(new DueStatus("Due 2024-06-18", DueStatus.Tone.MUTED),
            BillSchedule.dueStatus(TODAY.plusDays(8), TODAY));
    }
}
