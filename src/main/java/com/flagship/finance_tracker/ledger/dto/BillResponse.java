package com.flagship.finance_tracker.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.finance_tracker.ledger.Bill;
import com.flagship.finance_tracker.ledger.BillFrequency;
import com.flagship.finance_tracker.ledger.BillSchedule;
import com.flagship.finance_tracker.ledger.DueStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Response DTO for a bill, with its due status relative to today.
 */
@Value
@Builder
public class BillResponse {

    @JsonProperty("id")
    String id;

    @JsonProperty("name")
    String name;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("due_date")
    LocalDate dueDate;

    @JsonProperty("account_id")
    String accountId;

    @JsonProperty("frequency")
    BillFrequency frequency;

    @JsonProperty("is_paid")
    boolean paid;

    @JsonProperty("due_status")
    String dueStatus;

    @JsonProperty("due_tone")
    DueStatus.Tone dueTone;

    public static BillResponse from(Bill bill, LocalDate today) {
        DueStatus status = BillSchedule.dueStatus(bill.getDueDate(), today);
        return BillResponse.builder()
            .id(bill.getId())
            .name(bill.getName())
            .amount(bill.getAmount())
            .dueDate(bill.getDueDate())
            .accountId(bill.getAccountId())
            .frequency(bill.getFrequency())
            .paid(bill.isPaid())
            .dueStatus(status.getLabel())
            .dueTone(status.getTone())
            .build();
    }
}
