package com.flagship.finance_tracker.ledger.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.finance_tracker.ledger.Transaction;
import com.flagship.finance_tracker.ledger.TransactionKind;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class TransactionResponse {

    @JsonProperty("id")
    String id;

    @JsonProperty("account_id")
    String accountId;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("date")
    LocalDate date;

    @JsonProperty("description")
    String description;

    @JsonProperty("kind")
    TransactionKind kind;

    @JsonProperty("transfer_group_id")
    String transferGroupId;

    public static TransactionResponse from(Transaction transaction) {
        return TransactionResponse.builder()
            .id(transaction.getId())
            .accountId(transaction.getAccountId())
            .amount(transaction.getAmount())
            .date(transaction.getDate())
            .description(transaction.getDescription())
            .kind(transaction.getKind())
            .transferGroupId(transaction.getTransferGroupId())
            .build();
    }

    public static List<TransactionResponse> fromAll(List<Transaction> transactions) {
        return transactions.stream().map(TransactionResponse::from).toList();
    }
}
