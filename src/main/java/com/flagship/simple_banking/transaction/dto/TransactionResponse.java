package com.flagship.simple_banking.transaction.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.simple_banking.transaction.Transaction;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class TransactionResponse {

    @JsonProperty("transaction_id")
    Long transactionId;

    @JsonProperty("account_id")
    Long accountId;

    @JsonProperty("operation_type_id")
    Integer operationTypeId;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("event_date")
    Instant eventDate;

    public static TransactionResponse from(Transaction transaction) {
        return TransactionResponse.builder()
            .transactionId(transaction.getId())
            .accountId(transaction.getAccountId())
            .operationTypeId(transaction.getOperationTypeId())
            .amount(transaction.getAmount())
            .eventDate(transaction.getEventDate())
            .build();
    }
}
