package com.flagship.simple_banking.transaction.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Request DTO for creating a transaction.
 *
 * No bean validation here: TransactionNormalizer checks the fields in a fixed
 * order.
 */
@Value
public class CreateTransactionRequest {

    @JsonProperty("account_id")
    Long accountId;

    @JsonProperty("operation_type_id")
    Integer operationTypeId;

    @JsonProperty("amount")
    BigDecimal amount;
}
