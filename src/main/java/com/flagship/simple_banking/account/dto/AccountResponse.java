package com.flagship.simple_banking.account.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.simple_banking.account.Account;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class AccountResponse {

    @JsonProperty("account_id")
    Long accountId;

    @JsonProperty("document_number")
    String documentNumber;

    @JsonProperty("created_at")
    Instant createdAt;

    public static AccountResponse from(Account account) {
        return AccountResponse.builder()
            .accountId(account.getId())
            .documentNumber(account.getDocumentNumber())
            .createdAt(account.getCreatedAt())
            .build();
    }
}
