package com.flagship.simple_banking.transaction.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.simple_banking.transaction.TransactionPage;
import lombok.Value;

import java.util.List;

/**
 * Response DTO for listing an account's transactions.
 */
@Value
public class TransactionPageResponse {

    @JsonProperty("transactions")
    List<TransactionResponse> transactions;

    @JsonProperty("pagination")
    Pagination pagination;

    public static TransactionPageResponse from(TransactionPage page) {
        return new TransactionPageResponse(
            page.getTransactions().stream().map(TransactionResponse::from).toList(),
            new Pagination(page.getTotal(), page.getLimit(), page.getOffset(), page.getPages())
        );
    }

    @Value
    public static class Pagination {
        @JsonProperty("total")
        long total;

        @JsonProperty("limit")
        int limit;

        @JsonProperty("offset")
        long offset;

        @JsonProperty("pages")
        long pages;
    }
}
