package com.flagship.simple_banking.transaction;

import com.flagship.simple_banking.exception.ErrorCode;
import com.flagship.simple_banking.exception.ValidationException;
import com.flagship.simple_banking.observability.CorrelationContext;
import com.flagship.simple_banking.transaction.dto.CreateTransactionRequest;
import com.flagship.simple_banking.transaction.dto.TransactionPageResponse;
import com.flagship.simple_banking.transaction.dto.TransactionResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST Controller for transaction operations.
 *
 * Creation requires an Idempotency-Key header. Deduplication itself happens
 * in {@link com.flagship.simple_banking.idempotency.IdempotencyFilter} before
 * the request reaches this controller; here the header is only required to be
 * present.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class TransactionController {

    private final TransactionService transactionService;

    /**
     * Creates a new transaction with its amount sign normalized from the
     * operation type.
     *
     * @param request account, operation type and amount
     * @param idempotencyKey Idempotency key from header (required)
     * @return 201 with the persisted transaction
     */
    @PostMapping("/transactions")
    public ResponseEntity<TransactionResponse> createTransaction(
            @RequestBody CreateTransactionRequest request,
            @RequestHeader("${idempotency.header-name:Idempotency-Key}") String idempotencyKey) {

        if (idempotencyKey.isBlank()) {
            throw new ValidationException(ErrorCode.MISSING_HEADER, "Idempotency key must not be blank");
        }

        log.info("Received transaction creation request: idempotencyKey={}, accountId={}, operationTypeId={}",
            idempotencyKey, request.getAccountId(), request.getOperationTypeId());

        Transaction transaction = transactionService.createTransaction(
            request.getAccountId(), request.getOperationTypeId(), request.getAmount());
        MDC.put(CorrelationContext.TRANSACTION_ID_MDC_KEY, transaction.getId().toString());

        return ResponseEntity.status(HttpStatus.CREATED).body(TransactionResponse.from(transaction));
    }

    @GetMapping("/transactions/{transactionId}")
    public ResponseEntity<TransactionResponse> getTransaction(@PathVariable("transactionId") long transactionId) {
        return ResponseEntity.ok(TransactionResponse.from(transactionService.getTransaction(transactionId)));
    }

    @GetMapping("/accounts/{accountId}/transactions")
    public ResponseEntity<TransactionPageResponse> listTransactions(
            @PathVariable("accountId") long accountId,
            @RequestParam(name = "limit", required = false) Integer limit,
            @RequestParam(name = "offset", required = false) Long offset) {

        PageParameters page = PageParameters.of(limit, offset);
        MDC.put(CorrelationContext.ACCOUNT_ID_MDC_KEY, String.valueOf(accountId));

        return ResponseEntity.ok(TransactionPageResponse.from(transactionService.listTransactions(accountId, page)));
    }
}
