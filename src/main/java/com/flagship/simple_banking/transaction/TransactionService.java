package com.flagship.simple_banking.transaction;

import com.flagship.simple_banking.account.AccountRepository;
import com.flagship.simple_banking.exception.ErrorCode;
import com.flagship.simple_banking.exception.NotFoundException;
import com.flagship.simple_banking.exception.PersistenceFailureException;
import com.flagship.simple_banking.exception.ValidationException;
import com.flagship.simple_banking.observability.BankingMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.function.Supplier;

/**
 * Creates and reads transactions.
 *
 * Creation order:
 * 1. account id positive            -> INVALID_ACCOUNT_ID
 * 2. operation type one of the four -> INVALID_OPERATION_TYPE
 * 3. amount non-zero                -> ZERO_AMOUNT
 *    amount fits NUMERIC(19, 4)     -> INVALID_AMOUNT
 * 4. account exists                 -> ACCOUNT_NOT_FOUND
 * 5. operation type row exists      -> INVALID_OPERATION_TYPE
 * then the amount is normalized and exactly one row is written.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionService {

    private final TransactionNormalizer normalizer;
    private final AccountRepository accountRepository;
    private final OperationTypeRepository operationTypeRepository;
    private final TransactionPersistenceService persistenceService;
    private final BankingMetrics metrics;
    private final Clock clock;

    @Transactional
    public Transaction createTransaction(Long accountId, Integer operationTypeId, BigDecimal amount) {
        long startTime = System.currentTimeMillis();
        String operationTag = String.valueOf(operationTypeId);

        try {
            OperationType operationType = normalizer.validate(accountId, operationTypeId, amount);
            operationTag = operationType.name();

            if (!lookup(() -> accountRepository.existsById(accountId), "account " + accountId)) {
                throw NotFoundException.account(accountId);
            }
            if (!lookup(() -> operationTypeRepository.existsById(operationType.getId()),
                    "operation type " + operationType.getId())) {
                throw ValidationException.invalidOperationType();
            }

            BigDecimal normalizedAmount = normalizer.normalize(amount, operationType);
            Transaction saved = persistenceService.create(
                Transaction.pending(accountId, operationType, normalizedAmount, now()));

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordTransactionCreated(operationTag, "success");
            metrics.recordTransactionLatency(duration);
            log.info("Transaction created: transactionId={}, accountId={}, operationType={}, amount={}, duration={}ms",
                saved.getId(), accountId, operationType, normalizedAmount, duration);

            return saved;

        } catch (RuntimeException e) {
            metrics.recordTransactionCreated(operationTag, "error");
            throw e;
        }
    }

    /**
     * @throws NotFoundException if no transaction has the id
     */
    @Transactional(readOnly = true)
    public Transaction getTransaction(long transactionId) {
        if (transactionId <= 0) {
            throw new ValidationException(
                ErrorCode.INVALID_TRANSACTION_ID,
                "transaction_id must be greater than 0");
        }
        return persistenceService.findById(transactionId)
            .orElseThrow(() -> NotFoundException.transaction(transactionId));
    }

    /**
     * Lists an account's transactions, newest first.
     *
     * @throws NotFoundException if the account does not exist
     */
    @Transactional(readOnly = true)
    public TransactionPage listTransactions(long accountId, PageParameters page) {
        if (accountId <= 0) {
            throw ValidationException.invalidAccountId();
        }
        if (!lookup(() -> accountRepository.existsById(accountId), "account " + accountId)) {
            throw NotFoundException.account(accountId);
        }
        return persistenceService.pageByAccount(accountId, page);
    }

    /**
     * The event date column keeps microseconds; truncating here makes the
     * created response match later reads.
     */
    private Instant now() {
        return Instant.now(clock).truncatedTo(ChronoUnit.MICROS);
    }

    private boolean lookup(Supplier<Boolean> query, String what) {
        try {
            return query.get();
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Failed to look up " + what, e);
        }
    }
}
