package com.flagship.simple_banking.transaction;

import com.flagship.simple_banking.exception.PersistenceFailureException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Transaction store. Bridges the domain layer (Transaction) and the
 * persistence layer (TransactionEntity) and turns any storage error into a
 * {@link PersistenceFailureException}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransactionPersistenceService {

    private final TransactionRepository transactionRepository;

    /**
     * Writes one transaction and returns it with the storage-assigned id.
     */
    @Transactional
    public Transaction create(Transaction transaction) {
        try {
            TransactionEntity saved = transactionRepository.save(TransactionEntity.fromDomain(transaction));
            log.debug("Saved transaction {} for account {}", saved.getId(), saved.getAccountId());
            return saved.toDomain();
        } catch (DataAccessException e) {
            throw new PersistenceFailureException(
                "Failed to save transaction for account " + transaction.getAccountId(), e);
        }
    }

    @Transactional(readOnly = true)
    public Optional<Transaction> findById(long transactionId) {
        try {
            return transactionRepository.findById(transactionId).map(TransactionEntity::toDomain);
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Failed to load transaction " + transactionId, e);
        }
    }

    @Transactional(readOnly = true)
    public TransactionPage pageByAccount(long accountId, PageParameters page) {
        try {
            long total = transactionRepository.countByAccountId(accountId);
            List<Transaction> transactions = transactionRepository
                .findPageByAccountId(accountId, page.getLimit(), page.getOffset())
                .stream()
                .map(TransactionEntity::toDomain)
                .toList();
            return new TransactionPage(transactions, total, page.getLimit(), page.getOffset());
        } catch (DataAccessException e) {
            throw new PersistenceFailureException("Failed to list transactions for account " + accountId, e);
        }
    }
}
