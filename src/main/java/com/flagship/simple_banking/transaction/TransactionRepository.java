package com.flagship.simple_banking.transaction;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for Transaction persistence.
 */
@Repository
public interface TransactionRepository extends JpaRepository<TransactionEntity, Long> {

    long countByAccountId(Long accountId);

    /**
     * Offset-based page of an account's transactions, newest first.
     * Pageable is page-number based, so LIMIT/OFFSET are passed straight through.
     */
    @Query(value = "SELECT * FROM transactions WHERE account_id = :accountId "
            + "ORDER BY event_date DESC, id DESC LIMIT :limit OFFSET :offset",
        nativeQuery = true)
    List<TransactionEntity> findPageByAccountId(@Param("accountId") long accountId,
                                                @Param("limit") int limit,
                                                @Param("offset") long offset);
}
