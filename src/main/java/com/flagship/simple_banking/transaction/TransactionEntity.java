package com.flagship.simple_banking.transaction;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * JPA Entity for Transaction persistence.
 *
 * Transactions are append-only: no setters, every column updatable = false.
 * fromDomain() is the only way to create instances.
 */
@Entity
@Table(
    name = "transactions",
    indexes = @Index(name = "idx_transactions_account_event_date", columnList = "account_id, event_date")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TransactionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "account_id", nullable = false, updatable = false)
    private Long accountId;

    @Column(name = "operation_type_id", nullable = false, updatable = false)
    private Integer operationTypeId;

    @Column(nullable = false, updatable = false, precision = 19, scale = 4)
    private BigDecimal amount;

    @Column(name = "event_date", nullable = false, updatable = false)
    private Instant eventDate;

    static TransactionEntity fromDomain(Transaction transaction) {
        return new TransactionEntity(
            null, // id - assigned by the database
            transaction.getAccountId(),
            transaction.getOperationTypeId(),
            transaction.getAmount(),
            transaction.getEventDate()
        );
    }

    public Transaction toDomain() {
        return new Transaction(id, accountId, operationTypeId, amount, eventDate);
    }
}
