package com.flagship.simple_banking.account;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * JPA Entity for Account persistence.
 *
 * - No setters: accounts are immutable once written
 * - created_at is stamped by the @PrePersist hook
 * - fromDomain() is the only way to create instances
 */
@Entity
@Table(
    name = "accounts",
    uniqueConstraints = @UniqueConstraint(name = "uk_accounts_document_number", columnNames = "document_number")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class AccountEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "document_number", nullable = false, updatable = false, length = 14)
    private String documentNumber;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    static AccountEntity fromDomain(Account account) {
        return new AccountEntity(
            null, // id - assigned by the database
            account.getDocumentNumber(),
            null  // createdAt - will be set by @PrePersist
        );
    }

    public Account toDomain() {
        return new Account(id, documentNumber, createdAt);
    }
}
