package com.flagship.simple_banking.transaction;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.time.Instant;

/**
 * Reference row for an operation type. Rows are seeded by migration and
 * never written by the application.
 */
@Entity
@Immutable
@Table(name = "operation_types")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class OperationTypeEntity {

    @Id
    private Integer id;

    @Column(nullable = false)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "entry_type", nullable = false, length = 10)
    private EntryType entryType;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;
}
