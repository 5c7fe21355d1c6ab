package com.flagship.simple_banking.transaction;

import java.util.Optional;

/**
 * The closed set of operation types a transaction can carry.
 *
 * Ids match the rows seeded into {@code operation_types}. The debit/credit
 * classification is static domain knowledge and never comes from the client.
 */
public enum OperationType {
    PURCHASE(1, "Normal Purchase", EntryType.DEBIT),
    PURCHASE_WITH_INSTALLMENTS(2, "Purchase with installments", EntryType.DEBIT),
    WITHDRAWAL(3, "Withdrawal", EntryType.DEBIT),
    CREDIT_VOUCHER(4, "Credit Voucher", EntryType.CREDIT);

    private final int id;
    private final String description;
    private final EntryType entryType;

    OperationType(int id, String description, EntryType entryType) {
        this.id = id;
        this.description = description;
        this.entryType = entryType;
    }

    public int getId() {
        return id;
    }

    public String getDescription() {
        return description;
    }

    public EntryType entryType() {
        return entryType;
    }

    public boolean isDebit() {
        return entryType == EntryType.DEBIT;
    }

    public static Optional<OperationType> fromId(Integer id) {
        if (id == null) {
            return Optional.empty();
        }
        for (OperationType type : values()) {
            if (type.id == id) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
