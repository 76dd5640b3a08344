package com.ledger.engine.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of a ledger transaction.
 *
 * <p>Parsing accepts the Firefly-style aliases used in rule values:
 * {@code deposit} for {@link #INCOME} and {@code withdrawal} for {@link #EXPENSE}.
 */
public enum TransactionType {

    INCOME,
    EXPENSE,
    TRANSFER,
    UNKNOWN;

    /**
     * Parses a transaction type from its name or one of its aliases.
     *
     * @param value the raw value (case-insensitive)
     * @return the matching type, or null if the value is not recognised
     */
    @JsonCreator
    public static TransactionType fromString(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return switch (value.trim().toLowerCase()) {
            case "income", "deposit", "credit" -> INCOME;
            case "expense", "withdrawal", "debit" -> EXPENSE;
            case "transfer" -> TRANSFER;
            case "unknown" -> UNKNOWN;
            default -> null;
        };
    }

    @JsonValue
    public String toValue() {
        return name().toLowerCase();
    }
}
