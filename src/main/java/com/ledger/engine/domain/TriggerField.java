package com.ledger.engine.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

import static com.ledger.engine.domain.TriggerOperator.*;

/**
 * Transaction field a trigger can inspect.
 * <p>
 * The set is closed: rule definitions referencing any other field are rejected
 * when parsed and evaluate to false if constructed programmatically with a null field.
 */
public enum TriggerField {

    DESCRIPTION("description", ValueKind.TEXT),
    ACCOUNT_NAME("account_name", ValueKind.TEXT),
    COUNTER_PARTY("counter_party", ValueKind.TEXT),
    COUNTER_IBAN("counter_iban", ValueKind.TEXT),
    AMOUNT("amount", ValueKind.NUMBER),
    DATE("date", ValueKind.DATE),
    IBAN("iban", ValueKind.TEXT),
    TRANSACTION_TYPE("transaction_type", ValueKind.TRANSACTION_TYPE),
    CATEGORY("category", ValueKind.CATEGORY),
    NOTES("notes", ValueKind.TEXT),
    EXTERNAL_ID("external_id", ValueKind.TEXT),
    INTERNAL_REFERENCE("internal_reference", ValueKind.TEXT),
    TAGS("tags", ValueKind.TAGS);

    /**
     * Semantic type of the value a field yields.
     */
    public enum ValueKind {
        TEXT,
        NUMBER,
        DATE,
        CATEGORY,
        TRANSACTION_TYPE,
        TAGS
    }

    private static final Set<TriggerOperator> TEXT_OPERATORS = EnumSet.of(
            CONTAINS, STARTS_WITH, ENDS_WITH, EQUALS, MATCHES, IS_EMPTY, IS_NOT_EMPTY);

    private static final Set<TriggerOperator> NUMBER_OPERATORS = EnumSet.of(
            EQUALS, GREATER_THAN, GREATER_THAN_OR_EQUAL, LESS_THAN, LESS_THAN_OR_EQUAL, BETWEEN);

    private static final Set<TriggerOperator> DATE_OPERATORS = EnumSet.of(
            EQUALS, BEFORE, AFTER, ON, TODAY, YESTERDAY, TOMORROW, BETWEEN);

    private static final Set<TriggerOperator> TYPE_OPERATORS = EnumSet.of(EQUALS);

    private final String value;
    private final ValueKind kind;

    TriggerField(String value, ValueKind kind) {
        this.value = value;
        this.kind = kind;
    }

    public ValueKind getKind() {
        return kind;
    }

    /**
     * Operators an editor should offer for this field.
     * Evaluation itself is lenient and accepts any operator.
     */
    public Set<TriggerOperator> validOperators() {
        return switch (kind) {
            case TEXT, CATEGORY, TAGS -> TEXT_OPERATORS;
            case NUMBER -> NUMBER_OPERATORS;
            case DATE -> DATE_OPERATORS;
            case TRANSACTION_TYPE -> TYPE_OPERATORS;
        };
    }

    public boolean supports(TriggerOperator operator) {
        return operator != null && validOperators().contains(operator);
    }

    /**
     * Parses a field name, accepting both the snake_case form and the enum constant name.
     *
     * @return the field, or null if unknown
     */
    @JsonCreator
    public static TriggerField fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String normalized = raw.trim().toLowerCase();
        for (TriggerField field : values()) {
            if (field.value.equals(normalized)) {
                return field;
            }
        }
        return switch (normalized) {
            case "counterparty", "counter_name", "payee" -> COUNTER_PARTY;
            case "type" -> TRANSACTION_TYPE;
            case "account" -> ACCOUNT_NAME;
            default -> null;
        };
    }

    @JsonValue
    public String toValue() {
        return value;
    }
}
