package com.ledger.engine.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Comparison applied by a trigger.
 * <p>
 * Operators are normalized from their string form when a rule is parsed, so evaluation
 * switches over a closed enum instead of comparing strings.
 * <p>
 * Accepted aliases:
 * <ul>
 *   <li>EQUALS: "equals", "eq", "="</li>
 *   <li>MATCHES: "matches", "regex", "~"</li>
 *   <li>GREATER_THAN: "greater_than", "gt", "&gt;"</li>
 *   <li>GREATER_THAN_OR_EQUAL: "greater_than_or_equal", "gte", "&gt;="</li>
 *   <li>LESS_THAN: "less_than", "lt", "&lt;"</li>
 *   <li>LESS_THAN_OR_EQUAL: "less_than_or_equal", "lte", "&lt;="</li>
 * </ul>
 */
public enum TriggerOperator {

    CONTAINS("contains", "contains"),
    STARTS_WITH("starts_with", "starts with"),
    ENDS_WITH("ends_with", "ends with"),
    EQUALS("equals", "equals"),
    MATCHES("matches", "matches pattern"),

    GREATER_THAN("greater_than", ">"),
    GREATER_THAN_OR_EQUAL("greater_than_or_equal", ">="),
    LESS_THAN("less_than", "<"),
    LESS_THAN_OR_EQUAL("less_than_or_equal", "<="),
    BETWEEN("between", "between"),

    BEFORE("before", "before"),
    AFTER("after", "after"),
    ON("on", "on"),
    TODAY("today", "is today"),
    YESTERDAY("yesterday", "was yesterday"),
    TOMORROW("tomorrow", "is tomorrow"),

    IS_EMPTY("is_empty", "is empty"),
    IS_NOT_EMPTY("is_not_empty", "is not empty");

    /**
     * Separator between the two bounds of a {@link #BETWEEN} value, e.g. {@code 100..250}.
     */
    public static final String RANGE_SEPARATOR = "..";

    private final String value;
    private final String symbol;

    TriggerOperator(String value, String symbol) {
        this.value = value;
        this.symbol = symbol;
    }

    /**
     * Short form used in human-readable rule summaries.
     */
    public String getSymbol() {
        return symbol;
    }

    /**
     * Parses an operator from its string form.
     *
     * @param raw the operator string (e.g. "greater_than", "&gt;", "regex")
     * @return the operator, or null if unknown
     */
    @JsonCreator
    public static TriggerOperator fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return switch (raw.trim().toLowerCase()) {
            case "contains" -> CONTAINS;
            case "starts_with" -> STARTS_WITH;
            case "ends_with" -> ENDS_WITH;
            case "equals", "eq", "=" -> EQUALS;
            case "matches", "regex", "~" -> MATCHES;
            case "greater_than", "gt", ">" -> GREATER_THAN;
            case "greater_than_or_equal", "gte", ">=" -> GREATER_THAN_OR_EQUAL;
            case "less_than", "lt", "<" -> LESS_THAN;
            case "less_than_or_equal", "lte", "<=" -> LESS_THAN_OR_EQUAL;
            case "between" -> BETWEEN;
            case "before" -> BEFORE;
            case "after" -> AFTER;
            case "on" -> ON;
            case "today" -> TODAY;
            case "yesterday" -> YESTERDAY;
            case "tomorrow" -> TOMORROW;
            case "is_empty" -> IS_EMPTY;
            case "is_not_empty" -> IS_NOT_EMPTY;
            default -> null;
        };
    }

    @JsonValue
    public String toValue() {
        return value;
    }

    /**
     * @return true for operators that never read the comparison value
     */
    public boolean ignoresValue() {
        return this == TODAY || this == YESTERDAY || this == TOMORROW
                || this == IS_EMPTY || this == IS_NOT_EMPTY;
    }

    public boolean isText() {
        return this == CONTAINS || this == STARTS_WITH || this == ENDS_WITH || this == MATCHES;
    }

    public boolean isComparison() {
        return this == GREATER_THAN || this == GREATER_THAN_OR_EQUAL
                || this == LESS_THAN || this == LESS_THAN_OR_EQUAL || this == BETWEEN;
    }

    public boolean isRelativeDate() {
        return this == TODAY || this == YESTERDAY || this == TOMORROW;
    }
}
