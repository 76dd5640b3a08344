package com.ledger.engine.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;

import java.util.Objects;

/**
 * A single leaf condition: {@code field operator value}, optionally negated.
 *
 * <p>The comparison value is kept as a string and parsed into the field's type at
 * evaluation time. Negation inverts the operator's result, e.g.
 * {@code NOT description contains "refund"}.
 */
public class Trigger {

    @NotNull(message = "Field is required")
    @JsonProperty("field")
    private TriggerField field;

    @NotNull(message = "Operator is required")
    @JsonProperty("operator")
    private TriggerOperator operator;

    @JsonProperty("value")
    private String value;

    @JsonProperty("negated")
    private boolean negated;

    public Trigger() {
    }

    public Trigger(TriggerField field, TriggerOperator operator, String value) {
        this(field, operator, value, false);
    }

    public Trigger(TriggerField field, TriggerOperator operator, String value, boolean negated) {
        this.field = field;
        this.operator = operator;
        this.value = value;
        this.negated = negated;
    }

    /**
     * Copy of this trigger with the given negation flag.
     */
    public Trigger withNegation(boolean negated) {
        return new Trigger(field, operator, value, negated);
    }

    public TriggerField getField() {
        return field;
    }

    public void setField(TriggerField field) {
        this.field = field;
    }

    public TriggerOperator getOperator() {
        return operator;
    }

    public void setOperator(TriggerOperator operator) {
        this.operator = operator;
    }

    public String getValue() {
        return value;
    }

    public void setValue(String value) {
        this.value = value;
    }

    public boolean isNegated() {
        return negated;
    }

    public void setNegated(boolean negated) {
        this.negated = negated;
    }

    public String toHumanReadable() {
        return RuleFormatter.format(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Trigger trigger = (Trigger) o;
        return negated == trigger.negated
                && field == trigger.field
                && operator == trigger.operator
                && Objects.equals(value, trigger.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, operator, value, negated);
    }

    @Override
    public String toString() {
        return "Trigger{" +
               "field=" + field +
               ", operator=" + operator +
               ", value='" + value + '\'' +
               ", negated=" + negated +
               '}';
    }
}
