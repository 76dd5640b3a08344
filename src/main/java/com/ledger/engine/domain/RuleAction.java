package com.ledger.engine.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;

import java.util.Objects;

/**
 * One mutation of a rule. Actions run in list order; a successful action with
 * {@code stopProcessingAfter} set ends the rule's action list early.
 */
public class RuleAction {

    @NotNull(message = "Action type is required")
    @JsonProperty("type")
    private ActionType type;

    @JsonProperty("value")
    private String value = "";

    @JsonProperty("stop_processing_after")
    private boolean stopProcessingAfter;

    public RuleAction() {
    }

    public RuleAction(ActionType type, String value) {
        this.type = type;
        this.value = value;
    }

    public static RuleAction of(ActionType type) {
        return new RuleAction(type, "");
    }

    public static RuleAction of(ActionType type, String value) {
        return new RuleAction(type, value);
    }

    public ActionType getType() {
        return type;
    }

    public void setType(ActionType type) {
        this.type = type;
    }

    public String getValue() {
        return value;
    }

    public void setValue(String value) {
        this.value = value;
    }

    public boolean isStopProcessingAfter() {
        return stopProcessingAfter;
    }

    public void setStopProcessingAfter(boolean stopProcessingAfter) {
        this.stopProcessingAfter = stopProcessingAfter;
    }

    public RuleAction stopAfter() {
        this.stopProcessingAfter = true;
        return this;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RuleAction that = (RuleAction) o;
        return stopProcessingAfter == that.stopProcessingAfter
                && type == that.type
                && Objects.equals(value, that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, value, stopProcessingAfter);
    }

    @Override
    public String toString() {
        return RuleFormatter.format(this);
    }
}
