package com.ledger.engine.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Formats rules, trigger trees and actions into human-readable strings for
 * rule previews, simulation explanations and log lines.
 * <p>
 * Example output: {@code IF (description contains 'netflix' AND amount > '10') THEN set_category 'Subscriptions'}
 */
public final class RuleFormatter {

    private RuleFormatter() {
    }

    /**
     * Formats a trigger, e.g. {@code NOT notes is empty} or {@code amount between '10..20'}.
     *
     * @param trigger the trigger to format
     * @return a formatted string representation
     */
    public static String format(Trigger trigger) {
        if (trigger == null) {
            return "null";
        }
        StringBuilder sb = new StringBuilder();
        if (trigger.isNegated()) {
            sb.append("NOT ");
        }
        sb.append(trigger.getField() != null ? trigger.getField().toValue() : "?");
        sb.append(' ').append(trigger.getOperator() != null ? trigger.getOperator().getSymbol() : "?");
        if (trigger.getOperator() == null || !trigger.getOperator().ignoresValue()) {
            sb.append(' ').append(formatValue(trigger.getValue()));
        }
        return sb.toString();
    }

    /**
     * Formats a trigger tree. Empty groups render as {@code always} (AND) or {@code never} (OR).
     */
    public static String format(TriggerGroup group) {
        if (group == null) {
            return "never";
        }
        if (group.isEmpty()) {
            return group.getCombinator() == TriggerGroup.Combinator.OR ? "never" : "always";
        }
        List<String> parts = new ArrayList<>();
        if (group.getTriggers() != null) {
            for (Trigger trigger : group.getTriggers()) {
                parts.add(format(trigger));
            }
        }
        if (group.getGroups() != null) {
            for (TriggerGroup child : group.getGroups()) {
                parts.add(format(child));
            }
        }
        String joiner = " " + group.getCombinator().name() + " ";
        return parts.size() == 1 ? parts.get(0) : "(" + String.join(joiner, parts) + ")";
    }

    public static String format(RuleAction action) {
        if (action == null || action.getType() == null) {
            return "null";
        }
        String value = action.getValue();
        String formatted = value == null || value.isBlank()
                ? action.getType().toValue()
                : action.getType().toValue() + " " + formatValue(value);
        return action.isStopProcessingAfter() ? formatted + " (stop)" : formatted;
    }

    /**
     * One-line summary of a rule for previews and simulation output.
     */
    public static String summarize(Rule rule) {
        if (rule == null) {
            return "null";
        }
        String actions = rule.getActions() == null || rule.getActions().isEmpty()
                ? "nothing"
                : rule.getActions().stream().map(RuleFormatter::format).collect(Collectors.joining(", "));
        String summary = "IF " + format(rule.getTriggerGroup()) + " THEN " + actions;
        return rule.isStopProcessing() ? summary + " AND STOP" : summary;
    }

    private static String formatValue(String value) {
        if (value == null) {
            return "null";
        }
        return "'" + value + "'";
    }
}
