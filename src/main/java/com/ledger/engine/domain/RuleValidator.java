package com.ledger.engine.domain;

import com.ledger.engine.util.ValueParsers;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

/**
 * Checks rule definitions for problems a rule editor should report.
 * <p>
 * Evaluation never depends on this: an invalid trigger simply evaluates to false and an
 * invalid action fails at execution time. Validation exists to give feedback up front.
 */
public final class RuleValidator {

    /**
     * A single problem found in a rule definition.
     *
     * @param path       location in the rule, e.g. {@code triggers[0].groups[1].triggers[2]}
     * @param message    what is wrong
     * @param suggestion how to fix it, may be null
     */
    public record Issue(String path, String message, String suggestion) {

        @Override
        public String toString() {
            return suggestion == null ? path + ": " + message : path + ": " + message + " (" + suggestion + ")";
        }
    }

    private RuleValidator() {
    }

    public static List<Issue> validate(Rule rule) {
        List<Issue> issues = new ArrayList<>();
        if (rule == null) {
            issues.add(new Issue("rule", "Rule is missing", null));
            return issues;
        }
        if (rule.getId() == null || rule.getId().isBlank()) {
            issues.add(new Issue("id", "Rule ID is required", null));
        }
        if (rule.getName() == null || rule.getName().isBlank()) {
            issues.add(new Issue("name", "Rule name is required", null));
        }
        if (rule.getTriggerGroup() == null) {
            issues.add(new Issue("trigger_group", "Rule has no trigger group and will never match",
                    "Use an empty AND group to match every transaction"));
        } else {
            validateGroup(rule.getTriggerGroup(), "trigger_group", issues);
        }
        List<RuleAction> actions = rule.getActions();
        if (actions == null || actions.isEmpty()) {
            issues.add(new Issue("actions", "Rule has no actions", null));
        } else {
            for (int i = 0; i < actions.size(); i++) {
                Issue issue = validateAction(actions.get(i), "actions[" + i + "]");
                if (issue != null) {
                    issues.add(issue);
                }
            }
        }
        return issues;
    }

    private static void validateGroup(TriggerGroup group, String path, List<Issue> issues) {
        if (group.getTriggers() != null) {
            for (int i = 0; i < group.getTriggers().size(); i++) {
                Issue issue = validateTrigger(group.getTriggers().get(i), path + ".triggers[" + i + "]");
                if (issue != null) {
                    issues.add(issue);
                }
            }
        }
        if (group.getGroups() != null) {
            for (int i = 0; i < group.getGroups().size(); i++) {
                TriggerGroup child = group.getGroups().get(i);
                String childPath = path + ".groups[" + i + "]";
                if (child == null) {
                    issues.add(new Issue(childPath, "Nested group is missing", null));
                } else {
                    validateGroup(child, childPath, issues);
                }
            }
        }
    }

    /**
     * Validates one trigger.
     *
     * @return the first problem found, or null if the trigger is valid
     */
    public static Issue validateTrigger(Trigger trigger, String path) {
        if (trigger == null) {
            return new Issue(path, "Trigger is missing", null);
        }
        TriggerField field = trigger.getField();
        TriggerOperator operator = trigger.getOperator();
        if (field == null) {
            return new Issue(path, "Unknown field", null);
        }
        if (operator == null) {
            return new Issue(path, "Unknown operator", "Try operators: " + operatorList(field));
        }
        if (!field.supports(operator)) {
            return new Issue(path, operator.toValue() + " is not valid for " + field.toValue(),
                    "Try operators: " + operatorList(field));
        }
        String value = trigger.getValue() == null ? "" : trigger.getValue().trim();
        if (!operator.ignoresValue() && value.isEmpty()) {
            return new Issue(path, operator.toValue() + " requires a value", null);
        }
        switch (operator) {
            case MATCHES -> {
                try {
                    Pattern.compile(value);
                } catch (PatternSyntaxException e) {
                    return new Issue(path, "Invalid regular expression pattern",
                            "Check your regex syntax. Example: '^[A-Z]+.*'");
                }
            }
            case GREATER_THAN, GREATER_THAN_OR_EQUAL, LESS_THAN, LESS_THAN_OR_EQUAL -> {
                if (field.getKind() == TriggerField.ValueKind.NUMBER && ValueParsers.isAmbiguousDecimal(value)) {
                    return ambiguousAmount(path, value);
                }
                if (field.getKind() == TriggerField.ValueKind.NUMBER && ValueParsers.parseDecimal(value) == null) {
                    return new Issue(path, "Amount must be a valid number", "Examples: 100, 50.75, 1500");
                }
            }
            case BEFORE, AFTER, ON -> {
                if (ValueParsers.parseDate(value) == null) {
                    return new Issue(path, "Invalid date format", "Use YYYY-MM-DD format (e.g., 2025-12-31)");
                }
            }
            case BETWEEN -> {
                String[] bounds = ValueParsers.splitRange(value, TriggerOperator.RANGE_SEPARATOR);
                if (bounds != null && field.getKind() == TriggerField.ValueKind.NUMBER) {
                    for (String bound : bounds) {
                        if (ValueParsers.isAmbiguousDecimal(bound)) {
                            return ambiguousAmount(path, bound);
                        }
                    }
                }
                if (bounds == null || !boundsParse(field, bounds)) {
                    return new Issue(path, "Range must be two values separated by '..'",
                            field.getKind() == TriggerField.ValueKind.DATE ? "Example: 2025-01-01..2025-01-31" : "Example: 100..250");
                }
            }
            case EQUALS -> {
                if (field.getKind() == TriggerField.ValueKind.TRANSACTION_TYPE && TransactionType.fromString(value) == null) {
                    return new Issue(path, "Unknown transaction type '" + value + "'",
                            "Use income, expense, transfer or unknown");
                }
            }
            default -> {
                // no value constraints
            }
        }
        return null;
    }

    /**
     * Validates one action.
     *
     * @return the problem found, or null if the action is valid
     */
    public static Issue validateAction(RuleAction action, String path) {
        if (action == null || action.getType() == null) {
            return new Issue(path, "Unknown action type", null);
        }
        if (action.getType().requiresValue() && (action.getValue() == null || action.getValue().isBlank())) {
            return new Issue(path, action.getType().toValue() + " requires a value", null);
        }
        return null;
    }

    private static Issue ambiguousAmount(String path, String value) {
        return new Issue(path, "Ambiguous amount '" + value + "'",
                "Write amounts without thousands separators, e.g. 1000 or 12.50");
    }

    private static boolean boundsParse(TriggerField field, String[] bounds) {
        if (field.getKind() == TriggerField.ValueKind.DATE) {
            return ValueParsers.parseDate(bounds[0]) != null && ValueParsers.parseDate(bounds[1]) != null;
        }
        return ValueParsers.parseDecimal(bounds[0]) != null && ValueParsers.parseDecimal(bounds[1]) != null;
    }

    private static String operatorList(TriggerField field) {
        return field.validOperators().stream().map(TriggerOperator::toValue).collect(Collectors.joining(", "));
    }
}
