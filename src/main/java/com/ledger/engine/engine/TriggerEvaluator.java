package com.ledger.engine.engine;

import com.ledger.engine.config.EngineConfig;
import com.ledger.engine.domain.Transaction;
import com.ledger.engine.domain.TransactionType;
import com.ledger.engine.domain.Trigger;
import com.ledger.engine.domain.TriggerOperator;
import com.ledger.engine.util.ValueParsers;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.IntPredicate;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Evaluates a single trigger against a transaction.
 *
 * <p>Evaluation never throws. A comparison value that cannot be parsed into the field's
 * type, an invalid regex, a null field or a null operator all make the trigger evaluate
 * to {@code false} before negation is applied.
 *
 * <p>Operator semantics:
 * <ul>
 *   <li>String operators are case-insensitive; {@code matches} is a case-insensitive regex find.</li>
 *   <li>Numeric operators compare {@link BigDecimal}s exactly. On the amount field a
 *       non-negative comparison value is compared with the amount's magnitude, a negative one
 *       with the signed amount.</li>
 *   <li>Date operators compare calendar days; relative operators use the injected {@link Clock}.</li>
 *   <li>{@code between} takes {@code low..high}, inclusive, bounds swapped if reversed.</li>
 *   <li>{@code is_empty} / {@code is_not_empty} ignore the comparison value.</li>
 * </ul>
 */
@ApplicationScoped
public class TriggerEvaluator {

    private static final Logger LOG = Logger.getLogger(TriggerEvaluator.class);

    private static final int DEFAULT_REGEX_CACHE_SIZE = 1000;

    @Inject
    FieldAccessor fieldAccessor;

    @Inject
    EngineConfig config;

    Clock clock = Clock.systemDefaultZone();

    private final Map<String, Pattern> regexCache = new ConcurrentHashMap<>();

    public TriggerEvaluator() {
    }

    public TriggerEvaluator(FieldAccessor fieldAccessor, Clock clock) {
        this.fieldAccessor = fieldAccessor;
        this.clock = clock;
    }

    /**
     * Evaluates the trigger, applying its negation flag last.
     *
     * @param trigger the trigger
     * @param tx      the transaction
     * @return the trigger's result
     */
    public boolean evaluate(Trigger trigger, Transaction tx) {
        if (trigger == null || tx == null) {
            return false;
        }
        boolean raw = evaluateRaw(trigger, tx);
        return trigger.isNegated() != raw;
    }

    boolean evaluateRaw(Trigger trigger, Transaction tx) {
        TriggerOperator operator = trigger.getOperator();
        if (operator == null || trigger.getField() == null) {
            LOG.debugf("Trigger with missing field or operator evaluates to false: %s", trigger);
            return false;
        }
        FieldValue actual = fieldAccessor.extract(trigger.getField(), tx);

        if (operator == TriggerOperator.IS_EMPTY) {
            return actual.isEmpty();
        }
        if (operator == TriggerOperator.IS_NOT_EMPTY) {
            return !actual.isEmpty();
        }
        if (operator.isRelativeDate()) {
            return matchesRelativeDay(operator, actual);
        }

        String expected = trigger.getValue();
        if (expected == null || expected.isEmpty()) {
            return false;
        }

        return switch (operator) {
            case CONTAINS -> anyText(actual, text -> containsIgnoreCase(text, expected));
            case STARTS_WITH -> anyText(actual, text -> text.toLowerCase().startsWith(expected.toLowerCase()));
            case ENDS_WITH -> anyText(actual, text -> text.toLowerCase().endsWith(expected.toLowerCase()));
            case MATCHES -> matchesRegex(actual, expected);
            case EQUALS -> isEqual(actual, expected);
            case GREATER_THAN -> compare(actual, expected, c -> c > 0);
            case GREATER_THAN_OR_EQUAL -> compare(actual, expected, c -> c >= 0);
            case LESS_THAN -> compare(actual, expected, c -> c < 0);
            case LESS_THAN_OR_EQUAL -> compare(actual, expected, c -> c <= 0);
            case BETWEEN -> isBetween(actual, expected);
            case BEFORE -> compareDates(actual, expected, c -> c < 0);
            case AFTER -> compareDates(actual, expected, c -> c > 0);
            case ON -> compareDates(actual, expected, c -> c == 0);
            case TODAY, YESTERDAY, TOMORROW, IS_EMPTY, IS_NOT_EMPTY -> false;
        };
    }

    // ========== String operators ==========

    private static boolean anyText(FieldValue actual, Predicate<String> predicate) {
        if (actual instanceof FieldValue.Tags tags) {
            return tags.values().stream().anyMatch(predicate);
        }
        return predicate.test(actual.asText());
    }

    private static boolean containsIgnoreCase(String text, String fragment) {
        return text.toLowerCase().contains(fragment.toLowerCase());
    }

    private boolean matchesRegex(FieldValue actual, String regex) {
        Pattern pattern = compile(regex);
        if (pattern == null) {
            return false;
        }
        return anyText(actual, text -> pattern.matcher(text).find());
    }

    Pattern compile(String regex) {
        Pattern cached = regexCache.get(regex);
        if (cached != null) {
            return cached;
        }
        Pattern pattern;
        try {
            pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        } catch (PatternSyntaxException e) {
            LOG.debugf("Invalid regex pattern '%s': %s", regex, e.getDescription());
            return null;
        }
        if (regexCache.size() >= regexCacheSize()) {
            regexCache.clear();
        }
        regexCache.put(regex, pattern);
        return pattern;
    }

    int regexCacheSize() {
        return config != null ? config.regexCacheSize : DEFAULT_REGEX_CACHE_SIZE;
    }

    int cachedPatternCount() {
        return regexCache.size();
    }

    // ========== Equality ==========

    private boolean isEqual(FieldValue actual, String expected) {
        if (actual instanceof FieldValue.Number number) {
            BigDecimal target = ValueParsers.parseDecimal(expected);
            return target != null && operand(number.value(), target).compareTo(target) == 0;
        }
        if (actual instanceof FieldValue.Date date) {
            LocalDate target = ValueParsers.parseDate(expected);
            return target != null && target.equals(date.value());
        }
        if (actual instanceof FieldValue.Kind kind) {
            TransactionType target = TransactionType.fromString(expected);
            return target != null && target == kind.value();
        }
        return anyText(actual, text -> text.equalsIgnoreCase(expected.trim()) || text.equalsIgnoreCase(expected));
    }

    // ========== Ordering ==========

    private boolean compare(FieldValue actual, String expected, IntPredicate test) {
        if (actual instanceof FieldValue.Date) {
            return compareDates(actual, expected, test);
        }
        BigDecimal target = ValueParsers.parseDecimal(expected);
        BigDecimal value = numericValue(actual);
        if (target == null || value == null) {
            return false;
        }
        return test.test(operand(value, target, actual).compareTo(target));
    }

    private boolean compareDates(FieldValue actual, String expected, IntPredicate test) {
        LocalDate target = ValueParsers.parseDate(expected);
        LocalDate value = dateValue(actual);
        if (target == null || value == null) {
            return false;
        }
        return test.test(value.compareTo(target));
    }

    private boolean isBetween(FieldValue actual, String expected) {
        String[] bounds = ValueParsers.splitRange(expected, TriggerOperator.RANGE_SEPARATOR);
        if (bounds == null) {
            return false;
        }
        if (actual instanceof FieldValue.Date) {
            LocalDate value = dateValue(actual);
            LocalDate a = ValueParsers.parseDate(bounds[0]);
            LocalDate b = ValueParsers.parseDate(bounds[1]);
            if (value == null || a == null || b == null) {
                return false;
            }
            LocalDate low = a.isAfter(b) ? b : a;
            LocalDate high = a.isAfter(b) ? a : b;
            return !value.isBefore(low) && !value.isAfter(high);
        }
        BigDecimal value = numericValue(actual);
        BigDecimal a = ValueParsers.parseDecimal(bounds[0]);
        BigDecimal b = ValueParsers.parseDecimal(bounds[1]);
        if (value == null || a == null || b == null) {
            return false;
        }
        BigDecimal low = a.min(b);
        BigDecimal high = a.max(b);
        BigDecimal compared = operand(value, low, actual);
        return compared.compareTo(low) >= 0 && compared.compareTo(high) <= 0;
    }

    private boolean matchesRelativeDay(TriggerOperator operator, FieldValue actual) {
        LocalDate value = dateValue(actual);
        if (value == null) {
            return false;
        }
        LocalDate today = LocalDate.now(clock);
        return switch (operator) {
            case TODAY -> value.equals(today);
            case YESTERDAY -> value.equals(today.minusDays(1));
            case TOMORROW -> value.equals(today.plusDays(1));
            default -> false;
        };
    }

    // ========== Coercion ==========

    // Amounts compare by magnitude unless the rule addresses the sign explicitly.
    private static BigDecimal operand(BigDecimal amount, BigDecimal target) {
        return target.signum() >= 0 ? amount.abs() : amount;
    }

    private static BigDecimal operand(BigDecimal value, BigDecimal target, FieldValue actual) {
        return actual instanceof FieldValue.Number ? operand(value, target) : value;
    }

    private static BigDecimal numericValue(FieldValue actual) {
        if (actual instanceof FieldValue.Number number) {
            return number.value();
        }
        if (actual instanceof FieldValue.Tags) {
            return null;
        }
        return ValueParsers.parseDecimal(actual.asText());
    }

    private static LocalDate dateValue(FieldValue actual) {
        if (actual instanceof FieldValue.Date date) {
            return date.value();
        }
        if (actual instanceof FieldValue.Number || actual instanceof FieldValue.Tags) {
            return null;
        }
        return ValueParsers.parseDate(actual.asText());
    }

    /**
     * Clears the compiled pattern cache.
     */
    public void clearCache() {
        regexCache.clear();
    }
}
