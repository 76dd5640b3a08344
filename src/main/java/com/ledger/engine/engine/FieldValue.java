package com.ledger.engine.engine;

import com.ledger.engine.domain.Category;
import com.ledger.engine.domain.TransactionType;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Typed value of a transaction field, as produced by {@link FieldAccessor}.
 */
public interface FieldValue {

    /**
     * Text rendering used by the string operators.
     */
    String asText();

    /**
     * Whether the value counts as empty for {@code is_empty} / {@code is_not_empty}.
     */
    boolean isEmpty();

    record Text(String value) implements FieldValue {
        public Text {
            value = value == null ? "" : value;
        }

        @Override
        public String asText() {
            return value;
        }

        @Override
        public boolean isEmpty() {
            return value.isBlank();
        }
    }

    record Number(BigDecimal value) implements FieldValue {
        public Number {
            value = value == null ? BigDecimal.ZERO : value;
        }

        @Override
        public String asText() {
            return value.toPlainString();
        }

        @Override
        public boolean isEmpty() {
            return value.signum() == 0;
        }
    }

    /**
     * A calendar day; null when the transaction has no date.
     */
    record Date(LocalDate value) implements FieldValue {
        @Override
        public String asText() {
            return value == null ? "" : value.toString();
        }

        @Override
        public boolean isEmpty() {
            return value == null;
        }
    }

    /**
     * Effective category name; never null, {@link Category#UNCATEGORIZED} when unset.
     */
    record CategoryName(String value) implements FieldValue {
        public CategoryName {
            value = value == null || value.isBlank() ? Category.UNCATEGORIZED : value;
        }

        @Override
        public String asText() {
            return value;
        }

        @Override
        public boolean isEmpty() {
            return Category.UNCATEGORIZED.equalsIgnoreCase(value);
        }
    }

    record Kind(TransactionType value) implements FieldValue {
        public Kind {
            value = value == null ? TransactionType.UNKNOWN : value;
        }

        @Override
        public String asText() {
            return value.toValue();
        }

        @Override
        public boolean isEmpty() {
            return value == TransactionType.UNKNOWN;
        }
    }

    /**
     * Tags decoded from notes.
     */
    record Tags(List<String> values) implements FieldValue {
        public Tags {
            values = values == null ? List.of() : List.copyOf(values);
        }

        @Override
        public String asText() {
            return String.join(", ", values);
        }

        @Override
        public boolean isEmpty() {
            return values.isEmpty();
        }
    }
}
