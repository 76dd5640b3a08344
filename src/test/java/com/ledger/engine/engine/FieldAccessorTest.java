package com.ledger.engine.engine;

import com.ledger.engine.domain.Account;
import com.ledger.engine.domain.Category;
import com.ledger.engine.domain.Transaction;
import com.ledger.engine.domain.TransactionType;
import com.ledger.engine.domain.TriggerField;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class FieldAccessorTest {

    private final FieldAccessor accessor = new FieldAccessor();

    @Test
    void extractsEveryFieldOfAFullTransaction() {
        Transaction tx = new Transaction();
        tx.setDescription("NETFLIX.COM");
        tx.setAccount(new Account("Checking", "NL01BANK0001"));
        tx.setIban("NL01BANK0001");
        tx.setCounterName("Netflix International B.V.");
        tx.setCounterIban("NL99NFLX0002");
        tx.setAmount(new BigDecimal("-15.99"));
        tx.setDate(LocalDate.of(2024, 5, 1));
        tx.setTransactionType(TransactionType.EXPENSE);
        tx.setAutoCategory("Entertainment");
        tx.setNotes("subscription, monthly");
        tx.setMandateReference("MNDT-1");

        assertThat(accessor.extract(TriggerField.DESCRIPTION, tx).asText()).isEqualTo("NETFLIX.COM");
        assertThat(accessor.extract(TriggerField.ACCOUNT_NAME, tx).asText()).isEqualTo("Checking");
        assertThat(accessor.extract(TriggerField.COUNTER_PARTY, tx).asText()).isEqualTo("Netflix International B.V.");
        assertThat(accessor.extract(TriggerField.COUNTER_IBAN, tx).asText()).isEqualTo("NL99NFLX0002");
        assertThat(accessor.extract(TriggerField.AMOUNT, tx)).isEqualTo(new FieldValue.Number(new BigDecimal("-15.99")));
        assertThat(accessor.extract(TriggerField.DATE, tx)).isEqualTo(new FieldValue.Date(LocalDate.of(2024, 5, 1)));
        assertThat(accessor.extract(TriggerField.IBAN, tx).asText()).isEqualTo("NL01BANK0001");
        assertThat(accessor.extract(TriggerField.TRANSACTION_TYPE, tx)).isEqualTo(new FieldValue.Kind(TransactionType.EXPENSE));
        assertThat(accessor.extract(TriggerField.CATEGORY, tx).asText()).isEqualTo("Entertainment");
        assertThat(accessor.extract(TriggerField.NOTES, tx).asText()).isEqualTo("subscription, monthly");
        assertThat(accessor.extract(TriggerField.INTERNAL_REFERENCE, tx).asText()).isEqualTo("MNDT-1");
        assertThat(accessor.extract(TriggerField.TAGS, tx))
                .isInstanceOfSatisfying(FieldValue.Tags.class,
                        tags -> assertThat(tags.values()).containsExactly("subscription", "monthly"));
    }

    @Test
    void missingDataYieldsEmptyValues() {
        Transaction tx = new Transaction();
        tx.setAmount(null);

        for (TriggerField field : TriggerField.values()) {
            assertThat(accessor.extract(field, tx).isEmpty())
                    .as("field %s", field)
                    .isTrue();
        }
        assertThat(accessor.extract(TriggerField.CATEGORY, tx).asText()).isEqualTo(Category.UNCATEGORIZED);
        assertThat(accessor.extract(TriggerField.AMOUNT, tx).asText()).isEqualTo("0");
    }

    @Test
    void categoryOverrideWinsOverAutoCategory() {
        Transaction tx = new Transaction();
        tx.setAutoCategory("Groceries");
        tx.setCategoryOverride("Household");

        assertThat(accessor.extract(TriggerField.CATEGORY, tx).asText()).isEqualTo("Household");
    }

    @Test
    void counterPartyReadsBankNameEvenWhenDisplayNameDiffers() {
        Transaction tx = new Transaction();
        tx.setCounterName("EMPLOYER INC");
        tx.setStandardizedName("Employer");

        assertThat(accessor.extract(TriggerField.COUNTER_PARTY, tx).asText()).isEqualTo("EMPLOYER INC");
    }

    @Test
    void displayNameIsUsedWhenBankNameIsBlank() {
        Transaction tx = new Transaction();
        tx.setCounterName("  ");
        tx.setStandardizedName("Albert Heijn");

        assertThat(accessor.extract(TriggerField.COUNTER_PARTY, tx).asText()).isEqualTo("Albert Heijn");
    }

    @Test
    void markerValuesStopAtTagsAppendedAfterThem() {
        Transaction tx = new Transaction();
        tx.setNotes("External ID: EXT-42, coffee | Ref: INV-9, lunch");

        assertThat(accessor.extract(TriggerField.EXTERNAL_ID, tx).asText()).isEqualTo("EXT-42");
        assertThat(accessor.extract(TriggerField.INTERNAL_REFERENCE, tx).asText()).isEqualTo("INV-9");
    }

    @Test
    void markersInNotesFeedExternalIdAndReference() {
        Transaction tx = new Transaction();
        tx.setNotes("imported | External ID: EXT-7 | Ref: INV-2024-01");

        assertThat(accessor.extract(TriggerField.EXTERNAL_ID, tx).asText()).isEqualTo("EXT-7");
        assertThat(accessor.extract(TriggerField.INTERNAL_REFERENCE, tx).asText()).isEqualTo("INV-2024-01");
    }

    @Test
    void nullInputsNeverThrow() {
        assertThat(accessor.extract(null, new Transaction()).isEmpty()).isTrue();
        assertThat(accessor.extract(TriggerField.DESCRIPTION, null).isEmpty()).isTrue();
    }
}
