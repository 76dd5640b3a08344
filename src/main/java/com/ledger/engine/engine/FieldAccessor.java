package com.ledger.engine.engine;

import com.ledger.engine.domain.NoteMarkers;
import com.ledger.engine.domain.Transaction;
import com.ledger.engine.domain.TriggerField;
import jakarta.enterprise.context.ApplicationScoped;

/**
 * Extracts typed field values from a transaction.
 * <p>
 * Total: missing data yields empty text, a zero amount, an absent date or the
 * uncategorized category, never an exception.
 */
@ApplicationScoped
public class FieldAccessor {

    public FieldValue extract(TriggerField field, Transaction tx) {
        if (field == null || tx == null) {
            return new FieldValue.Text("");
        }
        return switch (field) {
            case DESCRIPTION -> new FieldValue.Text(tx.getDescription());
            case ACCOUNT_NAME -> new FieldValue.Text(tx.getAccount() != null ? tx.getAccount().getName() : null);
            case COUNTER_PARTY -> new FieldValue.Text(counterParty(tx));
            case COUNTER_IBAN -> new FieldValue.Text(tx.getCounterIban());
            case AMOUNT -> new FieldValue.Number(tx.getAmount());
            case DATE -> new FieldValue.Date(tx.getDate());
            case IBAN -> new FieldValue.Text(tx.getIban());
            case TRANSACTION_TYPE -> new FieldValue.Kind(tx.getTransactionType());
            case CATEGORY -> new FieldValue.CategoryName(tx.getEffectiveCategory());
            case NOTES -> new FieldValue.Text(tx.getNotes());
            case EXTERNAL_ID -> new FieldValue.Text(NoteMarkers.externalId(tx.getNotes()));
            case INTERNAL_REFERENCE -> new FieldValue.Text(internalReference(tx));
            case TAGS -> new FieldValue.Tags(NoteMarkers.parseTags(tx.getNotes()));
        };
    }

    // Raw bank name first, display name only when the bank sent none.
    private static String counterParty(Transaction tx) {
        if (tx.getCounterName() != null && !tx.getCounterName().isBlank()) {
            return tx.getCounterName();
        }
        return tx.getStandardizedName();
    }

    private static String internalReference(Transaction tx) {
        if (tx.getMandateReference() != null && !tx.getMandateReference().isBlank()) {
            return tx.getMandateReference();
        }
        return NoteMarkers.internalReference(tx.getNotes());
    }
}
