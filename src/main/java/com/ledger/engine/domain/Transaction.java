package com.ledger.engine.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Objects;

/**
 * A bank transaction as seen by the rule engine.
 *
 * <p>Triggers read these fields through {@code FieldAccessor}; actions mutate them on a
 * working copy that is only written back when every action of a rule succeeded.
 *
 * <p>Tags, the destination account, external id and internal reference have no dedicated
 * fields and are encoded in {@link #getNotes() notes}, see {@link NoteMarkers}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Transaction {

    @JsonProperty("id")
    private String id;

    @JsonProperty("iban")
    private String iban;

    @JsonProperty("account")
    private Account account;

    @JsonProperty("date")
    private LocalDate date;

    @NotNull(message = "Amount is required")
    @JsonProperty("amount")
    private BigDecimal amount = BigDecimal.ZERO;

    @JsonProperty("counter_iban")
    private String counterIban;

    @JsonProperty("counter_name")
    private String counterName;

    @JsonProperty("standardized_name")
    private String standardizedName;

    @JsonProperty("description")
    private String description;

    @JsonProperty("mandate_reference")
    private String mandateReference;

    @JsonProperty("auto_category")
    private String autoCategory;

    @JsonProperty("category_override")
    private String categoryOverride;

    @JsonProperty("notes")
    private String notes;

    @JsonProperty("transaction_type")
    private TransactionType transactionType = TransactionType.UNKNOWN;

    public Transaction() {
    }

    public Transaction(String id, BigDecimal amount, String description) {
        this.id = id;
        this.amount = amount;
        this.description = description;
    }

    /**
     * Category a user sees: the override if set, else the auto category, else
     * {@link Category#UNCATEGORIZED}.
     */
    @JsonIgnore
    public String getEffectiveCategory() {
        if (categoryOverride != null && !categoryOverride.isBlank()) {
            return categoryOverride;
        }
        if (autoCategory != null && !autoCategory.isBlank()) {
            return autoCategory;
        }
        return Category.UNCATEGORIZED;
    }

    /**
     * Detached copy of every mutable field. The linked account is shared since actions
     * replace it rather than modify it.
     */
    public Transaction copy() {
        Transaction copy = new Transaction();
        copy.restoreFrom(this);
        return copy;
    }

    /**
     * Overwrites every field of this transaction with the values of {@code source}.
     */
    public void restoreFrom(Transaction source) {
        this.id = source.id;
        this.iban = source.iban;
        this.account = source.account;
        this.date = source.date;
        this.amount = source.amount;
        this.counterIban = source.counterIban;
        this.counterName = source.counterName;
        this.standardizedName = source.standardizedName;
        this.description = source.description;
        this.mandateReference = source.mandateReference;
        this.autoCategory = source.autoCategory;
        this.categoryOverride = source.categoryOverride;
        this.notes = source.notes;
        this.transactionType = source.transactionType;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getIban() {
        return iban;
    }

    public void setIban(String iban) {
        this.iban = iban;
    }

    public Account getAccount() {
        return account;
    }

    public void setAccount(Account account) {
        this.account = account;
    }

    public LocalDate getDate() {
        return date;
    }

    public void setDate(LocalDate date) {
        this.date = date;
    }

    public BigDecimal getAmount() {
        return amount;
    }

    public void setAmount(BigDecimal amount) {
        this.amount = amount;
    }

    public String getCounterIban() {
        return counterIban;
    }

    public void setCounterIban(String counterIban) {
        this.counterIban = counterIban;
    }

    public String getCounterName() {
        return counterName;
    }

    public void setCounterName(String counterName) {
        this.counterName = counterName;
    }

    public String getStandardizedName() {
        return standardizedName;
    }

    public void setStandardizedName(String standardizedName) {
        this.standardizedName = standardizedName;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getMandateReference() {
        return mandateReference;
    }

    public void setMandateReference(String mandateReference) {
        this.mandateReference = mandateReference;
    }

    public String getAutoCategory() {
        return autoCategory;
    }

    public void setAutoCategory(String autoCategory) {
        this.autoCategory = autoCategory;
    }

    public String getCategoryOverride() {
        return categoryOverride;
    }

    public void setCategoryOverride(String categoryOverride) {
        this.categoryOverride = categoryOverride;
    }

    public String getNotes() {
        return notes;
    }

    public void setNotes(String notes) {
        this.notes = notes;
    }

    public TransactionType getTransactionType() {
        return transactionType;
    }

    public void setTransactionType(TransactionType transactionType) {
        this.transactionType = transactionType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Transaction that = (Transaction) o;
        return Objects.equals(id, that.id)
                && Objects.equals(iban, that.iban)
                && Objects.equals(account, that.account)
                && Objects.equals(date, that.date)
                && Objects.equals(amount, that.amount)
                && Objects.equals(counterIban, that.counterIban)
                && Objects.equals(counterName, that.counterName)
                && Objects.equals(standardizedName, that.standardizedName)
                && Objects.equals(description, that.description)
                && Objects.equals(mandateReference, that.mandateReference)
                && Objects.equals(autoCategory, that.autoCategory)
                && Objects.equals(categoryOverride, that.categoryOverride)
                && Objects.equals(notes, that.notes)
                && transactionType == that.transactionType;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, iban, date, amount, description);
    }

    @Override
    public String toString() {
        return "Transaction{" +
               "id='" + id + '\'' +
               ", date=" + date +
               ", amount=" + amount +
               ", description='" + description + '\'' +
               ", type=" + transactionType +
               '}';
    }
}
