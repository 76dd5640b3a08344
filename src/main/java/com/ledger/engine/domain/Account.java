package com.ledger.engine.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

import java.util.Objects;

/**
 * A ledger account. Actions look accounts up by name and never create them.
 */
public class Account {

    @NotBlank(message = "Account name is required")
    @JsonProperty("name")
    private String name;

    @JsonProperty("iban")
    private String iban;

    @JsonProperty("account_type")
    private String accountType;

    @JsonProperty("active")
    private boolean active = true;

    public Account() {
    }

    public Account(String name, String iban) {
        this.name = name;
        this.iban = iban;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getIban() {
        return iban;
    }

    public void setIban(String iban) {
        this.iban = iban;
    }

    public String getAccountType() {
        return accountType;
    }

    public void setAccountType(String accountType) {
        this.accountType = accountType;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Account account = (Account) o;
        return Objects.equals(name, account.name) && Objects.equals(iban, account.iban);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, iban);
    }

    @Override
    public String toString() {
        return "Account{name='" + name + "', iban='" + iban + "'}";
    }
}
