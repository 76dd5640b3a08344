package com.ledger.engine.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Mutation a rule applies to a matching transaction.
 */
public enum ActionType {

    // Categorization
    SET_CATEGORY("set_category", true),
    CLEAR_CATEGORY("clear_category", false),
    SET_NOTES("set_notes", true),
    SET_DESCRIPTION("set_description", true),
    APPEND_DESCRIPTION("append_description", true),
    PREPEND_DESCRIPTION("prepend_description", true),
    ADD_TAG("add_tag", true),
    REMOVE_TAG("remove_tag", true),
    CLEAR_ALL_TAGS("clear_all_tags", false),

    // Accounts
    SET_COUNTER_PARTY("set_counter_party", true),
    SET_SOURCE_ACCOUNT("set_source_account", true),
    SET_DESTINATION_ACCOUNT("set_destination_account", true),
    SWAP_ACCOUNTS("swap_accounts", false),

    // Conversion
    CONVERT_TO_DEPOSIT("convert_to_deposit", false),
    CONVERT_TO_WITHDRAWAL("convert_to_withdrawal", false),
    CONVERT_TO_TRANSFER("convert_to_transfer", false),

    // Advanced
    DELETE_TRANSACTION("delete_transaction", false),
    SET_EXTERNAL_ID("set_external_id", true),
    SET_INTERNAL_REFERENCE("set_internal_reference", true);

    private final String value;
    private final boolean requiresValue;

    ActionType(String value, boolean requiresValue) {
        this.value = value;
        this.requiresValue = requiresValue;
    }

    /**
     * Whether an empty value makes the action invalid.
     * {@link #CONVERT_TO_TRANSFER} takes an optional destination account name.
     */
    public boolean requiresValue() {
        return requiresValue;
    }

    public boolean referencesAccount() {
        return this == SET_SOURCE_ACCOUNT || this == SET_DESTINATION_ACCOUNT
                || this == SWAP_ACCOUNTS || this == CONVERT_TO_TRANSFER;
    }

    @JsonCreator
    public static ActionType fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String normalized = raw.trim().toLowerCase();
        for (ActionType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        return null;
    }

    @JsonValue
    public String toValue() {
        return value;
    }
}
