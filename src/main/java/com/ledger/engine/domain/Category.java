package com.ledger.engine.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A spending category. Names are unique ignoring case.
 */
public record Category(@JsonProperty("name") String name) {

    /**
     * Sentinel effective category of a transaction with neither override nor auto category.
     */
    public static final String UNCATEGORIZED = "Uncategorized";

    @JsonIgnore
    public boolean isUncategorized() {
        return name == null || name.isBlank() || UNCATEGORIZED.equalsIgnoreCase(name);
    }
}
