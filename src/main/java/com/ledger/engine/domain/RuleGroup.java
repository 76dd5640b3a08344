package com.ledger.engine.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

import java.util.Objects;

/**
 * Named container for organizing rules. Rules point at a group by id; the group holds
 * no references to its rules.
 */
public class RuleGroup {

    @NotBlank(message = "Group ID is required")
    @JsonProperty("id")
    private String id;

    @NotBlank(message = "Group name is required")
    @JsonProperty("name")
    private String name;

    @JsonProperty("execution_order")
    private int executionOrder;

    @JsonProperty("active")
    private boolean active = true;

    @JsonProperty("notes")
    private String notes;

    public RuleGroup() {
    }

    public RuleGroup(String id, String name, int executionOrder) {
        this.id = id;
        this.name = name;
        this.executionOrder = executionOrder;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public int getExecutionOrder() {
        return executionOrder;
    }

    public void setExecutionOrder(int executionOrder) {
        this.executionOrder = executionOrder;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public String getNotes() {
        return notes;
    }

    public void setNotes(String notes) {
        this.notes = notes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Objects.equals(id, ((RuleGroup) o).id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "RuleGroup{id='" + id + "', name='" + name + "', active=" + active + '}';
    }
}
