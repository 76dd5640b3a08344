package com.ledger.engine.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Node of a rule's boolean condition tree.
 *
 * <p>The combinator applies uniformly to every child at this level, leaf triggers and
 * nested groups alike. An empty AND group matches every transaction, an empty OR group
 * matches none.
 */
public class TriggerGroup {

    public enum Combinator {
        AND,
        OR;

        @JsonCreator
        public static Combinator fromString(String value) {
            if (value == null || value.isBlank()) {
                return AND;
            }
            return switch (value.trim().toLowerCase()) {
                case "or", "any", "||" -> OR;
                default -> AND;
            };
        }

        @JsonValue
        public String toValue() {
            return name().toLowerCase();
        }
    }

    @JsonProperty("combinator")
    private Combinator combinator = Combinator.AND;

    @JsonProperty("triggers")
    private List<Trigger> triggers = new ArrayList<>();

    @JsonProperty("groups")
    private List<TriggerGroup> groups = new ArrayList<>();

    public TriggerGroup() {
    }

    public TriggerGroup(Combinator combinator) {
        this.combinator = combinator;
    }

    public static TriggerGroup all(Trigger... triggers) {
        TriggerGroup group = new TriggerGroup(Combinator.AND);
        group.triggers.addAll(List.of(triggers));
        return group;
    }

    public static TriggerGroup any(Trigger... triggers) {
        TriggerGroup group = new TriggerGroup(Combinator.OR);
        group.triggers.addAll(List.of(triggers));
        return group;
    }

    public TriggerGroup addTrigger(Trigger trigger) {
        triggers.add(trigger);
        return this;
    }

    public TriggerGroup addGroup(TriggerGroup group) {
        groups.add(group);
        return this;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return (triggers == null || triggers.isEmpty()) && (groups == null || groups.isEmpty());
    }

    public Combinator getCombinator() {
        return combinator;
    }

    public void setCombinator(Combinator combinator) {
        this.combinator = combinator;
    }

    public List<Trigger> getTriggers() {
        return triggers;
    }

    public void setTriggers(List<Trigger> triggers) {
        this.triggers = triggers;
    }

    public List<TriggerGroup> getGroups() {
        return groups;
    }

    public void setGroups(List<TriggerGroup> groups) {
        this.groups = groups;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TriggerGroup that = (TriggerGroup) o;
        return combinator == that.combinator
                && Objects.equals(triggers, that.triggers)
                && Objects.equals(groups, that.groups);
    }

    @Override
    public int hashCode() {
        return Objects.hash(combinator, triggers, groups);
    }

    @Override
    public String toString() {
        return RuleFormatter.format(this);
    }
}
