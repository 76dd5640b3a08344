package com.ledger.engine.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A transaction rule.
 *
 * A rule consists of:
 * - An ID that uniquely identifies the rule
 * - A name for display purposes
 * - Exactly one root trigger group deciding whether the rule matches
 * - Ordered actions applied to a matching transaction
 * - Priority for ordering (lower = evaluated first)
 * - A stop-processing flag ending rule evaluation for a transaction once this rule matches
 * - An optional group id (weak reference, the group does not own the rule)
 * - Match statistics, updated after actions were applied successfully
 */
public class Rule {

    @NotBlank(message = "Rule ID is required")
    @JsonProperty("id")
    private String id;

    @NotBlank(message = "Rule name is required")
    @JsonProperty("name")
    private String name;

    @JsonProperty("description")
    private String description;

    @JsonProperty("priority")
    private int priority;

    @JsonProperty("active")
    private boolean active = true;

    @JsonProperty("stop_processing")
    private boolean stopProcessing;

    @JsonProperty("group_id")
    private String groupId;

    @NotNull(message = "Trigger group is required")
    @JsonProperty("trigger_group")
    private TriggerGroup triggerGroup = new TriggerGroup();

    @JsonProperty("actions")
    private List<RuleAction> actions = new ArrayList<>();

    @JsonIgnore
    private final AtomicLong matchCount = new AtomicLong();

    @JsonProperty("last_matched_at")
    private volatile Instant lastMatchedAt;

    public Rule() {
    }

    public Rule(String id, String name, int priority) {
        this.id = id;
        this.name = name;
        this.priority = priority;
    }

    /**
     * Records a successful application of this rule.
     *
     * @return the new match count
     */
    public long recordMatch(Instant at) {
        lastMatchedAt = at;
        return matchCount.incrementAndGet();
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

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public int getPriority() {
        return priority;
    }

    public void setPriority(int priority) {
        this.priority = priority;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public boolean isStopProcessing() {
        return stopProcessing;
    }

    public void setStopProcessing(boolean stopProcessing) {
        this.stopProcessing = stopProcessing;
    }

    public String getGroupId() {
        return groupId;
    }

    public void setGroupId(String groupId) {
        this.groupId = groupId;
    }

    public TriggerGroup getTriggerGroup() {
        return triggerGroup;
    }

    public void setTriggerGroup(TriggerGroup triggerGroup) {
        this.triggerGroup = triggerGroup;
    }

    public List<RuleAction> getActions() {
        return actions;
    }

    public void setActions(List<RuleAction> actions) {
        this.actions = actions;
    }

    public Rule addAction(RuleAction action) {
        this.actions.add(action);
        return this;
    }

    @JsonProperty("match_count")
    public long getMatchCount() {
        return matchCount.get();
    }

    @JsonProperty("match_count")
    public void setMatchCount(long count) {
        matchCount.set(count);
    }

    public Instant getLastMatchedAt() {
        return lastMatchedAt;
    }

    public void setLastMatchedAt(Instant lastMatchedAt) {
        this.lastMatchedAt = lastMatchedAt;
    }

    public String toHumanReadable() {
        return RuleFormatter.summarize(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Rule rule = (Rule) o;
        return Objects.equals(id, rule.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Rule{" +
               "id='" + id + '\'' +
               ", name='" + name + '\'' +
               ", priority=" + priority +
               ", active=" + active +
               ", stopProcessing=" + stopProcessing +
               '}';
    }
}
