package com.ledger.engine.catalog;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ledger.engine.domain.Rule;
import com.ledger.engine.domain.RuleGroup;
import jakarta.validation.Valid;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A set of rule groups and rules as exchanged in YAML or JSON documents.
 */
public class RuleCatalog {

    @Valid
    @JsonProperty("groups")
    private List<RuleGroup> groups = new ArrayList<>();

    @Valid
    @JsonProperty("rules")
    private List<Rule> rules = new ArrayList<>();

    public RuleCatalog() {
    }

    public RuleCatalog(List<RuleGroup> groups, List<Rule> rules) {
        setGroups(groups);
        setRules(rules);
    }

    public List<RuleGroup> getGroups() {
        return groups;
    }

    public void setGroups(List<RuleGroup> groups) {
        this.groups = groups != null ? new ArrayList<>(groups) : new ArrayList<>();
    }

    public List<Rule> getRules() {
        return rules;
    }

    public void setRules(List<Rule> rules) {
        this.rules = rules != null ? new ArrayList<>(rules) : new ArrayList<>();
    }

    public Optional<Rule> findRule(String id) {
        return rules.stream().filter(rule -> Objects.equals(rule.getId(), id)).findFirst();
    }

    public Optional<RuleGroup> findGroup(String id) {
        return groups.stream().filter(group -> Objects.equals(group.getId(), id)).findFirst();
    }

    /**
     * Active rules that are ungrouped or in an active group. A rule pointing at a group
     * that is not in the catalog counts as ungrouped.
     */
    public List<Rule> activeRules() {
        Set<String> inactiveGroups = groups.stream()
                .filter(group -> !group.isActive())
                .map(RuleGroup::getId)
                .collect(Collectors.toSet());
        return rules.stream()
                .filter(Rule::isActive)
                .filter(rule -> rule.getGroupId() == null || !inactiveGroups.contains(rule.getGroupId()))
                .toList();
    }

    @Override
    public String toString() {
        return "RuleCatalog{groups=" + groups.size() + ", rules=" + rules.size() + "}";
    }
}
