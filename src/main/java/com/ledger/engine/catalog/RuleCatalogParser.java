package com.ledger.engine.catalog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.ledger.engine.domain.Rule;
import com.ledger.engine.domain.RuleGroup;
import com.ledger.engine.domain.RuleValidator;
import com.ledger.engine.domain.Transaction;
import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads and writes rule catalogs.
 * <p>
 * Input may be YAML or JSON (JSON is read as YAML). Structural problems, such as
 * malformed documents, missing ids or duplicate ids, fail the whole parse. Semantic problems
 * (an operator the field does not support, an unparseable regex) are reported by
 * {@link #validate(RuleCatalog)} and leave the catalog usable: such triggers evaluate to false.
 */
@ApplicationScoped
public class RuleCatalogParser {

    private static final Logger LOG = Logger.getLogger(RuleCatalogParser.class);

    private final ObjectMapper yamlMapper;

    public RuleCatalogParser() {
        this.yamlMapper = new ObjectMapper(new YAMLFactory()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES));
        this.yamlMapper.registerModule(new JavaTimeModule());
        this.yamlMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.yamlMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * Parses a catalog document.
     *
     * @throws InvalidCatalogException if the document is malformed or structurally invalid
     */
    public RuleCatalog parse(String document) {
        if (document == null || document.isBlank()) {
            throw new InvalidCatalogException("Catalog document is empty");
        }
        RuleCatalog catalog;
        try {
            catalog = yamlMapper.readValue(document, RuleCatalog.class);
        } catch (JsonProcessingException e) {
            throw new InvalidCatalogException("Failed to parse rule catalog: " + e.getOriginalMessage(), e);
        }
        if (catalog == null) {
            throw new InvalidCatalogException("Catalog document is empty");
        }
        checkStructure(catalog);
        LOG.debugf("Parsed %s", catalog);
        return catalog;
    }

    /**
     * Parses a document holding a single rule.
     */
    public Rule parseRule(String document) {
        if (document == null || document.isBlank()) {
            throw new InvalidCatalogException("Rule document is empty");
        }
        try {
            Rule rule = yamlMapper.readValue(document, Rule.class);
            if (rule == null) {
                throw new InvalidCatalogException("Rule document is empty");
            }
            checkRule(rule, "rule");
            return rule;
        } catch (JsonProcessingException e) {
            throw new InvalidCatalogException("Failed to parse rule: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Parses a document holding a single transaction, e.g. for simulations.
     */
    public Transaction parseTransaction(String document) {
        if (document == null || document.isBlank()) {
            throw new InvalidCatalogException("Transaction document is empty");
        }
        try {
            Transaction tx = yamlMapper.readValue(document, Transaction.class);
            if (tx == null) {
                throw new InvalidCatalogException("Transaction document is empty");
            }
            return tx;
        } catch (JsonProcessingException e) {
            throw new InvalidCatalogException("Failed to parse transaction: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Serializes the catalog as YAML.
     */
    public String toYaml(RuleCatalog catalog) {
        try {
            return yamlMapper.writeValueAsString(catalog);
        } catch (JsonProcessingException e) {
            throw new InvalidCatalogException("Failed to write rule catalog", e);
        }
    }

    /**
     * Semantic issues per rule id; rules without issues are absent.
     */
    public Map<String, List<RuleValidator.Issue>> validate(RuleCatalog catalog) {
        Map<String, List<RuleValidator.Issue>> issues = new LinkedHashMap<>();
        for (Rule rule : catalog.getRules()) {
            List<RuleValidator.Issue> ruleIssues = RuleValidator.validate(rule);
            if (!ruleIssues.isEmpty()) {
                issues.put(rule.getId(), ruleIssues);
            }
        }
        return issues;
    }

    private void checkStructure(RuleCatalog catalog) {
        Set<String> groupIds = new HashSet<>();
        for (int i = 0; i < catalog.getGroups().size(); i++) {
            RuleGroup group = catalog.getGroups().get(i);
            if (group == null || isBlank(group.getId())) {
                throw new InvalidCatalogException("groups[" + i + "]: group id is required");
            }
            if (!groupIds.add(group.getId())) {
                throw new InvalidCatalogException("groups[" + i + "]: duplicate group id '" + group.getId() + "'");
            }
            if (isBlank(group.getName())) {
                group.setName(group.getId());
            }
        }

        Set<String> ruleIds = new HashSet<>();
        List<Rule> rules = new ArrayList<>(catalog.getRules());
        for (int i = 0; i < rules.size(); i++) {
            Rule rule = rules.get(i);
            String path = "rules[" + i + "]";
            if (rule == null) {
                throw new InvalidCatalogException(path + ": rule is empty");
            }
            checkRule(rule, path);
            if (!ruleIds.add(rule.getId())) {
                throw new InvalidCatalogException(path + ": duplicate rule id '" + rule.getId() + "'");
            }
            if (rule.getGroupId() != null && !groupIds.contains(rule.getGroupId())) {
                LOG.warnf("Rule %s references unknown group %s, treating it as ungrouped",
                        rule.getId(), rule.getGroupId());
                rule.setGroupId(null);
            }
        }
    }

    private static void checkRule(Rule rule, String path) {
        if (isBlank(rule.getId())) {
            throw new InvalidCatalogException(path + ": rule id is required");
        }
        if (isBlank(rule.getName())) {
            throw new InvalidCatalogException(path + ": rule name is required");
        }
        if (rule.getActions() == null) {
            rule.setActions(new ArrayList<>());
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /**
     * Thrown when a catalog document cannot be turned into rules.
     */
    public static class InvalidCatalogException extends RuntimeException {
        public InvalidCatalogException(String message) {
            super(message);
        }

        public InvalidCatalogException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
