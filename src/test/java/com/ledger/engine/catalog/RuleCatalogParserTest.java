package com.ledger.engine.catalog;

import com.ledger.engine.domain.ActionType;
import com.ledger.engine.domain.Rule;
import com.ledger.engine.domain.RuleAction;
import com.ledger.engine.domain.RuleValidator;
import com.ledger.engine.domain.Transaction;
import com.ledger.engine.domain.TransactionType;
import com.ledger.engine.domain.Trigger;
import com.ledger.engine.domain.TriggerField;
import com.ledger.engine.domain.TriggerGroup;
import com.ledger.engine.domain.TriggerOperator;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class RuleCatalogParserTest {

    private static final String CATALOG = """
            groups:
              - id: subscriptions
                name: Subscriptions
                execution_order: 1
              - id: archive
                active: false
            rules:
              - id: netflix
                name: Netflix
                priority: 10
                group_id: subscriptions
                stop_processing: true
                trigger_group:
                  combinator: and
                  triggers:
                    - field: description
                      operator: contains
                      value: netflix
                    - field: amount
                      operator: ">"
                      value: "5"
                  groups:
                    - combinator: or
                      triggers:
                        - field: payee
                          operator: regex
                          value: "^netflix"
                        - field: type
                          operator: eq
                          value: withdrawal
                actions:
                  - type: set_category
                    value: Subscriptions
                  - type: add_tag
                    value: streaming
                    stop_processing_after: true
              - id: old
                name: Old rule
                group_id: archive
                actions:
                  - type: clear_category
              - id: orphan
                name: Orphan
                group_id: nowhere
                some_future_field: ignored
            """;

    private final RuleCatalogParser parser = new RuleCatalogParser();

    @Test
    void parsesGroupsRulesAndNestedTriggers() {
        RuleCatalog catalog = parser.parse(CATALOG);

        assertThat(catalog.getGroups()).hasSize(2);
        assertThat(catalog.findGroup("archive")).hasValueSatisfying(group -> {
            assertThat(group.isActive()).isFalse();
            assertThat(group.getName()).isEqualTo("archive");
        });

        Rule netflix = catalog.findRule("netflix").orElseThrow();
        assertThat(netflix.getPriority()).isEqualTo(10);
        assertThat(netflix.isStopProcessing()).isTrue();
        assertThat(netflix.isActive()).isTrue();

        TriggerGroup group = netflix.getTriggerGroup();
        assertThat(group.getCombinator()).isEqualTo(TriggerGroup.Combinator.AND);
        assertThat(group.getTriggers()).containsExactly(
                new Trigger(TriggerField.DESCRIPTION, TriggerOperator.CONTAINS, "netflix"),
                new Trigger(TriggerField.AMOUNT, TriggerOperator.GREATER_THAN, "5"));
        TriggerGroup nested = group.getGroups().get(0);
        assertThat(nested.getCombinator()).isEqualTo(TriggerGroup.Combinator.OR);
        assertThat(nested.getTriggers()).extracting(Trigger::getField, Trigger::getOperator)
                .containsExactly(
                        tuple(TriggerField.COUNTER_PARTY, TriggerOperator.MATCHES),
                        tuple(TriggerField.TRANSACTION_TYPE, TriggerOperator.EQUALS));

        assertThat(netflix.getActions()).extracting(RuleAction::getType)
                .containsExactly(ActionType.SET_CATEGORY, ActionType.ADD_TAG);
        assertThat(netflix.getActions().get(1).isStopProcessingAfter()).isTrue();
    }

    @Test
    void activeRulesSkipInactiveGroupsAndTreatUnknownGroupsAsUngrouped() {
        RuleCatalog catalog = parser.parse(CATALOG);

        assertThat(catalog.findRule("orphan").orElseThrow().getGroupId()).isNull();
        assertThat(catalog.activeRules()).extracting(Rule::getId).containsExactly("netflix", "orphan");
    }

    @Test
    void missingActionsBecomeEmptyList() {
        Rule orphan = parser.parse(CATALOG).findRule("orphan").orElseThrow();

        assertThat(orphan.getActions()).isEmpty();
        assertThat(orphan.getTriggerGroup()).isNotNull();
    }

    @Test
    void unknownOperatorIsKeptAndReportedByValidation() {
        RuleCatalog catalog = parser.parse("""
                rules:
                  - id: r1
                    name: Weird
                    trigger_group:
                      triggers:
                        - field: description
                          operator: sounds_like
                          value: netflix
                        - field: date
                          operator: before
                          value: someday
                    actions:
                      - type: add_tag
                        value: x
                  - id: r2
                    name: Fine
                    actions:
                      - type: add_tag
                        value: y
                """);

        Map<String, List<RuleValidator.Issue>> issues = parser.validate(catalog);

        assertThat(catalog.findRule("r1").orElseThrow().getTriggerGroup().getTriggers().get(0).getOperator()).isNull();
        assertThat(issues).containsOnlyKeys("r1");
        assertThat(issues.get("r1")).extracting(RuleValidator.Issue::message)
                .containsExactly("Unknown operator", "Invalid date format");
    }

    @Test
    void structuralProblemsFailTheWholeDocument() {
        assertThatThrownBy(() -> parser.parse("  "))
                .isInstanceOf(RuleCatalogParser.InvalidCatalogException.class)
                .hasMessage("Catalog document is empty");
        assertThatThrownBy(() -> parser.parse("rules:\n  - name: No id\n"))
                .hasMessage("rules[0]: rule id is required");
        assertThatThrownBy(() -> parser.parse("rules:\n  - id: a\n    name: A\n  - id: a\n    name: B\n"))
                .hasMessage("rules[1]: duplicate rule id 'a'");
        assertThatThrownBy(() -> parser.parse("rules:\n  - id: a\n"))
                .hasMessage("rules[0]: rule name is required");
        assertThatThrownBy(() -> parser.parse("groups:\n  - name: nameless\n"))
                .hasMessage("groups[0]: group id is required");
        assertThatThrownBy(() -> parser.parse("rules: [unclosed"))
                .isInstanceOf(RuleCatalogParser.InvalidCatalogException.class)
                .hasMessageStartingWith("Failed to parse rule catalog: ");
    }

    @Test
    void acceptsJsonDocuments() {
        RuleCatalog catalog = parser.parse("""
                {"rules": [{"id": "r1", "name": "Json", "priority": 2,
                  "trigger_group": {"combinator": "or", "triggers": []},
                  "actions": [{"type": "delete_transaction"}]}]}
                """);

        Rule rule = catalog.findRule("r1").orElseThrow();
        assertThat(rule.getTriggerGroup().getCombinator()).isEqualTo(TriggerGroup.Combinator.OR);
        assertThat(rule.getActions()).singleElement()
                .satisfies(action -> assertThat(action.getType()).isEqualTo(ActionType.DELETE_TRANSACTION));
    }

    @Test
    void writtenYamlCanBeReadBack() {
        RuleCatalog catalog = parser.parse(CATALOG);

        String yaml = parser.toYaml(catalog);
        RuleCatalog reread = parser.parse(yaml);

        assertThat(yaml).contains("trigger_group:").contains("set_category");
        assertThat(reread.findRule("netflix").orElseThrow().getTriggerGroup())
                .isEqualTo(catalog.findRule("netflix").orElseThrow().getTriggerGroup());
    }

    @Test
    void parsesSingleRuleAndTransaction() {
        Rule rule = parser.parseRule("""
                id: r1
                name: Single
                actions:
                  - type: set_notes
                    value: hello
                """);
        Transaction tx = parser.parseTransaction("""
                id: tx-9
                description: NETFLIX.COM
                amount: -15.99
                date: 2024-05-01
                transaction_type: withdrawal
                notes: subscription
                """);

        assertThat(rule.getActions()).hasSize(1);
        assertThat(tx.getId()).isEqualTo("tx-9");
        assertThat(tx.getAmount()).isEqualByComparingTo(new BigDecimal("-15.99"));
        assertThat(tx.getDate()).isEqualTo(LocalDate.of(2024, 5, 1));
        assertThat(tx.getTransactionType()).isEqualTo(TransactionType.EXPENSE);
        assertThatThrownBy(() -> parser.parseRule("name: no id"))
                .hasMessage("rule: rule id is required");
        assertThatThrownBy(() -> parser.parseTransaction(""))
                .hasMessage("Transaction document is empty");
    }
}
