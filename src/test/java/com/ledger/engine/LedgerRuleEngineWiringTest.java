package com.ledger.engine;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ledger.engine.bulk.BulkRunSummary;
import com.ledger.engine.config.EngineConfig;
import com.ledger.engine.domain.ActionType;
import com.ledger.engine.domain.Rule;
import com.ledger.engine.domain.RuleAction;
import com.ledger.engine.domain.Transaction;
import com.ledger.engine.domain.Trigger;
import com.ledger.engine.domain.TriggerField;
import com.ledger.engine.domain.TriggerGroup;
import com.ledger.engine.domain.TriggerOperator;
import com.ledger.engine.service.RuleService;
import com.ledger.engine.service.RuleStatisticsAnalyzer;
import com.ledger.engine.simulation.SimulationService;
import com.ledger.engine.store.InMemoryLedgerStore;
import com.ledger.engine.store.LedgerStore;
import com.ledger.engine.testing.TransactionDataGenerator;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

@QuarkusTest
class LedgerRuleEngineWiringTest {

    @Inject
    RuleService ruleService;

    @Inject
    SimulationService simulationService;

    @Inject
    LedgerStore store;

    @Inject
    RuleStatisticsAnalyzer statisticsAnalyzer;

    @Inject
    EngineConfig config;

    @Inject
    ObjectMapper objectMapper;

    @Inject
    Validator validator;

    @Test
    void configurationComesFromTestProfile() {
        assertThat(config.bulkChunkSize).isEqualTo(100);
        assertThat(config.maxRecordedFailures).isEqualTo(1000);
        assertThat(config.simulationEnabled).isTrue();
    }

    @Test
    void appliesRuleThroughContainerBeans() {
        assertThat(store).isInstanceOf(InMemoryLedgerStore.class);
        Rule rule = new Rule("wiring-netflix", "Netflix", 1);
        rule.setTriggerGroup(TriggerGroup.all(
                new Trigger(TriggerField.DESCRIPTION, TriggerOperator.CONTAINS, "netflix")));
        rule.addAction(RuleAction.of(ActionType.SET_CATEGORY, "Subscriptions"));
        Transaction tx = TransactionDataGenerator.expense("wiring-tx-1", "NETFLIX.COM", "-15.99");

        BulkRunSummary summary = ruleService.applyRule(rule, List.of(tx));

        assertThat(summary.message()).isEqualTo("1 applied, 0 failed");
        assertThat(tx.getCategoryOverride()).isEqualTo("Subscriptions");
        assertThat(((InMemoryLedgerStore) store).getPersistedMatchCount("wiring-netflix")).contains(1L);
        assertThat(statisticsAnalyzer.allStatistics())
                .filteredOn(statistics -> statistics.getRuleId().equals("wiring-netflix"))
                .singleElement()
                .satisfies(statistics -> {
                    assertThat(statistics.getMatchCount()).isEqualTo(1);
                    assertThat(statistics.getLastBulkProcessedAt()).isNotNull();
                });
    }

    @Test
    void simulationIsAvailable() {
        SimulationService.SimulationResult result = simulationService.simulate("""
                rules:
                  - id: wiring-sim
                    name: Tag coffee
                    trigger_group:
                      triggers:
                        - field: description
                          operator: contains
                          value: coffee
                    actions:
                      - type: add_tag
                        value: coffee
                """, TransactionDataGenerator.expense("wiring-tx-2", "Coffee corner", "-3.20"));

        assertThat(result.getMatchedRuleIds()).containsExactly("wiring-sim");
    }

    @Test
    void objectMapperWritesIsoDates() throws Exception {
        Transaction tx = TransactionDataGenerator.expense("wiring-tx-3", "Train", "-12.00");
        tx.setDate(LocalDate.of(2024, 4, 2));

        String json = objectMapper.writeValueAsString(tx);

        assertThat(json).contains("\"date\":\"2024-04-02\"").contains("\"transaction_type\":\"expense\"");
    }

    @Test
    void ruleDefinitionsAreBeanValidated() {
        Rule rule = new Rule("wiring-invalid", " ", 1);
        rule.setTriggerGroup(null);

        Set<ConstraintViolation<Rule>> violations = validator.validate(rule);

        assertThat(violations).extracting(ConstraintViolation::getMessage)
                .containsExactlyInAnyOrder("Rule name is required", "Trigger group is required");
    }
}
