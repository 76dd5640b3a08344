package com.ledger.engine.simulation;

import com.ledger.engine.action.ActionExecutor;
import com.ledger.engine.catalog.RuleCatalogParser;
import com.ledger.engine.config.EngineConfig;
import com.ledger.engine.domain.Transaction;
import com.ledger.engine.engine.FieldAccessor;
import com.ledger.engine.engine.RuleEngine;
import com.ledger.engine.engine.TriggerEvaluator;
import com.ledger.engine.engine.TriggerGroupEvaluator;
import com.ledger.engine.simulation.SimulationService.SimulationException;
import com.ledger.engine.simulation.SimulationService.SimulationResult;
import com.ledger.engine.store.InMemoryLedgerStore;
import com.ledger.engine.store.StoreException;
import com.ledger.engine.store.UnitOfWork;
import com.ledger.engine.testing.TransactionDataGenerator;
import com.ledger.engine.util.EngineMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

class SimulationServiceTest {

    private static final String CATALOG = """
            rules:
              - id: salary
                name: Salary
                priority: 1
                stop_processing: true
                trigger_group:
                  triggers:
                    - field: counter_party
                      operator: equals
                      value: EMPLOYER INC
                actions:
                  - type: set_category
                    value: Salary
                  - type: add_tag
                    value: income
              - id: other
                name: Other income
                priority: 2
                trigger_group:
                  triggers:
                    - field: transaction_type
                      operator: equals
                      value: deposit
                actions:
                  - type: set_category
                    value: Other Income
              - id: broken
                name: Broken
                priority: 3
                trigger_group:
                  triggers:
                    - field: description
                      operator: contains
                      value: refund
                actions:
                  - type: set_source_account
                    value: Nowhere
            """;

    private InMemoryLedgerStore store;
    private EngineMetrics metrics;
    private EngineConfig config;
    private SimulationService simulationService;

    @BeforeEach
    void setup() {
        store = new InMemoryLedgerStore();
        metrics = new EngineMetrics();
        config = EngineConfig.defaults();
        TriggerGroupEvaluator groupEvaluator = new TriggerGroupEvaluator(
                new TriggerEvaluator(new FieldAccessor(), Clock.systemUTC()));
        RuleEngine engine = new RuleEngine(groupEvaluator, new ActionExecutor(store, metrics), store, config, metrics);
        simulationService = new SimulationService(engine, new RuleCatalogParser(), config, metrics);
    }

    @Test
    void explainsMatchedRulesAndStopsAfterStopProcessingRule() {
        Transaction tx = TransactionDataGenerator.income("tx-1", "EMPLOYER INC", "3200.00");
        Transaction before = tx.copy();

        SimulationResult result = simulationService.simulate(CATALOG, tx);

        assertThat(result.getTransactionId()).isEqualTo("tx-1");
        assertThat(result.getRulesEvaluated()).isEqualTo(1);
        assertThat(result.getMatchedRuleIds()).containsExactly("salary");
        assertThat(result.getStoppedByRuleId()).isEqualTo("salary");
        assertThat(result.getExplanations()).singleElement().satisfies(explanation -> assertThat(explanation)
                .startsWith("Rule 'Salary' matched: IF ")
                .endsWith(" -> 2 action(s) applied, stopped further rules"));
        assertThat(result.getExplanation()).startsWith("1 rule(s) matched, first: Rule 'Salary'");
        assertThat(result.getChanges())
                .containsEntry("category", "Uncategorized -> Salary")
                .containsEntry("notes", "null -> income")
                .doesNotContainKey("description");
        assertThat(result.getResultingState().getCategoryOverride()).isEqualTo("Salary");

        assertEquals(before, tx);
        assertThat(store.getCategories()).isEmpty();
        assertThat(metrics.snapshot()).containsEntry("simulation_total", 1L);
    }

    @Test
    void reportsUnchangedTransactionWhenNothingMatches() {
        Transaction tx = TransactionDataGenerator.expense("tx-2", "Coffee", "-3.50");

        SimulationResult result = simulationService.simulate(CATALOG, tx);

        assertThat(result.getMatchedRuleIds()).isEmpty();
        assertThat(result.getRulesEvaluated()).isEqualTo(3);
        assertThat(result.getExplanation()).isEqualTo("No rules matched - transaction unchanged");
        assertThat(result.getChanges()).isEmpty();
    }

    @Test
    void explainsRolledBackRule() {
        Transaction tx = TransactionDataGenerator.expense("tx-3", "Refund pending", "-20.00");

        SimulationResult result = simulationService.simulate(CATALOG, tx);

        assertThat(result.getMatchedRuleIds()).containsExactly("broken");
        assertThat(result.getExplanations().get(0)).contains(" -> rolled back: ");
        assertThat(result.getExplanation()).startsWith("Rule 'Broken': ");
        assertThat(result.getChanges()).isEmpty();
    }

    @Test
    void acceptsTransactionAsYaml() {
        SimulationResult result = simulationService.simulate(CATALOG, """
                id: tx-yaml
                counter_name: EMPLOYER INC
                amount: 3200
                transaction_type: deposit
                """);

        assertThat(result.getTransactionId()).isEqualTo("tx-yaml");
        assertThat(result.getMatchedRuleIds()).containsExactly("salary");
    }

    @Test
    void failsWhenDisabled() {
        config.simulationEnabled = false;

        assertThatThrownBy(() -> simulationService.simulate(CATALOG, TransactionDataGenerator.randomTransaction()))
                .isInstanceOf(SimulationException.class)
                .hasMessage("Simulation is disabled");
    }

    @Test
    void rejectsMissingTransactionAndInvalidCatalog() {
        assertThatThrownBy(() -> simulationService.simulate(CATALOG, (Transaction) null))
                .isInstanceOf(SimulationException.class)
                .hasMessage("Transaction is required");
        assertThatThrownBy(() -> simulationService.simulate("rules: [", TransactionDataGenerator.randomTransaction()))
                .isInstanceOf(RuleCatalogParser.InvalidCatalogException.class);
    }

    @Test
    void wrapsStoreFailures() {
        InMemoryLedgerStore failing = new InMemoryLedgerStore() {
            @Override
            public UnitOfWork beginAtomicUpdate(Transaction transaction) {
                throw new StoreException("store offline");
            }
        };
        TriggerGroupEvaluator groupEvaluator = new TriggerGroupEvaluator(
                new TriggerEvaluator(new FieldAccessor(), Clock.systemUTC()));
        RuleEngine engine = new RuleEngine(groupEvaluator, new ActionExecutor(failing, metrics), failing, config, metrics);
        SimulationService service = new SimulationService(engine, new RuleCatalogParser(), config, metrics);

        assertThatThrownBy(() -> service.simulate(CATALOG, TransactionDataGenerator.income("tx-1", "EMPLOYER INC", "10")))
                .isInstanceOf(SimulationException.class)
                .hasMessage("Simulation failed: store offline")
                .hasCauseInstanceOf(StoreException.class);
    }
}
