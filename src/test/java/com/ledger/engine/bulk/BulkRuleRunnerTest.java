package com.ledger.engine.bulk;

import com.ledger.engine.action.ActionExecutor;
import com.ledger.engine.config.EngineConfig;
import com.ledger.engine.domain.ActionType;
import com.ledger.engine.domain.Rule;
import com.ledger.engine.domain.RuleAction;
import com.ledger.engine.domain.Transaction;
import com.ledger.engine.domain.Trigger;
import com.ledger.engine.domain.TriggerField;
import com.ledger.engine.domain.TriggerGroup;
import com.ledger.engine.domain.TriggerOperator;
import com.ledger.engine.engine.FieldAccessor;
import com.ledger.engine.engine.RuleEngine;
import com.ledger.engine.engine.TriggerEvaluator;
import com.ledger.engine.engine.TriggerGroupEvaluator;
import com.ledger.engine.store.InMemoryLedgerStore;
import com.ledger.engine.testing.TransactionDataGenerator;
import com.ledger.engine.util.EngineMetrics;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BulkRuleRunnerTest {

    private InMemoryLedgerStore store;
    private EngineMetrics metrics;
    private EngineConfig config;
    private BulkRuleRunner runner;

    @BeforeEach
    void setup() {
        store = new InMemoryLedgerStore();
        metrics = new EngineMetrics();
        config = EngineConfig.defaults();
        TriggerGroupEvaluator groupEvaluator = new TriggerGroupEvaluator(
                new TriggerEvaluator(new FieldAccessor(), Clock.systemUTC()));
        RuleEngine engine = new RuleEngine(groupEvaluator, new ActionExecutor(store, metrics), store, config, metrics);
        runner = new BulkRuleRunner(engine, config, metrics);
    }

    @AfterEach
    void tearDown() {
        runner.stop();
    }

    private static List<Transaction> purchases(int count) {
        List<Transaction> transactions = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            transactions.add(TransactionDataGenerator.expense("tx-" + i, "Purchase " + i, "-10.00"));
        }
        return transactions;
    }

    private static Rule tagEverything(String tag) {
        Rule rule = new Rule("tag-" + tag, "Tag " + tag, 1);
        rule.addAction(RuleAction.of(ActionType.ADD_TAG, tag));
        return rule;
    }

    @Test
    void oneBadTransactionDoesNotStopTheRun() {
        List<Transaction> transactions = purchases(10_000);
        transactions.get(4_999).setDescription("Refund under review");

        Rule reroute = new Rule("reroute", "Reroute refunds", 1);
        reroute.setTriggerGroup(TriggerGroup.all(
                new Trigger(TriggerField.DESCRIPTION, TriggerOperator.CONTAINS, "refund")));
        reroute.addAction(RuleAction.of(ActionType.SET_SOURCE_ACCOUNT, "Account That Does Not Exist"));

        BulkRunSummary summary = runner.run(List.of(reroute), TransactionSource.of(transactions), null, null);

        assertThat(summary.processed()).isEqualTo(10_000);
        assertThat(summary.succeeded()).isEqualTo(9_999);
        assertThat(summary.failed()).isEqualTo(1);
        assertThat(summary.changed()).isZero();
        assertThat(summary.cancelled()).isFalse();
        assertThat(summary.message()).isEqualTo("9999 applied, 1 failed");
        assertThat(summary.failures()).singleElement().satisfies(failure -> {
            assertThat(failure.transactionId()).isEqualTo("tx-5000");
            assertThat(failure.kind()).isEqualTo(BulkFailure.Kind.ACTION);
            assertThat(failure.reason()).contains("Reroute refunds");
        });
        assertThat(transactions.get(4_999).getAccount()).isNull();
    }

    @Test
    void reportsProgressAfterEveryChunk() {
        config.bulkChunkSize = 40;
        List<BulkProgress> events = new ArrayList<>();

        BulkRunSummary summary = runner.run(List.of(tagEverything("seen")),
                TransactionSource.of(purchases(100)), events::add, new CancellationToken());

        assertThat(events).extracting(BulkProgress::processed).containsExactly(40L, 80L, 100L);
        assertThat(events).extracting(BulkProgress::chunk).containsExactly(1, 2, 3);
        assertThat(events.get(2).percent()).isEqualTo(100);
        assertThat(events.get(0).total()).isEqualTo(100);
        assertThat(summary.changed()).isEqualTo(100);
        assertThat(summary.rulesMatched()).isEqualTo(100);
    }

    @Test
    void progressCarriesTimingMatchesAndChunkFailures() {
        config.bulkChunkSize = 7;
        store.failCommitsWhen(tx -> tx.getId().equals("tx-3") || tx.getId().equals("tx-12"));
        List<BulkProgress> events = new ArrayList<>();

        runner.run(List.of(tagEverything("seen")), TransactionSource.of(purchases(20)), events::add, null);

        assertThat(events).hasSize(3);
        assertThat(events).extracting(BulkProgress::rulesMatched).containsExactly(6L, 12L, 18L);
        assertThat(events.get(0).chunkFailures()).extracting(BulkFailure::transactionId).containsExactly("tx-3");
        assertThat(events.get(1).chunkFailures()).extracting(BulkFailure::transactionId).containsExactly("tx-12");
        assertThat(events.get(2).chunkFailures()).isEmpty();
        assertThat(events).allSatisfy(event -> assertThat(event.elapsedMs()).isGreaterThanOrEqualTo(0));
        assertThat(events.get(0).elapsedMs()).isLessThanOrEqualTo(events.get(2).elapsedMs());
        assertThat(events.get(2).estimatedRemainingMs()).isZero();
        assertThat(events.get(0).estimatedRemainingMs()).isGreaterThanOrEqualTo(0);
    }

    @Test
    void finishedRunStampsRuleStatistics() {
        Rule rule = tagEverything("seen");

        runner.run(List.of(rule), TransactionSource.of(purchases(5)), null, null);

        assertThat(store.findRuleStatistics(rule.getId())).hasValueSatisfying(statistics -> {
            assertThat(statistics.getLastBulkProcessedAt()).isNotNull();
            assertThat(statistics.getTotalEvaluations()).isEqualTo(5);
            assertThat(statistics.getMatchCount()).isEqualTo(5);
        });
    }

    @Test
    void cancellationTakesEffectBetweenChunks() {
        config.bulkChunkSize = 10;
        CancellationToken token = new CancellationToken();
        List<Transaction> transactions = purchases(50);

        BulkRunSummary summary = runner.run(List.of(tagEverything("seen")), TransactionSource.of(transactions),
                progress -> token.cancel(), token);

        assertThat(summary.cancelled()).isTrue();
        assertThat(summary.processed()).isEqualTo(10);
        assertThat(summary.message()).isEqualTo("10 applied, 0 failed (cancelled)");
        assertThat(transactions.get(9).getNotes()).isEqualTo("seen");
        assertThat(transactions.get(10).getNotes()).isNull();
        assertThat(metrics.snapshot()).containsEntry("bulk_run_cancelled_total", 1L);
    }

    @Test
    void storeFailuresAreIsolatedPerTransaction() {
        config.bulkChunkSize = 7;
        store.failCommitsWhen(tx -> tx.getId().equals("tx-3") || tx.getId().equals("tx-12"));
        List<Transaction> transactions = purchases(20);

        BulkRunSummary summary = runner.run(List.of(tagEverything("seen")),
                TransactionSource.of(transactions), null, null);

        assertThat(summary.failed()).isEqualTo(2);
        assertThat(summary.succeeded()).isEqualTo(18);
        assertThat(summary.failures()).extracting(BulkFailure::transactionId).containsExactly("tx-3", "tx-12");
        assertThat(summary.failures()).extracting(BulkFailure::kind)
                .containsOnly(BulkFailure.Kind.STORE);
        assertThat(transactions.get(2).getNotes()).isNull();
        assertThat(transactions.get(3).getNotes()).isEqualTo("seen");
    }

    @Test
    void recordedFailuresAreCappedButCountedExactly() {
        config.maxRecordedFailures = 3;
        store.failCommitsWhen(tx -> true);

        BulkRunSummary summary = runner.run(List.of(tagEverything("seen")),
                TransactionSource.of(purchases(10)), null, null);

        assertThat(summary.failed()).isEqualTo(10);
        assertThat(summary.failures()).hasSize(3);
    }

    @Test
    void pagesThroughTheStore() {
        config.bulkChunkSize = 25;
        store.addTransactions(TransactionDataGenerator.randomTransactions(60));

        BulkRunSummary summary = runner.run(List.of(tagEverything("imported")),
                TransactionSource.fromStore(store, tx -> true), null, null);

        assertThat(summary.processed()).isEqualTo(60);
        assertThat(store.fetchTransactions(tx -> true, 0, 100))
                .allSatisfy(tx -> assertThat(tx.getNotes()).contains("imported"));
    }

    @Test
    void singleRuleRunIgnoresActiveFlag() {
        Rule inactive = tagEverything("manual");
        inactive.setActive(false);
        List<Transaction> transactions = purchases(5);

        BulkRunSummary all = runner.run(List.of(inactive), TransactionSource.of(transactions), null, null);
        BulkRunSummary single = runner.runSingle(inactive, TransactionSource.of(transactions), null, null);

        assertThat(all.changed()).isZero();
        assertThat(single.changed()).isEqualTo(5);
        assertThat(inactive.getMatchCount()).isEqualTo(5);
    }

    @Test
    void emptySourceFinishesImmediately() {
        List<BulkProgress> events = new ArrayList<>();

        BulkRunSummary summary = runner.run(List.of(tagEverything("x")), TransactionSource.of(List.of()),
                events::add, null);

        assertThat(summary.processed()).isZero();
        assertThat(summary.message()).isEqualTo("0 applied, 0 failed");
        assertThat(events).isEmpty();
    }

    @Test
    void chunkFetchFailureAbortsTheRun() {
        TransactionSource broken = new TransactionSource() {
            @Override
            public List<Transaction> chunk(int offset, int size) {
                throw new IllegalStateException("source unavailable");
            }

            @Override
            public long size() {
                return -1;
            }
        };

        assertThatThrownBy(() -> runner.run(List.of(tagEverything("x")), broken, null, null))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("source unavailable");
    }

    @Test
    void backgroundRunCompletesWithSummary() throws Exception {
        config.bulkChunkSize = 10;
        List<BulkProgress> events = new CopyOnWriteArrayList<>();

        BulkRunHandle handle = runner.submit(List.of(tagEverything("async")),
                TransactionSource.of(purchases(35)), events::add);
        BulkRunSummary summary = handle.completion().get(10, TimeUnit.SECONDS);

        assertThat(handle.isDone()).isTrue();
        assertThat(handle.isCancelled()).isFalse();
        assertThat(summary.processed()).isEqualTo(35);
        assertThat(events).hasSize(4);
        assertThat(metrics.snapshot()).containsEntry("bulk_run_completed_total", 1L);
    }

    @Test
    void backgroundSingleRuleRunCanBeCancelled() throws Exception {
        config.bulkChunkSize = 5;
        Rule rule = tagEverything("async");
        List<Transaction> transactions = purchases(100);
        BulkRunHandle[] holder = new BulkRunHandle[1];
        CountDownLatch started = new CountDownLatch(1);

        holder[0] = runner.submitSingle(rule, TransactionSource.of(transactions), progress -> {
            try {
                started.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            holder[0].cancel();
        });
        started.countDown();
        BulkRunSummary summary = holder[0].completion().get(10, TimeUnit.SECONDS);

        assertThat(summary.cancelled()).isTrue();
        assertThat(summary.processed()).isEqualTo(5);
    }

    @Test
    void backgroundRunFailureCompletesExceptionally() {
        TransactionSource broken = new TransactionSource() {
            @Override
            public List<Transaction> chunk(int offset, int size) {
                throw new IllegalStateException("source unavailable");
            }

            @Override
            public long size() {
                return -1;
            }
        };

        BulkRunHandle handle = runner.submit(List.of(tagEverything("x")), broken, null);

        assertThatThrownBy(() -> handle.completion().join())
                .isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
    }
}
