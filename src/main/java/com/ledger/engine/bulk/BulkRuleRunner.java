package com.ledger.engine.bulk;

import com.ledger.engine.config.EngineConfig;
import com.ledger.engine.domain.Rule;
import com.ledger.engine.domain.Transaction;
import com.ledger.engine.engine.RuleApplicationResult;
import com.ledger.engine.engine.RuleEngine;
import com.ledger.engine.engine.RuleOutcome;
import com.ledger.engine.store.StoreException;
import com.ledger.engine.util.EngineMetrics;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;

/**
 * Applies rules to many transactions in chunks.
 *
 * <p>Each transaction is isolated: a failure is recorded in the summary and processing
 * continues with the next one. A progress event is pushed after every chunk and cancellation
 * is checked before the next chunk starts, so work committed before cancellation stays
 * committed. Background runs execute one at a time on a dedicated worker thread.
 */
@ApplicationScoped
public class BulkRuleRunner {

    private static final Logger LOG = Logger.getLogger(BulkRuleRunner.class);

    private final ExecutorService worker = Executors.newSingleThreadExecutor(
            r -> new Thread(r, "rule-bulk-worker"));

    @Inject
    RuleEngine ruleEngine;

    @Inject
    EngineConfig config;

    @Inject
    EngineMetrics metrics;

    public BulkRuleRunner() {
    }

    public BulkRuleRunner(RuleEngine ruleEngine, EngineConfig config, EngineMetrics metrics) {
        this.ruleEngine = ruleEngine;
        this.config = config;
        this.metrics = metrics;
    }

    @PreDestroy
    void stop() {
        worker.shutdownNow();
    }

    /**
     * Applies all active rules, in priority order, to every transaction of the source.
     */
    public BulkRunSummary run(List<Rule> rules, TransactionSource source,
                              BulkProgressListener listener, CancellationToken token) {
        List<Rule> ordered = RuleEngine.orderForEvaluation(rules);
        return execute(ordered, source, tx -> ruleEngine.apply(ordered, tx), listener, token);
    }

    /**
     * Applies one rule, active or not, to every transaction of the source.
     */
    public BulkRunSummary runSingle(Rule rule, TransactionSource source,
                                    BulkProgressListener listener, CancellationToken token) {
        List<Rule> participants = rule == null ? List.of() : List.of(rule);
        return execute(participants, source, tx -> ruleEngine.applySingle(rule, tx), listener, token);
    }

    /**
     * Starts {@link #run} on the worker thread.
     */
    public BulkRunHandle submit(List<Rule> rules, TransactionSource source, BulkProgressListener listener) {
        CancellationToken token = new CancellationToken();
        CompletableFuture<BulkRunSummary> future = CompletableFuture.supplyAsync(
                () -> run(rules, source, listener, token), worker);
        return new BulkRunHandle(token, future);
    }

    /**
     * Starts {@link #runSingle} on the worker thread.
     */
    public BulkRunHandle submitSingle(Rule rule, TransactionSource source, BulkProgressListener listener) {
        CancellationToken token = new CancellationToken();
        CompletableFuture<BulkRunSummary> future = CompletableFuture.supplyAsync(
                () -> runSingle(rule, source, listener, token), worker);
        return new BulkRunHandle(token, future);
    }

    private BulkRunSummary execute(List<Rule> participants,
                                   TransactionSource source,
                                   Function<Transaction, RuleApplicationResult> step,
                                   BulkProgressListener listener,
                                   CancellationToken token) {
        BulkProgressListener progress = listener != null ? listener : BulkProgressListener.NONE;
        CancellationToken cancellation = token != null ? token : new CancellationToken();
        int chunkSize = config.effectiveChunkSize();
        int maxFailures = Math.max(0, config.maxRecordedFailures);

        long started = System.currentTimeMillis();
        metrics.incrementBulkRunStarted();
        long total = source.size();
        LOG.infof("Bulk rule run started: %d transactions, chunk size %d", total, chunkSize);

        List<BulkFailure> failures = new ArrayList<>();
        long processed = 0;
        long succeeded = 0;
        long failed = 0;
        long changed = 0;
        long rulesMatched = 0;
        int chunkNumber = 0;
        int offset = 0;
        boolean cancelled = false;

        while (true) {
            if (cancellation.isCancelled()) {
                cancelled = true;
                break;
            }
            List<Transaction> chunk = source.chunk(offset, chunkSize);
            if (chunk.isEmpty()) {
                break;
            }
            chunkNumber++;
            List<BulkFailure> chunkFailures = new ArrayList<>();

            for (Transaction tx : chunk) {
                BulkFailure failure;
                try {
                    RuleApplicationResult result = step.apply(tx);
                    long matched = result.matchedRules().stream().filter(RuleOutcome::applied).count();
                    rulesMatched += matched;
                    if (matched > 0) {
                        changed++;
                    }
                    failure = result.success()
                            ? null
                            : new BulkFailure(tx.getId(), BulkFailure.Kind.ACTION, result.failureMessage());
                } catch (StoreException e) {
                    LOG.warnf(e, "Store failure while applying rules to transaction %s", tx.getId());
                    failure = new BulkFailure(tx.getId(), BulkFailure.Kind.STORE, e.getMessage());
                } catch (RuntimeException e) {
                    LOG.errorf(e, "Unexpected failure while applying rules to transaction %s", tx.getId());
                    failure = new BulkFailure(tx.getId(), BulkFailure.Kind.UNEXPECTED, String.valueOf(e.getMessage()));
                }

                processed++;
                if (failure == null) {
                    succeeded++;
                } else {
                    failed++;
                    chunkFailures.add(failure);
                    if (failures.size() < maxFailures) {
                        failures.add(failure);
                    }
                }
            }

            offset += chunk.size();
            BulkProgress event = new BulkProgress(processed, total, succeeded, failed, rulesMatched, chunkNumber,
                    System.currentTimeMillis() - started, chunkFailures);
            LOG.debugf("Bulk run chunk %d done: %d/%d processed, %d failed, ~%d ms remaining",
                    chunkNumber, processed, total, failed, event.estimatedRemainingMs());
            progress.onProgress(event);
            if (chunk.size() < chunkSize) {
                break;
            }
        }

        if (processed > 0) {
            ruleEngine.recordBulkProcessed(participants);
        }
        long durationMs = System.currentTimeMillis() - started;
        metrics.recordBulkRunFinished(cancelled, processed, failed, durationMs);
        BulkRunSummary summary = new BulkRunSummary(processed, succeeded, failed, changed, rulesMatched,
                failures, cancelled, durationMs);
        LOG.infof("Bulk rule run finished in %d ms: %s", durationMs, summary.message());
        return summary;
    }
}
