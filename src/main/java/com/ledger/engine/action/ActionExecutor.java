package com.ledger.engine.action;

import com.ledger.engine.domain.Account;
import com.ledger.engine.domain.ActionType;
import com.ledger.engine.domain.Category;
import com.ledger.engine.domain.NoteMarkers;
import com.ledger.engine.domain.RuleAction;
import com.ledger.engine.domain.Transaction;
import com.ledger.engine.domain.TransactionType;
import com.ledger.engine.store.LedgerStore;
import com.ledger.engine.store.StoreException;
import com.ledger.engine.store.UnitOfWork;
import com.ledger.engine.util.EngineMetrics;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Applies a rule's ordered action list to one transaction, all or nothing.
 *
 * <p>Actions mutate the working copy of a {@link UnitOfWork}. When an action fails, the
 * unit is rolled back: earlier outcomes are reported as rolled back, later ones as skipped,
 * and the transaction is left exactly as it was. Only when every action succeeds is the
 * working copy committed. A {@link StoreException} rolls back as well and is rethrown.
 *
 * <p>Categories are created on demand inside the unit of work; accounts are only looked up.
 */
@ApplicationScoped
public class ActionExecutor {

    private static final Logger LOG = Logger.getLogger(ActionExecutor.class);

    @Inject
    LedgerStore store;

    @Inject
    EngineMetrics metrics;

    public ActionExecutor() {
    }

    public ActionExecutor(LedgerStore store, EngineMetrics metrics) {
        this.store = store;
        this.metrics = metrics;
    }

    /**
     * Applies the actions and commits them.
     *
     * @param actions the actions, in execution order
     * @param tx      the transaction; mutated only if every action succeeds
     * @return per-action outcomes and the overall result
     * @throws StoreException if the store fails; the transaction is unchanged
     */
    public ExecutionResult execute(List<RuleAction> actions, Transaction tx) {
        return run(actions, tx, false);
    }

    /**
     * Applies the actions to a working copy and always rolls back.
     * {@link ExecutionResult#resultingState()} holds the state a real run would commit.
     */
    public ExecutionResult preview(List<RuleAction> actions, Transaction tx) {
        return run(actions, tx, true);
    }

    private ExecutionResult run(List<RuleAction> actions, Transaction tx, boolean dryRun) {
        List<RuleAction> list = actions != null ? actions : List.of();
        List<ActionOutcome> outcomes = new ArrayList<>(list.size());

        try (UnitOfWork uow = store.beginAtomicUpdate(tx)) {
            Transaction working = uow.workingCopy();
            ActionExecutionException failure = null;
            boolean stopped = false;

            for (int i = 0; i < list.size(); i++) {
                RuleAction action = list.get(i);
                if (failure != null) {
                    outcomes.add(ActionOutcome.skipped(i, action, "Not attempted after a failed action"));
                    continue;
                }
                if (stopped) {
                    outcomes.add(ActionOutcome.skipped(i, action, "Stopped by a previous action"));
                    continue;
                }
                try {
                    apply(action, working, uow);
                    outcomes.add(ActionOutcome.applied(i, action));
                    stopped = action.isStopProcessingAfter();
                } catch (ActionExecutionException e) {
                    failure = e;
                    outcomes.add(ActionOutcome.failed(i, action, e));
                }
            }

            if (failure != null) {
                uow.rollback();
                increment(EngineMetrics::incrementActionBatchRollback);
                LOG.debugf("Rolled back actions on transaction %s: %s", tx.getId(), failure.getMessage());
                return new ExecutionResult(tx.getId(), markRolledBack(outcomes), false, dryRun, null);
            }

            Transaction resulting = working.copy();
            if (dryRun) {
                uow.rollback();
                increment(EngineMetrics::incrementActionDryRun);
                return new ExecutionResult(tx.getId(), outcomes, true, true, resulting);
            }

            uow.commit();
            increment(EngineMetrics::incrementActionBatchSuccess);
            return new ExecutionResult(tx.getId(), outcomes, true, false, resulting);
        } catch (StoreException e) {
            increment(EngineMetrics::incrementStoreFailure);
            throw e;
        }
    }

    private static List<ActionOutcome> markRolledBack(List<ActionOutcome> outcomes) {
        List<ActionOutcome> result = new ArrayList<>(outcomes.size());
        for (ActionOutcome outcome : outcomes) {
            result.add(outcome.status() == ActionOutcome.Status.APPLIED ? outcome.rolledBack() : outcome);
        }
        return result;
    }

    // ========== Single actions ==========

    void apply(RuleAction action, Transaction tx, UnitOfWork uow) {
        if (action == null || action.getType() == null) {
            throw ActionExecutionException.validation("Unknown action type");
        }
        ActionType type = action.getType();
        String value = action.getValue() == null ? "" : action.getValue().trim();
        if (type.requiresValue() && value.isEmpty()) {
            throw ActionExecutionException.validation(type.toValue() + " requires a value");
        }

        switch (type) {
            case SET_CATEGORY -> {
                Category category = uow.findOrCreateCategoryByName(value);
                tx.setCategoryOverride(category.name());
            }
            case CLEAR_CATEGORY -> tx.setCategoryOverride(null);
            case SET_NOTES -> tx.setNotes(value);
            case SET_DESCRIPTION -> tx.setDescription(value);
            case APPEND_DESCRIPTION -> tx.setDescription(join(tx.getDescription(), value));
            case PREPEND_DESCRIPTION -> tx.setDescription(join(value, tx.getDescription()));
            case ADD_TAG -> addTag(tx, value);
            case REMOVE_TAG -> removeTag(tx, value);
            case CLEAR_ALL_TAGS -> tx.setNotes(null);
            case SET_COUNTER_PARTY -> {
                tx.setCounterName(value);
                tx.setStandardizedName(value);
            }
            case SET_SOURCE_ACCOUNT -> linkAccount(tx, requireAccount(uow, value));
            case SET_DESTINATION_ACCOUNT -> {
                Account destination = requireAccount(uow, value);
                tx.setNotes(NoteMarkers.withDestination(tx.getNotes(), destination));
            }
            case SWAP_ACCOUNTS -> swapAccounts(tx, uow);
            case CONVERT_TO_DEPOSIT -> {
                tx.setTransactionType(TransactionType.INCOME);
                tx.setAmount(amountOf(tx).abs());
            }
            case CONVERT_TO_WITHDRAWAL -> {
                tx.setTransactionType(TransactionType.EXPENSE);
                tx.setAmount(amountOf(tx).abs().negate());
            }
            case CONVERT_TO_TRANSFER -> convertToTransfer(tx, uow, value);
            case DELETE_TRANSACTION -> tx.setNotes(NoteMarkers.markDeleted(tx.getNotes()));
            case SET_EXTERNAL_ID -> tx.setNotes(NoteMarkers.appendSegment(tx.getNotes(), NoteMarkers.EXTERNAL_ID_PREFIX + value));
            case SET_INTERNAL_REFERENCE -> tx.setNotes(NoteMarkers.appendSegment(tx.getNotes(), NoteMarkers.REFERENCE_PREFIX + value));
        }
        LOG.debugf("Applied %s to transaction %s", type.toValue(), tx.getId());
    }

    private static void addTag(Transaction tx, String tag) {
        List<String> tags = NoteMarkers.parseTags(tx.getNotes());
        if (!tags.contains(tag)) {
            tags.add(tag);
            tx.setNotes(NoteMarkers.joinTags(tags));
        }
    }

    private static void removeTag(Transaction tx, String tag) {
        List<String> tags = NoteMarkers.parseTags(tx.getNotes());
        if (tags.remove(tag)) {
            tx.setNotes(NoteMarkers.joinTags(tags));
        }
    }

    private void swapAccounts(Transaction tx, UnitOfWork uow) {
        String destinationName = NoteMarkers.destinationName(tx.getNotes());
        if (destinationName == null) {
            throw ActionExecutionException.precondition("No destination account found to swap");
        }
        Account source = tx.getAccount();
        if (source == null) {
            throw ActionExecutionException.precondition("Swap requires a source account");
        }
        Account destination = requireAccount(uow, destinationName);
        linkAccount(tx, destination);
        tx.setNotes(NoteMarkers.withDestination(tx.getNotes(), source));
        tx.setAmount(amountOf(tx).negate());
    }

    private void convertToTransfer(Transaction tx, UnitOfWork uow, String destinationName) {
        if (tx.getAccount() == null) {
            throw ActionExecutionException.precondition("Transfer requires a source account");
        }
        if (!destinationName.isEmpty()) {
            Account destination = requireAccount(uow, destinationName);
            tx.setNotes(NoteMarkers.withDestination(tx.getNotes(), destination));
        }
        tx.setTransactionType(TransactionType.TRANSFER);
    }

    private static Account requireAccount(UnitOfWork uow, String name) {
        return uow.findAccountByName(name).orElseThrow(() -> ActionExecutionException.accountNotFound(name));
    }

    private static void linkAccount(Transaction tx, Account account) {
        tx.setAccount(account);
        if (account.getIban() != null) {
            tx.setIban(account.getIban());
        }
    }

    private static BigDecimal amountOf(Transaction tx) {
        return tx.getAmount() != null ? tx.getAmount() : BigDecimal.ZERO;
    }

    private static String join(String first, String second) {
        if (first == null || first.isEmpty()) {
            return second;
        }
        if (second == null || second.isEmpty()) {
            return first;
        }
        return first + " " + second;
    }

    private void increment(Consumer<EngineMetrics> counter) {
        if (metrics != null) {
            counter.accept(metrics);
        }
    }
}
