package com.ledger.engine.engine;

import com.ledger.engine.domain.Transaction;
import com.ledger.engine.domain.Trigger;
import com.ledger.engine.domain.TriggerGroup;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.List;

/**
 * Evaluates a trigger tree.
 * <p>
 * An empty AND group is true and an empty OR group is false. AND stops at the first false
 * child, OR at the first true child; leaf triggers are visited before nested groups, each
 * in list order. Nesting depth is not limited.
 */
@ApplicationScoped
public class TriggerGroupEvaluator {

    private static final Logger LOG = Logger.getLogger(TriggerGroupEvaluator.class);

    @Inject
    TriggerEvaluator triggerEvaluator;

    public TriggerGroupEvaluator() {
    }

    public TriggerGroupEvaluator(TriggerEvaluator triggerEvaluator) {
        this.triggerEvaluator = triggerEvaluator;
    }

    /**
     * Evaluates a group. A null group matches nothing.
     */
    public boolean evaluateGroup(TriggerGroup group, Transaction tx) {
        if (group == null) {
            LOG.warn("Missing trigger group treated as matching nothing");
            return false;
        }
        boolean any = group.getCombinator() == TriggerGroup.Combinator.OR;
        List<Trigger> triggers = group.getTriggers();
        List<TriggerGroup> groups = group.getGroups();

        if (triggers != null) {
            for (Trigger trigger : triggers) {
                boolean result = triggerEvaluator.evaluate(trigger, tx);
                if (result == any) {
                    return any;
                }
            }
        }
        if (groups != null) {
            for (TriggerGroup child : groups) {
                boolean result = evaluateGroup(child, tx);
                if (result == any) {
                    return any;
                }
            }
        }
        // No child decided the outcome: AND -> true, OR -> false (also the empty-group identity).
        return !any;
    }
}
