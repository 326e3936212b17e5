package com.bankjob.rules;

import com.bankjob.ledger.Statement;
import com.bankjob.ledger.Transaction;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * An ordered set of transaction rules. Rules run highest priority first; rules of equal priority
 * run in the order they were registered. Use {@link #LAST} for rules that must see the result of
 * every other rule, such as a catch-all type assignment.
 *
 * <p>Each engine is owned by one extraction session, so rules registered for one bank never leak
 * into another's.</p>
 */
public final class RuleEngine {

    public static final int DEFAULT_PRIORITY = 0;
    public static final int LAST = -999;

    private static final Logger LOGGER = Logger.getLogger(RuleEngine.class.getName());

    private final List<RegisteredRule> rules = new ArrayList<>();

    public RuleEngine register(TransactionRule rule) {
        return register(DEFAULT_PRIORITY, rule);
    }

    public RuleEngine register(int priority, TransactionRule rule) {
        return register(priority, "rule-" + (rules.size() + 1), rule);
    }

    public synchronized RuleEngine register(int priority, String name, TransactionRule rule) {
        RegisteredRule registered = new RegisteredRule(priority, name, rule);
        // after the last rule that runs no later than this one, keeping registration order on ties
        int insertAt = 0;
        for (int i = rules.size() - 1; i >= 0; i--) {
            if (rules.get(i).getPriority() >= priority) {
                insertAt = i + 1;
                break;
            }
        }
        rules.add(insertAt, registered);
        return this;
    }

    /** The rules in execution order. */
    public synchronized List<RegisteredRule> rules() {
        return Collections.unmodifiableList(new ArrayList<>(rules));
    }

    /**
     * Applies each rule to every transaction of {@code statement} before moving to the next rule,
     * so a later rule sees what earlier rules did to the whole statement.
     *
     * @return {@code statement}, for chaining
     */
    public Statement applyAll(Statement statement) {
        Objects.requireNonNull(statement, "statement");
        List<RegisteredRule> ordered = rules();
        for (RegisteredRule rule : ordered) {
            LOGGER.log(
                    Level.FINE,
                    "Applying {0} (priority {1}) to {2} transaction(s)",
                    new Object[] {rule.getName(), rule.getPriority(), statement.getTransactions().size()});
            for (Transaction transaction : statement.getTransactions()) {
                rule.getRule().apply(transaction);
            }
        }
        return statement;
    }

    public static final class RegisteredRule {
        private final int priority;
        private final String name;
        private final TransactionRule rule;

        private RegisteredRule(int priority, String name, TransactionRule rule) {
            this.priority = priority;
            this.name = Objects.requireNonNull(name, "name");
            this.rule = Objects.requireNonNull(rule, "rule");
        }

        public int getPriority() {
            return priority;
        }

        public String getName() {
            return name;
        }

        public TransactionRule getRule() {
            return rule;
        }

        @Override
        public String toString() {
            return name + "@" + priority;
        }
    }
}
