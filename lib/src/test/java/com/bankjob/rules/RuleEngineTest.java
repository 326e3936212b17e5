package com.bankjob.rules;

import static com.bankjob.testing.TestStatements.statement;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

import com.bankjob.ledger.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

final class RuleEngineTest {

    @Test
    void ordersByPriorityThenRegistration() {
        RuleEngine engine = new RuleEngine();
        TransactionRule noop = transaction -> {};
        engine.register(0, "first-zero", noop);
        engine.register(0, "second-zero", noop);
        engine.register(RuleEngine.LAST, "catch-all", noop);
        engine.register(999, "urgent", noop);

        assertEquals(
                List.of("urgent", "first-zero", "second-zero", "catch-all"),
                engine.rules().stream().map(RuleEngine.RegisteredRule::getName).collect(Collectors.toList()));
    }

    @Test
    void lowerPriorityRegisteredFirstStillRunsLast() {
        RuleEngine engine = new RuleEngine();
        TransactionRule noop = transaction -> {};
        engine.register(-5, "low", noop);
        engine.register(3, "high", noop);
        engine.register(noop);

        assertEquals(
                List.of(3, 0, -5),
                engine.rules().stream().map(RuleEngine.RegisteredRule::getPriority).collect(Collectors.toList()));
    }

    @Test
    void appliesRuleMajor() {
        List<String> trace = new ArrayList<>();
        RuleEngine engine =
                new RuleEngine()
                        .register(1, transaction -> trace.add("a:" + transaction.getRawDescription()))
                        .register(0, transaction -> trace.add("b:" + transaction.getRawDescription()));
        Statement s = statement(1, 2);

        Statement result = engine.applyAll(s);

        assertSame(s, result);
        assertEquals(
                List.of("a:MOVEMENT 1", "a:MOVEMENT 2", "b:MOVEMENT 1", "b:MOVEMENT 2"), trace);
    }

    @Test
    void laterRulesSeeEarlierChanges() {
        RuleEngine engine =
                new RuleEngine()
                        .register(RuleEngine.LAST, StandardRules.capitalizeUncustomized())
                        .register(transaction -> transaction.setDescription("Custom"));
        Statement s = statement(1);

        engine.applyAll(s);

        assertEquals("Custom", s.getTransactions().get(0).getDescription());
    }
}
