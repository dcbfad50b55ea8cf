package io.jobwarden.engine;

import io.jobwarden.TargetRecord;
import io.jobwarden.core.ConditionOperator;
import io.jobwarden.core.ConditionPredicate;
import io.jobwarden.core.JobConfigurationException;
import io.jobwarden.engine.InMemoryRecords.MapRecord;
import io.jobwarden.engine.operator.BuiltinOperators;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConditionEvaluatorTest {

    private static final Instant NOW = Instant.parse("2026-03-10T12:00:00Z");

    private final ConditionEvaluator evaluator = new ConditionEvaluator(BuiltinOperators.registry());

    @Test
    void isMatchesNumericAttributeAgainstStringOperands() {
        MapRecord open = ticket().with("state_id", 2);
        MapRecord closed = ticket().with("state_id", 4);
        List<ConditionPredicate> condition = List.of(ConditionPredicate.of("ticket.state_id", "is", List.of("1", "2")));

        assertTrue(evaluator.matches(condition, open, NOW));
        assertFalse(evaluator.matches(condition, closed, NOW));
    }

    @Test
    void isNotInvertsMembership() {
        List<ConditionPredicate> condition = List.of(ConditionPredicate.of("ticket.group_id", "is not", "3"));

        assertTrue(evaluator.matches(condition, ticket().with("group_id", 1), NOW));
        assertFalse(evaluator.matches(condition, ticket().with("group_id", 3), NOW));
    }

    @Test
    void emptyOperandDoesNotFilter() {
        List<ConditionPredicate> condition = List.of(ConditionPredicate.of("ticket.state_id", "is", ""));

        assertTrue(evaluator.matches(condition, ticket().with("state_id", 7), NOW));
        assertTrue(evaluator.matches(condition, ticket(), NOW));
    }

    @Test
    void multiValuedAttributeMatchesWhenAnyElementIsContained() {
        List<ConditionPredicate> condition = List.of(ConditionPredicate.of("ticket.tags", "is", "vip"));

        assertTrue(evaluator.matches(condition, ticket().with("tags", List.of("spam", "vip")), NOW));
        assertFalse(evaluator.matches(condition, ticket().with("tags", List.of("spam")), NOW));
    }

    @Test
    void relativeOperatorsUseValueTimesRange() {
        MapRecord record = ticket().with("pending_time", NOW.minus(Duration.ofHours(3)));

        assertTrue(evaluator.matches(List.of(new ConditionPredicate("ticket.pending_time", "before (relative)", "2", "hour")), record, NOW));
        assertFalse(evaluator.matches(List.of(new ConditionPredicate("ticket.pending_time", "before (relative)", "4", "hour")), record, NOW));
        assertTrue(evaluator.matches(List.of(new ConditionPredicate("ticket.pending_time", "within last (relative)", "1", "day")), record, NOW));
        assertFalse(evaluator.matches(List.of(new ConditionPredicate("ticket.pending_time", "within next (relative)", "1", "day")), record, NOW));

        MapRecord future = ticket().with("pending_time", NOW.plus(Duration.ofDays(40)));
        assertTrue(evaluator.matches(List.of(new ConditionPredicate("ticket.pending_time", "after (relative)", "1", "month")), future, NOW));
        assertFalse(evaluator.matches(List.of(new ConditionPredicate("ticket.pending_time", "after (relative)", "1", "year")), future, NOW));
    }

    @Test
    void relativeOperatorNeverMatchesRecordWithoutTimestamp() {
        assertFalse(evaluator.matches(
                List.of(new ConditionPredicate("ticket.pending_time", "before (relative)", "1", "minute")), ticket(), NOW));
    }

    @Test
    void absoluteOperatorsCompareAgainstIsoOperand() {
        MapRecord record = ticket().with("created_at", "2026-02-01T08:00:00Z");

        assertTrue(evaluator.matches(List.of(ConditionPredicate.of("ticket.created_at", "before (absolute)", "2026-02-02")), record, NOW));
        assertTrue(evaluator.matches(List.of(ConditionPredicate.of("ticket.created_at", "after (absolute)", "2026-01-31T23:59:59Z")), record, NOW));
        assertFalse(evaluator.matches(List.of(ConditionPredicate.of("ticket.created_at", "after (absolute)", "2026-02-01")
        ), ticket().with("created_at", "2026-01-15"), NOW));
    }

    @Test
    void allPredicatesMustHold() {
        List<ConditionPredicate> condition = List.of(
                ConditionPredicate.of("ticket.state_id", "is", "1"),
                ConditionPredicate.of("ticket.group_id", "is", "2"));

        assertTrue(evaluator.matches(condition, ticket().with("state_id", 1).with("group_id", 2), NOW));
        assertFalse(evaluator.matches(condition, ticket().with("state_id", 1).with("group_id", 3), NOW));
    }

    @Test
    void unknownOperatorFailsEvenWithoutCandidates() {
        List<ConditionPredicate> condition = List.of(ConditionPredicate.of("ticket.state_id", "resembles", "1"));

        JobConfigurationException ex = assertThrows(JobConfigurationException.class,
                () -> evaluator.select(condition, List.of(), NOW));
        assertEquals("Unknown condition operator: resembles", ex.getMessage());
    }

    @Test
    void nonIntegerRelativeValueIsAConfigurationError() {
        List<ConditionPredicate> condition = List.of(new ConditionPredicate("ticket.created_at", "before (relative)", "two", "day"));

        assertThrows(JobConfigurationException.class,
                () -> evaluator.select(condition, List.of(ticket().with("created_at", NOW)), NOW));
    }

    @Test
    void negativeOrOversizedRelativeValueIsAConfigurationError() {
        List<TargetRecord> candidates = List.of(ticket().with("created_at", NOW));

        assertThrows(JobConfigurationException.class, () -> evaluator.select(
                List.of(new ConditionPredicate("ticket.created_at", "before (relative)", "-2", "day")), candidates, NOW));
        assertThrows(JobConfigurationException.class, () -> evaluator.select(
                List.of(new ConditionPredicate("ticket.created_at", "after (relative)", "9223372036854775807", "year")), candidates, NOW));
        assertThrows(JobConfigurationException.class, () -> evaluator.select(
                List.of(new ConditionPredicate("ticket.created_at", "within last (relative)", "50000", "year")), candidates, NOW));
    }

    @Test
    void selectCountsFailingRecordsAndKeepsGoing() {
        List<ConditionPredicate> condition = List.of(new ConditionPredicate("ticket.created_at", "before (relative)", "1", "day"));
        List<TargetRecord> candidates = List.of(
                ticket().with("created_at", "garbage"),
                ticket().with("created_at", NOW.minus(Duration.ofDays(2))),
                ticket().with("created_at", NOW));

        ConditionEvaluator.Selection selection = evaluator.select(condition, candidates, NOW);

        assertEquals(1, selection.matched().size());
        assertEquals(1, selection.failures());
    }

    @Test
    void customOperatorsCanBeRegistered() {
        ConditionOperator contains = new ConditionOperator() {
            @Override
            public String name() {
                return "contains";
            }

            @Override
            public boolean matches(Object attributeValue, ConditionPredicate predicate, Instant now) {
                return attributeValue != null && attributeValue.toString().contains(String.valueOf(predicate.value()));
            }
        };
        ConditionEvaluator custom = new ConditionEvaluator(BuiltinOperators.registry(List.of(contains)));

        assertTrue(custom.matches(List.of(ConditionPredicate.of("ticket.title", "contains", "refund")),
                ticket().with("title", "Please refund order 42"), NOW));
    }

    private static MapRecord ticket() {
        return new MapRecord("t", "ticket");
    }
}
