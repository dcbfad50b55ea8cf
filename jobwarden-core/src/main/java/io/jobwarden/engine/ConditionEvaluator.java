package io.jobwarden.engine;

import io.jobwarden.TargetRecord;
import io.jobwarden.core.ConditionPredicate;
import io.jobwarden.core.ConditionOperatorRegistry;
import io.jobwarden.core.JobConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Evaluates a job condition (AND over all predicates) against candidate records.
 */
public class ConditionEvaluator {
    private static final Logger log = LoggerFactory.getLogger(ConditionEvaluator.class);

    private final ConditionOperatorRegistry operators;

    public ConditionEvaluator(ConditionOperatorRegistry operators) {
        this.operators = Objects.requireNonNull(operators, "operators must not be null");
    }

    /**
     * Resolve every operator up front so an unknown one fails the job even without candidates.
     *
     * @throws JobConfigurationException for an unknown operator
     */
    public void validate(List<ConditionPredicate> condition) {
        for (ConditionPredicate p : condition) {
            operators.getRequired(p.operator());
        }
    }

    public boolean matches(List<ConditionPredicate> condition, TargetRecord record, Instant now) {
        for (ConditionPredicate p : condition) {
            Object value = record.get(p.path());
            if (!operators.getRequired(p.operator()).matches(value, p, now)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Records satisfying every predicate, in candidate order.
     *
     * <p>A record whose evaluation fails is logged and skipped; configuration errors propagate.
     */
    public Selection select(List<ConditionPredicate> condition, List<TargetRecord> candidates, Instant now) {
        validate(condition);

        List<TargetRecord> matched = new ArrayList<>();
        int failures = 0;
        for (TargetRecord record : candidates) {
            try {
                if (matches(condition, record, now)) {
                    matched.add(record);
                }
            } catch (JobConfigurationException e) {
                throw e;
            } catch (RuntimeException e) {
                failures++;
                log.warn("jobwarden condition failed record={} msg={}", record.id(), e.getMessage());
            }
        }
        return new Selection(List.copyOf(matched), failures);
    }

    public record Selection(List<TargetRecord> matched, int failures) {
    }
}
