package io.jobwarden.core;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable automation job definition: when it may run ({@link Timeplan}), which records it
 * selects (condition) and what it writes to them (perform).
 *
 * <p>{@code updatedAt} changes on every edit; {@code lastRunAt} is only stamped by the runner.
 */
public record AutomationJob(

        // identity
        String id,
        String name,

        // scheduling
        Timeplan timeplan,

        // rule
        List<ConditionPredicate> condition,
        List<PerformAction> perform,

        // flags
        boolean active,
        boolean disableNotification,

        // bookkeeping
        Instant lastRunAt,
        Instant updatedAt
) {
    public AutomationJob {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(timeplan, "timeplan must not be null");
        Objects.requireNonNull(updatedAt, "updatedAt must not be null");
        condition = condition == null ? List.of() : List.copyOf(condition);
        perform = perform == null ? List.of() : List.copyOf(perform);
    }

    /**
     * The single entity every condition and perform path refers to.
     *
     * @throws JobConfigurationException when no path is configured or paths span several entities
     */
    public String entity() {
        Set<String> entities = new LinkedHashSet<>();
        for (ConditionPredicate p : condition) {
            entities.add(AttributePath.parse(p.path()).entity());
        }
        for (PerformAction a : perform) {
            entities.add(AttributePath.parse(a.path()).entity());
        }
        if (entities.isEmpty()) {
            throw new JobConfigurationException("job '" + name + "' has neither condition nor perform");
        }
        if (entities.size() > 1) {
            throw new JobConfigurationException("job '" + name + "' mixes entities " + entities);
        }
        return entities.iterator().next();
    }

    public AutomationJob withLastRunAt(Instant at) {
        return new AutomationJob(id, name, timeplan, condition, perform, active, disableNotification, at, updatedAt);
    }
}
