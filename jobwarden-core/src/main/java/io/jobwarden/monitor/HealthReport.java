package io.jobwarden.monitor;

import java.util.List;
import java.util.Set;

/**
 * Result of one health aggregation.
 *
 * @param healthy true iff no issue was found
 * @param message issues joined with {@code ;}, or {@code "success"}
 * @param issues  individual findings in check order
 * @param actions remediation hints, e.g. {@code restart_failed_jobs}
 * @param unknown checks that could not be evaluated because a collaborator failed
 */
public record HealthReport(
        boolean healthy,
        String message,
        List<String> issues,
        Set<String> actions,
        List<String> unknown
) {
    public static final String SUCCESS = "success";
    public static final String ACTION_RESTART_FAILED_JOBS = "restart_failed_jobs";

    public HealthReport {
        issues = List.copyOf(issues);
        actions = Set.copyOf(actions);
        unknown = List.copyOf(unknown);
    }

    public static HealthReport of(List<String> issues, Set<String> actions, List<String> unknown) {
        boolean healthy = issues.isEmpty();
        String message = healthy ? SUCCESS : String.join(";", issues);
        return new HealthReport(healthy, message, issues, actions, unknown);
    }
}
