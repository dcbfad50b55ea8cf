package io.jobwarden.monitor;

public record AmountCheckResult(AmountState state, String message, long count) {
}
