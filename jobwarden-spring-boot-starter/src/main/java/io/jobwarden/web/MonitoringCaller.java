package io.jobwarden.web;

import java.util.Objects;

/**
 * Identity behind a monitoring request that did not present a token.
 *
 * @param login               who is calling
 * @param monitoringPermitted whether the caller holds the monitoring capability
 */
public record MonitoringCaller(String login, boolean monitoringPermitted) {
    public MonitoringCaller {
        Objects.requireNonNull(login, "login must not be null");
    }
}
