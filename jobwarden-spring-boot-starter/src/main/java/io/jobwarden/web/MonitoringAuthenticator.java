package io.jobwarden.web;

import jakarta.servlet.http.HttpServletRequest;

import java.util.Optional;

/**
 * Resolves the session or credentials of a monitoring request. Authentication schemes are left to
 * the host application; the default finds no caller, so only the monitoring token grants access.
 */
@FunctionalInterface
public interface MonitoringAuthenticator {

    Optional<MonitoringCaller> authenticate(HttpServletRequest request);

    static MonitoringAuthenticator none() {
        return request -> Optional.empty();
    }
}
