package io.jobwarden.web;

import org.springframework.http.HttpStatus;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Rejected monitoring request; carries the status and the fixed response body.
 */
public class MonitoringAccessDeniedException extends RuntimeException {

    private final HttpStatus status;
    private final Map<String, Object> body;

    private MonitoringAccessDeniedException(HttpStatus status, String error, boolean withHealthFlag) {
        super(error);
        this.status = status;
        Map<String, Object> b = new LinkedHashMap<>();
        if (withHealthFlag) {
            b.put("healthy", false);
        }
        b.put("error", error);
        this.body = b;
    }

    /**
     * No valid token and no authenticated caller.
     */
    public static MonitoringAccessDeniedException notAuthorized() {
        return new MonitoringAccessDeniedException(HttpStatus.UNAUTHORIZED, "Not authorized", true);
    }

    /**
     * Authenticated caller without the monitoring capability.
     */
    public static MonitoringAccessDeniedException notAuthorizedUser() {
        return new MonitoringAccessDeniedException(HttpStatus.UNAUTHORIZED, "Not authorized (user)!", false);
    }

    public static MonitoringAccessDeniedException authenticationFailed() {
        return new MonitoringAccessDeniedException(HttpStatus.UNAUTHORIZED, "authentication failed", false);
    }

    public HttpStatus getStatus() {
        return status;
    }

    public Map<String, Object> getBody() {
        return body;
    }
}
