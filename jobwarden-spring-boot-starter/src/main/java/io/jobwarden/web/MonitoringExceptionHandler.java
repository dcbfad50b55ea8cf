package io.jobwarden.web;

import io.jobwarden.monitor.TransientCollaboratorException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice(assignableTypes = MonitoringController.class)
public class MonitoringExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(MonitoringExceptionHandler.class);

    @ExceptionHandler(MonitoringAccessDeniedException.class)
    public ResponseEntity<Map<String, Object>> handleDenied(MonitoringAccessDeniedException ex) {
        log.debug("jobwarden monitoring request rejected error={}", ex.getMessage());
        return ResponseEntity.status(ex.getStatus()).body(ex.getBody());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidInput(IllegalArgumentException ex) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(Map.of("error", ex.getMessage()));
    }

    @ExceptionHandler(TransientCollaboratorException.class)
    public ResponseEntity<Map<String, Object>> handleUnavailable(TransientCollaboratorException ex) {
        log.warn("jobwarden monitoring source unavailable msg={}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("error", ex.getMessage()));
    }
}
