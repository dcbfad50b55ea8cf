package io.jobwarden.monitor;

/**
 * A monitored subsystem could not be queried. The affected health check reports "unknown".
 */
public class TransientCollaboratorException extends RuntimeException {

    public TransientCollaboratorException(String message) {
        super(message);
    }

    public TransientCollaboratorException(String message, Throwable cause) {
        super(message, cause);
    }
}
