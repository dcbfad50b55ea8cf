package io.jobwarden.core;

/**
 * Raised when a job definition cannot be evaluated: unknown operator, malformed timeplan bucket,
 * paths spanning several entities, unparseable relative range.
 *
 * <p>Fatal to the affected job's pass only.
 */
public class JobConfigurationException extends RuntimeException {

    public JobConfigurationException(String message) {
        super(message);
    }

    public JobConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
