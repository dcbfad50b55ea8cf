package io.jobwarden.monitor;

/**
 * Dead-letter store for inbound mails that could not be processed.
 */
public interface MailSpool {

    long countUnprocessable();
}
