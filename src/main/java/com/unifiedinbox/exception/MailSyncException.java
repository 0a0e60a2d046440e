package com.unifiedinbox.exception;

/**
 * Root of the sync engine's failures.
 */
public class MailSyncException extends RuntimeException {

    public MailSyncException(String message) {
        super(message);
    }

    public MailSyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
