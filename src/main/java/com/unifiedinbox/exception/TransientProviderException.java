package com.unifiedinbox.exception;

/**
 * Network failure, timeout, rate limit or 5xx. Safe to retry later.
 */
public class TransientProviderException extends MailSyncException {

    public TransientProviderException(String message) {
        super(message);
    }

    public TransientProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
