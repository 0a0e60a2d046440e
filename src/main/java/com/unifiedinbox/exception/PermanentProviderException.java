package com.unifiedinbox.exception;

/**
 * 4xx other than 401/429: the request itself is wrong and repeating it will not help.
 */
public class PermanentProviderException extends MailSyncException {

    public PermanentProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
