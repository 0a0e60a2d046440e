package com.unifiedinbox.exception;

/**
 * The provider answered 401 to a data call; the access token needs a refresh.
 */
public class CredentialRejectedException extends MailSyncException {

    public CredentialRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
