package com.unifiedinbox.exception;

/**
 * The refresh token is invalid, revoked or unreadable. Terminal for the account
 * until the user authorizes it again.
 */
public class AuthExpiredException extends MailSyncException {

    public AuthExpiredException(String message) {
        super(message);
    }

    public AuthExpiredException(String message, Throwable cause) {
        super(message, cause);
    }
}
