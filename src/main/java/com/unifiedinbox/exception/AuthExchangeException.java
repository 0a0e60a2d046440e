package com.unifiedinbox.exception;

public class AuthExchangeException extends MailSyncException {

    public AuthExchangeException(String message, Throwable cause) {
        super(message, cause);
    }
}
