package com.unifiedinbox.exception;

/**
 * Ciphertext could not be decrypted with the current deployment key.
 */
public class KeyMismatchException extends MailSyncException {

    public KeyMismatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
