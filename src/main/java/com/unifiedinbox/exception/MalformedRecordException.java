package com.unifiedinbox.exception;

public class MalformedRecordException extends MailSyncException {

    public MalformedRecordException(String message) {
        super(message);
    }
}
