package com.unifiedinbox.dto;

public class SyncResult {

    public enum Status {
        SUCCESS,
        SKIPPED,
        FAILED
    }

    private Status status;
    private int messagesIngested;
    private String reason;
    private ErrorKind errorKind;

    public SyncResult() {}

    public static SyncResult success(int messagesIngested) {
        SyncResult result = new SyncResult();
        result.status = Status.SUCCESS;
        result.messagesIngested = messagesIngested;
        return result;
    }

    public static SyncResult skipped(String reason) {
        SyncResult result = new SyncResult();
        result.status = Status.SKIPPED;
        result.reason = reason;
        return result;
    }

    public static SyncResult failed(ErrorKind errorKind, String reason) {
        SyncResult result = new SyncResult();
        result.status = Status.FAILED;
        result.errorKind = errorKind;
        result.reason = reason;
        return result;
    }

    public Status getStatus() { return status; }
    public void setStatus(Status status) { this.status = status; }

    public int getMessagesIngested() { return messagesIngested; }
    public void setMessagesIngested(int messagesIngested) { this.messagesIngested = messagesIngested; }

    public String getReason() { return reason; }
    public void setReason(String reason) { this.reason = reason; }

    public ErrorKind getErrorKind() { return errorKind; }
    public void setErrorKind(ErrorKind errorKind) { this.errorKind = errorKind; }

    @Override
    public String toString() {
        return "SyncResult{" + status + ", ingested=" + messagesIngested +
            (errorKind != null ? ", errorKind=" + errorKind : "") +
            (reason != null ? ", reason=" + reason : "") + "}";
    }
}
