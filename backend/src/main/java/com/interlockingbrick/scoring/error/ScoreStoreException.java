package com.interlockingbrick.scoring.error;

/**
 * Persistence failure in the event store. Never retried; propagates to the caller.
 */
public class ScoreStoreException extends RuntimeException {

    public enum Reason {
        CANNOT_OPEN,
        STORE_CLOSED,
        WRITE_FAILED,
        READ_FAILED
    }

    private final Reason reason;

    public ScoreStoreException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public ScoreStoreException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() { return reason; }
}
