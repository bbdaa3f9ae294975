package com.interlockingbrick.scoring.error;

/**
 * A message could not be delivered to the reflector. Only the sync worker sees these.
 */
public class SyncDeliveryException extends RuntimeException {
    private final int statusCode;

    public SyncDeliveryException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    public SyncDeliveryException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = -1;
    }

    /** HTTP status returned by the reflector, or -1 when no response arrived. */
    public int getStatusCode() { return statusCode; }
}
