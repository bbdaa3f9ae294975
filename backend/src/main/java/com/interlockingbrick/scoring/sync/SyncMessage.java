package com.interlockingbrick.scoring.sync;

/**
 * A queued replication message. {@link #endpoint()} is relative to the event base URL.
 */
public interface SyncMessage {
    String endpoint();

    Object body();
}
