package com.interlockingbrick.scoring.audit;

/**
 * A typed audit record. The store serializes the record's properties to JSON and adds
 * {@code timestamp} and {@code tag}.
 */
public interface AuditEvent {
    String tag();
}
