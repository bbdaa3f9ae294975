package com.interlockingbrick.scoring.model;

import jakarta.persistence.*;

import java.time.Instant;

/**
 * Append-only audit row. {@code data} holds the JSON form of the audited event,
 * including its own {@code timestamp} and {@code tag}.
 */
@Entity
@Table(name = "audit", indexes = {
        @Index(name = "idx_audit_ts", columnList = "timestamp")
})
public class AuditEntry {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "timestamp", nullable = false, updatable = false)
    private Instant timestamp;

    @Column(name = "tag", length = 64, nullable = false, updatable = false)
    private String tag;

    @Column(name = "data", columnDefinition = "clob", nullable = false, updatable = false)
    private String data;

    protected AuditEntry() {}

    public AuditEntry(Instant timestamp, String tag, String data) {
        this.timestamp = timestamp;
        this.tag = tag;
        this.data = data;
    }

    public Long getId() { return id; }
    public Instant getTimestamp() { return timestamp; }
    public String getTag() { return tag; }
    public String getData() { return data; }
}
