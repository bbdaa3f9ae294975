package com.interlockingbrick.scoring.model;

import jakarta.persistence.*;

import java.time.Instant;

@Entity
@Table(name = "log", indexes = {
        @Index(name = "idx_log_tag", columnList = "tag")
})
public class LogEntry {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "timestamp", nullable = false, updatable = false)
    private Instant loggedAt;

    @Column(name = "tag", length = 64, nullable = false, updatable = false)
    private String tag;

    @Column(name = "message", length = 4000, updatable = false)
    private String message;

    protected LogEntry() {}

    public LogEntry(Instant loggedAt, String tag, String message) {
        this.loggedAt = loggedAt;
        this.tag = tag;
        this.message = message;
    }

    public Long getId() { return id; }
    public Instant getLoggedAt() { return loggedAt; }
    public String getTag() { return tag; }
    public String getMessage() { return message; }
}
