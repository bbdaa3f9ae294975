package com.interlockingbrick.scoring.dto;

import com.interlockingbrick.scoring.model.AuditEntry;

import java.time.Instant;

public record AuditEntryDTO(Long id, Instant timestamp, String tag, String data) {
    public static AuditEntryDTO from(AuditEntry entry) {
        return new AuditEntryDTO(entry.getId(), entry.getTimestamp(), entry.getTag(), entry.getData());
    }
}
