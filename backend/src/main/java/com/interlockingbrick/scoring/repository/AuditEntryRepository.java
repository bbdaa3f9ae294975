package com.interlockingbrick.scoring.repository;

import com.interlockingbrick.scoring.model.AuditEntry;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface AuditEntryRepository extends JpaRepository<AuditEntry, Long> {
    List<AuditEntry> findAllByOrderByIdAsc();
}
