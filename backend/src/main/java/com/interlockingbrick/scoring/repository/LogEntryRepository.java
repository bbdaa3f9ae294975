package com.interlockingbrick.scoring.repository;

import com.interlockingbrick.scoring.model.LogEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.List;

public interface LogEntryRepository extends JpaRepository<LogEntry, Long> {

    // Latest timestamp per message for a tag, e.g. last start of each match
    interface LatestByMessage {
        String getMessage();
        Instant getLatest();
    }

    @Query("select l.message as message, max(l.loggedAt) as latest from LogEntry l where l.tag = :tag group by l.message")
    List<LatestByMessage> findLatestByMessage(@Param("tag") String tag);
}
