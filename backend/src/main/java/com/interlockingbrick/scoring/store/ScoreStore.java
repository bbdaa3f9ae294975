package com.interlockingbrick.scoring.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.interlockingbrick.scoring.audit.AuditEvent;
import com.interlockingbrick.scoring.audit.AuditEvents;
import com.interlockingbrick.scoring.error.ScoreStoreException;
import com.interlockingbrick.scoring.error.ScoreStoreException.Reason;
import com.interlockingbrick.scoring.model.*;
import com.interlockingbrick.scoring.repository.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Durable teams, scores and scoresheets for one event, with an append-only audit trail.
 * Every write and its audit entry share one transaction. Range checks happen one layer up.
 */
@Service
public class ScoreStore {
    private static final Logger log = LoggerFactory.getLogger(ScoreStore.class);

    public static final String SCHEMA_VERSION = "1";
    public static final String MATCH_START = "match_start";

    private enum State { NEW, OPEN, CLOSED }

    private final TeamEntryRepository teamRepository;
    private final ScoreEntryRepository scoreRepository;
    private final ScoresheetEntryRepository scoresheetRepository;
    private final AuditEntryRepository auditRepository;
    private final LogEntryRepository logRepository;
    private final MetaEntryRepository metaRepository;
    private final ObjectMapper auditMapper;
    private final Clock clock;
    private final String appVersion;

    private volatile State state = State.NEW;
    private volatile String eventDatabase;

    public ScoreStore(TeamEntryRepository teamRepository,
                      ScoreEntryRepository scoreRepository,
                      ScoresheetEntryRepository scoresheetRepository,
                      AuditEntryRepository auditRepository,
                      LogEntryRepository logRepository,
                      MetaEntryRepository metaRepository,
                      ObjectMapper objectMapper,
                      Clock clock,
                      @Value("${scoring.app-version:1.0.0}") String appVersion) {
        this.teamRepository = teamRepository;
        this.scoreRepository = scoreRepository;
        this.scoresheetRepository = scoresheetRepository;
        this.auditRepository = auditRepository;
        this.logRepository = logRepository;
        this.metaRepository = metaRepository;
        // StoreClosed has no properties
        this.auditMapper = objectMapper.copy().disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
        this.clock = clock;
        this.appVersion = appVersion;
    }

    /**
     * Opens the store. The schema is already migrated by Flyway; a store without a
     * {@code schema_version} meta row is treated as newly created.
     *
     * @return true when the store was created by this call
     */
    @Transactional
    public boolean open(String eventDatabase) {
        if (state == State.CLOSED) {
            throw new ScoreStoreException(Reason.STORE_CLOSED, "Store already closed");
        }
        if (state == State.OPEN) {
            throw new ScoreStoreException(Reason.CANNOT_OPEN, "Store already open: " + this.eventDatabase);
        }
        try {
            boolean created = !metaRepository.existsById(MetaEntry.SCHEMA_VERSION);
            if (created) {
                metaRepository.save(new MetaEntry(MetaEntry.SCHEMA_VERSION, SCHEMA_VERSION));
                metaRepository.save(new MetaEntry(MetaEntry.EVENT_DATABASE, eventDatabase));
                metaRepository.save(new MetaEntry(MetaEntry.CREATED_AT, clock.instant().toString()));
                metaRepository.save(new MetaEntry(MetaEntry.APP_VERSION, appVersion));
                writeAudit(new AuditEvents.StoreCreated(appVersion, eventDatabase));
            } else {
                writeAudit(new AuditEvents.StoreOpened(appVersion, eventDatabase));
            }
            auditRepository.flush();
            this.eventDatabase = eventDatabase;
            this.state = State.OPEN;
            log.info("[Store][Open] eventDatabase={} created={}", eventDatabase, created);
            return created;
        } catch (DataAccessException e) {
            log.error("[Store][Open] failed eventDatabase={}: {}", eventDatabase, e.getMessage());
            throw new ScoreStoreException(Reason.CANNOT_OPEN, "Cannot open event store " + eventDatabase, e);
        }
    }

    @Transactional
    public void close() {
        requireOpen();
        write(() -> writeAudit(new AuditEvents.StoreClosed()));
        state = State.CLOSED;
        log.info("[Store][Close] eventDatabase={}", eventDatabase);
    }

    public boolean isOpen() {
        return state == State.OPEN;
    }

    public String getEventDatabase() {
        return eventDatabase;
    }

    /**
     * Inserts a team or replaces its name and pit. Audits {@code team_add} on first sight,
     * {@code team_update} with old and new values otherwise.
     */
    @Transactional
    public void upsertTeam(int teamNumber, String name, int pit) {
        requireOpen();
        write(() -> {
            Optional<TeamEntry> existing = teamRepository.findById(teamNumber);
            if (existing.isPresent()) {
                TeamEntry entry = existing.get();
                String oldName = entry.getName();
                int oldPit = entry.getPit();
                entry.setName(name);
                entry.setPit(pit);
                teamRepository.save(entry);
                writeAudit(new AuditEvents.TeamUpdated(teamNumber, oldName, name, oldPit, pit));
            } else {
                teamRepository.save(new TeamEntry(teamNumber, name, pit));
                writeAudit(new AuditEvents.TeamAdded(teamNumber, name, pit));
            }
        });
    }

    @Transactional
    public void upsertScore(int teamNumber, int round, int score) {
        upsertScore(teamNumber, round, score, "");
    }

    @Transactional
    public void upsertScore(int teamNumber, int round, int score, String comments) {
        requireOpen();
        write(() -> saveScore(teamNumber, round, score, comments));
    }

    @Transactional
    public void upsertScoresheet(int teamNumber, int round, String scoresheet) {
        requireOpen();
        write(() -> saveScoresheet(teamNumber, round, scoresheet));
    }

    /** Scoresheet submission: the sheet and the score it produced land together. */
    @Transactional
    public void recordScoresheet(int teamNumber, int round, int score, String scoresheet) {
        requireOpen();
        write(() -> {
            saveScoresheet(teamNumber, round, scoresheet);
            saveScore(teamNumber, round, score, "");
        });
    }

    /**
     * Removes a team with its scores and scoresheets, auditing each removal.
     *
     * @return false when no such team exists
     */
    @Transactional
    public boolean deleteTeam(int teamNumber) {
        requireOpen();
        boolean[] deleted = {false};
        write(() -> {
            Optional<TeamEntry> team = teamRepository.findById(teamNumber);
            if (team.isEmpty()) return;
            writeAudit(new AuditEvents.TeamDeleted(teamNumber));
            teamRepository.delete(team.get());
            for (ScoreEntry score : scoreRepository.findByTeamNumberOrderByRoundAsc(teamNumber)) {
                writeAudit(new AuditEvents.ScoreDeleted(teamNumber, score.getRound(), score.getScore()));
                scoreRepository.delete(score);
            }
            for (ScoresheetEntry sheet : scoresheetRepository.findByTeamNumberOrderByRoundAsc(teamNumber)) {
                writeAudit(new AuditEvents.ScoresheetDeleted(teamNumber, sheet.getRound(), sheet.getScoresheet()));
                scoresheetRepository.delete(sheet);
            }
            deleted[0] = true;
        });
        if (deleted[0]) log.info("[Store][Delete] teamnumber={}", teamNumber);
        return deleted[0];
    }

    @Transactional(readOnly = true)
    public List<TeamEntry> loadTeams() {
        requireOpen();
        return read(teamRepository::findAllByOrderByTeamNumberAsc);
    }

    @Transactional(readOnly = true)
    public List<ScoreEntry> loadScores() {
        requireOpen();
        return read(scoreRepository::findAllByOrderByTeamNumberAscRoundAsc);
    }

    @Transactional(readOnly = true)
    public List<ScoresheetEntry> loadScoresheets() {
        requireOpen();
        return read(() -> {
            List<ScoresheetEntry> all = new ArrayList<>(scoresheetRepository.findAll());
            all.sort(Comparator.comparingInt(ScoresheetEntry::getTeamNumber).thenComparingInt(ScoresheetEntry::getRound));
            return all;
        });
    }

    /** Audit entries in insertion order. Readable after close for forensics. */
    @Transactional(readOnly = true)
    public List<AuditEntry> loadAuditTrail() {
        if (state == State.NEW) {
            throw new ScoreStoreException(Reason.STORE_CLOSED, "Store not open");
        }
        return read(auditRepository::findAllByOrderByIdAsc);
    }

    @Transactional
    public void writeLogEntry(String tag, String message) {
        requireOpen();
        write(() -> logRepository.save(new LogEntry(clock.instant(), tag, message)));
    }

    /**
     * Latest {@code match_start} per match number, ascending by match. Entries whose
     * message is not a match number are ignored.
     */
    @Transactional(readOnly = true)
    public List<MatchStart> queryMatchStartTimes() {
        requireOpen();
        List<LogEntryRepository.LatestByMessage> rows = read(() -> logRepository.findLatestByMessage(MATCH_START));
        List<MatchStart> out = new ArrayList<>();
        for (LogEntryRepository.LatestByMessage row : rows) {
            Integer match = parseMatchNumber(row.getMessage());
            if (match == null || row.getLatest() == null) continue;
            out.add(new MatchStart(match, row.getLatest()));
        }
        out.sort(Comparator.comparingInt(MatchStart::matchNumber));
        return out;
    }

    private void saveScore(int teamNumber, int round, int score, String comments) {
        Optional<ScoreEntry> existing = scoreRepository.findById(ScoreEntry.slug(teamNumber, round));
        Integer oldScore = existing.map(ScoreEntry::getScore).orElse(null);
        ScoreEntry entry = existing.orElseGet(() -> new ScoreEntry(teamNumber, round, score, comments));
        entry.setScore(score);
        entry.setComments(comments == null ? "" : comments);
        scoreRepository.save(entry);
        writeAudit(new AuditEvents.ScoreUpdated(teamNumber, round, oldScore, score));
    }

    private void saveScoresheet(int teamNumber, int round, String scoresheet) {
        Optional<ScoresheetEntry> existing = scoresheetRepository.findById(ScoreEntry.slug(teamNumber, round));
        String old = existing.map(ScoresheetEntry::getScoresheet).orElse(null);
        ScoresheetEntry entry = existing.orElseGet(() -> new ScoresheetEntry(teamNumber, round, scoresheet));
        entry.setScoresheet(scoresheet);
        scoresheetRepository.save(entry);
        writeAudit(new AuditEvents.ScoresheetUpdated(teamNumber, round, old, scoresheet));
    }

    private void writeAudit(AuditEvent event) {
        Instant now = clock.instant();
        ObjectNode data = auditMapper.createObjectNode();
        data.put("timestamp", now.getEpochSecond() + now.getNano() / 1_000_000_000d);
        data.put("tag", event.tag());
        data.setAll((ObjectNode) auditMapper.valueToTree(event));
        auditRepository.save(new AuditEntry(now, event.tag(), data.toString()));
        log.debug("[Store][Audit] tag={} data={}", event.tag(), data);
    }

    private void requireOpen() {
        if (state != State.OPEN) {
            throw new ScoreStoreException(Reason.STORE_CLOSED,
                    state == State.CLOSED ? "Store is closed" : "Store not open");
        }
    }

    // Flushes so constraint and I/O errors surface inside the operation that caused them
    private void write(Runnable work) {
        try {
            work.run();
            auditRepository.flush();
        } catch (DataAccessException e) {
            log.error("[Store][Write] failed: {}", e.getMessage());
            throw new ScoreStoreException(Reason.WRITE_FAILED, "Event store write failed", e);
        }
    }

    private <T> T read(java.util.function.Supplier<T> query) {
        try {
            return query.get();
        } catch (DataAccessException e) {
            log.error("[Store][Read] failed: {}", e.getMessage());
            throw new ScoreStoreException(Reason.READ_FAILED, "Event store read failed", e);
        }
    }

    static Integer parseMatchNumber(String message) {
        if (message == null) return null;
        try {
            return Integer.parseInt(message.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
