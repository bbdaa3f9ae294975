package com.interlockingbrick.scoring.service;

import com.interlockingbrick.scoring.domain.MatchStatus;
import com.interlockingbrick.scoring.domain.Team;
import com.interlockingbrick.scoring.error.ScoreStoreException;
import com.interlockingbrick.scoring.error.ScoreValidationException;
import com.interlockingbrick.scoring.error.TeamNotFoundException;
import com.interlockingbrick.scoring.model.AuditEntry;
import com.interlockingbrick.scoring.model.ScoreEntry;
import com.interlockingbrick.scoring.model.TeamEntry;
import com.interlockingbrick.scoring.ranking.RankingEngine;
import com.interlockingbrick.scoring.store.EventDatabase;
import com.interlockingbrick.scoring.store.ScoreStore;
import com.interlockingbrick.scoring.sync.EventSnapshot;
import com.interlockingbrick.scoring.sync.SyncDispatcher;
import com.interlockingbrick.scoring.sync.SyncMessages;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.util.*;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the live team collection for the event and coordinates every mutation:
 * persist through {@link ScoreStore}, rerank, queue a reflector update, then publish a
 * {@link StandingsChangedEvent}. All operations run under one lock so callers are serialized.
 * Callers only ever receive copies of the teams.
 */
@Service
public class EventService {
    private static final Logger log = LoggerFactory.getLogger(EventService.class);

    private final ScoreStore store;
    private final RankingEngine rankingEngine;
    private final SyncDispatcher syncDispatcher;
    private final ApplicationEventPublisher events;
    private final EventDatabase eventDatabase;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<Integer, Team> teams = new HashMap<>();
    private List<Team> standings = List.of();
    private int currentMatch = 1;
    private boolean started;

    public EventService(ScoreStore store,
                        RankingEngine rankingEngine,
                        SyncDispatcher syncDispatcher,
                        ApplicationEventPublisher events,
                        EventDatabase eventDatabase) {
        this.store = store;
        this.rankingEngine = rankingEngine;
        this.syncDispatcher = syncDispatcher;
        this.events = events;
        this.eventDatabase = eventDatabase;
    }

    /** Opens the event store and restores teams and scores from it. */
    @PostConstruct
    public void start() {
        lock.lock();
        try {
            if (started) return;
            persist(() -> store.open(eventDatabase.name()));
            teams.clear();
            for (TeamEntry entry : store.loadTeams()) {
                teams.put(entry.getTeamNumber(), new Team(entry.getTeamNumber(), entry.getName(), entry.getPit()));
            }
            int restoredScores = 0;
            for (ScoreEntry score : store.loadScores()) {
                Team team = teams.get(score.getTeamNumber());
                if (team == null || score.getRound() < 1 || score.getRound() > Team.ROUNDS) {
                    log.warn("[Event][Restore] ignoring score row slug={}", score.getSlug());
                    continue;
                }
                team.setScore(score.getRound(), score.getScore());
                restoredScores++;
            }
            rerank();
            started = true;
            log.info("[Event][Start] eventDatabase={} eventCode={} teams={} scores={}",
                    eventDatabase.name(), eventDatabase.eventCode(), teams.size(), restoredScores);
        } finally {
            lock.unlock();
        }
    }

    /** Closes the event store. Safe to call more than once. */
    @PreDestroy
    public void shutdown() {
        lock.lock();
        try {
            if (store.isOpen()) {
                persist(store::close);
                log.info("[Event][Shutdown] store closed, teams={}", teams.size());
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Adds a team. Re-adding an existing number with the same name and pit is a no-op.
     *
     * @throws ScoreValidationException on invalid input or a conflicting existing team
     */
    public Team addTeam(int number, String name, int pit) {
        validateNumber(number);
        String cleanName = validateName(name);
        validatePit(pit);
        lock.lock();
        try {
            Team existing = teams.get(number);
            if (existing != null) {
                if (existing.getName().equals(cleanName) && existing.getPit() == pit) {
                    log.debug("[Event][AddTeam] teamnumber={} already present, no change", number);
                    return existing.copy();
                }
                throw new ScoreValidationException("Team " + number + " already exists as '" + existing.getName() + "'");
            }
            persist(() -> store.upsertTeam(number, cleanName, pit));
            Team team = new Team(number, cleanName, pit);
            teams.put(number, team);
            rerank();
            syncTeams();
            log.info("[Event][AddTeam] teamnumber={} name='{}' pit={}", number, cleanName, pit);
            notifyChanged("team_add");
            return team.copy();
        } finally {
            lock.unlock();
        }
    }

    public Team renameTeam(int number, String name) {
        lock.lock();
        try {
            return updateTeam(number, name, requireTeam(number).getPit());
        } finally {
            lock.unlock();
        }
    }

    public Team updateTeam(int number, String name, int pit) {
        String cleanName = validateName(name);
        validatePit(pit);
        lock.lock();
        try {
            Team team = requireTeam(number);
            if (team.getName().equals(cleanName) && team.getPit() == pit) {
                return team.copy();
            }
            persist(() -> store.upsertTeam(number, cleanName, pit));
            team.setName(cleanName);
            team.setPit(pit);
            rerank();
            syncTeams();
            log.info("[Event][UpdateTeam] teamnumber={} name='{}' pit={}", number, cleanName, pit);
            notifyChanged("team_update");
            return team.copy();
        } finally {
            lock.unlock();
        }
    }

    public Team setScore(int number, int round, int score) {
        return setScore(number, round, score, "");
    }

    /**
     * Records a round score. {@link Team#NOT_PLAYED} clears the round.
     *
     * @throws TeamNotFoundException for an unknown team
     * @throws ScoreValidationException for a bad round or score
     */
    public Team setScore(int number, int round, int score, String comments) {
        validateRound(round);
        validateScore(score);
        lock.lock();
        try {
            Team team = requireTeam(number);
            persist(() -> store.upsertScore(number, round, score, comments == null ? "" : comments));
            return applyScore(team, round, score);
        } finally {
            lock.unlock();
        }
    }

    /** Stores a submitted scoresheet together with the score it produced. */
    public Team submitScoresheet(int number, int round, int score, String scoresheet) {
        validateRound(round);
        validateScore(score);
        if (scoresheet == null || scoresheet.isBlank()) {
            throw new ScoreValidationException("Scoresheet payload is required");
        }
        lock.lock();
        try {
            Team team = requireTeam(number);
            persist(() -> store.recordScoresheet(number, round, score, scoresheet));
            return applyScore(team, round, score);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Deletes a team with its scores and scoresheets.
     *
     * @throws TeamNotFoundException for an unknown team
     */
    public void deleteTeam(int number) {
        lock.lock();
        try {
            requireTeam(number);
            persist(() -> store.deleteTeam(number));
            teams.remove(number);
            rerank();
            syncTeams();
            log.info("[Event][DeleteTeam] teamnumber={}", number);
            notifyChanged("team_delete");
        } finally {
            lock.unlock();
        }
    }

    /**
     * Adds or updates every row, then reranks once. Rows are validated before anything is
     * written. Played rounds in a row overwrite the stored score; unplayed rounds are left alone.
     */
    public ImportResult importTeams(List<TeamImportRow> rows) {
        Set<Integer> seen = new HashSet<>();
        for (TeamImportRow row : rows) {
            validateNumber(row.number());
            validateName(row.name());
            validatePit(row.pit());
            for (int round = 1; round <= Team.ROUNDS; round++) validateScore(row.score(round));
            if (!seen.add(row.number())) {
                throw new ScoreValidationException("Duplicate team number " + row.number() + " in import");
            }
        }
        lock.lock();
        int added = 0, updated = 0, unchanged = 0;
        List<SyncMessages.ScoreUpdate> scoreUpdates = new ArrayList<>();
        boolean completed = false;
        try {
            for (TeamImportRow row : rows) {
                String name = row.name().trim();
                Team team = teams.get(row.number());
                if (team == null) {
                    persist(() -> store.upsertTeam(row.number(), name, row.pit()));
                    team = new Team(row.number(), name, row.pit());
                    teams.put(row.number(), team);
                    added++;
                } else if (!team.getName().equals(name) || team.getPit() != row.pit()) {
                    persist(() -> store.upsertTeam(row.number(), name, row.pit()));
                    team.setName(name);
                    team.setPit(row.pit());
                    updated++;
                } else {
                    unchanged++;
                }
                for (int round = 1; round <= Team.ROUNDS; round++) {
                    int score = row.score(round);
                    if (score == Team.NOT_PLAYED) continue;
                    int r = round;
                    persist(() -> store.upsertScore(row.number(), r, score, ""));
                    team.setScore(round, score);
                    scoreUpdates.add(new SyncMessages.ScoreUpdate(row.number(), round, score));
                }
            }
            completed = true;
            log.info("[Event][Import] rows={} added={} updated={} unchanged={} scores={}",
                    rows.size(), added, updated, unchanged, scoreUpdates.size());
            return new ImportResult(added, updated, unchanged, scoreUpdates.size());
        } finally {
            // rows written before a failure stay committed, so they are ranked and published too
            if (completed || added + updated > 0 || !scoreUpdates.isEmpty()) {
                rerank();
                syncTeams();
                scoreUpdates.forEach(syncDispatcher::enqueue);
                notifyChanged("import");
            }
            if (!completed) {
                log.warn("[Event][Import] aborted after added={} updated={} scores={}",
                        added, updated, scoreUpdates.size());
            }
            lock.unlock();
        }
    }

    /** Logs the match start for cycle-time reporting and tells the reflector it is running. */
    public int startMatch(int match) {
        validateMatch(match);
        lock.lock();
        try {
            persist(() -> store.writeLogEntry(ScoreStore.MATCH_START, String.valueOf(match)));
            currentMatch = match;
            syncDispatcher.enqueue(new SyncMessages.MatchStatusUpdate(match, MatchStatus.RUNNING));
            log.info("[Event][Match] start match={}", match);
            return currentMatch;
        } finally {
            lock.unlock();
        }
    }

    public int abortMatch(int match) {
        validateMatch(match);
        lock.lock();
        try {
            syncDispatcher.enqueue(new SyncMessages.MatchStatusUpdate(match, MatchStatus.ABORTED));
            log.info("[Event][Match] abort match={}", match);
            return currentMatch;
        } finally {
            lock.unlock();
        }
    }

    /** Completes a match and advances to the next one, which is announced as queueing. */
    public int completeMatch(int match) {
        validateMatch(match);
        lock.lock();
        try {
            currentMatch = match + 1;
            syncDispatcher.enqueue(new SyncMessages.MatchStatusUpdate(currentMatch, MatchStatus.QUEUEING));
            log.info("[Event][Match] complete match={} next={}", match, currentMatch);
            return currentMatch;
        } finally {
            lock.unlock();
        }
    }

    public int currentMatch() {
        lock.lock();
        try {
            return currentMatch;
        } finally {
            lock.unlock();
        }
    }

    /** Pushes the full event state to the reflector immediately, bypassing the queue. */
    public boolean forceSync() {
        EventSnapshot snapshot;
        lock.lock();
        try {
            snapshot = EventSnapshot.of(currentMatch, MatchStatus.QUEUEING, rankingEngine.byNumber(teams.values()));
        } finally {
            lock.unlock();
        }
        return syncDispatcher.forceSync(snapshot);
    }

    /** Teams in rank order. */
    public List<Team> teams() {
        lock.lock();
        try {
            return copies(standings);
        } finally {
            lock.unlock();
        }
    }

    public List<Team> teamsByNumber() {
        lock.lock();
        try {
            return copies(rankingEngine.byNumber(teams.values()));
        } finally {
            lock.unlock();
        }
    }

    public Optional<Team> findTeam(int number) {
        lock.lock();
        try {
            return Optional.ofNullable(teams.get(number)).map(Team::copy);
        } finally {
            lock.unlock();
        }
    }

    public List<AuditEntry> auditTrail() {
        lock.lock();
        try {
            return store.loadAuditTrail();
        } finally {
            lock.unlock();
        }
    }

    private Team applyScore(Team team, int round, int score) {
        team.setScore(round, score);
        rerank();
        syncDispatcher.enqueue(new SyncMessages.ScoreUpdate(team.getNumber(), round, score));
        log.info("[Event][Score] teamnumber={} round={} score={} rank={}",
                team.getNumber(), round, score, RankingEngine.displayRank(team));
        notifyChanged("score_update");
        return team.copy();
    }

    private void rerank() {
        standings = rankingEngine.rank(teams.values());
    }

    private void syncTeams() {
        syncDispatcher.enqueue(SyncMessages.TeamsSnapshot.of(rankingEngine.byNumber(teams.values())));
    }

    private void notifyChanged(String reason) {
        events.publishEvent(new StandingsChangedEvent(reason, copies(standings)));
    }

    private Team requireTeam(int number) {
        Team team = teams.get(number);
        if (team == null) throw new TeamNotFoundException(number);
        return team;
    }

    // Commit failures surface outside the store's own transaction boundary
    private void persist(Runnable write) {
        try {
            write.run();
        } catch (TransactionException e) {
            log.error("[Event][Persist] transaction failed: {}", e.getMessage());
            throw new ScoreStoreException(ScoreStoreException.Reason.WRITE_FAILED, "Event store transaction failed", e);
        }
    }

    private static List<Team> copies(Collection<Team> source) {
        List<Team> out = new ArrayList<>(source.size());
        for (Team t : source) out.add(t.copy());
        return out;
    }

    private static void validateNumber(int number) {
        if (number <= 0) throw new ScoreValidationException("Team number must be positive: " + number);
    }

    private static String validateName(String name) {
        if (name == null || name.isBlank()) throw new ScoreValidationException("Team name is required");
        return name.trim();
    }

    private static void validatePit(int pit) {
        if (pit < 0) throw new ScoreValidationException("Pit must not be negative: " + pit);
    }

    private static void validateRound(int round) {
        if (round < 1 || round > Team.ROUNDS) {
            throw new ScoreValidationException("Round must be between 1 and " + Team.ROUNDS + ": " + round);
        }
    }

    private static void validateScore(int score) {
        if (score != Team.NOT_PLAYED && (score < 0 || score > Team.MAX_SCORE)) {
            throw new ScoreValidationException("Score must be between 0 and " + Team.MAX_SCORE + ": " + score);
        }
    }

    private static void validateMatch(int match) {
        if (match <= 0) throw new ScoreValidationException("Match number must be positive: " + match);
    }
}
