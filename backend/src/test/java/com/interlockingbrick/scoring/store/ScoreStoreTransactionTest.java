package com.interlockingbrick.scoring.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.interlockingbrick.scoring.MutableClock;
import com.interlockingbrick.scoring.error.ScoreStoreException;
import com.interlockingbrick.scoring.model.ScoreEntry;
import com.interlockingbrick.scoring.repository.*;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Runs outside the test-managed transaction so commits and rollbacks are real.
 */
@DataJpaTest
@ActiveProfiles("test")
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class ScoreStoreTransactionTest {

    @Autowired private TeamEntryRepository teamRepository;
    @Autowired private ScoreEntryRepository scoreRepository;
    @Autowired private ScoresheetEntryRepository scoresheetRepository;
    @Autowired private AuditEntryRepository auditRepository;
    @Autowired private LogEntryRepository logRepository;
    @Autowired private MetaEntryRepository metaRepository;
    @Autowired private PlatformTransactionManager transactionManager;

    private final ObjectMapper mapper = new ObjectMapper();
    private final MutableClock clock = new MutableClock(Instant.parse("2026-10-18T09:00:00Z"), ZoneId.of("UTC"));
    private TransactionTemplate tx;

    @BeforeEach
    void setUp() {
        tx = new TransactionTemplate(transactionManager);
    }

    @AfterEach
    void cleanUp() {
        scoresheetRepository.deleteAllInBatch();
        scoreRepository.deleteAllInBatch();
        teamRepository.deleteAllInBatch();
        auditRepository.deleteAllInBatch();
        logRepository.deleteAllInBatch();
        metaRepository.deleteAllInBatch();
    }

    private ScoreStore store(ScoreEntryRepository scores) {
        return new ScoreStore(teamRepository, scores, scoresheetRepository, auditRepository,
                logRepository, metaRepository, mapper, clock, "1.0.0");
    }

    private ScoreStore openStoreWithTeam() {
        ScoreStore store = store(scoreRepository);
        tx.executeWithoutResult(s -> store.open("db"));
        tx.executeWithoutResult(s -> {
            store.upsertTeam(101, "Falcons", 0);
            store.upsertScore(101, 1, 45);
            store.upsertScore(101, 2, 50);
        });
        return store;
    }

    @Test
    void deleteCascadeRollsBackAsOneUnit() {
        ScoreStore store = openStoreWithTeam();
        long auditBefore = auditRepository.count();

        tx.executeWithoutResult(status -> {
            store.deleteTeam(101);
            status.setRollbackOnly();
        });

        assertThat(teamRepository.existsById(101)).isTrue();
        assertThat(scoreRepository.findByTeamNumberOrderByRoundAsc(101)).hasSize(2);
        assertThat(auditRepository.count()).isEqualTo(auditBefore);

        tx.executeWithoutResult(status -> store.deleteTeam(101));

        assertThat(teamRepository.existsById(101)).isFalse();
        assertThat(scoreRepository.findByTeamNumberOrderByRoundAsc(101)).isEmpty();
        assertThat(auditRepository.count()).isEqualTo(auditBefore + 3);
    }

    @Test
    void failureMidCascadeLeavesTeamAndAuditUntouched() {
        openStoreWithTeam();
        long auditBefore = auditRepository.count();

        ScoreEntryRepository failing = mock(ScoreEntryRepository.class);
        when(failing.findByTeamNumberOrderByRoundAsc(101))
                .thenReturn(List.of(new ScoreEntry(101, 1, 45, ""), new ScoreEntry(101, 2, 50, "")));
        doThrow(new DataIntegrityViolationException("disk full")).when(failing).delete(any(ScoreEntry.class));
        ScoreStore store = store(failing);
        tx.executeWithoutResult(s -> store.open("db"));
        long afterOpen = auditRepository.count();

        assertThatThrownBy(() -> tx.executeWithoutResult(s -> store.deleteTeam(101)))
                .isInstanceOf(ScoreStoreException.class)
                .extracting(e -> ((ScoreStoreException) e).getReason())
                .isEqualTo(ScoreStoreException.Reason.WRITE_FAILED);

        assertThat(teamRepository.existsById(101)).isTrue();
        assertThat(scoreRepository.findByTeamNumberOrderByRoundAsc(101)).hasSize(2);
        assertThat(auditRepository.count()).isEqualTo(afterOpen);
        assertThat(afterOpen).isEqualTo(auditBefore + 1);
    }
}
