package com.interlockingbrick.scoring.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.interlockingbrick.scoring.MutableClock;
import com.interlockingbrick.scoring.error.ScoreStoreException;
import com.interlockingbrick.scoring.model.AuditEntry;
import com.interlockingbrick.scoring.model.MetaEntry;
import com.interlockingbrick.scoring.repository.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@ActiveProfiles("test")
class ScoreStoreTest {

    @Autowired private TeamEntryRepository teamRepository;
    @Autowired private ScoreEntryRepository scoreRepository;
    @Autowired private ScoresheetEntryRepository scoresheetRepository;
    @Autowired private AuditEntryRepository auditRepository;
    @Autowired private LogEntryRepository logRepository;
    @Autowired private MetaEntryRepository metaRepository;

    private final ObjectMapper mapper = new ObjectMapper();
    private final MutableClock clock = new MutableClock(Instant.parse("2026-10-18T09:00:00Z"), ZoneId.of("UTC"));
    private ScoreStore store;

    @BeforeEach
    void setUp() {
        store = newStore();
    }

    private ScoreStore newStore() {
        return new ScoreStore(teamRepository, scoreRepository, scoresheetRepository, auditRepository,
                logRepository, metaRepository, mapper, clock, "9.9.9");
    }

    private List<JsonNode> auditData() throws Exception {
        List<AuditEntry> trail = store.loadAuditTrail();
        List<JsonNode> out = new java.util.ArrayList<>();
        for (AuditEntry e : trail) out.add(mapper.readTree(e.getData()));
        return out;
    }

    private List<String> tags() {
        return store.loadAuditTrail().stream().map(AuditEntry::getTag).toList();
    }

    @Test
    void openingEmptyStoreRecordsCreation() throws Exception {
        boolean created = store.open("TEST-20261018");

        assertThat(created).isTrue();
        assertThat(metaRepository.findById(MetaEntry.SCHEMA_VERSION)).get()
                .extracting(MetaEntry::getValue).isEqualTo(ScoreStore.SCHEMA_VERSION);
        assertThat(metaRepository.findById(MetaEntry.EVENT_DATABASE)).get()
                .extracting(MetaEntry::getValue).isEqualTo("TEST-20261018");

        JsonNode data = auditData().get(0);
        assertThat(data.get("tag").asText()).isEqualTo("db_created");
        assertThat(data.get("app_version").asText()).isEqualTo("9.9.9");
        assertThat(data.get("event_database").asText()).isEqualTo("TEST-20261018");
        assertThat(data.get("timestamp").asDouble()).isEqualTo(Instant.parse("2026-10-18T09:00:00Z").getEpochSecond());
    }

    @Test
    void reopeningExistingStoreRecordsOpen() {
        store.open("TEST-20261018");
        store.close();

        store = newStore();
        boolean created = store.open("TEST-20261018");

        assertThat(created).isFalse();
        assertThat(tags()).containsExactly("db_created", "db_closed", "db_opened");
    }

    @Test
    void operationsRequireOpenStore() {
        assertThatThrownBy(() -> store.upsertTeam(1, "A", 0))
                .isInstanceOf(ScoreStoreException.class)
                .extracting(e -> ((ScoreStoreException) e).getReason())
                .isEqualTo(ScoreStoreException.Reason.STORE_CLOSED);
    }

    @Test
    void closeIsValidOnce() {
        store.open("db");
        store.close();

        assertThat(store.isOpen()).isFalse();
        assertThatThrownBy(store::close)
                .isInstanceOf(ScoreStoreException.class)
                .extracting(e -> ((ScoreStoreException) e).getReason())
                .isEqualTo(ScoreStoreException.Reason.STORE_CLOSED);
        assertThatThrownBy(() -> store.upsertScore(1, 1, 10))
                .isInstanceOf(ScoreStoreException.class);
        assertThatThrownBy(() -> store.open("db"))
                .isInstanceOf(ScoreStoreException.class);
        // the trail stays readable for forensics
        assertThat(tags()).endsWith("db_closed");
    }

    @Test
    void upsertTeamAddsThenUpdatesWithOldValues() throws Exception {
        store.open("db");
        store.upsertTeam(101, "Falcons", 4);
        store.upsertTeam(101, "Peregrines", 7);

        assertThat(teamRepository.findById(101)).get()
                .satisfies(t -> {
                    assertThat(t.getName()).isEqualTo("Peregrines");
                    assertThat(t.getPit()).isEqualTo(7);
                });
        List<JsonNode> data = auditData();
        JsonNode add = data.get(1);
        assertThat(add.get("tag").asText()).isEqualTo("team_add");
        assertThat(add.get("teamnumber").asInt()).isEqualTo(101);
        assertThat(add.get("name").asText()).isEqualTo("Falcons");
        JsonNode update = data.get(2);
        assertThat(update.get("tag").asText()).isEqualTo("team_update");
        assertThat(update.get("old_name").asText()).isEqualTo("Falcons");
        assertThat(update.get("new_name").asText()).isEqualTo("Peregrines");
        assertThat(update.get("old_pit").asInt()).isEqualTo(4);
        assertThat(update.get("new_pit").asInt()).isEqualTo(7);
    }

    @Test
    void everyScoreUpsertWritesOneAuditEntryWithOldAndNew() throws Exception {
        store.open("db");
        store.upsertTeam(101, "Falcons", 0);
        int before = store.loadAuditTrail().size();

        store.upsertScore(101, 1, 45);
        store.upsertScore(101, 1, 60, "re-scored");
        store.upsertScore(101, 2, 0);

        List<JsonNode> data = auditData();
        assertThat(data).hasSize(before + 3);
        JsonNode first = data.get(before);
        assertThat(first.get("tag").asText()).isEqualTo("score_update");
        assertThat(first.get("old_score").isNull()).isTrue();
        assertThat(first.get("new_score").asInt()).isEqualTo(45);
        JsonNode second = data.get(before + 1);
        assertThat(second.get("old_score").asInt()).isEqualTo(45);
        assertThat(second.get("new_score").asInt()).isEqualTo(60);
        assertThat(second.get("round").asInt()).isEqualTo(1);

        assertThat(scoreRepository.findById("101-1")).get()
                .satisfies(s -> {
                    assertThat(s.getScore()).isEqualTo(60);
                    assertThat(s.getComments()).isEqualTo("re-scored");
                });
        assertThat(store.loadScores()).hasSize(2);
    }

    @Test
    void deleteTeamCascadesWithIndividualAudits() throws Exception {
        store.open("db");
        store.upsertTeam(101, "Falcons", 0);
        store.upsertTeam(102, "Hawks", 0);
        store.upsertScore(101, 3, 30);
        store.upsertScore(101, 1, 10);
        store.upsertScoresheet(101, 1, "{\"m01\":true}");
        store.upsertScore(102, 1, 99);
        int before = store.loadAuditTrail().size();

        boolean deleted = store.deleteTeam(101);

        assertThat(deleted).isTrue();
        List<JsonNode> data = auditData().subList(before, store.loadAuditTrail().size());
        assertThat(data).extracting(n -> n.get("tag").asText())
                .containsExactly("team_delete", "score_delete", "score_delete", "scoresheet_delete");
        assertThat(data.get(1).get("round").asInt()).isEqualTo(1);
        assertThat(data.get(1).get("old_score").asInt()).isEqualTo(10);
        assertThat(data.get(1).get("new_score").isNull()).isTrue();
        assertThat(data.get(2).get("old_score").asInt()).isEqualTo(30);
        assertThat(data.get(3).get("old_scoresheet").asText()).isEqualTo("{\"m01\":true}");

        assertThat(teamRepository.existsById(101)).isFalse();
        assertThat(scoreRepository.findByTeamNumberOrderByRoundAsc(101)).isEmpty();
        assertThat(scoresheetRepository.findByTeamNumberOrderByRoundAsc(101)).isEmpty();
        assertThat(scoreRepository.findByTeamNumberOrderByRoundAsc(102)).hasSize(1);
    }

    @Test
    void deletingUnknownTeamIsNoOp() {
        store.open("db");
        int before = store.loadAuditTrail().size();

        assertThat(store.deleteTeam(404)).isFalse();
        assertThat(store.loadAuditTrail()).hasSize(before);
    }

    @Test
    void recordScoresheetStoresSheetAndScore() throws Exception {
        store.open("db");
        store.upsertTeam(7, "Gears", 0);
        String sheet = "{\"missions\":[1,2,3],\"gp\":3}";

        store.recordScoresheet(7, 2, 215, sheet);

        assertThat(store.loadScoresheets()).singleElement()
                .satisfies(s -> assertThat(s.getScoresheet()).isEqualTo(sheet));
        assertThat(scoreRepository.findById("7-2")).get().extracting(s -> s.getScore()).isEqualTo(215);
        List<String> tags = tags();
        assertThat(tags.subList(tags.size() - 2, tags.size())).containsExactly("scoresheet_update", "score_update");
        JsonNode sheetAudit = auditData().get(tags.size() - 2);
        assertThat(sheetAudit.get("old_scoresheet").isNull()).isTrue();
        assertThat(sheetAudit.get("new_scoresheet").asText()).isEqualTo(sheet);
    }

    @Test
    void matchStartTimesKeepLatestPerMatchInNumericOrder() {
        store.open("db");
        Instant t0 = clock.instant();
        store.writeLogEntry(ScoreStore.MATCH_START, "10");
        clock.advance(Duration.ofMinutes(1));
        store.writeLogEntry(ScoreStore.MATCH_START, "2");
        clock.advance(Duration.ofMinutes(1));
        store.writeLogEntry(ScoreStore.MATCH_START, "2");
        store.writeLogEntry(ScoreStore.MATCH_START, "practice");
        store.writeLogEntry("timer", "3");

        List<MatchStart> starts = store.queryMatchStartTimes();

        assertThat(starts).extracting(MatchStart::matchNumber).containsExactly(2, 10);
        assertThat(starts.get(0).startedAt()).isEqualTo(t0.plus(Duration.ofMinutes(2)));
        assertThat(starts.get(1).startedAt()).isEqualTo(t0);
    }
}
