package com.interlockingbrick.scoring.audit;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

public final class AuditEvents {

    public static final String DB_CREATED = "db_created";
    public static final String DB_OPENED = "db_opened";
    public static final String DB_CLOSED = "db_closed";
    public static final String TEAM_ADD = "team_add";
    public static final String TEAM_UPDATE = "team_update";
    public static final String TEAM_DELETE = "team_delete";
    public static final String SCORE_UPDATE = "score_update";
    public static final String SCORE_DELETE = "score_delete";
    public static final String SCORESHEET_UPDATE = "scoresheet_update";
    public static final String SCORESHEET_DELETE = "scoresheet_delete";

    private AuditEvents() {}

    public record StoreCreated(@JsonProperty("app_version") String appVersion,
                               @JsonProperty("event_database") String eventDatabase) implements AuditEvent {
        @JsonIgnore
        @Override public String tag() { return DB_CREATED; }
    }

    public record StoreOpened(@JsonProperty("app_version") String appVersion,
                              @JsonProperty("event_database") String eventDatabase) implements AuditEvent {
        @JsonIgnore
        @Override public String tag() { return DB_OPENED; }
    }

    public record StoreClosed() implements AuditEvent {
        @JsonIgnore
        @Override public String tag() { return DB_CLOSED; }
    }

    public record TeamAdded(@JsonProperty("teamnumber") int teamNumber,
                            @JsonProperty("name") String name,
                            @JsonProperty("pit") int pit) implements AuditEvent {
        @JsonIgnore
        @Override public String tag() { return TEAM_ADD; }
    }

    public record TeamUpdated(@JsonProperty("teamnumber") int teamNumber,
                              @JsonProperty("old_name") String oldName,
                              @JsonProperty("new_name") String newName,
                              @JsonProperty("old_pit") int oldPit,
                              @JsonProperty("new_pit") int newPit) implements AuditEvent {
        @JsonIgnore
        @Override public String tag() { return TEAM_UPDATE; }
    }

    public record TeamDeleted(@JsonProperty("teamnumber") int teamNumber) implements AuditEvent {
        @JsonIgnore
        @Override public String tag() { return TEAM_DELETE; }
    }

    // old_score is null the first time a round is scored
    @JsonInclude(JsonInclude.Include.ALWAYS)
    public record ScoreUpdated(@JsonProperty("teamnumber") int teamNumber,
                               @JsonProperty("round") int round,
                               @JsonProperty("old_score") Integer oldScore,
                               @JsonProperty("new_score") Integer newScore) implements AuditEvent {
        @JsonIgnore
        @Override public String tag() { return SCORE_UPDATE; }
    }

    @JsonInclude(JsonInclude.Include.ALWAYS)
    public record ScoreDeleted(@JsonProperty("teamnumber") int teamNumber,
                               @JsonProperty("round") int round,
                               @JsonProperty("old_score") Integer oldScore) implements AuditEvent {
        @JsonProperty("new_score")
        public Integer newScore() { return null; }

        @JsonIgnore
        @Override public String tag() { return SCORE_DELETE; }
    }

    @JsonInclude(JsonInclude.Include.ALWAYS)
    public record ScoresheetUpdated(@JsonProperty("teamnumber") int teamNumber,
                                    @JsonProperty("round") int round,
                                    @JsonProperty("old_scoresheet") String oldScoresheet,
                                    @JsonProperty("new_scoresheet") String newScoresheet) implements AuditEvent {
        @JsonIgnore
        @Override public String tag() { return SCORESHEET_UPDATE; }
    }

    @JsonInclude(JsonInclude.Include.ALWAYS)
    public record ScoresheetDeleted(@JsonProperty("teamnumber") int teamNumber,
                                    @JsonProperty("round") int round,
                                    @JsonProperty("old_scoresheet") String oldScoresheet) implements AuditEvent {
        @JsonIgnore
        @Override public String tag() { return SCORESHEET_DELETE; }
    }
}
