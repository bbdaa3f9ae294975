package com.interlockingbrick.scoring.sync;

import com.interlockingbrick.scoring.domain.MatchStatus;
import com.interlockingbrick.scoring.domain.Team;

import java.util.Collection;
import java.util.List;
import java.util.Map;

public final class SyncMessages {

    /** Ends the worker loop. Never sent. */
    static final SyncMessage STOP = new SyncMessage() {
        @Override public String endpoint() { return null; }
        @Override public Object body() { return null; }
        @Override public String toString() { return "STOP"; }
    };

    private SyncMessages() {}

    public record RosterEntry(String name, int number, int pit) {}

    public record TeamsSnapshot(List<RosterEntry> teams) implements SyncMessage {
        public TeamsSnapshot {
            teams = List.copyOf(teams);
        }

        public static TeamsSnapshot of(Collection<Team> teams) {
            return new TeamsSnapshot(teams.stream()
                    .map(t -> new RosterEntry(t.getName(), t.getNumber(), t.getPit()))
                    .toList());
        }

        @Override public String endpoint() { return "/teams"; }
        @Override public Object body() { return teams; }
    }

    public record MatchStatusUpdate(int match, MatchStatus status) implements SyncMessage {
        @Override public String endpoint() { return "/match"; }
        @Override public Object body() { return Map.of("match", match, "status", status.getLabel()); }
    }

    // the reflector calls the round "match"
    public record ScoreUpdate(int team, int match, int score) implements SyncMessage {
        @Override public String endpoint() { return "/scores"; }
        @Override public Object body() { return Map.of("team", team, "match", match, "score", score); }
    }
}
