package com.interlockingbrick.scoring.sync;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.interlockingbrick.scoring.domain.MatchStatus;
import com.interlockingbrick.scoring.domain.Team;

import java.util.Collection;
import java.util.List;

/** Full event state posted to {@code /sync} by a force sync. */
public record EventSnapshot(@JsonProperty("match") int match,
                            @JsonProperty("status") MatchStatus status,
                            @JsonProperty("teams") List<TeamState> teams) {

    public record TeamState(@JsonProperty("name") String name,
                            @JsonProperty("teamnumber") int teamNumber,
                            @JsonProperty("pit") int pit,
                            @JsonProperty("round1") int round1,
                            @JsonProperty("round2") int round2,
                            @JsonProperty("round3") int round3) {

        static TeamState of(Team team) {
            return new TeamState(team.getName(), team.getNumber(), team.getPit(),
                    team.getScore(1), team.getScore(2), team.getScore(3));
        }
    }

    public static EventSnapshot of(int match, MatchStatus status, Collection<Team> teams) {
        return new EventSnapshot(match, status, teams.stream().map(TeamState::of).toList());
    }
}
