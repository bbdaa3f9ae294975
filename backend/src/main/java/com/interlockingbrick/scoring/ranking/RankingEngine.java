package com.interlockingbrick.scoring.ranking;

import com.interlockingbrick.scoring.domain.Team;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Orders teams by their best three round scores and assigns rank numbers.
 *
 * <p>Teams are sorted descending by (high score, second highest, third highest); the team
 * number breaks remaining ties, lower number first, so the order is total and repeated runs
 * over the same scores always produce the same ranks. Teams that have not played any round
 * are not placed: they receive {@link #NOT_PLACED} and sort after every ranked team.
 */
@Component
public class RankingEngine {

    public static final int NOT_PLACED = Team.NOT_PLACED;
    public static final String NOT_PLACED_LABEL = "NP";

    static final Comparator<Team> STANDINGS = Comparator
            .comparingInt(Team::getHighScore).reversed()
            .thenComparing(Comparator.comparingInt(Team::getSecondHighest).reversed())
            .thenComparing(Comparator.comparingInt(Team::getThirdHighest).reversed())
            .thenComparingInt(Team::getNumber);

    /**
     * Sets the rank of every team and returns them in standings order.
     * The input collection is not reordered.
     */
    public List<Team> rank(Collection<Team> teams) {
        List<Team> ordered = new ArrayList<>(teams);
        ordered.sort(Comparator.comparing((Team t) -> !t.hasPlayed()).thenComparing(STANDINGS));
        int position = 1;
        for (Team team : ordered) {
            if (team.hasPlayed()) {
                team.setRank(position++);
            } else {
                team.setRank(NOT_PLACED);
            }
        }
        return ordered;
    }

    public List<Team> byNumber(Collection<Team> teams) {
        List<Team> ordered = new ArrayList<>(teams);
        ordered.sort(Comparator.comparingInt(Team::getNumber));
        return ordered;
    }

    public static String displayRank(Team team) {
        return team.getRank() == NOT_PLACED ? NOT_PLACED_LABEL : String.valueOf(team.getRank());
    }
}
