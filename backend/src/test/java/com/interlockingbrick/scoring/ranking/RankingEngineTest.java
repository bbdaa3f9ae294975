package com.interlockingbrick.scoring.ranking;

import com.interlockingbrick.scoring.domain.Team;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class RankingEngineTest {

    private final RankingEngine engine = new RankingEngine();

    private static Team team(int number, int... scores) {
        Team t = new Team(number, "Team " + number, 0);
        for (int i = 0; i < scores.length; i++) t.setScore(i + 1, scores[i]);
        return t;
    }

    @Test
    void ranksByHighScoreThenLowerRounds() {
        Team a = team(1, 100, 50, 10);
        Team b = team(2, 100, 60, 0);
        Team c = team(3, 150);

        List<Team> order = engine.rank(List.of(a, b, c));

        assertThat(order).extracting(Team::getNumber).containsExactly(3, 2, 1);
        assertThat(c.getRank()).isEqualTo(1);
        assertThat(b.getRank()).isEqualTo(2);
        assertThat(a.getRank()).isEqualTo(3);
    }

    @Test
    void identicalTuplesOrderedByTeamNumber() {
        Team twenty = team(20, 50, 40, 30);
        Team ten = team(10, 30, 50, 40);

        engine.rank(List.of(twenty, ten));

        assertThat(ten.getRank()).isEqualTo(1);
        assertThat(twenty.getRank()).isEqualTo(2);
    }

    @Test
    void unplayedTeamsAreNotPlacedRegardlessOfNumber() {
        Team unplayed = team(1);
        Team zero = team(99, 0);

        List<Team> order = engine.rank(List.of(unplayed, zero));

        assertThat(zero.getRank()).isEqualTo(1);
        assertThat(unplayed.getRank()).isEqualTo(RankingEngine.NOT_PLACED);
        assertThat(RankingEngine.displayRank(unplayed)).isEqualTo("NP");
        assertThat(order).extracting(Team::getNumber).containsExactly(99, 1);
    }

    @Test
    void zeroScoreOutranksUnplayed() {
        Team played = team(500, 0, -1, -1);
        Team unplayed = team(2, -1, -1, -1);

        engine.rank(List.of(unplayed, played));

        assertThat(played.getRank()).isLessThan(unplayed.getRank());
    }

    @Test
    void ranksAreContiguousFromOne() {
        Random random = new Random(42);
        List<Team> teams = new ArrayList<>();
        for (int n = 1; n <= 40; n++) {
            Team t = new Team(n, "T" + n, 0);
            for (int round = 1; round <= 3; round++) {
                if (random.nextInt(3) > 0) t.setScore(round, random.nextInt(20));
            }
            teams.add(t);
        }

        engine.rank(teams);

        List<Integer> ranks = teams.stream()
                .filter(Team::hasPlayed)
                .map(Team::getRank)
                .sorted()
                .toList();
        for (int i = 0; i < ranks.size(); i++) {
            assertThat(ranks.get(i)).isEqualTo(i + 1);
        }
        assertThat(teams.stream().filter(t -> !t.hasPlayed()))
                .allMatch(t -> t.getRank() == RankingEngine.NOT_PLACED);
    }

    @Test
    void rankingIsIdempotent() {
        List<Team> teams = List.of(team(4, 10, 20), team(3, 20, 10), team(2), team(1, 5));

        List<Integer> first = engine.rank(teams).stream().map(Team::getNumber).toList();
        List<Integer> firstRanks = teams.stream().map(Team::getRank).toList();
        List<Integer> second = engine.rank(teams).stream().map(Team::getNumber).toList();

        assertThat(second).isEqualTo(first);
        assertThat(teams.stream().map(Team::getRank).toList()).isEqualTo(firstRanks);
    }

    @Test
    void byNumberSortsAscending() {
        List<Team> teams = List.of(team(30), team(10, 5), team(20));

        assertThat(engine.byNumber(teams)).extracting(Team::getNumber).containsExactly(10, 20, 30);
    }
}
