package com.interlockingbrick.scoring.dto;

import com.interlockingbrick.scoring.domain.Team;
import com.interlockingbrick.scoring.ranking.RankingEngine;

import java.util.List;

public class TeamStandingDTO {
    private int number;
    private String name;
    private int pit;
    private List<Integer> scores;
    private int highScore;
    private int highScoreRound;
    private String rank;

    public TeamStandingDTO() {}

    public static TeamStandingDTO from(Team team) {
        TeamStandingDTO dto = new TeamStandingDTO();
        dto.number = team.getNumber();
        dto.name = team.getName();
        dto.pit = team.getPit();
        dto.scores = List.of(team.getScore(1), team.getScore(2), team.getScore(3));
        dto.highScore = team.getHighScore();
        dto.highScoreRound = team.getHighScoreIndex() + 1;
        dto.rank = RankingEngine.displayRank(team);
        return dto;
    }

    public int getNumber() { return number; }
    public void setNumber(int number) { this.number = number; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public int getPit() { return pit; }
    public void setPit(int pit) { this.pit = pit; }

    public List<Integer> getScores() { return scores; }
    public void setScores(List<Integer> scores) { this.scores = scores; }

    public int getHighScore() { return highScore; }
    public void setHighScore(int highScore) { this.highScore = highScore; }

    public int getHighScoreRound() { return highScoreRound; }
    public void setHighScoreRound(int highScoreRound) { this.highScoreRound = highScoreRound; }

    // rank number, or "NP" when not placed
    public String getRank() { return rank; }
    public void setRank(String rank) { this.rank = rank; }
}
