package com.interlockingbrick.scoring.model;

import jakarta.persistence.*;

@Entity
@Table(name = "scores", indexes = {
        @Index(name = "idx_scores_team", columnList = "teamnumber")
})
public class ScoreEntry {

    // "{teamnumber}-{round}"
    @Id
    @Column(name = "slug", length = 32, nullable = false)
    private String slug;

    @Column(name = "teamnumber", nullable = false)
    private int teamNumber;

    @Column(nullable = false)
    private int round;

    @Column(nullable = false)
    private int score;

    @Column(length = 4000)
    private String comments;

    public ScoreEntry() {}

    public ScoreEntry(int teamNumber, int round, int score, String comments) {
        this.slug = slug(teamNumber, round);
        this.teamNumber = teamNumber;
        this.round = round;
        this.score = score;
        this.comments = comments;
    }

    public static String slug(int teamNumber, int round) {
        return teamNumber + "-" + round;
    }

    public String getSlug() { return slug; }
    public void setSlug(String slug) { this.slug = slug; }

    public int getTeamNumber() { return teamNumber; }
    public void setTeamNumber(int teamNumber) { this.teamNumber = teamNumber; }

    public int getRound() { return round; }
    public void setRound(int round) { this.round = round; }

    public int getScore() { return score; }
    public void setScore(int score) { this.score = score; }

    public String getComments() { return comments; }
    public void setComments(String comments) { this.comments = comments; }
}
