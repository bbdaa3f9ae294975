package com.interlockingbrick.scoring.model;

import jakarta.persistence.*;

/**
 * Serialized scoresheet captured by the scoresheet UI. The payload is opaque to the store.
 */
@Entity
@Table(name = "scoresheets")
public class ScoresheetEntry {

    @Id
    @Column(name = "slug", length = 32, nullable = false)
    private String slug;

    @Column(name = "teamnumber", nullable = false)
    private int teamNumber;

    @Column(nullable = false)
    private int round;

    @Column(name = "scoresheet", columnDefinition = "clob")
    private String scoresheet;

    public ScoresheetEntry() {}

    public ScoresheetEntry(int teamNumber, int round, String scoresheet) {
        this.slug = ScoreEntry.slug(teamNumber, round);
        this.teamNumber = teamNumber;
        this.round = round;
        this.scoresheet = scoresheet;
    }

    public String getSlug() { return slug; }
    public void setSlug(String slug) { this.slug = slug; }

    public int getTeamNumber() { return teamNumber; }
    public void setTeamNumber(int teamNumber) { this.teamNumber = teamNumber; }

    public int getRound() { return round; }
    public void setRound(int round) { this.round = round; }

    public String getScoresheet() { return scoresheet; }
    public void setScoresheet(String scoresheet) { this.scoresheet = scoresheet; }
}
