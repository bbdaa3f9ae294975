package com.interlockingbrick.scoring.model;

import jakarta.persistence.*;

@Entity
@Table(name = "teams")
public class TeamEntry {

    @Id
    @Column(name = "teamnumber", nullable = false)
    private Integer teamNumber;

    @Column(nullable = false)
    private String name;

    @Column(nullable = false)
    private int pit;

    public TeamEntry() {}

    public TeamEntry(Integer teamNumber, String name, int pit) {
        this.teamNumber = teamNumber;
        this.name = name;
        this.pit = pit;
    }

    public Integer getTeamNumber() { return teamNumber; }
    public void setTeamNumber(Integer teamNumber) { this.teamNumber = teamNumber; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public int getPit() { return pit; }
    public void setPit(int pit) { this.pit = pit; }
}
