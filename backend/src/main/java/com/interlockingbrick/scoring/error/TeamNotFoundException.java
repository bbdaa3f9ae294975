package com.interlockingbrick.scoring.error;

public class TeamNotFoundException extends ScoreValidationException {
    private final int teamNumber;

    public TeamNotFoundException(int teamNumber) {
        super("Unknown team " + teamNumber);
        this.teamNumber = teamNumber;
    }

    public int getTeamNumber() { return teamNumber; }
}
