package com.interlockingbrick.scoring.service;

import com.interlockingbrick.scoring.domain.Team;

import java.util.Arrays;

/**
 * One team parsed for import. Unplayed rounds hold {@link Team#NOT_PLAYED}.
 */
public record TeamImportRow(int number, String name, int pit, int[] scores) {

    public TeamImportRow {
        scores = scores == null ? new int[]{Team.NOT_PLAYED, Team.NOT_PLAYED, Team.NOT_PLAYED} : scores.clone();
        if (scores.length != Team.ROUNDS) {
            throw new IllegalArgumentException("expected " + Team.ROUNDS + " scores, got " + scores.length);
        }
    }

    public TeamImportRow(int number, String name, int pit) {
        this(number, name, pit, null);
    }

    public int score(int round) {
        return scores[round - 1];
    }

    @Override
    public int[] scores() {
        return scores.clone();
    }

    @Override
    public String toString() {
        return "TeamImportRow[" + number + " '" + name + "' pit=" + pit + " scores=" + Arrays.toString(scores) + "]";
    }
}
