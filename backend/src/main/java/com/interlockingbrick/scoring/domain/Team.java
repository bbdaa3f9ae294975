package com.interlockingbrick.scoring.domain;

import java.util.Arrays;

/**
 * In-memory view of a competing team. Scores are kept per round (index 0..2);
 * {@link #NOT_PLAYED} marks a round that has not been played yet.
 *
 * <p>The derived fields (high score, second and third highest, high score index)
 * are recomputed whenever a score changes. The rank is owned by the ranking engine.
 */
public class Team {

    public static final int ROUNDS = 3;
    public static final int NOT_PLAYED = -1;
    public static final int MAX_SCORE = 999;
    public static final int NOT_PLACED = Integer.MAX_VALUE;

    private final int number;
    private String name;
    private int pit;
    private final int[] scores = {NOT_PLAYED, NOT_PLAYED, NOT_PLAYED};

    private int highScore = NOT_PLAYED;
    private int secondHighest = NOT_PLAYED;
    private int thirdHighest = NOT_PLAYED;
    private int highScoreIndex = 0;
    private int rank = NOT_PLACED;

    public Team(int number, String name, int pit) {
        this.number = number;
        this.name = name;
        this.pit = pit;
    }

    /**
     * Sets the score of a round (1-based) and recomputes the derived fields.
     */
    public void setScore(int round, int score) {
        if (round < 1 || round > ROUNDS) {
            throw new IllegalArgumentException("round must be between 1 and " + ROUNDS + ": " + round);
        }
        scores[round - 1] = score;
        recompute();
    }

    private void recompute() {
        int[] sorted = scores.clone();
        Arrays.sort(sorted);
        highScore = sorted[2];
        secondHighest = sorted[1];
        thirdHighest = sorted[0];
        // lowest round index wins ties
        for (int i = 0; i < ROUNDS; i++) {
            if (scores[i] == highScore) {
                highScoreIndex = i;
                break;
            }
        }
    }

    /** True when at least one round has been played. */
    public boolean hasPlayed() {
        for (int s : scores) {
            if (s != NOT_PLAYED) return true;
        }
        return false;
    }

    public Team copy() {
        Team t = new Team(number, name, pit);
        System.arraycopy(scores, 0, t.scores, 0, ROUNDS);
        t.recompute();
        t.rank = rank;
        return t;
    }

    public int getNumber() { return number; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public int getPit() { return pit; }
    public void setPit(int pit) { this.pit = pit; }

    public int[] getScores() { return scores.clone(); }
    public int getScore(int round) { return scores[round - 1]; }

    public int getHighScore() { return highScore; }
    public int getSecondHighest() { return secondHighest; }
    public int getThirdHighest() { return thirdHighest; }
    public int getHighScoreIndex() { return highScoreIndex; }

    public int getRank() { return rank; }
    public void setRank(int rank) { this.rank = rank; }

    @Override
    public String toString() {
        return "Team{" + number + " '" + name + "' pit=" + pit + " scores=" + Arrays.toString(scores) + " rank=" + rank + "}";
    }
}
