package com.interlockingbrick.scoring.error;

/**
 * Rejected input: bad team number, name, round or score, a conflicting duplicate team,
 * or a malformed CSV row. Raised before the store is touched.
 */
public class ScoreValidationException extends RuntimeException {
    public ScoreValidationException(String message) {
        super(message);
    }
}
