package com.interlockingbrick.scoring.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Match status vocabulary understood by the reflector.
 */
public enum MatchStatus {
    QUEUEING("queueing"),
    RUNNING("running"),
    ABORTED("aborted");

    private final String label;

    MatchStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
