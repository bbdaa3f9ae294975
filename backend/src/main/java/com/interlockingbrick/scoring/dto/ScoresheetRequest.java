package com.interlockingbrick.scoring.dto;

/** Submission from the scoresheet UI; {@code scoresheet} is stored as-is. */
public record ScoresheetRequest(Integer score, String scoresheet) {}
