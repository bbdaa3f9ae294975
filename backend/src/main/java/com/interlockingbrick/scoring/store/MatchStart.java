package com.interlockingbrick.scoring.store;

import java.time.Instant;

/** Latest recorded start of a match. */
public record MatchStart(int matchNumber, Instant startedAt) {}
