package com.interlockingbrick.scoring.service;

import com.interlockingbrick.scoring.domain.Team;

import java.util.List;

/**
 * Published after every mutation that may change the standings. {@code standings} holds
 * copies in rank order.
 */
public record StandingsChangedEvent(String reason, List<Team> standings) {}
