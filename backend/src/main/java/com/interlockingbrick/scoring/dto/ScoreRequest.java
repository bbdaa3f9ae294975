package com.interlockingbrick.scoring.dto;

public record ScoreRequest(Integer score, String comments) {}
