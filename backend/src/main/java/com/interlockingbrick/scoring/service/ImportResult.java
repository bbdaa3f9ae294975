package com.interlockingbrick.scoring.service;

public record ImportResult(int added, int updated, int unchanged, int scores) {}
