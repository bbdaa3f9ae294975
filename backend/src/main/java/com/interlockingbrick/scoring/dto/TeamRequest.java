package com.interlockingbrick.scoring.dto;

public record TeamRequest(Integer number, String name, Integer pit) {}
