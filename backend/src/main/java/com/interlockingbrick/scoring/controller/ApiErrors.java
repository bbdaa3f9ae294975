package com.interlockingbrick.scoring.controller;

import com.interlockingbrick.scoring.error.ScoreStoreException;
import com.interlockingbrick.scoring.error.ScoreValidationException;
import com.interlockingbrick.scoring.error.TeamNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

/**
 * Maps service exceptions to {@code {"error": ...}} responses.
 */
final class ApiErrors {
    private static final Logger log = LoggerFactory.getLogger(ApiErrors.class);

    private ApiErrors() {}

    static ResponseEntity<Map<String, Object>> of(RuntimeException e) {
        if (e instanceof TeamNotFoundException) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        }
        if (e instanceof ScoreValidationException || e instanceof IllegalArgumentException) {
            return ResponseEntity.badRequest().body(Map.of("error", String.valueOf(e.getMessage())));
        }
        if (e instanceof ScoreStoreException) {
            ScoreStoreException se = (ScoreStoreException) e;
            log.error("[Api] store failure reason={}: {}", se.getReason(), se.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("error", se.getMessage(), "reason", se.getReason().name()));
        }
        throw e;
    }

    static ResponseEntity<Map<String, Object>> badRequest(String message) {
        return ResponseEntity.badRequest().body(Map.of("error", message));
    }
}
