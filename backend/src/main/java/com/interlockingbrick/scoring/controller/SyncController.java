package com.interlockingbrick.scoring.controller;

import com.interlockingbrick.scoring.service.EventService;
import com.interlockingbrick.scoring.sync.ReflectorCredentials;
import com.interlockingbrick.scoring.sync.SyncDispatcher;
import com.interlockingbrick.scoring.sync.SyncHealth;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/sync")
@CrossOrigin(origins = "*")
public class SyncController {
    private static final Logger log = LoggerFactory.getLogger(SyncController.class);

    private final SyncDispatcher syncDispatcher;
    private final EventService eventService;

    public SyncController(SyncDispatcher syncDispatcher, EventService eventService) {
        this.syncDispatcher = syncDispatcher;
        this.eventService = eventService;
    }

    /** Accepts the same JSON as {@code sync.json}. */
    @PostMapping(path = "/credentials", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> configure(@RequestBody ReflectorCredentials credentials) {
        try {
            syncDispatcher.configure(credentials);
            return ResponseEntity.ok(Map.of("configured", true));
        } catch (IllegalArgumentException e) {
            log.warn("[Sync][Api] rejected credentials: {}", e.getMessage());
            return ApiErrors.badRequest(e.getMessage());
        }
    }

    @PostMapping("/force")
    public Map<String, Object> force() {
        boolean accepted = eventService.forceSync();
        return Map.of("accepted", accepted, "match", eventService.currentMatch());
    }

    @GetMapping("/health")
    public SyncHealth health() {
        return syncDispatcher.health();
    }
}
