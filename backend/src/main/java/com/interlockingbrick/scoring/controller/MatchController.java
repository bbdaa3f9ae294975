package com.interlockingbrick.scoring.controller;

import com.interlockingbrick.scoring.service.EventService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/matches")
@CrossOrigin(origins = "*")
public class MatchController {

    private final EventService eventService;

    public MatchController(EventService eventService) {
        this.eventService = eventService;
    }

    @GetMapping("/current")
    public Map<String, Object> current() {
        return Map.of("match", eventService.currentMatch());
    }

    @PostMapping("/{match}/start")
    public ResponseEntity<?> start(@PathVariable("match") int match) {
        try {
            return ResponseEntity.ok(Map.of("match", eventService.startMatch(match), "status", "running"));
        } catch (RuntimeException e) {
            return ApiErrors.of(e);
        }
    }

    @PostMapping("/{match}/abort")
    public ResponseEntity<?> abort(@PathVariable("match") int match) {
        try {
            return ResponseEntity.ok(Map.of("match", eventService.abortMatch(match), "status", "aborted"));
        } catch (RuntimeException e) {
            return ApiErrors.of(e);
        }
    }

    @PostMapping("/{match}/complete")
    public ResponseEntity<?> complete(@PathVariable("match") int match) {
        try {
            return ResponseEntity.ok(Map.of("match", eventService.completeMatch(match), "status", "queueing"));
        } catch (RuntimeException e) {
            return ApiErrors.of(e);
        }
    }
}
