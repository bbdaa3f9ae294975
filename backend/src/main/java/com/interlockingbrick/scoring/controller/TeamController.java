package com.interlockingbrick.scoring.controller;

import com.interlockingbrick.scoring.domain.Team;
import com.interlockingbrick.scoring.dto.ScoreRequest;
import com.interlockingbrick.scoring.dto.ScoresheetRequest;
import com.interlockingbrick.scoring.dto.TeamRequest;
import com.interlockingbrick.scoring.dto.TeamStandingDTO;
import com.interlockingbrick.scoring.error.TeamNotFoundException;
import com.interlockingbrick.scoring.service.CsvTeamService;
import com.interlockingbrick.scoring.service.EventService;
import com.interlockingbrick.scoring.service.ImportResult;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.StringReader;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/teams")
@CrossOrigin(origins = "*")
public class TeamController {

    private final EventService eventService;
    private final CsvTeamService csvTeamService;

    public TeamController(EventService eventService, CsvTeamService csvTeamService) {
        this.eventService = eventService;
        this.csvTeamService = csvTeamService;
    }

    @GetMapping
    public List<TeamStandingDTO> list(@RequestParam(value = "sort", required = false, defaultValue = "rank") String sort) {
        List<Team> teams = "number".equalsIgnoreCase(sort) ? eventService.teamsByNumber() : eventService.teams();
        return teams.stream().map(TeamStandingDTO::from).toList();
    }

    @GetMapping("/{number}")
    public ResponseEntity<?> get(@PathVariable("number") int number) {
        return eventService.findTeam(number)
                .<ResponseEntity<?>>map(t -> ResponseEntity.ok(TeamStandingDTO.from(t)))
                .orElseGet(() -> ApiErrors.of(new TeamNotFoundException(number)));
    }

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> add(@RequestBody TeamRequest req) {
        if (req == null || req.number() == null) return ApiErrors.badRequest("number is required");
        try {
            Team team = eventService.addTeam(req.number(), req.name(), req.pit() == null ? 0 : req.pit());
            return ResponseEntity.status(HttpStatus.CREATED).body(TeamStandingDTO.from(team));
        } catch (RuntimeException e) {
            return ApiErrors.of(e);
        }
    }

    // Omitted pit keeps the current one
    @PutMapping(path = "/{number}", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> update(@PathVariable("number") int number, @RequestBody TeamRequest req) {
        if (req == null) return ApiErrors.badRequest("Missing body");
        try {
            Team team = req.pit() == null
                    ? eventService.renameTeam(number, req.name())
                    : eventService.updateTeam(number, req.name(), req.pit());
            return ResponseEntity.ok(TeamStandingDTO.from(team));
        } catch (RuntimeException e) {
            return ApiErrors.of(e);
        }
    }

    @DeleteMapping("/{number}")
    public ResponseEntity<?> delete(@PathVariable("number") int number) {
        try {
            eventService.deleteTeam(number);
            return ResponseEntity.noContent().build();
        } catch (RuntimeException e) {
            return ApiErrors.of(e);
        }
    }

    @PutMapping(path = "/{number}/scores/{round}", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> setScore(@PathVariable("number") int number,
                                      @PathVariable("round") int round,
                                      @RequestBody ScoreRequest req) {
        if (req == null || req.score() == null) return ApiErrors.badRequest("score is required");
        try {
            Team team = eventService.setScore(number, round, req.score(), req.comments());
            return ResponseEntity.ok(TeamStandingDTO.from(team));
        } catch (RuntimeException e) {
            return ApiErrors.of(e);
        }
    }

    @PutMapping(path = "/{number}/scoresheets/{round}", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> submitScoresheet(@PathVariable("number") int number,
                                              @PathVariable("round") int round,
                                              @RequestBody ScoresheetRequest req) {
        if (req == null || req.score() == null) return ApiErrors.badRequest("score is required");
        try {
            Team team = eventService.submitScoresheet(number, round, req.score(), req.scoresheet());
            return ResponseEntity.ok(TeamStandingDTO.from(team));
        } catch (RuntimeException e) {
            return ApiErrors.of(e);
        }
    }

    @PostMapping(path = "/import", consumes = {"text/csv", MediaType.TEXT_PLAIN_VALUE})
    public ResponseEntity<?> importCsv(@RequestParam(value = "scores", defaultValue = "false") boolean withScores,
                                       @RequestBody String csv) {
        try {
            ImportResult result = csvTeamService.importCsv(new StringReader(csv), withScores);
            return ResponseEntity.ok(Map.of(
                    "added", result.added(),
                    "updated", result.updated(),
                    "unchanged", result.unchanged(),
                    "scores", result.scores()
            ));
        } catch (RuntimeException e) {
            return ApiErrors.of(e);
        }
    }

    @GetMapping(path = "/export", produces = "text/csv")
    public ResponseEntity<String> exportCsv() {
        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"teams.csv\"")
                .contentType(MediaType.parseMediaType("text/csv"))
                .body(csvTeamService.exportCsv());
    }
}
