package com.interlockingbrick.scoring.controller;

import com.interlockingbrick.scoring.dto.AuditEntryDTO;
import com.interlockingbrick.scoring.service.CycleTimeReportService;
import com.interlockingbrick.scoring.service.EventService;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api")
@CrossOrigin(origins = "*")
public class ReportController {

    private final CycleTimeReportService cycleTimeReportService;
    private final EventService eventService;

    public ReportController(CycleTimeReportService cycleTimeReportService, EventService eventService) {
        this.cycleTimeReportService = cycleTimeReportService;
        this.eventService = eventService;
    }

    @GetMapping("/reports/cycle-time")
    public ResponseEntity<?> cycleTime(@RequestParam(value = "format", required = false, defaultValue = "json") String format) {
        try {
            if ("text".equalsIgnoreCase(format)) {
                return ResponseEntity.ok().contentType(MediaType.TEXT_PLAIN).body(cycleTimeReportService.reportText());
            }
            return ResponseEntity.ok(cycleTimeReportService.report());
        } catch (RuntimeException e) {
            return ApiErrors.of(e);
        }
    }

    @GetMapping("/audit")
    public ResponseEntity<?> audit() {
        try {
            List<AuditEntryDTO> entries = eventService.auditTrail().stream().map(AuditEntryDTO::from).toList();
            return ResponseEntity.ok(entries);
        } catch (RuntimeException e) {
            return ApiErrors.of(e);
        }
    }
}
