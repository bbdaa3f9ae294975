package com.interlockingbrick.scoring.service;

import com.interlockingbrick.scoring.store.MatchStart;
import com.interlockingbrick.scoring.store.ScoreStore;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Time between consecutive match starts, from the {@code match_start} log.
 */
@Service
public class CycleTimeReportService {

    public static final String NOT_AVAILABLE = "N/A";
    private static final DateTimeFormatter START_TIME = DateTimeFormatter.ofPattern("h:mm a", Locale.US);
    private static final String RULE = "=".repeat(60);

    private final ScoreStore store;
    private final ZoneId zone;

    public CycleTimeReportService(ScoreStore store, Clock clock) {
        this.store = store;
        this.zone = clock.getZone();
    }

    public record Row(int match, String startTime, String cycleTime, Long cycleSeconds) {}

    public List<Row> report() {
        return buildRows(store.queryMatchStartTimes());
    }

    public String reportText() {
        return renderText(report());
    }

    List<Row> buildRows(List<MatchStart> starts) {
        List<Row> rows = new ArrayList<>(starts.size());
        MatchStart previous = null;
        for (MatchStart start : starts) {
            String startTime = START_TIME.format(start.startedAt().atZone(zone));
            if (previous == null) {
                rows.add(new Row(start.matchNumber(), startTime, NOT_AVAILABLE, null));
            } else {
                long seconds = Duration.between(previous.startedAt(), start.startedAt()).getSeconds();
                rows.add(new Row(start.matchNumber(), startTime, formatCycle(seconds), seconds));
            }
            previous = start;
        }
        return rows;
    }

    static String formatCycle(long seconds) {
        return Math.floorDiv(seconds, 60) + "m" + String.format("%02d", Math.floorMod(seconds, 60)) + "s";
    }

    static String renderText(List<Row> rows) {
        List<String> lines = new ArrayList<>();
        lines.add("Cycle Time Report");
        lines.add(RULE);
        lines.add(String.format("%-10s%-20s%-20s", "Match", "Start Time", "Cycle Time"));
        lines.add("-".repeat(60));
        for (Row row : rows) {
            lines.add(String.format("%-10s%-20s%-20s", row.match(), row.startTime(), row.cycleTime()));
        }
        lines.add(RULE);
        return String.join("\n", lines);
    }
}
