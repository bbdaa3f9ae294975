package com.interlockingbrick.scoring.service;

import com.interlockingbrick.scoring.domain.Team;
import com.interlockingbrick.scoring.error.ScoreValidationException;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Reader;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.*;

/**
 * Team roster CSV import and export.
 *
 * <p>Import reads {@code Team Name}, {@code Team Number}, an optional {@code Pit #} and, when
 * scores are requested, {@code Round 1 Score} to {@code Round 3 Score}. A round score that is
 * blank, non-numeric or not positive counts as not played. Any bad row rejects the whole file.
 */
@Service
public class CsvTeamService {
    private static final Logger log = LoggerFactory.getLogger(CsvTeamService.class);

    public static final String COL_NAME = "Team Name";
    public static final String COL_NUMBER = "Team Number";
    public static final String COL_PIT = "Pit #";
    public static final String[] EXPORT_HEADER = {
            COL_PIT, COL_NAME, COL_NUMBER, roundColumn(1), roundColumn(2), roundColumn(3)
    };

    private final EventService eventService;

    public CsvTeamService(EventService eventService) {
        this.eventService = eventService;
    }

    public ImportResult importCsv(Reader reader, boolean withScores) {
        List<TeamImportRow> rows = parse(reader, withScores);
        return eventService.importTeams(rows);
    }

    public List<TeamImportRow> parse(Reader reader, boolean withScores) {
        CSVFormat fmt = CSVFormat.DEFAULT.builder()
                .setHeader()
                .setSkipHeaderRecord(true)
                .setTrim(true)
                .setIgnoreEmptyLines(true)
                .build();
        List<TeamImportRow> rows = new ArrayList<>();
        Set<Integer> numbers = new HashSet<>();
        try (CSVParser parser = new CSVParser(reader, fmt)) {
            Map<String, Integer> header = parser.getHeaderMap();
            if (header == null || !header.containsKey(COL_NAME) || !header.containsKey(COL_NUMBER)) {
                throw new ScoreValidationException("CSV header must contain '" + COL_NAME + "' and '" + COL_NUMBER + "'");
            }
            int rowNum = 1;
            for (CSVRecord rec : parser) {
                rowNum++;
                String name = opt(rec, COL_NAME);
                if (name == null || name.isEmpty()) {
                    throw new ScoreValidationException("Row " + rowNum + ": missing " + COL_NAME);
                }
                int number = parseRequired(opt(rec, COL_NUMBER), rowNum, COL_NUMBER);
                if (number <= 0) {
                    throw new ScoreValidationException("Row " + rowNum + ": " + COL_NUMBER + " must be positive");
                }
                if (!numbers.add(number)) {
                    throw new ScoreValidationException("Row " + rowNum + ": duplicate team number " + number);
                }
                String pitRaw = opt(rec, COL_PIT);
                int pit = pitRaw == null || pitRaw.isEmpty() ? 0 : parseRequired(pitRaw, rowNum, COL_PIT);
                if (pit < 0) {
                    throw new ScoreValidationException("Row " + rowNum + ": " + COL_PIT + " must not be negative");
                }
                int[] scores = {Team.NOT_PLAYED, Team.NOT_PLAYED, Team.NOT_PLAYED};
                if (withScores) {
                    for (int round = 1; round <= Team.ROUNDS; round++) {
                        scores[round - 1] = parseRoundScore(opt(rec, roundColumn(round)));
                    }
                }
                rows.add(new TeamImportRow(number, name, pit, scores));
            }
        } catch (IOException e) {
            throw new ScoreValidationException("Failed to read CSV: " + e.getMessage());
        } catch (IllegalStateException | UncheckedIOException e) {
            // commons-csv reports malformed input this way
            throw new ScoreValidationException("Malformed CSV: " + e.getMessage());
        }
        log.info("[Csv][Import] parsed rows={} withScores={}", rows.size(), withScores);
        return rows;
    }

    /** Exports the live roster ordered by pit, using the team number where no pit is assigned. */
    public String exportCsv() {
        return export(eventService.teamsByNumber());
    }

    public String export(Collection<Team> teams) {
        List<Team> sorted = new ArrayList<>(teams);
        sorted.sort(Comparator.comparingInt((Team t) -> t.getPit() != 0 ? t.getPit() : t.getNumber())
                .thenComparingInt(Team::getNumber));
        StringWriter out = new StringWriter();
        CSVFormat fmt = CSVFormat.DEFAULT.builder()
                .setHeader(EXPORT_HEADER)
                .setRecordSeparator("\n")
                .build();
        try (CSVPrinter printer = new CSVPrinter(out, fmt)) {
            for (Team t : sorted) {
                printer.printRecord(t.getPit(), t.getName(), t.getNumber(), t.getScore(1), t.getScore(2), t.getScore(3));
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toString();
    }

    static String roundColumn(int round) {
        return "Round " + round + " Score";
    }

    static int parseRoundScore(String raw) {
        if (raw == null || raw.isEmpty()) return Team.NOT_PLAYED;
        try {
            int v = Integer.parseInt(raw);
            if (v <= 0) return Team.NOT_PLAYED;
            if (v > Team.MAX_SCORE) throw new ScoreValidationException("Score out of range: " + v);
            return v;
        } catch (NumberFormatException e) {
            return Team.NOT_PLAYED;
        }
    }

    private static int parseRequired(String raw, int rowNum, String column) {
        if (raw == null || raw.isEmpty()) {
            throw new ScoreValidationException("Row " + rowNum + ": missing " + column);
        }
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new ScoreValidationException("Row " + rowNum + ": " + column + " is not a number: '" + raw + "'");
        }
    }

    private static String opt(CSVRecord rec, String key) {
        if (!rec.isMapped(key) || !rec.isSet(key)) return null;
        String v = rec.get(key);
        return v == null ? null : v.trim();
    }
}
