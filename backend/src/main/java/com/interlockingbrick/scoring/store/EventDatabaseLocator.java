package com.interlockingbrick.scoring.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Picks the event database for today. Pre-provisioned databases are named
 * {@code EVENTCODE-YYYYMMDD}; the one dated today or closest after today wins.
 * Without one, a database named {@code YYYYMMDD-event} is used.
 */
public class EventDatabaseLocator {
    private static final Logger log = LoggerFactory.getLogger(EventDatabaseLocator.class);

    public static final String H2_SUFFIX = ".mv.db";
    private static final Pattern PROVISIONED = Pattern.compile("^([A-Za-z0-9_]+)-(\\d{8})$");
    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("uuuuMMdd")
            .withResolverStyle(ResolverStyle.STRICT);

    private final Path directory;
    private final Clock clock;

    public EventDatabaseLocator(String directory, Clock clock) {
        this.directory = Paths.get(directory == null || directory.isBlank() ? "." : directory.trim());
        this.clock = clock;
    }

    public EventDatabase locate() {
        LocalDate today = LocalDate.now(clock);
        Optional<EventDatabase> provisioned = findProvisioned(today);
        if (provisioned.isPresent()) {
            EventDatabase db = provisioned.get();
            log.info("[Store][Locate] using provisioned database name={} eventCode={} date={}", db.name(), db.eventCode(), db.eventDate());
            return db;
        }
        EventDatabase generated = new EventDatabase(DATE.format(today) + "-event", directory, null, today);
        log.info("[Store][Locate] no provisioned database in dir={}, using name={}", directory.toAbsolutePath(), generated.name());
        return generated;
    }

    Optional<EventDatabase> findProvisioned(LocalDate today) {
        if (!Files.isDirectory(directory)) return Optional.empty();
        EventDatabase best = null;
        try (Stream<Path> files = Files.list(directory)) {
            for (Path file : (Iterable<Path>) files::iterator) {
                EventDatabase candidate = parse(file.getFileName().toString());
                if (candidate == null || candidate.eventDate().isBefore(today)) continue;
                if (best == null || candidate.eventDate().isBefore(best.eventDate())
                        || (candidate.eventDate().equals(best.eventDate()) && candidate.name().compareTo(best.name()) < 0)) {
                    best = candidate;
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list event database directory " + directory, e);
        }
        return Optional.ofNullable(best);
    }

    private EventDatabase parse(String fileName) {
        if (!fileName.endsWith(H2_SUFFIX)) return null;
        String base = fileName.substring(0, fileName.length() - H2_SUFFIX.length());
        Matcher m = PROVISIONED.matcher(base);
        if (!m.matches()) return null;
        // a generated database is named "<date>-event" and never matches, the code must come first
        try {
            LocalDate date = LocalDate.parse(m.group(2), DATE);
            return new EventDatabase(base, directory, m.group(1), date);
        } catch (DateTimeParseException e) {
            log.debug("[Store][Locate] skipping {} with invalid date", fileName);
            return null;
        }
    }
}
