package com.interlockingbrick.scoring.store;

import java.nio.file.Path;
import java.time.LocalDate;

/**
 * An event database resolved at startup.
 *
 * @param name      database name without the H2 file suffix, e.g. {@code NYC-20261018}
 * @param directory directory holding the database files
 * @param eventCode event code of a pre-provisioned database, null for a generated one
 * @param eventDate date encoded in the name
 */
public record EventDatabase(String name, Path directory, String eventCode, LocalDate eventDate) {

    public boolean isProvisioned() {
        return eventCode != null;
    }

    /** Path passed to H2, which appends {@code .mv.db} itself. */
    public Path basePath() {
        return directory.resolve(name).toAbsolutePath();
    }

    public String jdbcUrl() {
        return "jdbc:h2:file:" + basePath().toString().replace('\\', '/');
    }
}
