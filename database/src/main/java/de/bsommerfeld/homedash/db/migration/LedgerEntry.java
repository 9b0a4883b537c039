package de.bsommerfeld.homedash.db.migration;

import java.time.Instant;

/**
 * One row of {@code schema_migrations}: this version ran to completion.
 */
public record LedgerEntry(int version, String name, Instant appliedAt) {
}
