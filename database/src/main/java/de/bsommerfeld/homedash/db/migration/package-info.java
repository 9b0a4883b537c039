/**
 * Versioned schema and data migrations for the SQLite store.
 *
 * <h2>Flow</h2>
 *
 * <pre>
 *   SqliteDatabase (startup)
 *        │
 *        ▼
 *   MigrationRunner.run(registry, connection)
 *        │  1. ensure schema_migrations
 *        │  2. read applied versions
 *        │  3. for each pending migration, ascending:
 *        │       up(context)  →  Ledger row
 *        ▼
 *   MigrationResult  (or MigrationException, fatal)
 * </pre>
 *
 * <h2>Ledger</h2>
 *
 * <pre>
 * ┌──────────────────────────────────────────────────────┐
 * │ schema_migrations                                    │
 * ├──────────────────┬───────────────────────────────────┤
 * │ version (PK)     │ Migration.version()               │
 * │ name             │ Migration.name() at apply time    │
 * │ applied_at       │ Epoch seconds                     │
 * └──────────────────┴───────────────────────────────────┘
 * </pre>
 *
 * A row means the version ran to completion and is never run again. The row
 * is written after {@code up} returns, so every {@code up} must tolerate being
 * run a second time against its own partial result.
 *
 * <h2>Errors</h2>
 * <ul>
 * <li>{@link de.bsommerfeld.homedash.db.migration.StructuralMigrationException}:
 * a statement inside {@code up} failed. Fatal.</li>
 * <li>{@link de.bsommerfeld.homedash.db.migration.SchemaDowngradeException}:
 * the Ledger is ahead of the registry. Fatal.</li>
 * <li>{@link de.bsommerfeld.homedash.db.migration.LedgerException}: the Ledger
 * itself is unusable. Fatal.</li>
 * <li>Skipped rows: a single payload could not be transformed. Counted in the
 * {@link de.bsommerfeld.homedash.db.migration.UnitReport}, the row keeps its
 * previous value and the migration succeeds.</li>
 * </ul>
 *
 * <h2>SQL File Inventory</h2>
 * <ul>
 * <li>{@code ledger-create.sql}, {@code ledger-select-all.sql},
 * {@code ledger-insert.sql}: the Ledger</li>
 * <li>{@code migrations/NNNN-*.sql}: DDL scripts run by
 * {@link de.bsommerfeld.homedash.db.migration.ScriptMigration}</li>
 * </ul>
 */
package de.bsommerfeld.homedash.db.migration;
