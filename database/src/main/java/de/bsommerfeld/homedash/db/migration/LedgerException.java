package de.bsommerfeld.homedash.db.migration;

/**
 * The Version Ledger could not be created, read or appended to.
 */
public class LedgerException extends MigrationException {

    public LedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
