package de.bsommerfeld.homedash.db.migration;

/**
 * Thrown when the migration sequence cannot continue. Always fatal to
 * process startup: the host must not begin serving.
 */
public class MigrationException extends Exception {

    public MigrationException(String message) {
        super(message);
    }

    public MigrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
