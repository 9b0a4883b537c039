package de.bsommerfeld.homedash.db;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Explicit transaction scoping for JDBC work. The connection's previous
 * auto-commit setting is restored afterwards, so callers can nest this
 * inside code that otherwise runs statement by statement.
 */
public final class Transactions {

    private Transactions() {
    }

    /** A unit of JDBC work that may throw {@link SQLException}. */
    @FunctionalInterface
    public interface SqlWork<T> {
        T run(Connection connection) throws SQLException;
    }

    /**
     * Runs {@code work} inside a transaction: commit on success, rollback on
     * any exception, which is then rethrown unchanged.
     */
    public static <T> T inTransaction(Connection connection, SqlWork<T> work) throws SQLException {
        boolean previousAutoCommit = connection.getAutoCommit();
        connection.setAutoCommit(false);
        try {
            T result = work.run(connection);
            connection.commit();
            return result;
        } catch (SQLException | RuntimeException e) {
            connection.rollback();
            throw e;
        } finally {
            connection.setAutoCommit(previousAutoCommit);
        }
    }
}
