package de.bsommerfeld.homedash.db.migration.units;

import de.bsommerfeld.homedash.db.Transactions;
import de.bsommerfeld.homedash.db.migration.AbstractMigration;
import de.bsommerfeld.homedash.db.migration.MigrationContext;
import de.bsommerfeld.homedash.db.migration.UnitReport;
import de.bsommerfeld.homedash.db.migration.payload.TransformOutcome;
import de.bsommerfeld.homedash.db.migration.payload.WidgetPayloads;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * The dashboard grid's row height went from 100px to 50px, so every stored
 * widget height doubles.
 *
 * <p>
 * Each table is read into memory first and then rewritten inside one
 * transaction per table. Rows whose JSON cannot be parsed are left as they
 * are and counted as skipped.
 */
final class DoubleWidgetHeights extends AbstractMigration {

    static final double FACTOR = 2;

    DoubleWidgetHeights() {
        super(13, "double_widget_heights");
    }

    @Override
    public void up(MigrationContext context) throws SQLException {
        Connection conn = context.connection();
        UnitReport report = context.report();

        int prefs = rewrite(conn, report, "user_preferences", "user_id", "dashboard_config");
        log.debug("{} Updated {} user preference row(s)", prefix(), prefs);

        int templates = rewrite(conn, report, "dashboard_templates", "id", "widgets", "mobile_widgets");
        log.debug("{} Updated {} template(s)", prefix(), templates);

        int backups = rewrite(conn, report, "dashboard_backups", "id", "widgets", "mobile_widgets");
        log.debug("{} Updated {} backup(s)", prefix(), backups);
    }

    /** @return number of rows written back */
    private int rewrite(Connection conn, UnitReport report, String table, String keyColumn, String... columns)
            throws SQLException {
        List<String[]> rows = readAll(conn, table, keyColumn, columns);

        List<String[]> updates = new ArrayList<>();
        for (String[] row : rows) {
            String[] updated = Arrays.copyOf(row, row.length);
            boolean changed = false;
            for (int i = 0; i < columns.length; i++) {
                TransformOutcome outcome = WidgetPayloads.scaleWidgetHeights(row[i + 1], FACTOR);
                report.record(table + "." + columns[i] + "[" + row[0] + "]", outcome);
                if (outcome.changed()) {
                    updated[i + 1] = outcome.value();
                    changed = true;
                }
            }
            if (changed) {
                updates.add(updated);
            }
        }
        if (updates.isEmpty()) {
            return 0;
        }

        String sql = "UPDATE " + table + " SET " + String.join(" = ?, ", columns) + " = ? WHERE " + keyColumn
                + " = ?";
        return Transactions.inTransaction(conn, c -> {
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                for (String[] row : updates) {
                    for (int i = 0; i < columns.length; i++) {
                        ps.setString(i + 1, row[i + 1]);
                    }
                    ps.setString(columns.length + 1, row[0]);
                    ps.executeUpdate();
                }
            }
            return updates.size();
        });
    }

    /** Each entry is {@code [key, column1, column2, ...]}. */
    private static List<String[]> readAll(Connection conn, String table, String keyColumn, String... columns)
            throws SQLException {
        String sql = "SELECT " + keyColumn + ", " + String.join(", ", columns) + " FROM " + table;
        List<String[]> rows = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                String[] row = new String[columns.length + 1];
                for (int i = 0; i <= columns.length; i++) {
                    row[i] = rs.getString(i + 1);
                }
                rows.add(row);
            }
        }
        return rows;
    }
}
