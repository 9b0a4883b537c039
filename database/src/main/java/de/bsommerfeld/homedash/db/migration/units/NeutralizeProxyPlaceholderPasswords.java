package de.bsommerfeld.homedash.db.migration.units;

import de.bsommerfeld.homedash.db.Transactions;
import de.bsommerfeld.homedash.db.migration.AbstractMigration;
import de.bsommerfeld.homedash.db.migration.MigrationContext;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Accounts created through proxy authentication were given a placeholder
 * password hash that could be guessed. Users without a local password get a
 * value no password verifier accepts, and their sessions are revoked.
 * Accounts with {@code has_local_password = 1} are never touched.
 */
final class NeutralizeProxyPlaceholderPasswords extends AbstractMigration {

    /** Not a valid bcrypt or argon2 string, so verification always fails. */
    static final String DISABLED_PASSWORD = "!no-local-password";

    NeutralizeProxyPlaceholderPasswords() {
        super(19, "neutralize_proxy_placeholder_passwords");
    }

    @Override
    public void up(MigrationContext context) throws SQLException {
        Connection conn = context.connection();

        List<String> userIds = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT id FROM users WHERE has_local_password = 0 AND password <> ?")) {
            ps.setString(1, DISABLED_PASSWORD);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    userIds.add(rs.getString(1));
                }
            }
        }
        if (userIds.isEmpty()) {
            log.debug("{} No proxy-only accounts to fix", prefix());
            return;
        }

        int sessions = Transactions.inTransaction(conn, c -> {
            int revoked = 0;
            try (PreparedStatement password = c.prepareStatement("UPDATE users SET password = ? WHERE id = ?");
                    PreparedStatement logout = c.prepareStatement("DELETE FROM sessions WHERE user_id = ?")) {
                for (String userId : userIds) {
                    password.setString(1, DISABLED_PASSWORD);
                    password.setString(2, userId);
                    password.executeUpdate();
                    logout.setString(1, userId);
                    revoked += logout.executeUpdate();
                }
            }
            return revoked;
        });

        context.report().migrated(userIds.size());
        log.debug("{} Neutralized {} placeholder password(s), revoked {} session(s)", prefix(), userIds.size(),
                sessions);
    }
}
