package de.bsommerfeld.homedash.db;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Loads and caches SQL statements from classpath resource files under
 * {@code sql/}.
 *
 * <p>
 * Two kinds of files live there:
 * <ul>
 * <li>single statements, e.g. {@code sql/ledger-insert.sql}, loaded with
 * {@link #load}</li>
 * <li>multi-statement DDL scripts for schema migrations, e.g.
 * {@code sql/migrations/0001-initial-schema.sql}, loaded with
 * {@link #loadScript}</li>
 * </ul>
 *
 * <p>
 * Scripts are split on a semicolon that ends a line. Trigger bodies must
 * therefore keep their inner statement and the closing {@code END;} on the
 * same line. Lines starting with {@code --} are dropped before splitting.
 *
 * <p>
 * Each file is read exactly once and cached for the lifetime of the JVM.
 */
public final class SqlLoader {

    private static final ConcurrentHashMap<String, String> CACHE = new ConcurrentHashMap<>();
    private static final ConcurrentHashMap<String, List<String>> SCRIPT_CACHE = new ConcurrentHashMap<>();
    private static final Pattern STATEMENT_END = Pattern.compile(";\\s*(\\r?\\n|$)");

    private SqlLoader() {
    }

    /**
     * Returns the SQL statement from {@code sql/<name>.sql} on the classpath.
     * The result is trimmed and cached.
     *
     * @param name the file stem relative to {@code sql/}, without extension
     * @return the SQL string, ready for {@link java.sql.PreparedStatement} use
     * @throws IllegalStateException if the resource is missing or unreadable
     */
    public static String load(String name) {
        return CACHE.computeIfAbsent(name, SqlLoader::readResource);
    }

    /**
     * Returns the individual statements of the script {@code sql/<name>.sql}
     * in file order.
     *
     * @throws IllegalStateException if the resource is missing or unreadable
     */
    public static List<String> loadScript(String name) {
        return SCRIPT_CACHE.computeIfAbsent(name, n -> split(load(n)));
    }

    static List<String> split(String script) {
        StringBuilder withoutComments = new StringBuilder();
        for (String line : script.split("\\r?\\n")) {
            if (!line.trim().startsWith("--")) {
                withoutComments.append(line).append('\n');
            }
        }

        List<String> statements = new ArrayList<>();
        for (String sql : STATEMENT_END.split(withoutComments)) {
            String trimmed = sql.trim();
            if (!trimmed.isEmpty()) {
                statements.add(trimmed);
            }
        }
        return List.copyOf(statements);
    }

    private static String readResource(String name) {
        String path = "sql/" + name + ".sql";
        try (InputStream in = SqlLoader.class.getClassLoader().getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalStateException("SQL resource not found: " + path);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read SQL resource: " + path, e);
        }
    }
}
