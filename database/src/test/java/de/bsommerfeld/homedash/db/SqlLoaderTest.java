package de.bsommerfeld.homedash.db;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SqlLoaderTest {

    @Test
    void load_shouldReturnLedgerInsert() {
        String sql = SqlLoader.load("ledger-insert");
        assertNotNull(sql);
        assertTrue(sql.toLowerCase().contains("insert into schema_migrations"));
    }

    @Test
    void load_shouldCacheRepeatCalls() {
        String first = SqlLoader.load("ledger-select-all");
        String second = SqlLoader.load("ledger-select-all");
        assertSame(first, second, "Cached calls should return the same String reference");
    }

    @Test
    void load_shouldThrowForNonexistentFile() {
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> SqlLoader.load("nonexistent-sql-file"));
        assertTrue(e.getMessage().contains("sql/nonexistent-sql-file.sql"));
    }

    // -- Scripts --

    @Test
    void loadScript_shouldKeepTriggerBodiesIntact() {
        List<String> statements = SqlLoader.loadScript("migrations/0001-initial-schema");

        List<String> triggers = statements.stream().filter(s -> s.startsWith("CREATE TRIGGER")).toList();
        assertEquals(3, triggers.size());
        for (String trigger : triggers) {
            assertTrue(trigger.endsWith("END"), trigger);
            assertTrue(trigger.contains("BEGIN UPDATE"), trigger);
        }
    }

    @Test
    void loadScript_shouldSplitMultiStatementTriggerAsOne() {
        List<String> statements = SqlLoader.loadScript("migrations/0020-add-media-library");

        String update = statements.stream().filter(s -> s.contains("media_library_au")).findFirst().orElseThrow();
        assertEquals(2, update.split("INSERT INTO media_library_fts").length - 1);
    }

    @Test
    void split_shouldDropCommentLinesAndBlankStatements() {
        String script = "-- header\nCREATE TABLE a (x INTEGER);\n\n  -- indented comment\nCREATE TABLE b (y TEXT);\n;\n";

        List<String> statements = SqlLoader.split(script);

        assertEquals(List.of("CREATE TABLE a (x INTEGER)", "CREATE TABLE b (y TEXT)"), statements);
    }

    @Test
    void split_shouldAcceptLastStatementWithoutSemicolon() {
        assertEquals(List.of("SELECT 1", "SELECT 2"), SqlLoader.split("SELECT 1;\nSELECT 2"));
    }

    @Test
    void split_shouldNotSplitOnSemicolonInsideLine() {
        List<String> statements = SqlLoader.split("INSERT INTO t VALUES ('a;b');\n");
        assertEquals(1, statements.size());
        assertEquals("INSERT INTO t VALUES ('a;b')", statements.get(0));
    }
}
