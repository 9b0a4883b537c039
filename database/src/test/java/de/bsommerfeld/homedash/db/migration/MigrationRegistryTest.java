package de.bsommerfeld.homedash.db.migration;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class MigrationRegistryTest {

    private final List<Integer> journal = new ArrayList<>();

    @Test
    void of_shouldSortByVersion() {
        MigrationRegistry registry = MigrationRegistry.of(
                new RecordingMigration(3, journal),
                new RecordingMigration(1, journal),
                new RecordingMigration(2, journal));

        List<Integer> versions = registry.migrations().stream().map(Migration::version).toList();
        assertEquals(List.of(1, 2, 3), versions);
        assertEquals(3, registry.latestVersion());
    }

    @Test
    void of_shouldRejectDuplicateVersions() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> MigrationRegistry.of(
                        new RecordingMigration(1, "first", journal, false),
                        new RecordingMigration(1, "second", journal, false)));
        assertTrue(e.getMessage().contains("first"));
        assertTrue(e.getMessage().contains("second"));
    }

    @Test
    void of_shouldRejectNonPositiveVersion() {
        Migration zero = new Migration() {
            @Override
            public int version() {
                return 0;
            }

            @Override
            public String name() {
                return "zero";
            }

            @Override
            public void up(MigrationContext context) {
            }
        };
        assertThrows(IllegalArgumentException.class, () -> MigrationRegistry.of(zero));
    }

    @Test
    void abstractMigration_shouldRejectBlankName() {
        assertThrows(IllegalArgumentException.class, () -> new RecordingMigration(1, " ", journal, false));
    }

    @Test
    void latestVersion_shouldBeZeroForEmptyRegistry() {
        assertEquals(0, MigrationRegistry.of(List.of()).latestVersion());
    }

    @Test
    void pending_shouldSkipAppliedVersionsIncludingGaps() {
        MigrationRegistry registry = MigrationRegistry.of(
                new RecordingMigration(1, journal),
                new RecordingMigration(2, journal),
                new RecordingMigration(5, journal),
                new RecordingMigration(7, journal));

        List<Integer> pending = registry.pending(Set.of(1, 5)).stream().map(Migration::version).toList();

        assertEquals(List.of(2, 7), pending);
    }

    @Test
    void migrations_shouldBeImmutable() {
        MigrationRegistry registry = MigrationRegistry.of(new RecordingMigration(1, journal));
        assertThrows(UnsupportedOperationException.class,
                () -> registry.migrations().add(new RecordingMigration(2, journal)));
    }

    @Test
    void find_shouldLookUpByVersion() {
        MigrationRegistry registry = MigrationRegistry.of(new RecordingMigration(4, journal));
        assertTrue(registry.find(4).isPresent());
        assertTrue(registry.find(5).isEmpty());
    }
}
