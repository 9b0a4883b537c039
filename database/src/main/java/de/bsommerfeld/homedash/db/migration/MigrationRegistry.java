package de.bsommerfeld.homedash.db.migration;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Immutable, version-ordered set of known migrations. Construction fails on a
 * duplicate or non-positive version, so a registry that exists is valid.
 */
public final class MigrationRegistry {

    private final ImmutableSortedMap<Integer, Migration> byVersion;

    private MigrationRegistry(ImmutableSortedMap<Integer, Migration> byVersion) {
        this.byVersion = byVersion;
    }

    public static MigrationRegistry of(Migration... migrations) {
        return of(Arrays.asList(migrations));
    }

    /**
     * @throws IllegalArgumentException on a duplicate or non-positive version
     */
    public static MigrationRegistry of(Collection<? extends Migration> migrations) {
        TreeMap<Integer, Migration> sorted = new TreeMap<>();
        for (Migration migration : migrations) {
            if (migration.version() <= 0) {
                throw new IllegalArgumentException("Migration version must be positive: " + migration);
            }
            Migration previous = sorted.putIfAbsent(migration.version(), migration);
            if (previous != null) {
                throw new IllegalArgumentException("Duplicate migration version " + migration.version()
                        + ": " + previous.name() + " and " + migration.name());
            }
        }
        return new MigrationRegistry(ImmutableSortedMap.copyOfSorted(sorted));
    }

    /** All migrations in ascending version order. */
    public List<Migration> migrations() {
        return ImmutableList.copyOf(byVersion.values());
    }

    public Optional<Migration> find(int version) {
        return Optional.ofNullable(byVersion.get(version));
    }

    /** Highest registered version, 0 for an empty registry. */
    public int latestVersion() {
        return byVersion.isEmpty() ? 0 : byVersion.lastKey();
    }

    /** Migrations whose version is not in {@code applied}, ascending. */
    public List<Migration> pending(Set<Integer> applied) {
        List<Migration> pending = new ArrayList<>();
        for (Migration migration : byVersion.values()) {
            if (!applied.contains(migration.version())) {
                pending.add(migration);
            }
        }
        return pending;
    }

    public int size() {
        return byVersion.size();
    }
}
