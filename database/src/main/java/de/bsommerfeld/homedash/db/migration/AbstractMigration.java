package de.bsommerfeld.homedash.db.migration;

import com.google.common.base.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds version and name and gives every unit a logger plus the
 * {@code [Migration 0013]} log prefix.
 */
public abstract class AbstractMigration implements Migration {

    protected final Logger log = LoggerFactory.getLogger(getClass());

    private final int version;
    private final String name;

    protected AbstractMigration(int version, String name) {
        Preconditions.checkArgument(version > 0, "migration version must be positive: %s", version);
        Preconditions.checkArgument(name != null && !name.isBlank(), "migration name must not be blank");
        this.version = version;
        this.name = name;
    }

    @Override
    public final int version() {
        return version;
    }

    @Override
    public final String name() {
        return name;
    }

    protected String prefix() {
        return String.format("[Migration %04d]", version);
    }

    @Override
    public String toString() {
        return version + ":" + name;
    }
}
