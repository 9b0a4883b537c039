package de.bsommerfeld.homedash.db.migration.payload;

import java.util.Objects;

/**
 * Result of transforming one stored value. A {@link Status#SKIPPED} outcome
 * always carries the original value, so writing {@link #value()} back is
 * never harmful.
 *
 * @param value  the value to store; the input unless {@code TRANSFORMED}
 * @param status what happened
 * @param reason why the row was skipped, {@code null} otherwise
 */
public record TransformOutcome(String value, Status status, String reason) {

    public enum Status {
        TRANSFORMED,
        UNCHANGED,
        SKIPPED
    }

    public TransformOutcome {
        Objects.requireNonNull(status, "status");
    }

    public static TransformOutcome transformed(String value) {
        return new TransformOutcome(value, Status.TRANSFORMED, null);
    }

    public static TransformOutcome unchanged(String value) {
        return new TransformOutcome(value, Status.UNCHANGED, null);
    }

    public static TransformOutcome skipped(String original, String reason) {
        return new TransformOutcome(original, Status.SKIPPED, reason);
    }

    public boolean changed() {
        return status == Status.TRANSFORMED;
    }
}
