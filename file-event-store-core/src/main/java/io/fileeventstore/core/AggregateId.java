package io.fileeventstore.core;

/**
 * Validated aggregate identifier.
 *
 * <p>Distinct from {@link StreamId}: callers pass the raw aggregate id and the
 * session derives the backing stream id from it. Same traversal and character
 * rules as a stream id, without the length cap.
 */
public final class AggregateId {

    private final String value;

    private AggregateId(String value) {
        Identifiers.requireNotBlank(value, "aggregate id");
        Identifiers.requireNoTraversal(value, "aggregate id");
        Identifiers.requireNoReservedChars(value, "aggregate id");
        this.value = value;
    }

    /**
     * @throws InvalidIdentifierException if the id is malformed
     */
    public static AggregateId of(String value) {
        return new AggregateId(value);
    }

    public String value() {
        return value;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof AggregateId)) return false;
        return value.equals(((AggregateId) other).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
