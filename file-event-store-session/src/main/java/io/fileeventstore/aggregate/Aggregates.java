package io.fileeventstore.aggregate;

import io.fileeventstore.core.AggregateId;
import io.fileeventstore.core.StreamId;

import java.util.Locale;

/**
 * Helpers shared by the repository and the session.
 */
public final class Aggregates {

    private Aggregates() {}

    /**
     * Default stream id for an aggregate: lower-case kind name, a hyphen, then the id.
     *
     * @throws io.fileeventstore.core.InvalidIdentifierException if the result is not a valid stream id
     */
    public static StreamId streamIdFor(Class<?> kind, AggregateId id) {
        return StreamId.of(streamTypeOf(kind).toLowerCase(Locale.ROOT) + "-" + id.value());
    }

    /**
     * Stream type recorded with an aggregate's events.
     */
    public static String streamTypeOf(Class<?> kind) {
        return kind.getSimpleName();
    }
}
