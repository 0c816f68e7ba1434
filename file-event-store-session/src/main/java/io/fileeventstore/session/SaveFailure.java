package io.fileeventstore.session;

import io.fileeventstore.aggregate.Aggregate;
import io.fileeventstore.core.StreamId;

import java.util.Objects;
import java.util.Optional;

/**
 * One stream commit that failed during {@link EventSession#saveChanges()}.
 *
 * @param streamId the target stream
 * @param aggregate the aggregate whose events were not saved, or null for a raw stream operation
 * @param cause why the commit failed
 */
public record SaveFailure(StreamId streamId, Aggregate<?> aggregate, RuntimeException cause) {
    public SaveFailure {
        Objects.requireNonNull(streamId, "streamId");
        Objects.requireNonNull(cause, "cause");
    }

    public Optional<Aggregate<?>> aggregateIfAny() {
        return Optional.ofNullable(aggregate);
    }

    @Override
    public String toString() {
        return streamId + ": " + cause.getMessage();
    }
}
