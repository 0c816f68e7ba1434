package io.fileeventstore.aggregate;

import io.fileeventstore.core.AggregateId;
import io.fileeventstore.core.EventStore;
import io.fileeventstore.core.ExpectedVersion;
import io.fileeventstore.core.StoredEvent;
import io.fileeventstore.core.StreamId;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Loads and saves one aggregate kind directly against an {@link EventStore},
 * without identity map or unit of work.
 *
 * @param <T> aggregate kind
 */
public final class AggregateRepository<T extends Aggregate<?>> {

    private final EventStore store;
    private final Class<T> kind;
    private final Supplier<T> aggregateFactory;
    private final Function<AggregateId, StreamId> streamIdFor;

    /**
     * @param kind aggregate class, names the stream and its type
     * @param aggregateFactory creates empty instances, usually a constructor reference
     */
    public AggregateRepository(EventStore store, Class<T> kind, Supplier<T> aggregateFactory) {
        this(store, kind, aggregateFactory, id -> Aggregates.streamIdFor(kind, id));
    }

    public AggregateRepository(EventStore store, Class<T> kind, Supplier<T> aggregateFactory,
                               Function<AggregateId, StreamId> streamIdFor) {
        this.store = Objects.requireNonNull(store, "store");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.aggregateFactory = Objects.requireNonNull(aggregateFactory, "aggregateFactory");
        this.streamIdFor = Objects.requireNonNull(streamIdFor, "streamIdFor");
    }

    /**
     * @return the replayed aggregate, or null if its stream has no events
     */
    public T load(AggregateId id) {
        List<StoredEvent> events = store.fetchStream(streamIdFor.apply(id));
        if (events.isEmpty()) {
            return null;
        }
        T aggregate = aggregateFactory.get();
        aggregate.loadFromHistory(events);
        return aggregate;
    }

    public T loadOrCreate(AggregateId id) {
        T aggregate = load(id);
        return aggregate != null ? aggregate : aggregateFactory.get();
    }

    /**
     * Append the aggregate's uncommitted events, expecting the stream to be at the
     * aggregate's version. Does nothing if there are no uncommitted events.
     *
     * @throws io.fileeventstore.core.ConcurrencyException if the stream moved since the aggregate was loaded
     * @throws io.fileeventstore.core.InvalidIdentifierException if the aggregate has no valid id
     */
    public void save(T aggregate) {
        Objects.requireNonNull(aggregate, "aggregate");
        if (!aggregate.hasUncommittedEvents()) {
            return;
        }
        StreamId streamId = streamIdFor.apply(AggregateId.of(aggregate.id()));
        ExpectedVersion expected = aggregate.version() == 0
                ? ExpectedVersion.none()
                : ExpectedVersion.exactly(aggregate.version());
        long newVersion = store.appendToStream(
                streamId, Aggregates.streamTypeOf(kind), aggregate.uncommittedEvents(), expected);
        aggregate.markCommitted(newVersion);
    }
}
