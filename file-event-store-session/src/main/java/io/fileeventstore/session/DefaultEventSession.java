package io.fileeventstore.session;

import io.fileeventstore.aggregate.Aggregate;
import io.fileeventstore.aggregate.AggregateFactories;
import io.fileeventstore.aggregate.Aggregates;
import io.fileeventstore.core.AggregateId;
import io.fileeventstore.core.EventStore;
import io.fileeventstore.core.ExpectedVersion;
import io.fileeventstore.core.StoredEvent;
import io.fileeventstore.core.StreamId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * {@link EventSession} over any {@link EventStore}.
 *
 * <p>Identity map entries are keyed by (aggregate kind, aggregate id). Each entry
 * remembers the stream version it was loaded at; that version is what
 * {@link #saveChanges()} expects the stream to still be at. A repeated load of the
 * same key returns the cached instance and keeps the first loaded version. After a
 * successful commit the entry moves to the new version so the session can save again.
 *
 * <p>Raw stream operations are flushed before aggregates, in the order queued. Each
 * one is dropped from the queue once attempted; a failure is reported, not retried.
 */
public final class DefaultEventSession implements EventSession {

    private static final Logger log = LoggerFactory.getLogger(DefaultEventSession.class);

    private final EventStore store;
    private final AggregateFactories factories;
    private final Map<AggregateKey, TrackedAggregate> tracked = new LinkedHashMap<>();
    private final List<PendingStreamOperation> pending = new ArrayList<>();
    private boolean closed;

    /**
     * @param store backing store
     * @param factories creates empty aggregates for {@link #load} and {@link #loadOrCreate}
     */
    public DefaultEventSession(EventStore store, AggregateFactories factories) {
        this.store = Objects.requireNonNull(store, "store");
        this.factories = Objects.requireNonNull(factories, "factories");
    }

    @Override
    public <T extends Aggregate<?>> T load(Class<T> kind, AggregateId id) {
        ensureOpen();
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(id, "id");

        AggregateKey key = new AggregateKey(kind, id);
        TrackedAggregate entry = tracked.get(key);
        if (entry != null) {
            return kind.cast(entry.aggregate);
        }

        Supplier<? extends T> factory = factories.factoryFor(kind);
        StreamId streamId = Aggregates.streamIdFor(kind, id);
        List<StoredEvent> events = store.fetchStream(streamId);
        if (events.isEmpty()) {
            return null;
        }

        T aggregate = factory.get();
        aggregate.loadFromHistory(events);
        tracked.put(key, new TrackedAggregate(aggregate, kind, streamId, aggregate.version()));
        return aggregate;
    }

    @Override
    public <T extends Aggregate<?>> T loadOrCreate(Class<T> kind, AggregateId id) {
        T aggregate = load(kind, id);
        if (aggregate != null) {
            return aggregate;
        }
        aggregate = factories.create(kind);
        tracked.put(new AggregateKey(kind, id),
                new TrackedAggregate(aggregate, kind, Aggregates.streamIdFor(kind, id), 0));
        return aggregate;
    }

    @Override
    public void track(Aggregate<?> aggregate) {
        ensureOpen();
        Objects.requireNonNull(aggregate, "aggregate");
        Class<?> kind = aggregate.getClass();
        AggregateId id = AggregateId.of(aggregate.id());
        tracked.put(new AggregateKey(kind, id),
                new TrackedAggregate(aggregate, kind, Aggregates.streamIdFor(kind, id), aggregate.version()));
    }

    @Override
    public void startStream(StreamId streamId, Object... events) {
        ensureOpen();
        queue(streamId, null, events, ExpectedVersion.none());
    }

    @Override
    public void startStream(Class<? extends Aggregate<?>> kind, AggregateId id, Object... events) {
        ensureOpen();
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(id, "id");
        queue(Aggregates.streamIdFor(kind, id), Aggregates.streamTypeOf(kind), events, ExpectedVersion.none());
    }

    @Override
    public void append(StreamId streamId, Object... events) {
        ensureOpen();
        queue(streamId, null, events, ExpectedVersion.any());
    }

    @Override
    public List<StoredEvent> fetchStream(StreamId streamId) {
        ensureOpen();
        return store.fetchStream(Objects.requireNonNull(streamId, "streamId"));
    }

    @Override
    public void saveChanges() {
        saveChanges(CancellationToken.none());
    }

    @Override
    public void saveChanges(CancellationToken cancellation) {
        ensureOpen();
        Objects.requireNonNull(cancellation, "cancellation");

        List<TrackedAggregate> dirty = new ArrayList<>();
        for (TrackedAggregate entry : tracked.values()) {
            if (entry.aggregate.hasUncommittedEvents()) {
                dirty.add(entry);
            }
        }
        if (pending.isEmpty() && dirty.isEmpty()) {
            return;
        }
        log.debug("Saving {} stream operation(s) and {} aggregate(s)", pending.size(), dirty.size());

        List<SaveFailure> failures = new ArrayList<>();

        // An attempted operation leaves the queue even when it fails: part of its batch may be on disk.
        while (!pending.isEmpty()) {
            if (cancellation.isCancellationRequested()) {
                throw cancelled(failures, dirty);
            }
            PendingStreamOperation op = pending.remove(0);
            try {
                store.appendToStream(op.streamId(), op.streamType(), op.events(), op.expectedVersion());
            } catch (RuntimeException e) {
                log.warn("Failed to commit stream operation on {}: {}", op.streamId(), e.getMessage());
                failures.add(new SaveFailure(op.streamId(), null, e));
            }
        }

        for (int i = 0; i < dirty.size(); i++) {
            TrackedAggregate entry = dirty.get(i);
            if (cancellation.isCancellationRequested()) {
                throw cancelled(failures, dirty.subList(i, dirty.size()));
            }
            try {
                long newVersion = store.appendToStream(
                        entry.streamId,
                        Aggregates.streamTypeOf(entry.kind),
                        entry.aggregate.uncommittedEvents(),
                        entry.expectedVersion());
                entry.aggregate.markCommitted(newVersion);
                entry.loadedVersion = newVersion;
            } catch (RuntimeException e) {
                log.warn("Failed to commit aggregate stream {}: {}", entry.streamId, e.getMessage());
                failures.add(new SaveFailure(entry.streamId, entry.aggregate, e));
            }
        }

        if (!failures.isEmpty()) {
            throw new SaveChangesException(failures);
        }
    }

    @Override
    public boolean hasChanges() {
        ensureOpen();
        if (!pending.isEmpty()) {
            return true;
        }
        for (TrackedAggregate entry : tracked.values()) {
            if (entry.aggregate.hasUncommittedEvents()) {
                return true;
            }
        }
        return false;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        tracked.clear();
        pending.clear();
    }

    private void queue(StreamId streamId, String streamType, Object[] events, ExpectedVersion expectedVersion) {
        Objects.requireNonNull(streamId, "streamId");
        Objects.requireNonNull(events, "events");
        pending.add(new PendingStreamOperation(streamId, streamType, List.of(events), expectedVersion));
    }

    private SaveCancelledException cancelled(List<SaveFailure> failures, List<TrackedAggregate> remaining) {
        List<StreamId> notAttempted = new ArrayList<>();
        for (PendingStreamOperation op : pending) {
            notAttempted.add(op.streamId());
        }
        for (TrackedAggregate entry : remaining) {
            notAttempted.add(entry.streamId);
        }
        log.debug("Save cancelled with {} stream commit(s) not attempted", notAttempted.size());
        return new SaveCancelledException(failures, notAttempted);
    }

    private void ensureOpen() {
        if (closed) {
            throw new SessionClosedException();
        }
    }

    private record AggregateKey(Class<?> kind, AggregateId id) {
    }

    private record PendingStreamOperation(
            StreamId streamId, String streamType, List<Object> events, ExpectedVersion expectedVersion) {
    }

    private static final class TrackedAggregate {
        private final Aggregate<?> aggregate;
        private final Class<?> kind;
        private final StreamId streamId;
        private long loadedVersion;

        private TrackedAggregate(Aggregate<?> aggregate, Class<?> kind, StreamId streamId, long loadedVersion) {
            this.aggregate = aggregate;
            this.kind = kind;
            this.streamId = streamId;
            this.loadedVersion = loadedVersion;
        }

        private ExpectedVersion expectedVersion() {
            return loadedVersion == 0 ? ExpectedVersion.none() : ExpectedVersion.exactly(loadedVersion);
        }
    }
}
