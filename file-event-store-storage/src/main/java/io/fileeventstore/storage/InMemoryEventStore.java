package io.fileeventstore.storage;

import io.fileeventstore.core.ConcurrencyException;
import io.fileeventstore.core.EventSerializer;
import io.fileeventstore.core.EventStore;
import io.fileeventstore.core.EventTypeRegistry;
import io.fileeventstore.core.ExpectedVersion;
import io.fileeventstore.core.StoredEvent;
import io.fileeventstore.core.StreamId;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reference in-memory {@link EventStore}.
 *
 * <p>Good for unit tests and examples. Not intended for production. Records are kept
 * in encoded form and go through the same {@link EventSerializer} as the file store,
 * so decode failures behave the same. Appends to one stream are serialized through
 * {@link ConcurrentHashMap#compute}.
 */
public final class InMemoryEventStore implements EventStore {

    private final Map<StreamId, List<byte[]>> streams = new ConcurrentHashMap<>();
    private final EventSerializer serializer;
    private final Clock clock;

    public InMemoryEventStore(EventSerializer serializer) {
        this(serializer, Clock.systemUTC());
    }

    public InMemoryEventStore(EventSerializer serializer, Clock clock) {
        this.serializer = Objects.requireNonNull(serializer, "serializer");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public long appendToStream(StreamId streamId, String streamType, List<?> events, ExpectedVersion expectedVersion) {
        Objects.requireNonNull(streamId, "streamId");
        Objects.requireNonNull(expectedVersion, "expectedVersion");
        List<?> batch = List.copyOf(Objects.requireNonNull(events, "events"));

        long[] result = new long[1];
        streams.compute(streamId, (id, existing) -> {
            List<byte[]> records = existing != null ? existing : new ArrayList<>();
            long current = records.size();
            if (!expectedVersion.isSatisfiedBy(current)) {
                throw new ConcurrencyException(id.value(), expectedVersion, current);
            }
            List<byte[]> encoded = new ArrayList<>(batch.size());
            long version = current;
            for (Object event : batch) {
                version++;
                EventTypeRegistry.Entry type = serializer.describe(event);
                encoded.add(serializer.serialize(new StoredEvent(
                        version, id.value(), streamType, type.tag(), type.discriminator(), clock.instant(), event)));
            }
            records.addAll(encoded);
            result[0] = version;
            return records.isEmpty() ? null : records;
        });
        return result[0];
    }

    @Override
    public List<StoredEvent> fetchStream(StreamId streamId) {
        Objects.requireNonNull(streamId, "streamId");
        List<byte[]> snapshot = snapshot(streamId);
        List<StoredEvent> out = new ArrayList<>(snapshot.size());
        for (byte[] record : snapshot) {
            out.add(serializer.deserialize(record));
        }
        return List.copyOf(out);
    }

    @Override
    public long getStreamVersion(StreamId streamId) {
        return snapshot(Objects.requireNonNull(streamId, "streamId")).size();
    }

    @Override
    public boolean streamExists(StreamId streamId) {
        return getStreamVersion(streamId) > 0;
    }

    private List<byte[]> snapshot(StreamId streamId) {
        List<byte[]> copy = new ArrayList<>();
        streams.computeIfPresent(streamId, (id, records) -> {
            copy.addAll(records);
            return records;
        });
        return copy;
    }
}
