package io.fileeventstore.core;

import java.util.ArrayList;
import java.util.List;

/**
 * Storage abstraction for append-only event streams.
 *
 * <p>This SPI is minimal and blocking. The current version of a
 * stream is the highest version durably present; versions are 1-based and
 * contiguous.
 */
public interface EventStore {

    /**
     * Create a stream.
     *
     * @param streamId stream to create
     * @param streamType optional stream type (may be null)
     * @param events events to write, in order
     * @return the stream's version after the write
     * @throws ConcurrencyException if the stream already has events
     */
    default long startStream(StreamId streamId, String streamType, List<?> events) {
        return appendToStream(streamId, streamType, events, ExpectedVersion.none());
    }

    default long startStream(StreamId streamId, List<?> events) {
        return startStream(streamId, null, events);
    }

    /**
     * Append events after checking {@code expectedVersion}.
     *
     * @param streamId target stream
     * @param streamType optional stream type (may be null)
     * @param events events to write, in order
     * @param expectedVersion optimistic concurrency predicate
     * @return the stream's version after the write
     * @throws ConcurrencyException if the predicate fails or another writer claimed a version slot
     * @throws EventSerializationException if an event cannot be encoded; nothing is written
     */
    long appendToStream(StreamId streamId, String streamType, List<?> events, ExpectedVersion expectedVersion);

    default long appendToStream(StreamId streamId, List<?> events, ExpectedVersion expectedVersion) {
        return appendToStream(streamId, null, events, expectedVersion);
    }

    default long appendToStream(StreamId streamId, String streamType, Object event, ExpectedVersion expectedVersion) {
        return appendToStream(streamId, streamType, List.of(event), expectedVersion);
    }

    default long appendToStream(StreamId streamId, Object event, ExpectedVersion expectedVersion) {
        return appendToStream(streamId, null, List.of(event), expectedVersion);
    }

    /**
     * All stored events in ascending version order; empty if the stream was never written.
     *
     * @throws EventDecodingException if any record fails to decode
     */
    List<StoredEvent> fetchStream(StreamId streamId);

    /**
     * Event payloads only, in stream order.
     */
    default List<Object> loadEvents(StreamId streamId) {
        List<StoredEvent> stored = fetchStream(streamId);
        List<Object> out = new ArrayList<>(stored.size());
        for (StoredEvent e : stored) {
            out.add(e.data());
        }
        return out;
    }

    /**
     * Current version, 0 if the stream does not exist.
     */
    long getStreamVersion(StreamId streamId);

    /**
     * True iff at least one event exists for the stream.
     */
    boolean streamExists(StreamId streamId);
}
