package io.fileeventstore.core;

import java.time.Instant;
import java.util.Objects;

/**
 * One persisted event record. Each record is one physical unit of storage.
 *
 * @param streamVersion 1-based position in the stream
 * @param streamId owning stream
 * @param streamType optional stream type (aggregate kind name), may be null
 * @param eventType event type tag
 * @param typeDiscriminator decode discriminator, resolved before the tag
 * @param timestamp UTC instant assigned by the store's clock
 * @param data event payload
 */
public record StoredEvent(
        long streamVersion,
        String streamId,
        String streamType,
        String eventType,
        String typeDiscriminator,
        Instant timestamp,
        Object data
) {
    public StoredEvent {
        if (streamVersion < 1) {
            throw new IllegalArgumentException("streamVersion must be >= 1");
        }
        Objects.requireNonNull(streamId, "streamId");
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(typeDiscriminator, "typeDiscriminator");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(data, "data");
    }
}
