package io.fileeventstore.json.jackson;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * On-disk JSON shape of one stored event.
 */
record JsonEventEnvelope(
        long streamVersion,
        String streamId,
        String streamType,
        String eventType,
        String typeDiscriminator,
        Instant timestamp,
        JsonNode data
) {
}
