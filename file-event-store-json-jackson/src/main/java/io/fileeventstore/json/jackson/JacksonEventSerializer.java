package io.fileeventstore.json.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.fileeventstore.core.EventDecodingException;
import io.fileeventstore.core.EventSerializationException;
import io.fileeventstore.core.EventSerializer;
import io.fileeventstore.core.EventTypeRegistry;
import io.fileeventstore.core.StoredEvent;

import java.io.IOException;
import java.util.Objects;

/**
 * Jackson implementation of {@link EventSerializer}.
 *
 * <p>Each record is an indented JSON object:
 * <pre>{@code
 * {
 *   "streamVersion" : 1,
 *   "streamId" : "house-h1",
 *   "streamType" : "House",
 *   "eventType" : "HouseCreated",
 *   "typeDiscriminator" : "com.example.HouseCreated",
 *   "timestamp" : "2024-01-01T00:00:00Z",
 *   "data" : { ... }
 * }
 * }</pre>
 *
 * <p>The payload class is resolved through the {@link EventTypeRegistry}: by
 * discriminator first, then by the {@code eventType} tag.
 */
public final class JacksonEventSerializer implements EventSerializer {

    private final ObjectMapper mapper;
    private final EventTypeRegistry registry;

    /**
     * Creates a serializer with the default ObjectMapper configuration.
     */
    public JacksonEventSerializer(EventTypeRegistry registry) {
        this(defaultMapper(), registry);
    }

    /**
     * Creates a serializer with a custom ObjectMapper. The mapper must be able to
     * handle {@link java.time.Instant}.
     */
    public JacksonEventSerializer(ObjectMapper mapper, EventTypeRegistry registry) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /**
     * ObjectMapper used when none is supplied: ISO-8601 instants, indented output,
     * unknown payload properties ignored.
     */
    public static ObjectMapper defaultMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper getMapper() {
        return mapper;
    }

    @Override
    public String fileExtension() {
        return "json";
    }

    @Override
    public EventTypeRegistry.Entry describe(Object event) {
        Objects.requireNonNull(event, "event");
        return registry.describe(event.getClass());
    }

    @Override
    public byte[] serialize(StoredEvent event) {
        Objects.requireNonNull(event, "event");
        try {
            JsonEventEnvelope envelope = new JsonEventEnvelope(
                    event.streamVersion(),
                    event.streamId(),
                    event.streamType(),
                    event.eventType(),
                    event.typeDiscriminator(),
                    event.timestamp(),
                    mapper.valueToTree(event.data())
            );
            return mapper.writeValueAsBytes(envelope);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new EventSerializationException("Failed to serialize " + event.eventType()
                    + " for stream " + event.streamId(), e);
        }
    }

    @Override
    public StoredEvent deserialize(byte[] data) {
        Objects.requireNonNull(data, "data");
        JsonEventEnvelope envelope;
        try {
            envelope = mapper.readValue(data, JsonEventEnvelope.class);
        } catch (IOException e) {
            throw new EventDecodingException("Failed to parse event envelope", e);
        }
        if (envelope == null) {
            throw new EventDecodingException("Empty event envelope");
        }

        Class<?> type = registry.resolve(envelope.typeDiscriminator(), envelope.eventType())
                .orElseThrow(() -> new EventDecodingException("Could not resolve event type: "
                        + envelope.typeDiscriminator() + " (eventType: " + envelope.eventType() + ")"));

        JsonNode payload = envelope.data();
        if (payload == null || payload.isNull() || payload.isMissingNode()) {
            throw new EventDecodingException("Missing data for " + envelope.eventType()
                    + " in stream " + envelope.streamId());
        }

        Object value;
        try {
            value = mapper.treeToValue(payload, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new EventDecodingException("Failed to deserialize event data for " + envelope.eventType(), e);
        }

        if (envelope.streamId() == null || envelope.eventType() == null || envelope.timestamp() == null) {
            throw new EventDecodingException("Incomplete event envelope for " + envelope.eventType()
                    + " in stream " + envelope.streamId() + ": streamId, eventType and timestamp are required");
        }
        if (envelope.streamVersion() < 1) {
            throw new EventDecodingException("Invalid streamVersion " + envelope.streamVersion()
                    + " in stream " + envelope.streamId());
        }
        return new StoredEvent(
                envelope.streamVersion(),
                envelope.streamId(),
                envelope.streamType(),
                envelope.eventType(),
                envelope.typeDiscriminator() != null ? envelope.typeDiscriminator() : type.getName(),
                envelope.timestamp(),
                value
        );
    }
}
