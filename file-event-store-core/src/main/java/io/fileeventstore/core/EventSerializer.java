package io.fileeventstore.core;

/**
 * Encodes and decodes one stored-event envelope.
 *
 * <p>Implementations wrap a specific format library. The store treats the encoded
 * bytes as opaque and names each file with {@link #fileExtension()}.
 */
public interface EventSerializer {

    /**
     * File extension (without the dot) for records written by this serializer.
     */
    String fileExtension();

    /**
     * @throws EventSerializationException if the record cannot be encoded
     */
    byte[] serialize(StoredEvent event);

    /**
     * @throws EventDecodingException if the record cannot be resolved or decoded
     */
    StoredEvent deserialize(byte[] data);

    /**
     * Names to persist for an event payload's class.
     *
     * @throws EventSerializationException if the class is not known to this serializer
     */
    EventTypeRegistry.Entry describe(Object event);
}
