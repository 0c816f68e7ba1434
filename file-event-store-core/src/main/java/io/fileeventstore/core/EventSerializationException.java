package io.fileeventstore.core;

/**
 * Raised when an event cannot be encoded, for example because its type was never
 * registered in the {@link EventTypeRegistry}.
 */
public class EventSerializationException extends EventStoreException {

    public EventSerializationException(String message) {
        super(message);
    }

    public EventSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
