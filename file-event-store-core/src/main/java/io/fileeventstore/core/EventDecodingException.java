package io.fileeventstore.core;

/**
 * Raised when a persisted record cannot be resolved to a registered event type
 * or its payload cannot be decoded.
 */
public class EventDecodingException extends EventStoreException {

    public EventDecodingException(String message) {
        super(message);
    }

    public EventDecodingException(String message, Throwable cause) {
        super(message, cause);
    }
}
