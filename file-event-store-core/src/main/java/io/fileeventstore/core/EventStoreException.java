package io.fileeventstore.core;

/**
 * Base class for event store related exceptions.
 *
 * <p>Provides a common unchecked hierarchy for validation, concurrency and
 * decoding errors. Subclasses preserve the original cause when applicable.
 */
public abstract class EventStoreException extends RuntimeException {

    protected EventStoreException(String message) {
        super(message);
    }

    protected EventStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
