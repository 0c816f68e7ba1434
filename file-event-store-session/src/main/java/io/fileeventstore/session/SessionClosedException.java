package io.fileeventstore.session;

import io.fileeventstore.core.EventStoreException;

/**
 * Raised when a session is used after {@link EventSession#close()}.
 */
public class SessionClosedException extends EventStoreException {

    public SessionClosedException() {
        super("event session is closed");
    }
}
