package io.fileeventstore.session;

/**
 * Creates event sessions. Inject this into handlers and services.
 */
@FunctionalInterface
public interface EventSessionFactory {

    /**
     * Open a new session. Close it when done.
     */
    EventSession openSession();
}
