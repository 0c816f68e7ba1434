package io.fileeventstore.session;

import io.fileeventstore.aggregate.Aggregate;
import io.fileeventstore.core.AggregateId;
import io.fileeventstore.core.StoredEvent;
import io.fileeventstore.core.StreamId;

import java.util.List;

/**
 * Unit of work for event sourcing.
 *
 * <p>Provides both aggregate-based and raw stream operations. Each aggregate
 * stream is committed independently; there is no cross-stream atomicity.
 *
 * <p>A session is meant for one thread of control and is not thread-safe.
 * Every method except {@link #close()} throws {@link SessionClosedException}
 * once the session is closed.
 */
public interface EventSession extends AutoCloseable {

    // ===== Aggregate operations =====

    /**
     * Load and rebuild an aggregate from its stream. Subsequent calls with the same
     * kind and id return the cached instance without reading the store again.
     *
     * @return the aggregate, or null if its stream has no events
     */
    <T extends Aggregate<?>> T load(Class<T> kind, AggregateId id);

    /**
     * As {@link #load}, but creates and tracks an empty aggregate when the stream does not exist.
     */
    <T extends Aggregate<?>> T loadOrCreate(Class<T> kind, AggregateId id);

    /**
     * Track an externally created aggregate for saving, replacing any entry for the
     * same runtime kind and id. Its current version is taken as the version to expect.
     *
     * @throws io.fileeventstore.core.InvalidIdentifierException if the aggregate has no valid id
     */
    void track(Aggregate<?> aggregate);

    // ===== Stream operations (raw access) =====

    /**
     * Queue events to start a new stream. The commit fails if the stream already exists.
     */
    void startStream(StreamId streamId, Object... events);

    /**
     * Queue events to start the stream backing an aggregate of the given kind.
     */
    void startStream(Class<? extends Aggregate<?>> kind, AggregateId id, Object... events);

    /**
     * Queue events to append to a stream without a version check.
     */
    void append(StreamId streamId, Object... events);

    /**
     * Read a stream immediately. Not cached and not tracked.
     */
    List<StoredEvent> fetchStream(StreamId streamId);

    // ===== Unit of work =====

    /**
     * Commit all queued stream operations, then every tracked aggregate with
     * uncommitted events.
     *
     * @throws SaveChangesException if any commit failed; successful commits are kept
     */
    void saveChanges();

    /**
     * As {@link #saveChanges()}, checking {@code cancellation} before each commit.
     *
     * @throws SaveCancelledException if cancellation was requested before all commits were attempted
     */
    void saveChanges(CancellationToken cancellation);

    /**
     * True if any tracked aggregate has uncommitted events or any stream operation is queued.
     */
    boolean hasChanges();

    /**
     * Discard the identity map and queued operations. Idempotent; never touches committed data.
     */
    @Override
    void close();
}
