package io.fileeventstore.aggregate;

import io.fileeventstore.core.EventDecodingException;
import io.fileeventstore.core.StoredEvent;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Base class for event-sourced aggregates.
 *
 * <p>All state is derived by folding events through {@link #apply}. Events reach
 * {@code apply} either from history ({@link #loadFromHistory}) or from a command
 * ({@link #emit}); both paths must produce the same state for the same sequence.
 *
 * <p>Subclasses usually declare a sealed event interface and dispatch on it:
 * <pre>{@code
 * public final class House extends Aggregate<HouseEvent> {
 *     private String name;
 *
 *     public House() { super(HouseEvent.class); }
 *
 *     public void rename(String newName) { emit(new HouseRenamed(newName)); }
 *
 *     @Override
 *     protected void apply(HouseEvent event) {
 *         if (event instanceof HouseCreated c) { setId(c.id()); name = c.name(); }
 *         else if (event instanceof HouseRenamed r) { name = r.newName(); }
 *     }
 * }
 * }</pre>
 *
 * <p>Sessions and repositories create empty instances through a registered factory,
 * usually a constructor reference such as {@code House::new}; see {@link AggregateFactories}.
 *
 * @param <E> the aggregate's event type
 */
public abstract class Aggregate<E> {

    private final Class<E> eventType;
    private final List<E> uncommittedEvents = new ArrayList<>();
    private String id;
    private long version;

    protected Aggregate(Class<E> eventType) {
        this.eventType = Objects.requireNonNull(eventType, "eventType");
    }

    /**
     * Aggregate id, or null until the subclass sets it from its creation event.
     */
    public String id() {
        return id;
    }

    protected void setId(String id) {
        this.id = id;
    }

    /**
     * Stream version of the last applied stored event, 0 if none.
     */
    public long version() {
        return version;
    }

    public List<E> uncommittedEvents() {
        return Collections.unmodifiableList(uncommittedEvents);
    }

    public boolean hasUncommittedEvents() {
        return !uncommittedEvents.isEmpty();
    }

    /**
     * Replay stored events in order, advancing the version to each event's stream version.
     *
     * @throws EventDecodingException if a payload is not an event of this aggregate
     */
    public void loadFromHistory(List<StoredEvent> history) {
        for (StoredEvent stored : history) {
            Object data = stored.data();
            if (!eventType.isInstance(data)) {
                throw new EventDecodingException("Event " + stored.eventType() + " at version "
                        + stored.streamVersion() + " of stream " + stored.streamId()
                        + " is not a " + eventType.getSimpleName());
            }
            apply(eventType.cast(data));
            version = stored.streamVersion();
        }
    }

    /**
     * Apply a new event immediately and queue it for the next save.
     */
    protected void emit(E event) {
        Objects.requireNonNull(event, "event");
        apply(event);
        uncommittedEvents.add(event);
    }

    /**
     * Called after the uncommitted events were appended: clears them and moves the
     * version to the stream version the store returned.
     */
    public void markCommitted(long newVersion) {
        uncommittedEvents.clear();
        version = newVersion;
    }

    /**
     * Fold one event into state. Must not have side effects beyond field mutation.
     */
    protected abstract void apply(E event);
}
