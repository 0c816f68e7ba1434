package io.fileeventstore.core;

import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Explicit mapping between event classes and the names persisted with them.
 *
 * <p>Each registered class has a tag (the {@code eventType} field, by default the
 * simple class name) and a discriminator (the class's binary name). Decoding tries
 * the discriminator first and falls back to the tag, so records written before a
 * class was moved or renamed still resolve as long as the tag is kept.
 *
 * <p>Populate once at startup:
 * <pre>{@code
 * EventTypeRegistry registry = EventTypeRegistry.builder()
 *     .register(HouseCreated.class)
 *     .register("Renamed", HouseRenamed.class)
 *     .build();
 * }</pre>
 */
public final class EventTypeRegistry {

    /**
     * Persisted names for one event class.
     *
     * @param type the event class
     * @param tag the {@code eventType} tag
     * @param discriminator the decode discriminator
     */
    public record Entry(Class<?> type, String tag, String discriminator) {
        public Entry {
            Objects.requireNonNull(type, "type");
            Objects.requireNonNull(tag, "tag");
            Objects.requireNonNull(discriminator, "discriminator");
        }
    }

    private final Map<Class<?>, Entry> byType;
    private final Map<String, Entry> byDiscriminator;
    private final Map<String, Entry> byTag;

    private EventTypeRegistry(Map<Class<?>, Entry> entries) {
        Map<String, Entry> discriminators = new HashMap<>();
        Map<String, Entry> tags = new HashMap<>();
        for (Entry e : entries.values()) {
            discriminators.put(e.discriminator(), e);
            tags.put(e.tag(), e);
        }
        this.byType = Map.copyOf(entries);
        this.byDiscriminator = Map.copyOf(discriminators);
        this.byTag = Map.copyOf(tags);
    }

    /**
     * Creates a new builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Convenience for registering classes under their default tags.
     */
    public static EventTypeRegistry of(Class<?>... types) {
        Builder b = builder();
        for (Class<?> t : types) {
            b.register(t);
        }
        return b.build();
    }

    /**
     * Names to persist for an event instance's class.
     *
     * @throws EventSerializationException if the class was never registered
     */
    public Entry describe(Class<?> type) {
        Entry entry = byType.get(type);
        if (entry == null) {
            throw new EventSerializationException("event type not registered: " + type.getName());
        }
        return entry;
    }

    /**
     * Resolve the class for a persisted record: by discriminator first, then by tag.
     *
     * @param discriminator persisted discriminator (may be null or blank)
     * @param tag persisted event type tag (may be null or blank)
     * @return the class, or empty if neither resolves
     */
    public Optional<Class<?>> resolve(String discriminator, String tag) {
        if (discriminator != null && !discriminator.isBlank()) {
            Entry e = byDiscriminator.get(discriminator);
            if (e != null) return Optional.of(e.type());
        }
        if (tag != null && !tag.isBlank()) {
            Entry e = byTag.get(tag);
            if (e != null) return Optional.of(e.type());
        }
        return Optional.empty();
    }

    public Collection<Entry> entries() {
        return byType.values();
    }

    /**
     * Builder for {@link EventTypeRegistry}.
     */
    public static final class Builder {
        private final Map<Class<?>, Entry> entries = new LinkedHashMap<>();

        private Builder() {}

        /**
         * Register a class under its simple name.
         */
        public Builder register(Class<?> type) {
            Objects.requireNonNull(type, "type");
            return register(type.getSimpleName(), type);
        }

        /**
         * Register a class under an explicit tag.
         *
         * @throws IllegalArgumentException if the tag is blank or already used by another class
         */
        public Builder register(String tag, Class<?> type) {
            Objects.requireNonNull(type, "type");
            if (tag == null || tag.isBlank()) {
                throw new IllegalArgumentException("tag must not be null or blank");
            }
            for (Entry existing : entries.values()) {
                if (existing.tag().equals(tag) && existing.type() != type) {
                    throw new IllegalArgumentException("tag '" + tag + "' already registered for "
                            + existing.type().getName());
                }
            }
            entries.put(type, new Entry(type, tag, type.getName()));
            return this;
        }

        public Builder registerAll(Iterable<? extends Class<?>> types) {
            for (Class<?> t : types) {
                register(t);
            }
            return this;
        }

        public EventTypeRegistry build() {
            return new EventTypeRegistry(entries);
        }
    }
}
