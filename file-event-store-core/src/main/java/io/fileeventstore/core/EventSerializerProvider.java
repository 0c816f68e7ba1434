package io.fileeventstore.core;

/**
 * {@link java.util.ServiceLoader} entry point for serializer modules.
 *
 * <p>Lets a store find a serializer on the class path when none is configured.
 */
public interface EventSerializerProvider {

    /**
     * Create a serializer bound to the given type registry.
     */
    EventSerializer create(EventTypeRegistry registry);
}
