package io.fileeventstore.storage;

import io.fileeventstore.core.EventSerializer;
import io.fileeventstore.core.EventSerializerProvider;
import io.fileeventstore.core.EventTypeRegistry;

import java.util.Iterator;
import java.util.Objects;
import java.util.ServiceLoader;

/**
 * Finds an {@link EventSerializer} through {@link java.util.ServiceLoader}.
 *
 * <p>The first {@link EventSerializerProvider} on the class path wins.
 */
public final class ServiceLoaderEventSerializers {

    private ServiceLoaderEventSerializers() {}

    public static EventSerializer load(EventTypeRegistry registry) {
        return load(registry, Thread.currentThread().getContextClassLoader());
    }

    /**
     * @throws IllegalStateException if no provider is installed
     */
    public static EventSerializer load(EventTypeRegistry registry, ClassLoader cl) {
        Objects.requireNonNull(registry, "registry");
        Objects.requireNonNull(cl, "cl");
        Iterator<EventSerializerProvider> it = ServiceLoader.load(EventSerializerProvider.class, cl).iterator();
        if (!it.hasNext()) {
            throw new IllegalStateException("No EventSerializerProvider found on the class path; "
                    + "add file-event-store-json-jackson or pass a serializer explicitly");
        }
        return it.next().create(registry);
    }
}
