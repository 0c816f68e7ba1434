package io.fileeventstore.json.jackson;

import io.fileeventstore.core.EventSerializer;
import io.fileeventstore.core.EventSerializerProvider;
import io.fileeventstore.core.EventTypeRegistry;

/**
 * ServiceLoader provider for {@link JacksonEventSerializer}.
 */
public final class JacksonEventSerializerProvider implements EventSerializerProvider {

    @Override
    public EventSerializer create(EventTypeRegistry registry) {
        return new JacksonEventSerializer(registry);
    }
}
