package io.fileeventstore.session;

import io.fileeventstore.aggregate.AggregateFactories;
import io.fileeventstore.core.EventStore;

import java.util.Objects;

/**
 * {@link EventSessionFactory} producing {@link DefaultEventSession}s over one store.
 */
public final class DefaultEventSessionFactory implements EventSessionFactory {

    private final EventStore store;
    private final AggregateFactories factories;

    public DefaultEventSessionFactory(EventStore store, AggregateFactories factories) {
        this.store = Objects.requireNonNull(store, "store");
        this.factories = Objects.requireNonNull(factories, "factories");
    }

    @Override
    public EventSession openSession() {
        return new DefaultEventSession(store, factories);
    }
}
