package io.fileeventstore.aggregate;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Creates empty aggregate instances by kind, for replay and for new aggregates.
 *
 * <pre>{@code
 * AggregateFactories factories = AggregateFactories.builder()
 *     .register(House.class, House::new)
 *     .build();
 * }</pre>
 */
public final class AggregateFactories {

    private final Map<Class<?>, Supplier<?>> factories;

    private AggregateFactories(Map<Class<?>, Supplier<?>> factories) {
        this.factories = Map.copyOf(factories);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Factory for one kind.
     *
     * @throws IllegalArgumentException if no factory was registered for the kind
     */
    @SuppressWarnings("unchecked")
    public <T extends Aggregate<?>> Supplier<? extends T> factoryFor(Class<T> kind) {
        Objects.requireNonNull(kind, "kind");
        Supplier<?> factory = factories.get(kind);
        if (factory == null) {
            throw new IllegalArgumentException("no factory registered for aggregate kind " + kind.getName());
        }
        // register() only accepts a Supplier<? extends T> for Class<T>
        return (Supplier<? extends T>) factory;
    }

    /**
     * @throws IllegalArgumentException if no factory was registered for the kind
     */
    public <T extends Aggregate<?>> T create(Class<T> kind) {
        T aggregate = factoryFor(kind).get();
        return Objects.requireNonNull(aggregate, () -> "factory for " + kind.getName() + " returned null");
    }

    public boolean supports(Class<?> kind) {
        return factories.containsKey(kind);
    }

    /**
     * Builder for {@link AggregateFactories}.
     */
    public static final class Builder {
        private final Map<Class<?>, Supplier<?>> factories = new LinkedHashMap<>();

        private Builder() {}

        public <T extends Aggregate<?>> Builder register(Class<T> kind, Supplier<? extends T> factory) {
            factories.put(Objects.requireNonNull(kind, "kind"), Objects.requireNonNull(factory, "factory"));
            return this;
        }

        public AggregateFactories build() {
            return new AggregateFactories(factories);
        }
    }
}
