package io.fileeventstore.aggregate;

import io.fileeventstore.core.AggregateId;
import io.fileeventstore.core.ConcurrencyException;
import io.fileeventstore.core.ExpectedVersion;
import io.fileeventstore.core.InvalidIdentifierException;
import io.fileeventstore.core.StoredEvent;
import io.fileeventstore.core.StreamId;
import io.fileeventstore.json.jackson.JacksonEventSerializer;
import io.fileeventstore.storage.InMemoryEventStore;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AggregateRepositoryTest {

    private final InMemoryEventStore store = new InMemoryEventStore(new JacksonEventSerializer(House.EVENTS));
    private final AggregateRepository<House> houses = new AggregateRepository<>(store, House.class, House::new);

    @Test
    void savesNewAggregateAndLoadsItBack() {
        House house = House.create("h1", "Name");
        houses.save(house);

        assertThat(house.version()).isEqualTo(1);
        assertThat(house.hasUncommittedEvents()).isFalse();
        assertThat(store.fetchStream(StreamId.of("house-h1")))
                .extracting(StoredEvent::streamType).containsExactly("House");

        House loaded = houses.load(AggregateId.of("h1"));
        assertThat(loaded.name()).isEqualTo("Name");
        assertThat(loaded.version()).isEqualTo(1);
    }

    @Test
    void saveExpectsLoadedVersion() {
        houses.save(House.create("h1", "Name"));
        House first = houses.load(AggregateId.of("h1"));
        House second = houses.load(AggregateId.of("h1"));

        first.rename("A");
        houses.save(first);
        second.rename("B");

        assertThatThrownBy(() -> houses.save(second)).isInstanceOf(ConcurrencyException.class);
        assertThat(houses.load(AggregateId.of("h1")).name()).isEqualTo("A");
    }

    @Test
    void creatingTwiceFails() {
        houses.save(House.create("h1", "Name"));

        assertThatThrownBy(() -> houses.save(House.create("h1", "Other")))
                .isInstanceOfSatisfying(ConcurrencyException.class,
                        e -> assertThat(e.expected()).isEqualTo(ExpectedVersion.none()));
    }

    @Test
    void saveWithoutChangesDoesNothing() {
        houses.save(new House());

        assertThat(store.streamExists(StreamId.of("house-h1"))).isFalse();
    }

    @Test
    void saveWithoutIdFails() {
        House house = new House();
        house.rename("orphan");

        assertThatThrownBy(() -> houses.save(house)).isInstanceOf(InvalidIdentifierException.class);
    }

    @Test
    void missingAggregateLoadsAsNullOrFresh() {
        assertThat(houses.load(AggregateId.of("nope"))).isNull();

        House fresh = houses.loadOrCreate(AggregateId.of("nope"));
        assertThat(fresh.version()).isZero();
        assertThat(fresh.id()).isNull();
    }

    @Test
    void streamIdFunctionIsPluggable() {
        AggregateRepository<House> custom = new AggregateRepository<>(store, House.class, House::new,
                id -> StreamId.of("houses_" + id.value()));

        custom.save(House.create("h7", "Name"));

        assertThat(store.streamExists(StreamId.of("houses_h7"))).isTrue();
        assertThat(custom.load(AggregateId.of("h7")).name()).isEqualTo("Name");
    }
}
