package io.fileeventstore.core;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AggregateIdTest {

    @Test
    void hasNoLengthCap() {
        assertThat(AggregateId.of("x".repeat(500)).value()).hasSize(500);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", " ", "../etc", "a..b", "a/b", "a\\b", "a:b"})
    void rejectsMalformedIds(String raw) {
        assertThatThrownBy(() -> AggregateId.of(raw)).isInstanceOf(InvalidIdentifierException.class);
    }

    @Test
    void valueEquality() {
        assertThat(AggregateId.of("a1")).isEqualTo(AggregateId.of("a1"));
        assertThat(AggregateId.of("a1")).isNotEqualTo(AggregateId.of("a2"));
    }
}
