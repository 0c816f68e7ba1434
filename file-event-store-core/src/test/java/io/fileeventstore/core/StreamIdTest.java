package io.fileeventstore.core;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StreamIdTest {

    @ParameterizedTest
    @ValueSource(strings = {"h1", "a", "house-42", "order_7.v2", "A-b_C.d"})
    void acceptsAlphanumericWithSeparators(String raw) {
        assertThat(StreamId.of(raw).value()).isEqualTo(raw);
    }

    @Test
    void rejectsParentDirectorySegment() {
        assertThatThrownBy(() -> StreamId.of("../x"))
                .isInstanceOf(InvalidIdentifierException.class)
                .hasMessageContaining("..");
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   "})
    void rejectsBlank(String raw) {
        assertThatThrownBy(() -> StreamId.of(raw)).isInstanceOf(InvalidIdentifierException.class);
    }

    @Test
    void rejectsNull() {
        assertThatThrownBy(() -> StreamId.of(null)).isInstanceOf(InvalidIdentifierException.class);
    }

    @Test
    void enforcesLengthLimit() {
        assertThat(StreamId.of("a".repeat(200)).value()).hasSize(200);
        assertThatThrownBy(() -> StreamId.of("a".repeat(201)))
                .isInstanceOf(InvalidIdentifierException.class)
                .hasMessageContaining("200");
    }

    @ParameterizedTest
    @ValueSource(strings = {"a/b", "a\\b", "a:b", "a*b", "a?b", "a\"b", "a<b", "a>b", "a|b", "a\u0000b"})
    void rejectsReservedCharacters(String raw) {
        assertThatThrownBy(() -> StreamId.of(raw))
                .isInstanceOf(InvalidIdentifierException.class)
                .hasMessageContaining("forbidden character");
    }

    @ParameterizedTest
    @ValueSource(strings = {".hidden", "trailing.", " lead", "trail "})
    void rejectsBadBoundaryCharacters(String raw) {
        assertThatThrownBy(() -> StreamId.of(raw))
                .isInstanceOf(InvalidIdentifierException.class)
                .hasMessageContaining("start or end");
    }

    @ParameterizedTest
    @ValueSource(strings = {"-start", "end_", "with space", "café"})
    void rejectsOtherPatternViolations(String raw) {
        assertThatThrownBy(() -> StreamId.of(raw))
                .isInstanceOf(InvalidIdentifierException.class)
                .hasMessageContaining("alphanumeric");
    }

    @Test
    void exposesRejectedValue() {
        assertThatThrownBy(() -> StreamId.of("a/b"))
                .isInstanceOfSatisfying(InvalidIdentifierException.class,
                        e -> assertThat(e.rejectedValue()).isEqualTo("a/b"));
    }

    @Test
    void tryOfReturnsEmptyInsteadOfThrowing() {
        assertThat(StreamId.tryOf("../x")).isEmpty();
        assertThat(StreamId.tryOf("ok-1")).contains(StreamId.of("ok-1"));
    }

    @Test
    void valueEquality() {
        assertThat(StreamId.of("s1")).isEqualTo(StreamId.of("s1")).hasSameHashCodeAs(StreamId.of("s1"));
        assertThat(StreamId.of("s1")).isNotEqualTo(StreamId.of("s2"));
        assertThat(StreamId.of("s1")).hasToString("s1");
    }
}
