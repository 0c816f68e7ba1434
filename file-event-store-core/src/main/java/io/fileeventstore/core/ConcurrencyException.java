package io.fileeventstore.core;

import java.util.Objects;

/**
 * Raised when an append's {@link ExpectedVersion} does not hold against the
 * version durably present in the stream, or when another writer claimed the
 * same version slot first.
 */
public class ConcurrencyException extends EventStoreException {

    private final String streamId;
    private final ExpectedVersion expected;
    private final long actualVersion;

    public ConcurrencyException(String streamId, ExpectedVersion expected, long actualVersion) {
        super("Stream '" + streamId + "' expected " + expected + " but was at version " + actualVersion);
        this.streamId = Objects.requireNonNull(streamId, "streamId");
        this.expected = Objects.requireNonNull(expected, "expected");
        this.actualVersion = actualVersion;
    }

    public ConcurrencyException(String streamId, ExpectedVersion expected, long actualVersion, Throwable cause) {
        super("Stream '" + streamId + "' expected " + expected + " but another writer moved it to version "
                + actualVersion, cause);
        this.streamId = Objects.requireNonNull(streamId, "streamId");
        this.expected = Objects.requireNonNull(expected, "expected");
        this.actualVersion = actualVersion;
    }

    public String streamId() {
        return streamId;
    }

    public ExpectedVersion expected() {
        return expected;
    }

    public long actualVersion() {
        return actualVersion;
    }
}
