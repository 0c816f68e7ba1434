package io.fileeventstore.session;

import io.fileeventstore.core.EventStore;
import io.fileeventstore.core.ExpectedVersion;
import io.fileeventstore.core.StoredEvent;
import io.fileeventstore.core.StreamId;

import java.util.ArrayList;
import java.util.List;

/**
 * Delegating store that records every append it forwards.
 */
final class RecordingEventStore implements EventStore {

    record Append(StreamId streamId, String streamType, int eventCount, ExpectedVersion expectedVersion) {}

    private final EventStore delegate;
    private final List<Append> appends = new ArrayList<>();
    private int fetches;

    RecordingEventStore(EventStore delegate) {
        this.delegate = delegate;
    }

    List<Append> appends() {
        return appends;
    }

    int fetches() {
        return fetches;
    }

    @Override
    public long appendToStream(StreamId streamId, String streamType, List<?> events, ExpectedVersion expectedVersion) {
        appends.add(new Append(streamId, streamType, events.size(), expectedVersion));
        return delegate.appendToStream(streamId, streamType, events, expectedVersion);
    }

    @Override
    public List<StoredEvent> fetchStream(StreamId streamId) {
        fetches++;
        return delegate.fetchStream(streamId);
    }

    @Override
    public long getStreamVersion(StreamId streamId) {
        return delegate.getStreamVersion(streamId);
    }

    @Override
    public boolean streamExists(StreamId streamId) {
        return delegate.streamExists(streamId);
    }
}
