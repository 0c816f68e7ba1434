package io.fileeventstore.storage;

import io.fileeventstore.core.ConcurrencyException;
import io.fileeventstore.core.EventDecodingException;
import io.fileeventstore.core.EventSerializer;
import io.fileeventstore.core.EventStore;
import io.fileeventstore.core.EventTypeRegistry;
import io.fileeventstore.core.ExpectedVersion;
import io.fileeventstore.core.StoredEvent;
import io.fileeventstore.core.StreamId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * File-based {@link EventStore} writing one file per event.
 *
 * <p>Storage layout:
 * <pre>
 * rootDir/
 *   streams/
 *     {stream-id}/
 *       000001.json   - event at version 1
 *       000002.json   - event at version 2
 * </pre>
 *
 * <p>The current version of a stream is not stored anywhere: it is the highest
 * version among the event files present, so it always matches what is on disk.
 * Every version check lists the stream directory.
 *
 * <p>Each event is written to a {@code .tmp} file first and then hard-linked under its
 * version file name, which fails if the name already exists. When two writers race for
 * the same version slot, only one file can exist; the loser gets a
 * {@link ConcurrencyException}, the same as for a version mismatch. Events written
 * before a failure in the middle of a batch stay on disk.
 *
 * <p>Example usage:
 * <pre>{@code
 * EventTypeRegistry types = EventTypeRegistry.of(HouseCreated.class, HouseRenamed.class);
 * FileEventStore store = FileEventStore.builder(Paths.get("/var/lib/events"))
 *     .types(types)
 *     .build();
 *
 * long v = store.startStream(StreamId.of("h1"), null, List.of(new HouseCreated("h1", "Name")));
 * }</pre>
 */
public final class FileEventStore implements EventStore {

    private static final Logger log = LoggerFactory.getLogger(FileEventStore.class);

    static final String STREAMS_DIR = "streams";

    private final Path rootDir;
    private final Path streamsDir;
    private final EventSerializer serializer;
    private final Clock clock;

    /**
     * Creates a store using the serializer found on the class path.
     *
     * @param rootDir root directory
     * @param types event types the serializer can decode
     */
    public FileEventStore(Path rootDir, EventTypeRegistry types) {
        this(rootDir, ServiceLoaderEventSerializers.load(types), Clock.systemUTC());
    }

    public FileEventStore(Path rootDir, EventSerializer serializer) {
        this(rootDir, serializer, Clock.systemUTC());
    }

    /**
     * @param rootDir root directory; {@code streams/} is created under it
     * @param serializer record encoder/decoder
     * @param clock source of event timestamps
     */
    public FileEventStore(Path rootDir, EventSerializer serializer, Clock clock) {
        this.rootDir = Objects.requireNonNull(rootDir, "rootDir");
        this.serializer = Objects.requireNonNull(serializer, "serializer");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.streamsDir = rootDir.resolve(STREAMS_DIR);
        ensureDirectory(streamsDir);
    }

    /**
     * Creates a new builder for configuring a store.
     */
    public static Builder builder(Path rootDir) {
        return new Builder(rootDir);
    }

    public Path rootDir() {
        return rootDir;
    }

    @Override
    public long appendToStream(StreamId streamId, String streamType, List<?> events, ExpectedVersion expectedVersion) {
        Objects.requireNonNull(streamId, "streamId");
        Objects.requireNonNull(events, "events");
        Objects.requireNonNull(expectedVersion, "expectedVersion");
        List<?> batch = List.copyOf(events);

        Path streamDir = resolveStreamDir(streamId);
        long currentVersion = currentVersion(streamDir);
        if (!expectedVersion.isSatisfiedBy(currentVersion)) {
            throw new ConcurrencyException(streamId.value(), expectedVersion, currentVersion);
        }
        if (batch.isEmpty()) {
            return currentVersion;
        }

        // Encode the whole batch first so an unencodable event fails before anything is durable.
        List<byte[]> records = new ArrayList<>(batch.size());
        long version = currentVersion;
        for (Object event : batch) {
            version++;
            EventTypeRegistry.Entry type = serializer.describe(event);
            StoredEvent stored = new StoredEvent(
                    version,
                    streamId.value(),
                    streamType,
                    type.tag(),
                    type.discriminator(),
                    clock.instant(),
                    event
            );
            records.add(serializer.serialize(stored));
        }

        ensureDirectory(streamDir);
        String ext = serializer.fileExtension();
        version = currentVersion;
        for (byte[] record : records) {
            version++;
            Path file = streamDir.resolve(EventFileNames.encode(version, ext));
            try {
                claim(file, record);
            } catch (FileAlreadyExistsException e) {
                long actual = currentVersion(streamDir);
                log.warn("Write collision on stream {} at version {} (now at {})", streamId, version, actual);
                throw new ConcurrencyException(streamId.value(), expectedVersion, actual, e);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to write " + file, e);
            }
        }

        log.debug("Appended {} event(s) to stream {} ({} -> {})", records.size(), streamId, currentVersion, version);
        return version;
    }

    @Override
    public List<StoredEvent> fetchStream(StreamId streamId) {
        Objects.requireNonNull(streamId, "streamId");
        Path streamDir = resolveStreamDir(streamId);
        List<VersionedFile> files = listEventFiles(streamDir);
        List<StoredEvent> events = new ArrayList<>(files.size());
        for (VersionedFile f : files) {
            byte[] bytes;
            try {
                bytes = Files.readAllBytes(f.path());
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read " + f.path(), e);
            }
            try {
                events.add(serializer.deserialize(bytes));
            } catch (EventDecodingException e) {
                throw new EventDecodingException("Failed to decode version " + f.version()
                        + " of stream " + streamId, e);
            }
        }
        log.debug("Fetched {} event(s) from stream {}", events.size(), streamId);
        return List.copyOf(events);
    }

    @Override
    public long getStreamVersion(StreamId streamId) {
        Objects.requireNonNull(streamId, "streamId");
        return currentVersion(resolveStreamDir(streamId));
    }

    @Override
    public boolean streamExists(StreamId streamId) {
        return getStreamVersion(streamId) > 0;
    }

    /**
     * Writes the record to a temporary file next to the target, then links it under the
     * version file name. The link fails if the name exists, and readers never see a
     * partially written record.
     */
    private static void claim(Path file, byte[] record) throws IOException {
        Path tmp = file.resolveSibling(file.getFileName() + "." + UUID.randomUUID() + ".tmp");
        try {
            Files.write(tmp, record, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            Files.createLink(file, tmp);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    private long currentVersion(Path streamDir) {
        long max = 0;
        for (VersionedFile f : listEventFiles(streamDir)) {
            max = Math.max(max, f.version());
        }
        return max;
    }

    private List<VersionedFile> listEventFiles(Path streamDir) {
        if (!Files.isDirectory(streamDir)) {
            return List.of();
        }
        String ext = serializer.fileExtension();
        List<VersionedFile> out = new ArrayList<>();
        try (Stream<Path> files = Files.list(streamDir)) {
            files.forEach(p -> {
                long v = EventFileNames.decode(p.getFileName().toString(), ext);
                if (v > 0 && Files.isRegularFile(p)) {
                    out.add(new VersionedFile(v, p));
                }
            });
        } catch (NoSuchFileException e) {
            return List.of();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + streamDir, e);
        }
        out.sort(Comparator.comparingLong(VersionedFile::version));
        return out;
    }

    private Path resolveStreamDir(StreamId streamId) {
        return streamsDir.resolve(streamId.value());
    }

    private static void ensureDirectory(Path dir) {
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private record VersionedFile(long version, Path path) {
    }

    /**
     * Builder for {@link FileEventStore}.
     */
    public static final class Builder {
        private final Path rootDir;
        private EventSerializer serializer;
        private EventTypeRegistry types;
        private Clock clock;

        private Builder(Path rootDir) {
            this.rootDir = Objects.requireNonNull(rootDir, "rootDir");
        }

        /**
         * Serializer to use. Takes precedence over {@link #types}.
         */
        public Builder serializer(EventSerializer serializer) {
            this.serializer = serializer;
            return this;
        }

        /**
         * Event types for the class-path serializer, used when no serializer is set.
         */
        public Builder types(EventTypeRegistry types) {
            this.types = types;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * @throws IllegalStateException if neither a serializer nor event types were given
         */
        public FileEventStore build() {
            EventSerializer s = serializer;
            if (s == null) {
                if (types == null) {
                    throw new IllegalStateException("either serializer or types must be set");
                }
                s = ServiceLoaderEventSerializers.load(types);
            }
            return new FileEventStore(rootDir, s, clock != null ? clock : Clock.systemUTC());
        }
    }
}
