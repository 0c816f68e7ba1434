package io.fileeventstore.core;

/**
 * Optimistic concurrency predicate evaluated against a stream's current version
 * (0 when the stream has never been written).
 */
public sealed interface ExpectedVersion permits ExpectedVersion.NoStream, ExpectedVersion.Any, ExpectedVersion.Exactly {

    /**
     * The stream must not exist yet.
     */
    static ExpectedVersion none() {
        return NoStream.INSTANCE;
    }

    /**
     * Skip the version check.
     */
    static ExpectedVersion any() {
        return Any.INSTANCE;
    }

    /**
     * The stream must currently be at exactly {@code version}.
     */
    static ExpectedVersion exactly(long version) {
        return new Exactly(version);
    }

    boolean isSatisfiedBy(long currentVersion);

    record NoStream() implements ExpectedVersion {
        private static final NoStream INSTANCE = new NoStream();

        @Override
        public boolean isSatisfiedBy(long currentVersion) {
            return currentVersion == 0;
        }

        @Override
        public String toString() {
            return "no stream";
        }
    }

    record Any() implements ExpectedVersion {
        private static final Any INSTANCE = new Any();

        @Override
        public boolean isSatisfiedBy(long currentVersion) {
            return true;
        }

        @Override
        public String toString() {
            return "any version";
        }
    }

    record Exactly(long version) implements ExpectedVersion {
        public Exactly {
            if (version < 0) {
                throw new IllegalArgumentException("expected version must be >= 0");
            }
        }

        @Override
        public boolean isSatisfiedBy(long currentVersion) {
            return currentVersion == version;
        }

        @Override
        public String toString() {
            return "version " + version;
        }
    }
}
