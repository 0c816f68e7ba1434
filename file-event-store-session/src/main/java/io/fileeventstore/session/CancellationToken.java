package io.fileeventstore.session;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal polled by {@link EventSession#saveChanges(CancellationToken)}
 * between per-stream commits.
 */
@FunctionalInterface
public interface CancellationToken {

    boolean isCancellationRequested();

    /**
     * A token that is never cancelled.
     */
    static CancellationToken none() {
        return () -> false;
    }

    /**
     * A token cancelled when the calling thread is interrupted.
     */
    static CancellationToken onInterrupt() {
        return () -> Thread.currentThread().isInterrupted();
    }

    /**
     * Creates a token that can be cancelled through {@link Source#cancel()}.
     */
    static Source source() {
        return new Source();
    }

    /**
     * Owner side of a cancellable token.
     */
    final class Source implements CancellationToken {
        private final AtomicBoolean cancelled = new AtomicBoolean();

        private Source() {}

        public void cancel() {
            cancelled.set(true);
        }

        @Override
        public boolean isCancellationRequested() {
            return cancelled.get();
        }
    }
}
