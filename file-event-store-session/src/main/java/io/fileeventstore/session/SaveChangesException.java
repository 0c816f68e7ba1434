package io.fileeventstore.session;

import io.fileeventstore.core.EventStoreException;

import java.util.List;

/**
 * Raised by {@link EventSession#saveChanges()} when one or more stream commits failed.
 *
 * <p>Commits that succeeded in the same call stay committed. Every individual cause
 * is available from {@link #failures()} and is also attached as a suppressed exception.
 */
public class SaveChangesException extends EventStoreException {

    private final List<SaveFailure> failures;

    public SaveChangesException(List<SaveFailure> failures) {
        this(failures.size() + " stream commit(s) failed: " + failures, failures);
    }

    protected SaveChangesException(String message, List<SaveFailure> failures) {
        super(message);
        this.failures = List.copyOf(failures);
        for (SaveFailure f : this.failures) {
            addSuppressed(f.cause());
        }
    }

    public List<SaveFailure> failures() {
        return failures;
    }
}
