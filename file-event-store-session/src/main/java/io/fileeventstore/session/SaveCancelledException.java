package io.fileeventstore.session;

import io.fileeventstore.core.StreamId;

import java.util.List;

/**
 * Raised when {@link EventSession#saveChanges(CancellationToken)} is cancelled between
 * commits. Streams committed before cancellation stay committed; the streams in
 * {@link #notAttempted()} still hold their uncommitted changes in the session.
 */
public class SaveCancelledException extends SaveChangesException {

    private final List<StreamId> notAttempted;

    public SaveCancelledException(List<SaveFailure> failures, List<StreamId> notAttempted) {
        super("save cancelled with " + notAttempted.size() + " stream commit(s) not attempted and "
                + failures.size() + " failed", failures);
        this.notAttempted = List.copyOf(notAttempted);
    }

    public List<StreamId> notAttempted() {
        return notAttempted;
    }
}
