/**
 * Unit of work over an {@link io.fileeventstore.core.EventStore}.
 *
 * <p>A session keeps an identity map of loaded aggregates and a queue of raw stream
 * operations, and commits them with {@link io.fileeventstore.session.EventSession#saveChanges()}.
 * Each stream is committed on its own: there is no cross-stream atomicity, and
 * failures are reported together in a {@link io.fileeventstore.session.SaveChangesException}.
 */
package io.fileeventstore.session;
