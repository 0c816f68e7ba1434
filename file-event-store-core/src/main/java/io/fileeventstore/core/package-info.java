/**
 * Storage-neutral core for the file event store.
 *
 * <p>This module contains only:
 * <ul>
 *   <li>Validated identifiers ({@link io.fileeventstore.core.StreamId}, {@link io.fileeventstore.core.AggregateId})</li>
 *   <li>The stored record model and the {@link io.fileeventstore.core.ExpectedVersion} predicate</li>
 *   <li>The {@link io.fileeventstore.core.EventStore} and {@link io.fileeventstore.core.EventSerializer} SPIs</li>
 *   <li>The exception hierarchy rooted at {@link io.fileeventstore.core.EventStoreException}</li>
 * </ul>
 *
 * <p>Storage backends, serializers and the session layer live in other modules.
 */
package io.fileeventstore.core;
