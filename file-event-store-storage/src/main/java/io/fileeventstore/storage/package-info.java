/**
 * Stream store implementations.
 *
 * <p>Contains:
 * <ul>
 *   <li>{@link io.fileeventstore.storage.FileEventStore} (one file per event, version derived from file names)</li>
 *   <li>{@link io.fileeventstore.storage.InMemoryEventStore} (reference store for tests and examples)</li>
 * </ul>
 */
package io.fileeventstore.storage;
