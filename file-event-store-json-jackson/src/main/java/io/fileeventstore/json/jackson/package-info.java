/**
 * Jackson-backed {@link io.fileeventstore.core.EventSerializer}.
 *
 * <p>Registered through {@link java.util.ServiceLoader} so stores pick it up when no
 * serializer is configured explicitly.
 */
package io.fileeventstore.json.jackson;
