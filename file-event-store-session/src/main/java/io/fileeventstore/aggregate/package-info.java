/**
 * Event-sourced aggregate base and a session-less repository.
 */
package io.fileeventstore.aggregate;
