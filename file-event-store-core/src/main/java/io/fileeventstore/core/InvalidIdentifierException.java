package io.fileeventstore.core;

/**
 * Raised when a stream or aggregate identifier is malformed (empty, too long,
 * contains a traversal sequence or a forbidden character).
 */
public class InvalidIdentifierException extends EventStoreException {

    private final String rejectedValue;

    public InvalidIdentifierException(String message, String rejectedValue) {
        super(message);
        this.rejectedValue = rejectedValue;
    }

    public String rejectedValue() {
        return rejectedValue;
    }
}
