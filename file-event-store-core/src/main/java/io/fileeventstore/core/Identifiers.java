package io.fileeventstore.core;

/**
 * Shared checks for identifiers that end up as file-system path segments.
 */
final class Identifiers {

    static final String RESERVED_CHARS = "/\\:*?\"<>|";

    private Identifiers() {}

    static void requireNotBlank(String value, String what) {
        if (value == null || value.isBlank()) {
            throw new InvalidIdentifierException(what + " must not be null or blank", value);
        }
    }

    static void requireNoTraversal(String value, String what) {
        if (value.contains("..")) {
            throw new InvalidIdentifierException(what + " must not contain '..' (path traversal)", value);
        }
    }

    static void requireNoReservedChars(String value, String what) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (Character.isISOControl(c) || RESERVED_CHARS.indexOf(c) >= 0) {
                throw new InvalidIdentifierException(what + " contains forbidden character at index " + i, value);
            }
        }
    }
}
