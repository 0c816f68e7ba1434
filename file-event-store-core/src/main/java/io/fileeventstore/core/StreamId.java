package io.fileeventstore.core;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Validated stream identifier.
 *
 * <p>A stream id is used verbatim as a directory name, so validation is strict:
 * <ul>
 *   <li>not null or blank, at most {@value #MAX_LENGTH} characters</li>
 *   <li>no {@code ..} and no file-system reserved or control characters</li>
 *   <li>no leading or trailing dot or space</li>
 *   <li>alphanumeric with hyphens, underscores or dots in between</li>
 * </ul>
 *
 * <p>Validation happens at construction, before any I/O.
 */
public final class StreamId {

    public static final int MAX_LENGTH = 200;

    private static final Pattern VALID = Pattern.compile("^[a-zA-Z0-9]([a-zA-Z0-9_.\\-]*[a-zA-Z0-9])?$");

    private final String value;

    private StreamId(String value) {
        this.value = validate(value);
    }

    /**
     * Create a stream id, validating it.
     *
     * @param value raw id
     * @return the validated id
     * @throws InvalidIdentifierException if the id is malformed
     */
    public static StreamId of(String value) {
        return new StreamId(value);
    }

    /**
     * Create a stream id, returning empty instead of throwing when invalid.
     */
    public static Optional<StreamId> tryOf(String value) {
        try {
            return Optional.of(new StreamId(value));
        } catch (InvalidIdentifierException e) {
            return Optional.empty();
        }
    }

    public String value() {
        return value;
    }

    private static String validate(String v) {
        Identifiers.requireNotBlank(v, "stream id");
        if (v.length() > MAX_LENGTH) {
            throw new InvalidIdentifierException("stream id must not exceed " + MAX_LENGTH + " characters", v);
        }
        Identifiers.requireNoTraversal(v, "stream id");
        Identifiers.requireNoReservedChars(v, "stream id");
        if (v.startsWith(".") || v.endsWith(".") || v.startsWith(" ") || v.endsWith(" ")) {
            throw new InvalidIdentifierException("stream id must not start or end with a dot or space", v);
        }
        if (!VALID.matcher(v).matches()) {
            throw new InvalidIdentifierException(
                    "stream id must be alphanumeric with hyphens, underscores or dots", v);
        }
        return v;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (!(other instanceof StreamId)) return false;
        return value.equals(((StreamId) other).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
