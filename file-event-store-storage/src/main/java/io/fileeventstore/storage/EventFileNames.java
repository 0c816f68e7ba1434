package io.fileeventstore.storage;

/**
 * Encodes stream versions as zero-padded file names so that lexicographic order
 * matches numeric order up to {@value #WIDTH} digits. Wider versions still parse.
 */
final class EventFileNames {
    static final int WIDTH = 6;

    private EventFileNames() {}

    static String encode(long version, String extension) {
        if (version < 1) throw new IllegalArgumentException("version must be >= 1");
        String s = Long.toString(version);
        String padded = s.length() >= WIDTH ? s : "0".repeat(WIDTH - s.length()) + s;
        return padded + "." + extension;
    }

    /**
     * Only names {@link #encode} would produce are accepted: exactly {@value #WIDTH} digits,
     * or more digits without a leading zero. {@code 1.json} and {@code 0000001.json} are not event files.
     *
     * @return the version, or -1 if the name is not an event file with this extension
     */
    static long decode(String fileName, String extension) {
        String suffix = "." + extension;
        if (fileName == null || !fileName.endsWith(suffix)) return -1;
        String digits = fileName.substring(0, fileName.length() - suffix.length());
        if (digits.length() < WIDTH || digits.length() > 18) return -1;
        if (digits.length() > WIDTH && digits.charAt(0) == '0') return -1;
        for (int i = 0; i < digits.length(); i++) {
            char c = digits.charAt(i);
            if (c < '0' || c > '9') return -1;
        }
        long v = Long.parseLong(digits);
        return v >= 1 ? v : -1;
    }
}
