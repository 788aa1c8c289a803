package dev.etfaggregator.store;

import java.nio.file.Path;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Validation of collection and kind names before they touch the filesystem.
 */
public final class DatasetNames {

    public static final int MAX_LENGTH = 100;

    private static final Pattern SAFE_NAME = Pattern.compile("^[a-zA-Z0-9][a-zA-Z0-9_ -]*$");

    // Kinds that would collide with another kind's segment or manifest file name
    private static final Pattern RESERVED_KIND = Pattern.compile(".*_(part\\d+|metadata)$");

    private DatasetNames() {
    }

    /**
     * Validate a raw name against the allow-list and return its trimmed, lower-cased form.
     *
     * @throws InvalidDatasetNameException if the name is empty, too long, contains a path
     *                                     separator or {@code ..}, or has disallowed characters
     */
    public static String sanitize(String raw) {
        if (raw == null || raw.isEmpty()) {
            throw new InvalidDatasetNameException(raw, "must not be empty");
        }
        if (raw.length() > MAX_LENGTH) {
            throw new InvalidDatasetNameException(raw, "must be at most " + MAX_LENGTH + " characters");
        }
        if (raw.contains("..") || raw.contains("/") || raw.contains("\\")) {
            throw new InvalidDatasetNameException(raw, "path separators and '..' are not allowed");
        }
        if (!SAFE_NAME.matcher(raw).matches()) {
            throw new InvalidDatasetNameException(raw, "contains disallowed characters");
        }
        return raw.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Sanitize a kind and reject the suffixes used by segment and manifest file names.
     */
    public static String sanitizeKind(String raw) {
        String kind = sanitize(raw);
        if (RESERVED_KIND.matcher(kind).matches()) {
            throw new InvalidDatasetNameException(raw, "'_partN' and '_metadata' suffixes are reserved");
        }
        return kind;
    }

    /**
     * Join a sanitized name onto {@code root} and check that the result stays below it.
     */
    public static Path resolveWithin(Path root, String sanitized) {
        Path base = root.toAbsolutePath().normalize();
        Path resolved = base.resolve(sanitized).normalize();
        if (!resolved.startsWith(base) || resolved.equals(base)) {
            throw new InvalidDatasetNameException(sanitized, "resolves outside of the storage root");
        }
        return resolved;
    }
}
