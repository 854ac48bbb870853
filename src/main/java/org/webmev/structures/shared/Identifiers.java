package org.webmev.structures.shared;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Normalizes sample/feature style identifiers.
 *
 * <p>Identifiers end up in files consumed by third-party tools (R, for instance), so only
 * ASCII letters, digits, dots, dashes and underscores are allowed and the first character
 * must be a letter.
 */
public final class Identifiers {
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z][A-Za-z0-9._-]*");
    private static final Pattern UUID_PATTERN = Pattern.compile(
        "[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}");
    private static final Pattern COMPACT_UUID_PATTERN = Pattern.compile("[0-9a-fA-F]{32}");

    private Identifiers() {}

    /**
     * Trims the value and replaces inner spaces with underscores. Empty when the result
     * does not match the identifier grammar or the value is not a string.
     */
    public static Optional<String> normalize(Object raw) {
        if (!(raw instanceof String str)) {
            return Optional.empty();
        }
        String name = str.strip().replace(' ', '_');
        if (IDENTIFIER.matcher(name).matches()) {
            return Optional.of(name);
        }
        return Optional.empty();
    }

    public static boolean isValid(String candidate) {
        return candidate != null && IDENTIFIER.matcher(candidate).matches();
    }

    public static boolean isUuid(String candidate) {
        return candidate != null && UUID_PATTERN.matcher(candidate).matches();
    }

    /**
     * Canonical lower-case, hyphenated form of a UUID given hyphenated or as 32 hex digits.
     */
    public static Optional<String> canonicalUuid(Object raw) {
        if (!(raw instanceof String str)) {
            return Optional.empty();
        }
        String trimmed = str.strip();
        if (COMPACT_UUID_PATTERN.matcher(trimmed).matches()) {
            trimmed = trimmed.substring(0, 8) + "-" + trimmed.substring(8, 12) + "-" + trimmed.substring(12, 16)
                + "-" + trimmed.substring(16, 20) + "-" + trimmed.substring(20);
        }
        if (!isUuid(trimmed)) {
            return Optional.empty();
        }
        return Optional.of(trimmed.toLowerCase(Locale.ROOT));
    }
}
