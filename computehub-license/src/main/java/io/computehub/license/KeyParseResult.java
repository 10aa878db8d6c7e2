package io.computehub.license;

/**
 * Result of normalizing user input into a {@link LicenseKey}.
 *
 * @param key the normalized key, or null if the input was malformed
 * @param error user-facing message if the input was malformed
 */
public record KeyParseResult(
    LicenseKey key,
    String error
) {

    /**
     * Well-formed input.
     */
    public static KeyParseResult valid(LicenseKey key) {
        return new KeyParseResult(key, null);
    }

    /**
     * Malformed input; the caller should prompt for the key again.
     */
    public static KeyParseResult invalid(String error) {
        return new KeyParseResult(null, error);
    }

    public boolean isValid() {
        return key != null;
    }
}
