package io.computehub.license;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Parses and masks license keys.
 *
 * <p>Canonical format: {@code PREFIX-XXXX-XXXX-XXXX-XXXX} where each X is an
 * uppercase letter or digit. Input is trimmed and uppercased before matching,
 * so {@code " computehub-aaaa-bbbb-cccc-dddd "} normalizes to the same key as
 * its uppercase form.
 *
 * <p>Nothing here throws on bad input; malformed keys come back as
 * {@link KeyParseResult#invalid(String)}.
 */
public final class LicenseKeyCodec {

    /**
     * Prefix carried by every key sold for ComputeHub.
     */
    public static final String DEFAULT_PREFIX = "COMPUTEHUB";

    /**
     * Codec for the standard ComputeHub prefix.
     */
    public static final LicenseKeyCodec DEFAULT = new LicenseKeyCodec(DEFAULT_PREFIX);

    private static final int GROUPS = 4;
    private static final int GROUP_LENGTH = 4;
    private static final String MASKED_FALLBACK = "****-****-****-****";

    private final String prefix;
    private final Pattern pattern;

    public LicenseKeyCodec(String prefix) {
        Objects.requireNonNull(prefix, "prefix cannot be null");
        if (!prefix.matches("[A-Z0-9]+")) {
            throw new IllegalArgumentException("prefix must be uppercase alphanumeric: " + prefix);
        }
        this.prefix = prefix;
        this.pattern = Pattern.compile(
            "^" + Pattern.quote(prefix) + "(-[A-Z0-9]{" + GROUP_LENGTH + "}){" + GROUPS + "}$"
        );
    }

    public String prefix() {
        return prefix;
    }

    /**
     * Normalize raw user input into a canonical key.
     *
     * @param raw text as typed or pasted by the user (may be null)
     * @return the parsed key, or an invalid result with a message to show the user
     */
    public KeyParseResult normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            return KeyParseResult.invalid("Please enter a license key");
        }

        String candidate = raw.trim().toUpperCase(Locale.ROOT);
        if (!pattern.matcher(candidate).matches()) {
            return KeyParseResult.invalid(
                "Invalid license key format. Expected format: " + expectedFormat()
            );
        }
        return KeyParseResult.valid(new LicenseKey(candidate));
    }

    /**
     * Human-readable template, e.g. {@code COMPUTEHUB-XXXX-XXXX-XXXX-XXXX}.
     */
    public String expectedFormat() {
        return prefix + "-XXXX".repeat(GROUPS);
    }

    /**
     * Mask a key for display: {@code COMPUTEHUB-A1B2-C3D4-E5F6-G7H8} becomes
     * {@code COMPUTEHUB-****-****-****-G7H8}.
     *
     * <p>Works for any prefix. Anything that is not hyphen-separated into a prefix
     * and four groups masks to {@code ****-****-****-****}.
     */
    public static String mask(String key) {
        if (key == null) {
            return MASKED_FALLBACK;
        }
        String[] parts = key.trim().split("-");
        if (parts.length != GROUPS + 1) {
            return MASKED_FALLBACK;
        }
        StringBuilder masked = new StringBuilder(parts[0]);
        for (int i = 1; i < GROUPS; i++) {
            masked.append('-').append("*".repeat(parts[i].length()));
        }
        masked.append('-').append(parts[GROUPS]);
        return masked.toString();
    }
}
