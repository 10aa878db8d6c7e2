package io.computehub.license;

import java.util.Objects;

/**
 * A normalized ComputeHub license key.
 *
 * <p>Instances are only created by {@link LicenseKeyCodec}, so the value is always
 * uppercase, trimmed and well-formed. The key itself is the secret: {@link #toString()}
 * returns the masked form so a key dropped into a log line or exception message
 * never leaks.
 *
 * @param value the canonical key, e.g. {@code COMPUTEHUB-AAAA-BBBB-CCCC-DDDD}
 */
public record LicenseKey(String value) {

    public LicenseKey {
        Objects.requireNonNull(value, "value cannot be null");
    }

    /**
     * Display-safe form keeping only the prefix and the last group.
     */
    public String masked() {
        return LicenseKeyCodec.mask(value);
    }

    @Override
    public String toString() {
        return masked();
    }
}
