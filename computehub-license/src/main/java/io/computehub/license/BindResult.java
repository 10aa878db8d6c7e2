package io.computehub.license;

import java.time.Instant;

/**
 * Result of {@link LicenseAuthority#bind}.
 *
 * @param outcome what the license server decided
 * @param tier the tier the key was issued for (null unless {@code OK})
 * @param activatedAt when the server first bound the key to this installation (may be null)
 * @param message server-provided detail, for logging (may be null)
 */
public record BindResult(
    BindOutcome outcome,
    Tier tier,
    Instant activatedAt,
    String message
) {

    public static BindResult ok(Tier tier, Instant activatedAt) {
        return new BindResult(BindOutcome.OK, tier, activatedAt, null);
    }

    public static BindResult conflict(String message) {
        return new BindResult(BindOutcome.CONFLICT, null, null, message);
    }

    public static BindResult invalid(String message) {
        return new BindResult(BindOutcome.INVALID, null, null, message);
    }
}
