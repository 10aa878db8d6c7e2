package io.computehub.license;

import java.time.Instant;

/**
 * Entitlement state as shown to callers (feature gates, settings page, CLI).
 *
 * <p>Never carries the plaintext key.
 *
 * @param entitled whether Pro features are unlocked
 * @param tier the active tier ({@link Tier#FREE} when not entitled)
 * @param maskedKey masked license key, or null if nothing is activated
 * @param activatedAt when the key was activated on this installation (may be null)
 * @param lastVerifiedAt last confirmation from the license server (may be null)
 * @param cached true when entitlement rests on a cached verification ("offline mode")
 * @param reason why the state is what it is
 */
public record StatusView(
    boolean entitled,
    Tier tier,
    String maskedKey,
    Instant activatedAt,
    Instant lastVerifiedAt,
    boolean cached,
    Reason reason
) {

    public enum Reason {
        ACTIVE,
        NOT_ACTIVATED,
        VERIFICATION_REQUIRED,
        REVOKED,
        STORE_UNAVAILABLE
    }

    /**
     * No license on this installation.
     */
    public static StatusView notActivated() {
        return inactive(Reason.NOT_ACTIVATED);
    }

    /**
     * Not entitled, with no record details to show.
     */
    public static StatusView inactive(Reason reason) {
        return new StatusView(false, Tier.FREE, null, null, null, false, reason);
    }

    /**
     * Entitled through {@code record}.
     */
    public static StatusView active(ActivationRecord record) {
        return new StatusView(
            true, record.tier(), record.maskedKey(),
            record.activatedAt(), record.lastVerifiedAt(), record.isCached(), Reason.ACTIVE
        );
    }

    /**
     * A record exists but its last verification is too old to trust.
     */
    public static StatusView verificationRequired(ActivationRecord record) {
        return new StatusView(
            false, Tier.FREE, record.maskedKey(),
            record.activatedAt(), record.lastVerifiedAt(), record.isCached(), Reason.VERIFICATION_REQUIRED
        );
    }

    /**
     * View of a verification outcome.
     */
    public static StatusView of(Verdict verdict) {
        return switch (verdict.kind()) {
            case VERIFIED, FALLBACK_ENTITLED -> active(verdict.record());
            case FALLBACK_DENIED -> verificationRequired(verdict.record());
            case REVOKED -> inactive(Reason.REVOKED);
            case NOT_ACTIVATED -> notActivated();
        };
    }

    /**
     * Message suitable for a status line.
     */
    public String message() {
        return switch (reason) {
            case ACTIVE -> cached
                ? "Pro License is active (offline mode)"
                : "Pro License is active";
            case NOT_ACTIVATED -> "No Pro License activated";
            case VERIFICATION_REQUIRED -> "Pro License could not be verified. Connect to the internet to continue.";
            case REVOKED -> "Pro License is no longer active on this installation";
            case STORE_UNAVAILABLE -> "License status is unavailable";
        };
    }
}
