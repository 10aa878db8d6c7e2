package io.computehub.license;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Proof of entitlement persisted on one installation.
 *
 * <p>Created by a successful activation, updated by re-verification, deleted by
 * deactivation or revocation. Only {@link CredentialStore} writes it to disk.
 *
 * @param licenseKey the activated key (encrypted at rest, masked in {@link #toString()})
 * @param installationId the installation the key is bound to
 * @param activatedAt when this installation first bound the key
 * @param tier the tier reported by the license server
 * @param lastVerifiedAt last time the license server confirmed the binding
 * @param lastVerificationResult whether the last check reached the server
 */
public record ActivationRecord(
    LicenseKey licenseKey,
    String installationId,
    Instant activatedAt,
    Tier tier,
    Instant lastVerifiedAt,
    VerificationResult lastVerificationResult
) {

    public ActivationRecord {
        Objects.requireNonNull(licenseKey, "licenseKey cannot be null");
        Objects.requireNonNull(installationId, "installationId cannot be null");
        Objects.requireNonNull(activatedAt, "activatedAt cannot be null");
        Objects.requireNonNull(tier, "tier cannot be null");
        Objects.requireNonNull(lastVerifiedAt, "lastVerifiedAt cannot be null");
        Objects.requireNonNull(lastVerificationResult, "lastVerificationResult cannot be null");
    }

    /**
     * Record for a binding the server just confirmed.
     */
    public static ActivationRecord activated(
            LicenseKey key, String installationId, Tier tier, Instant activatedAt, Instant now) {
        return new ActivationRecord(key, installationId, activatedAt, tier, now, VerificationResult.OK);
    }

    /**
     * Copy after the server confirmed the binding at {@code now}.
     */
    public ActivationRecord verifiedAt(Instant now) {
        return new ActivationRecord(licenseKey, installationId, activatedAt, tier, now, VerificationResult.OK);
    }

    /**
     * Copy after a check that could not reach the server; {@code lastVerifiedAt} is unchanged.
     */
    public ActivationRecord markedOffline() {
        return new ActivationRecord(
            licenseKey, installationId, activatedAt, tier, lastVerifiedAt, VerificationResult.OFFLINE
        );
    }

    /**
     * Whether the last confirmed verification is recent enough to trust offline.
     *
     * @param now the current time
     * @param maxStaleness how long a confirmation may be trusted without the server
     */
    public boolean isFresh(Instant now, Duration maxStaleness) {
        return !lastVerifiedAt.plus(maxStaleness).isBefore(now);
    }

    public boolean isCached() {
        return lastVerificationResult == VerificationResult.OFFLINE;
    }

    public String maskedKey() {
        return licenseKey.masked();
    }
}
