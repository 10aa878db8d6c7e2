package io.computehub.license.server;

import io.computehub.license.Tier;

import java.time.Instant;
import java.util.Objects;

/**
 * One issued license as the ledger knows it.
 *
 * <p>The ledger never keeps the plaintext key: entries are looked up by the SHA-256
 * of the canonical key and carry only its masked form for display.
 *
 * @param keyHash hex SHA-256 of the canonical key
 * @param maskedKey masked key for logs and admin output
 * @param tier the tier the key unlocks
 * @param email buyer email (may be null)
 * @param createdAt when the key was issued
 * @param installationId installation currently holding the key, or null
 * @param machineName display name of that installation, or null
 * @param boundAt when the current binding was made, or null
 * @param revokedAt when the key was revoked, or null
 * @param revokedReason why it was revoked, or null
 */
public record LedgerEntry(
    String keyHash,
    String maskedKey,
    Tier tier,
    String email,
    Instant createdAt,
    String installationId,
    String machineName,
    Instant boundAt,
    Instant revokedAt,
    String revokedReason
) {

    public LedgerEntry {
        Objects.requireNonNull(keyHash, "keyHash cannot be null");
        Objects.requireNonNull(maskedKey, "maskedKey cannot be null");
        Objects.requireNonNull(tier, "tier cannot be null");
        Objects.requireNonNull(createdAt, "createdAt cannot be null");
    }

    static LedgerEntry issued(String keyHash, String maskedKey, Tier tier, String email, Instant now) {
        return new LedgerEntry(keyHash, maskedKey, tier, email, now, null, null, null, null, null);
    }

    public boolean isBound() {
        return installationId != null;
    }

    public boolean isRevoked() {
        return revokedAt != null;
    }

    public boolean isBoundTo(String installation) {
        return installationId != null && installationId.equals(installation);
    }

    LedgerEntry boundTo(String installation, String machine, Instant now) {
        return new LedgerEntry(
            keyHash, maskedKey, tier, email, createdAt, installation, machine, now, revokedAt, revokedReason
        );
    }

    LedgerEntry unbound() {
        return new LedgerEntry(
            keyHash, maskedKey, tier, email, createdAt, null, null, null, revokedAt, revokedReason
        );
    }

    LedgerEntry revoked(String reason, Instant now) {
        return new LedgerEntry(keyHash, maskedKey, tier, email, createdAt, null, null, null, now, reason);
    }
}
