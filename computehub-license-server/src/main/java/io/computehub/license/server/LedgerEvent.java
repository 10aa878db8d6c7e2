package io.computehub.license.server;

import java.time.Instant;

/**
 * Audit trail entry for one ledger operation.
 *
 * @param at when the operation ran
 * @param operation bind, unbind, verify, issue or revoke
 * @param maskedKey the key involved, masked
 * @param installationId the calling installation (null for admin operations)
 * @param success whether the operation granted what was asked
 * @param detail outcome in words (may be null)
 */
public record LedgerEvent(
    Instant at,
    String operation,
    String maskedKey,
    String installationId,
    boolean success,
    String detail
) {
}
