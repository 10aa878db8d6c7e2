package io.computehub.license.server;

import io.computehub.license.LicenseKey;
import io.computehub.license.Tier;

/**
 * A freshly issued key. This is the only time the ledger hands out the plaintext.
 */
public record IssuedLicense(LicenseKey key, Tier tier) {
}
