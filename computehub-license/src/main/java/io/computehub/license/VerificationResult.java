package io.computehub.license;

/**
 * Outcome of the most recent verification of a stored activation.
 */
public enum VerificationResult {

    /**
     * The license server confirmed the binding.
     */
    OK,

    /**
     * The license server was unreachable and the cached record was trusted.
     */
    OFFLINE
}
