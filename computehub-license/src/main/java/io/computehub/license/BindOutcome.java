package io.computehub.license;

/**
 * License server answer to a bind request.
 */
public enum BindOutcome {

    /**
     * Bound to the requesting installation, freshly or as a repeat of an existing binding.
     */
    OK,

    /**
     * Already bound to a different installation.
     */
    CONFLICT,

    /**
     * Unknown or revoked key.
     */
    INVALID
}
