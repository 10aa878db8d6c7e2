package io.computehub.license.server;

/**
 * Result of an admin revocation.
 */
public record RevokeResult(boolean success, String message) {

    static RevokeResult revoked() {
        return new RevokeResult(true, "License revoked successfully");
    }

    static RevokeResult notFound() {
        return new RevokeResult(false, "License key not found");
    }
}
