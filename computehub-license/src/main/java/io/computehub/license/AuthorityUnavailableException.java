package io.computehub.license;

/**
 * The license server could not be reached or gave no usable answer.
 *
 * <p>Covers connection failures, timeouts, server errors and malformed responses.
 * Verification falls back to the cached record; activation and deactivation fail.
 */
public class AuthorityUnavailableException extends Exception {

    public AuthorityUnavailableException(String message) {
        super(message);
    }

    public AuthorityUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
