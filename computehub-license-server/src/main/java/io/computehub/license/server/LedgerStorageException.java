package io.computehub.license.server;

/**
 * Thrown when the ledger file cannot be read or written.
 */
public class LedgerStorageException extends RuntimeException {

    public LedgerStorageException(String message) {
        super(message);
    }

    public LedgerStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
