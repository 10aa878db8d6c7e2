package io.computehub.license;

/**
 * The local storage medium failed (config directory unwritable, disk full, ...).
 *
 * <p>Unlike a corrupt record, which reads as "not activated", this is a fault the
 * caller cannot recover from by re-entering a key.
 */
public class LicenseStorageException extends RuntimeException {

    public LicenseStorageException(String message) {
        super(message);
    }

    public LicenseStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
