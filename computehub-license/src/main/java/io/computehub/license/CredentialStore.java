package io.computehub.license;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.logging.Logger;

/**
 * Single-slot, encrypted storage of this installation's {@link ActivationRecord}.
 *
 * <p>Stores the record in {@code <configDir>/activation.json}. The license key is
 * AES-GCM encrypted with the installation's store key and bound to the installation
 * id; the remaining fields are plain JSON.
 *
 * <p>Writes replace the file atomically and are serialized, so a concurrent reader
 * always sees either the previous record or the new one. A record that cannot be
 * parsed or decrypted reads as absent.
 */
public class CredentialStore {

    /**
     * Name of the record file inside the config directory.
     */
    public static final String RECORD_FILE = "activation.json";

    private static final Logger LOG = Logger.getLogger(CredentialStore.class.getName());
    private static final int FORMAT_VERSION = 1;
    private static final Gson GSON = new GsonBuilder()
        .setPrettyPrinting()
        .create();

    private final Path recordFile;
    private final StoreCipher cipher;
    private final LicenseKeyCodec codec;
    private final String installationId;

    public CredentialStore(Path configDir, StoreCipher cipher, String installationId) {
        this(configDir, cipher, installationId, LicenseKeyCodec.DEFAULT);
    }

    public CredentialStore(Path configDir, StoreCipher cipher, String installationId, LicenseKeyCodec codec) {
        this.recordFile = configDir.resolve(RECORD_FILE);
        this.cipher = cipher;
        this.installationId = installationId;
        this.codec = codec;
    }

    /**
     * Load the stored record.
     *
     * @return the record, or null if none is stored or the stored one is unreadable
     * @throws LicenseStorageException if the file exists but cannot be read at all
     */
    public ActivationRecord load() {
        if (!Files.exists(recordFile)) {
            return null;
        }

        String json;
        try {
            json = Files.readString(recordFile);
        } catch (IOException e) {
            throw new LicenseStorageException("Cannot read " + recordFile, e);
        }

        try {
            StoredRecord stored = GSON.fromJson(json, StoredRecord.class);
            if (stored == null || stored.encryptedKey == null) {
                LOG.warning("Ignoring empty activation record at " + recordFile);
                return null;
            }
            if (!installationId.equals(stored.installationId)) {
                LOG.warning("Ignoring activation record written by another installation");
                return null;
            }

            String plainKey = cipher.decrypt(stored.encryptedKey, installationId);
            KeyParseResult parsed = codec.normalize(plainKey);
            if (!parsed.isValid()) {
                LOG.warning("Ignoring activation record with a malformed key");
                return null;
            }

            return new ActivationRecord(
                parsed.key(),
                stored.installationId,
                Instant.parse(stored.activatedAt),
                Tier.valueOf(stored.tier),
                Instant.parse(stored.lastVerifiedAt),
                VerificationResult.valueOf(stored.lastVerificationResult)
            );
        } catch (GeneralSecurityException e) {
            LOG.warning("Ignoring activation record that failed decryption: " + e.getMessage());
            return null;
        } catch (JsonParseException | DateTimeParseException | IllegalArgumentException | NullPointerException e) {
            LOG.warning("Ignoring corrupted activation record: " + e.getClass().getSimpleName());
            return null;
        }
    }

    /**
     * Persist {@code record}, replacing any stored one.
     *
     * @throws LicenseStorageException if the file cannot be written
     */
    public synchronized void save(ActivationRecord record) {
        if (!installationId.equals(record.installationId())) {
            throw new IllegalArgumentException("Record belongs to another installation");
        }

        StoredRecord stored = new StoredRecord();
        stored.version = FORMAT_VERSION;
        stored.installationId = record.installationId();
        stored.encryptedKey = cipher.encrypt(record.licenseKey().value(), installationId);
        stored.maskedKey = record.maskedKey();
        stored.tier = record.tier().name();
        stored.activatedAt = record.activatedAt().toString();
        stored.lastVerifiedAt = record.lastVerifiedAt().toString();
        stored.lastVerificationResult = record.lastVerificationResult().name();

        try {
            SecureFiles.writeAtomically(recordFile, GSON.toJson(stored));
        } catch (IOException e) {
            throw new LicenseStorageException("Cannot write " + recordFile, e);
        }
    }

    /**
     * Remove the stored record. Clearing an empty store succeeds silently.
     *
     * @throws LicenseStorageException if an existing file cannot be deleted
     */
    public synchronized void clear() {
        try {
            Files.deleteIfExists(recordFile);
        } catch (IOException e) {
            throw new LicenseStorageException("Cannot delete " + recordFile, e);
        }
    }

    /**
     * Check if a record file is present (it may still be unreadable).
     */
    public boolean exists() {
        return Files.exists(recordFile);
    }

    /**
     * On-disk layout.
     */
    private static class StoredRecord {
        int version;
        String installationId;
        String encryptedKey;
        String maskedKey;
        String tier;
        String activatedAt;
        String lastVerifiedAt;
        String lastVerificationResult;
    }
}
