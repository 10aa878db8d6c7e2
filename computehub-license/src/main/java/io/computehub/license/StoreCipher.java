package io.computehub.license;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.logging.Logger;

/**
 * AES-256-GCM encryption of the license key at rest.
 *
 * <p>Output is Base64 of {@code iv || ciphertext || tag}. Callers pass associated data
 * (the installation id) so a record copied from another installation fails
 * authentication instead of decrypting.
 *
 * <p>The key lives in {@value #KEY_FILE} next to the activation record, owner-only,
 * generated once per installation and never sent anywhere.
 */
public final class StoreCipher {

    /**
     * File under the config directory holding the Base64 store key.
     */
    public static final String KEY_FILE = "store.key";

    private static final Logger LOG = Logger.getLogger(StoreCipher.class.getName());
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int KEY_BYTES = 32;
    private static final int IV_BYTES = 12;
    private static final int TAG_BITS = 128;

    private final SecretKey key;
    private final SecureRandom random = new SecureRandom();

    /**
     * @param rawKey 32 bytes of key material
     */
    public StoreCipher(byte[] rawKey) {
        if (rawKey == null || rawKey.length != KEY_BYTES) {
            throw new IllegalArgumentException("Store key must be " + KEY_BYTES + " bytes");
        }
        this.key = new SecretKeySpec(rawKey, "AES");
    }

    /**
     * Load the installation's store key from {@code configDir}, generating it on first use.
     *
     * @throws LicenseStorageException if the key file cannot be read or written
     */
    public static StoreCipher loadOrCreate(Path configDir) {
        Path keyFile = configDir.resolve(KEY_FILE);
        try {
            if (Files.exists(keyFile)) {
                byte[] raw = decodeKeyFile(keyFile);
                if (raw != null) {
                    return new StoreCipher(raw);
                }
                // A damaged key makes any stored record unreadable; load() treats that as absent.
                LOG.warning("Store key file is unreadable, generating a new key");
            }

            byte[] raw = new byte[KEY_BYTES];
            new SecureRandom().nextBytes(raw);
            SecureFiles.writeAtomically(keyFile, Base64.getEncoder().encodeToString(raw) + "\n");
            return new StoreCipher(raw);
        } catch (IOException e) {
            throw new LicenseStorageException("Cannot read or create store key at " + keyFile, e);
        }
    }

    /**
     * Encrypt {@code plain}, binding it to {@code associatedData}.
     */
    public String encrypt(String plain, String associatedData) {
        try {
            byte[] iv = new byte[IV_BYTES];
            random.nextBytes(iv);

            Cipher c = Cipher.getInstance(TRANSFORMATION);
            c.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, iv));
            c.updateAAD(associatedData.getBytes(StandardCharsets.UTF_8));
            byte[] ct = c.doFinal(plain.getBytes(StandardCharsets.UTF_8));

            byte[] out = new byte[iv.length + ct.length];
            System.arraycopy(iv, 0, out, 0, iv.length);
            System.arraycopy(ct, 0, out, iv.length, ct.length);
            return Base64.getEncoder().encodeToString(out);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("CRYPTO_ENCRYPT_FAILED", e);
        }
    }

    /**
     * Decrypt a value produced by {@link #encrypt(String, String)}.
     *
     * @throws GeneralSecurityException if the value was tampered with, encrypted under
     *     another key, or bound to different associated data
     */
    public String decrypt(String cipherB64, String associatedData) throws GeneralSecurityException {
        byte[] all;
        try {
            all = Base64.getDecoder().decode(cipherB64);
        } catch (IllegalArgumentException e) {
            throw new GeneralSecurityException("CRYPTO_BAD_CIPHER", e);
        }
        if (all.length <= IV_BYTES) {
            throw new GeneralSecurityException("CRYPTO_BAD_CIPHER");
        }

        Cipher c = Cipher.getInstance(TRANSFORMATION);
        c.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, all, 0, IV_BYTES));
        c.updateAAD(associatedData.getBytes(StandardCharsets.UTF_8));
        byte[] pt = c.doFinal(all, IV_BYTES, all.length - IV_BYTES);
        return new String(pt, StandardCharsets.UTF_8);
    }

    private static byte[] decodeKeyFile(Path keyFile) throws IOException {
        try {
            byte[] raw = Base64.getDecoder().decode(Files.readString(keyFile).trim());
            return raw.length == KEY_BYTES ? raw : null;
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
