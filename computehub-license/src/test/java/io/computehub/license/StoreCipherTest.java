package io.computehub.license;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StoreCipherTest {

    private static final String KEY = "COMPUTEHUB-AAAA-BBBB-CCCC-DDDD";

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("encrypt then decrypt with the same associated data")
    void encryptDecrypt() throws GeneralSecurityException {
        var cipher = StoreCipher.loadOrCreate(tempDir);

        String sealed = cipher.encrypt(KEY, "install-1");

        assertFalse(sealed.contains("BBBB"));
        assertEquals(KEY, cipher.decrypt(sealed, "install-1"));
    }

    @Test
    @DisplayName("each encryption uses a fresh IV")
    void encrypt_freshIv() {
        var cipher = StoreCipher.loadOrCreate(tempDir);

        assertNotEquals(cipher.encrypt(KEY, "install-1"), cipher.encrypt(KEY, "install-1"));
    }

    @Test
    @DisplayName("different associated data fails authentication")
    void decrypt_otherAssociatedData_fails() {
        var cipher = StoreCipher.loadOrCreate(tempDir);
        String sealed = cipher.encrypt(KEY, "install-1");

        assertThrows(GeneralSecurityException.class, () -> cipher.decrypt(sealed, "install-2"));
    }

    @Test
    @DisplayName("garbage input is rejected")
    void decrypt_garbage_fails() {
        var cipher = StoreCipher.loadOrCreate(tempDir);

        assertThrows(GeneralSecurityException.class, () -> cipher.decrypt("%%%not-base64", "install-1"));
        assertThrows(GeneralSecurityException.class, () -> cipher.decrypt("AAAA", "install-1"));
    }

    @Test
    @DisplayName("store key persists across loads")
    void loadOrCreate_reusesKey() throws GeneralSecurityException {
        String sealed = StoreCipher.loadOrCreate(tempDir).encrypt(KEY, "install-1");

        assertTrue(Files.exists(tempDir.resolve(StoreCipher.KEY_FILE)));
        assertEquals(KEY, StoreCipher.loadOrCreate(tempDir).decrypt(sealed, "install-1"));
    }

    @Test
    @DisplayName("damaged key file is replaced")
    void loadOrCreate_damagedKey_regenerates() throws IOException {
        Files.writeString(tempDir.resolve(StoreCipher.KEY_FILE), "too-short");

        var cipher = StoreCipher.loadOrCreate(tempDir);

        assertNotEquals("too-short", Files.readString(tempDir.resolve(StoreCipher.KEY_FILE)).trim());
        assertTrue(cipher.encrypt(KEY, "x").length() > 0);
    }

    @Test
    @DisplayName("key material must be 32 bytes")
    void constructor_wrongLength_throws() {
        assertThrows(IllegalArgumentException.class, () -> new StoreCipher(new byte[16]));
        assertThrows(IllegalArgumentException.class, () -> new StoreCipher(null));
    }
}
