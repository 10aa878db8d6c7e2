package io.computehub.license;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermissions;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Tests for {@link CredentialStore}.
 */
class CredentialStoreTest {

    private static final String INSTALLATION = "install-1";

    @TempDir
    Path tempDir;

    private StoreCipher cipher;
    private CredentialStore store;

    @BeforeEach
    void setUp() {
        cipher = StoreCipher.loadOrCreate(tempDir);
        store = new CredentialStore(tempDir, cipher, INSTALLATION);
    }

    @Test
    @DisplayName("load returns null for empty store")
    void load_emptyStore_returnsNull() {
        assertNull(store.load());
        assertFalse(store.exists());
    }

    @Test
    @DisplayName("save and load round-trip works")
    void saveAndLoad_roundTrip() {
        var original = record("COMPUTEHUB-A1B2-C3D4-E5F6-G7H8");

        store.save(original);

        assertTrue(store.exists());
        assertEquals(original, store.load());
    }

    @Test
    @DisplayName("offline verification result survives round-trip")
    void saveAndLoad_offlineResult() {
        var original = record("COMPUTEHUB-A1B2-C3D4-E5F6-G7H8").markedOffline();

        store.save(original);

        var loaded = store.load();
        assertEquals(VerificationResult.OFFLINE, loaded.lastVerificationResult());
        assertTrue(loaded.isCached());
    }

    @Test
    @DisplayName("record file never contains the plaintext key")
    void recordFile_hasNoPlaintextKey() throws IOException {
        store.save(record("COMPUTEHUB-A1B2-C3D4-E5F6-G7H8"));

        String content = Files.readString(tempDir.resolve(CredentialStore.RECORD_FILE));
        assertFalse(content.contains("A1B2"));
        assertFalse(content.contains("C3D4"));
        assertFalse(content.contains("E5F6"));
        assertTrue(content.contains("COMPUTEHUB-****-****-****-G7H8"));
    }

    @Test
    @DisplayName("save overwrites the previous record")
    void multipleSaves_overwrite() {
        store.save(record("COMPUTEHUB-AAAA-AAAA-AAAA-AAAA"));
        store.save(record("COMPUTEHUB-BBBB-BBBB-BBBB-BBBB"));

        assertEquals("COMPUTEHUB-BBBB-BBBB-BBBB-BBBB", store.load().licenseKey().value());
        try (var files = Files.list(tempDir)) {
            assertEquals(0, files.filter(p -> p.toString().endsWith(".tmp")).count());
        } catch (IOException e) {
            throw new AssertionError(e);
        }
    }

    @Test
    @DisplayName("clear removes the record")
    void clear_removesRecord() {
        store.save(record("COMPUTEHUB-AAAA-BBBB-CCCC-DDDD"));

        store.clear();

        assertFalse(store.exists());
        assertNull(store.load());
    }

    @Test
    @DisplayName("clear on empty store is safe")
    void clear_emptyStore_isSafe() {
        store.clear();
        store.clear();

        assertFalse(store.exists());
    }

    @Test
    @DisplayName("Corrupted record file reads as absent")
    void corruptedFile_returnsNull() throws IOException {
        Files.writeString(tempDir.resolve(CredentialStore.RECORD_FILE), "not valid json{{{");

        assertNull(store.load());
    }

    @Test
    @DisplayName("Empty record file reads as absent")
    void emptyFile_returnsNull() throws IOException {
        Files.writeString(tempDir.resolve(CredentialStore.RECORD_FILE), "");

        assertNull(store.load());
    }

    @Test
    @DisplayName("Tampered ciphertext reads as absent")
    void tamperedCiphertext_returnsNull() throws IOException {
        store.save(record("COMPUTEHUB-AAAA-BBBB-CCCC-DDDD"));
        Path file = tempDir.resolve(CredentialStore.RECORD_FILE);
        String json = Files.readString(file);
        String tampered = json.replaceFirst("\"encryptedKey\": \"(.)", "\"encryptedKey\": \"X$1");
        Files.writeString(file, tampered);

        assertNull(store.load());
    }

    @Test
    @DisplayName("Invalid tier name reads as absent")
    void invalidTier_returnsNull() throws IOException {
        store.save(record("COMPUTEHUB-AAAA-BBBB-CCCC-DDDD"));
        Path file = tempDir.resolve(CredentialStore.RECORD_FILE);
        Files.writeString(file, Files.readString(file).replace("\"PRO\"", "\"PLATINUM\""));

        assertNull(store.load());
    }

    @Test
    @DisplayName("Record written by another installation reads as absent")
    void foreignInstallation_returnsNull() {
        store.save(record("COMPUTEHUB-AAAA-BBBB-CCCC-DDDD"));

        var otherInstallation = new CredentialStore(tempDir, cipher, "install-2");

        assertNull(otherInstallation.load());
    }

    @Test
    @DisplayName("Record encrypted under another store key reads as absent")
    void otherStoreKey_returnsNull() {
        store.save(record("COMPUTEHUB-AAAA-BBBB-CCCC-DDDD"));

        byte[] otherKey = new byte[32];
        otherKey[0] = 1;
        var otherStore = new CredentialStore(tempDir, new StoreCipher(otherKey), INSTALLATION);

        assertNull(otherStore.load());
    }

    @Test
    @DisplayName("save rejects a record for another installation")
    void save_foreignRecord_rejected() {
        var foreign = new ActivationRecord(
            LicenseKeyCodec.DEFAULT.normalize("COMPUTEHUB-AAAA-BBBB-CCCC-DDDD").key(),
            "install-2", Instant.now(), Tier.PRO, Instant.now(), VerificationResult.OK
        );

        assertThrows(IllegalArgumentException.class, () -> store.save(foreign));
    }

    @Test
    @DisplayName("record file is owner-only on POSIX")
    void recordFile_ownerOnly() throws IOException {
        assumeTrue(tempDir.getFileSystem().supportedFileAttributeViews().contains("posix"));

        store.save(record("COMPUTEHUB-AAAA-BBBB-CCCC-DDDD"));

        var perms = Files.getPosixFilePermissions(tempDir.resolve(CredentialStore.RECORD_FILE));
        assertEquals(PosixFilePermissions.fromString("rw-------"), perms);
    }

    @Test
    @DisplayName("save fails loudly when the directory is not writable")
    void save_unwritableDirectory_throws() throws IOException {
        Path notADirectory = tempDir.resolve("blocker");
        Files.writeString(notADirectory, "file, not a directory");
        var broken = new CredentialStore(notADirectory, cipher, INSTALLATION);

        assertThrows(LicenseStorageException.class,
            () -> broken.save(record("COMPUTEHUB-AAAA-BBBB-CCCC-DDDD")));
    }

    @Test
    @DisplayName("concurrent readers never see a partial record")
    void concurrentReaders_seeWholeRecords() throws Exception {
        var first = record("COMPUTEHUB-AAAA-AAAA-AAAA-AAAA");
        var second = record("COMPUTEHUB-BBBB-BBBB-BBBB-BBBB");
        store.save(first);

        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            futures.add(pool.submit(() -> {
                start.await();
                for (int i = 0; i < 50; i++) {
                    store.save(i % 2 == 0 ? second : first);
                }
                return null;
            }));
            for (int r = 0; r < 3; r++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < 100; i++) {
                        var loaded = store.load();
                        assertNotNull(loaded);
                        assertTrue(loaded.equals(first) || loaded.equals(second));
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }
    }

    private static ActivationRecord record(String key) {
        Instant now = Instant.now().truncatedTo(ChronoUnit.SECONDS);
        return ActivationRecord.activated(
            LicenseKeyCodec.DEFAULT.normalize(key).key(),
            INSTALLATION,
            Tier.PRO,
            now.minus(3, ChronoUnit.DAYS),
            now
        );
    }
}
