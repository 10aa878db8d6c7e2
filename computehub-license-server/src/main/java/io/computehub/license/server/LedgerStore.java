package io.computehub.license.server;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import io.computehub.license.SecureFiles;
import io.computehub.license.Tier;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * JSON snapshot persistence for {@link ActivationLedger}.
 *
 * <p>The whole ledger is rewritten on every change with an atomic replace, so a crash
 * leaves either the previous snapshot or the new one. Unlike the client's credential
 * store, a ledger that cannot be parsed is an error: starting empty would free every
 * bound key.
 */
public class LedgerStore {

    private static final Logger LOG = Logger.getLogger(LedgerStore.class.getName());
    private static final int FORMAT_VERSION = 1;
    private static final Gson GSON = new GsonBuilder()
        .setPrettyPrinting()
        .serializeNulls()
        .create();

    private final Path dataFile;

    public LedgerStore(Path dataFile) {
        this.dataFile = dataFile;
    }

    /**
     * Snapshot of the ledger contents.
     */
    public record Snapshot(List<LedgerEntry> entries, List<LedgerEvent> events) {

        public static Snapshot empty() {
            return new Snapshot(List.of(), List.of());
        }
    }

    /**
     * Read the snapshot; a missing file is an empty ledger.
     *
     * @throws LedgerStorageException if the file exists but cannot be read or parsed
     */
    public Snapshot load() {
        if (!Files.exists(dataFile)) {
            LOG.info("No ledger at " + dataFile + ", starting empty");
            return Snapshot.empty();
        }

        try {
            StoredLedger stored = GSON.fromJson(Files.readString(dataFile), StoredLedger.class);
            if (stored == null) {
                return Snapshot.empty();
            }
            List<LedgerEntry> entries = new ArrayList<>();
            if (stored.licenses != null) {
                for (StoredEntry e : stored.licenses) {
                    entries.add(e.toEntry());
                }
            }
            List<LedgerEvent> events = new ArrayList<>();
            if (stored.events != null) {
                for (StoredEvent e : stored.events) {
                    events.add(e.toEvent());
                }
            }
            LOG.info("Loaded " + entries.size() + " licenses from " + dataFile);
            return new Snapshot(entries, events);
        } catch (IOException e) {
            throw new LedgerStorageException("Cannot read ledger " + dataFile, e);
        } catch (JsonParseException | DateTimeParseException | IllegalArgumentException | NullPointerException e) {
            throw new LedgerStorageException("Ledger " + dataFile + " is corrupted", e);
        }
    }

    /**
     * Replace the stored snapshot.
     *
     * @throws LedgerStorageException if the file cannot be written
     */
    public synchronized void save(Snapshot snapshot) {
        StoredLedger stored = new StoredLedger();
        stored.version = FORMAT_VERSION;
        stored.licenses = new ArrayList<>();
        for (LedgerEntry entry : snapshot.entries()) {
            stored.licenses.add(StoredEntry.of(entry));
        }
        stored.events = new ArrayList<>();
        for (LedgerEvent event : snapshot.events()) {
            stored.events.add(StoredEvent.of(event));
        }

        try {
            SecureFiles.writeAtomically(dataFile, GSON.toJson(stored));
        } catch (IOException e) {
            throw new LedgerStorageException("Cannot write ledger " + dataFile, e);
        }
    }

    public Path getDataFile() {
        return dataFile;
    }

    private static String format(Instant instant) {
        return instant != null ? instant.toString() : null;
    }

    private static Instant parse(String value) {
        return value != null ? Instant.parse(value) : null;
    }

    private static class StoredLedger {
        int version;
        List<StoredEntry> licenses;
        List<StoredEvent> events;
    }

    private static class StoredEntry {
        String keyHash;
        String maskedKey;
        String tier;
        String email;
        String createdAt;
        String installationId;
        String machineName;
        String boundAt;
        String revokedAt;
        String revokedReason;

        static StoredEntry of(LedgerEntry entry) {
            StoredEntry s = new StoredEntry();
            s.keyHash = entry.keyHash();
            s.maskedKey = entry.maskedKey();
            s.tier = entry.tier().name();
            s.email = entry.email();
            s.createdAt = format(entry.createdAt());
            s.installationId = entry.installationId();
            s.machineName = entry.machineName();
            s.boundAt = format(entry.boundAt());
            s.revokedAt = format(entry.revokedAt());
            s.revokedReason = entry.revokedReason();
            return s;
        }

        LedgerEntry toEntry() {
            return new LedgerEntry(
                keyHash, maskedKey, Tier.valueOf(tier), email, parse(createdAt),
                installationId, machineName, parse(boundAt), parse(revokedAt), revokedReason
            );
        }
    }

    private static class StoredEvent {
        String at;
        String operation;
        String maskedKey;
        String installationId;
        boolean success;
        String detail;

        static StoredEvent of(LedgerEvent event) {
            StoredEvent s = new StoredEvent();
            s.at = format(event.at());
            s.operation = event.operation();
            s.maskedKey = event.maskedKey();
            s.installationId = event.installationId();
            s.success = event.success();
            s.detail = event.detail();
            return s;
        }

        LedgerEvent toEvent() {
            return new LedgerEvent(parse(at), operation, maskedKey, installationId, success, detail);
        }
    }
}
