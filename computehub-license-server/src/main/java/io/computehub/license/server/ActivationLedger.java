package io.computehub.license.server;

import io.computehub.license.BindResult;
import io.computehub.license.BindingState;
import io.computehub.license.LicenseKey;
import io.computehub.license.Tier;
import io.computehub.license.UnbindOutcome;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * The license server's source of truth: which installation holds each key.
 *
 * <p>A key is bound to at most one installation at a time. All operations are
 * serialized on this object, so when two installations race to bind the same free
 * key the first one wins and the second sees a conflict.
 *
 * <p>Every change is written through {@link LedgerStore} before it becomes visible;
 * if the write fails the in-memory state is rolled back and the
 * {@link LedgerStorageException} propagates.
 *
 * <p>Usage:
 * <pre>{@code
 * ActivationLedger ledger = ActivationLedger.open(new LedgerStore(path), Clock.systemUTC());
 * IssuedLicense issued = ledger.issue(Tier.PRO, "buyer@example.com");
 * BindResult result = ledger.bind(issued.key(), installationId, "gpu-box (Linux)");
 * }</pre>
 */
public class ActivationLedger {

    private static final Logger LOG = Logger.getLogger(ActivationLedger.class.getName());

    /**
     * Number of audit events kept.
     */
    public static final int DEFAULT_MAX_EVENTS = 1000;

    private final LedgerStore store;
    private final Clock clock;
    private final LicenseKeyGenerator generator;
    private final int maxEvents;

    private final Map<String, LedgerEntry> entries = new LinkedHashMap<>();
    private final Deque<LedgerEvent> events = new ArrayDeque<>();

    public ActivationLedger(LedgerStore store, Clock clock, LicenseKeyGenerator generator, int maxEvents) {
        this.store = Objects.requireNonNull(store, "store cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.generator = Objects.requireNonNull(generator, "generator cannot be null");
        if (maxEvents < 0) {
            throw new IllegalArgumentException("maxEvents cannot be negative");
        }
        this.maxEvents = maxEvents;
    }

    /**
     * Open the ledger persisted in {@code store}.
     *
     * @throws LedgerStorageException if the stored ledger cannot be read
     */
    public static ActivationLedger open(LedgerStore store, Clock clock) {
        ActivationLedger ledger = new ActivationLedger(store, clock, new LicenseKeyGenerator(), DEFAULT_MAX_EVENTS);
        ledger.restore(store.load());
        return ledger;
    }

    /**
     * Issue a new key. The returned key is the only copy of the plaintext.
     */
    public synchronized IssuedLicense issue(Tier tier, String email) {
        Objects.requireNonNull(tier, "tier cannot be null");
        if (tier == Tier.FREE) {
            throw new IllegalArgumentException("Cannot issue a key for the free tier");
        }

        LicenseKey key;
        String hash;
        do {
            key = generator.generate();
            hash = hash(key);
        } while (entries.containsKey(hash));

        LedgerEntry entry = LedgerEntry.issued(hash, key.masked(), tier, email, clock.instant());
        commit(null, entry, event("issue", key, null, true, tier.name()));
        LOG.info("Issued " + tier.getDisplayName() + " license " + key);
        return new IssuedLicense(key, tier);
    }

    /**
     * Bind {@code key} to {@code installationId}. Re-binding the holder is a no-op.
     */
    public synchronized BindResult bind(LicenseKey key, String installationId, String machineName) {
        LedgerEntry entry = entries.get(hash(key));
        if (entry == null) {
            record(event("bind", key, installationId, false, "License key not found"));
            return BindResult.invalid("Invalid license key");
        }
        if (entry.isRevoked()) {
            record(event("bind", key, installationId, false, "License revoked"));
            return BindResult.invalid("License has been revoked: " + reasonOf(entry));
        }
        if (entry.isBound() && !entry.isBoundTo(installationId)) {
            record(event("bind", key, installationId, false, "Bound to another installation"));
            LOG.info("Refused bind of " + key + ": held by another installation");
            return BindResult.conflict("License key is already activated on another installation");
        }
        if (entry.isBoundTo(installationId)) {
            record(event("bind", key, installationId, true, "Already bound"));
            return BindResult.ok(entry.tier(), entry.boundAt());
        }

        LedgerEntry bound = entry.boundTo(installationId, machineName, clock.instant());
        commit(entry, bound, event("bind", key, installationId, true, "Bound to " + machineName));
        LOG.info("License " + key + " bound to installation " + installationId);
        return BindResult.ok(bound.tier(), bound.boundAt());
    }

    /**
     * Release {@code key} if {@code installationId} holds it.
     */
    public synchronized UnbindOutcome unbind(LicenseKey key, String installationId) {
        LedgerEntry entry = entries.get(hash(key));
        if (entry == null || !entry.isBoundTo(installationId)) {
            record(event("unbind", key, installationId, false, "Not bound to this installation"));
            return UnbindOutcome.NOT_BOUND;
        }

        commit(entry, entry.unbound(), event("unbind", key, installationId, true, null));
        LOG.info("License " + key + " released by installation " + installationId);
        return UnbindOutcome.OK;
    }

    /**
     * Report who holds {@code key}, relative to {@code installationId}.
     *
     * <p>Unknown and revoked keys are {@link BindingState#NOT_BOUND}.
     */
    public synchronized BindingState verify(LicenseKey key, String installationId) {
        LedgerEntry entry = entries.get(hash(key));
        BindingState state;
        if (entry == null || entry.isRevoked() || !entry.isBound()) {
            state = BindingState.NOT_BOUND;
        } else if (entry.isBoundTo(installationId)) {
            state = BindingState.BOUND_TO_THIS;
        } else {
            state = BindingState.BOUND_ELSEWHERE;
        }
        record(event("verify", key, installationId, state == BindingState.BOUND_TO_THIS, state.wireName()));
        return state;
    }

    /**
     * Revoke {@code key}. The holder loses it on its next verification.
     */
    public synchronized RevokeResult revoke(LicenseKey key, String reason) {
        LedgerEntry entry = entries.get(hash(key));
        if (entry == null) {
            record(event("revoke", key, null, false, "License key not found"));
            return RevokeResult.notFound();
        }

        commit(entry, entry.revoked(reason, clock.instant()), event("revoke", key, null, true, reason));
        LOG.warning("License " + key + " revoked: " + (reason != null ? reason : "no reason given"));
        return RevokeResult.revoked();
    }

    /**
     * Look up the entry for {@code key}, or null if it was never issued.
     */
    public synchronized LedgerEntry find(LicenseKey key) {
        return entries.get(hash(key));
    }

    /**
     * The most recent audit events, oldest first. A limit below one returns none.
     */
    public synchronized List<LedgerEvent> recentEvents(int limit) {
        if (limit <= 0) {
            return List.of();
        }
        List<LedgerEvent> all = new ArrayList<>(events);
        return List.copyOf(all.subList(Math.max(0, all.size() - limit), all.size()));
    }

    public synchronized int size() {
        return entries.size();
    }

    private void restore(LedgerStore.Snapshot snapshot) {
        for (LedgerEntry entry : snapshot.entries()) {
            entries.put(entry.keyHash(), entry);
        }
        for (LedgerEvent event : snapshot.events()) {
            appendEvent(event);
        }
    }

    /**
     * Apply a change and persist it, undoing the change if the write fails.
     */
    private void commit(LedgerEntry before, LedgerEntry after, LedgerEvent event) {
        List<LedgerEvent> previousEvents = List.copyOf(events);
        entries.put(after.keyHash(), after);
        appendEvent(event);
        try {
            persist();
        } catch (LedgerStorageException e) {
            if (before == null) {
                entries.remove(after.keyHash());
            } else {
                entries.put(before.keyHash(), before);
            }
            restoreEvents(previousEvents);
            throw e;
        }
    }

    /**
     * Persist an audit event for an operation that changed no entry.
     */
    private void record(LedgerEvent event) {
        List<LedgerEvent> previousEvents = List.copyOf(events);
        appendEvent(event);
        try {
            persist();
        } catch (LedgerStorageException e) {
            restoreEvents(previousEvents);
            throw e;
        }
    }

    // Appending at capacity evicts the oldest event, so undo restores the whole log.
    private void restoreEvents(List<LedgerEvent> previous) {
        events.clear();
        events.addAll(previous);
    }

    private void appendEvent(LedgerEvent event) {
        if (maxEvents == 0) {
            return;
        }
        events.addLast(event);
        while (events.size() > maxEvents) {
            events.pollFirst();
        }
    }

    private void persist() {
        store.save(new LedgerStore.Snapshot(List.copyOf(entries.values()), List.copyOf(events)));
    }

    private LedgerEvent event(String operation, LicenseKey key, String installationId, boolean success, String detail) {
        return new LedgerEvent(clock.instant(), operation, key.masked(), installationId, success, detail);
    }

    private static String reasonOf(LedgerEntry entry) {
        return entry.revokedReason() != null ? entry.revokedReason() : "No reason provided";
    }

    static String hash(LicenseKey key) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(key.value().getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
