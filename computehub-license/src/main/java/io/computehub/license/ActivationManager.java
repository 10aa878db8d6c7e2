package io.computehub.license;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Moves an installation between "not entitled" and "entitled".
 *
 * <p>Activation and deactivation need the license server: it holds the ledger that
 * binds each key to a single installation. Verification ({@link #refresh()}) tolerates
 * an unreachable server through {@link VerificationEngine}.
 *
 * <p>{@link #activate}, {@link #deactivate} and {@link #refresh} serialize on one lock,
 * including runs of the background refresh, so the stored record always reflects the
 * last completed operation.
 *
 * <p>Usage:
 * <pre>{@code
 * ActivationResult result = manager.activate("COMPUTEHUB-AAAA-BBBB-CCCC-DDDD");
 * if (!result.success()) {
 *     System.err.println(result.error());
 * }
 * manager.startBackgroundRefresh(Duration.ofHours(6));
 * }</pre>
 */
public class ActivationManager implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(ActivationManager.class.getName());

    private final LicenseAuthority authority;
    private final CredentialStore store;
    private final VerificationEngine engine;
    private final InstallationIdentity identity;
    private final LicenseKeyCodec codec;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> refreshTask;

    public ActivationManager(
            LicenseAuthority authority,
            CredentialStore store,
            VerificationEngine engine,
            InstallationIdentity identity,
            LicenseKeyCodec codec,
            Clock clock) {
        this.authority = Objects.requireNonNull(authority, "authority cannot be null");
        this.store = Objects.requireNonNull(store, "store cannot be null");
        this.engine = Objects.requireNonNull(engine, "engine cannot be null");
        this.identity = Objects.requireNonNull(identity, "identity cannot be null");
        this.codec = Objects.requireNonNull(codec, "codec cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    /**
     * Activate a license key on this installation.
     *
     * <p>Malformed keys are rejected without contacting the server. Activating the key
     * that is already active here re-confirms the binding and only refreshes
     * {@code lastVerifiedAt}.
     *
     * @param rawKey the key as entered by the user
     * @return activation result with the resulting status
     * @throws LicenseStorageException if the record cannot be written
     */
    public ActivationResult activate(String rawKey) {
        KeyParseResult parsed = codec.normalize(rawKey);
        if (!parsed.isValid()) {
            return ActivationResult.failure(
                parsed.error(), ActivationResult.ErrorCode.INVALID_FORMAT, StatusView.notActivated()
            );
        }
        LicenseKey key = parsed.key();

        lock.lock();
        try {
            ActivationRecord existing = store.load();
            if (existing != null && !existing.licenseKey().equals(key)) {
                return ActivationResult.failure(
                    "License " + existing.maskedKey() + " is already active on this installation. "
                        + "Deactivate it before activating a different key.",
                    ActivationResult.ErrorCode.ANOTHER_KEY_ACTIVE,
                    StatusView.active(existing)
                );
            }
            StatusView before = existing != null ? StatusView.active(existing) : StatusView.notActivated();

            BindResult bind;
            try {
                bind = authority.bind(key, identity);
            } catch (AuthorityUnavailableException e) {
                LOG.warning("Activation of " + key + " failed, license server unreachable: " + e.getMessage());
                return ActivationResult.failure(
                    "Activation requires a connection to the license server. Check your network and try again.",
                    ActivationResult.ErrorCode.NETWORK_REQUIRED_FOR_ACTIVATION,
                    before
                );
            }

            if (bind.outcome() == BindOutcome.CONFLICT) {
                LOG.info("Activation of " + key + " refused: bound to another installation");
                return ActivationResult.failure(
                    "This license key is already activated on another installation. "
                        + "Deactivate it there first, or contact support.",
                    ActivationResult.ErrorCode.ALREADY_ACTIVATED_ELSEWHERE,
                    before
                );
            }
            if (bind.outcome() == BindOutcome.INVALID) {
                LOG.info("Activation of " + key + " refused: unknown or revoked key");
                return ActivationResult.failure(
                    "Invalid license key",
                    ActivationResult.ErrorCode.INVALID_KEY,
                    before
                );
            }

            Instant now = clock.instant();
            ActivationRecord record = existing != null
                ? existing.verifiedAt(now)
                : ActivationRecord.activated(
                    key,
                    identity.id(),
                    bind.tier() != null ? bind.tier() : Tier.PRO,
                    bind.activatedAt() != null ? bind.activatedAt() : now,
                    now
                );
            store.save(record);
            LOG.info("License " + key + " activated (" + record.tier().getDisplayName() + ")");
            return ActivationResult.success(StatusView.active(record));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Release this installation's license so it can be activated elsewhere.
     *
     * <p>The local record is only removed once the server confirms the release;
     * if the server is unreachable the license stays active here.
     *
     * @throws LicenseStorageException if the record cannot be removed
     */
    public DeactivationResult deactivate() {
        lock.lock();
        try {
            ActivationRecord record = store.load();
            if (record == null) {
                store.clear();
                return DeactivationResult.notActive();
            }

            UnbindOutcome outcome;
            try {
                outcome = authority.unbind(record.licenseKey(), record.installationId());
            } catch (AuthorityUnavailableException e) {
                LOG.warning("Deactivation of " + record.maskedKey() + " failed, license server unreachable: "
                    + e.getMessage());
                return DeactivationResult.networkRequired();
            }

            store.clear();
            if (outcome == UnbindOutcome.NOT_BOUND) {
                LOG.info("License " + record.maskedKey() + " was not bound at the server, removed locally");
            } else {
                LOG.info("License " + record.maskedKey() + " deactivated");
            }
            return DeactivationResult.deactivated();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Re-verify the stored activation with the license server.
     *
     * @return the verification verdict
     */
    public Verdict refresh() {
        lock.lock();
        try {
            return engine.verify(store.load());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Run {@link #refresh()} now and then every {@code interval} on a daemon thread.
     *
     * <p>Calling again replaces the previous schedule.
     */
    public synchronized void startBackgroundRefresh(Duration interval) {
        if (interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive");
        }
        if (refreshTask != null) {
            refreshTask.cancel(false);
        }
        if (scheduler == null) {
            scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "computehub-license-refresh");
                t.setDaemon(true);
                return t;
            });
        }
        refreshTask = scheduler.scheduleWithFixedDelay(
            this::backgroundRefresh, 0, interval.toMillis(), TimeUnit.MILLISECONDS
        );
        LOG.fine("Background license refresh every " + interval);
    }

    /**
     * Check if the background refresh is scheduled.
     */
    public synchronized boolean isBackgroundRefreshRunning() {
        return refreshTask != null && !refreshTask.isCancelled();
    }

    /**
     * Stop the background refresh. An in-flight refresh is allowed to finish.
     */
    @Override
    public synchronized void close() {
        if (refreshTask != null) {
            refreshTask.cancel(false);
            refreshTask = null;
        }
        if (scheduler != null) {
            scheduler.shutdown();
            scheduler = null;
        }
    }

    public InstallationIdentity getIdentity() {
        return identity;
    }

    public LicenseAuthority getAuthority() {
        return authority;
    }

    private void backgroundRefresh() {
        try {
            Verdict verdict = refresh();
            LOG.fine("Background license refresh: " + verdict.kind());
        } catch (RuntimeException e) {
            // An exception would cancel the schedule; log and wait for the next run.
            LOG.log(Level.WARNING, "Background license refresh failed", e);
        }
    }
}
