package io.computehub.license;

import java.time.Clock;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Read-mostly entitlement queries for feature gates and status display.
 *
 * <p>{@link #currentStatus()} is the fast path: it reads the local record only and never
 * contacts the license server, so it is safe to call from every gated code path. It can
 * be briefly stale; {@link #refresh()} is the strong path and does a server round trip.
 *
 * <pre>{@code
 * if (entitlements.isEnabled(ProFeature.BATCH_OPERATIONS)) {
 *     showBatchToolbar();
 * }
 * entitlements.require(ProFeature.AUTOMATION_ENGINE); // throws if not unlocked
 * }</pre>
 */
public class Entitlements {

    private static final Logger LOG = Logger.getLogger(Entitlements.class.getName());

    private final CredentialStore store;
    private final VerificationEngine engine;
    private final ActivationManager manager;
    private final Clock clock;

    public Entitlements(CredentialStore store, VerificationEngine engine, ActivationManager manager, Clock clock) {
        this.store = Objects.requireNonNull(store, "store cannot be null");
        this.engine = Objects.requireNonNull(engine, "engine cannot be null");
        this.manager = Objects.requireNonNull(manager, "manager cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    /**
     * Current entitlement from the local record, without any network call.
     *
     * <p>A record whose last confirmed verification is older than the staleness window
     * reports not entitled. Never throws: storage faults answer "not entitled".
     */
    public StatusView currentStatus() {
        try {
            ActivationRecord record = store.load();
            if (record == null) {
                return StatusView.notActivated();
            }
            if (!engine.isWithinStaleness(record, clock.instant())) {
                return StatusView.verificationRequired(record);
            }
            return StatusView.active(record);
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Cannot read license status", e);
            return StatusView.inactive(StatusView.Reason.STORE_UNAVAILABLE);
        }
    }

    /**
     * Re-verify with the license server and return the resulting status.
     *
     * <p>Blocks for at most the configured request timeout. Never throws: any failure
     * answers "not entitled".
     */
    public StatusView refresh() {
        try {
            return StatusView.of(manager.refresh());
        } catch (LicenseStorageException e) {
            LOG.log(Level.WARNING, "License refresh could not update local state", e);
            return StatusView.inactive(StatusView.Reason.STORE_UNAVAILABLE);
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "License refresh failed", e);
            return StatusView.inactive(StatusView.Reason.VERIFICATION_REQUIRED);
        }
    }

    /**
     * Check if {@code feature} is unlocked right now (fast path).
     */
    public boolean isEnabled(ProFeature feature) {
        StatusView status = currentStatus();
        return status.entitled() && status.tier().includes(feature);
    }

    /**
     * Guard for Pro-only operations.
     *
     * @throws ProLicenseRequiredException if {@code feature} is not unlocked
     */
    public void require(ProFeature feature) {
        if (!isEnabled(feature)) {
            throw new ProLicenseRequiredException(feature, LicenseConfig.PURCHASE_URL);
        }
    }
}
