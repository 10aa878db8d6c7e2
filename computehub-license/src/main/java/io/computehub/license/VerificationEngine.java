package io.computehub.license;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Re-checks a stored activation against the license server.
 *
 * <p>One attempt, no retries:
 * <ul>
 *   <li>bound to this installation - record refreshed, {@link Verdict.Kind#VERIFIED}</li>
 *   <li>bound elsewhere or not bound - record cleared, {@link Verdict.Kind#REVOKED}</li>
 *   <li>server unreachable - the record is trusted while
 *       {@code now - lastVerifiedAt <= maxStaleness} ({@link Verdict.Kind#FALLBACK_ENTITLED}),
 *       otherwise {@link Verdict.Kind#FALLBACK_DENIED} with the record kept for a later retry</li>
 * </ul>
 *
 * <p>Callers serialize attempts; see {@link ActivationManager}.
 */
public class VerificationEngine {

    private static final Logger LOG = Logger.getLogger(VerificationEngine.class.getName());

    private final LicenseAuthority authority;
    private final CredentialStore store;
    private final Clock clock;
    private final Duration maxStaleness;

    public VerificationEngine(LicenseAuthority authority, CredentialStore store, Clock clock, Duration maxStaleness) {
        this.authority = Objects.requireNonNull(authority, "authority cannot be null");
        this.store = Objects.requireNonNull(store, "store cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.maxStaleness = Objects.requireNonNull(maxStaleness, "maxStaleness cannot be null");
    }

    /**
     * Verify {@code record} with the license server, falling back to it when offline.
     *
     * @param record the stored activation (null means nothing to verify)
     * @return the verdict, with the record as it now stands in the store
     */
    public Verdict verify(ActivationRecord record) {
        if (record == null) {
            return new Verdict(Verdict.Kind.NOT_ACTIVATED, null);
        }

        BindingState state;
        try {
            state = authority.verify(record.licenseKey(), record.installationId());
        } catch (AuthorityUnavailableException e) {
            return fallback(record, e);
        }

        if (state == BindingState.BOUND_TO_THIS) {
            ActivationRecord verified = record.verifiedAt(clock.instant());
            store.save(verified);
            LOG.fine("License " + record.maskedKey() + " verified");
            return new Verdict(Verdict.Kind.VERIFIED, verified);
        }

        store.clear();
        LOG.warning("License " + record.maskedKey() + " is no longer bound to this installation ("
            + state.wireName() + "), entitlement removed");
        return new Verdict(Verdict.Kind.REVOKED, null);
    }

    /**
     * Whether {@code record} may be trusted at {@code now} without the server.
     */
    public boolean isWithinStaleness(ActivationRecord record, Instant now) {
        return record.isFresh(now, maxStaleness);
    }

    public Duration getMaxStaleness() {
        return maxStaleness;
    }

    private Verdict fallback(ActivationRecord record, AuthorityUnavailableException cause) {
        Instant now = clock.instant();
        if (!isWithinStaleness(record, now)) {
            LOG.warning("License server unreachable and last verification of " + record.maskedKey()
                + " is older than " + maxStaleness.toDays() + " days: " + cause.getMessage());
            return new Verdict(Verdict.Kind.FALLBACK_DENIED, record);
        }

        ActivationRecord offline = record.markedOffline();
        if (!offline.equals(record)) {
            store.save(offline);
        }
        LOG.info("License server unreachable, using cached verification: " + cause.getMessage());
        return new Verdict(Verdict.Kind.FALLBACK_ENTITLED, offline);
    }
}
