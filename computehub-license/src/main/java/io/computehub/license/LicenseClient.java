package io.computehub.license;

import java.time.Clock;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Main entry point for ComputeHub license management.
 *
 * <p>Owns the licensing state of one installation. Create one per installation (or per
 * tenant config directory) and hand it to the code that needs it; there is no global
 * instance.
 *
 * <p>Usage:
 * <pre>{@code
 * try (LicenseClient license = LicenseClient.create(LicenseConfig.fromEnvironment())) {
 *     license.startBackgroundRefresh();
 *
 *     ActivationResult activation = license.activate("COMPUTEHUB-AAAA-BBBB-CCCC-DDDD");
 *     if (!activation.success()) {
 *         System.err.println(activation.error());
 *     }
 *
 *     if (license.entitlements().isEnabled(ProFeature.BATCH_OPERATIONS)) {
 *         // ...
 *     }
 * }
 * }</pre>
 */
public class LicenseClient implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(LicenseClient.class.getName());

    private final LicenseConfig config;
    private final ActivationManager manager;
    private final Entitlements entitlements;

    LicenseClient(LicenseConfig config, ActivationManager manager, Entitlements entitlements) {
        this.config = config;
        this.manager = manager;
        this.entitlements = entitlements;
    }

    /**
     * Create a client talking to the server named in {@code config}.
     *
     * <p>Without a server URL the client still answers status queries from the local
     * record, but activation and deactivation fail as network-required.
     *
     * @throws LicenseStorageException if the config directory cannot be initialized
     */
    public static LicenseClient create(LicenseConfig config) {
        LicenseAuthority authority = config.hasServer()
            ? new HttpLicenseAuthority(config.serverUrl(), config.requestTimeout())
            : new UnconfiguredAuthority();
        return create(config, authority, Clock.systemUTC());
    }

    /**
     * Create a client with an explicit authority and clock.
     *
     * @throws LicenseStorageException if the config directory cannot be initialized
     */
    public static LicenseClient create(LicenseConfig config, LicenseAuthority authority, Clock clock) {
        Objects.requireNonNull(config, "config cannot be null");
        Objects.requireNonNull(authority, "authority cannot be null");
        Objects.requireNonNull(clock, "clock cannot be null");

        InstallationIdentity identity = InstallationIdentity.loadOrCreate(config.configDir());
        StoreCipher cipher = StoreCipher.loadOrCreate(config.configDir());
        CredentialStore store = new CredentialStore(config.configDir(), cipher, identity.id());
        VerificationEngine engine = new VerificationEngine(authority, store, clock, config.maxStaleness());
        ActivationManager manager = new ActivationManager(
            authority, store, engine, identity, LicenseKeyCodec.DEFAULT, clock
        );
        Entitlements entitlements = new Entitlements(store, engine, manager, clock);

        LOG.fine("License client for installation " + identity.id() + " using " + authority.getName());
        return new LicenseClient(config, manager, entitlements);
    }

    /**
     * Activate a license key on this installation.
     */
    public ActivationResult activate(String rawKey) {
        return manager.activate(rawKey);
    }

    /**
     * Release this installation's license.
     */
    public DeactivationResult deactivate() {
        return manager.deactivate();
    }

    /**
     * Current status without a network call.
     */
    public StatusView currentStatus() {
        return entitlements.currentStatus();
    }

    /**
     * Re-verify with the license server.
     */
    public StatusView refresh() {
        return entitlements.refresh();
    }

    /**
     * Start periodic re-verification at the configured interval.
     */
    public void startBackgroundRefresh() {
        manager.startBackgroundRefresh(config.refreshInterval());
    }

    public Entitlements entitlements() {
        return entitlements;
    }

    public InstallationIdentity getIdentity() {
        return manager.getIdentity();
    }

    public LicenseConfig getConfig() {
        return config;
    }

    @Override
    public void close() {
        manager.close();
    }
}
