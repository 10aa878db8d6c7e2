package io.computehub.license.server;

import io.computehub.license.ActivationResult;
import io.computehub.license.HttpLicenseAuthority;
import io.computehub.license.LicenseClient;
import io.computehub.license.LicenseConfig;
import io.computehub.license.LicenseKey;
import io.computehub.license.ProFeature;
import io.computehub.license.StatusView;
import io.computehub.license.Tier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * End-to-end: two client installations against a running license server.
 */
class LicenseServerIntegrationTest {

    @TempDir
    Path tempDir;

    private ActivationLedger ledger;
    private LedgerServer server;
    private LicenseClient installationX;
    private LicenseClient installationY;

    @BeforeEach
    void setUp() throws IOException {
        LedgerConfig config = LedgerConfig.fromEnvironment(Map.of())
            .withPort(0)
            .withDataFile(tempDir.resolve("server").resolve("ledger.json"));
        ledger = ActivationLedger.open(new LedgerStore(config.dataFile()), Clock.systemUTC());
        server = new LedgerServer(ledger, config);
        server.start();

        installationX = client("x", Duration.ofHours(6));
        installationY = client("y", Duration.ofHours(6));
    }

    @AfterEach
    void tearDown() {
        installationX.close();
        installationY.close();
        server.close();
    }

    @Test
    @DisplayName("key moves from X to Y only through deactivation")
    void singleInstallationTransfer() {
        String key = ledger.issue(Tier.PRO, "buyer@example.com").key().value();

        ActivationResult onX = installationX.activate(key);
        assertTrue(onX.success());
        assertTrue(installationX.currentStatus().entitled());

        ActivationResult onY = installationY.activate(key);
        assertFalse(onY.success());
        assertEquals(ActivationResult.ErrorCode.ALREADY_ACTIVATED_ELSEWHERE, onY.errorCode());

        assertTrue(installationX.deactivate().success());
        assertFalse(installationX.currentStatus().entitled());

        assertTrue(installationY.activate(key).success());
        assertTrue(installationY.entitlements().isEnabled(ProFeature.BATCH_OPERATIONS));
        assertEquals(StatusView.Reason.ACTIVE, installationY.refresh().reason());
    }

    @Test
    @DisplayName("activating twice leaves one binding")
    void doubleActivation() {
        LicenseKey key = ledger.issue(Tier.PRO, null).key();

        assertTrue(installationX.activate(key.value()).success());
        assertTrue(installationX.activate(key.value().toLowerCase()).success());

        assertTrue(ledger.find(key).isBoundTo(installationX.getIdentity().id()));
    }

    @Test
    @DisplayName("unknown key is reported invalid")
    void unknownKey() {
        ActivationResult result = installationX.activate("COMPUTEHUB-ZZZZ-ZZZZ-ZZZZ-ZZZZ");

        assertEquals(ActivationResult.ErrorCode.INVALID_KEY, result.errorCode());
    }

    @Test
    @DisplayName("revocation reaches the installation through background refresh")
    void revocation_reconciledInBackground() {
        LicenseKey key = ledger.issue(Tier.PRO, null).key();
        LicenseClient fast = client("fast", Duration.ofMillis(100));
        try {
            assertTrue(fast.activate(key.value()).success());

            ledger.revoke(key, "Refund");
            fast.startBackgroundRefresh();

            await().atMost(Duration.ofSeconds(10))
                .until(() -> !fast.currentStatus().entitled());
            assertEquals(StatusView.Reason.NOT_ACTIVATED, fast.currentStatus().reason());
        } finally {
            fast.close();
        }
    }

    @Test
    @DisplayName("server outage falls back to the cached verification")
    void serverDown_cachedEntitlement() {
        LicenseKey key = ledger.issue(Tier.PRO, null).key();
        assertTrue(installationX.activate(key.value()).success());

        server.close();
        StatusView status = installationX.refresh();

        assertTrue(status.entitled());
        assertTrue(status.cached());
        assertFalse(installationX.deactivate().success());
        assertTrue(installationX.currentStatus().entitled());
    }

    private LicenseClient client(String name, Duration refreshInterval) {
        LicenseConfig config = LicenseConfig.defaults()
            .withConfigDir(tempDir.resolve(name))
            .withServerUrl(server.getBaseUrl())
            .withRequestTimeout(Duration.ofSeconds(2))
            .withRefreshInterval(refreshInterval);
        return LicenseClient.create(
            config,
            new HttpLicenseAuthority(config.serverUrl(), config.requestTimeout()),
            Clock.systemUTC()
        );
    }
}
