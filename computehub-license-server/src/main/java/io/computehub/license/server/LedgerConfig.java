package io.computehub.license.server;

import java.nio.file.Path;
import java.util.Map;

/**
 * Configuration for the license server.
 *
 * <p>Environment variables:
 * <ul>
 *   <li>{@code COMPUTEHUB_LEDGER_PORT} - listen port (default 8090, 0 picks a free port)</li>
 *   <li>{@code COMPUTEHUB_LEDGER_DATA} - ledger file (default {@code ledger.json} in the working directory)</li>
 *   <li>{@code COMPUTEHUB_LEDGER_ADMIN_SECRET} - secret for the admin endpoints; unset disables them</li>
 * </ul>
 *
 * @param port TCP port to listen on
 * @param dataFile where the ledger is persisted
 * @param adminSecret value required in the {@code X-Admin-Secret} header, or null
 * @param threads request handler threads
 */
public record LedgerConfig(int port, Path dataFile, String adminSecret, int threads) {

    public static final String ENV_PORT = "COMPUTEHUB_LEDGER_PORT";
    public static final String ENV_DATA = "COMPUTEHUB_LEDGER_DATA";
    public static final String ENV_ADMIN_SECRET = "COMPUTEHUB_LEDGER_ADMIN_SECRET";

    public static final int DEFAULT_PORT = 8090;
    public static final int DEFAULT_THREADS = 4;

    public LedgerConfig {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        if (dataFile == null) {
            throw new IllegalArgumentException("dataFile cannot be null");
        }
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1");
        }
        if (adminSecret != null && adminSecret.isBlank()) {
            adminSecret = null;
        }
    }

    public static LedgerConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * @throws IllegalArgumentException if the port is not a number
     */
    public static LedgerConfig fromEnvironment(Map<String, String> env) {
        String port = env.get(ENV_PORT);
        String data = env.get(ENV_DATA);
        int parsedPort;
        try {
            parsedPort = port != null && !port.isBlank() ? Integer.parseInt(port.trim()) : DEFAULT_PORT;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(ENV_PORT + " must be a number: " + port, e);
        }
        return new LedgerConfig(
            parsedPort,
            data != null && !data.isBlank() ? Path.of(data.trim()) : Path.of("ledger.json"),
            env.get(ENV_ADMIN_SECRET),
            DEFAULT_THREADS
        );
    }

    public LedgerConfig withPort(int newPort) {
        return new LedgerConfig(newPort, dataFile, adminSecret, threads);
    }

    public LedgerConfig withDataFile(Path file) {
        return new LedgerConfig(port, file, adminSecret, threads);
    }

    public LedgerConfig withAdminSecret(String secret) {
        return new LedgerConfig(port, dataFile, secret, threads);
    }

    public boolean adminEnabled() {
        return adminSecret != null;
    }

    @Override
    public String toString() {
        return "LedgerConfig[port=" + port + ", dataFile=" + dataFile
            + ", admin=" + (adminEnabled() ? "enabled" : "disabled") + ", threads=" + threads + "]";
    }
}
