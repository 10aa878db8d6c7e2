package io.computehub.license;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration for ComputeHub licensing.
 *
 * <p>Values come from environment variables, falling back to defaults:
 * <ul>
 *   <li>{@code COMPUTEHUB_LICENSE_SERVER} - absolute http(s) license server URL (no server: activation unavailable)</li>
 *   <li>{@code COMPUTEHUB_LICENSE_TIMEOUT_SECONDS} - bound on each server call (default 15)</li>
 *   <li>{@code COMPUTEHUB_LICENSE_MAX_STALENESS_DAYS} - offline tolerance (default 14)</li>
 *   <li>{@code COMPUTEHUB_LICENSE_REFRESH_HOURS} - background re-verification interval (default 6)</li>
 *   <li>{@code XDG_CONFIG_HOME} - base of the config directory (default {@code ~/.config})</li>
 * </ul>
 *
 * @param configDir directory holding the installation id, store key and activation record
 * @param serverUrl license server root, or null if none is configured
 * @param requestTimeout bound on each license server call
 * @param maxStaleness how long a verification may be trusted while the server is unreachable
 * @param refreshInterval delay between background re-verifications
 */
public record LicenseConfig(
    Path configDir,
    URI serverUrl,
    Duration requestTimeout,
    Duration maxStaleness,
    Duration refreshInterval
) {

    public static final String ENV_SERVER_URL = "COMPUTEHUB_LICENSE_SERVER";
    public static final String ENV_TIMEOUT_SECONDS = "COMPUTEHUB_LICENSE_TIMEOUT_SECONDS";
    public static final String ENV_MAX_STALENESS_DAYS = "COMPUTEHUB_LICENSE_MAX_STALENESS_DAYS";
    public static final String ENV_REFRESH_HOURS = "COMPUTEHUB_LICENSE_REFRESH_HOURS";

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(15);
    public static final Duration DEFAULT_MAX_STALENESS = Duration.ofDays(14);
    public static final Duration DEFAULT_REFRESH_INTERVAL = Duration.ofHours(6);

    /**
     * Where to buy a license.
     */
    public static final String PURCHASE_URL = "https://gumroad.com/l/computehub-pro";

    public LicenseConfig {
        Objects.requireNonNull(configDir, "configDir cannot be null");
        if (serverUrl != null) {
            requireHttpUrl(serverUrl);
        }
        requirePositive(requestTimeout, "requestTimeout");
        requirePositive(maxStaleness, "maxStaleness");
        requirePositive(refreshInterval, "refreshInterval");
    }

    /**
     * Defaults with no license server.
     */
    public static LicenseConfig defaults() {
        return new LicenseConfig(
            defaultConfigDir(System.getenv()),
            null,
            DEFAULT_TIMEOUT,
            DEFAULT_MAX_STALENESS,
            DEFAULT_REFRESH_INTERVAL
        );
    }

    /**
     * Configuration from the process environment.
     */
    public static LicenseConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Configuration from the given environment map.
     *
     * @throws IllegalArgumentException if a variable is set to an unusable value
     */
    public static LicenseConfig fromEnvironment(Map<String, String> env) {
        String server = env.get(ENV_SERVER_URL);
        return new LicenseConfig(
            defaultConfigDir(env),
            server != null && !server.isBlank() ? parseUrl(server.trim()) : null,
            Duration.ofSeconds(parseLong(env, ENV_TIMEOUT_SECONDS, DEFAULT_TIMEOUT.toSeconds())),
            Duration.ofDays(parseLong(env, ENV_MAX_STALENESS_DAYS, DEFAULT_MAX_STALENESS.toDays())),
            Duration.ofHours(parseLong(env, ENV_REFRESH_HOURS, DEFAULT_REFRESH_INTERVAL.toHours()))
        );
    }

    public LicenseConfig withConfigDir(Path dir) {
        return new LicenseConfig(dir, serverUrl, requestTimeout, maxStaleness, refreshInterval);
    }

    public LicenseConfig withServerUrl(URI url) {
        return new LicenseConfig(configDir, url, requestTimeout, maxStaleness, refreshInterval);
    }

    public LicenseConfig withRequestTimeout(Duration timeout) {
        return new LicenseConfig(configDir, serverUrl, timeout, maxStaleness, refreshInterval);
    }

    public LicenseConfig withMaxStaleness(Duration staleness) {
        return new LicenseConfig(configDir, serverUrl, requestTimeout, staleness, refreshInterval);
    }

    public LicenseConfig withRefreshInterval(Duration interval) {
        return new LicenseConfig(configDir, serverUrl, requestTimeout, maxStaleness, interval);
    }

    public boolean hasServer() {
        return serverUrl != null;
    }

    private static Path defaultConfigDir(Map<String, String> env) {
        String configHome = env.get("XDG_CONFIG_HOME");
        if (configHome != null && !configHome.isBlank()) {
            return Path.of(configHome, "computehub");
        }
        return Path.of(System.getProperty("user.home"), ".config", "computehub");
    }

    private static long parseLong(Map<String, String> env, String name, long defaultValue) {
        String value = env.get(name);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be a whole number: " + value, e);
        }
    }

    private static URI parseUrl(String value) {
        try {
            return URI.create(value);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(ENV_SERVER_URL + " is not a valid URL: " + value, e);
        }
    }

    private static void requireHttpUrl(URI url) {
        String scheme = url.getScheme();
        if (!url.isAbsolute() || url.getHost() == null
                || !("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme))) {
            throw new IllegalArgumentException(
                "License server URL must be an absolute http or https URL: " + url
            );
        }
    }

    private static void requirePositive(Duration value, String name) {
        Objects.requireNonNull(value, name + " cannot be null");
        if (value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }
}
