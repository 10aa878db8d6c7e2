package io.computehub.license;

import java.io.IOException;
import java.net.InetAddress;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;
import java.util.logging.Logger;

/**
 * Stable identity of one ComputeHub installation.
 *
 * <p>The license server binds each key to exactly one installation id. The id is a
 * random UUID created on first use and kept in the config directory, so it survives
 * restarts and upgrades but not a wipe of the config directory. It is not a secret.
 *
 * @param id the installation id sent to the license server
 * @param machineName human-readable name shown by the server (hostname and OS)
 */
public record InstallationIdentity(String id, String machineName) {

    /**
     * File under the config directory holding the installation id.
     */
    public static final String ID_FILE = "installation-id";

    private static final Logger LOG = Logger.getLogger(InstallationIdentity.class.getName());

    public InstallationIdentity {
        Objects.requireNonNull(id, "id cannot be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id cannot be blank");
        }
        if (machineName == null || machineName.isBlank()) {
            machineName = "unknown";
        }
    }

    /**
     * Read the installation id from {@code configDir}, creating it on first use.
     *
     * @param configDir the license config directory
     * @return the identity of this installation
     * @throws LicenseStorageException if the id file cannot be read or written
     */
    public static InstallationIdentity loadOrCreate(Path configDir) {
        Path idFile = configDir.resolve(ID_FILE);
        try {
            if (Files.exists(idFile)) {
                String existing = Files.readString(idFile).trim();
                if (!existing.isEmpty()) {
                    return new InstallationIdentity(existing, getMachineName());
                }
                LOG.warning("Installation id file is empty, generating a new id");
            }

            String id = UUID.randomUUID().toString();
            SecureFiles.writeAtomically(idFile, id + "\n");
            LOG.info("Generated installation id " + id);
            return new InstallationIdentity(id, getMachineName());
        } catch (IOException e) {
            throw new LicenseStorageException("Cannot read or create installation id at " + idFile, e);
        }
    }

    /**
     * Get a short, human-readable machine name, e.g. {@code gpu-box-01 (Linux)}.
     */
    public static String getMachineName() {
        String hostname = getHostname();
        String os = System.getProperty("os.name", "Unknown");
        String lower = os.toLowerCase(Locale.ROOT);

        if (lower.contains("mac")) {
            return hostname + " (macOS)";
        } else if (lower.contains("linux")) {
            return hostname + " (Linux)";
        } else {
            return hostname + " (" + os + ")";
        }
    }

    private static String getHostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (IOException e) {
            return "unknown";
        }
    }
}
