package io.computehub.license.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import io.computehub.license.ActivationResult;
import io.computehub.license.DeactivationResult;
import io.computehub.license.LicenseClient;
import io.computehub.license.LicenseConfig;
import io.computehub.license.LicenseStorageException;
import io.computehub.license.ProFeature;
import io.computehub.license.StatusView;

import java.io.PrintStream;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * ComputeHub License CLI - manage the Pro license of this installation.
 *
 * <p>Commands:
 * <ul>
 *   <li>activate - Activate a license key</li>
 *   <li>deactivate - Release the license so it can move to another installation</li>
 *   <li>status - Show the license status (no network)</li>
 *   <li>refresh - Re-verify with the license server</li>
 *   <li>features - List Pro features and whether they are unlocked</li>
 * </ul>
 */
public class LicenseCli {

    private static final String VERSION = "1.0.0";
    private static final Gson JSON = new GsonBuilder()
        .setPrettyPrinting()
        .serializeNulls()
        .create();
    private static final DateTimeFormatter TIME_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneId.systemDefault());

    // Held so the level survives logger garbage collection.
    private static final Logger LIBRARY_LOG = Logger.getLogger("io.computehub.license");

    private final LicenseClient client;
    private final PrintStream out;
    private final PrintStream err;

    public LicenseCli(LicenseClient client, PrintStream out, PrintStream err) {
        this.client = client;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        if (args.length == 0 || args[0].equals("--help") || args[0].equals("-h")) {
            printHelp(System.out);
            return;
        }
        if (args[0].equals("--version") || args[0].equals("-v")) {
            System.out.println("computehub-license " + VERSION);
            return;
        }

        if (!hasFlag(args, "--verbose")) {
            LIBRARY_LOG.setLevel(Level.WARNING);
        }

        int exitCode;
        try (LicenseClient client = LicenseClient.create(LicenseConfig.fromEnvironment())) {
            exitCode = new LicenseCli(client, System.out, System.err).run(args);
        } catch (LicenseStorageException e) {
            System.err.println("Storage error: " + e.getMessage());
            exitCode = 1;
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            exitCode = 1;
        }
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    /**
     * Run one command.
     *
     * @return process exit code
     */
    public int run(String[] args) {
        if (args.length == 0) {
            printHelp(out);
            return 0;
        }
        String command = args[0];
        String[] commandArgs = Arrays.copyOfRange(args, 1, args.length);

        try {
            return switch (command) {
                case "activate" -> handleActivate(commandArgs);
                case "deactivate" -> handleDeactivate(commandArgs);
                case "status" -> handleStatus(commandArgs, false);
                case "refresh" -> handleStatus(commandArgs, true);
                case "features" -> handleFeatures(commandArgs);
                case "--help", "-h", "help" -> {
                    printHelp(out);
                    yield 0;
                }
                default -> {
                    err.println("Unknown command: " + command);
                    err.println("Run 'computehub-license --help' for usage.");
                    yield 1;
                }
            };
        } catch (LicenseStorageException e) {
            err.println("Storage error: " + e.getMessage());
            return 1;
        }
    }

    private int handleActivate(String[] args) {
        if (args.length == 0 || args[0].startsWith("--")) {
            err.println("Error: license key is required");
            err.println("Usage: computehub-license activate <key>");
            return 1;
        }
        boolean json = hasFlag(args, "--json");

        ActivationResult result = client.activate(args[0]);
        if (json) {
            JsonObject obj = new JsonObject();
            obj.addProperty("success", result.success());
            obj.addProperty("error", result.error());
            obj.addProperty("error_code", result.errorCode().name());
            obj.add("status", toJson(result.status()));
            out.println(JSON.toJson(obj));
        } else if (result.success()) {
            out.println("License activated successfully!");
            printStatus(result.status());
        } else {
            err.println("Activation failed: " + result.error());
        }
        return result.success() ? 0 : 1;
    }

    private int handleDeactivate(String[] args) {
        boolean json = hasFlag(args, "--json");

        DeactivationResult result = client.deactivate();
        if (json) {
            JsonObject obj = new JsonObject();
            obj.addProperty("success", result.success());
            obj.addProperty("was_active", result.wasActive());
            obj.addProperty("error", result.error());
            obj.addProperty("error_code", result.errorCode().name());
            out.println(JSON.toJson(obj));
        } else if (!result.success()) {
            err.println("Deactivation failed: " + result.error());
        } else if (result.wasActive()) {
            out.println("License deactivated. You can now activate it on another installation.");
        } else {
            out.println("No license is active on this installation.");
        }
        return result.success() ? 0 : 1;
    }

    private int handleStatus(String[] args, boolean refresh) {
        StatusView status = refresh ? client.refresh() : client.currentStatus();
        if (hasFlag(args, "--json")) {
            out.println(JSON.toJson(toJson(status)));
        } else {
            printStatus(status);
        }
        return 0;
    }

    private int handleFeatures(String[] args) {
        boolean json = hasFlag(args, "--json");
        JsonArray array = new JsonArray();

        if (!json) {
            out.println("Pro features:");
        }
        for (ProFeature feature : ProFeature.values()) {
            boolean enabled = client.entitlements().isEnabled(feature);
            if (json) {
                JsonObject obj = new JsonObject();
                obj.addProperty("feature", feature.name().toLowerCase(Locale.ROOT));
                obj.addProperty("name", feature.getDisplayName());
                obj.addProperty("enabled", enabled);
                array.add(obj);
            } else {
                out.printf("  [%s] %-24s %s%n", enabled ? "x" : " ", feature.getDisplayName(), feature.getDescription());
            }
        }
        if (json) {
            out.println(JSON.toJson(array));
        } else if (!client.currentStatus().entitled()) {
            out.println();
            out.println("Get ComputeHub Pro at " + LicenseConfig.PURCHASE_URL);
        }
        return 0;
    }

    private void printStatus(StatusView status) {
        out.println("Status:        " + status.message());
        out.println("Tier:          " + status.tier().getDisplayName());
        if (status.maskedKey() != null) {
            out.println("License:       " + status.maskedKey());
        }
        if (status.activatedAt() != null) {
            out.println("Activated:     " + formatTime(status.activatedAt()));
        }
        if (status.lastVerifiedAt() != null) {
            out.println("Last verified: " + formatTime(status.lastVerifiedAt()));
        }
        out.println("Installation:  " + client.getIdentity().id());
    }

    private static JsonObject toJson(StatusView status) {
        JsonObject obj = new JsonObject();
        obj.addProperty("entitled", status.entitled());
        obj.addProperty("tier", status.tier().name().toLowerCase(Locale.ROOT));
        obj.addProperty("masked_key", status.maskedKey());
        obj.addProperty("activated_at", status.activatedAt() != null ? status.activatedAt().toString() : null);
        obj.addProperty("last_verified_at",
            status.lastVerifiedAt() != null ? status.lastVerifiedAt().toString() : null);
        obj.addProperty("cached", status.cached());
        obj.addProperty("reason", status.reason().name());
        obj.addProperty("message", status.message());
        return obj;
    }

    private static String formatTime(Instant instant) {
        return TIME_FORMAT.format(instant);
    }

    private static boolean hasFlag(String[] args, String flag) {
        return Arrays.asList(args).contains(flag);
    }

    private static void printHelp(PrintStream out) {
        out.println("ComputeHub License CLI - manage the Pro license of this installation");
        out.println();
        out.println("Usage: computehub-license <command> [options]");
        out.println();
        out.println("Commands:");
        out.println("  activate <key>  Activate a license key");
        out.println("  deactivate      Release the license for use on another installation");
        out.println("  status          Show license status (offline)");
        out.println("  refresh         Re-verify with the license server");
        out.println("  features        List Pro features");
        out.println();
        out.println("Options:");
        out.println("  --json          Machine-readable output");
        out.println("  --verbose       Show informational log messages");
        out.println("  -h, --help      Show help");
        out.println("  -v, --version   Show version");
        out.println();
        out.println("Environment:");
        out.println("  " + LicenseConfig.ENV_SERVER_URL + "  License server URL");
        out.println();
        out.println("Examples:");
        out.println("  computehub-license activate COMPUTEHUB-XXXX-XXXX-XXXX-XXXX");
        out.println("  computehub-license status --json");
    }
}
