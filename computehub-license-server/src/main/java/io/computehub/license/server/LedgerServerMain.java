package io.computehub.license.server;

import io.computehub.license.KeyParseResult;
import io.computehub.license.LicenseKey;
import io.computehub.license.LicenseKeyCodec;
import io.computehub.license.Tier;

import java.io.IOException;
import java.time.Clock;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CountDownLatch;

/**
 * ComputeHub License Server - command line entry point.
 *
 * <p>Commands:
 * <ul>
 *   <li>serve - Run the HTTP server (default)</li>
 *   <li>issue - Issue a key directly into the ledger file</li>
 *   <li>revoke - Revoke a key directly in the ledger file</li>
 *   <li>show - Show the ledger entry for a key</li>
 *   <li>log - Show recent ledger events</li>
 * </ul>
 *
 * <p>Offline commands operate on the ledger file and must not run while a server
 * holds the same file.
 */
public class LedgerServerMain {

    private static final String VERSION = "1.0.0";
    static final int DEFAULT_LOG_LIMIT = 20;

    public static void main(String[] args) {
        String command = args.length == 0 ? "serve" : args[0];

        if (command.equals("--help") || command.equals("-h")) {
            printHelp();
            return;
        }
        if (command.equals("--version") || command.equals("-v")) {
            System.out.println("computehub-license-server " + VERSION);
            return;
        }
        String[] commandArgs = args.length == 0 ? args : Arrays.copyOfRange(args, 1, args.length);

        try {
            LedgerConfig config = LedgerConfig.fromEnvironment();
            switch (command) {
                case "serve" -> handleServe(config);
                case "issue" -> handleIssue(config, commandArgs);
                case "revoke" -> handleRevoke(config, commandArgs);
                case "show" -> handleShow(config, commandArgs);
                case "log" -> handleLog(config, commandArgs);
                default -> {
                    System.err.println("Unknown command: " + command);
                    System.err.println("Run 'computehub-license-server --help' for usage.");
                    System.exit(1);
                }
            }
        } catch (LedgerStorageException e) {
            System.err.println("Ledger error: " + e.getMessage());
            System.exit(1);
        } catch (IOException e) {
            System.err.println("I/O error: " + e.getMessage());
            System.exit(1);
        } catch (IllegalArgumentException e) {
            System.err.println("Error: " + e.getMessage());
            System.err.println("Run 'computehub-license-server --help' for usage.");
            System.exit(1);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void handleServe(LedgerConfig config) throws IOException, InterruptedException {
        ActivationLedger ledger = openLedger(config);
        LedgerServer server = new LedgerServer(ledger, config);
        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            server.close();
            stopped.countDown();
        }, "license-server-shutdown"));

        server.start();
        System.out.println("ComputeHub License Server listening on port " + server.getPort());
        System.out.println("Ledger: " + config.dataFile().toAbsolutePath());
        stopped.await();
    }

    private static void handleIssue(LedgerConfig config, String[] args) {
        String tierName = getFlagValue(args, "--tier");
        String email = getFlagValue(args, "--email");
        Tier tier = tierName != null ? Tier.valueOf(tierName.toUpperCase(Locale.ROOT)) : Tier.PRO;

        IssuedLicense issued = openLedger(config).issue(tier, email);
        System.out.println(issued.key().value());
        System.err.println("Tier: " + issued.tier().getDisplayName() + (email != null ? " (" + email + ")" : ""));
    }

    private static void handleRevoke(LedgerConfig config, String[] args) {
        if (args.length == 0 || args[0].startsWith("--")) {
            System.err.println("Error: license key is required");
            System.err.println("Usage: computehub-license-server revoke <key> [--reason <text>]");
            System.exit(1);
        }
        RevokeResult result = openLedger(config).revoke(parseKey(args[0]), getFlagValue(args, "--reason"));
        if (!result.success()) {
            System.err.println(result.message());
            System.exit(1);
        }
        System.out.println(result.message());
    }

    private static void handleShow(LedgerConfig config, String[] args) {
        if (args.length == 0) {
            System.err.println("Usage: computehub-license-server show <key>");
            System.exit(1);
        }
        LedgerEntry entry = openLedger(config).find(parseKey(args[0]));
        if (entry == null) {
            System.err.println("License key not found");
            System.exit(1);
        }
        System.out.println("License:      " + entry.maskedKey());
        System.out.println("Tier:         " + entry.tier().getDisplayName());
        System.out.println("Email:        " + (entry.email() != null ? entry.email() : "-"));
        System.out.println("Issued:       " + entry.createdAt());
        if (entry.isRevoked()) {
            System.out.println("Revoked:      " + entry.revokedAt() + " (" + entry.revokedReason() + ")");
        } else if (entry.isBound()) {
            System.out.println("Installation: " + entry.installationId() + " - " + entry.machineName());
            System.out.println("Bound since:  " + entry.boundAt());
        } else {
            System.out.println("Installation: not bound");
        }
    }

    private static void handleLog(LedgerConfig config, String[] args) {
        int limit = parseLimit(getFlagValue(args, "--limit"));
        List<LedgerEvent> events = openLedger(config).recentEvents(limit);
        for (LedgerEvent e : events) {
            System.out.printf("%s  %-6s  %-30s  %-5s  %s%n",
                e.at(), e.operation(), e.maskedKey(), e.success() ? "ok" : "fail",
                e.detail() != null ? e.detail() : "");
        }
    }

    /**
     * Parse the {@code log --limit} value; absent means {@link #DEFAULT_LOG_LIMIT}.
     *
     * @throws IllegalArgumentException if the value is not a non-negative whole number
     */
    static int parseLimit(String value) {
        if (value == null) {
            return DEFAULT_LOG_LIMIT;
        }
        int limit;
        try {
            limit = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--limit must be a non-negative whole number: " + value, e);
        }
        if (limit < 0) {
            throw new IllegalArgumentException("--limit must be a non-negative whole number: " + value);
        }
        return limit;
    }

    private static ActivationLedger openLedger(LedgerConfig config) {
        return ActivationLedger.open(new LedgerStore(config.dataFile()), Clock.systemUTC());
    }

    private static LicenseKey parseKey(String raw) {
        KeyParseResult parsed = LicenseKeyCodec.DEFAULT.normalize(raw);
        if (!parsed.isValid()) {
            throw new IllegalArgumentException(parsed.error());
        }
        return parsed.key();
    }

    private static String getFlagValue(String[] args, String flag) {
        List<String> argList = Arrays.asList(args);
        int index = argList.indexOf(flag);
        if (index >= 0 && index < args.length - 1) {
            return args[index + 1];
        }
        return null;
    }

    private static void printHelp() {
        System.out.println("ComputeHub License Server");
        System.out.println();
        System.out.println("Usage: computehub-license-server [command] [options]");
        System.out.println();
        System.out.println("Commands:");
        System.out.println("  serve         Run the HTTP server (default)");
        System.out.println("  issue         Issue a key (--tier pro, --email <address>)");
        System.out.println("  revoke <key>  Revoke a key (--reason <text>)");
        System.out.println("  show <key>    Show who holds a key");
        System.out.println("  log           Show recent ledger events (--limit <n>)");
        System.out.println();
        System.out.println("Environment:");
        System.out.println("  " + LedgerConfig.ENV_PORT + "          Listen port (default " + LedgerConfig.DEFAULT_PORT + ")");
        System.out.println("  " + LedgerConfig.ENV_DATA + "          Ledger file (default ledger.json)");
        System.out.println("  " + LedgerConfig.ENV_ADMIN_SECRET + "  Secret for admin endpoints");
    }
}
