package io.computehub.license.server;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.computehub.license.BindOutcome;
import io.computehub.license.BindResult;
import io.computehub.license.BindingState;
import io.computehub.license.KeyParseResult;
import io.computehub.license.LicenseKeyCodec;
import io.computehub.license.Tier;
import io.computehub.license.UnbindOutcome;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * HTTP front end of the {@link ActivationLedger}.
 *
 * <p>Endpoints (JSON bodies, snake_case fields):
 * <ul>
 *   <li>{@code POST /api/bind} - bind a key to an installation</li>
 *   <li>{@code POST /api/unbind} - release a key</li>
 *   <li>{@code POST /api/verify} - report who holds a key</li>
 *   <li>{@code POST /api/issue} - admin: issue a new key</li>
 *   <li>{@code POST /api/revoke} - admin: revoke a key</li>
 *   <li>{@code GET /health} - liveness</li>
 * </ul>
 *
 * <p>Admin endpoints need the {@code X-Admin-Secret} header. Keys only ever arrive in
 * request bodies, and only masked keys are logged.
 */
public class LedgerServer implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(LedgerServer.class.getName());
    private static final Gson GSON = new Gson();

    public static final String ADMIN_HEADER = "X-Admin-Secret";
    public static final String SERVICE_NAME = "license-server";

    private static final int MAX_BODY_BYTES = 64 * 1024;

    private final ActivationLedger ledger;
    private final LedgerConfig config;
    private final LicenseKeyCodec codec;

    private HttpServer server;
    private ExecutorService executor;

    public LedgerServer(ActivationLedger ledger, LedgerConfig config) {
        this(ledger, config, LicenseKeyCodec.DEFAULT);
    }

    public LedgerServer(ActivationLedger ledger, LedgerConfig config, LicenseKeyCodec codec) {
        this.ledger = Objects.requireNonNull(ledger, "ledger cannot be null");
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.codec = Objects.requireNonNull(codec, "codec cannot be null");
    }

    /**
     * Bind the port and start serving.
     *
     * @throws IOException if the port cannot be bound
     */
    public synchronized void start() throws IOException {
        if (server != null) {
            throw new IllegalStateException("Server already started");
        }
        HttpServer http = HttpServer.create(new InetSocketAddress(config.port()), 0);
        http.createContext("/api/bind", route("POST", false, this::handleBind));
        http.createContext("/api/unbind", route("POST", false, this::handleUnbind));
        http.createContext("/api/verify", route("POST", false, this::handleVerify));
        http.createContext("/api/issue", route("POST", true, this::handleIssue));
        http.createContext("/api/revoke", route("POST", true, this::handleRevoke));
        http.createContext("/health", route("GET", false, body -> health()));
        http.createContext("/", route("GET", false, body -> root()));

        AtomicInteger counter = new AtomicInteger();
        executor = Executors.newFixedThreadPool(config.threads(), r -> {
            Thread t = new Thread(r, "license-server-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        http.setExecutor(executor);
        http.start();
        server = http;
        LOG.info("License server listening on port " + getPort() + " (" + ledger.size() + " licenses, admin "
            + (config.adminEnabled() ? "enabled" : "disabled") + ")");
    }

    /**
     * The bound port, useful when configured with port 0.
     */
    public synchronized int getPort() {
        if (server == null) {
            throw new IllegalStateException("Server not started");
        }
        return server.getAddress().getPort();
    }

    public URI getBaseUrl() {
        return URI.create("http://127.0.0.1:" + getPort());
    }

    @Override
    public synchronized void close() {
        if (server != null) {
            server.stop(0);
            server = null;
            LOG.info("License server stopped");
        }
        if (executor != null) {
            executor.shutdownNow();
            executor = null;
        }
    }

    // ===== Handlers =====

    private Response handleBind(JsonObject body) {
        KeyParseResult key = codec.normalize(optString(body, "license_key"));
        String installationId = requireString(body, "installation_id");
        if (!key.isValid()) {
            return Response.of(404, status("invalid", key.error()));
        }

        BindResult result = ledger.bind(key.key(), installationId, optString(body, "machine_name"));
        if (result.outcome() == BindOutcome.CONFLICT) {
            return Response.of(409, status("conflict", result.message()));
        }
        if (result.outcome() == BindOutcome.INVALID) {
            return Response.of(404, status("invalid", result.message()));
        }
        JsonObject json = status("ok", "License activated");
        json.addProperty("tier", result.tier().name().toLowerCase(Locale.ROOT));
        if (result.activatedAt() != null) {
            json.addProperty("activated_at", result.activatedAt().toString());
        }
        return Response.of(200, json);
    }

    private Response handleUnbind(JsonObject body) {
        KeyParseResult key = codec.normalize(optString(body, "license_key"));
        String installationId = requireString(body, "installation_id");
        UnbindOutcome outcome = key.isValid()
            ? ledger.unbind(key.key(), installationId)
            : UnbindOutcome.NOT_BOUND;
        return Response.of(200, status(outcome == UnbindOutcome.OK ? "ok" : "not_bound", null));
    }

    private Response handleVerify(JsonObject body) {
        KeyParseResult key = codec.normalize(optString(body, "license_key"));
        String installationId = requireString(body, "installation_id");
        BindingState state = key.isValid()
            ? ledger.verify(key.key(), installationId)
            : BindingState.NOT_BOUND;

        JsonObject json = new JsonObject();
        json.addProperty("binding", state.wireName());
        json.addProperty("valid", state == BindingState.BOUND_TO_THIS);
        return Response.of(200, json);
    }

    private Response handleIssue(JsonObject body) {
        String tierName = optString(body, "tier");
        Tier tier;
        try {
            tier = tierName != null ? Tier.valueOf(tierName.trim().toUpperCase(Locale.ROOT)) : Tier.PRO;
        } catch (IllegalArgumentException e) {
            throw new BadRequestException("Unknown tier: " + tierName);
        }
        if (!tier.isPaid()) {
            throw new BadRequestException("Cannot issue a key for the free tier");
        }

        IssuedLicense issued = ledger.issue(tier, optString(body, "email"));
        JsonObject json = new JsonObject();
        json.addProperty("license_key", issued.key().value());
        json.addProperty("tier", issued.tier().name().toLowerCase(Locale.ROOT));
        return Response.of(201, json);
    }

    private Response handleRevoke(JsonObject body) {
        KeyParseResult key = codec.normalize(optString(body, "license_key"));
        RevokeResult result = key.isValid()
            ? ledger.revoke(key.key(), optString(body, "reason"))
            : RevokeResult.notFound();

        JsonObject json = new JsonObject();
        json.addProperty("success", result.success());
        json.addProperty("message", result.message());
        return Response.of(200, json);
    }

    private Response health() {
        JsonObject json = new JsonObject();
        json.addProperty("status", "ok");
        json.addProperty("service", SERVICE_NAME);
        return Response.of(200, json);
    }

    private Response root() {
        JsonObject endpoints = new JsonObject();
        endpoints.addProperty("bind", "POST /api/bind");
        endpoints.addProperty("unbind", "POST /api/unbind");
        endpoints.addProperty("verify", "POST /api/verify");
        endpoints.addProperty("issue", "POST /api/issue (admin only)");
        endpoints.addProperty("revoke", "POST /api/revoke (admin only)");
        endpoints.addProperty("health", "GET /health");

        JsonObject json = new JsonObject();
        json.addProperty("service", "ComputeHub License Server");
        json.add("endpoints", endpoints);
        return Response.of(200, json);
    }

    // ===== Plumbing =====

    private com.sun.net.httpserver.HttpHandler route(String method, boolean admin, Handler handler) {
        return exchange -> {
            Response response;
            try {
                response = dispatch(exchange, method, admin, handler);
            } catch (BadRequestException e) {
                response = Response.of(400, error(e.getMessage()));
            } catch (LedgerStorageException e) {
                LOG.log(Level.SEVERE, "Ledger storage failure", e);
                response = Response.of(500, error("Ledger unavailable"));
            } catch (RuntimeException e) {
                LOG.log(Level.SEVERE, "Request to " + exchange.getRequestURI().getPath() + " failed", e);
                response = Response.of(500, error("Internal error"));
            }
            writeJson(exchange, response);
        };
    }

    private Response dispatch(HttpExchange exchange, String method, boolean admin, Handler handler)
            throws IOException {
        String path = exchange.getRequestURI().getPath();
        if (!path.equals(exchange.getHttpContext().getPath())) {
            return Response.of(404, error("Not found"));
        }
        if (!method.equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.getResponseHeaders().set("Allow", method);
            return Response.of(405, error("Method not allowed"));
        }
        if (admin) {
            Response denied = checkAdmin(exchange);
            if (denied != null) {
                return denied;
            }
        }
        JsonObject body = "POST".equals(method) ? readBody(exchange) : new JsonObject();
        return handler.handle(body);
    }

    private Response checkAdmin(HttpExchange exchange) {
        if (!config.adminEnabled()) {
            return Response.of(403, error("Admin endpoints are disabled"));
        }
        String presented = exchange.getRequestHeaders().getFirst(ADMIN_HEADER);
        if (presented == null || !MessageDigest.isEqual(
                presented.getBytes(StandardCharsets.UTF_8),
                config.adminSecret().getBytes(StandardCharsets.UTF_8))) {
            LOG.warning("Rejected admin request to " + exchange.getRequestURI().getPath()
                + " from " + exchange.getRemoteAddress());
            return Response.of(403, error("Invalid admin secret"));
        }
        return null;
    }

    private static JsonObject readBody(HttpExchange exchange) throws IOException {
        byte[] bytes;
        try (InputStream in = exchange.getRequestBody()) {
            bytes = in.readNBytes(MAX_BODY_BYTES + 1);
        }
        if (bytes.length > MAX_BODY_BYTES) {
            throw new BadRequestException("Request body too large");
        }
        String text = new String(bytes, StandardCharsets.UTF_8);
        if (text.isBlank()) {
            throw new BadRequestException("Request body is required");
        }
        try {
            JsonElement element = JsonParser.parseString(text);
            if (!element.isJsonObject()) {
                throw new BadRequestException("Request body must be a JSON object");
            }
            return element.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new BadRequestException("Malformed JSON");
        }
    }

    private static void writeJson(HttpExchange exchange, Response response) throws IOException {
        byte[] bytes = GSON.toJson(response.body()).getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        exchange.sendResponseHeaders(response.status(), bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private static String optString(JsonObject json, String field) {
        JsonElement value = json.get(field);
        if (value == null || !value.isJsonPrimitive()) {
            return null;
        }
        return value.getAsString();
    }

    private static String requireString(JsonObject json, String field) {
        String value = optString(json, field);
        if (value == null || value.isBlank()) {
            throw new BadRequestException("Missing field: " + field);
        }
        return value;
    }

    private static JsonObject status(String status, String message) {
        JsonObject json = new JsonObject();
        json.addProperty("status", status);
        if (message != null) {
            json.addProperty("message", message);
        }
        return json;
    }

    private static JsonObject error(String message) {
        JsonObject json = new JsonObject();
        json.addProperty("error", message);
        return json;
    }

    @FunctionalInterface
    private interface Handler {
        Response handle(JsonObject body);
    }

    private record Response(int status, JsonObject body) {
        static Response of(int status, JsonObject body) {
            return new Response(status, body);
        }
    }

    private static class BadRequestException extends RuntimeException {
        BadRequestException(String message) {
            super(message);
        }
    }
}
