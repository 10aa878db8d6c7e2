package io.computehub.license;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * {@link LicenseAuthority} backed by the ComputeHub license server.
 *
 * <p>Endpoints (JSON bodies, snake_case fields):
 * <ul>
 *   <li>{@code POST /api/bind} - 200 {@code {"status":"ok"}}, 409 conflict, 404 invalid</li>
 *   <li>{@code POST /api/unbind} - 200 {@code {"status":"ok"|"not_bound"}}</li>
 *   <li>{@code POST /api/verify} - 200 {@code {"binding":"bound_to_this"|...}}</li>
 * </ul>
 *
 * <p>The key travels only in request bodies, never in the URL. Every request carries
 * the configured timeout; transport errors, timeouts, 5xx and unparsable bodies all
 * become {@link AuthorityUnavailableException}.
 */
public class HttpLicenseAuthority implements LicenseAuthority {

    private static final Logger LOG = Logger.getLogger(HttpLicenseAuthority.class.getName());
    private static final Gson GSON = new Gson();

    private final URI baseUrl;
    private final Duration timeout;
    private final HttpClient httpClient;

    /**
     * @param baseUrl license server root, e.g. {@code https://license.computehub.io}
     * @param timeout bound on connect and on each request
     */
    public HttpLicenseAuthority(URI baseUrl, Duration timeout) {
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl cannot be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout cannot be null");
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(timeout)
            .build();
    }

    @Override
    public String getName() {
        return "ComputeHub license server (" + baseUrl + ")";
    }

    @Override
    public BindResult bind(LicenseKey licenseKey, InstallationIdentity identity)
            throws AuthorityUnavailableException {
        JsonObject body = new JsonObject();
        body.addProperty("license_key", licenseKey.value());
        body.addProperty("installation_id", identity.id());
        body.addProperty("machine_name", identity.machineName());

        HttpResponse<String> response = post("/api/bind", body);
        int status = response.statusCode();
        JsonObject json = parseBody(response);
        String message = optString(json, "message");

        return switch (status) {
            case 200, 201 -> {
                requireStatus(json, "ok");
                yield BindResult.ok(Tier.fromWireName(optString(json, "tier")), optInstant(json, "activated_at"));
            }
            case 409 -> BindResult.conflict(message);
            case 400, 404, 410, 422 -> BindResult.invalid(message);
            default -> throw unexpected("bind", status);
        };
    }

    @Override
    public UnbindOutcome unbind(LicenseKey licenseKey, String installationId)
            throws AuthorityUnavailableException {
        JsonObject body = new JsonObject();
        body.addProperty("license_key", licenseKey.value());
        body.addProperty("installation_id", installationId);

        HttpResponse<String> response = post("/api/unbind", body);
        if (response.statusCode() != 200) {
            throw unexpected("unbind", response.statusCode());
        }
        String status = optString(parseBody(response), "status");
        if ("ok".equals(status)) {
            return UnbindOutcome.OK;
        }
        if ("not_bound".equals(status)) {
            return UnbindOutcome.NOT_BOUND;
        }
        throw new AuthorityUnavailableException("Unexpected unbind status: " + status);
    }

    @Override
    public BindingState verify(LicenseKey licenseKey, String installationId)
            throws AuthorityUnavailableException {
        JsonObject body = new JsonObject();
        body.addProperty("license_key", licenseKey.value());
        body.addProperty("installation_id", installationId);

        HttpResponse<String> response = post("/api/verify", body);
        if (response.statusCode() != 200) {
            throw unexpected("verify", response.statusCode());
        }
        try {
            return BindingState.fromWireName(optString(parseBody(response), "binding"));
        } catch (IllegalArgumentException e) {
            throw new AuthorityUnavailableException("Unexpected verify response", e);
        }
    }

    private HttpResponse<String> post(String path, JsonObject body) throws AuthorityUnavailableException {
        HttpRequest request;
        try {
            request = HttpRequest.newBuilder()
                .uri(baseUrl.resolve(path))
                .header("Accept", "application/json")
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(GSON.toJson(body)))
                .timeout(timeout)
                .build();
        } catch (IllegalArgumentException e) {
            LOG.warning("License server URL is unusable: " + baseUrl);
            throw new AuthorityUnavailableException("Invalid license server URL: " + baseUrl, e);
        }

        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            LOG.fine("License server call " + path + " failed: " + e);
            throw new AuthorityUnavailableException("Network error: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AuthorityUnavailableException("Request interrupted", e);
        }
    }

    private static JsonObject parseBody(HttpResponse<String> response) throws AuthorityUnavailableException {
        String body = response.body();
        if (body == null || body.isBlank()) {
            return new JsonObject();
        }
        try {
            JsonElement element = JsonParser.parseString(body);
            return element.isJsonObject() ? element.getAsJsonObject() : new JsonObject();
        } catch (JsonParseException e) {
            throw new AuthorityUnavailableException("Failed to parse response (HTTP " + response.statusCode() + ")", e);
        }
    }

    private static void requireStatus(JsonObject json, String expected) throws AuthorityUnavailableException {
        String status = optString(json, "status");
        if (!expected.equals(status)) {
            throw new AuthorityUnavailableException("Unexpected status in response: " + status);
        }
    }

    private static String optString(JsonObject json, String field) {
        JsonElement value = json.get(field);
        if (value == null || !value.isJsonPrimitive()) {
            return null;
        }
        return value.getAsString();
    }

    private static Instant optInstant(JsonObject json, String field) {
        String value = optString(json, field);
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static AuthorityUnavailableException unexpected(String operation, int status) {
        return new AuthorityUnavailableException(
            "License server " + operation + " failed (HTTP " + status + ")"
        );
    }
}
