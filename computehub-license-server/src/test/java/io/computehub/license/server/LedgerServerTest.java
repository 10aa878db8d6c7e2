package io.computehub.license.server;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * HTTP-level tests for {@link LedgerServer}.
 */
class LedgerServerTest {

    private static final String SECRET = "s3cret-admin";

    @TempDir
    Path tempDir;

    private LedgerServer server;
    private HttpClient http;

    @BeforeEach
    void setUp() throws IOException {
        LedgerConfig config = LedgerConfig.fromEnvironment(Map.of())
            .withPort(0)
            .withDataFile(tempDir.resolve("ledger.json"))
            .withAdminSecret(SECRET);
        ActivationLedger ledger = ActivationLedger.open(new LedgerStore(config.dataFile()), Clock.systemUTC());
        server = new LedgerServer(ledger, config);
        server.start();
        http = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build();
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    @Test
    @DisplayName("health endpoint")
    void health() throws Exception {
        var response = get("/health");

        assertEquals(200, response.statusCode());
        JsonObject json = parse(response);
        assertEquals("ok", json.get("status").getAsString());
        assertEquals("license-server", json.get("service").getAsString());
    }

    @Test
    @DisplayName("issue requires the admin secret")
    void issue_withoutSecret_forbidden() throws Exception {
        assertEquals(403, post("/api/issue", "{\"tier\":\"pro\"}", null).statusCode());
        assertEquals(403, post("/api/issue", "{\"tier\":\"pro\"}", "wrong").statusCode());
    }

    @Test
    @DisplayName("issue returns a new key")
    void issue_withSecret() throws Exception {
        var response = post("/api/issue", "{\"tier\":\"pro\",\"email\":\"buyer@example.com\"}", SECRET);

        assertEquals(201, response.statusCode());
        JsonObject json = parse(response);
        assertTrue(json.get("license_key").getAsString().startsWith("COMPUTEHUB-"));
        assertEquals("pro", json.get("tier").getAsString());
    }

    @Test
    @DisplayName("issue rejects the free tier")
    void issue_freeTier_badRequest() throws Exception {
        assertEquals(400, post("/api/issue", "{\"tier\":\"free\"}", SECRET).statusCode());
    }

    @Test
    @DisplayName("bind, conflict, verify, unbind over HTTP")
    void bindLifecycle() throws Exception {
        String key = issue();

        var bind = post("/api/bind", bindBody(key, "install-x"), null);
        assertEquals(200, bind.statusCode());
        assertEquals("ok", parse(bind).get("status").getAsString());
        assertTrue(parse(bind).has("activated_at"));

        var conflict = post("/api/bind", bindBody(key, "install-y"), null);
        assertEquals(409, conflict.statusCode());
        assertEquals("conflict", parse(conflict).get("status").getAsString());

        var verify = post("/api/verify", keyBody(key, "install-y"), null);
        assertEquals("bound_elsewhere", parse(verify).get("binding").getAsString());

        var unbind = post("/api/unbind", keyBody(key, "install-x"), null);
        assertEquals("ok", parse(unbind).get("status").getAsString());

        var again = post("/api/unbind", keyBody(key, "install-x"), null);
        assertEquals("not_bound", parse(again).get("status").getAsString());
    }

    @Test
    @DisplayName("lowercase key in request is normalized")
    void bind_lowercaseKey() throws Exception {
        String key = issue();

        var bind = post("/api/bind", bindBody(key.toLowerCase(), "install-x"), null);

        assertEquals(200, bind.statusCode());
    }

    @Test
    @DisplayName("unknown key binds as invalid")
    void bind_unknownKey_404() throws Exception {
        var response = post("/api/bind", bindBody("COMPUTEHUB-ZZZZ-ZZZZ-ZZZZ-ZZZZ", "install-x"), null);

        assertEquals(404, response.statusCode());
        assertEquals("invalid", parse(response).get("status").getAsString());
    }

    @Test
    @DisplayName("revoke over HTTP")
    void revoke() throws Exception {
        String key = issue();
        post("/api/bind", bindBody(key, "install-x"), null);

        var revoke = post("/api/revoke", "{\"license_key\":\"" + key + "\",\"reason\":\"Refund\"}", SECRET);

        assertEquals(200, revoke.statusCode());
        assertTrue(parse(revoke).get("success").getAsBoolean());
        var verify = post("/api/verify", keyBody(key, "install-x"), null);
        assertEquals("not_bound", parse(verify).get("binding").getAsString());
        assertFalse(parse(verify).get("valid").getAsBoolean());
    }

    @Test
    @DisplayName("malformed JSON is a bad request")
    void malformedBody_400() throws Exception {
        assertEquals(400, post("/api/verify", "{not json", null).statusCode());
        assertEquals(400, post("/api/verify", "", null).statusCode());
        assertEquals(400, post("/api/verify", "{\"license_key\":\"COMPUTEHUB-AAAA-BBBB-CCCC-DDDD\"}", null)
            .statusCode());
    }

    @Test
    @DisplayName("wrong method is rejected")
    void wrongMethod_405() throws Exception {
        assertEquals(405, get("/api/verify").statusCode());
    }

    @Test
    @DisplayName("unknown path is not found")
    void unknownPath_404() throws Exception {
        assertEquals(404, get("/api/nothing-here").statusCode());
    }

    private String issue() throws Exception {
        var response = post("/api/issue", "{\"tier\":\"pro\"}", SECRET);
        return parse(response).get("license_key").getAsString();
    }

    private static String bindBody(String key, String installation) {
        return "{\"license_key\":\"" + key + "\",\"installation_id\":\"" + installation
            + "\",\"machine_name\":\"" + installation + " (Linux)\"}";
    }

    private static String keyBody(String key, String installation) {
        return "{\"license_key\":\"" + key + "\",\"installation_id\":\"" + installation + "\"}";
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder(server.getBaseUrl().resolve(path)).GET().build();
        return http.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String body, String secret) throws Exception {
        HttpRequest.Builder builder = HttpRequest.newBuilder(server.getBaseUrl().resolve(path))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body));
        if (secret != null) {
            builder.header(LedgerServer.ADMIN_HEADER, secret);
        }
        return http.send(builder.build(), HttpResponse.BodyHandlers.ofString());
    }

    private static JsonObject parse(HttpResponse<String> response) {
        return JsonParser.parseString(response.body()).getAsJsonObject();
    }
}
