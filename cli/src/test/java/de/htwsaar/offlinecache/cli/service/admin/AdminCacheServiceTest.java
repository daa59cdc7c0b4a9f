package de.htwsaar.offlinecache.cli.service.admin;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import de.htwsaar.offlinecache.cli.dto.ConfigPatchRequest;
import de.htwsaar.offlinecache.cli.dto.HttpCallResult;
import de.htwsaar.offlinecache.common.serialization.JacksonCodec;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AdminCacheServiceTest {

    private HttpServer server;
    private URI baseUrl;
    private AdminCacheService service;

    private final AtomicReference<String> seenMethod = new AtomicReference<>();
    private final AtomicReference<String> seenToken = new AtomicReference<>();
    private final AtomicReference<String> seenQuery = new AtomicReference<>();
    private final AtomicReference<String> seenBody = new AtomicReference<>();

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.setExecutor(Executors.newSingleThreadExecutor());
        server.start();
        baseUrl = URI.create("http://localhost:" + server.getAddress().getPort());
        service = new AdminCacheService(
                HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build(), Duration.ofSeconds(5), "test-token");
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    @Test
    void sendCommand_postsJsonWithAdminToken() throws Exception {
        server.createContext("/_cache/admin/commands", exchange -> record(exchange, 202, "{\"status\":\"accepted\"}"));

        HttpCallResult result = service.sendCommand(baseUrl, "cleanup", "m-7");

        assertEquals(202, result.statusCode());
        assertTrue(result.is2xx());
        assertEquals("POST", seenMethod.get());
        assertEquals("test-token", seenToken.get());
        JsonNode body = JacksonCodec.mapper().readTree(seenBody.get());
        assertEquals("cleanup", body.path("action").asText());
        assertEquals("m-7", body.path("messageId").asText());
    }

    @Test
    void sendCommand_rejectsBlankActionLocally() {
        HttpCallResult result = service.sendCommand(baseUrl, " ", null);

        assertEquals(400, result.statusCode());
        assertNull(seenMethod.get());
    }

    @Test
    void stats_clampsWindowToAtLeastOneSecond() {
        server.createContext("/_cache/admin/stats", exchange -> record(exchange, 200, "{}"));

        service.stats(baseUrl, 0);

        assertEquals("windowSec=1", seenQuery.get());
    }

    @Test
    void patchConfig_sendsOnlyGivenValues() throws Exception {
        server.createContext("/_cache/admin/config", exchange -> record(exchange, 200, "{\"imageMaxEntries\":10}"));

        HttpCallResult result = service.patchConfig(baseUrl, new ConfigPatchRequest(null, null, 10));

        assertTrue(result.is2xx());
        assertEquals("PATCH", seenMethod.get());
        JsonNode body = JacksonCodec.mapper().readTree(seenBody.get());
        assertEquals(10, body.path("imageMaxEntries").asInt());
        assertTrue(body.path("apiTimeoutMs").isNull());
    }

    @Test
    void patchConfig_withoutValues_isClientError() {
        HttpCallResult result = service.patchConfig(baseUrl, new ConfigPatchRequest(null, null, null));

        assertEquals(400, result.statusCode());
        assertNotNull(result.error());
    }

    @Test
    void install_reportsServiceUnavailableAsHttpError() {
        server.createContext(
                "/_cache/admin/lifecycle/install",
                exchange -> record(exchange, 503, "{\"state\":\"INSTALL_FAILED\"}"));

        HttpCallResult result = service.install(baseUrl);

        assertEquals("POST", seenMethod.get());
        assertEquals(503, result.statusCode());
        assertEquals(2, result.exitCode());
    }

    @Test
    void unreachableProxy_yieldsIoError() {
        server.stop(0);

        HttpCallResult result = service.listPartitions(baseUrl);

        assertNull(result.statusCode());
        assertNotNull(result.error());
        assertEquals(1, result.exitCode());
    }

    private void record(HttpExchange exchange, int status, String body) throws IOException {
        seenMethod.set(exchange.getRequestMethod());
        seenToken.set(exchange.getRequestHeaders().getFirst("X-Admin-Token"));
        seenQuery.set(exchange.getRequestURI().getRawQuery());
        seenBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
        byte[] payload = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(payload);
        }
    }
}
