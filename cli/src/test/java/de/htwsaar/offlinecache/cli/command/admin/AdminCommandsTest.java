package de.htwsaar.offlinecache.cli.command.admin;

import static org.junit.jupiter.api.Assertions.*;

import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import de.htwsaar.offlinecache.cli.command.root.OfflineCacheRootCommand;
import de.htwsaar.offlinecache.cli.di.CliContext;
import de.htwsaar.offlinecache.cli.di.ContextFactory;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import org.jline.terminal.impl.DumbTerminal;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

/**
 * Führt Admin-Commands über den echten Picocli-Baum gegen einen Stub-Proxy aus.
 */
class AdminCommandsTest {

    private HttpServer server;
    private StringWriter out;
    private StringWriter err;
    private CommandLine cmd;
    private final List<String> requests = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.setExecutor(Executors.newSingleThreadExecutor());
        server.start();

        out = new StringWriter();
        err = new StringWriter();
        CliContext ctx = new CliContext(
                new DumbTerminal(new ByteArrayInputStream(new byte[0]), new ByteArrayOutputStream()),
                new PrintWriter(out, true),
                new PrintWriter(err, true),
                HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build(),
                Duration.ofSeconds(5),
                URI.create("http://localhost:" + server.getAddress().getPort()));
        cmd = new CommandLine(OfflineCacheRootCommand.class, new ContextFactory(ctx));
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    void controlCleanup_postsCommandAndReportsStatus() {
        server.createContext("/_cache/admin/commands", json(202, "{\"action\":\"cleanup\",\"status\":\"accepted\"}"));

        int rc = cmd.execute("admin", "control", "cleanup", "--message-id", "nightly-1");

        assertEquals(0, rc);
        assertEquals(List.of("POST /_cache/admin/commands"), requests);
        assertTrue(out.toString().contains("Command cleanup accepted"), out.toString());
    }

    @Test
    void controlForceActivate_failsWithExitCode2OnUnauthorized() {
        server.createContext("/_cache/admin/commands", json(401, "{\"error\":\"unauthorized\"}"));

        int rc = cmd.execute("admin", "control", "force-activate");

        assertEquals(2, rc);
        assertTrue(err.toString().contains("status=401"), err.toString());
    }

    @Test
    void partitions_printsOneLinePerPartition() {
        server.createContext(
                "/_cache/admin/partitions",
                json(200, """
                        [
                          {"name":"api-v1","family":"api","version":"v1","entries":3,"current":true},
                          {"name":"image-v0","family":"image","version":"v0","entries":12,"current":false}
                        ]
                        """));

        int rc = cmd.execute("admin", "partitions");

        assertEquals(0, rc);
        String text = out.toString();
        assertTrue(text.contains("(2)"), text);
        assertTrue(text.lines().anyMatch(l -> l.contains("api-v1") && l.contains("3") && l.contains("current")), text);
        assertTrue(text.lines().anyMatch(l -> l.contains("image-v0") && l.contains("stale")), text);
    }

    @Test
    void partitions_withGarbageResponse_exitsWith1() {
        server.createContext("/_cache/admin/partitions", json(200, "not json"));

        assertEquals(1, cmd.execute("admin", "partitions"));
    }

    @Test
    void lifecycleInstall_reportsFailedInstall() {
        server.createContext(
                "/_cache/admin/lifecycle/install",
                json(503, "{\"version\":\"v1\",\"state\":\"INSTALL_FAILED\",\"error\":\"Pre-cache of / failed\"}"));

        int rc = cmd.execute("admin", "lifecycle", "install");

        assertEquals(2, rc);
        assertTrue(err.toString().contains("INSTALL_FAILED"), err.toString());
    }

    @Test
    void lifecycleShow_printsVersionAndState() {
        server.createContext("/_cache/admin/lifecycle", json(200, "{\"version\":\"v1\",\"state\":\"ACTIVE\"}"));

        assertEquals(0, cmd.execute("admin", "lifecycle", "show"));
        assertTrue(out.toString().contains("Version v1 is ACTIVE"), out.toString());
    }

    @Test
    void configSet_withoutOptions_doesNotCallProxy() {
        int rc = cmd.execute("admin", "config", "set");

        assertEquals(1, rc);
        assertTrue(requests.isEmpty());
    }

    @Test
    void configSet_patchesAndPrintsResult() {
        server.createContext(
                "/_cache/admin/config",
                json(200, "{\"apiTimeoutMs\":8000,\"navigationTimeoutMs\":3000,\"imageMaxEntries\":50}"));

        int rc = cmd.execute("admin", "config", "set", "--api-timeout-ms", "8000");

        assertEquals(0, rc);
        assertEquals(List.of("PATCH /_cache/admin/config"), requests);
        assertTrue(out.toString().contains("8000"), out.toString());
    }

    @Test
    void statsShow_printsCountersAndClassifications() {
        server.createContext(
                "/_cache/admin/stats",
                json(200, """
                        {"totalRequests":10,"requestsPerWindow":4,"cacheHits":6,"cacheMisses":2,
                         "fallbacks":1,"bypassed":1,"failedRequests":0,"detachedTaskFailures":0,
                         "cacheHitRatio":0.75,"entriesCached":9,"byClassification":{"API":5,"IMAGE":3}}
                        """));

        int rc = cmd.execute("admin", "stats", "show", "--window-sec", "30");

        assertEquals(0, rc);
        String text = out.toString();
        assertTrue(text.contains("0.7500"), text);
        assertTrue(text.lines().anyMatch(l -> l.contains("API") && l.contains("5")), text);
    }

    @Test
    void ping_returns2WhileProxyIsNotReady() {
        server.createContext("/_cache/ready", json(503, "installing"));

        assertEquals(2, cmd.execute("admin", "ping", "-p", "_cache/ready"));
        assertTrue(out.toString().contains("Status: 503"));
    }

    @Test
    void ping_returns1WhenProxyIsDown() {
        server.stop(0);

        assertEquals(1, cmd.execute("admin", "ping"));
        assertTrue(err.toString().contains("Ping failed"));
    }

    private HttpHandler json(int status, String body) {
        return exchange -> {
            requests.add(exchange.getRequestMethod() + " " + exchange.getRequestURI().getPath());
            exchange.getRequestBody().readAllBytes();
            byte[] payload = body.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(status, payload.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(payload);
            }
        };
    }
}
