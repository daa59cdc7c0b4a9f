package de.htwsaar.offlinecache.proxy.adapter.http;

import static org.junit.jupiter.api.Assertions.*;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import de.htwsaar.offlinecache.proxy.domain.InterceptedRequest;
import de.htwsaar.offlinecache.proxy.domain.UpstreamResponse;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HttpUpstreamClientTest {

    private HttpServer server;
    private String baseUrl;
    private HttpUpstreamClient client;

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        server.setExecutor(Executors.newSingleThreadExecutor());
        server.start();
        baseUrl = "http://localhost:" + server.getAddress().getPort();
        client = new HttpUpstreamClient(
                HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build(), Duration.ofSeconds(5));
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    @Test
    void fetch_returnsStatusHeadersAndRawBytes() {
        byte[] payload = {0x00, (byte) 0xFF, 0x10, 0x7F};
        server.createContext("/img/raw.bin", exchange -> {
            exchange.getResponseHeaders().add("Content-Type", "application/octet-stream");
            exchange.getResponseHeaders().add("Vary", "Accept-Encoding");
            send(exchange, 200, payload);
        });

        UpstreamResponse response = client.fetch(InterceptedRequest.get(URI.create(baseUrl + "/img/raw.bin"))).join();

        assertEquals(200, response.statusCode());
        assertArrayEquals(payload, response.body());
        assertEquals("application/octet-stream", response.header("content-type"));
        assertEquals("Accept-Encoding", response.header("VARY"));
    }

    @Test
    void fetch_passesErrorStatusThroughAsResponse() {
        server.createContext("/api/missing", exchange -> send(exchange, 404, "nope".getBytes(StandardCharsets.UTF_8)));

        UpstreamResponse response =
                client.fetch(InterceptedRequest.get(URI.create(baseUrl + "/api/missing"))).join();

        assertEquals(404, response.statusCode());
        assertFalse(response.isOk());
    }

    @Test
    void fetch_forwardsEndToEndHeadersAndBody() {
        AtomicReference<String> seenHeader = new AtomicReference<>();
        AtomicReference<String> seenBody = new AtomicReference<>();
        AtomicReference<String> seenMethod = new AtomicReference<>();
        server.createContext("/api/swipe", exchange -> {
            seenMethod.set(exchange.getRequestMethod());
            seenHeader.set(exchange.getRequestHeaders().getFirst("X-Requested-With"));
            seenBody.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            send(exchange, 204, new byte[0]);
        });
        InterceptedRequest request = new InterceptedRequest(
                "POST",
                URI.create(baseUrl + "/api/swipe"),
                Map.of(
                        "X-Requested-With", List.of("offline-cache"),
                        "Connection", List.of("keep-alive"),
                        "Host", List.of("evil.example")),
                "{\"liked\":true}".getBytes(StandardCharsets.UTF_8));

        UpstreamResponse response = client.fetch(request).join();

        assertEquals(204, response.statusCode());
        assertEquals("POST", seenMethod.get());
        assertEquals("offline-cache", seenHeader.get());
        assertEquals("{\"liked\":true}", seenBody.get());
    }

    @Test
    void fetch_failsWhenUpstreamIsUnreachable() {
        server.stop(0);

        CompletionException ex = assertThrows(
                CompletionException.class,
                () -> client.fetch(InterceptedRequest.get(URI.create(baseUrl + "/"))).join());

        assertInstanceOf(IOException.class, ex.getCause());
    }

    private static void send(HttpExchange exchange, int status, byte[] payload) throws IOException {
        exchange.sendResponseHeaders(status, payload.length == 0 ? -1 : payload.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(payload);
        }
    }
}
