package de.htwsaar.offlinecache.cli.service.admin;

import de.htwsaar.offlinecache.cli.dto.ConfigPatchRequest;
import de.htwsaar.offlinecache.cli.dto.ControlCommandRequest;
import de.htwsaar.offlinecache.cli.dto.HttpCallResult;
import de.htwsaar.offlinecache.cli.util.HttpUtils;
import de.htwsaar.offlinecache.cli.util.UriUtils;
import de.htwsaar.offlinecache.common.serialization.JacksonCodec;
import de.htwsaar.offlinecache.common.serialization.OfflineCacheSerializationException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.time.Duration;
import java.util.Objects;

/**
 * Client für die Admin-API des Offline-Cache-Proxys ({@code /_cache/admin/**}).
 *
 * <p>Alle Methoden liefern ein {@link HttpCallResult}; Netzwerkfehler werfen keine Exceptions.</p>
 */
public final class AdminCacheService {

    private static final String ADMIN_BASE = "_cache/admin/";

    private final HttpClient httpClient;
    private final Duration requestTimeout;
    private final String adminToken;

    public AdminCacheService(HttpClient httpClient, Duration requestTimeout) {
        this(httpClient, requestTimeout, null);
    }

    /**
     * @param httpClient     HTTP-Client
     * @param requestTimeout Timeout pro Request
     * @param adminToken     Admin-Token oder {@code null} für Env/System-Property/Default
     */
    public AdminCacheService(HttpClient httpClient, Duration requestTimeout, String adminToken) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
        this.adminToken = adminToken;
    }

    /**
     * Sendet ein Steuerkommando: POST /_cache/admin/commands
     */
    public HttpCallResult sendCommand(URI proxyBaseUrl, String action, String messageId) {
        Objects.requireNonNull(proxyBaseUrl, "proxyBaseUrl");
        if (action == null || action.isBlank()) {
            return HttpCallResult.clientError("action must not be blank");
        }
        return sendJson(proxyBaseUrl, "commands", "POST", new ControlCommandRequest(action, messageId));
    }

    /**
     * Listet alle Partitionen: GET /_cache/admin/partitions
     */
    public HttpCallResult listPartitions(URI proxyBaseUrl) {
        return get(proxyBaseUrl, "partitions");
    }

    /**
     * Zustand der Cache-Version: GET /_cache/admin/lifecycle
     */
    public HttpCallResult lifecycle(URI proxyBaseUrl) {
        return get(proxyBaseUrl, "lifecycle");
    }

    /**
     * Installation erneut anstoßen: POST /_cache/admin/lifecycle/install
     */
    public HttpCallResult install(URI proxyBaseUrl) {
        Objects.requireNonNull(proxyBaseUrl, "proxyBaseUrl");
        HttpRequest req = adminRequest(proxyBaseUrl, "lifecycle/install")
                .POST(HttpRequest.BodyPublishers.noBody())
                .build();
        return HttpUtils.sendForStringBody(httpClient, req);
    }

    /**
     * Laufzeitmetriken: GET /_cache/admin/stats?windowSec={windowSec}
     */
    public HttpCallResult stats(URI proxyBaseUrl, int windowSec) {
        return get(proxyBaseUrl, "stats?windowSec=" + Math.max(1, windowSec));
    }

    /**
     * Aktuelle Konfiguration: GET /_cache/admin/config
     */
    public HttpCallResult config(URI proxyBaseUrl) {
        return get(proxyBaseUrl, "config");
    }

    /**
     * Partielles Config-Update: PATCH /_cache/admin/config
     */
    public HttpCallResult patchConfig(URI proxyBaseUrl, ConfigPatchRequest patch) {
        Objects.requireNonNull(proxyBaseUrl, "proxyBaseUrl");
        if (patch == null || patch.isEmpty()) {
            return HttpCallResult.clientError("at least one config value must be set");
        }
        return sendJson(proxyBaseUrl, "config", "PATCH", patch);
    }

    private HttpCallResult get(URI proxyBaseUrl, String path) {
        Objects.requireNonNull(proxyBaseUrl, "proxyBaseUrl");
        HttpRequest req = adminRequest(proxyBaseUrl, path).GET().build();
        return HttpUtils.sendForStringBody(httpClient, req);
    }

    private HttpCallResult sendJson(URI proxyBaseUrl, String path, String method, Object payload) {
        String json;
        try {
            json = JacksonCodec.toJson(payload);
        } catch (OfflineCacheSerializationException e) {
            return HttpCallResult.clientError(e.getMessage());
        }
        HttpRequest req = adminRequest(proxyBaseUrl, path)
                .header("Content-Type", "application/json")
                .method(method, HttpRequest.BodyPublishers.ofString(json))
                .build();
        return HttpUtils.sendForStringBody(httpClient, req);
    }

    private HttpRequest.Builder adminRequest(URI proxyBaseUrl, String path) {
        URI url = UriUtils.resolve(proxyBaseUrl, ADMIN_BASE + path);
        return HttpUtils.newAdminRequestBuilder(url, adminToken).timeout(requestTimeout);
    }
}
