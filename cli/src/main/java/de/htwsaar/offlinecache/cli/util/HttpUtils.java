package de.htwsaar.offlinecache.cli.util;

import de.htwsaar.offlinecache.cli.dto.HttpCallResult;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Objects;

public final class HttpUtils {

    /** Header, den der Proxy für alle Pfade unter {@code /_cache/admin} verlangt. */
    public static final String ADMIN_TOKEN_HEADER = "X-Admin-Token";

    private static final String TOKEN_ENV = "OFFLINECACHE_ADMIN_TOKEN";
    private static final String TOKEN_PROPERTY = "offlinecache.admin.token";
    private static final String DEFAULT_TOKEN = "secret-token";

    private HttpUtils() {}

    /**
     * Hilfsfunktion zum Senden eines HTTP-Requests und Erfassen des Statuscodes und der Antwort als String.
     * Behandelt InterruptedException und IOException und gibt ein HttpCallResult zurück,
     * das entweder den Statuscode und die Antwort oder eine Fehlermeldung enthält.
     */
    public static HttpCallResult sendForStringBody(HttpClient httpClient, HttpRequest request) {
        Objects.requireNonNull(httpClient, "httpClient");
        Objects.requireNonNull(request, "request");

        try {
            HttpResponse<String> resp = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            return HttpCallResult.http(resp.statusCode(), resp.body());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return HttpCallResult.ioError("interrupted");
        } catch (IOException e) {
            return HttpCallResult.ioError(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
    }

    /**
     * Creates an HTTP request builder for admin endpoints with an explicit token value.
     *
     * @param uri the target URI for the request
     * @param token admin token value (falls leer/null: Env/System-Property-Fallback)
     * @return a builder preconfigured with the {@code X-Admin-Token} header
     */
    public static HttpRequest.Builder newAdminRequestBuilder(URI uri, String token) {
        Objects.requireNonNull(uri, "uri");
        return HttpRequest.newBuilder(uri).header(ADMIN_TOKEN_HEADER, resolveToken(token));
    }

    /**
     * Reihenfolge: expliziter Wert, Umgebungsvariable, System-Property, Default.
     *
     * @param token expliziter Token oder {@code null}
     * @return effektiver Token
     */
    static String resolveToken(String token) {
        String effectiveToken = token;
        if (effectiveToken == null || effectiveToken.isBlank()) {
            effectiveToken = System.getenv(TOKEN_ENV);
        }
        if (effectiveToken == null || effectiveToken.isBlank()) {
            effectiveToken = System.getProperty(TOKEN_PROPERTY);
        }
        if (effectiveToken == null || effectiveToken.isBlank()) {
            effectiveToken = DEFAULT_TOKEN;
        }
        return effectiveToken;
    }
}
