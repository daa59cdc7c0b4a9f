package de.htwsaar.offlinecache.proxy.adapter.http;

import de.htwsaar.offlinecache.proxy.domain.Headers;
import de.htwsaar.offlinecache.proxy.domain.InterceptedRequest;
import de.htwsaar.offlinecache.proxy.domain.UpstreamClient;
import de.htwsaar.offlinecache.proxy.domain.UpstreamResponse;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * HTTP-Adapter zum Upstream auf Basis von {@link HttpClient#sendAsync}.
 *
 * <p>Enthält alle HTTP-Details (Header-Filter, Timeouts). Die Strategien hängen ausschließlich am
 * {@link UpstreamClient}-Port. Abbrechen des zurückgegebenen Futures bricht den Transfer ab.</p>
 */
public final class HttpUpstreamClient implements UpstreamClient {

    /** Header, die der JDK-Client selbst setzt oder verbietet. */
    private static final Set<String> RESTRICTED = Set.of("content-length", "expect", "host");

    private final HttpClient httpClient;
    private final Duration requestTimeout;

    /**
     * @param httpClient JDK-HTTP-Client (darf nicht {@code null} sein)
     * @param requestTimeout harte Obergrenze pro Upstream-Request
     */
    public HttpUpstreamClient(HttpClient httpClient, Duration requestTimeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout must not be null");
    }

    @Override
    public CompletableFuture<UpstreamResponse> fetch(InterceptedRequest request) {
        HttpRequest httpRequest;
        try {
            httpRequest = toHttpRequest(request);
        } catch (IllegalArgumentException ex) {
            return CompletableFuture.failedFuture(ex);
        }
        return httpClient
                .sendAsync(httpRequest, HttpResponse.BodyHandlers.ofByteArray())
                .thenApply(HttpUpstreamClient::toUpstreamResponse);
    }

    private HttpRequest toHttpRequest(InterceptedRequest request) {
        HttpRequest.BodyPublisher body = request.body().length == 0
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofByteArray(request.body());
        HttpRequest.Builder builder = HttpRequest.newBuilder(request.url())
                .timeout(requestTimeout)
                .method(request.method(), body);
        for (Map.Entry<String, List<String>> header : request.headers().entrySet()) {
            String name = header.getKey();
            if (Headers.isHopByHop(name) || RESTRICTED.contains(name.toLowerCase(Locale.ROOT))) {
                continue;
            }
            for (String value : header.getValue()) {
                builder.header(name, value);
            }
        }
        return builder.build();
    }

    private static UpstreamResponse toUpstreamResponse(HttpResponse<byte[]> response) {
        return new UpstreamResponse(response.statusCode(), response.headers().map(), response.body());
    }
}
