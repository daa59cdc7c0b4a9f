package de.htwsaar.offlinecache.proxy.web;

import de.htwsaar.offlinecache.proxy.classify.RequestClassifier;
import de.htwsaar.offlinecache.proxy.config.UpstreamOrigin;
import de.htwsaar.offlinecache.proxy.domain.InterceptResult;
import de.htwsaar.offlinecache.proxy.domain.InterceptedRequest;
import de.htwsaar.offlinecache.proxy.domain.UpstreamException;
import de.htwsaar.offlinecache.proxy.service.CacheRouter;
import jakarta.servlet.http.HttpServletRequest;
import java.io.IOException;
import java.net.URI;
import java.util.concurrent.CompletionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * HTTP-Adapter der Interception: Reverse-Proxy auf die eigene Origin.
 *
 * <p>Kein Fachcode hier, nur HTTP-Mapping und Fehlerbehandlung.</p>
 */
@RestController
public class InterceptController {

    private static final Logger log = LoggerFactory.getLogger(InterceptController.class);

    private static final String CACHE_PREFIX = "/_cache/";

    private final CacheRouter router;
    private final UpstreamOrigin origin;
    private final RequestClassifier classifier;

    /**
     * Constructor Injection.
     *
     * @param router Cache-Router
     * @param origin eigene Origin
     * @param classifier bestimmt, welche Hosts abgefangen werden dürfen
     */
    public InterceptController(CacheRouter router, UpstreamOrigin origin, RequestClassifier classifier) {
        this.router = router;
        this.origin = origin;
        this.classifier = classifier;
    }

    /**
     * Fängt eine absolute URL ab, etwa für freigegebene fremde Bild- oder API-Hosts.
     *
     * <p>Ziele außerhalb der eigenen Origin und der freigegebenen Hosts werden mit 403 abgelehnt und nie
     * abgerufen.</p>
     *
     * @param url absolute URL
     * @param servletRequest eingehender Request (für Header)
     * @return Antwort mit {@code X-Cache}-Header
     */
    @GetMapping("/_cache/fetch")
    public ResponseEntity<byte[]> fetch(@RequestParam("url") String url, HttpServletRequest servletRequest)
            throws IOException {
        URI target;
        try {
            target = URI.create(url);
        } catch (IllegalArgumentException ex) {
            return ResponseEntity.badRequest().build();
        }
        if (!target.isAbsolute() || target.getHost() == null) {
            return ResponseEntity.badRequest().build();
        }
        boolean ownOrigin = classifier.isOwnOrigin(target);
        if (!classifier.isInScope(target) || (ownOrigin && !origin.sameAuthority(target))) {
            log.warn("Rejected fetch of {}: host not allow-listed", target.getAuthority());
            return ResponseEntity.status(HttpStatus.FORBIDDEN).build();
        }
        return intercept(ProxyHttpMapper.toInterceptedRequest(servletRequest, target, ownOrigin));
    }

    /**
     * Leitet jeden übrigen Pfad an die Origin weiter. Unbekannte Pfade unter {@code /_cache/} werden nie
     * weitergeleitet.
     *
     * @param servletRequest eingehender Request
     * @return Antwort mit {@code X-Cache}-Header
     */
    @RequestMapping("/**")
    public ResponseEntity<byte[]> proxy(HttpServletRequest servletRequest) throws IOException {
        if (servletRequest.getRequestURI().startsWith(CACHE_PREFIX)) {
            return ResponseEntity.notFound().build();
        }
        URI target = origin.resolve(servletRequest.getRequestURI(), servletRequest.getQueryString());
        return intercept(ProxyHttpMapper.toInterceptedRequest(servletRequest, target, true));
    }

    private ResponseEntity<byte[]> intercept(InterceptedRequest request) {
        try {
            InterceptResult result = router.onIntercept(request).join();
            return ProxyHttpMapper.toResponseEntity(result);
        } catch (CompletionException ex) {
            if (ex.getCause() instanceof UpstreamException) {
                return ResponseEntity.status(((UpstreamException) ex.getCause()).getStatusCode()).build();
            }
            return ResponseEntity.status(502).build();
        }
    }
}
