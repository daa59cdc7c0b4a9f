package de.htwsaar.offlinecache.common.logging;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;
import org.slf4j.MDC;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Servlet-Filter zur Erzeugung und Verwaltung einer Trace-ID.
 *
 * <p>Für jede Anfrage wird eine Trace-ID aus dem Request-Header übernommen oder neu erzeugt,
 * im MDC abgelegt und im Response-Header zurückgegeben. Hintergrund-Refreshes des Caches
 * übernehmen den MDC-Kontext, so dass ihre Logzeilen der auslösenden Anfrage zuordenbar bleiben.</p>
 */
public class TraceIdFilter extends OncePerRequestFilter {

    /** Schlüsselname der Trace-ID im Logging-Kontext */
    public static final String TRACE_ID_KEY = "traceId";

    /** HTTP-Header, aus dem eine vorhandene Trace-ID gelesen werden kann */
    public static final String TRACE_ID_HEADER = "X-Trace-Id";

    /** Erlaubte Zeichen einer fremden Trace-ID; alles andere wird verworfen (Log-Injection). */
    private static final Pattern SAFE_TRACE_ID = Pattern.compile("[A-Za-z0-9._-]{1,64}");

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String traceId = resolveTraceId(request.getHeader(TRACE_ID_HEADER));

        MDC.put(TRACE_ID_KEY, traceId);
        response.setHeader(TRACE_ID_HEADER, traceId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(TRACE_ID_KEY);
        }
    }

    /**
     * Übernimmt eine mitgesendete Trace-ID, sofern sie unbedenklich ist, sonst wird eine UUID erzeugt.
     *
     * @param incoming Header-Wert (darf {@code null} sein)
     * @return zu verwendende Trace-ID
     */
    static String resolveTraceId(String incoming) {
        if (incoming == null) {
            return UUID.randomUUID().toString();
        }
        String trimmed = incoming.trim();
        if (!SAFE_TRACE_ID.matcher(trimmed).matches()) {
            return UUID.randomUUID().toString();
        }
        return trimmed;
    }
}
