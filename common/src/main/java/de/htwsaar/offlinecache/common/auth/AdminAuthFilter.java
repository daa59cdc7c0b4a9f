package de.htwsaar.offlinecache.common.auth;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Filter that protects the cache administration endpoints (control commands, partition listing,
 * live configuration) by validating a shared admin token.
 */
public class AdminAuthFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(AdminAuthFilter.class);

    /** Name of the HTTP header expected to carry the admin token. */
    public static final String AUTH_HEADER = "X-Admin-Token";

    private final String expectedToken;
    private final List<String> protectedPrefixes;

    /**
     * Creates a new admin authentication filter.
     *
     * @param expectedToken     token that must match the value provided in the admin header
     * @param protectedPrefixes request-URI prefixes that require the token
     */
    public AdminAuthFilter(String expectedToken, List<String> protectedPrefixes) {
        this.expectedToken = Objects.requireNonNull(expectedToken, "expectedToken must not be null");
        this.protectedPrefixes = List.copyOf(protectedPrefixes);
    }

    /**
     * Rejects requests to protected routes with 401 when the token is missing and with 403 when it
     * does not match. All other requests pass unchanged.
     */
    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        if (isProtected(request.getRequestURI())) {
            String providedToken = request.getHeader(AUTH_HEADER);

            if (providedToken == null || providedToken.isBlank()) {
                log.debug("Rejected admin request without token: {}", request.getRequestURI());
                response.sendError(HttpServletResponse.SC_UNAUTHORIZED, "Missing Admin Token");
                return;
            }

            if (!tokenMatches(providedToken)) {
                log.warn("Rejected admin request with invalid token: {}", request.getRequestURI());
                response.sendError(HttpServletResponse.SC_FORBIDDEN, "Invalid Admin Token");
                return;
            }
        }

        filterChain.doFilter(request, response);
    }

    private boolean isProtected(String requestUri) {
        if (requestUri == null) return false;
        for (String prefix : protectedPrefixes) {
            if (requestUri.startsWith(prefix)) return true;
        }
        return false;
    }

    private boolean tokenMatches(String providedToken) {
        return MessageDigest.isEqual(
                expectedToken.getBytes(StandardCharsets.UTF_8), providedToken.getBytes(StandardCharsets.UTF_8));
    }
}
