package de.htwsaar.offlinecache.cli.util;

import static org.junit.jupiter.api.Assertions.*;

import java.net.URI;
import org.junit.jupiter.api.Test;

class UriUtilsTest {

    @Test
    void resolve_keepsBasePathAndIgnoresLeadingSlashes() {
        assertEquals(
                URI.create("http://localhost:8080/_cache/admin/stats"),
                UriUtils.resolve(URI.create("http://localhost:8080"), "/_cache/admin/stats"));
        assertEquals(
                URI.create("http://proxy.local/cache/_cache/health"),
                UriUtils.resolve(URI.create("http://proxy.local/cache/"), "//_cache/health"));
    }

    @Test
    void parseHttpUri_acceptsOnlyHttpSchemes() {
        assertTrue(UriUtils.parseHttpUri(" https://proxy.local ").isPresent());
        assertTrue(UriUtils.parseHttpUri("ftp://proxy.local").isEmpty());
        assertTrue(UriUtils.parseHttpUri("localhost:8080 x").isEmpty());
        assertTrue(UriUtils.parseHttpUri(null).isEmpty());
    }
}
