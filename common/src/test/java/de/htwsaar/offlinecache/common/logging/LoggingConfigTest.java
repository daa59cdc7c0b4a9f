package de.htwsaar.offlinecache.common.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;

import org.junit.jupiter.api.Test;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.core.Ordered;

/**
 * Tests für {@link LoggingConfig}.
 */
class LoggingConfigTest {

    @Test
    void shouldCreateTraceIdFilterBeanInstance() {
        assertNotNull(new LoggingConfig().traceIdFilter());
    }

    @Test
    void shouldRegisterTraceIdFilterWithHighestPrecedence() {
        LoggingConfig config = new LoggingConfig();
        TraceIdFilter filter = config.traceIdFilter();

        FilterRegistrationBean<TraceIdFilter> registration = config.traceIdFilterRegistration(filter);

        assertSame(filter, registration.getFilter());
        assertEquals(Ordered.HIGHEST_PRECEDENCE, registration.getOrder());
    }
}
