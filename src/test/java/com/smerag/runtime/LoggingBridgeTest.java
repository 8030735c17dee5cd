package com.smerag.runtime;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class LoggingBridgeTest {

    @Test
    void shouldRouteLog4jApiCallsThroughSlf4j() throws Exception {
        // The POI parsers behind Tika log through the Log4j 2 API.
        Object factory = Class.forName("org.apache.logging.log4j.LogManager").getMethod("getFactory").invoke(null);

        assertEquals("org.apache.logging.slf4j.SLF4JLoggerContextFactory", factory.getClass().getName());
    }
}
