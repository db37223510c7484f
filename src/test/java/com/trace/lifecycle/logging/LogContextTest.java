package com.trace.lifecycle.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LogContext Tests")
class LogContextTest {

    @AfterEach
    void cleanupMDC() {
        MDC.clear();
    }

    @Test
    @DisplayName("forExport should set traceId and operation in MDC")
    void forExportSetsMDC() {
        try (LogContext ctx = LogContext.forExport("tr-1")) {
            assertEquals("tr-1", MDC.get("traceId"));
            assertEquals("export", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forTimeout should set traceId and operation in MDC")
    void forTimeoutSetsMDC() {
        try (LogContext ctx = LogContext.forTimeout("tr-2")) {
            assertEquals("tr-2", MDC.get("traceId"));
            assertEquals("timeout", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forSpan should set traceId, spanId and operation in MDC")
    void forSpanSetsMDC() {
        try (LogContext ctx = LogContext.forSpan("tr-3", "abc")) {
            assertEquals("tr-3", MDC.get("traceId"));
            assertEquals("abc", MDC.get("spanId"));
            assertEquals("span", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("MDC should be cleared on close, including extra keys")
    void mdcClearedOnClose() {
        LogContext ctx = LogContext.forExport("tr-1").with("backend", "http");
        assertEquals("http", MDC.get("backend"));

        ctx.close();

        assertNull(MDC.get("traceId"));
        assertNull(MDC.get("operation"));
        assertNull(MDC.get("backend"));
    }
}
