package com.tts.resilience.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LogContext Tests")
class LogContextTest {

    @AfterEach
    void cleanupMDC() {
        MDC.clear();
    }

    @Test
    @DisplayName("forLoad should set cache, artifactKey, and operation in MDC")
    void forLoadSetsMDC() {
        try (LogContext ctx = LogContext.forLoad("voices", "af_heart")) {
            assertEquals("voices", MDC.get("cache"));
            assertEquals("af_heart", MDC.get("artifactKey"));
            assertEquals("load", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forWarmup should set task id and cache")
    void forWarmupSetsMDC() {
        try (LogContext ctx = LogContext.forWarmup("voices/af_heart", "voices")) {
            assertEquals("voices/af_heart", MDC.get("warmupTaskId"));
            assertEquals("voices", MDC.get("cache"));
            assertEquals("warmup", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forReload should set target and a fresh correlation id")
    void forReloadSetsMDC() {
        try (LogContext ctx = LogContext.forReload("model")) {
            assertEquals("model", MDC.get("reloadTarget"));
            assertNotNull(MDC.get("correlationId"));
            assertEquals("reload", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forHealthCheck should set check name")
    void forHealthCheckSetsMDC() {
        try (LogContext ctx = LogContext.forHealthCheck("memory")) {
            assertEquals("memory", MDC.get("healthCheck"));
            assertEquals("health", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("MDC should be cleared on close")
    void mdcClearedOnClose() {
        LogContext ctx = LogContext.forLoad("voices", "af_heart").with("attempt", "2");
        assertEquals("2", MDC.get("attempt"));

        ctx.close();

        assertNull(MDC.get("cache"));
        assertNull(MDC.get("artifactKey"));
        assertNull(MDC.get("operation"));
        assertNull(MDC.get("attempt"));
    }

    @Test
    @DisplayName("Closing should leave unrelated MDC keys alone")
    void closeKeepsUnrelatedKeys() {
        MDC.put("requestId", "req-1");
        try (LogContext ctx = LogContext.forHealthCheck("disk")) {
            assertEquals("req-1", MDC.get("requestId"));
        }
        assertEquals("req-1", MDC.get("requestId"));
    }

    @Test
    @DisplayName("generateCorrelationId should produce unique ids")
    void uniqueCorrelationIds() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            ids.add(LogContext.generateCorrelationId());
        }
        assertEquals(100, ids.size());
    }
}
