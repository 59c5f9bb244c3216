package com.resonance.matrix.logging;

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
    @DisplayName("forBuild should set runId and operation in MDC")
    void forBuildSetsMDC() {
        try (LogContext ctx = LogContext.forBuild("run-1")) {
            assertEquals("run-1", MDC.get("runId"));
            assertEquals("build", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forMigration should set runId, input and operation in MDC")
    void forMigrationSetsMDC() {
        try (LogContext ctx = LogContext.forMigration("run-2", "registry.json")) {
            assertEquals("run-2", MDC.get("runId"));
            assertEquals("registry.json", MDC.get("input"));
            assertEquals("migrate", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forSelfHeal should record the number of failed nodes")
    void forSelfHealSetsMDC() {
        try (LogContext ctx = LogContext.forSelfHeal("run-3", 7)) {
            assertEquals("7", MDC.get("failedNodes"));
            assertEquals("self-heal", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("close should remove every key it added, including extra ones")
    void closeRemovesKeys() {
        MDC.put("unrelated", "kept");
        try (LogContext ctx = LogContext.forMigration("run-4", "in.json").with("part", "3")) {
            assertEquals("3", MDC.get("part"));
        }

        assertNull(MDC.get("runId"));
        assertNull(MDC.get("input"));
        assertNull(MDC.get("part"));
        assertEquals("kept", MDC.get("unrelated"));
    }

    @Test
    @DisplayName("generateRunId should produce unique ids")
    void uniqueRunIds() {
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            ids.add(LogContext.generateRunId());
        }
        assertEquals(100, ids.size());
    }
}
