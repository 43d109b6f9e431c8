package com.omegaagi.core.health;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HealthStatusTest {

    @Test
    @DisplayName("degraded optional components leave the service UP")
    void degradedIsStillUp() {
        var checks = List.of(
                HealthStatus.up("backend", "ok", Map.of("defaultModel", "gpt-4o")),
                HealthStatus.degraded("database", "No DataSource configured"));

        assertEquals(HealthStatus.Status.UP, HealthStatus.overall(checks));
    }

    @Test
    @DisplayName("one DOWN component takes the service DOWN")
    void anyDownIsDown() {
        var checks = List.of(
                HealthStatus.up("logsink", "Slf4jLogSink"),
                HealthStatus.down("backend", "No text generation backend configured"));

        assertEquals(HealthStatus.Status.DOWN, HealthStatus.overall(checks));
        assertTrue(checks.get(1).isDown());
        assertFalse(checks.get(0).isDown());
    }

    @Test
    @DisplayName("metadata is never null and cannot be changed afterwards")
    void metadataIsDefensive() {
        var status = new HealthStatus("backend", HealthStatus.Status.UP, "ok", null);
        assertEquals(Map.of(), status.metadata());

        var source = new HashMap<String, String>();
        source.put("defaultModel", "gpt-4o");
        var copied = HealthStatus.up("backend", "ok", source);
        source.put("defaultModel", "other");

        assertEquals("gpt-4o", copied.metadata().get("defaultModel"));
        assertThrows(UnsupportedOperationException.class, () -> copied.metadata().put("x", "y"));
    }
}
