package com.pathhound.core.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.logging.Level;

import static org.assertj.core.api.Assertions.assertThat;

class StructuredLogTest {

    private final ObjectMapper om = new ObjectMapper();

    @Test
    void event_line_is_valid_json_with_scan_context() throws Exception {
        StructuredLog slog = StructuredLog.get(StructuredLogTest.class).forScan("abc123");

        String line = slog.buildJson(Level.INFO, "auto-tune", null,
                "threadsFrom", 8, "threadsTo", 4, "note", "quote \" and\nnewline");
        JsonNode n = om.readTree(line);

        assertThat(n.get("event").asText()).isEqualTo("auto-tune");
        assertThat(n.get("scan").asText()).isEqualTo("abc123");
        assertThat(n.get("comp").asText()).isEqualTo("StructuredLogTest");
        assertThat(n.get("threadsTo").asInt()).isEqualTo(4);
        assertThat(n.get("note").asText()).isEqualTo("quote \" and\nnewline");
    }

    @Test
    void odd_key_value_list_is_flagged() throws Exception {
        String line = StructuredLog.get(StructuredLogTest.class).buildJson(Level.WARNING, "x", null, "dangling");
        JsonNode n = om.readTree(line);
        assertThat(n.has("scan")).isFalse();
        assertThat(n.get("_kv_mismatch").asBoolean()).isTrue();
    }

    @Test
    void throwable_is_summarized() throws Exception {
        String line = StructuredLog.get(StructuredLogTest.class)
                .buildJson(Level.SEVERE, "scan-failed", new IllegalStateException("boom"));
        JsonNode n = om.readTree(line);
        assertThat(n.get("error").asText()).isEqualTo("IllegalStateException");
        assertThat(n.get("message").asText()).isEqualTo("boom");
    }
}
