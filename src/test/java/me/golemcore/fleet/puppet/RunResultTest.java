package me.golemcore.fleet.puppet;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.fleet.infrastructure.config.AutoConfiguration;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RunResultTest {

    private final ObjectMapper objectMapper = AutoConfiguration.objectMapper();

    @Test
    void shouldFillUnknownFieldsOnFailure() {
        JsonNode json = objectMapper.valueToTree(
                RunResult.failure(PuppetErrorType.AGENT_DISABLED, "Puppet agent is disabled", 1));

        List<String> fields = iterate(json);
        assertEquals(List.of("kind", "time", "transaction_uuid", "environment", "status", "error_type", "error",
                "exitcode", "version"), fields);
        assertEquals("unknown", json.get("kind").asText());
        assertEquals("agent_disabled", json.get("error_type").asText());
    }

    @Test
    void shouldOmitErrorFieldsOnSuccess() {
        JsonNode json = objectMapper.valueToTree(RunResult.fromReport(
                Map.of("kind", "apply", "status", "unchanged", "environment", "production"), 0));

        assertFalse(json.has("error_type"));
        assertFalse(json.has("error"));
        assertEquals("unchanged", json.get("status").asText());
        assertEquals("unknown", json.get("transaction_uuid").asText());
        assertEquals(0, json.get("exitcode").asInt());
    }

    private static List<String> iterate(JsonNode json) {
        List<String> names = new ArrayList<>();
        json.fieldNames().forEachRemaining(names::add);
        return names;
    }
}
