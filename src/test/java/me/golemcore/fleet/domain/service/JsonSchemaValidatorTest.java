package me.golemcore.fleet.domain.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonSchemaValidatorTest {

    private static final Map<String, Object> SCHEMA = Map.of(
            "type", "object",
            "required", List.of("name", "flags"),
            "properties", Map.of(
                    "name", Map.of("type", "string"),
                    "count", Map.of("type", List.of("integer", "null")),
                    "mode", Map.of("type", "string", "enum", List.of("fast", "slow")),
                    "flags", Map.of("type", "array", "items", Map.of("type", "string"))));

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final JsonSchemaValidator validator = new JsonSchemaValidator();

    private JsonNode json(String text) throws Exception {
        return objectMapper.readTree(text);
    }

    @Test
    void shouldAcceptValidDocument() throws Exception {
        List<String> violations = validator.validate(SCHEMA,
                json("{\"name\":\"x\",\"count\":null,\"mode\":\"fast\",\"flags\":[\"a\",\"b\"]}"));

        assertTrue(violations.isEmpty(), violations.toString());
    }

    @Test
    void shouldReportMissingRequiredProperty() throws Exception {
        List<String> violations = validator.validate(SCHEMA, json("{\"name\":\"x\"}"));

        assertEquals(List.of("$: missing required property 'flags'"), violations);
    }

    @Test
    void shouldReportWrongTypeWithPath() throws Exception {
        List<String> violations = validator.validate(SCHEMA, json("{\"name\":1,\"flags\":[\"a\",2]}"));

        assertEquals(2, violations.size());
        assertTrue(violations.get(0).startsWith("$.name: expected string"));
        assertTrue(violations.get(1).startsWith("$.flags[1]: expected string"));
    }

    @Test
    void shouldReportValueOutsideEnum() throws Exception {
        List<String> violations = validator.validate(SCHEMA, json("{\"name\":\"x\",\"flags\":[],\"mode\":\"medium\"}"));

        assertEquals(1, violations.size());
        assertTrue(violations.get(0).contains("is not one of"));
    }

    @Test
    void shouldRejectAdditionalPropertiesWhenForbidden() throws Exception {
        Map<String, Object> strict = Map.of(
                "type", "object",
                "additionalProperties", false,
                "properties", Map.of("a", Map.of("type", "string")));

        assertTrue(validator.isValid(strict, json("{\"a\":\"x\"}")));
        assertEquals(List.of("$: unexpected property 'b'"), validator.validate(strict, json("{\"a\":\"x\",\"b\":1}")));
    }

    @Test
    void shouldAcceptAnythingWithoutSchema() throws Exception {
        assertTrue(validator.isValid(null, json("[1,2,3]")));
    }

    @Test
    void shouldTreatMissingDocumentAsNull() {
        List<String> violations = validator.validate(Map.of("type", "object"), null);

        assertEquals(List.of("$: expected object but was nothing"), violations);
    }
}
