package me.golemcore.fleet.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Validates JSON documents against the subset of JSON Schema used by module
 * metadata: {@code type} (single or list), {@code required},
 * {@code properties}, {@code additionalProperties: false}, {@code items} and
 * {@code enum}. Unknown keywords are ignored.
 */
public class JsonSchemaValidator {

    private static final String KEY_TYPE = "type";
    private static final String KEY_PROPERTIES = "properties";
    private static final String KEY_REQUIRED = "required";
    private static final String KEY_ITEMS = "items";
    private static final String KEY_ENUM = "enum";
    private static final String KEY_ADDITIONAL_PROPERTIES = "additionalProperties";
    private static final String ROOT = "$";

    /**
     * Validates a document.
     *
     * @param schema
     *            the schema; null accepts everything
     * @param value
     *            the document; null is treated as JSON null
     * @return violations prefixed with the JSON path they refer to, empty when
     *         valid
     */
    public List<String> validate(Map<String, Object> schema, JsonNode value) {
        List<String> violations = new ArrayList<>();
        if (schema != null) {
            validateNode(schema, value, ROOT, violations);
        }
        return violations;
    }

    public boolean isValid(Map<String, Object> schema, JsonNode value) {
        return validate(schema, value).isEmpty();
    }

    @SuppressWarnings("unchecked")
    private void validateNode(Map<String, Object> schema, JsonNode value, String path, List<String> violations) {
        Object type = schema.get(KEY_TYPE);
        if (type != null && !matchesType(type, value)) {
            violations.add(path + ": expected " + type + " but was " + describe(value));
            return;
        }

        Object allowed = schema.get(KEY_ENUM);
        if (allowed instanceof Collection<?> values && !enumContains(values, value)) {
            violations.add(path + ": value " + value + " is not one of " + values);
        }

        if (value != null && value.isObject()) {
            Object required = schema.get(KEY_REQUIRED);
            if (required instanceof Collection<?> names) {
                for (Object name : names) {
                    JsonNode field = value.get(String.valueOf(name));
                    if (field == null) {
                        violations.add(path + ": missing required property '" + name + "'");
                    }
                }
            }
            Object properties = schema.get(KEY_PROPERTIES);
            Map<String, Object> propertySchemas = properties instanceof Map<?, ?> map
                    ? (Map<String, Object>) map
                    : Map.of();
            Iterator<Map.Entry<String, JsonNode>> fields = value.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                Object propertySchema = propertySchemas.get(field.getKey());
                if (propertySchema instanceof Map<?, ?> nested) {
                    validateNode((Map<String, Object>) nested, field.getValue(),
                            path + "." + field.getKey(), violations);
                } else if (Boolean.FALSE.equals(schema.get(KEY_ADDITIONAL_PROPERTIES))) {
                    violations.add(path + ": unexpected property '" + field.getKey() + "'");
                }
            }
        }

        if (value != null && value.isArray() && schema.get(KEY_ITEMS) instanceof Map<?, ?> items) {
            for (int i = 0; i < value.size(); i++) {
                validateNode((Map<String, Object>) items, value.get(i), path + "[" + i + "]", violations);
            }
        }
    }

    private boolean matchesType(Object type, JsonNode value) {
        if (type instanceof Collection<?> types) {
            for (Object candidate : types) {
                if (matchesSingleType(String.valueOf(candidate), value)) {
                    return true;
                }
            }
            return false;
        }
        return matchesSingleType(String.valueOf(type), value);
    }

    private boolean matchesSingleType(String type, JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return "null".equals(type);
        }
        return switch (type) {
        case "object" -> value.isObject();
        case "array" -> value.isArray();
        case "string" -> value.isTextual();
        case "integer" -> value.isIntegralNumber();
        case "number" -> value.isNumber();
        case "boolean" -> value.isBoolean();
        case "null" -> false;
        default -> true;
        };
    }

    private boolean enumContains(Collection<?> values, JsonNode value) {
        if (value == null) {
            return values.contains(null);
        }
        for (Object candidate : values) {
            if (candidate == null ? value.isNull() : candidate.toString().equals(value.asText())) {
                return true;
            }
        }
        return false;
    }

    private String describe(JsonNode value) {
        if (value == null || value.isMissingNode()) {
            return "nothing";
        }
        return value.getNodeType().name().toLowerCase(java.util.Locale.ROOT);
    }
}
