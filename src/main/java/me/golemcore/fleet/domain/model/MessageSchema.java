package me.golemcore.fleet.domain.model;

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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Schema a broker connector checks inbound payloads against before handing
 * them to the registered callback. Only top-level fields are constrained.
 */
public final class MessageSchema {

    private final String name;
    private final ContentType contentType;
    private final Map<String, FieldConstraint> constraints = new LinkedHashMap<>();

    public MessageSchema(String name, ContentType contentType) {
        this.name = name;
        this.contentType = contentType;
    }

    public String getName() {
        return name;
    }

    public ContentType getContentType() {
        return contentType;
    }

    public Map<String, FieldConstraint> getConstraints() {
        return Collections.unmodifiableMap(constraints);
    }

    public MessageSchema addConstraint(String field, TypeConstraint type, boolean required) {
        constraints.put(field, new FieldConstraint(type, required));
        return this;
    }

    /**
     * Checks a JSON payload against the field constraints.
     *
     * @return human readable violations, empty when the payload is valid
     */
    public List<String> validate(JsonNode data) {
        List<String> violations = new ArrayList<>();
        if (data == null || !data.isObject()) {
            violations.add("payload is not a JSON object");
            return violations;
        }
        for (Map.Entry<String, FieldConstraint> entry : constraints.entrySet()) {
            String field = entry.getKey();
            FieldConstraint constraint = entry.getValue();
            JsonNode value = data.get(field);
            if (value == null || value.isNull()) {
                if (constraint.required()) {
                    violations.add("missing required field '" + field + "'");
                }
                continue;
            }
            if (!constraint.type().matches(value)) {
                violations.add("field '" + field + "' is not of type "
                        + constraint.type().name().toLowerCase(Locale.ROOT));
            }
        }
        return violations;
    }

    public record FieldConstraint(TypeConstraint type, boolean required) {
    }
}
