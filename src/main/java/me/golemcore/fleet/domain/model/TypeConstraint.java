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

/**
 * JSON type a message schema field must have.
 */
public enum TypeConstraint {

    STRING,
    INT,
    DOUBLE,
    BOOL,
    ARRAY,
    OBJECT,
    ANY;

    public boolean matches(JsonNode node) {
        return switch (this) {
        case STRING -> node.isTextual();
        case INT -> node.isIntegralNumber();
        case DOUBLE -> node.isNumber();
        case BOOL -> node.isBoolean();
        case ARRAY -> node.isArray();
        case OBJECT -> node.isObject();
        case ANY -> true;
        };
    }
}
