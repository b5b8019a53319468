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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * One action a module exposes: its name, description and the JSON Schemas of
 * its input and its results.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ActionDefinition {

    private String name;
    private String description;
    private Map<String, Object> input; // JSON Schema
    private Map<String, Object> results; // JSON Schema

    /**
     * Creates an action definition whose input and results are unconstrained
     * objects.
     */
    public static ActionDefinition simple(String name, String description) {
        return ActionDefinition.builder()
                .name(name)
                .description(description)
                .input(Map.of("type", "object", "properties", Map.of()))
                .results(Map.of("type", "object", "properties", Map.of()))
                .build();
    }
}
