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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Self-description of a module: what it does, which actions it accepts and
 * which configuration it reads. External modules print this document when
 * invoked with the {@code metadata} action.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class ModuleMetadata {

    private String name;
    private String description;
    @Builder.Default
    private List<ActionDefinition> actions = new ArrayList<>();
    private Map<String, Object> configuration; // JSON Schema

    public Optional<ActionDefinition> findAction(String actionName) {
        if (actions == null) {
            return Optional.empty();
        }
        return actions.stream()
                .filter(action -> action.getName().equals(actionName))
                .findFirst();
    }

    public List<String> actionNames() {
        if (actions == null) {
            return List.of();
        }
        return actions.stream().map(ActionDefinition::getName).toList();
    }
}
