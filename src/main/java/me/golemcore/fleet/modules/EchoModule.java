package me.golemcore.fleet.modules;

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
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import me.golemcore.fleet.domain.component.BuiltinModule;
import me.golemcore.fleet.domain.model.ActionDefinition;
import me.golemcore.fleet.domain.model.ActionRequest;
import me.golemcore.fleet.domain.model.ModuleMetadata;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Returns its argument unchanged. Used to check that the agent is reachable and
 * processing requests.
 */
@Component
public class EchoModule extends BuiltinModule {

    public static final String NAME = "echo";

    private static final ModuleMetadata METADATA = metadata(NAME, "Echoes back the supplied argument")
            .actions(List.of(ActionDefinition.builder()
                    .name("echo")
                    .description("Return the argument as outcome")
                    .input(Map.of(
                            "type", "object",
                            "required", List.of("argument"),
                            "properties", Map.of("argument", Map.of("type", "string"))))
                    .results(Map.of(
                            "type", "object",
                            "required", List.of("outcome"),
                            "properties", Map.of("outcome", Map.of("type", "string"))))
                    .build()))
            .build();

    public EchoModule(ObjectMapper objectMapper) {
        super(objectMapper);
    }

    @Override
    public ModuleMetadata getMetadata() {
        return METADATA;
    }

    @Override
    protected JsonNode callAction(String action, JsonNode params, ActionRequest request) {
        ObjectNode result = objectMapper.createObjectNode();
        result.put("outcome", params.path("argument").asText());
        return result;
    }
}
