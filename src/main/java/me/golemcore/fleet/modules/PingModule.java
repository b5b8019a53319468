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
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import me.golemcore.fleet.domain.component.BuiltinModule;
import me.golemcore.fleet.domain.model.ActionDefinition;
import me.golemcore.fleet.domain.model.ActionRequest;
import me.golemcore.fleet.domain.model.ModuleMetadata;
import me.golemcore.fleet.infrastructure.config.AgentProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Reports the hops a request went through: the hop entries found in the debug
 * annotations of the request, followed by one entry for this agent.
 */
@Component
public class PingModule extends BuiltinModule {

    public static final String NAME = "ping";

    private static final String HOPS = "hops";

    private static final ModuleMetadata METADATA = metadata(NAME, "Reports the hops of a request")
            .actions(List.of(ActionDefinition.builder()
                    .name("ping")
                    .description("Return the request hops, ending with this agent")
                    .input(Map.of("type", "object"))
                    .results(Map.of(
                            "type", "object",
                            "required", List.of("request_hops"),
                            "properties", Map.of("request_hops", Map.of("type", "array"))))
                    .build()))
            .build();

    private final AgentProperties properties;
    private final Clock clock;

    public PingModule(ObjectMapper objectMapper, AgentProperties properties, Clock clock) {
        super(objectMapper);
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public ModuleMetadata getMetadata() {
        return METADATA;
    }

    @Override
    protected JsonNode callAction(String action, JsonNode params, ActionRequest request) {
        ObjectNode result = objectMapper.createObjectNode();
        ArrayNode hops = result.putArray("request_hops");
        for (JsonNode entry : request.debug()) {
            entry.path(HOPS).forEach(hops::add);
        }

        ObjectNode self = hops.addObject();
        self.put("server", properties.getIdentity());
        self.put("time", Instant.now(clock).toString());
        self.put("stage", "agent");
        return result;
    }
}
