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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.fleet.domain.component.BuiltinModule;
import me.golemcore.fleet.domain.model.ActionDefinition;
import me.golemcore.fleet.domain.model.ActionRequest;
import me.golemcore.fleet.domain.model.ModuleMetadata;
import me.golemcore.fleet.infrastructure.config.AgentProperties;
import org.springframework.stereotype.Component;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.List;
import java.util.Map;

/**
 * Collects basic facts about the host and the agent process.
 */
@Component
@Slf4j
public class InventoryModule extends BuiltinModule {

    public static final String NAME = "inventory";

    private static final ModuleMetadata METADATA = metadata(NAME, "Provides facts about the host")
            .actions(List.of(ActionDefinition.builder()
                    .name("inventory")
                    .description("Return the facts of this host")
                    .input(Map.of("type", "object"))
                    .results(Map.of(
                            "type", "object",
                            "required", List.of("facts"),
                            "properties", Map.of("facts", Map.of("type", "object"))))
                    .build()))
            .build();

    private final AgentProperties properties;

    public InventoryModule(ObjectMapper objectMapper, AgentProperties properties) {
        super(objectMapper);
        this.properties = properties;
    }

    @Override
    public ModuleMetadata getMetadata() {
        return METADATA;
    }

    @Override
    protected JsonNode callAction(String action, JsonNode params, ActionRequest request) {
        ObjectNode result = objectMapper.createObjectNode();
        ObjectNode facts = result.putObject("facts");
        facts.put("hostname", hostname());
        facts.put("identity", properties.getIdentity());
        facts.put("os_name", System.getProperty("os.name"));
        facts.put("os_version", System.getProperty("os.version"));
        facts.put("os_arch", System.getProperty("os.arch"));
        facts.put("processors", Runtime.getRuntime().availableProcessors());
        facts.put("max_memory", Runtime.getRuntime().maxMemory());
        facts.put("java_version", System.getProperty("java.version"));
        facts.put("user", System.getProperty("user.name"));
        facts.put("modules_dir", properties.modulesPath().toString());
        return result;
    }

    private String hostname() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.debug("[Inventory] Cannot resolve local hostname: {}", e.getMessage());
            return "unknown";
        }
    }
}
