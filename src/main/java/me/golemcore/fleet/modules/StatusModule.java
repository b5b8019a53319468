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
import me.golemcore.fleet.domain.service.ActionSpool;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Out-of-band inspection of external actions: reports the spooled state of a
 * previous request by its transaction id.
 */
@Component
public class StatusModule extends BuiltinModule {

    public static final String NAME = "status";

    private static final ModuleMetadata METADATA = metadata(NAME, "Reports the state of external actions")
            .actions(List.of(ActionDefinition.builder()
                    .name("query")
                    .description("Return the status and output of a previous external action")
                    .input(Map.of(
                            "type", "object",
                            "required", List.of("transaction_id"),
                            "properties", Map.of("transaction_id", Map.of("type", "string"))))
                    .results(Map.of(
                            "type", "object",
                            "required", List.of("status"),
                            "properties", Map.of(
                                    "status", Map.of(
                                            "type", "string",
                                            "enum", List.of(ActionSpool.STATUS_RUNNING, ActionSpool.STATUS_SUCCESS,
                                                    ActionSpool.STATUS_FAILURE, ActionSpool.STATUS_UNKNOWN)),
                                    "exitcode", Map.of("type", "integer"),
                                    "stdout", Map.of("type", "string"),
                                    "stderr", Map.of("type", "string"))))
                    .build()))
            .build();

    private final ActionSpool spool;

    public StatusModule(ObjectMapper objectMapper, ActionSpool spool) {
        super(objectMapper);
        this.spool = spool;
    }

    @Override
    public ModuleMetadata getMetadata() {
        return METADATA;
    }

    @Override
    protected JsonNode callAction(String action, JsonNode params, ActionRequest request) {
        String transactionId = params.path("transaction_id").asText();
        Optional<ActionSpool.SpoolState> state = spool.inspect(transactionId);

        ObjectNode result = objectMapper.createObjectNode();
        if (state.isEmpty()) {
            result.put("status", ActionSpool.STATUS_UNKNOWN);
            return result;
        }
        ActionSpool.SpoolState spoolState = state.get();
        result.put("status", spoolState.status());
        if (spoolState.exitcode() != null) {
            result.put("exitcode", spoolState.exitcode());
        }
        result.put("stdout", spoolState.stdout());
        result.put("stderr", spoolState.stderr());
        return result;
    }
}
