package me.golemcore.fleet.domain.component;

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
import me.golemcore.fleet.domain.exception.RequestValidationException;
import me.golemcore.fleet.domain.model.ActionDefinition;
import me.golemcore.fleet.domain.model.ActionRequest;
import me.golemcore.fleet.domain.model.ModuleMetadata;
import me.golemcore.fleet.domain.service.JsonSchemaValidator;

import java.util.List;

/**
 * Base class for modules implemented in-process. Subclasses declare their
 * metadata and implement {@link #callAction}; request params are validated
 * against the action input schema before the call.
 */
public abstract non-sealed class BuiltinModule implements AgentModule {

    protected final ObjectMapper objectMapper;
    private final JsonSchemaValidator validator = new JsonSchemaValidator();

    protected BuiltinModule(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public String getName() {
        return getMetadata().getName();
    }

    @Override
    public final JsonNode performRequest(ActionRequest request) {
        ActionDefinition action = requireAction(request.action());
        JsonNode params = request.params() != null ? request.params() : objectMapper.createObjectNode();
        List<String> violations = validator.validate(action.getInput(), params);
        if (!violations.isEmpty()) {
            throw new RequestValidationException("invalid input for '" + getName() + " "
                    + action.getName() + "': " + String.join("; ", violations));
        }
        return callAction(action.getName(), params, request);
    }

    /**
     * Executes a validated action.
     *
     * @param action
     *            the action name, known to be declared in the metadata
     * @param params
     *            the action input, valid against the input schema
     * @param request
     *            the full request, for correlation and debug data
     * @return the result document
     */
    protected abstract JsonNode callAction(String action, JsonNode params, ActionRequest request);

    protected static ModuleMetadata.ModuleMetadataBuilder metadata(String name, String description) {
        return ModuleMetadata.builder().name(name).description(description);
    }
}
