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
import me.golemcore.fleet.domain.exception.RequestException;
import me.golemcore.fleet.domain.exception.RequestValidationException;
import me.golemcore.fleet.domain.model.ActionDefinition;
import me.golemcore.fleet.domain.model.ActionRequest;
import me.golemcore.fleet.domain.model.ModuleMetadata;

import java.util.List;

/**
 * A named, pluggable unit exposing one or more actions to remote requesters.
 * There are exactly two kinds: {@link BuiltinModule}s run in-process,
 * {@link ExternalModule}s run as a subprocess speaking the external module
 * protocol. Modules are immutable once registered.
 */
public sealed interface AgentModule permits BuiltinModule, ExternalModule {

    /**
     * Returns the unique name requests use to address this module.
     */
    String getName();

    /**
     * Returns the module self-description, including every accepted action.
     */
    ModuleMetadata getMetadata();

    /**
     * Performs the requested action and returns its result document.
     *
     * @throws RequestException
     *             if the request is invalid for this module or the action could
     *             not produce a result
     */
    JsonNode performRequest(ActionRequest request);

    default List<String> getActionNames() {
        return getMetadata().actionNames();
    }

    default ActionDefinition requireAction(String actionName) {
        return getMetadata().findAction(actionName)
                .orElseThrow(() -> new RequestValidationException(
                        "unknown action '" + actionName + "' for module '" + getName() + "'"));
    }
}
