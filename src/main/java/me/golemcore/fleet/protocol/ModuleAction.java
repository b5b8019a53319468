package me.golemcore.fleet.protocol;

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
import me.golemcore.fleet.domain.model.ActionDefinition;

import java.util.Optional;

/**
 * One action of an external module.
 */
public interface ModuleAction {

    String name();

    /**
     * Returns the action description published in the module metadata.
     */
    ActionDefinition definition();

    /**
     * Builds the result reported when the invocation of this action is
     * rejected before it runs: unparseable or schema-violating input, or an
     * invocation meant for another action. The document must satisfy the
     * action's results schema and carry {@code error_type}
     * {@value ExternalModuleRunner#INVALID_JSON}.
     */
    JsonNode invalidInput(String message);

    /**
     * Checks the preconditions that take priority over input validation.
     *
     * @param invocation
     *            the invocation, with configuration valid against the module
     *            configuration schema and input not yet validated
     * @return the failure result, or empty when the action may proceed
     */
    default Optional<JsonNode> checkPreconditions(ActionInvocation invocation) {
        return Optional.empty();
    }

    /**
     * Performs the action. Expected failures are reported as data in the
     * returned document, under {@code error_type} and {@code error}.
     *
     * @param invocation
     *            the invocation, with input valid against the input schema
     */
    JsonNode perform(ActionInvocation invocation);
}
