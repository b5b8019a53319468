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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.fleet.domain.model.ModuleMetadata;
import me.golemcore.fleet.domain.service.JsonSchemaValidator;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Module-side implementation of the external module protocol.
 *
 * <p>
 * {@code metadata} prints the module metadata. Any other action reads an
 * {@link ActionInvocation} from the input stream, redirects output when the
 * invocation asks for it, performs the action and prints exactly one result
 * document. The returned exit status is 1 when the result carries an
 * {@code error}, 0 otherwise, and {@value #EXIT_CANNOT_REDIRECT} when the
 * output files cannot be opened.
 */
@Slf4j
public class ExternalModuleRunner {

    public static final String METADATA_ACTION = "metadata";
    public static final int EXIT_SUCCESS = 0;
    public static final int EXIT_FAILURE = 1;
    public static final int EXIT_CANNOT_REDIRECT = 5;

    public static final String ERROR_TYPE = "error_type";
    public static final String ERROR = "error";
    public static final String INVALID_JSON = "invalid_json";

    private final String description;
    private final Map<String, Object> configurationSchema;
    private final Map<String, ModuleAction> actions = new LinkedHashMap<>();
    private final ObjectMapper objectMapper;
    private final InputStream in;
    private final PrintStream out;
    private final PrintStream err;
    private final JsonSchemaValidator validator = new JsonSchemaValidator();

    public ExternalModuleRunner(String description, Map<String, Object> configurationSchema,
            List<ModuleAction> actions, ObjectMapper objectMapper, InputStream in, PrintStream out,
            PrintStream err) {
        this.description = description;
        this.configurationSchema = configurationSchema;
        for (ModuleAction action : actions) {
            this.actions.put(action.name(), action);
        }
        this.objectMapper = objectMapper;
        this.in = in;
        this.out = out;
        this.err = err;
    }

    public ModuleMetadata metadata() {
        return ModuleMetadata.builder()
                .description(description)
                .actions(actions.values().stream().map(ModuleAction::definition).toList())
                .configuration(configurationSchema)
                .build();
    }

    /**
     * Runs one protocol step.
     *
     * @param action
     *            {@code metadata} or the name of the action to perform
     * @return the process exit status
     */
    public int run(String action) {
        if (action == null || METADATA_ACTION.equals(action)) {
            return printMetadata();
        }

        ActionInvocation invocation;
        try {
            invocation = objectMapper.readValue(in, ActionInvocation.class);
        } catch (IOException e) {
            log.debug("Invalid action input", e);
            return print(out, invalidJson(action, "invalid input for '" + action + "': " + describe(e)));
        }
        if (invocation == null) {
            return print(out, invalidJson(action, "no input for '" + action + "'"));
        }

        if (!invocation.hasOutputFiles()) {
            return print(out, perform(action, invocation));
        }
        if (!invocation.getOutputFiles().isComplete()) {
            return print(out, invalidJson(action,
                    "output_files requires the stdout, stderr and exitcode paths"));
        }

        OutputRedirection redirection;
        try {
            redirection = OutputRedirection.open(invocation.getOutputFiles());
        } catch (IOException e) {
            err.println("Failed to open the output files: " + e.getMessage());
            return EXIT_CANNOT_REDIRECT;
        }
        try (redirection) {
            int exitCode = print(redirection.out(), perform(action, invocation));
            redirection.setExitCode(exitCode);
            return exitCode;
        } catch (IOException e) {
            err.println("Failed to write the exit status: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    JsonNode perform(String actionName, ActionInvocation invocation) {
        ModuleAction action = actions.get(actionName);
        if (action == null) {
            return invalidJson(null, "unknown action '" + actionName + "'");
        }
        if (invocation.getAction() != null && !actionName.equals(invocation.getAction())) {
            return action.invalidInput("the input is for action '" + invocation.getAction() + "', not '"
                    + actionName + "'");
        }

        if (invocation.getInput() == null) {
            invocation.setInput(objectMapper.createObjectNode());
        }
        if (invocation.getConfiguration() == null) {
            invocation.setConfiguration(objectMapper.createObjectNode());
        }
        List<String> violations = validator.validate(configurationSchema, invocation.getConfiguration());
        if (!violations.isEmpty()) {
            return action.invalidInput("invalid configuration: " + String.join("; ", violations));
        }
        Optional<JsonNode> unmet = action.checkPreconditions(invocation);
        if (unmet.isPresent()) {
            return unmet.get();
        }
        violations = validator.validate(action.definition().getInput(), invocation.getInput());
        if (!violations.isEmpty()) {
            return action.invalidInput("invalid input: " + String.join("; ", violations));
        }

        return action.perform(invocation);
    }

    private int printMetadata() {
        try {
            out.println(objectMapper.writeValueAsString(metadata()));
            out.flush();
            return EXIT_SUCCESS;
        } catch (JsonProcessingException e) {
            err.println("Failed to serialize metadata: " + e.getOriginalMessage());
            return EXIT_FAILURE;
        }
    }

    private int print(PrintStream target, JsonNode result) {
        try {
            target.println(objectMapper.writeValueAsString(result));
        } catch (JsonProcessingException e) {
            err.println("Failed to serialize result: " + e.getOriginalMessage());
            return EXIT_FAILURE;
        }
        target.flush();
        return result.hasNonNull(ERROR) ? EXIT_FAILURE : EXIT_SUCCESS;
    }

    private JsonNode invalidJson(String actionName, String message) {
        ModuleAction action = actionName != null ? actions.get(actionName) : null;
        if (action != null) {
            return action.invalidInput(message);
        }
        ObjectNode result = objectMapper.createObjectNode();
        result.put(ERROR_TYPE, INVALID_JSON);
        result.put(ERROR, message);
        return result;
    }

    private static String describe(IOException e) {
        return e instanceof JsonProcessingException jpe ? jpe.getOriginalMessage() : e.getMessage();
    }
}
