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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.fleet.domain.exception.RequestProcessingException;
import me.golemcore.fleet.domain.exception.RequestValidationException;
import me.golemcore.fleet.domain.model.ActionDefinition;
import me.golemcore.fleet.domain.model.ActionRequest;
import me.golemcore.fleet.domain.model.ModuleMetadata;
import me.golemcore.fleet.domain.service.ActionSpool;
import me.golemcore.fleet.domain.service.JsonSchemaValidator;
import me.golemcore.fleet.protocol.ActionInvocation;
import me.golemcore.fleet.protocol.OutputFiles;

import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * A module implemented by an executable speaking the external module protocol.
 *
 * <p>
 * Each request launches {@code <executable> <action>} in the transaction's
 * spool directory, writes the {@link ActionInvocation} to its stdin with
 * output redirected to files in that directory, and waits for the process.
 * The result is the stdout file, accepted only once the module has written
 * its exit status. Module execution is not bounded by a timeout.
 */
@Slf4j
public final class ExternalModule implements AgentModule {

    static final String LAUNCH_LOG = "launch.log";

    private final String name;
    private final Path executable;
    private final ModuleMetadata metadata;
    private final JsonNode configuration;
    private final ActionSpool spool;
    private final ObjectMapper objectMapper;
    private final JsonSchemaValidator validator = new JsonSchemaValidator();

    public ExternalModule(String name, Path executable, ModuleMetadata metadata, JsonNode configuration,
            ActionSpool spool, ObjectMapper objectMapper) {
        this.name = name;
        this.executable = executable;
        this.metadata = metadata;
        this.configuration = configuration != null ? configuration : objectMapper.createObjectNode();
        this.spool = spool;
        this.objectMapper = objectMapper;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public ModuleMetadata getMetadata() {
        return metadata;
    }

    public JsonNode getConfiguration() {
        return configuration;
    }

    @Override
    public JsonNode performRequest(ActionRequest request) {
        ActionDefinition action = requireAction(request.action());
        JsonNode input = request.params() != null ? request.params() : objectMapper.createObjectNode();
        List<String> violations = validator.validate(action.getInput(), input);
        if (!violations.isEmpty()) {
            throw new RequestValidationException("invalid input for '" + name + " " + action.getName()
                    + "': " + String.join("; ", violations));
        }

        OutputFiles files = spool.prepare(request.id());
        ActionInvocation invocation = ActionInvocation.builder()
                .action(action.getName())
                .input(input)
                .configuration(configuration)
                .outputFiles(files)
                .build();

        int processExitCode = launch(action.getName(), invocation, files);

        Optional<Integer> exitCode = spool.readExitCode(files);
        if (exitCode.isEmpty()) {
            throw new RequestProcessingException("the module '" + name + "' terminated unexpectedly (exit code "
                    + processExitCode + ") while performing '" + action.getName() + "'");
        }
        log.debug("[Module:{}] '{}' finished with exit code {}", name, action.getName(), exitCode.get());

        JsonNode result = parseResult(action, spool.readOutput(files.stdoutPath()));
        List<String> resultViolations = validator.validate(action.getResults(), result);
        if (!resultViolations.isEmpty()) {
            throw new RequestProcessingException("the '" + name + " " + action.getName()
                    + "' results are invalid: " + String.join("; ", resultViolations));
        }
        return result;
    }

    private int launch(String actionName, ActionInvocation invocation, OutputFiles files) {
        Path workDir = files.exitcodePath().getParent();
        ProcessBuilder pb = new ProcessBuilder(executable.toString(), actionName);
        pb.directory(workDir.toFile());
        // stdout/stderr are redirected by the module itself; anything written
        // before the redirection is in effect lands here
        File launchLog = workDir.resolve(LAUNCH_LOG).toFile();
        pb.redirectOutput(ProcessBuilder.Redirect.appendTo(launchLog));
        pb.redirectError(ProcessBuilder.Redirect.appendTo(launchLog));

        log.info("[Module:{}] Executing '{}' in {}", name, actionName, workDir);
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new RequestProcessingException("failed to execute the '" + name + "' module: " + e.getMessage(), e);
        }

        try (OutputStream stdin = process.getOutputStream()) {
            objectMapper.writeValue(stdin, invocation);
        } catch (IOException e) {
            // the module may exit without reading its input
            log.debug("[Module:{}] Failed to write action input: {}", name, e.getMessage());
        }

        try {
            return process.waitFor();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new RequestProcessingException("interrupted while waiting for the '" + name + "' module", e);
        }
    }

    private JsonNode parseResult(ActionDefinition action, String output) {
        if (output.isBlank()) {
            throw new RequestProcessingException("the '" + name + " " + action.getName()
                    + "' action produced no output");
        }
        try {
            return objectMapper.readTree(output);
        } catch (JsonProcessingException e) {
            throw new RequestProcessingException("the '" + name + " " + action.getName()
                    + "' output is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }
}
