package me.golemcore.fleet.domain.service;

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
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.fleet.domain.component.ExternalModule;
import me.golemcore.fleet.domain.exception.ModuleException;
import me.golemcore.fleet.domain.model.ModuleMetadata;
import me.golemcore.fleet.infrastructure.config.AgentProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Discovers external modules: every regular file of the modules directory is
 * invoked once with {@code metadata}, its output validated and turned into an
 * {@link ExternalModule}. Candidates that fail are logged and skipped.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ExternalModuleLoader {

    static final Map<String, Object> METADATA_SCHEMA = Map.of(
            "type", "object",
            "required", List.of("description", "actions"),
            "properties", Map.of(
                    "name", Map.of("type", "string"),
                    "description", Map.of("type", "string"),
                    "configuration", Map.of("type", "object"),
                    "actions", Map.of(
                            "type", "array",
                            "items", Map.of(
                                    "type", "object",
                                    "required", List.of("name", "input", "results"),
                                    "properties", Map.of(
                                            "name", Map.of("type", "string"),
                                            "description", Map.of("type", "string"),
                                            "input", Map.of("type", "object"),
                                            "results", Map.of("type", "object"))))));

    private static final Pattern MODULE_NAME = Pattern.compile("[A-Za-z0-9_-]+");
    private static final String CONFIG_EXTENSION = ".conf";

    private final AgentProperties properties;
    private final ActionSpool spool;
    private final ObjectMapper objectMapper;
    private final JsonSchemaValidator validator = new JsonSchemaValidator();

    public List<ExternalModule> loadModules() {
        return loadFrom(properties.modulesPath());
    }

    /**
     * Loads every module found in a directory, in file name order.
     */
    public List<ExternalModule> loadFrom(Path modulesDir) {
        if (!Files.isDirectory(modulesDir)) {
            log.warn("[Registry] Modules directory {} does not exist, no external modules loaded", modulesDir);
            return List.of();
        }

        List<Path> candidates;
        try (Stream<Path> files = Files.list(modulesDir)) {
            candidates = files.filter(Files::isRegularFile)
                    .sorted((a, b) -> a.getFileName().toString().compareTo(b.getFileName().toString()))
                    .toList();
        } catch (IOException e) {
            log.error("[Registry] Failed to list modules directory {}: {}", modulesDir, e.getMessage());
            return List.of();
        }

        List<ExternalModule> modules = new ArrayList<>();
        for (Path candidate : candidates) {
            try {
                modules.add(load(candidate));
            } catch (ModuleException e) {
                log.error("[Registry] Failed to load {}: {}", candidate, e.getMessage());
            } catch (RuntimeException e) {
                log.error("[Registry] Unexpected error loading {}", candidate, e);
            }
        }
        return modules;
    }

    /**
     * Loads one module.
     *
     * @throws ModuleException
     *             if the file is not a valid external module
     */
    public ExternalModule load(Path executable) {
        if (!Files.isExecutable(executable)) {
            throw new ModuleException("file is not executable");
        }

        JsonNode document = readMetadata(executable);
        List<String> violations = validator.validate(METADATA_SCHEMA, document);
        if (!violations.isEmpty()) {
            throw new ModuleException("invalid metadata: " + String.join("; ", violations));
        }

        ModuleMetadata metadata;
        try {
            metadata = objectMapper.treeToValue(document, ModuleMetadata.class);
        } catch (JsonProcessingException e) {
            throw new ModuleException("invalid metadata: " + e.getOriginalMessage(), e);
        }

        String name = metadata.getName() != null ? metadata.getName() : fileStem(executable);
        if (!MODULE_NAME.matcher(name).matches()) {
            throw new ModuleException("invalid module name '" + name + "'");
        }
        metadata.setName(name);

        JsonNode configuration = readConfiguration(name, metadata);
        return new ExternalModule(name, executable, metadata, configuration, spool, objectMapper);
    }

    private JsonNode readMetadata(Path executable) {
        ProcessBuilder pb = new ProcessBuilder(executable.toString(), "metadata");
        pb.redirectError(ProcessBuilder.Redirect.DISCARD);
        pb.redirectInput(ProcessBuilder.Redirect.PIPE);

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new ModuleException("failed to execute: " + e.getMessage(), e);
        }

        CompletableFuture<String> output = CompletableFuture.supplyAsync(() -> readFully(process.getInputStream()));
        int timeoutSeconds = properties.getModuleMetadataTimeout();
        try {
            process.getOutputStream().close();
            if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                throw new ModuleException("metadata not produced within " + timeoutSeconds + " seconds");
            }
            if (process.exitValue() != 0) {
                throw new ModuleException("metadata action exited with code " + process.exitValue());
            }
            return objectMapper.readTree(output.get(timeoutSeconds, TimeUnit.SECONDS));
        } catch (JsonProcessingException e) {
            throw new ModuleException("metadata is not valid JSON: " + e.getOriginalMessage(), e);
        } catch (IOException | ExecutionException | TimeoutException e) {
            process.destroyForcibly();
            throw new ModuleException("failed to read metadata: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new ModuleException("interrupted while reading metadata", e);
        }
    }

    private JsonNode readConfiguration(String name, ModuleMetadata metadata) {
        Path configFile = properties.modulesConfigPath().resolve(name + CONFIG_EXTENSION);
        if (!Files.isRegularFile(configFile)) {
            return objectMapper.createObjectNode();
        }

        JsonNode configuration;
        try {
            configuration = objectMapper.readTree(configFile.toFile());
        } catch (IOException e) {
            throw new ModuleException("failed to parse configuration " + configFile + ": " + e.getMessage(), e);
        }
        if (configuration == null || configuration.isMissingNode()) {
            return objectMapper.createObjectNode();
        }

        List<String> violations = validator.validate(metadata.getConfiguration(), configuration);
        if (!violations.isEmpty()) {
            throw new ModuleException("invalid configuration " + configFile + ": " + String.join("; ", violations));
        }
        log.debug("[Registry] Loaded configuration of '{}' from {}", name, configFile);
        return configuration;
    }

    private static String readFully(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    static String fileStem(Path file) {
        String fileName = file.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
