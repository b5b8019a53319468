package me.golemcore.fleet.puppet;

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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.fleet.domain.model.ActionDefinition;
import me.golemcore.fleet.protocol.ActionInvocation;
import me.golemcore.fleet.protocol.ModuleAction;
import me.golemcore.fleet.protocol.ProcessEnvironment;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * The {@code run} action: triggers a single {@code puppet agent} run and
 * reports its outcome from the last run report.
 */
@Slf4j
public class PuppetRunAction implements ModuleAction {

    public static final String NAME = "run";
    public static final String CONFIG_PUPPET_BIN = "puppet_bin";

    static final String DEFAULT_PUPPET_BIN = "/opt/puppetlabs/bin/puppet";
    static final String DEFAULT_WINDOWS_PUPPET_BIN = "C:\\Program Files\\Puppet Labs\\Puppet\\bin\\puppet.bat";

    static final ActionDefinition DEFINITION = ActionDefinition.builder()
            .name(NAME)
            .description("Start a Puppet run")
            .input(Map.of(
                    "type", "object",
                    "required", List.of("env", "flags"),
                    "properties", Map.of(
                            "env", Map.of("type", "array", "items", Map.of("type", "string")),
                            "flags", Map.of("type", "array", "items", Map.of("type", "string")))))
            .results(Map.of(
                    "type", "object",
                    "required", List.of("kind", "time", "transaction_uuid", "environment", "status", "exitcode",
                            "version"),
                    "properties", Map.of(
                            "kind", Map.of("type", "string"),
                            "time", Map.of("type", "string"),
                            "transaction_uuid", Map.of("type", "string"),
                            "environment", Map.of("type", "string"),
                            "status", Map.of("type", "string"),
                            "error_type", Map.of("type", "string"),
                            "error", Map.of("type", "string"),
                            "exitcode", Map.of("type", "number"),
                            "version", Map.of("type", "number"))))
            .build();

    public static final Map<String, Object> CONFIGURATION_SCHEMA = Map.of(
            "type", "object",
            "properties", Map.of(CONFIG_PUPPET_BIN, Map.of("type", "string")));

    private final ObjectMapper objectMapper;
    private final ProcessEnvironment processEnvironment;
    private final LastRunReportReader reportReader;
    private final String defaultPuppetBin;

    public PuppetRunAction(ObjectMapper objectMapper, ProcessEnvironment processEnvironment) {
        this(objectMapper, processEnvironment, new LastRunReportReader(), defaultPuppetBin());
    }

    PuppetRunAction(ObjectMapper objectMapper, ProcessEnvironment processEnvironment,
            LastRunReportReader reportReader, String defaultPuppetBin) {
        this.objectMapper = objectMapper;
        this.processEnvironment = processEnvironment;
        this.reportReader = reportReader;
        this.defaultPuppetBin = defaultPuppetBin;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ActionDefinition definition() {
        return DEFINITION;
    }

    @Override
    public JsonNode invalidInput(String message) {
        return objectMapper.valueToTree(RunResult.failure(PuppetErrorType.INVALID_JSON, message,
                RunResult.NOT_STARTED));
    }

    @Override
    public Optional<JsonNode> checkPreconditions(ActionInvocation invocation) {
        return missingBinary(puppetBin(invocation)).map(objectMapper::valueToTree);
    }

    @Override
    public JsonNode perform(ActionInvocation invocation) {
        return objectMapper.valueToTree(run(invocation));
    }

    RunResult run(ActionInvocation invocation) {
        String puppetBin = puppetBin(invocation);
        Optional<RunResult> missing = missingBinary(puppetBin);
        if (missing.isPresent()) {
            return missing.get();
        }

        List<String> flags = strings(invocation.getInput().path("flags"));
        List<String> env = strings(invocation.getInput().path("env"));
        Optional<String> invalid = PuppetFlagValidator.findInvalidFlag(flags)
                .or(() -> PuppetFlagValidator.findInvalidEnvEntry(env));
        if (invalid.isPresent()) {
            return RunResult.failure(PuppetErrorType.INVALID_JSON, "Invalid input: " + invalid.get(),
                    RunResult.NOT_STARTED);
        }

        Optional<Path> reportPath = lastRunReportPath(puppetBin, env);
        Optional<FileTime> previousReportTime = reportPath.flatMap(reportReader::modificationTime);

        List<String> command = new ArrayList<>();
        command.add(puppetBin);
        command.add("agent");
        command.addAll(PuppetFlagValidator.DEFAULT_FLAGS);
        command.addAll(PuppetFlagValidator.withoutDefaults(flags));

        ProcessOutcome outcome;
        try {
            outcome = execute(command, env, true);
        } catch (IOException e) {
            log.warn("Failed to start Puppet agent: {}", e.getMessage());
            return RunResult.failure(PuppetErrorType.AGENT_FAILED_TO_START, "Failed to start Puppet agent",
                    RunResult.NOT_STARTED);
        }

        int exitcode = outcome.exitCode();
        if (PuppetConsoleOutput.isAlreadyRunning(outcome.output())) {
            return RunResult.failure(PuppetErrorType.AGENT_ALREADY_RUNNING,
                    "Puppet agent is already performing a run", exitcode);
        }
        if (PuppetConsoleOutput.isDisabled(outcome.output())) {
            return RunResult.failure(PuppetErrorType.AGENT_DISABLED, "Puppet agent is disabled", exitcode);
        }

        Optional<FileTime> currentReportTime = reportPath.flatMap(reportReader::modificationTime);
        if (currentReportTime.isEmpty() || currentReportTime.equals(previousReportTime)) {
            return RunResult.failure(PuppetErrorType.NO_LAST_RUN_REPORT,
                    "Puppet agent did not produce a new last run report", exitcode);
        }

        RunResult result;
        try {
            result = RunResult.fromReport(reportReader.read(reportPath.get()), exitcode);
        } catch (InvalidReportException e) {
            log.warn("{}", e.getMessage());
            return RunResult.failure(PuppetErrorType.INVALID_LAST_RUN_REPORT,
                    "Could not parse the last run report " + reportPath.get(), exitcode);
        }

        if (exitcode != 0) {
            result.setErrorType(PuppetErrorType.AGENT_EXIT_NON_ZERO);
            result.setError("Puppet agent exited with a non 0 exitcode");
        }
        return result;
    }

    private String puppetBin(ActionInvocation invocation) {
        JsonNode configuration = invocation.getConfiguration();
        return configuration != null
                ? configuration.path(CONFIG_PUPPET_BIN).asText(defaultPuppetBin)
                : defaultPuppetBin;
    }

    private static Optional<RunResult> missingBinary(String puppetBin) {
        if (Files.exists(Path.of(puppetBin))) {
            return Optional.empty();
        }
        return Optional.of(RunResult.failure(PuppetErrorType.NO_PUPPET_BIN,
                "Puppet executable '" + puppetBin + "' does not exist", RunResult.NOT_STARTED));
    }

    private Optional<Path> lastRunReportPath(String puppetBin, List<String> env) {
        try {
            // stdout only: warnings on stderr must not end up in the path
            ProcessOutcome outcome = execute(List.of(puppetBin, "agent", "--configprint", "lastrunreport"), env,
                    false);
            String path = outcome.output().trim();
            if (outcome.exitCode() != 0 || path.isEmpty()) {
                log.warn("Cannot determine the last run report location (exit code {})", outcome.exitCode());
                return Optional.empty();
            }
            return Optional.of(Path.of(path));
        } catch (IOException e) {
            log.warn("Cannot determine the last run report location: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private ProcessOutcome execute(List<String> command, List<String> env, boolean includeStderr)
            throws IOException {
        ProcessBuilder pb = new ProcessBuilder(command);
        if (includeStderr) {
            pb.redirectErrorStream(true);
        } else {
            pb.redirectError(ProcessBuilder.Redirect.DISCARD);
        }
        pb.redirectInput(ProcessBuilder.Redirect.PIPE);
        Map<String, String> environment = pb.environment();
        for (String entry : env) {
            int equals = entry.indexOf('=');
            environment.put(entry.substring(0, equals), entry.substring(equals + 1));
        }
        processEnvironment.apply(environment);

        log.debug("Executing {}", command);
        Process process = pb.start();
        process.getOutputStream().close();
        String output;
        try (InputStream in = process.getInputStream()) {
            output = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
        try {
            int exitCode = process.waitFor();
            log.debug("{} exited with {}", command.get(0), exitCode);
            return new ProcessOutcome(exitCode, output);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new IOException("interrupted while waiting for " + command.get(0), e);
        }
    }

    private static List<String> strings(JsonNode array) {
        List<String> values = new ArrayList<>();
        array.forEach(value -> values.add(value.asText()));
        return values;
    }

    static String defaultPuppetBin() {
        String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        return os.contains("win") ? DEFAULT_WINDOWS_PUPPET_BIN : DEFAULT_PUPPET_BIN;
    }

    private record ProcessOutcome(int exitCode, String output) {
    }
}
