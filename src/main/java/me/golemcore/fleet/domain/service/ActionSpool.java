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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.fleet.domain.exception.RequestProcessingException;
import me.golemcore.fleet.domain.exception.RequestValidationException;
import me.golemcore.fleet.infrastructure.config.AgentProperties;
import me.golemcore.fleet.protocol.OutputFiles;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Per-transaction directories holding the output files of external module
 * runs.
 *
 * <p>
 * Layout: {@code <agent.spool-dir>/<transaction id>/{stdout,stderr,exitcode}}.
 * A run is finished exactly when its {@code exitcode} file exists and is not
 * empty. Directories are kept after the run so the {@code status} module can
 * report on them.
 */
@Component
@Slf4j
public class ActionSpool {

    public static final String STATUS_RUNNING = "running";
    public static final String STATUS_SUCCESS = "success";
    public static final String STATUS_FAILURE = "failure";
    public static final String STATUS_UNKNOWN = "unknown";

    private static final Pattern TRANSACTION_ID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]{0,127}");

    private final Path spoolRoot;

    public ActionSpool(AgentProperties properties) {
        this.spoolRoot = properties.spoolPath();
    }

    public Path getSpoolRoot() {
        return spoolRoot;
    }

    /**
     * Creates (or reuses) the results directory of a transaction and removes a
     * stale exit status left by an earlier run with the same id.
     */
    public OutputFiles prepare(String transactionId) {
        Path directory = resolve(transactionId);
        try {
            Files.createDirectories(directory);
            OutputFiles files = OutputFiles.in(directory);
            Files.deleteIfExists(files.exitcodePath());
            return files;
        } catch (IOException e) {
            throw new RequestProcessingException("failed to prepare results directory " + directory, e);
        }
    }

    /**
     * Reads the exit status of a finished run.
     *
     * @return the exit status, or empty while the file is missing, empty or
     *         unparseable
     */
    public Optional<Integer> readExitCode(OutputFiles files) {
        Path exitcode = files.exitcodePath();
        if (!Files.isRegularFile(exitcode)) {
            return Optional.empty();
        }
        try {
            String content = Files.readString(exitcode, StandardCharsets.UTF_8).trim();
            if (content.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(Integer.parseInt(content));
        } catch (IOException | NumberFormatException e) {
            log.warn("[Spool] Unreadable exit status in {}: {}", exitcode, e.getMessage());
            return Optional.empty();
        }
    }

    public String readOutput(Path file) {
        if (!Files.isRegularFile(file)) {
            return "";
        }
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RequestProcessingException("failed to read " + file, e);
        }
    }

    /**
     * Reports the state of a transaction.
     *
     * @return the state, or empty when the transaction is not known
     */
    public Optional<SpoolState> inspect(String transactionId) {
        Path directory = resolve(transactionId);
        if (!Files.isDirectory(directory)) {
            return Optional.empty();
        }
        OutputFiles files = OutputFiles.in(directory);
        Optional<Integer> exitCode = readExitCode(files);
        if (exitCode.isEmpty()) {
            String status = Files.exists(files.exitcodePath()) ? STATUS_UNKNOWN : STATUS_RUNNING;
            return Optional.of(new SpoolState(status, null, "", ""));
        }
        String status = exitCode.get() == 0 ? STATUS_SUCCESS : STATUS_FAILURE;
        return Optional.of(new SpoolState(status, exitCode.get(),
                readOutput(files.stdoutPath()), readOutput(files.stderrPath())));
    }

    private Path resolve(String transactionId) {
        if (transactionId == null || !TRANSACTION_ID.matcher(transactionId).matches()) {
            throw new RequestValidationException("invalid transaction id: " + transactionId);
        }
        return spoolRoot.resolve(transactionId);
    }

    /**
     * Snapshot of a spooled run.
     */
    public record SpoolState(String status, Integer exitcode, String stdout, String stderr) {
    }
}
