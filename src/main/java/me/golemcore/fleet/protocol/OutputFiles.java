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

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.nio.file.Path;

/**
 * Output redirection requested from an external module: where to write its
 * stdout, its stderr and, last of all, its numeric exit status.
 *
 * @param stdout
 *            path of the captured standard output
 * @param stderr
 *            path of the captured standard error
 * @param exitcode
 *            path of the exit status file; its appearance signals completion
 */
public record OutputFiles(String stdout, String stderr, String exitcode) {

    public static OutputFiles in(Path directory) {
        return new OutputFiles(
                directory.resolve("stdout").toString(),
                directory.resolve("stderr").toString(),
                directory.resolve("exitcode").toString());
    }

    /**
     * Checks that all three paths are given.
     */
    @JsonIgnore
    public boolean isComplete() {
        return isPresent(stdout) && isPresent(stderr) && isPresent(exitcode);
    }

    private static boolean isPresent(String path) {
        return path != null && !path.isBlank();
    }

    public Path stdoutPath() {
        return Path.of(stdout);
    }

    public Path stderrPath() {
        return Path.of(stderr);
    }

    public Path exitcodePath() {
        return Path.of(exitcode);
    }
}
