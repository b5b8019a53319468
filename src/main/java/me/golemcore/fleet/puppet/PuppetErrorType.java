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

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Closed vocabulary of puppet run failures, serialized under
 * {@code error_type}.
 */
public enum PuppetErrorType {

    INVALID_JSON("invalid_json"),

    NO_PUPPET_BIN("no_puppet_bin"),

    NO_LAST_RUN_REPORT("no_last_run_report"),

    INVALID_LAST_RUN_REPORT("invalid_last_run_report"),

    AGENT_ALREADY_RUNNING("agent_already_running"),

    AGENT_DISABLED("agent_disabled"),

    AGENT_FAILED_TO_START("agent_failed_to_start"),

    AGENT_EXIT_NON_ZERO("agent_exit_non_zero");

    private final String wireName;

    PuppetErrorType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }
}
