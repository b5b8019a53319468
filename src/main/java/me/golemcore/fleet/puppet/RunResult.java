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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Result document of the puppet {@code run} action.
 *
 * <p>
 * Every field except {@code error_type} and {@code error} is always present.
 * Fields that could not be determined hold {@value #UNKNOWN}; exit code -1
 * means the puppet process never started.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({ "kind", "time", "transaction_uuid", "environment", "status", "error_type", "error",
        "exitcode", "version" })
public class RunResult {

    public static final String UNKNOWN = "unknown";
    public static final int NOT_STARTED = -1;
    public static final int VERSION = 1;

    @Builder.Default
    private String kind = UNKNOWN;

    @Builder.Default
    private String time = UNKNOWN;

    @Builder.Default
    @JsonProperty("transaction_uuid")
    private String transactionUuid = UNKNOWN;

    @Builder.Default
    private String environment = UNKNOWN;

    @Builder.Default
    private String status = UNKNOWN;

    @JsonProperty("error_type")
    @JsonInclude(JsonInclude.Include.NON_NULL)
    private PuppetErrorType errorType;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    private String error;

    @Builder.Default
    private int exitcode = NOT_STARTED;

    @Builder.Default
    private int version = VERSION;

    public static RunResult failure(PuppetErrorType errorType, String error, int exitcode) {
        return RunResult.builder()
                .errorType(errorType)
                .error(error)
                .exitcode(exitcode)
                .build();
    }

    /**
     * Builds a result from the fields of a last run report.
     */
    public static RunResult fromReport(Map<?, ?> report, int exitcode) {
        return RunResult.builder()
                .kind(field(report, "kind"))
                .time(field(report, "time"))
                .transactionUuid(field(report, "transaction_uuid"))
                .environment(field(report, "environment"))
                .status(field(report, "status"))
                .exitcode(exitcode)
                .build();
    }

    private static String field(Map<?, ?> report, String key) {
        Object value = report.get(key);
        return value != null ? value.toString() : UNKNOWN;
    }
}
