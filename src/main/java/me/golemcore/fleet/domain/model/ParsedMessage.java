package me.golemcore.fleet.domain.model;

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

import java.util.List;

/**
 * Inbound broker message after envelope decoding and schema validation.
 *
 * @param envelope
 *            routing metadata
 * @param hasData
 *            whether the message carried a payload at all
 * @param dataType
 *            declared payload content type
 * @param data
 *            payload; a text node for non-JSON content, null when absent
 * @param debug
 *            debug annotations appended by the broker and requester
 */
public record ParsedMessage(
        MessageEnvelope envelope,
        boolean hasData,
        ContentType dataType,
        JsonNode data,
        List<JsonNode> debug) {

    public ParsedMessage {
        debug = debug == null ? List.of() : List.copyOf(debug);
    }
}
