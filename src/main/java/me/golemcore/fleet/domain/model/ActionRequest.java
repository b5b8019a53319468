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
 * A request to perform one action of one module, extracted from an inbound
 * message.
 *
 * @param id
 *            id of the inbound message, also used as transaction id
 * @param sender
 *            identity of the requester
 * @param module
 *            target module name
 * @param action
 *            target action name
 * @param params
 *            action input; an empty object when the request carried none
 * @param debug
 *            debug annotations of the inbound message
 */
public record ActionRequest(
        String id,
        String sender,
        String module,
        String action,
        JsonNode params,
        List<JsonNode> debug) {

    public ActionRequest {
        debug = debug == null ? List.of() : List.copyOf(debug);
    }
}
