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

import java.util.List;

/**
 * Routing metadata of a broker message.
 *
 * @param id
 *            unique message id
 * @param messageType
 *            schema name of the payload (e.g. {@code rpc_request})
 * @param sender
 *            identity of the sending endpoint
 * @param targets
 *            identities the message is addressed to
 * @param expires
 *            ISO-8601 expiry instant, may be null
 * @param inReplyTo
 *            id of the request this message answers, may be null
 */
public record MessageEnvelope(
        String id,
        String messageType,
        String sender,
        List<String> targets,
        String expires,
        String inReplyTo) {

    public MessageEnvelope {
        targets = targets == null ? List.of() : List.copyOf(targets);
    }
}
