package me.golemcore.fleet.domain.dispatch;

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
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.fleet.domain.component.AgentModule;
import me.golemcore.fleet.domain.exception.ConnectionConfigException;
import me.golemcore.fleet.domain.exception.ConnectionException;
import me.golemcore.fleet.domain.exception.ConnectionFatalException;
import me.golemcore.fleet.domain.exception.FatalAgentException;
import me.golemcore.fleet.domain.exception.RequestException;
import me.golemcore.fleet.domain.exception.RequestValidationException;
import me.golemcore.fleet.domain.model.ActionRequest;
import me.golemcore.fleet.domain.model.ContentType;
import me.golemcore.fleet.domain.model.MessageEnvelope;
import me.golemcore.fleet.domain.model.MessageSchema;
import me.golemcore.fleet.domain.model.OutboundMessage;
import me.golemcore.fleet.domain.model.ParsedMessage;
import me.golemcore.fleet.domain.model.TypeConstraint;
import me.golemcore.fleet.domain.service.ModuleRegistry;
import me.golemcore.fleet.infrastructure.config.AgentProperties;
import me.golemcore.fleet.port.inbound.BrokerConnector;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Receives action requests from the broker, routes them to modules and sends
 * back results or errors.
 *
 * <p>
 * Requests are processed synchronously on the connector's delivery thread, one
 * at a time. Nothing thrown while handling a request escapes the callback:
 * request failures become error responses and send failures are logged.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AgentDispatcher {

    public static final String RPC_REQUEST = "rpc_request";
    public static final String RPC_RESPONSE = "rpc_response";
    public static final String RPC_ERROR = "rpc_error_message";

    private static final String FIELD_MODULE = "module";
    private static final String FIELD_ACTION = "action";
    private static final String FIELD_PARAMS = "params";
    private static final String FIELD_ERROR = "error";
    private static final String FIELD_DEBUG_DATA = "debug_data";

    private final BrokerConnector connector;
    private final ModuleRegistry moduleRegistry;
    private final AgentProperties properties;
    private final ObjectMapper objectMapper;

    static MessageSchema requestSchema() {
        return new MessageSchema(RPC_REQUEST, ContentType.JSON)
                .addConstraint(FIELD_MODULE, TypeConstraint.STRING, true)
                .addConstraint(FIELD_ACTION, TypeConstraint.STRING, true)
                .addConstraint(FIELD_PARAMS, TypeConstraint.OBJECT, false);
    }

    /**
     * Loads the modules, connects to the broker and serves requests until the
     * connection is closed.
     *
     * @throws FatalAgentException
     *             if the connection cannot be configured, established or
     *             re-established
     */
    public void start() {
        moduleRegistry.ensureInitialized();
        connector.registerMessageCallback(requestSchema(), this::handleRequest);

        try {
            connector.connect();
        } catch (ConnectionConfigException e) {
            throw new FatalAgentException("failed to configure the underlying communications layer: "
                    + e.getMessage(), e);
        } catch (ConnectionFatalException e) {
            throw new FatalAgentException("failed to connect: " + e.getMessage(), e);
        }

        log.info("[Dispatcher] Connected to {}, waiting for requests", properties.getBrokerWsUri());
        try {
            connector.monitorConnection();
        } catch (ConnectionFatalException e) {
            throw new FatalAgentException("failed to reconnect: " + e.getMessage(), e);
        }
    }

    void handleRequest(ParsedMessage message) {
        MessageEnvelope envelope = message.envelope();
        log.info("[Dispatcher] Received request {} from {}", envelope.id(), envelope.sender());

        try {
            ActionRequest request = toActionRequest(message);
            AgentModule module = moduleRegistry.find(request.module())
                    .orElseThrow(() -> new RequestValidationException("unknown module: " + request.module()));

            log.info("[Dispatcher] Performing '{} {}' for request {}", request.module(), request.action(),
                    request.id());
            JsonNode result = module.performRequest(request);
            sendResponse(envelope, result, message.debug());
        } catch (RequestException e) {
            log.warn("[Dispatcher] Request {} failed: {}", envelope.id(), e.getMessage());
            sendError(envelope, e.getMessage());
        } catch (RuntimeException e) {
            log.error("[Dispatcher] Unexpected failure processing request {}", envelope.id(), e);
            sendError(envelope, "unexpected failure: " + e.getMessage());
        }
    }

    private ActionRequest toActionRequest(ParsedMessage message) {
        if (!message.hasData() || message.data() == null) {
            throw new RequestValidationException("no data");
        }
        JsonNode data = message.data();
        if (message.dataType() != ContentType.JSON || !data.isObject()) {
            throw new RequestValidationException("data is not in JSON format");
        }

        JsonNode params = data.get(FIELD_PARAMS);
        if (params == null || params.isNull()) {
            params = objectMapper.createObjectNode();
        }
        MessageEnvelope envelope = message.envelope();
        return new ActionRequest(
                envelope.id(),
                envelope.sender(),
                data.path(FIELD_MODULE).asText(),
                data.path(FIELD_ACTION).asText(),
                params,
                message.debug());
    }

    private void sendResponse(MessageEnvelope envelope, JsonNode result, List<JsonNode> debug) {
        List<JsonNode> debugEntries = debug.stream()
                .map(entry -> (JsonNode) objectMapper.createObjectNode().set(FIELD_DEBUG_DATA, entry))
                .toList();
        OutboundMessage response = new OutboundMessage(replyTargets(envelope), RPC_RESPONSE, envelope.id(),
                result, debugEntries);
        try {
            connector.send(response, properties.getSendTimeout());
            log.info("[Dispatcher] Sent response for request {} to {}", envelope.id(), envelope.sender());
        } catch (ConnectionException e) {
            log.error("[Dispatcher] Failed to send response for request {}: {}", envelope.id(), e.getMessage());
        }
    }

    private static List<String> replyTargets(MessageEnvelope envelope) {
        return envelope.sender() != null ? List.of(envelope.sender()) : List.of();
    }

    private void sendError(MessageEnvelope envelope, String description) {
        ObjectNode error = objectMapper.createObjectNode();
        error.put(FIELD_ERROR, description);
        OutboundMessage response = new OutboundMessage(replyTargets(envelope), RPC_ERROR, envelope.id(),
                error, List.of());
        try {
            connector.send(response, properties.getSendTimeout());
            log.info("[Dispatcher] Sent error for request {} to {}", envelope.id(), envelope.sender());
        } catch (ConnectionException e) {
            log.error("[Dispatcher] Failed to send error for request {}: {}", envelope.id(), e.getMessage());
        }
    }
}
