package me.golemcore.fleet.adapter.inbound.broker;

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
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.fleet.domain.exception.ConnectionConfigException;
import me.golemcore.fleet.domain.exception.ConnectionException;
import me.golemcore.fleet.domain.exception.ConnectionFatalException;
import me.golemcore.fleet.domain.model.ContentType;
import me.golemcore.fleet.domain.model.MessageEnvelope;
import me.golemcore.fleet.domain.model.MessageSchema;
import me.golemcore.fleet.domain.model.OutboundMessage;
import me.golemcore.fleet.domain.model.ParsedMessage;
import me.golemcore.fleet.infrastructure.config.AgentProperties;
import me.golemcore.fleet.infrastructure.http.BrokerTlsFactory;
import me.golemcore.fleet.port.inbound.BrokerConnector;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Broker connector speaking JSON envelopes over an OkHttp WebSocket.
 *
 * <p>
 * Each text frame carries one envelope:
 * {@code {id, message_type, sender, targets, expires, in_reply_to, data,
 * data_type, debug}}. Inbound envelopes are matched to a registered schema by
 * {@code message_type}; unknown types and payloads violating the schema are
 * logged and dropped. Accepted messages are delivered to their callback on a
 * single dispatch thread, so callbacks run serially in receipt order and a long
 * running callback never stalls the socket reader.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebSocketBrokerConnector implements BrokerConnector {

    private static final int NORMAL_CLOSURE = 1000;
    private static final long SEND_POLL_MILLIS = 10;

    private final OkHttpClient okHttpClient;
    private final BrokerTlsFactory tlsFactory;
    private final AgentProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Map<String, Registration> registrations = new ConcurrentHashMap<>();
    private final ExecutorService dispatchExecutor = Executors.newSingleThreadExecutor(runnable -> {
        Thread thread = new Thread(runnable, "broker-dispatch");
        thread.setDaemon(true);
        return thread;
    });
    private final Object connectionMonitor = new Object();

    private volatile OkHttpClient client;
    private volatile WebSocket webSocket;
    private volatile boolean connected;
    private volatile boolean closed;

    @Override
    public void registerMessageCallback(MessageSchema schema, Consumer<ParsedMessage> callback) {
        registrations.put(schema.getName(), new Registration(schema, callback));
        log.debug("[Broker] Registered callback for '{}'", schema.getName());
    }

    @Override
    public void connect() {
        Request request = buildRequest();
        if (client == null) {
            client = tlsFactory.configure(okHttpClient);
        }

        AgentProperties.ConnectionProperties connection = properties.getConnection();
        int maxAttempts = connection.getMaxConnectAttempts();
        long delay = connection.getReconnectInitialDelay();
        int attempt = 0;
        while (!closed) {
            attempt++;
            if (attemptConnect(request)) {
                return;
            }
            if (maxAttempts > 0 && attempt >= maxAttempts) {
                throw new ConnectionFatalException("could not connect to " + properties.getBrokerWsUri()
                        + " after " + attempt + " attempts");
            }
            log.warn("[Broker] Connection attempt {} failed, retrying in {} ms", attempt, delay);
            if (!sleep(delay)) {
                throw new ConnectionFatalException("interrupted while connecting");
            }
            delay = nextDelay(delay);
        }
        throw new ConnectionFatalException("connector closed");
    }

    @Override
    public void monitorConnection() {
        Request request = buildRequest();
        long delay = properties.getConnection().getReconnectInitialDelay();
        while (!closed) {
            if (connected) {
                delay = properties.getConnection().getReconnectInitialDelay();
                if (!awaitDisconnect()) {
                    return;
                }
                continue;
            }
            log.info("[Broker] Connection lost, reconnecting to {}", properties.getBrokerWsUri());
            if (attemptConnect(request)) {
                log.info("[Broker] Reconnected");
                continue;
            }
            log.warn("[Broker] Reconnect failed, retrying in {} ms", delay);
            if (!sleep(delay)) {
                return;
            }
            delay = nextDelay(delay);
        }
    }

    @Override
    public boolean isConnected() {
        return connected;
    }

    @Override
    public void send(OutboundMessage message, int timeoutSeconds) {
        WebSocket socket = webSocket;
        if (!connected || socket == null) {
            throw new ConnectionException("not connected to the broker");
        }

        String frame;
        try {
            frame = objectMapper.writeValueAsString(toEnvelope(message, timeoutSeconds));
        } catch (JsonProcessingException e) {
            throw new ConnectionException("failed to serialize message: " + e.getOriginalMessage(), e);
        }
        if (!socket.send(frame)) {
            throw new ConnectionException("the connection is closing, message not sent");
        }

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(timeoutSeconds);
        while (socket.queueSize() > 0) {
            if (System.nanoTime() >= deadline) {
                throw new ConnectionException("message not sent within " + timeoutSeconds + " seconds");
            }
            if (!sleep(SEND_POLL_MILLIS)) {
                throw new ConnectionException("interrupted while sending");
            }
        }
        log.debug("[Broker] Sent '{}' to {}", message.messageType(), message.targets());
    }

    @Override
    @PreDestroy
    public void close() {
        closed = true;
        WebSocket socket = webSocket;
        if (socket != null) {
            socket.close(NORMAL_CLOSURE, "agent shutting down");
        }
        connected = false;
        synchronized (connectionMonitor) {
            connectionMonitor.notifyAll();
        }
        dispatchExecutor.shutdown();
    }

    private Request buildRequest() {
        try {
            return new Request.Builder().url(properties.getBrokerWsUri()).build();
        } catch (IllegalArgumentException e) {
            throw new ConnectionConfigException("invalid broker URI " + properties.getBrokerWsUri(), e);
        }
    }

    private boolean attemptConnect(Request request) {
        Listener listener = new Listener();
        WebSocket socket = client.newWebSocket(request, listener);
        long timeout = properties.getConnection().getConnectTimeout() * 2;
        try {
            if (!listener.opened.await(timeout, TimeUnit.MILLISECONDS) && listener.abandon()) {
                log.warn("[Broker] No connection within {} ms", timeout);
                socket.cancel();
                return false;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (listener.abandon()) {
                socket.cancel();
            }
            return false;
        }
        return listener.state.get() == AttemptState.OPEN;
    }

    private boolean awaitDisconnect() {
        synchronized (connectionMonitor) {
            try {
                while (connected && !closed) {
                    connectionMonitor.wait(properties.getConnection().getPingInterval());
                }
                return true;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
    }

    private void markDisconnected(WebSocket socket) {
        if (webSocket == socket) {
            connected = false;
        }
        synchronized (connectionMonitor) {
            connectionMonitor.notifyAll();
        }
    }

    private long nextDelay(long delay) {
        return Math.min(delay * 2, properties.getConnection().getReconnectMaxDelay());
    }

    private boolean sleep(long millis) {
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private ObjectNode toEnvelope(OutboundMessage message, int timeoutSeconds) {
        ObjectNode envelope = objectMapper.createObjectNode();
        envelope.put("id", UUID.randomUUID().toString());
        envelope.put("message_type", message.messageType());
        envelope.put("sender", properties.getIdentity());
        ArrayNode targets = envelope.putArray("targets");
        message.targets().forEach(targets::add);
        envelope.put("expires", Instant.now(clock).plusSeconds(timeoutSeconds).toString());
        if (message.inReplyTo() != null) {
            envelope.put("in_reply_to", message.inReplyTo());
        }
        if (message.data() != null) {
            envelope.set("data", message.data());
            envelope.put("data_type", ContentType.JSON.getWireName());
        }
        ArrayNode debug = envelope.putArray("debug");
        message.debug().forEach(debug::add);
        return envelope;
    }

    void handleFrame(String text) {
        JsonNode frame;
        try {
            frame = objectMapper.readTree(text);
        } catch (JsonProcessingException e) {
            log.warn("[Broker] Dropping frame that is not a JSON envelope: {}", e.getOriginalMessage());
            return;
        }
        if (frame == null || !frame.isObject()) {
            log.warn("[Broker] Dropping frame that is not a JSON envelope");
            return;
        }

        String messageType = frame.path("message_type").asText("");
        Registration registration = registrations.get(messageType);
        if (registration == null) {
            log.warn("[Broker] No callback registered for message type '{}', dropping message {}", messageType,
                    frame.path("id").asText());
            return;
        }

        ParsedMessage message = parse(frame);
        if (message.hasData() && message.dataType() == ContentType.JSON) {
            List<String> violations = registration.schema().validate(message.data());
            if (!violations.isEmpty()) {
                log.warn("[Broker] Dropping message {} of type '{}': {}", message.envelope().id(), messageType,
                        String.join("; ", violations));
                return;
            }
        }

        dispatchExecutor.execute(() -> {
            try {
                registration.callback().accept(message);
            } catch (RuntimeException e) {
                log.error("[Broker] Callback for message {} failed", message.envelope().id(), e);
            }
        });
    }

    private ParsedMessage parse(JsonNode frame) {
        List<String> targets = new ArrayList<>();
        frame.path("targets").forEach(target -> targets.add(target.asText()));
        MessageEnvelope envelope = new MessageEnvelope(
                frame.path("id").asText(null),
                frame.path("message_type").asText(null),
                frame.path("sender").asText(null),
                targets,
                frame.path("expires").asText(null),
                frame.path("in_reply_to").asText(null));

        JsonNode data = frame.get("data");
        boolean hasData = data != null && !data.isNull();
        ContentType dataType = ContentType.fromWireName(frame.path("data_type").asText(null));

        List<JsonNode> debug = new ArrayList<>();
        frame.path("debug").forEach(debug::add);
        return new ParsedMessage(envelope, hasData, dataType, hasData ? data : null, debug);
    }

    private enum AttemptState {
        PENDING, OPEN, FAILED, ABANDONED
    }

    private final class Listener extends WebSocketListener {

        private final CountDownLatch opened = new CountDownLatch(1);
        private final AtomicReference<AttemptState> state = new AtomicReference<>(AttemptState.PENDING);

        /**
         * Gives up on a pending attempt; a later open is cancelled.
         *
         * @return false if the attempt has completed in the meantime
         */
        private boolean abandon() {
            return state.compareAndSet(AttemptState.PENDING, AttemptState.ABANDONED);
        }

        @Override
        public void onOpen(WebSocket socket, Response response) {
            if (!state.compareAndSet(AttemptState.PENDING, AttemptState.OPEN)) {
                log.debug("[Broker] Cancelling connection opened after its attempt timed out");
                socket.cancel();
                return;
            }
            webSocket = socket;
            connected = true;
            opened.countDown();
            log.info("[Broker] Connected to {}", properties.getBrokerWsUri());
        }

        @Override
        public void onMessage(WebSocket socket, String text) {
            handleFrame(text);
        }

        @Override
        public void onClosing(WebSocket socket, int code, String reason) {
            log.info("[Broker] Broker is closing the connection: {} {}", code, reason);
            socket.close(NORMAL_CLOSURE, null);
        }

        @Override
        public void onClosed(WebSocket socket, int code, String reason) {
            state.compareAndSet(AttemptState.PENDING, AttemptState.FAILED);
            markDisconnected(socket);
            opened.countDown();
        }

        @Override
        public void onFailure(WebSocket socket, Throwable t, Response response) {
            log.warn("[Broker] Connection failure: {}", t.getMessage());
            state.compareAndSet(AttemptState.PENDING, AttemptState.FAILED);
            markDisconnected(socket);
            opened.countDown();
        }
    }

    private record Registration(MessageSchema schema, Consumer<ParsedMessage> callback) {
    }
}
