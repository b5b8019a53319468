package me.golemcore.fleet.port.inbound;

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

import me.golemcore.fleet.domain.exception.ConnectionConfigException;
import me.golemcore.fleet.domain.exception.ConnectionException;
import me.golemcore.fleet.domain.exception.ConnectionFatalException;
import me.golemcore.fleet.domain.model.MessageSchema;
import me.golemcore.fleet.domain.model.OutboundMessage;
import me.golemcore.fleet.domain.model.ParsedMessage;

import java.util.function.Consumer;

/**
 * Bidirectional port to the message broker. Implementations own the
 * authenticated link, reconnect it when it drops, validate inbound payloads
 * against registered schemas and deliver them serially, in receipt order, to
 * the matching callback.
 */
public interface BrokerConnector {

    /**
     * Registers the callback invoked for inbound messages whose type equals the
     * schema name. Payloads violating the schema are dropped by the connector.
     */
    void registerMessageCallback(MessageSchema schema, Consumer<ParsedMessage> callback);

    /**
     * Establishes the connection.
     *
     * @throws ConnectionConfigException
     *             if the connection cannot be configured
     * @throws ConnectionFatalException
     *             if no connection could be established
     */
    void connect();

    /**
     * Blocks the calling thread while the connector keeps the connection alive,
     * reconnecting whenever it drops. Returns only after {@link #close()}.
     *
     * @throws ConnectionFatalException
     *             if the connector gives up reconnecting
     */
    void monitorConnection();

    /**
     * Checks if the connection is currently open.
     */
    boolean isConnected();

    /**
     * Sends a message and waits until it is handed to the network.
     *
     * @throws ConnectionException
     *             if the message could not be sent within the timeout
     */
    void send(OutboundMessage message, int timeoutSeconds);

    /**
     * Closes the connection and releases {@link #monitorConnection()}.
     */
    void close();
}
