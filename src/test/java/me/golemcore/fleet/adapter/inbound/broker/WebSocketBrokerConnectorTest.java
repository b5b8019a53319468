package me.golemcore.fleet.adapter.inbound.broker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.fleet.domain.exception.ConnectionConfigException;
import me.golemcore.fleet.domain.exception.ConnectionException;
import me.golemcore.fleet.domain.exception.ConnectionFatalException;
import me.golemcore.fleet.domain.model.ContentType;
import me.golemcore.fleet.domain.model.MessageSchema;
import me.golemcore.fleet.domain.model.OutboundMessage;
import me.golemcore.fleet.domain.model.ParsedMessage;
import me.golemcore.fleet.domain.model.TypeConstraint;
import me.golemcore.fleet.infrastructure.config.AgentProperties;
import me.golemcore.fleet.infrastructure.config.AutoConfiguration;
import me.golemcore.fleet.infrastructure.http.BrokerTlsFactory;
import okhttp3.OkHttpClient;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class WebSocketBrokerConnectorTest {

    private static final String IDENTITY = "pcp://node-17.example.com/agent";
    private static final String REQUEST_TYPE = "rpc_request";
    private static final Instant NOW = Instant.parse("2026-10-19T10:00:00Z");

    private final ObjectMapper objectMapper = AutoConfiguration.objectMapper();
    private final BlockingQueue<String> receivedByBroker = new LinkedBlockingQueue<>();
    private final BlockingQueue<WebSocket> brokerSockets = new LinkedBlockingQueue<>();
    private final BlockingQueue<ParsedMessage> delivered = new LinkedBlockingQueue<>();

    private MockWebServer mockServer;
    private AgentProperties properties;
    private WebSocketBrokerConnector connector;

    @BeforeEach
    void setUp() throws IOException {
        mockServer = new MockWebServer();
        mockServer.start();

        properties = new AgentProperties();
        properties.setIdentity(IDENTITY);
        properties.setBrokerWsUri(mockServer.url("/pcp/").toString().replaceFirst("^http", "ws"));
        properties.getConnection().setConnectTimeout(2000);
        properties.getConnection().setReconnectInitialDelay(50);
        properties.getConnection().setReconnectMaxDelay(100);
        properties.getConnection().setMaxConnectAttempts(1);

        connector = new WebSocketBrokerConnector(new OkHttpClient(), new BrokerTlsFactory(properties), properties,
                objectMapper, Clock.fixed(NOW, ZoneOffset.UTC));
        connector.registerMessageCallback(new MessageSchema(REQUEST_TYPE, ContentType.JSON)
                .addConstraint("module", TypeConstraint.STRING, true)
                .addConstraint("action", TypeConstraint.STRING, true), delivered::add);
    }

    @AfterEach
    void tearDown() throws IOException {
        connector.close();
        mockServer.shutdown();
    }

    private void enqueueBroker() {
        mockServer.enqueue(new MockResponse().withWebSocketUpgrade(new WebSocketListener() {
            @Override
            public void onOpen(WebSocket webSocket, Response response) {
                brokerSockets.add(webSocket);
            }

            @Override
            public void onMessage(WebSocket webSocket, String text) {
                receivedByBroker.add(text);
            }
        }));
    }

    private WebSocket connectToBroker() throws InterruptedException {
        enqueueBroker();
        connector.connect();
        WebSocket brokerSide = brokerSockets.poll(5, TimeUnit.SECONDS);
        assertNotNull(brokerSide);
        return brokerSide;
    }

    private static String request(String id, String data) {
        return """
                {"id": "%s", "message_type": "rpc_request", "sender": "pcp://controller/client",
                 "targets": ["pcp://node-17.example.com/agent"], "expires": "2026-10-19T10:01:00Z",
                 "data": %s, "data_type": "json", "debug": [{"hops": []}]}
                """.formatted(id, data);
    }

    @Test
    void shouldSendEnvelopeWithAgentIdentity() throws Exception {
        connectToBroker();
        assertTrue(connector.isConnected());

        JsonNode data = objectMapper.readTree("{\"outcome\": \"hello\"}");
        JsonNode debug = objectMapper.readTree("{\"debug_data\": {\"hops\": []}}");
        connector.send(new OutboundMessage(List.of("pcp://controller/client"), "rpc_response", "req-1", data,
                List.of(debug)), 5);

        String frame = receivedByBroker.poll(5, TimeUnit.SECONDS);
        assertNotNull(frame);
        JsonNode envelope = objectMapper.readTree(frame);
        assertFalse(envelope.get("id").asText().isEmpty());
        assertEquals("rpc_response", envelope.get("message_type").asText());
        assertEquals(IDENTITY, envelope.get("sender").asText());
        assertEquals("pcp://controller/client", envelope.get("targets").get(0).asText());
        assertEquals("req-1", envelope.get("in_reply_to").asText());
        assertEquals("2026-10-19T10:00:05Z", envelope.get("expires").asText());
        assertEquals("json", envelope.get("data_type").asText());
        assertEquals("hello", envelope.get("data").get("outcome").asText());
        assertEquals(1, envelope.get("debug").size());
    }

    @Test
    void shouldDeliverRegisteredMessageToCallback() throws Exception {
        WebSocket brokerSide = connectToBroker();

        brokerSide.send(request("req-7", "{\"module\": \"echo\", \"action\": \"echo\", \"params\": {}}"));

        ParsedMessage message = delivered.poll(5, TimeUnit.SECONDS);
        assertNotNull(message);
        assertEquals("req-7", message.envelope().id());
        assertEquals("pcp://controller/client", message.envelope().sender());
        assertEquals(ContentType.JSON, message.dataType());
        assertEquals("echo", message.data().get("module").asText());
        assertEquals(1, message.debug().size());
    }

    @Test
    void shouldDropFramesThatCannotBeDelivered() throws Exception {
        WebSocket brokerSide = connectToBroker();

        brokerSide.send("this is not json");
        brokerSide.send(request("req-1", "{\"module\": 42, \"action\": \"echo\"}"));
        brokerSide.send(request("req-2", "{\"module\": \"echo\", \"action\": \"echo\"}")
                .replace("rpc_request", "inventory_request"));
        brokerSide.send(request("req-3", "{\"module\": \"echo\", \"action\": \"echo\"}"));

        ParsedMessage message = delivered.poll(5, TimeUnit.SECONDS);
        assertNotNull(message);
        assertEquals("req-3", message.envelope().id());
        assertNull(delivered.poll(200, TimeUnit.MILLISECONDS));
    }

    @Test
    void shouldPassMessagesWithoutDataToCallback() throws Exception {
        WebSocket brokerSide = connectToBroker();

        brokerSide.send("{\"id\": \"req-9\", \"message_type\": \"rpc_request\", \"sender\": \"pcp://c/x\"}");

        ParsedMessage message = delivered.poll(5, TimeUnit.SECONDS);
        assertNotNull(message);
        assertFalse(message.hasData());
    }

    @Test
    void shouldRefuseToSendWhenNotConnected() {
        OutboundMessage message = new OutboundMessage(List.of("pcp://controller/client"), "rpc_response", "req-1",
                objectMapper.createObjectNode(), List.of());

        ConnectionException error = assertThrows(ConnectionException.class, () -> connector.send(message, 1));
        assertEquals("not connected to the broker", error.getMessage());
    }

    @Test
    void shouldGiveUpAfterMaxConnectAttempts() {
        mockServer.enqueue(new MockResponse().setResponseCode(500));

        ConnectionFatalException error = assertThrows(ConnectionFatalException.class, connector::connect);
        assertTrue(error.getMessage().contains("after 1 attempts"));
        assertFalse(connector.isConnected());
    }

    @Test
    void shouldRetryUntilBrokerAccepts() throws Exception {
        properties.getConnection().setMaxConnectAttempts(3);
        mockServer.enqueue(new MockResponse().setResponseCode(503));
        enqueueBroker();

        connector.connect();

        assertTrue(connector.isConnected());
        assertEquals(2, mockServer.getRequestCount());
    }

    @Test
    void shouldCancelAttemptThatTimedOut() throws Exception {
        properties.getConnection().setConnectTimeout(100);
        mockServer.enqueue(new MockResponse()
                .setHeadersDelay(1, TimeUnit.SECONDS)
                .withWebSocketUpgrade(new WebSocketListener() {
                }));

        assertThrows(ConnectionFatalException.class, connector::connect);

        Thread.sleep(1500);
        assertFalse(connector.isConnected());
    }

    @Test
    void shouldRejectInvalidBrokerUri() {
        properties.setBrokerWsUri("not a broker uri");

        assertThrows(ConnectionConfigException.class, connector::connect);
    }

    @Test
    void shouldReconnectAfterBrokerClosesConnection() throws Exception {
        WebSocket brokerSide = connectToBroker();
        Thread monitor = new Thread(connector::monitorConnection, "monitor");
        monitor.start();

        enqueueBroker();
        brokerSide.close(1001, "going away");

        assertNotNull(brokerSockets.poll(5, TimeUnit.SECONDS));
        long deadline = System.currentTimeMillis() + 5000;
        while (!connector.isConnected() && System.currentTimeMillis() < deadline) {
            Thread.sleep(20);
        }
        assertTrue(connector.isConnected());

        connector.close();
        monitor.join(5000);
        assertFalse(monitor.isAlive());
    }

    @Test
    void shouldReleaseMonitorOnClose() throws Exception {
        connectToBroker();
        Thread monitor = new Thread(connector::monitorConnection, "monitor");
        monitor.start();

        connector.close();

        monitor.join(5000);
        assertFalse(monitor.isAlive());
        assertFalse(connector.isConnected());
    }
}
