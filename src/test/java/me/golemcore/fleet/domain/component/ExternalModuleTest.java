package me.golemcore.fleet.domain.component;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.fleet.domain.exception.RequestProcessingException;
import me.golemcore.fleet.domain.exception.RequestValidationException;
import me.golemcore.fleet.domain.model.ActionRequest;
import me.golemcore.fleet.domain.model.ModuleMetadata;
import me.golemcore.fleet.domain.service.ActionSpool;
import me.golemcore.fleet.infrastructure.config.AgentProperties;
import me.golemcore.fleet.testsupport.Executables;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisabledOnOs(OS.WINDOWS)
class ExternalModuleTest {

    private static final String METADATA = """
            {"description":"greets","actions":[{"name":"greet",\
            "input":{"type":"object","required":["who"],"properties":{"who":{"type":"string"}}},\
            "results":{"type":"object","required":["greeting"],"properties":{"greeting":{"type":"string"}}}}]}""";

    private static final String WRITE_GREETING = """
            echo '{"greeting":"hello"}' > stdout
            echo 0 > exitcode
            """;

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ActionSpool spool;
    private ModuleMetadata metadata;

    @BeforeEach
    void setUp() throws Exception {
        AgentProperties properties = new AgentProperties();
        properties.setSpoolDir(tempDir.resolve("spool").toString());
        spool = new ActionSpool(properties);
        metadata = objectMapper.readValue(METADATA, ModuleMetadata.class);
        metadata.setName("greeter");
        Files.createDirectories(tempDir.resolve("bin"));
    }

    private ExternalModule module(String actionBody, JsonNode configuration) throws Exception {
        Path executable = Executables.module(tempDir.resolve("bin"), "greeter", METADATA, actionBody);
        return new ExternalModule("greeter", executable, metadata, configuration, spool, objectMapper);
    }

    private ActionRequest request(String id, String action, String params) throws Exception {
        return new ActionRequest(id, "pcp://controller/1", "greeter", action, objectMapper.readTree(params),
                List.of());
    }

    @Test
    void shouldReturnResultFromStdoutFile() throws Exception {
        ExternalModule module = module(WRITE_GREETING, null);

        JsonNode result = module.performRequest(request("tx-1", "greet", "{\"who\":\"world\"}"));

        assertEquals("hello", result.get("greeting").asText());
    }

    @Test
    void shouldPassInvocationWithConfigurationAndOutputFiles() throws Exception {
        ExternalModule module = module(WRITE_GREETING, objectMapper.readTree("{\"greeting_word\":\"hi\"}"));

        module.performRequest(request("tx-2", "greet", "{\"who\":\"world\"}"));

        Path spoolDir = spool.getSpoolRoot().resolve("tx-2");
        JsonNode invocation = objectMapper.readTree(spoolDir.resolve("invocation.json").toFile());
        assertEquals("greet", invocation.get("action").asText());
        assertEquals("world", invocation.get("input").get("who").asText());
        assertEquals("hi", invocation.get("configuration").get("greeting_word").asText());
        assertEquals(spoolDir.resolve("exitcode").toString(),
                invocation.get("output_files").get("exitcode").asText());
    }

    @Test
    void shouldRejectInvalidInputWithoutLaunching() throws Exception {
        ExternalModule module = module(WRITE_GREETING, null);

        RequestValidationException e = assertThrows(RequestValidationException.class,
                () -> module.performRequest(request("tx-3", "greet", "{}")));

        assertTrue(e.getMessage().contains("missing required property 'who'"));
        assertFalse(Files.exists(spool.getSpoolRoot().resolve("tx-3")));
    }

    @Test
    void shouldRejectUnknownAction() throws Exception {
        ExternalModule module = module(WRITE_GREETING, null);

        RequestValidationException e = assertThrows(RequestValidationException.class,
                () -> module.performRequest(request("tx-4", "wave", "{}")));

        assertEquals("unknown action 'wave' for module 'greeter'", e.getMessage());
    }

    @Test
    void shouldFailWhenModuleTerminatesWithoutExitCode() throws Exception {
        ExternalModule module = module("exit 3\n", null);

        RequestProcessingException e = assertThrows(RequestProcessingException.class,
                () -> module.performRequest(request("tx-5", "greet", "{\"who\":\"x\"}")));

        assertTrue(e.getMessage().contains("terminated unexpectedly (exit code 3)"), e.getMessage());
    }

    @Test
    void shouldFailOnOutputThatIsNotJson() throws Exception {
        ExternalModule module = module("echo 'not json' > stdout\necho 0 > exitcode\n", null);

        RequestProcessingException e = assertThrows(RequestProcessingException.class,
                () -> module.performRequest(request("tx-6", "greet", "{\"who\":\"x\"}")));

        assertTrue(e.getMessage().contains("not valid JSON"), e.getMessage());
    }

    @Test
    void shouldFailOnEmptyOutput() throws Exception {
        ExternalModule module = module("echo 1 > exitcode\n", null);

        RequestProcessingException e = assertThrows(RequestProcessingException.class,
                () -> module.performRequest(request("tx-7", "greet", "{\"who\":\"x\"}")));

        assertTrue(e.getMessage().contains("produced no output"), e.getMessage());
    }

    @Test
    void shouldFailOnResultViolatingResultsSchema() throws Exception {
        ExternalModule module = module("echo '{\"greeting\":42}' > stdout\necho 0 > exitcode\n", null);

        RequestProcessingException e = assertThrows(RequestProcessingException.class,
                () -> module.performRequest(request("tx-8", "greet", "{\"who\":\"x\"}")));

        assertTrue(e.getMessage().contains("results are invalid"), e.getMessage());
    }

    @Test
    void shouldKeepOutputWrittenBeforeRedirectionInLaunchLog() throws Exception {
        ExternalModule module = module("echo 'starting up'\n" + WRITE_GREETING, null);

        module.performRequest(request("tx-9", "greet", "{\"who\":\"x\"}"));

        String launchLog = Files.readString(spool.getSpoolRoot().resolve("tx-9").resolve(ExternalModule.LAUNCH_LOG));
        assertTrue(launchLog.contains("starting up"));
    }
}
