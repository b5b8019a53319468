package me.golemcore.fleet.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import me.golemcore.fleet.domain.model.ActionDefinition;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ExternalModuleRunnerTest {

    private static final Map<String, Object> CONFIGURATION_SCHEMA = Map.of(
            "type", "object",
            "properties", Map.of("greeting", Map.of("type", "string")));

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();

    private static final class GreetAction implements ModuleAction {

        private final ObjectMapper objectMapper = new ObjectMapper();
        private final List<ActionInvocation> invocations = new ArrayList<>();

        @Override
        public String name() {
            return "greet";
        }

        @Override
        public ActionDefinition definition() {
            return ActionDefinition.builder()
                    .name("greet")
                    .description("Greets")
                    .input(Map.of(
                            "type", "object",
                            "required", List.of("who"),
                            "properties", Map.of("who", Map.of("type", "string"))))
                    .results(Map.of("type", "object"))
                    .build();
        }

        @Override
        public JsonNode invalidInput(String message) {
            ObjectNode result = objectMapper.createObjectNode();
            result.put("message", "");
            result.put("error_type", "invalid_json");
            result.put("error", message);
            return result;
        }

        @Override
        public Optional<JsonNode> checkPreconditions(ActionInvocation invocation) {
            if (!"closed".equals(invocation.getConfiguration().path("greeting").asText())) {
                return Optional.empty();
            }
            ObjectNode result = objectMapper.createObjectNode();
            result.put("message", "");
            result.put("error_type", "closed");
            result.put("error", "greetings are closed");
            return Optional.of(result);
        }

        @Override
        public JsonNode perform(ActionInvocation invocation) {
            invocations.add(invocation);
            String who = invocation.getInput().get("who").asText();
            if ("crash".equals(who)) {
                throw new IllegalStateException("unexpected fault");
            }
            ObjectNode result = objectMapper.createObjectNode();
            if ("nobody".equals(who)) {
                result.put("error", "nobody to greet");
                return result;
            }
            String greeting = invocation.getConfiguration().path("greeting").asText("hello");
            result.put("message", greeting + " " + who);
            if ("big".equals(who)) {
                result.put("payload", "x".repeat(4 * 1024 * 1024));
            }
            return result;
        }
    }

    private final GreetAction action = new GreetAction();

    private ExternalModuleRunner runner(String stdin) {
        return new ExternalModuleRunner("Greets people", CONFIGURATION_SCHEMA, List.of(action), objectMapper,
                new ByteArrayInputStream(stdin.getBytes(StandardCharsets.UTF_8)),
                new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private JsonNode printed() throws Exception {
        return objectMapper.readTree(out.toString(StandardCharsets.UTF_8));
    }

    private String invocation(String input, OutputFiles files) throws Exception {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("action", "greet");
        node.set("input", objectMapper.readTree(input));
        node.set("configuration", objectMapper.createObjectNode());
        if (files != null) {
            node.set("output_files", objectMapper.valueToTree(files));
        }
        return objectMapper.writeValueAsString(node);
    }

    @Test
    void shouldPrintMetadataListingAcceptedActions() throws Exception {
        int exitCode = runner("").run("metadata");

        assertEquals(0, exitCode);
        JsonNode metadata = printed();
        assertEquals("Greets people", metadata.get("description").asText());
        assertEquals("string", metadata.get("configuration").get("properties").get("greeting").get("type").asText());
        assertEquals(1, metadata.get("actions").size());
        String listed = metadata.get("actions").get(0).get("name").asText();
        assertEquals("greet", listed);
        assertEquals(0, runner(invocation("{\"who\":\"a\"}", null)).run(listed));
    }

    @Test
    void shouldTreatMissingActionAsMetadata() throws Exception {
        assertEquals(0, runner("").run(null));
        assertTrue(printed().has("actions"));
    }

    @Test
    void shouldPrintResultOnStdout() throws Exception {
        int exitCode = runner("{\"input\":{\"who\":\"world\"},\"configuration\":{\"greeting\":\"hi\"}}").run("greet");

        assertEquals(0, exitCode);
        assertEquals("hi world", printed().get("message").asText());
    }

    @Test
    void shouldExitOneWhenResultCarriesError() throws Exception {
        int exitCode = runner(invocation("{\"who\":\"nobody\"}", null)).run("greet");

        assertEquals(1, exitCode);
        assertEquals("nobody to greet", printed().get("error").asText());
    }

    @Test
    void shouldReportUnknownActionAsInvalidJson() throws Exception {
        int exitCode = runner("{\"input\":{}}").run("wave");

        assertEquals(1, exitCode);
        JsonNode result = printed();
        assertEquals("invalid_json", result.get("error_type").asText());
        assertFalse(result.has("message"));
        assertTrue(action.invocations.isEmpty());
    }

    @Test
    void shouldReportUnparseableInputInActionResultShape() throws Exception {
        int exitCode = runner("{not json").run("greet");

        assertEquals(1, exitCode);
        JsonNode result = printed();
        assertEquals("invalid_json", result.get("error_type").asText());
        assertTrue(result.has("message"));
    }

    @Test
    void shouldReportEmptyInputInActionResultShape() throws Exception {
        assertEquals(1, runner("").run("greet"));
        JsonNode result = printed();
        assertEquals("invalid_json", result.get("error_type").asText());
        assertTrue(result.has("message"));
    }

    @Test
    void shouldRejectInvocationMeantForAnotherAction() throws Exception {
        int exitCode = runner("{\"action\":\"wave\",\"input\":{\"who\":\"a\"}}").run("greet");

        assertEquals(1, exitCode);
        JsonNode result = printed();
        assertTrue(result.get("error").asText().contains("'wave'"));
        assertTrue(result.has("message"));
        assertTrue(action.invocations.isEmpty());
    }

    @Test
    void shouldCheckPreconditionsBeforeInputSchema() throws Exception {
        int exitCode = runner("{\"input\":{},\"configuration\":{\"greeting\":\"closed\"}}").run("greet");

        assertEquals(1, exitCode);
        assertEquals("closed", printed().get("error_type").asText());
        assertTrue(action.invocations.isEmpty());
    }

    @Test
    void shouldValidateInputAndConfiguration() throws Exception {
        assertEquals(1, runner("{\"input\":{\"who\":5}}").run("greet"));
        assertTrue(printed().get("error").asText().startsWith("invalid input"));
        assertTrue(printed().has("message"));

        out.reset();
        assertEquals(1, runner("{\"input\":{\"who\":\"a\"},\"configuration\":{\"greeting\":[]}}").run("greet"));
        assertTrue(printed().get("error").asText().startsWith("invalid configuration"));
        assertTrue(action.invocations.isEmpty());
    }

    @Test
    void shouldWriteResultAndExitCodeToOutputFiles() throws Exception {
        OutputFiles files = OutputFiles.in(tempDir);
        PrintStream originalOut = System.out;

        int exitCode = runner(invocation("{\"who\":\"world\"}", files)).run("greet");

        assertEquals(0, exitCode);
        assertSame(originalOut, System.out);
        assertEquals(0, out.size());
        assertEquals("hello world",
                objectMapper.readTree(files.stdoutPath().toFile()).get("message").asText());
        assertEquals("0", Files.readString(files.exitcodePath()).trim());
        assertTrue(Files.exists(files.stderrPath()));
    }

    @Test
    void shouldRecordFailureExitCodeInOutputFiles() throws Exception {
        OutputFiles files = OutputFiles.in(tempDir);

        int exitCode = runner(invocation("{\"who\":\"nobody\"}", files)).run("greet");

        assertEquals(1, exitCode);
        assertEquals("1", Files.readString(files.exitcodePath()).trim());
    }

    @Test
    void shouldWriteExitCodeOnlyAfterCompleteOutput() throws Exception {
        OutputFiles files = OutputFiles.in(tempDir);

        runner(invocation("{\"who\":\"big\"}", files)).run("greet");

        assertTrue(Files.exists(files.exitcodePath()));
        JsonNode result = objectMapper.readTree(files.stdoutPath().toFile());
        assertEquals(4 * 1024 * 1024, result.get("payload").asText().length());
    }

    @Test
    void shouldRecordExitCodeWhenActionCrashes() throws Exception {
        OutputFiles files = OutputFiles.in(tempDir);
        PrintStream originalErr = System.err;

        assertThrows(IllegalStateException.class,
                () -> runner(invocation("{\"who\":\"crash\"}", files)).run("greet"));

        assertSame(originalErr, System.err);
        assertEquals("1", Files.readString(files.exitcodePath()).trim());
    }

    @Test
    void shouldExitFiveWhenOutputFilesCannotBeOpened() throws Exception {
        OutputFiles files = OutputFiles.in(tempDir.resolve("missing-dir"));

        int exitCode = runner(invocation("{\"who\":\"world\"}", files)).run("greet");

        assertEquals(ExternalModuleRunner.EXIT_CANNOT_REDIRECT, exitCode);
        assertFalse(Files.exists(files.exitcodePath()));
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("Failed to open the output files"));
        assertTrue(action.invocations.isEmpty());
    }

    @Test
    void shouldReportIncompleteOutputFilesOnStdout() throws Exception {
        ObjectNode invocation = (ObjectNode) objectMapper.readTree(invocation("{\"who\":\"world\"}", null));
        invocation.putObject("output_files").put("stdout", tempDir.resolve("stdout").toString());

        int exitCode = runner(objectMapper.writeValueAsString(invocation)).run("greet");

        assertEquals(1, exitCode);
        JsonNode result = printed();
        assertEquals("invalid_json", result.get("error_type").asText());
        assertTrue(result.get("error").asText().contains("output_files"));
        assertFalse(Files.exists(tempDir.resolve("stdout")));
        assertTrue(action.invocations.isEmpty());
    }
}
