package me.golemcore.teams.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.teams.domain.exception.ToolValidationException;
import me.golemcore.teams.domain.model.ToolCall;
import me.golemcore.teams.domain.model.ToolFailureKind;
import me.golemcore.teams.domain.model.ToolOutput;
import me.golemcore.teams.domain.model.ToolResult;
import me.golemcore.teams.domain.model.ToolStatus;
import me.golemcore.teams.infrastructure.config.TeamsProperties;
import me.golemcore.teams.testsupport.ScriptedTool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolGatewayTest {

    private static final Map<String, Object> HELLO_ARGS = Map.of("file_path", "hello.txt", "content", "hi");

    private TeamsProperties properties;
    private ScriptedTool writeFile;
    private ToolGateway gateway;

    @BeforeEach
    void setUp() {
        properties = new TeamsProperties();
        properties.getGateway().setTimeoutMs(100);
        properties.getGateway().setMaxRetries(2);
        properties.getGateway().setRetryBackoffMs(0);
        writeFile = ScriptedTool.writeFile();
        gateway = new ToolGateway(new ToolRegistry(List.of(writeFile)), properties, new ObjectMapper());
    }

    @Test
    void shouldReturnOkResultFromProvider() {
        writeFile.thenReturn(ToolOutput.success("File written successfully: hello.txt"));

        ToolResult result = gateway.invoke(call("write_file", HELLO_ARGS));

        assertEquals(ToolStatus.OK, result.status());
        assertEquals("File written successfully: hello.txt", result.payload());
        assertEquals("c1", result.callId());
        assertEquals(1, result.attempts());
        assertEquals(List.of(HELLO_ARGS), writeFile.getInvocations());
    }

    @Test
    void shouldRetryTimeoutsAndSucceedOnThirdAttempt() {
        writeFile.thenHang().thenHang().thenReturn(ToolOutput.success("written"));

        ToolResult result = gateway.invoke(call("write_file", HELLO_ARGS));

        assertEquals(ToolStatus.OK, result.status());
        assertEquals(3, result.attempts());
        assertEquals(3, writeFile.invocationCount());
    }

    @Test
    void shouldGiveUpAfterRetryBudget() {
        writeFile.thenFail(new IOException("connection reset"))
                .thenFail(new IOException("connection reset"))
                .thenFail(new IOException("connection reset"));

        ToolResult result = gateway.invoke(call("write_file", HELLO_ARGS));

        assertEquals(ToolStatus.ERROR, result.status());
        assertEquals(ToolFailureKind.TRANSIENT, result.errorKind());
        assertEquals("connection reset", result.errorDetail());
        assertEquals(3, result.attempts());
    }

    @Test
    void shouldNotRetryProviderErrors() {
        writeFile.thenReturn(ToolOutput.failure("disk full"));

        ToolResult result = gateway.invoke(call("write_file", HELLO_ARGS));

        assertEquals(ToolFailureKind.PROVIDER_ERROR, result.errorKind());
        assertEquals("disk full", result.errorDetail());
        assertEquals(1, writeFile.invocationCount());
    }

    @Test
    void shouldRejectInvalidArgumentsWithoutCallingProvider() {
        ToolResult result = gateway.invoke(call("write_file", Map.of("file_path", "hello.txt")));

        assertEquals(ToolFailureKind.VALIDATION, result.errorKind());
        assertEquals(0, result.attempts());
        assertEquals(0, writeFile.invocationCount());
    }

    @Test
    void shouldMapProviderValidationExceptionWithoutRetry() {
        writeFile.thenThrow(new ToolValidationException("Path traversal blocked"));

        ToolResult result = gateway.invoke(call("write_file", HELLO_ARGS));

        assertEquals(ToolFailureKind.VALIDATION, result.errorKind());
        assertEquals(1, result.attempts());
    }

    @Test
    void shouldReportUnknownTool() {
        ToolResult result = gateway.invoke(call("github_search", Map.of("query", "x")));

        assertEquals(ToolFailureKind.UNKNOWN_TOOL, result.errorKind());
        assertTrue(result.errorDetail().contains("github_search"));
        assertEquals(0, result.attempts());
    }

    @Test
    void shouldReturnCancelledWhenThreadIsInterrupted() {
        Thread.currentThread().interrupt();
        try {
            ToolResult result = gateway.invoke(call("write_file", HELLO_ARGS));

            assertEquals(ToolFailureKind.CANCELLED, result.errorKind());
            assertEquals(0, writeFile.invocationCount());
        } finally {
            assertTrue(Thread.interrupted());
        }
    }

    @Test
    void shouldSerializeStructuredDataWhenOutputIsMissing() {
        writeFile.thenReturn(ToolOutput.builder().success(true).data(Map.of("bytes", 2)).build());

        ToolResult result = gateway.invoke(call("write_file", HELLO_ARGS));

        assertEquals("{\"bytes\":2}", result.payload());
    }

    @Test
    void shouldTruncateOversizedPayload() {
        properties.getGateway().setMaxResultChars(100);
        writeFile.thenReturn(ToolOutput.success("x".repeat(500)));

        ToolResult result = gateway.invoke(call("write_file", HELLO_ARGS));

        assertEquals(100, result.payload().length());
        assertTrue(result.payload().contains("[OUTPUT TRUNCATED: 500 chars total"));
    }

    @Test
    void shouldClassifyExceptions() {
        assertEquals(ToolFailureKind.TRANSIENT, ToolGateway.classify(new IOException("x")));
        assertEquals(ToolFailureKind.VALIDATION, ToolGateway.classify(new ToolValidationException("x")));
        assertEquals(ToolFailureKind.PROVIDER_ERROR, ToolGateway.classify(new IllegalStateException("x")));
    }

    private static ToolCall call(String toolName, Map<String, Object> arguments) {
        return ToolCall.builder()
                .taskId("t-1").seq(3).timestamp(Instant.now())
                .callId("c1")
                .requesterAgent("Alice")
                .toolName(toolName)
                .arguments(arguments)
                .turn(1)
                .build();
    }
}
