package me.golemcore.teams.adapter.outbound.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import feign.FeignException;
import feign.Request;
import feign.Response;
import me.golemcore.teams.domain.exception.LlmBackendException;
import me.golemcore.teams.domain.model.LlmMessage;
import me.golemcore.teams.domain.model.LlmRequest;
import me.golemcore.teams.domain.model.LlmResponse;
import me.golemcore.teams.domain.model.LlmToolCall;
import me.golemcore.teams.domain.model.ToolDefinition;
import me.golemcore.teams.infrastructure.config.TeamsProperties;
import me.golemcore.teams.infrastructure.http.FeignClientFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class OpenAiCompatibleLlmAdapterTest {

    private TeamsProperties properties;
    private FeignClientFactory feignClientFactory;
    private OpenAiCompatibleLlmAdapter.ChatCompletionApi api;
    private OpenAiCompatibleLlmAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new TeamsProperties();
        properties.getLlm().setBaseUrl("https://api.groq.com/openai/v1/");
        properties.getLlm().setApiKey("gsk-test");
        properties.getLlm().setModel("llama3-8b-8192");
        feignClientFactory = mock(FeignClientFactory.class);
        api = mock(OpenAiCompatibleLlmAdapter.ChatCompletionApi.class);
        when(feignClientFactory.create(eq(OpenAiCompatibleLlmAdapter.ChatCompletionApi.class), anyString()))
                .thenReturn(api);
        adapter = new OpenAiCompatibleLlmAdapter(properties, feignClientFactory, new ObjectMapper());
    }

    @Test
    void shouldSendBearerTokenAndConvertReply() throws Exception {
        when(api.chatCompletion(anyString(), any())).thenReturn(response("Here is the plan.", null, "stop"));

        LlmResponse reply = adapter.chat(LlmRequest.builder()
                .messages(List.of(LlmMessage.user("Plan the work")))
                .build()).get();

        assertEquals("Here is the plan.", reply.getContent());
        assertEquals("stop", reply.getFinishReason());
        verify(api).chatCompletion(eq("Bearer gsk-test"), any());
        verify(feignClientFactory).create(OpenAiCompatibleLlmAdapter.ChatCompletionApi.class,
                "https://api.groq.com/openai/v1");
    }

    @Test
    void shouldBuildRequestWithSystemPromptToolsAndSanitizedNames() {
        ToolDefinition tool = ToolDefinition.builder()
                .name("write_file")
                .description("Write a file")
                .inputSchema(Map.of("type", "object"))
                .build();
        LlmToolCall priorCall = LlmToolCall.builder()
                .id("call-1").name("write_file").arguments(Map.of("path", "a.txt")).build();
        List<LlmMessage> messages = new ArrayList<>();
        messages.add(LlmMessage.user("Technical Expert", "Please write it"));
        messages.add(LlmMessage.builder().role(LlmMessage.ASSISTANT).toolCalls(List.of(priorCall)).build());
        messages.add(LlmMessage.builder().role(LlmMessage.TOOL).toolCallId("call-1").content("ok").build());

        OpenAiCompatibleLlmAdapter.ChatCompletionRequest request = adapter.buildRequest(LlmRequest.builder()
                .systemPrompt("You are the Developer.")
                .messages(messages)
                .tools(List.of(tool))
                .build());

        assertEquals("llama3-8b-8192", request.getModel());
        assertEquals(4, request.getMessages().size());
        assertEquals("system", request.getMessages().get(0).getRole());
        assertEquals("Technical_Expert", request.getMessages().get(1).getName());
        assertEquals("{\"path\":\"a.txt\"}",
                request.getMessages().get(2).getToolCalls().get(0).getFunction().getArguments());
        assertEquals("call-1", request.getMessages().get(3).getToolCallId());
        assertEquals("function", request.getTools().get(0).getType());
        assertEquals("write_file", request.getTools().get(0).getFunction().getName());
    }

    @Test
    void shouldFlagUnparseableToolArguments() {
        OpenAiCompatibleLlmAdapter.ApiFunction function = new OpenAiCompatibleLlmAdapter.ApiFunction();
        function.setName("write_file");
        function.setArguments("{\"path\": ");
        OpenAiCompatibleLlmAdapter.ApiToolCall call = new OpenAiCompatibleLlmAdapter.ApiToolCall();
        call.setId("call-9");
        call.setFunction(function);

        LlmResponse reply = adapter.convertResponse(response(null, List.of(call), "tool_calls"));

        assertTrue(reply.hasToolCalls());
        LlmToolCall toolCall = reply.getToolCalls().get(0);
        assertEquals("write_file", toolCall.getName());
        assertFalse(toolCall.isArgumentsParsed());
        assertEquals("{\"path\": ", toolCall.getRawArguments());
    }

    @Test
    void shouldReturnErrorFinishForEmptyChoices() {
        LlmResponse reply = adapter.convertResponse(new OpenAiCompatibleLlmAdapter.ChatCompletionResponse());

        assertEquals("error", reply.getFinishReason());
        assertFalse(reply.hasContent());
    }

    @Test
    void shouldTranslateRateLimitAsRetryable() {
        LlmBackendException e = OpenAiCompatibleLlmAdapter.translate(httpError(429, "slow down"));

        assertTrue(e.isRetryable());
        assertTrue(e.getMessage().contains("429"));
        assertTrue(e.getMessage().contains("slow down"));
    }

    @Test
    void shouldTranslateServerErrorAsRetryable() {
        assertTrue(OpenAiCompatibleLlmAdapter.translate(httpError(503, "overloaded")).isRetryable());
    }

    @Test
    void shouldTranslateClientErrorAsFatal() {
        assertFalse(OpenAiCompatibleLlmAdapter.translate(httpError(401, "invalid api key")).isRetryable());
    }

    @Test
    void shouldSurfaceFeignFailureAsBackendException() {
        when(api.chatCompletion(anyString(), any())).thenThrow(httpError(500, "boom"));

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> adapter.chat(LlmRequest.builder().build()).get());

        LlmBackendException cause = assertInstanceOf(LlmBackendException.class, e.getCause());
        assertTrue(cause.isRetryable());
    }

    @Test
    void shouldFailWithoutBaseUrl() {
        properties.getLlm().setBaseUrl("");

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> adapter.chat(LlmRequest.builder().build()).get());

        LlmBackendException cause = assertInstanceOf(LlmBackendException.class, e.getCause());
        assertFalse(cause.isRetryable());
        assertFalse(adapter.isAvailable());
    }

    private static OpenAiCompatibleLlmAdapter.ChatCompletionResponse response(String content,
            List<OpenAiCompatibleLlmAdapter.ApiToolCall> toolCalls, String finishReason) {
        OpenAiCompatibleLlmAdapter.ApiMessage message = new OpenAiCompatibleLlmAdapter.ApiMessage();
        message.setRole("assistant");
        message.setContent(content);
        message.setToolCalls(toolCalls);
        OpenAiCompatibleLlmAdapter.ChatChoice choice = new OpenAiCompatibleLlmAdapter.ChatChoice();
        choice.setMessage(message);
        choice.setFinishReason(finishReason);
        OpenAiCompatibleLlmAdapter.ChatCompletionResponse response = new OpenAiCompatibleLlmAdapter.ChatCompletionResponse();
        response.setModel("llama3-8b-8192");
        response.setChoices(List.of(choice));
        return response;
    }

    private static FeignException httpError(int status, String body) {
        Request request = Request.create(Request.HttpMethod.POST, "https://api.groq.com/openai/v1/chat/completions",
                Map.of(), null, StandardCharsets.UTF_8, null);
        Response response = Response.builder()
                .status(status)
                .reason("error")
                .request(request)
                .headers(Map.of())
                .body(body, StandardCharsets.UTF_8)
                .build();
        return FeignException.errorStatus("ChatCompletionApi#chatCompletion", response);
    }
}
