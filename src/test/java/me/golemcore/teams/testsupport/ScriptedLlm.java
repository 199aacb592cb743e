package me.golemcore.teams.testsupport;

import me.golemcore.teams.domain.exception.LlmBackendException;
import me.golemcore.teams.domain.model.LlmRequest;
import me.golemcore.teams.domain.model.LlmResponse;
import me.golemcore.teams.domain.model.LlmToolCall;
import me.golemcore.teams.port.outbound.LlmPort;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * LLM backend double that answers from a script. Requests beyond the script
 * fail the test loudly with a non-retryable backend error.
 */
public class ScriptedLlm implements LlmPort {

    private final Deque<CompletableFuture<LlmResponse>> script = new ArrayDeque<>();
    private final List<LlmRequest> requests = Collections.synchronizedList(new ArrayList<>());
    private LlmBackendException repeatedFailure;

    public ScriptedLlm reply(String content) {
        script.add(CompletableFuture.completedFuture(LlmResponse.builder().content(content).build()));
        return this;
    }

    public ScriptedLlm callTool(String name, Map<String, Object> arguments) {
        LlmToolCall call = LlmToolCall.builder().id("call_" + script.size()).name(name).arguments(arguments).build();
        script.add(CompletableFuture.completedFuture(LlmResponse.builder().toolCalls(List.of(call)).build()));
        return this;
    }

    public ScriptedLlm respond(LlmResponse response) {
        script.add(CompletableFuture.completedFuture(response));
        return this;
    }

    public ScriptedLlm fail(LlmBackendException error) {
        script.add(CompletableFuture.failedFuture(error));
        return this;
    }

    public ScriptedLlm alwaysFail(LlmBackendException error) {
        this.repeatedFailure = error;
        return this;
    }

    public List<LlmRequest> getRequests() {
        return requests;
    }

    public int callCount() {
        return requests.size();
    }

    @Override
    public String getProviderId() {
        return "scripted";
    }

    @Override
    public synchronized CompletableFuture<LlmResponse> chat(LlmRequest request) {
        requests.add(request);
        if (repeatedFailure != null) {
            return CompletableFuture.failedFuture(repeatedFailure);
        }
        CompletableFuture<LlmResponse> next = script.poll();
        if (next == null) {
            return CompletableFuture.failedFuture(new LlmBackendException("Script exhausted", false));
        }
        return next;
    }

    @Override
    public String getCurrentModel() {
        return "scripted-model";
    }

    @Override
    public boolean isAvailable() {
        return true;
    }
}
