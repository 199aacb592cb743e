package me.golemcore.teams.domain.runtime;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.teams.domain.exception.BackendUnavailableException;
import me.golemcore.teams.domain.exception.LlmBackendException;
import me.golemcore.teams.domain.exception.MalformedAgentOutputException;
import me.golemcore.teams.domain.model.AgentDefinition;
import me.golemcore.teams.domain.model.AgentOutput;
import me.golemcore.teams.domain.model.ConversationEntry;
import me.golemcore.teams.domain.model.LlmMessage;
import me.golemcore.teams.domain.model.LlmRequest;
import me.golemcore.teams.domain.model.LlmResponse;
import me.golemcore.teams.domain.model.LlmToolCall;
import me.golemcore.teams.domain.model.RoutingPolicyType;
import me.golemcore.teams.domain.model.Team;
import me.golemcore.teams.domain.model.ToolDefinition;
import me.golemcore.teams.port.outbound.LlmPort;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * One agent bound to a task: its definition, the tools it may see, and the call
 * into the LLM backend.
 *
 * <p>
 * {@link #step(List)} turns the agent's visible history into exactly one
 * {@link AgentOutput}. When the model returns several tool calls only the
 * first is used; the agent gets the floor back after the result and can ask
 * again.
 */
@Slf4j
public class AgentRuntime {

    private final AgentDefinition definition;
    private final Team team;
    private final LlmPort llmPort;
    private final List<ToolDefinition> tools;
    private final AgentSettings settings;

    public AgentRuntime(AgentDefinition definition, Team team, LlmPort llmPort, List<ToolDefinition> tools,
            AgentSettings settings) {
        this.definition = definition;
        this.team = team;
        this.llmPort = llmPort;
        this.tools = List.copyOf(tools);
        this.settings = settings;
    }

    public String getName() {
        return definition.getName();
    }

    public AgentDefinition getDefinition() {
        return definition;
    }

    /**
     * Runs one agent step.
     *
     * @param visibleHistory
     *            the task history as this agent sees it, in global order
     * @return a reply or a tool request
     * @throws BackendUnavailableException
     *             if the backend could not be reached or refused the request
     * @throws MalformedAgentOutputException
     *             if the answer is neither a usable reply nor a usable tool call
     */
    public AgentOutput step(List<ConversationEntry> visibleHistory) {
        LlmRequest request = LlmRequest.builder()
                .model(settings.model())
                .systemPrompt(buildSystemPrompt())
                .messages(ConversationViewBuilder.build(getName(), visibleHistory))
                .tools(tools)
                .temperature(settings.temperature())
                .maxTokens(settings.maxTokens())
                .taskId(taskIdOf(visibleHistory))
                .build();
        return parse(call(request));
    }

    /**
     * Asks this agent, acting as team lead, which member should act next.
     *
     * @return the chosen member, or empty when the answer names no candidate
     *         exactly (ignoring case and surrounding punctuation)
     */
    public Optional<String> chooseNextSpeaker(List<ConversationEntry> visibleHistory, List<String> candidates) {
        List<LlmMessage> messages = ConversationViewBuilder.build(getName(), visibleHistory);
        messages.add(LlmMessage.user("Which team member should act next? Answer with exactly one name from: "
                + String.join(", ", candidates) + "."));
        LlmRequest request = LlmRequest.builder()
                .model(settings.model())
                .systemPrompt("You are " + getName() + ", the lead of team " + team.name()
                        + ". You decide who speaks next. Reply with a single name and nothing else.")
                .messages(messages)
                .temperature(0.0)
                .taskId(taskIdOf(visibleHistory))
                .build();
        LlmResponse response = call(request);
        String answer = response.getContent() != null ? response.getContent().strip() : "";
        answer = answer.replaceAll("^[\\p{Punct}\\s]+|[\\p{Punct}\\s]+$", "");
        for (String candidate : candidates) {
            if (candidate.equalsIgnoreCase(answer)) {
                return Optional.of(candidate);
            }
        }
        log.debug("[Agent:{}] Routing answer '{}' names no candidate", getName(), answer);
        return Optional.empty();
    }

    private LlmResponse call(LlmRequest request) {
        try {
            LlmResponse response = llmPort.chat(request).get(settings.timeoutSeconds(), TimeUnit.SECONDS);
            if (response == null) {
                throw new MalformedAgentOutputException("Backend returned no response");
            }
            return response;
        } catch (TimeoutException e) {
            throw new BackendUnavailableException("LLM backend did not answer within " + settings.timeoutSeconds()
                    + "s", true, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof LlmBackendException backend) {
                throw new BackendUnavailableException(backend.getMessage(), backend.isRetryable(), backend);
            }
            throw new BackendUnavailableException("LLM call failed: " + cause.getMessage(), true, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendUnavailableException("Interrupted while waiting for the LLM backend", false, e);
        }
    }

    private AgentOutput parse(LlmResponse response) {
        if (response.hasToolCalls()) {
            LlmToolCall toolCall = response.getToolCalls().get(0);
            if (response.getToolCalls().size() > 1) {
                log.debug("[Agent:{}] Model returned {} tool calls, using '{}'", getName(),
                        response.getToolCalls().size(), toolCall.getName());
            }
            String toolName = toolCall.getName() != null ? toolCall.getName().strip() : "";
            if (toolName.isEmpty()) {
                throw new MalformedAgentOutputException("Tool call without a tool name");
            }
            if (!toolCall.isArgumentsParsed()) {
                throw new MalformedAgentOutputException("Arguments for tool '" + toolName
                        + "' are not a valid JSON object: " + toolCall.getRawArguments());
            }
            return new AgentOutput.ToolRequest(toolName, toolCall.getArguments());
        }
        if (!response.hasContent()) {
            throw new MalformedAgentOutputException("Empty response: no text and no tool call");
        }
        String text = response.getContent();
        boolean complete = settings.completionToken() != null && !settings.completionToken().isBlank()
                && text.contains(settings.completionToken());
        return new AgentOutput.Reply(text, complete);
    }

    private String buildSystemPrompt() {
        StringBuilder prompt = new StringBuilder();
        prompt.append("You are ").append(getName());
        if (definition.getRole() != null && !definition.getRole().isBlank()) {
            prompt.append(", the ").append(definition.getRole());
        }
        prompt.append(", a member of team ").append(team.name()).append(".\n");
        if (definition.getPersona() != null && !definition.getPersona().isBlank()) {
            prompt.append(definition.getPersona().strip()).append("\n");
        }
        prompt.append("\nTeam members: ").append(String.join(", ", team.members())).append(".\n");
        prompt.append("Messages from other members are prefixed with their name in brackets.\n");
        if (!tools.isEmpty()) {
            prompt.append("You may call these tools, one at a time: ");
            prompt.append(String.join(", ", tools.stream().map(ToolDefinition::getName).toList())).append(".\n");
        }
        if (team.routing() == RoutingPolicyType.CRITERIA_HANDOFF) {
            prompt.append("To pass the work to a specific member, end your reply with a line 'HANDOFF: <name>'.\n");
        }
        if (settings.completionToken() != null && !settings.completionToken().isBlank()) {
            prompt.append("When the task is fully done, give the final answer and include the word ")
                    .append(settings.completionToken()).append(".\n");
        }
        return prompt.toString();
    }

    private static String taskIdOf(List<ConversationEntry> history) {
        return history.isEmpty() ? null : history.get(0).taskId();
    }
}
