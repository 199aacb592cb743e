package me.golemcore.teams.domain.service;

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
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.teams.domain.component.ToolComponent;
import me.golemcore.teams.domain.exception.ToolValidationException;
import me.golemcore.teams.domain.exception.UnknownToolException;
import me.golemcore.teams.domain.model.ToolCall;
import me.golemcore.teams.domain.model.ToolFailureKind;
import me.golemcore.teams.domain.model.ToolOutput;
import me.golemcore.teams.domain.model.ToolResult;
import me.golemcore.teams.infrastructure.config.TeamsProperties;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Dispatches a {@link ToolCall} to its provider and folds whatever comes back
 * into a {@link ToolResult}.
 *
 * <p>
 * Per call: resolve the provider, validate the arguments against its schema,
 * then invoke with a per-attempt timeout. TIMEOUT and TRANSIENT failures are
 * retried up to {@code teams.gateway.max-retries} times with exponential
 * backoff; every other failure is returned at once. The result records how many
 * provider invocations were made.
 *
 * <p>
 * Does NOT persist anything and never throws for a failed tool: callers always
 * get exactly one result per call. Interrupting the calling thread aborts the
 * call with a CANCELLED result and leaves the interrupt flag set.
 */
@Service
@Slf4j
public class ToolGateway {

    private final ToolRegistry toolRegistry;
    private final TeamsProperties.GatewayProperties settings;
    private final ObjectMapper objectMapper;

    public ToolGateway(ToolRegistry toolRegistry, TeamsProperties properties, ObjectMapper objectMapper) {
        this.toolRegistry = toolRegistry;
        this.settings = properties.getGateway();
        this.objectMapper = objectMapper;
    }

    public ToolResult invoke(ToolCall call) {
        ToolComponent tool;
        try {
            tool = toolRegistry.resolve(call.toolName());
        } catch (UnknownToolException e) {
            log.warn("[Gateway] {} requested unknown tool '{}'", call.requesterAgent(), call.toolName());
            return ToolResult.error(call, ToolFailureKind.UNKNOWN_TOOL, e.getMessage(), 0);
        }

        try {
            ToolArgumentValidator.validate(call.arguments(), tool.getDefinition().getInputSchema());
        } catch (ToolValidationException e) {
            log.debug("[Gateway] Rejected arguments for '{}': {}", call.toolName(), e.getMessage());
            return ToolResult.error(call, ToolFailureKind.VALIDATION, e.getMessage(), 0);
        }

        int maxAttempts = Math.max(0, settings.getMaxRetries()) + 1;
        int attempts = 0;
        while (true) {
            attempts++;
            Attempt attempt = attemptOnce(tool, call);
            if (attempt.kind() == null) {
                log.debug("[Gateway] '{}' call {} succeeded after {} attempt(s)", call.toolName(), call.callId(),
                        attempts);
                return ToolResult.ok(call, truncate(attempt.payload(), call.toolName()), attempts);
            }
            if (!attempt.kind().isRetryable() || attempts >= maxAttempts) {
                log.info("[Gateway] '{}' call {} failed with {} after {} attempt(s): {}", call.toolName(),
                        call.callId(), attempt.kind(), attempts, attempt.detail());
                return ToolResult.error(call, attempt.kind(), attempt.detail(), attempts);
            }

            long backoffMs = settings.getRetryBackoffMs() * (1L << (attempts - 1));
            log.warn("[Gateway] '{}' call {} attempt {}/{} failed with {}, retrying in {}ms", call.toolName(),
                    call.callId(), attempts, maxAttempts, attempt.kind(), backoffMs);
            if (backoffMs > 0) {
                try {
                    Thread.sleep(backoffMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return ToolResult.error(call, ToolFailureKind.CANCELLED, "Cancelled during retry backoff",
                            attempts);
                }
            }
        }
    }

    private Attempt attemptOnce(ToolComponent tool, ToolCall call) {
        if (Thread.currentThread().isInterrupted()) {
            return Attempt.failed(ToolFailureKind.CANCELLED, "Cancelled before invocation");
        }
        CompletableFuture<ToolOutput> future;
        try {
            future = tool.execute(call.arguments());
        } catch (RuntimeException e) {
            return Attempt.failed(classify(e), safeCauseMessage(e));
        }

        try {
            return fromOutput(future.get(settings.getTimeoutMs(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            future.cancel(true);
            return Attempt.failed(ToolFailureKind.TIMEOUT,
                    "Tool '" + call.toolName() + "' timed out after " + settings.getTimeoutMs() + "ms");
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return Attempt.failed(ToolFailureKind.CANCELLED, "Task cancelled while '" + call.toolName()
                    + "' was running");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            return Attempt.failed(classify(cause), safeCauseMessage(cause));
        } catch (CancellationException e) {
            return Attempt.failed(ToolFailureKind.CANCELLED, "Tool invocation was cancelled");
        }
    }

    private Attempt fromOutput(ToolOutput output) {
        if (output == null) {
            return Attempt.failed(ToolFailureKind.PROVIDER_ERROR, "Tool returned no result");
        }
        if (output.isSuccess()) {
            return Attempt.ok(payloadOf(output));
        }
        ToolFailureKind kind = output.getFailureKind() != null
                ? output.getFailureKind()
                : ToolFailureKind.PROVIDER_ERROR;
        String detail = output.getError() != null ? output.getError() : output.getOutput();
        return Attempt.failed(kind, detail != null ? detail : "Tool failed without details");
    }

    private String payloadOf(ToolOutput output) {
        if (output.getOutput() != null) {
            return output.getOutput();
        }
        if (output.getData() == null) {
            return "";
        }
        try {
            return objectMapper.writeValueAsString(output.getData());
        } catch (JsonProcessingException e) {
            return String.valueOf(output.getData());
        }
    }

    static ToolFailureKind classify(Throwable error) {
        if (error instanceof ToolValidationException) {
            return ToolFailureKind.VALIDATION;
        }
        if (error instanceof UnknownToolException) {
            return ToolFailureKind.UNKNOWN_TOOL;
        }
        if (error instanceof TimeoutException) {
            return ToolFailureKind.TIMEOUT;
        }
        if (error instanceof CancellationException) {
            return ToolFailureKind.CANCELLED;
        }
        if (error instanceof IOException || error instanceof UncheckedIOException) {
            return ToolFailureKind.TRANSIENT;
        }
        return ToolFailureKind.PROVIDER_ERROR;
    }

    /**
     * Truncate tool output that exceeds the configured max length.
     */
    String truncate(String content, String toolName) {
        int maxChars = settings.getMaxResultChars();
        if (content == null || maxChars <= 0 || content.length() <= maxChars) {
            return content;
        }
        String suffix = "\n\n[OUTPUT TRUNCATED: " + content.length() + " chars total, showing first "
                + maxChars + " chars.]";
        int cutPoint = Math.max(0, maxChars - suffix.length());
        log.warn("[Gateway] Truncating '{}' result: {} chars -> ~{} chars", toolName, content.length(),
                cutPoint + suffix.length());
        return content.substring(0, cutPoint) + suffix;
    }

    private static String safeCauseMessage(Throwable error) {
        Throwable cursor = error;
        Throwable cause = cursor.getCause();
        while (cause != null && cause != cursor) {
            cursor = cause;
            cause = cursor.getCause();
        }
        String message = cursor.getMessage();
        if (message == null || message.isBlank()) {
            message = cursor.getClass().getSimpleName();
        }
        return message;
    }

    private record Attempt(String payload, ToolFailureKind kind, String detail) {

        static Attempt ok(String payload) {
            return new Attempt(payload, null, null);
        }

        static Attempt failed(ToolFailureKind kind, String detail) {
            return new Attempt(null, kind, detail);
        }
    }
}
