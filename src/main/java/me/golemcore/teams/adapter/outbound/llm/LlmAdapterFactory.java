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

package me.golemcore.teams.adapter.outbound.llm;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.teams.domain.exception.LlmBackendException;
import me.golemcore.teams.domain.model.LlmRequest;
import me.golemcore.teams.domain.model.LlmResponse;
import me.golemcore.teams.infrastructure.config.TeamsProperties;
import me.golemcore.teams.port.outbound.LlmPort;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Selects the active LLM adapter from {@code teams.llm.provider}:
 * <ul>
 * <li>openai - OpenAI-compatible REST API via Feign
 * <li>langchain4j - OpenAI-compatible API via the langchain4j client
 * <li>none - fails every call, for setups without an LLM
 * </ul>
 *
 * <p>
 * Registered as the primary {@link LlmPort} so agent runtimes stay unaware of
 * the provider choice. Whatever the adapter throws reaches the caller as a
 * {@link LlmBackendException}; failures the adapter did not classify are
 * treated as not retryable.
 *
 * @see LlmProviderAdapter
 */
@Component
@Primary
@RequiredArgsConstructor
@Slf4j
public class LlmAdapterFactory implements LlmPort {

    private static final String PROVIDER_NONE = "none";

    private final TeamsProperties properties;
    private final List<LlmProviderAdapter> adapters;

    private LlmProviderAdapter activeAdapter;

    @PostConstruct
    public void init() {
        Map<String, LlmProviderAdapter> byProvider = new LinkedHashMap<>();
        adapters.forEach(adapter -> byProvider.putIfAbsent(adapter.getProviderId(), adapter));
        log.debug("[LLM] Registered adapters: {}", byProvider.keySet());

        String provider = properties.getLlm().getProvider();
        activeAdapter = byProvider.get(provider);
        if (activeAdapter == null) {
            activeAdapter = byProvider.containsKey(PROVIDER_NONE)
                    ? byProvider.get(PROVIDER_NONE)
                    : adapters.stream().findFirst().orElse(null);
            log.warn("[LLM] Provider '{}' not found, using: {}", provider, getProviderId());
        } else if (!activeAdapter.isAvailable()) {
            log.warn("[LLM] Provider '{}' is selected but not configured; every agent step will fail", provider);
        } else {
            log.info("[LLM] Active provider: {} ({})", provider, activeAdapter.getCurrentModel());
        }
    }

    public LlmPort getActiveAdapter() {
        return activeAdapter;
    }

    @Override
    public String getProviderId() {
        return activeAdapter != null ? activeAdapter.getProviderId() : PROVIDER_NONE;
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        if (activeAdapter == null) {
            return CompletableFuture.failedFuture(new LlmBackendException("No LLM adapter registered", false));
        }
        log.debug("[LLM] {} request for task {} ({} messages, {} tools)", getProviderId(), request.getTaskId(),
                request.getMessages() != null ? request.getMessages().size() : 0,
                request.getTools() != null ? request.getTools().size() : 0);
        CompletableFuture<LlmResponse> response;
        try {
            response = activeAdapter.chat(request);
        } catch (RuntimeException e) {
            response = CompletableFuture.failedFuture(e);
        }
        return response.handle((result, error) -> {
            if (error == null) {
                return result;
            }
            throw new CompletionException(asBackendFailure(error));
        });
    }

    @Override
    public String getCurrentModel() {
        return activeAdapter != null ? activeAdapter.getCurrentModel() : PROVIDER_NONE;
    }

    @Override
    public boolean isAvailable() {
        return activeAdapter != null && activeAdapter.isAvailable();
    }

    static LlmBackendException asBackendFailure(Throwable error) {
        Throwable cause = error;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof LlmBackendException backend) {
            return backend;
        }
        return new LlmBackendException("LLM adapter failed: " + cause.getMessage(), false, cause);
    }
}
