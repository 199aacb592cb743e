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
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.teams.domain.component.ToolComponent;
import me.golemcore.teams.domain.exception.UnknownToolException;
import me.golemcore.teams.domain.model.ToolDefinition;
import me.golemcore.teams.port.outbound.McpPort;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Static catalog of tool providers, built once at startup from the local tool
 * beans and the tools advertised by configured MCP servers. Nothing is added or
 * removed afterwards; changing the catalog takes a restart.
 *
 * <p>
 * {@link #getVersion()} is a digest of every name, provider and schema, so two
 * processes with the same version expose identical tools.
 */
@Component
@Slf4j
public class ToolRegistry {

    private final Map<String, ToolComponent> tools;
    private final String version;

    @Autowired
    public ToolRegistry(List<ToolComponent> localTools, McpPort mcpPort) {
        this(concat(localTools, mcpPort.connectAll()));
    }

    public ToolRegistry(List<ToolComponent> providers) {
        Map<String, ToolComponent> catalog = new LinkedHashMap<>();
        for (ToolComponent tool : providers) {
            if (!tool.isEnabled()) {
                log.info("[Tools] Skipping disabled tool: {}", tool.getToolName());
                continue;
            }
            ToolComponent previous = catalog.putIfAbsent(tool.getToolName(), tool);
            if (previous != null) {
                log.warn("[Tools] Duplicate tool '{}' from {}, keeping the one from {}", tool.getToolName(),
                        tool.getProviderName(), previous.getProviderName());
            }
        }
        this.tools = Collections.unmodifiableMap(catalog);
        this.version = computeVersion(catalog.values());
        log.info("[Tools] Registry {} ready with {} tools: {}", version, tools.size(), tools.keySet());
    }

    public ToolComponent resolve(String toolName) {
        ToolComponent tool = toolName != null ? tools.get(toolName) : null;
        if (tool == null) {
            throw new UnknownToolException(toolName);
        }
        return tool;
    }

    public boolean contains(String toolName) {
        return toolName != null && tools.containsKey(toolName);
    }

    public Collection<ToolComponent> getTools() {
        return tools.values();
    }

    /**
     * Definitions of the registered tools among {@code allowedTools}, in catalog
     * order. Allowed names missing from the catalog are ignored.
     */
    public List<ToolDefinition> definitionsFor(Collection<String> allowedTools) {
        List<ToolDefinition> definitions = new ArrayList<>();
        for (ToolComponent tool : tools.values()) {
            if (allowedTools.contains(tool.getToolName())) {
                definitions.add(tool.getDefinition());
            }
        }
        return definitions;
    }

    public String getVersion() {
        return version;
    }

    private static List<ToolComponent> concat(List<ToolComponent> first, List<ToolComponent> second) {
        List<ToolComponent> all = new ArrayList<>(first);
        all.addAll(second);
        return all;
    }

    private static String computeVersion(Collection<ToolComponent> catalog) {
        ObjectWriter writer = new ObjectMapper().writer().with(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            for (ToolComponent tool : catalog) {
                ToolDefinition definition = tool.getDefinition();
                String line = tool.getToolName() + "|" + tool.getProviderName() + "|"
                        + writer.writeValueAsString(definition.getInputSchema()) + "\n";
                digest.update(line.getBytes(StandardCharsets.UTF_8));
            }
            return HexFormat.of().formatHex(digest.digest()).substring(0, 12);
        } catch (NoSuchAlgorithmException | JsonProcessingException e) {
            throw new IllegalStateException("Cannot compute tool registry version", e);
        }
    }
}
