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

package me.golemcore.warden.domain.service;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.warden.domain.component.ToolComponent;
import me.golemcore.warden.domain.model.ToolDefinition;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Name-to-executor map of every tool the model may call. Built once from the
 * tool beans in the context; the map is never exposed mutably.
 */
@Component
@Slf4j
public class ToolRegistry {

    private final Map<String, ToolComponent> tools;

    public ToolRegistry(List<ToolComponent> toolComponents) {
        Map<String, ToolComponent> registered = new LinkedHashMap<>();
        for (ToolComponent tool : toolComponents) {
            String name = tool.getToolName();
            if (name == null || name.isBlank()) {
                log.warn("[Tool] Skipping tool without a name: {}", tool.getClass().getSimpleName());
                continue;
            }
            ToolComponent previous = registered.putIfAbsent(name, tool);
            if (previous != null) {
                throw new IllegalStateException("Duplicate tool name: " + name);
            }
        }
        this.tools = Map.copyOf(registered);
        log.info("[Tool] Registered tools: {}", registered.keySet());
    }

    public Optional<ToolComponent> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        ToolComponent tool = tools.get(sanitizeToolName(name));
        return tool != null && tool.isEnabled() ? Optional.of(tool) : Optional.empty();
    }

    public Set<String> getToolNames() {
        return tools.keySet();
    }

    /**
     * Definitions of the enabled tools, as advertised to the model.
     */
    public List<ToolDefinition> getDefinitions() {
        return tools.values().stream()
                .filter(ToolComponent::isEnabled)
                .map(ToolComponent::getDefinition)
                .sorted((a, b) -> a.getName().compareTo(b.getName()))
                .toList();
    }

    /**
     * Strip special tokens and garbage from tool names. Some models leak special
     * tokens like {@code <|channel|>} into tool call names.
     */
    static String sanitizeToolName(String name) {
        String sanitized = name.replaceAll("[^a-zA-Z0-9_-].*", "");
        if (!sanitized.equals(name)) {
            log.warn("[Tool] Sanitized tool name: '{}' -> '{}'", name, sanitized);
        }
        return sanitized;
    }
}
