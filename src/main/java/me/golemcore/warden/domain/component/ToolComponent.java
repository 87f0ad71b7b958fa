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

package me.golemcore.warden.domain.component;

import me.golemcore.warden.domain.model.ToolDefinition;
import me.golemcore.warden.domain.model.ToolResult;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * An executable tool the model can call. Tools expose their JSON Schema
 * definition to the model via function calling and implement the execution
 * logic.
 *
 * <p>
 * Tools are only ever invoked by the tool-call pipeline after the security
 * gate, the permission policy and (when asked) the human have let the call
 * through. Path arguments named by {@link #getPathArguments()} arrive already
 * resolved to absolute, symlink-free paths inside the workspace, so
 * implementations must not validate them again.
 */
public interface ToolComponent {

    /**
     * Returns the tool definition with JSON Schema for function calling.
     *
     * @return the tool definition
     */
    ToolDefinition getDefinition();

    /**
     * Executes the tool with gate-checked parameters. Failures are returned as
     * {@link ToolResult#failure} rather than thrown. Cancelling the returned
     * future must release whatever the tool holds (processes, file handles).
     *
     * @param parameters
     *            the execution parameters as a map
     * @return a future containing the tool execution result
     */
    CompletableFuture<ToolResult> execute(Map<String, Object> parameters);

    default String getToolName() {
        return getDefinition().getName();
    }

    default boolean isEnabled() {
        return true;
    }

    /**
     * Names of arguments holding filesystem paths the gate must resolve and
     * validate.
     */
    default List<String> getPathArguments() {
        return List.of();
    }

    /**
     * Name of the argument holding a shell command the gate must validate, or
     * null.
     */
    default String getCommandArgument() {
        return null;
    }

    /**
     * Scope used for {@code tool:scope} permission rules, or null when the tool
     * has no scopes.
     */
    default String getScopeHint(Map<String, Object> parameters) {
        return null;
    }

    /**
     * Every scope the call touches. A call is allowed only when each scope is
     * allowed, and denied when any is denied.
     */
    default List<String> getScopeHints(Map<String, Object> parameters) {
        String hint = getScopeHint(parameters);
        return hint == null ? List.of() : List.of(hint);
    }

    /**
     * Timeout the call asks for in seconds, or null for the default. The
     * pipeline clamps it to the configured maximum.
     */
    default Integer getRequestedTimeoutSeconds(Map<String, Object> parameters) {
        return null;
    }
}
