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

package me.golemcore.warden.tools;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.warden.domain.component.ToolComponent;
import me.golemcore.warden.domain.model.ToolDefinition;
import me.golemcore.warden.domain.model.ToolFailureKind;
import me.golemcore.warden.domain.model.ToolResult;
import me.golemcore.warden.infrastructure.config.WardenProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Reads a text file from the workspace.
 *
 * <p>
 * Reads at most {@code warden.tools.read-max-bytes}; longer files are returned
 * truncated with a note. Files that look binary (NUL byte in the first 8 KB)
 * are refused.
 */
@Component
@Slf4j
public class ReadFileTool implements ToolComponent {

    private static final String PARAM_PATH = "path";
    private static final int BINARY_PROBE_BYTES = 8192;

    private final Path workspaceRoot;
    private final long maxBytes;

    public ReadFileTool(WardenProperties properties) {
        this.workspaceRoot = WorkspacePaths.realRoot(properties.getWorkspace().resolveRoot());
        this.maxBytes = properties.getTools().getReadMaxBytes();
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("read_file")
                .description("Read the contents of a file from the filesystem")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                PARAM_PATH, Map.of(
                                        "type", "string",
                                        "description", "The path to the file to read")),
                        "required", List.of(PARAM_PATH)))
                .build();
    }

    @Override
    public List<String> getPathArguments() {
        return List.of(PARAM_PATH);
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> readFile(WorkspacePaths.argument(parameters.get(PARAM_PATH))));
    }

    private ToolResult readFile(Path path) {
        String display = WorkspacePaths.display(workspaceRoot, path);
        if (!Files.exists(path)) {
            return ToolResult.failure(ToolFailureKind.NOT_FOUND, "File not found: " + display);
        }
        if (!Files.isRegularFile(path)) {
            return ToolResult.failure("Not a file: " + display);
        }

        try {
            long size = Files.size(path);
            byte[] bytes;
            try (InputStream in = Files.newInputStream(path)) {
                bytes = in.readNBytes((int) Math.min(size, maxBytes));
            }
            if (looksBinary(bytes)) {
                return ToolResult.failure("Cannot read binary file: " + display);
            }

            String content = new String(bytes, StandardCharsets.UTF_8);
            boolean truncated = size > maxBytes;
            if (truncated) {
                log.debug("[FileSystem] Truncated read of {} at {} bytes", display, maxBytes);
                content = content + "\n[Truncated: file is " + size + " bytes, showing the first " + maxBytes + "]";
            }
            log.debug("[FileSystem] Read {} ({} bytes)", display, size);
            return ToolResult.success(content, Map.of(
                    PARAM_PATH, display,
                    "size", size,
                    "truncated", truncated));
        } catch (IOException e) {
            return ToolResult.failure("Failed to read file: " + e.getMessage());
        }
    }

    private static boolean looksBinary(byte[] bytes) {
        int probe = Math.min(bytes.length, BINARY_PROBE_BYTES);
        for (int i = 0; i < probe; i++) {
            if (bytes[i] == 0) {
                return true;
            }
        }
        return false;
    }
}
