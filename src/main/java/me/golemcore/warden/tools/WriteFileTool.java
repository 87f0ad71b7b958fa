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
import me.golemcore.warden.domain.model.ToolResult;
import me.golemcore.warden.infrastructure.config.WardenProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Writes (creates or overwrites) a text file in the workspace, creating
 * missing parent directories.
 */
@Component
@Slf4j
public class WriteFileTool implements ToolComponent {

    private static final String PARAM_PATH = "path";
    private static final String PARAM_CONTENT = "content";

    private final Path workspaceRoot;

    public WriteFileTool(WardenProperties properties) {
        this.workspaceRoot = WorkspacePaths.realRoot(properties.getWorkspace().resolveRoot());
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("write_file")
                .description("Write content to a file on the filesystem. Creates the file if it doesn't exist, "
                        + "overwrites if it does.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                PARAM_PATH, Map.of(
                                        "type", "string",
                                        "description", "The path where the file should be written"),
                                PARAM_CONTENT, Map.of(
                                        "type", "string",
                                        "description", "The content to write to the file")),
                        "required", List.of(PARAM_PATH, PARAM_CONTENT)))
                .build();
    }

    @Override
    public List<String> getPathArguments() {
        return List.of(PARAM_PATH);
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> writeFile(
                WorkspacePaths.argument(parameters.get(PARAM_PATH)),
                String.valueOf(parameters.get(PARAM_CONTENT))));
    }

    private ToolResult writeFile(Path path, String content) {
        String display = WorkspacePaths.display(workspaceRoot, path);
        if (Files.isDirectory(path)) {
            return ToolResult.failure("Cannot write, path is a directory: " + display);
        }
        try {
            Path parent = path.getParent();
            if (parent != null && !Files.exists(parent)) {
                Files.createDirectories(parent);
            }
            boolean existed = Files.exists(path);
            Files.writeString(path, content, StandardCharsets.UTF_8);
            long size = Files.size(path);
            log.debug("[FileSystem] Wrote {} ({} bytes)", display, size);
            return ToolResult.success("Successfully wrote " + size + " bytes to " + display, Map.of(
                    PARAM_PATH, display,
                    "size", size,
                    "created", !existed));
        } catch (IOException e) {
            return ToolResult.failure("Failed to write file: " + e.getMessage());
        }
    }
}
