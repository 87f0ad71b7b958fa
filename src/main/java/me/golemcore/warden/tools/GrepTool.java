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
import me.golemcore.warden.security.SecurityGate;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Stream;

/**
 * Regex search over a file or, recursively, a directory of the workspace.
 *
 * <p>
 * Case-insensitive unless {@code case_sensitive} is set. Returns at most
 * {@code max_results} matches (default 50, capped by
 * {@code warden.tools.grep-max-results}). Symlinks are not followed, binary
 * and empty files are skipped, and files the security gate would refuse (for
 * instance ignored ones) are left out of a directory walk.
 */
@Component
@Slf4j
public class GrepTool implements ToolComponent {

    private static final String PARAM_PATTERN = "pattern";
    private static final String PARAM_PATH = "path";
    private static final String PARAM_CASE_SENSITIVE = "case_sensitive";
    private static final String PARAM_MAX_RESULTS = "max_results";
    private static final int MAX_LINE_LENGTH = 500;

    private static final Set<String> BINARY_EXTENSIONS = Set.of(
            "jpg", "jpeg", "png", "gif", "bmp", "ico", "webp", "pdf", "zip", "tar", "gz", "rar", "7z",
            "exe", "dll", "so", "dylib", "bin", "dat", "mp4", "mov", "avi", "mkv", "iso", "db", "sqlite",
            "sqlite3", "class", "jar");

    private final SecurityGate securityGate;
    private final Path workspaceRoot;
    private final int defaultMaxResults;
    private final int maxResultsCap;

    public GrepTool(WardenProperties properties, SecurityGate securityGate) {
        this.securityGate = securityGate;
        this.workspaceRoot = WorkspacePaths.realRoot(properties.getWorkspace().resolveRoot());
        this.defaultMaxResults = properties.getTools().getGrepDefaultMaxResults();
        this.maxResultsCap = properties.getTools().getGrepMaxResults();
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("grep")
                .description("Search for a pattern in files using regex. "
                        + "Searches recursively from a given directory or in a specific file.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                PARAM_PATTERN, Map.of(
                                        "type", "string",
                                        "description", "The regex pattern to search for"),
                                PARAM_PATH, Map.of(
                                        "type", "string",
                                        "description", "The file or directory path to search in. "
                                                + "If a directory, searches recursively."),
                                PARAM_CASE_SENSITIVE, Map.of(
                                        "type", "boolean",
                                        "description", "Whether the search should be case-sensitive (default: false)"),
                                PARAM_MAX_RESULTS, Map.of(
                                        "type", "integer",
                                        "description", "Maximum number of results to return (default: 50)")),
                        "required", List.of(PARAM_PATTERN, PARAM_PATH)))
                .build();
    }

    @Override
    public List<String> getPathArguments() {
        return List.of(PARAM_PATH);
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        return CompletableFuture.supplyAsync(() -> search(parameters));
    }

    private ToolResult search(Map<String, Object> parameters) {
        String patternText = String.valueOf(parameters.get(PARAM_PATTERN));
        Path root = WorkspacePaths.argument(parameters.get(PARAM_PATH));
        boolean caseSensitive = Boolean.TRUE.equals(parameters.get(PARAM_CASE_SENSITIVE));
        int maxResults = resolveMaxResults(parameters.get(PARAM_MAX_RESULTS));

        Pattern pattern;
        try {
            pattern = caseSensitive
                    ? Pattern.compile(patternText)
                    : Pattern.compile(patternText, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        } catch (PatternSyntaxException e) {
            return ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS, "Invalid regex pattern: " + e.getDescription());
        }

        if (!Files.exists(root)) {
            return ToolResult.failure(ToolFailureKind.NOT_FOUND,
                    "Path not found: " + WorkspacePaths.display(workspaceRoot, root));
        }

        List<Map<String, Object>> matches = new ArrayList<>();
        if (Files.isRegularFile(root)) {
            searchFile(root, pattern, maxResults, matches);
        } else {
            try (Stream<Path> walk = Files.walk(root)) {
                Iterator<Path> files = walk.filter(Files::isRegularFile).iterator();
                while (files.hasNext() && matches.size() < maxResults) {
                    Path file = files.next();
                    if (isSearchable(file)) {
                        searchFile(file, pattern, maxResults, matches);
                    }
                }
            } catch (IOException | UncheckedIOException e) {
                return ToolResult.failure("Failed to walk directory: " + e.getMessage());
            }
        }

        log.debug("[Grep] '{}' in {}: {} matches", patternText, root, matches.size());
        return ToolResult.success(format(matches, maxResults), Map.of(
                "matches", matches,
                "count", matches.size(),
                "truncated", matches.size() >= maxResults));
    }

    private int resolveMaxResults(Object value) {
        if (value instanceof Number number) {
            return Math.max(1, Math.min(number.intValue(), maxResultsCap));
        }
        return defaultMaxResults;
    }

    private boolean isSearchable(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot >= 0 && BINARY_EXTENSIONS.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT))) {
            return false;
        }
        try {
            if (Files.size(file) == 0) {
                return false;
            }
        } catch (IOException e) {
            return false;
        }
        return securityGate.validatePath(file.toString()).allowed();
    }

    private void searchFile(Path file, Pattern pattern, int maxResults, List<Map<String, Object>> matches) {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line = reader.readLine();
            int lineNumber = 1;
            while (line != null && matches.size() < maxResults) {
                if (pattern.matcher(line).find()) {
                    Map<String, Object> match = new LinkedHashMap<>();
                    match.put("file", WorkspacePaths.display(workspaceRoot, file));
                    match.put("line", lineNumber);
                    match.put("content", line.length() > MAX_LINE_LENGTH ? line.substring(0, MAX_LINE_LENGTH) : line);
                    matches.add(match);
                }
                line = reader.readLine();
                lineNumber++;
            }
        } catch (IOException | UncheckedIOException e) {
            log.debug("[Grep] Skipping {}: {}", file, e.getMessage());
        }
    }

    private static String format(List<Map<String, Object>> matches, int maxResults) {
        if (matches.isEmpty()) {
            return "No matches found";
        }
        StringBuilder sb = new StringBuilder();
        for (Map<String, Object> match : matches) {
            sb.append(match.get("file")).append(':').append(match.get("line")).append(": ")
                    .append(match.get("content")).append('\n');
        }
        if (matches.size() >= maxResults) {
            sb.append("[Result limit of ").append(maxResults).append(" reached]\n");
        }
        return sb.toString().stripTrailing();
    }
}
