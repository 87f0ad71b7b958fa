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

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.warden.domain.component.ToolComponent;
import me.golemcore.warden.domain.model.ToolDefinition;
import me.golemcore.warden.domain.model.ToolFailureKind;
import me.golemcore.warden.domain.model.ToolResult;
import me.golemcore.warden.infrastructure.config.WardenProperties;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Tool for running shell commands in the workspace directory.
 *
 * <p>
 * Commands run via {@code /bin/sh -c} with the workspace as working directory
 * and a sanitized environment. Each run is bounded by a timeout (default 10s,
 * max 60s); on expiry the process tree is killed and the model gets a
 * {@code timeout} failure. Cancelling the returned future kills the process
 * too.
 *
 * <p>
 * Destructive commands never reach this tool: the security gate vetoes them
 * first.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code warden.tools.default-timeout-seconds} - Default timeout
 * <li>{@code warden.tools.max-timeout-seconds} - Max timeout
 * <li>{@code warden.tools.allowed-env-vars} - Extra environment variables to
 * pass through
 * </ul>
 */
@Component
@Slf4j
public class BashTool implements ToolComponent {

    private static final String PARAM_COMMAND = "command";
    private static final String PARAM_TIMEOUT = "timeout";
    private static final Pattern COMMAND_SEPARATOR = Pattern.compile("&&|\\|\\||\\$\\(|[;&|\n\r`()]");

    private static final Set<String> DEFAULT_ALLOWED_ENV_VARS = Set.of(
            "PATH", "HOME", "LANG", "LC_ALL", "LC_CTYPE", "TERM", "TMPDIR",
            "TZ", "SHELL", "USER", "LOGNAME");

    private final Path workspaceRoot;
    private final int defaultTimeout;
    private final int maxTimeout;
    private final int maxOutputChars;
    private final Set<String> allowedEnvVars;
    private final ExecutorService executor;

    public BashTool(WardenProperties properties) {
        WardenProperties.ToolsProperties config = properties.getTools();
        this.workspaceRoot = WorkspacePaths.realRoot(properties.getWorkspace().resolveRoot());
        this.defaultTimeout = config.getDefaultTimeoutSeconds();
        this.maxTimeout = config.getMaxTimeoutSeconds();
        this.maxOutputChars = config.getMaxOutputChars();
        this.allowedEnvVars = buildAllowedEnvVars(config.getAllowedEnvVars());
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "bash-tool");
            t.setDaemon(true);
            return t;
        });
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("[Bash] Executor did not terminate within timeout");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("bash")
                .description("Execute a bash command. Only use this for safe, non-destructive commands like ls, "
                        + "git status, cat, etc. Dangerous commands (rm -rf, sudo, chmod, dd, curl, wget, kill) "
                        + "are automatically blocked.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                PARAM_COMMAND, Map.of(
                                        "type", "string",
                                        "description",
                                        "The bash command to execute (e.g., 'ls -la', 'git status', 'cat file.txt')"),
                                PARAM_TIMEOUT, Map.of(
                                        "type", "integer",
                                        "description", "Maximum execution time in seconds (default: "
                                                + defaultTimeout + ", max: " + maxTimeout + ")")),
                        "required", List.of(PARAM_COMMAND)))
                .build();
    }

    @Override
    public String getCommandArgument() {
        return PARAM_COMMAND;
    }

    /**
     * Single command family, or null when the command chains several.
     */
    @Override
    public String getScopeHint(Map<String, Object> parameters) {
        List<String> scopes = getScopeHints(parameters);
        return scopes.size() == 1 ? scopes.get(0) : null;
    }

    @Override
    public List<String> getScopeHints(Map<String, Object> parameters) {
        Object command = parameters.get(PARAM_COMMAND);
        if (command == null) {
            return List.of();
        }
        return commandSegments(command.toString()).stream()
                .map(BashTool::baseCommand)
                .filter(Objects::nonNull)
                .distinct()
                .toList();
    }

    @Override
    public Integer getRequestedTimeoutSeconds(Map<String, Object> parameters) {
        Object timeout = parameters.get(PARAM_TIMEOUT);
        return timeout instanceof Number number ? number.intValue() : null;
    }

    /**
     * Command family used as permission scope: the first word, or the first two
     * for {@code git} subcommands ({@code git status}, {@code git push}).
     */
    /**
     * Splits a command line at every point where the shell may start another
     * command: separators, pipes, background jobs, subshells and command
     * substitution. Quoting is ignored, so a quoted separator yields an extra
     * segment.
     */
    public static List<String> commandSegments(String command) {
        return Arrays.stream(COMMAND_SEPARATOR.split(command))
                .map(String::trim)
                .filter(segment -> !segment.isEmpty())
                .toList();
    }

    public static String baseCommand(String command) {
        String[] words = command.trim().split("\\s+");
        if (words.length == 0 || words[0].isEmpty()) {
            return null;
        }
        if ("git".equals(words[0]) && words.length > 1) {
            return words[0] + " " + words[1];
        }
        return words[0];
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        String command = String.valueOf(parameters.get(PARAM_COMMAND));
        int timeout = resolveTimeout(getRequestedTimeoutSeconds(parameters));

        CompletableFuture<ToolResult> result = new CompletableFuture<>();
        AtomicReference<Process> running = new AtomicReference<>();
        result.whenComplete((r, e) -> {
            if (result.isCancelled()) {
                log.info("[Bash] Cancelled: '{}'", truncate(command, 200));
                destroyTree(running.get());
            }
        });

        executor.execute(() -> {
            try {
                result.complete(executeCommand(command, timeout, running, result));
            } catch (RuntimeException e) {
                log.error("[Bash] ERROR: {}", e.getMessage(), e);
                result.complete(ToolResult.failure("Error: " + e.getMessage()));
            }
        });
        return result;
    }

    private int resolveTimeout(Integer requested) {
        if (requested == null) {
            return defaultTimeout;
        }
        return Math.max(1, Math.min(requested, maxTimeout));
    }

    private ToolResult executeCommand(String command, int timeoutSeconds, AtomicReference<Process> running,
            CompletableFuture<ToolResult> result) {
        log.info("[Bash] Command: '{}' (timeout {}s)", truncate(command, 200), timeoutSeconds);
        ProcessBuilder pb = new ProcessBuilder();
        String os = System.getProperty("os.name").toLowerCase(Locale.ROOT);
        if (os.contains("win")) {
            pb.command("cmd.exe", "/c", command);
        } else {
            pb.command("/bin/sh", "-c", command);
        }
        pb.directory(workspaceRoot.toFile());
        pb.redirectErrorStream(true);

        Map<String, String> env = pb.environment();
        env.keySet().retainAll(allowedEnvVars);
        env.put("PWD", workspaceRoot.toString());

        long startTime = System.currentTimeMillis();
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            return ToolResult.failure("Failed to start command: " + e.getMessage());
        }
        running.set(process);
        if (result.isDone()) {
            destroyTree(process);
            return ToolResult.failure(ToolFailureKind.SUPERSEDED, "Command cancelled");
        }

        Future<String> outputFuture = executor.submit(() -> readOutput(process));
        try {
            boolean completed = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);
            long duration = System.currentTimeMillis() - startTime;
            if (!completed) {
                destroyTree(process);
                log.warn("[Bash] Timed out after {}s: '{}'", timeoutSeconds, truncate(command, 200));
                return ToolResult.failure(ToolFailureKind.TIMEOUT,
                        "Command timed out after " + timeoutSeconds + " seconds");
            }

            String output;
            try {
                output = outputFuture.get(1, TimeUnit.SECONDS);
            } catch (TimeoutException e) {
                outputFuture.cancel(true);
                output = "[Output read timeout]";
            } catch (ExecutionException e) {
                output = "[Output unavailable: " + e.getCause().getMessage() + "]";
            }
            if (output.length() > maxOutputChars) {
                output = output.substring(0, maxOutputChars) + "\n[Output truncated...]";
            }

            int exitCode = process.exitValue();
            log.info("[Bash] Exit code {} in {}ms", exitCode, duration);
            Map<String, Object> data = Map.of(
                    "exitCode", exitCode,
                    "duration", duration,
                    PARAM_COMMAND, command);
            if (exitCode == 0) {
                String trimmed = output.strip();
                return ToolResult.success(trimmed.isEmpty() ? "(no output)" : trimmed, data);
            }
            return ToolResult.builder()
                    .success(false)
                    .failureKind(ToolFailureKind.EXECUTION_FAILED)
                    .error("Command failed with exit code " + exitCode + ": " + output.strip())
                    .data(data)
                    .build();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            destroyTree(process);
            return ToolResult.failure("Command interrupted");
        }
    }

    private String readOutput(Process process) throws IOException {
        StringBuilder output = new StringBuilder();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line = reader.readLine();
            while (line != null) {
                if (output.length() <= maxOutputChars) {
                    output.append(line).append('\n');
                }
                line = reader.readLine();
            }
        }
        return output.toString();
    }

    private static void destroyTree(Process process) {
        if (process == null || !process.isAlive()) {
            return;
        }
        process.descendants().forEach(ProcessHandle::destroyForcibly);
        process.destroyForcibly();
    }

    private static Set<String> buildAllowedEnvVars(String configValue) {
        if (configValue == null || configValue.isBlank()) {
            return DEFAULT_ALLOWED_ENV_VARS;
        }
        Set<String> merged = new HashSet<>(DEFAULT_ALLOWED_ENV_VARS);
        merged.addAll(Arrays.stream(configValue.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toSet()));
        return Collections.unmodifiableSet(merged);
    }

    private static String truncate(String text, int maxLen) {
        if (text == null) {
            return "<null>";
        }
        return text.length() <= maxLen ? text : text.substring(0, maxLen) + "...";
    }
}
