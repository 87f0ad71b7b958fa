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

package me.golemcore.warden.security;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.warden.infrastructure.config.WardenProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Absolute validation layer for every path and command a tool call carries.
 *
 * <p>
 * The gate is consulted before the permission policy, before any human
 * approval, and once more right before execution. Nothing configures it off:
 * an allow rule or an "approve" click never overrides a blocked verdict.
 *
 * <p>
 * Paths are resolved first (relative to the workspace root, {@code ~}
 * expanded, symlinks followed even when the final target does not exist yet)
 * and only then checked against:
 * <ul>
 * <li>the built-in sensitive-system-path blacklist
 * <li>the workspace root boundary
 * <li>the project ignore list ({@code .wardenignore} plus configured globs);
 * the ignore file itself is always protected
 * </ul>
 *
 * <p>
 * Commands are matched against a fixed set of destructive patterns: recursive
 * delete, privilege escalation, permission changes, raw device access,
 * outbound network fetch and process termination.
 *
 * <p>
 * Holds no mutable state. The ignore file is re-read on each check so edits to
 * it apply immediately.
 */
@Component
@Slf4j
public class SecurityGate {

    private static final int MAX_LINK_DEPTH = 40;

    private static final List<String> SYSTEM_BLACKLIST = List.of(
            "/etc", "/bin", "/sbin", "/usr/bin", "/usr/sbin", "/boot", "/dev", "/sys", "/proc",
            "C:\\Windows\\System32", "C:\\Windows\\SysWOW64");

    private static final List<String> HOME_BLACKLIST = List.of(
            ".ssh", ".gnupg", ".aws", ".kube", ".config/gcloud", ".docker/config.json");

    private static final String RECURSIVE_DELETE = "recursive delete";
    private static final String PRIVILEGE_ESCALATION = "privilege escalation";
    private static final String PERMISSION_CHANGE = "permission change";
    private static final String RAW_DEVICE = "raw device access";
    private static final String NETWORK_FETCH = "network fetch";
    private static final String PROCESS_TERMINATION = "process termination";

    private static final String COMMAND_START = "(?:^|[;&|(`]\\s*|\\$\\(\\s*)";

    private static final List<BlockedPattern> BLOCKED_COMMANDS = List.of(
            new BlockedPattern(RECURSIVE_DELETE,
                    Pattern.compile("\\brm\\s+(?:[^;&|]*\\s)?-(?:-recursive|-force|[a-zA-Z]*[rRf])")),
            new BlockedPattern(RECURSIVE_DELETE, Pattern.compile("\\bfind\\b[^;&|]*\\s-delete\\b")),
            new BlockedPattern(RECURSIVE_DELETE, Pattern.compile(":\\(\\)\\s*\\{")),
            new BlockedPattern(PRIVILEGE_ESCALATION, Pattern.compile("\\b(?:sudo|doas|pkexec)\\b")),
            new BlockedPattern(PRIVILEGE_ESCALATION, Pattern.compile(COMMAND_START + "su(?:\\s|$)")),
            new BlockedPattern(PERMISSION_CHANGE, Pattern.compile("\\b(?:chmod|chown|chgrp|setfacl)\\b")),
            new BlockedPattern(RAW_DEVICE, Pattern.compile(COMMAND_START + "dd\\s")),
            new BlockedPattern(RAW_DEVICE, Pattern.compile("\\b(?:mkfs(?:\\.\\w+)?|fdisk|parted|wipefs)\\b")),
            new BlockedPattern(RAW_DEVICE, Pattern.compile(">\\s*/dev/(?!null\\b|stdout\\b|stderr\\b)")),
            new BlockedPattern(NETWORK_FETCH,
                    Pattern.compile("\\b(?:curl|wget|nc|ncat|netcat|scp|sftp|ftp|rsync|telnet)\\b")),
            new BlockedPattern(PROCESS_TERMINATION, Pattern.compile("\\b(?:kill|pkill|killall)\\b")),
            new BlockedPattern(PROCESS_TERMINATION, Pattern.compile("\\b(?:shutdown|reboot|halt|poweroff)\\b")));

    private final Path workspaceRoot;
    private final String ignoreFileName;
    private final List<String> configuredIgnoreGlobs;
    private final Path homeDirectory;

    @Autowired
    public SecurityGate(WardenProperties properties) {
        this(properties.getWorkspace().resolveRoot(),
                properties.getWorkspace().getIgnoreFile(),
                properties.getWorkspace().getIgnorePatterns(),
                Paths.get(System.getProperty("user.home")));
    }

    public SecurityGate(Path workspaceRoot, String ignoreFileName, List<String> configuredIgnoreGlobs,
            Path homeDirectory) {
        this.workspaceRoot = workspaceRoot.toAbsolutePath().normalize();
        this.ignoreFileName = ignoreFileName;
        this.configuredIgnoreGlobs = configuredIgnoreGlobs != null ? List.copyOf(configuredIgnoreGlobs) : List.of();
        this.homeDirectory = homeDirectory.toAbsolutePath().normalize();
    }

    public Path getWorkspaceRoot() {
        return workspaceRoot;
    }

    public GateVerdict validatePath(String path) {
        return validatePath(path, workspaceRoot);
    }

    /**
     * Resolves the path against the workspace root and validates the resolved
     * location.
     *
     * @param path
     *            path as requested by the model, absolute or relative
     * @param root
     *            workspace root to confine the path to
     */
    public GateVerdict validatePath(String path, Path root) {
        if (path == null || path.isBlank()) {
            return logVerdict(path, GateVerdict.blocked(GateVerdict.Kind.INVALID_PATH, "empty path"));
        }

        Path realRoot;
        Path resolved;
        try {
            realRoot = realize(root.toAbsolutePath().normalize(), 0);
            resolved = realize(toAbsolute(path, root), 0);
        } catch (IOException | InvalidPathException e) {
            return logVerdict(path,
                    GateVerdict.blocked(GateVerdict.Kind.INVALID_PATH, "unresolvable: " + e.getMessage()));
        }

        Optional<Path> sensitive = findSensitiveParent(resolved);
        if (sensitive.isPresent()) {
            return logVerdict(path, GateVerdict.blocked(GateVerdict.Kind.SENSITIVE_PATH,
                    resolved + " is under blacklisted " + sensitive.get()));
        }

        if (!resolved.startsWith(realRoot)) {
            return logVerdict(path, GateVerdict.blocked(GateVerdict.Kind.OUTSIDE_WORKSPACE,
                    resolved + " is outside workspace " + realRoot));
        }

        Path relative = realRoot.relativize(resolved);
        if (ignoreFileName != null && !ignoreFileName.isBlank() && relative.equals(Paths.get(ignoreFileName))) {
            return logVerdict(path, GateVerdict.blocked(GateVerdict.Kind.IGNORED, "ignore file itself"));
        }

        IgnorePatterns ignorePatterns = loadIgnorePatterns(realRoot);
        Optional<String> ignoredBy = ignorePatterns.match(relative);
        if (ignoredBy.isPresent()) {
            return logVerdict(path, GateVerdict.blocked(GateVerdict.Kind.IGNORED,
                    relative + " matches ignore pattern '" + ignoredBy.get() + "'"));
        }

        return logVerdict(path, GateVerdict.allowedPath(resolved));
    }

    /**
     * Matches a shell command against the destructive pattern set.
     */
    public GateVerdict validateCommand(String command) {
        if (command == null || command.isBlank()) {
            return logVerdict(command, GateVerdict.blockedCommand("empty command", "empty command"));
        }
        for (BlockedPattern blocked : BLOCKED_COMMANDS) {
            if (blocked.pattern().matcher(command).find()) {
                return logVerdict(command, GateVerdict.blockedCommand(blocked.category(),
                        "matches " + blocked.category() + " pattern " + blocked.pattern().pattern()));
            }
        }
        return logVerdict(command, GateVerdict.allowedCommand());
    }

    private IgnorePatterns loadIgnorePatterns(Path root) {
        Path ignoreFile = ignoreFileName == null || ignoreFileName.isBlank() ? null : root.resolve(ignoreFileName);
        return IgnorePatterns.load(ignoreFile, configuredIgnoreGlobs);
    }

    private Path toAbsolute(String rawPath, Path root) {
        String expanded = rawPath.trim();
        if (expanded.equals("~")) {
            expanded = homeDirectory.toString();
        } else if (expanded.startsWith("~/")) {
            expanded = homeDirectory.resolve(expanded.substring(2)).toString();
        }
        Path candidate = Paths.get(expanded);
        if (!candidate.isAbsolute()) {
            candidate = root.toAbsolutePath().resolve(candidate);
        }
        return candidate.normalize();
    }

    /**
     * Follows symlinks along the path, including a dangling final link, and
     * returns the canonical location the OS would touch.
     */
    private Path realize(Path path, int depth) throws IOException {
        if (depth > MAX_LINK_DEPTH) {
            throw new IOException("Too many levels of symbolic links: " + path);
        }
        if (Files.exists(path)) {
            return path.toRealPath();
        }
        if (Files.isSymbolicLink(path)) {
            Path target = Files.readSymbolicLink(path);
            Path parent = path.getParent();
            Path next = parent != null ? parent.resolve(target) : target;
            return realize(next.normalize(), depth + 1);
        }
        Path parent = path.getParent();
        if (parent == null) {
            return path;
        }
        return realize(parent, depth + 1).resolve(path.getFileName());
    }

    private Optional<Path> findSensitiveParent(Path resolved) {
        for (Path entry : blacklist()) {
            if (resolved.startsWith(entry)) {
                return Optional.of(entry);
            }
        }
        return Optional.empty();
    }

    private List<Path> blacklist() {
        List<Path> entries = new ArrayList<>();
        for (String system : SYSTEM_BLACKLIST) {
            addBlacklistEntry(entries, Paths.get(system));
        }
        for (String relative : HOME_BLACKLIST) {
            addBlacklistEntry(entries, homeDirectory.resolve(relative));
        }
        return entries;
    }

    private void addBlacklistEntry(List<Path> entries, Path entry) {
        if (!entry.isAbsolute()) {
            return;
        }
        entries.add(entry.normalize());
        try {
            Path real = realize(entry.normalize(), 0);
            if (!real.equals(entry.normalize())) {
                entries.add(real);
            }
        } catch (IOException e) {
            log.debug("[Gate] Could not resolve blacklist entry {}: {}", entry, e.getMessage());
        }
    }

    private GateVerdict logVerdict(String target, GateVerdict verdict) {
        if (verdict.allowed()) {
            log.debug("[Gate] Allowed: {}", target);
        } else {
            log.warn("[Gate] Blocked ({}): {} - {}", verdict.kind(), target, verdict.reason());
        }
        return verdict;
    }

    private record BlockedPattern(String category, Pattern pattern) {
    }
}
