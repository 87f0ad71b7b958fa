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

import java.nio.file.Path;

/**
 * Outcome of a {@link SecurityGate} check.
 *
 * <p>
 * {@code reason} is the internal explanation that goes to the log. The model
 * only ever sees {@link #describeForModel(String)}.
 *
 * @param allowed
 *            whether the target passed every rule
 * @param kind
 *            which rule blocked the target, {@link Kind#NONE} when allowed
 * @param reason
 *            internal reason, for logs
 * @param category
 *            short public label of a blocked command family, or null
 * @param resolvedPath
 *            symlink-resolved absolute path for allowed path checks, or null
 */
public record GateVerdict(boolean allowed, Kind kind, String reason, String category, Path resolvedPath) {

    public enum Kind {
        NONE, OUTSIDE_WORKSPACE, IGNORED, SENSITIVE_PATH, INVALID_PATH, DANGEROUS_COMMAND
    }

    public static GateVerdict allowedPath(Path resolvedPath) {
        return new GateVerdict(true, Kind.NONE, null, null, resolvedPath);
    }

    public static GateVerdict allowedCommand() {
        return new GateVerdict(true, Kind.NONE, null, null, null);
    }

    public static GateVerdict blocked(Kind kind, String reason) {
        return new GateVerdict(false, kind, reason, null, null);
    }

    public static GateVerdict blockedCommand(String category, String reason) {
        return new GateVerdict(false, Kind.DANGEROUS_COMMAND, reason, category, null);
    }

    public boolean isBlocked() {
        return !allowed;
    }

    /**
     * User-facing explanation handed to the model in place of the tool result.
     *
     * @param target
     *            the path or command as the model requested it
     */
    public String describeForModel(String target) {
        return switch (kind) {
        case NONE -> "Allowed.";
        case IGNORED -> "I cannot access '" + target
                + "' because it's protected by the project's ignore file. "
                + "This file or directory has been marked as private or sensitive by the project owner.";
        case SENSITIVE_PATH -> "I cannot access '" + target
                + "' because it's a protected system file or directory. "
                + "Access to this location is blocked for security reasons.";
        case OUTSIDE_WORKSPACE -> "I cannot access '" + target
                + "' because it's outside the current project directory. "
                + "I can only access files within the project.";
        case INVALID_PATH -> "I cannot access '" + target + "' because the path could not be resolved.";
        case DANGEROUS_COMMAND -> "I cannot run this command because it matches a blocked pattern ("
                + category + "). This kind of command is never allowed, regardless of approvals.";
        };
    }
}
