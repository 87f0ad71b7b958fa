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

import me.golemcore.warden.domain.model.ToolCall;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Builds the human-readable action description shown on approval prompts.
 */
@Component
public class ToolCallDescriber {

    private static final String UNKNOWN = "unknown";
    private static final String PATH = "path";
    private static final int COMMAND_LENGTH_THRESHOLD = 80;

    public String describe(ToolCall toolCall) {
        String toolName = toolCall.getName();
        Map<String, Object> args = toolCall.getArguments() != null ? toolCall.getArguments() : Map.of();

        return switch (toolName) {
        case "read_file" -> "Read file: " + stringArg(args, PATH, UNKNOWN);
        case "write_file" -> describeWrite(args);
        case "grep" -> "Search for '" + stringArg(args, "pattern", "") + "' in " + stringArg(args, PATH, ".");
        case "bash" -> describeCommand(args);
        default -> toolName + ": " + args;
        };
    }

    private String describeWrite(Map<String, Object> args) {
        Object content = args.get("content");
        int length = content != null ? content.toString().length() : 0;
        return "Write file: " + stringArg(args, PATH, UNKNOWN) + " (" + length + " chars)";
    }

    private String describeCommand(Map<String, Object> args) {
        String command = stringArg(args, "command", UNKNOWN);
        if (command.length() > COMMAND_LENGTH_THRESHOLD) {
            command = command.substring(0, COMMAND_LENGTH_THRESHOLD) + "...";
        }
        return "Run command: " + command;
    }

    private static String stringArg(Map<String, Object> args, String name, String fallback) {
        Object value = args.get(name);
        return value != null ? value.toString() : fallback;
    }
}
