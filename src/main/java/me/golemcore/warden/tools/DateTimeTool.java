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

import lombok.RequiredArgsConstructor;
import me.golemcore.warden.domain.component.ToolComponent;
import me.golemcore.warden.domain.model.ToolDefinition;
import me.golemcore.warden.domain.model.ToolFailureKind;
import me.golemcore.warden.domain.model.ToolResult;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Tool returning the current date and time in RFC 3339 format, either in UTC
 * or in the server's local zone.
 *
 * <p>
 * Always enabled.
 */
@Component
@RequiredArgsConstructor
public class DateTimeTool implements ToolComponent {

    private static final String PARAM_TIMEZONE = "timezone";

    private final Clock clock;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name("now")
                .description("Get the current date and time in RFC 3339 format. "
                        + "Only use this when the user specifically asks for it or when current datetime is needed.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                PARAM_TIMEZONE, Map.of(
                                        "type", "string",
                                        "enum", List.of("local", "utc"),
                                        "description",
                                        "'local' for local time (default) or 'utc' for UTC time.")),
                        "required", List.of()))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        String timezone = String.valueOf(parameters.getOrDefault(PARAM_TIMEZONE, "local"))
                .trim().toLowerCase(Locale.ROOT);
        ZoneId zone;
        switch (timezone) {
        case "utc" -> zone = ZoneOffset.UTC;
        case "local", "" -> zone = clock.getZone();
        default -> {
            return CompletableFuture.completedFuture(ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS,
                    "Invalid timezone '" + timezone + "', expected 'local' or 'utc'"));
        }
        }
        OffsetDateTime now = OffsetDateTime.ofInstant(clock.instant(), zone);
        String formatted = now.format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
        return CompletableFuture.completedFuture(ToolResult.success(formatted,
                Map.of("datetime", formatted, PARAM_TIMEZONE, timezone.isEmpty() ? "local" : timezone)));
    }
}
