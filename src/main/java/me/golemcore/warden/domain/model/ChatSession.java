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

package me.golemcore.warden.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A persisted conversation. Created on the first message, updated on every
 * turn, removed only by an explicit delete.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ChatSession {

    private static final int MAX_TITLE_LENGTH = 100;
    private static final int MAX_PREVIEW_LENGTH = 100;

    private String id;
    private String title;
    private String modelId;
    private Instant createdAt;
    private Instant updatedAt;

    @Builder.Default
    private TokenUsage tokenUsage = TokenUsage.empty();

    @Builder.Default
    private List<Message> messages = new ArrayList<>();

    /**
     * Ordinal the next appended message must carry.
     */
    public long nextOrdinal() {
        if (messages == null || messages.isEmpty()) {
            return 1;
        }
        return messages.get(messages.size() - 1).getOrdinal() + 1;
    }

    /**
     * Start of the first user message, for session lists. Null while the
     * session has no user message.
     */
    public String preview() {
        if (messages == null) {
            return null;
        }
        return messages.stream()
                .filter(Message::isUserMessage)
                .map(Message::getContent)
                .filter(Objects::nonNull)
                .findFirst()
                .map(content -> content.length() > MAX_PREVIEW_LENGTH
                        ? content.substring(0, MAX_PREVIEW_LENGTH) + "..."
                        : content)
                .orElse(null);
    }

    /**
     * Builds a title from the first user message: whitespace collapsed, at most
     * 100 characters.
     */
    public static String titleFrom(String firstMessage) {
        if (firstMessage == null || firstMessage.isBlank()) {
            return "New chat";
        }
        String collapsed = firstMessage.strip().replaceAll("\\s+", " ");
        if (collapsed.length() <= MAX_TITLE_LENGTH) {
            return collapsed;
        }
        return collapsed.substring(0, MAX_TITLE_LENGTH - 3) + "...";
    }
}
