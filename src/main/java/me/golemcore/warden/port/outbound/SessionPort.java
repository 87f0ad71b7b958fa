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

package me.golemcore.warden.port.outbound;

import me.golemcore.warden.domain.model.Attachment;
import me.golemcore.warden.domain.model.ChatSession;
import me.golemcore.warden.domain.model.Message;
import me.golemcore.warden.domain.model.TurnRecord;

import java.util.List;
import java.util.Optional;

/**
 * Durable, ordered record of chat sessions. Every write is atomic for its
 * session: on failure the previously committed state stays as it was.
 */
public interface SessionPort {

    /**
     * Returns the session with the given id, or creates a new one when the id is
     * null or unknown.
     */
    ChatSession getOrCreate(String sessionId);

    Optional<ChatSession> get(String sessionId);

    /**
     * Appends a user message and stores its attachments as deduplicated blobs.
     */
    Message appendUserMessage(String sessionId, String content, List<Attachment> attachments);

    /**
     * Writes a completed (or interrupted) assistant turn in one atomic unit.
     */
    Message commitTurn(String sessionId, TurnRecord turn);

    ChatSession rename(String sessionId, String title);

    /**
     * Detaches one source from a message and releases its blob reference.
     */
    void removeSource(String sessionId, long ordinal, int sourceIndex);

    void delete(String sessionId);

    List<ChatSession> listAll();

    /**
     * Decompressed content of a stored attachment.
     */
    Optional<byte[]> readContent(String contentHash);
}
