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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.warden.domain.model.Attachment;
import me.golemcore.warden.domain.model.ChatSession;
import me.golemcore.warden.domain.model.Message;
import me.golemcore.warden.domain.model.Source;
import me.golemcore.warden.domain.model.TokenUsage;
import me.golemcore.warden.domain.model.TurnRecord;
import me.golemcore.warden.port.outbound.SessionPort;
import me.golemcore.warden.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Durable chat sessions: one JSON document per session under
 * {@code sessions/<id>.json}, written atomically.
 *
 * <p>
 * Every mutation works on a copy of the cached session, writes it, and only
 * then replaces the cached instance, so a failed write leaves the previously
 * committed state in place. Writes to one session are serialized by a
 * per-session lock; different sessions write concurrently. Attachment bytes go
 * to the {@link ContentBlobStore}: references are taken before the session
 * file is written and handed back if the write fails.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SessionService implements SessionPort {

    private static final String SESSIONS_DIR = "sessions";
    private static final String JSON_EXTENSION = ".json";
    private static final Pattern SESSION_ID = Pattern.compile("[A-Za-z0-9_-]{1,64}");

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final ContentBlobStore blobStore;

    private final Map<String, ChatSession> sessionCache = new ConcurrentHashMap<>();
    private final Map<String, Object> locks = new ConcurrentHashMap<>();

    @PostConstruct
    public void reconcileBlobReferences() {
        Map<String, Integer> counts = new HashMap<>();
        for (ChatSession session : listAll()) {
            for (Message message : session.getMessages()) {
                for (Source source : message.getSources()) {
                    counts.merge(source.getContentHash(), 1, Integer::sum);
                }
            }
        }
        blobStore.reconcile(counts);
    }

    @Override
    public ChatSession getOrCreate(String sessionId) {
        if (sessionId != null && !sessionId.isBlank()) {
            validateId(sessionId);
            synchronized (lockFor(sessionId)) {
                Optional<ChatSession> existing = get(sessionId);
                if (existing.isPresent()) {
                    return existing.get();
                }
                return create(sessionId);
            }
        }
        String id = UUID.randomUUID().toString();
        synchronized (lockFor(id)) {
            return create(id);
        }
    }

    @Override
    public Optional<ChatSession> get(String sessionId) {
        if (sessionId == null || !SESSION_ID.matcher(sessionId).matches()) {
            return Optional.empty();
        }
        ChatSession cached = sessionCache.get(sessionId);
        if (cached != null) {
            return Optional.of(cached);
        }
        Optional<ChatSession> loaded = load(sessionId + JSON_EXTENSION);
        loaded.ifPresent(session -> sessionCache.putIfAbsent(sessionId, session));
        return loaded.map(session -> sessionCache.get(sessionId));
    }

    @Override
    public Message appendUserMessage(String sessionId, String content, List<Attachment> attachments) {
        synchronized (lockFor(sessionId)) {
            ChatSession working = copy(require(sessionId));

            List<Source> sources = new ArrayList<>();
            List<String> taken = new ArrayList<>();
            try {
                for (Attachment attachment : attachments != null ? attachments : List.<Attachment>of()) {
                    byte[] bytes = attachment.getContent() != null
                            ? attachment.getContent().getBytes(StandardCharsets.UTF_8)
                            : new byte[0];
                    String hash = blobStore.put(bytes);
                    taken.add(hash);
                    sources.add(Source.builder()
                            .title(attachment.getFilename())
                            .contentHash(hash)
                            .size(bytes.length)
                            .build());
                }

                if (working.getMessages().isEmpty()) {
                    working.setTitle(ChatSession.titleFrom(content));
                }
                Instant now = clock.instant();
                Message message = Message.builder()
                        .id(UUID.randomUUID().toString())
                        .sessionId(sessionId)
                        .role(Message.ROLE_USER)
                        .ordinal(working.nextOrdinal())
                        .content(content)
                        .sources(sources)
                        .timestamp(now)
                        .build();
                working.getMessages().add(message);
                working.setUpdatedAt(now);

                persist(working);
                log.debug("[Session] {} user message #{} ({} sources)", sessionId, message.getOrdinal(),
                        sources.size());
                return message;
            } catch (RuntimeException e) {
                releaseTaken(sessionId, taken, e);
                throw e;
            }
        }
    }

    private void releaseTaken(String sessionId, List<String> taken, RuntimeException cause) {
        if (taken.isEmpty()) {
            return;
        }
        try {
            blobStore.release(taken);
        } catch (RuntimeException e) {
            log.warn("[Session] {} could not release {} blob references after a failed write", sessionId,
                    taken.size(), e);
            cause.addSuppressed(e);
        }
    }

    @Override
    public Message commitTurn(String sessionId, TurnRecord turn) {
        synchronized (lockFor(sessionId)) {
            ChatSession working = copy(require(sessionId));
            Instant now = clock.instant();
            Message message = Message.builder()
                    .id(turn.getMessageId() != null ? turn.getMessageId() : UUID.randomUUID().toString())
                    .sessionId(sessionId)
                    .role(Message.ROLE_ASSISTANT)
                    .ordinal(working.nextOrdinal())
                    .content(turn.getContent())
                    .reasoning(turn.getReasoning())
                    .toolInvocations(new ArrayList<>(turn.getToolInvocations()))
                    .thinkingSteps(new ArrayList<>(turn.getThinkingSteps()))
                    .timestamp(now)
                    .build();
            working.getMessages().add(message);
            if (working.getModelId() == null) {
                working.setModelId(turn.getModelId());
            }
            TokenUsage usage = working.getTokenUsage();
            if (turn.getContextWindow() > 0) {
                usage.applyContextWindow(turn.getContextWindow());
            }
            usage.add(turn.getUsage());
            working.setUpdatedAt(now);

            persist(working);
            if (usage.isApproachingLimit()) {
                log.warn("[Session] {} has used {}% of its {} token context window", sessionId,
                        Math.round(usage.getContextUtilization() * 100), usage.getContextWindow());
            }
            log.info("[Session] {} committed turn #{} ({} tool invocations{})", sessionId, message.getOrdinal(),
                    message.getToolInvocations().size(), turn.isInterrupted() ? ", interrupted" : "");
            return message;
        }
    }

    @Override
    public ChatSession rename(String sessionId, String title) {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("Title must not be blank");
        }
        synchronized (lockFor(sessionId)) {
            ChatSession working = copy(require(sessionId));
            working.setTitle(ChatSession.titleFrom(title));
            working.setUpdatedAt(clock.instant());
            persist(working);
            return working;
        }
    }

    @Override
    public void removeSource(String sessionId, long ordinal, int sourceIndex) {
        String hash;
        synchronized (lockFor(sessionId)) {
            ChatSession working = copy(require(sessionId));
            Message message = working.getMessages().stream()
                    .filter(m -> m.getOrdinal() == ordinal)
                    .findFirst()
                    .orElseThrow(() -> new NoSuchElementException(
                            "Message #" + ordinal + " not found in session " + sessionId));
            if (sourceIndex < 0 || sourceIndex >= message.getSources().size()) {
                throw new IllegalArgumentException("Source index out of range: " + sourceIndex);
            }
            hash = message.getSources().remove(sourceIndex).getContentHash();
            working.setUpdatedAt(clock.instant());
            persist(working);
            blobStore.release(List.of(hash));
        }
        log.info("[Session] {} removed source {} of message #{}", sessionId, sourceIndex, ordinal);
    }

    @Override
    public void delete(String sessionId) {
        synchronized (lockFor(sessionId)) {
            ChatSession session = require(sessionId);
            try {
                storagePort.deleteObject(SESSIONS_DIR, sessionId + JSON_EXTENSION).join();
            } catch (CompletionException e) {
                throw new StoragePort.StorageException("Failed to delete session " + sessionId, e.getCause());
            }
            sessionCache.remove(sessionId);
            blobStore.release(session.getMessages().stream()
                    .flatMap(message -> message.getSources().stream())
                    .map(Source::getContentHash)
                    .toList());
        }
        locks.remove(sessionId);
        log.info("[Session] Deleted session: {}", sessionId);
    }

    @Override
    public List<ChatSession> listAll() {
        try {
            List<String> files = storagePort.listObjects(SESSIONS_DIR, "").join();
            for (String file : files) {
                if (!file.endsWith(JSON_EXTENSION) || file.contains("/")) {
                    continue;
                }
                String id = file.substring(0, file.length() - JSON_EXTENSION.length());
                if (!sessionCache.containsKey(id)) {
                    load(file).ifPresent(session -> sessionCache.putIfAbsent(id, session));
                }
            }
        } catch (CompletionException e) {
            log.warn("[Session] Failed to scan sessions directory: {}", e.getMessage());
        }
        return sessionCache.values().stream()
                .sorted(Comparator.comparing(ChatSession::getUpdatedAt,
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .toList();
    }

    @Override
    public Optional<byte[]> readContent(String contentHash) {
        return blobStore.read(contentHash);
    }

    private ChatSession create(String sessionId) {
        Instant now = clock.instant();
        ChatSession session = ChatSession.builder()
                .id(sessionId)
                .title(ChatSession.titleFrom(null))
                .createdAt(now)
                .updatedAt(now)
                .build();
        sessionCache.put(sessionId, session);
        log.info("[Session] Created new session: {}", sessionId);
        return session;
    }

    private ChatSession require(String sessionId) {
        return get(sessionId).orElseThrow(() -> new NoSuchElementException("Session not found: " + sessionId));
    }

    private Optional<ChatSession> load(String file) {
        String json;
        try {
            json = storagePort.getText(SESSIONS_DIR, file).join();
        } catch (CompletionException e) {
            throw new StoragePort.StorageException("Failed to read session file " + file, e.getCause());
        }
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, ChatSession.class));
        } catch (JsonProcessingException e) {
            log.warn("[Session] Failed to parse session file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    private void persist(ChatSession session) {
        String json;
        try {
            json = objectMapper.writeValueAsString(session);
        } catch (JsonProcessingException e) {
            throw new StoragePort.StorageException("Failed to serialize session " + session.getId(), e);
        }
        try {
            storagePort.putTextAtomic(SESSIONS_DIR, session.getId() + JSON_EXTENSION, json).join();
        } catch (CompletionException e) {
            log.error("[Session] Failed to save session: {}", session.getId(), e.getCause());
            throw new StoragePort.StorageException("Failed to save session " + session.getId(), e.getCause());
        }
        sessionCache.put(session.getId(), session);
    }

    private ChatSession copy(ChatSession session) {
        try {
            return objectMapper.readValue(objectMapper.writeValueAsBytes(session), ChatSession.class);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to copy session " + session.getId(), e);
        }
    }

    private Object lockFor(String sessionId) {
        return locks.computeIfAbsent(sessionId, id -> new Object());
    }

    private static void validateId(String sessionId) {
        if (!SESSION_ID.matcher(sessionId).matches()) {
            throw new IllegalArgumentException("Invalid session id: " + sessionId);
        }
    }
}
