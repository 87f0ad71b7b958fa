package me.golemcore.warden.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.warden.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.warden.domain.model.Attachment;
import me.golemcore.warden.domain.model.ChatSession;
import me.golemcore.warden.domain.model.Message;
import me.golemcore.warden.domain.model.ThinkingStep;
import me.golemcore.warden.domain.model.TokenUsage;
import me.golemcore.warden.domain.model.ToolInvocation;
import me.golemcore.warden.domain.model.ToolInvocationStatus;
import me.golemcore.warden.domain.model.TurnRecord;
import me.golemcore.warden.infrastructure.config.AutoConfiguration;
import me.golemcore.warden.infrastructure.config.WardenProperties;
import me.golemcore.warden.port.outbound.StoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doCallRealMethod;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.spy;

class SessionServiceTest {

    private static final String SESSION_ID = "session-1";

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storage;
    private final ObjectMapper objectMapper = AutoConfiguration.objectMapper();

    @BeforeEach
    void setUp() {
        WardenProperties properties = new WardenProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        storage = new LocalStorageAdapter(properties);
        storage.init();
    }

    private SessionService newService(StoragePort storagePort) {
        ContentBlobStore blobStore = new ContentBlobStore(storagePort, objectMapper, Clock.systemUTC());
        blobStore.init();
        SessionService service = new SessionService(storagePort, objectMapper, Clock.systemUTC(), blobStore);
        service.reconcileBlobReferences();
        return service;
    }

    private SessionService newService() {
        return newService(storage);
    }

    private static Attachment attachment(String name, String content) {
        return Attachment.builder().filename(name).content(content).build();
    }

    private static TurnRecord turn(String content) {
        return TurnRecord.builder()
                .messageId("assistant-1")
                .content(content)
                .modelId("local-model")
                .build();
    }

    @Test
    void newSessionIsNotWrittenUntilFirstMessage() {
        SessionService service = newService();

        ChatSession session = service.getOrCreate(null);

        assertNotNull(session.getId());
        assertEquals("New chat", session.getTitle());
        assertFalse(Files.exists(tempDir.resolve("sessions").resolve(session.getId() + ".json")));

        service.appendUserMessage(session.getId(), "Hello", List.of());
        assertTrue(Files.exists(tempDir.resolve("sessions").resolve(session.getId() + ".json")));
    }

    @Test
    void rejectsInvalidSessionId() {
        SessionService service = newService();

        assertThrows(IllegalArgumentException.class, () -> service.getOrCreate("../escape"));
        assertTrue(service.get("../escape").isEmpty());
    }

    @Test
    void firstMessageSetsTitleAndOrdinals() {
        SessionService service = newService();
        service.getOrCreate(SESSION_ID);

        Message first = service.appendUserMessage(SESSION_ID, "  Refactor   the\nparser  ", List.of());
        Message reply = service.commitTurn(SESSION_ID, turn("Done."));
        Message second = service.appendUserMessage(SESSION_ID, "Thanks", List.of());

        assertEquals(1, first.getOrdinal());
        assertEquals(2, reply.getOrdinal());
        assertEquals(3, second.getOrdinal());
        assertEquals("Refactor the parser", service.get(SESSION_ID).orElseThrow().getTitle());
    }

    @Test
    void reloadedSessionEqualsCommittedOne() {
        SessionService service = newService();
        service.getOrCreate(SESSION_ID);
        service.appendUserMessage(SESSION_ID, "Check this file", List.of(attachment("notes.txt", "some notes")));
        TurnRecord turn = TurnRecord.builder()
                .messageId("assistant-1")
                .content("I ran the command.")
                .reasoning("Need to list files")
                .modelId("local-model")
                .toolInvocations(List.of(ToolInvocation.builder()
                        .messageId("assistant-1")
                        .toolCallId("call_1")
                        .toolName("bash")
                        .arguments(Map.of("command", "ls"))
                        .result("notes.txt")
                        .status(ToolInvocationStatus.COMPLETED)
                        .completedAt(Instant.parse("2026-03-01T12:00:00Z"))
                        .build()))
                .thinkingSteps(List.of(
                        ThinkingStep.builder().order(0).type(ThinkingStep.StepType.REASONING)
                                .content("Need to list files").build(),
                        ThinkingStep.builder().order(1).type(ThinkingStep.StepType.TOOL)
                                .toolCallId("call_1").build()))
                .usage(TokenUsage.builder().inputTokens(100).outputTokens(20).reasoningTokens(5).build())
                .build();
        service.commitTurn(SESSION_ID, turn);
        ChatSession committed = service.get(SESSION_ID).orElseThrow();

        ChatSession reloaded = newService().get(SESSION_ID).orElseThrow();

        assertEquals(committed, reloaded);
        assertEquals(120, reloaded.getTokenUsage().getTotalTokens());
        assertEquals("local-model", reloaded.getModelId());
        assertEquals(2, reloaded.getMessages().get(1).getThinkingSteps().size());
    }

    @Test
    void modelIdIsSetOnceAndUsageAccumulates() {
        SessionService service = newService();
        service.getOrCreate(SESSION_ID);
        service.appendUserMessage(SESSION_ID, "Hi", List.of());
        service.commitTurn(SESSION_ID, TurnRecord.builder().content("a").modelId("first")
                .usage(TokenUsage.builder().inputTokens(10).outputTokens(1).build()).build());
        service.commitTurn(SESSION_ID, TurnRecord.builder().content("b").modelId("second")
                .usage(TokenUsage.builder().inputTokens(20).outputTokens(2).cacheTokens(3).build()).build());

        ChatSession session = service.get(SESSION_ID).orElseThrow();
        assertEquals("first", session.getModelId());
        assertEquals(30, session.getTokenUsage().getInputTokens());
        assertEquals(3, session.getTokenUsage().getCacheTokens());
        assertEquals(33, session.getTokenUsage().getTotalTokens());
    }

    @Test
    void committedTurnsTrackContextWindowUtilization() {
        SessionService service = newService();
        service.getOrCreate(SESSION_ID);
        service.appendUserMessage(SESSION_ID, "Hi", List.of());
        TurnRecord first = turn("a");
        first.setContextWindow(1000);
        first.setUsage(TokenUsage.builder().inputTokens(500).outputTokens(100).build());
        service.commitTurn(SESSION_ID, first);

        TokenUsage usage = service.get(SESSION_ID).orElseThrow().getTokenUsage();
        assertEquals(1000, usage.getContextWindow());
        assertEquals(0.6, usage.getContextUtilization(), 1e-9);
        assertFalse(usage.isApproachingLimit());

        TurnRecord second = turn("b");
        second.setContextWindow(1000);
        second.setUsage(TokenUsage.builder().inputTokens(250).outputTokens(50).build());
        service.commitTurn(SESSION_ID, second);

        TokenUsage reloaded = newService().get(SESSION_ID).orElseThrow().getTokenUsage();
        assertEquals(0.9, reloaded.getContextUtilization(), 1e-9);
        assertTrue(reloaded.isApproachingLimit());
    }

    @Test
    void identicalAttachmentsShareOneBlob() {
        SessionService service = newService();
        service.getOrCreate("a");
        service.getOrCreate("b");
        service.appendUserMessage("a", "first", List.of(attachment("x.txt", "same body")));
        service.appendUserMessage("b", "second", List.of(attachment("y.txt", "same body")));
        String hash = ContentBlobStore.hash("same body".getBytes(StandardCharsets.UTF_8));
        Path blob = tempDir.resolve("blobs").resolve(hash + ".gz");

        assertArrayEquals("same body".getBytes(StandardCharsets.UTF_8), service.readContent(hash).orElseThrow());

        service.delete("a");
        assertTrue(Files.exists(blob));
        assertTrue(service.get("a").isEmpty());

        service.removeSource("b", 1, 0);
        assertFalse(Files.exists(blob));
        assertTrue(service.get("b").orElseThrow().getMessages().get(0).getSources().isEmpty());
    }

    @Test
    void removeSourceValidatesTarget() {
        SessionService service = newService();
        service.getOrCreate(SESSION_ID);
        service.appendUserMessage(SESSION_ID, "with file", List.of(attachment("x.txt", "body")));

        assertThrows(NoSuchElementException.class, () -> service.removeSource(SESSION_ID, 9, 0));
        assertThrows(IllegalArgumentException.class, () -> service.removeSource(SESSION_ID, 1, 3));
    }

    @Test
    void renameValidatesTitleAndSession() {
        SessionService service = newService();
        service.getOrCreate(SESSION_ID);
        service.appendUserMessage(SESSION_ID, "Hello", List.of());

        assertEquals("Parser work", service.rename(SESSION_ID, "Parser work").getTitle());
        assertThrows(IllegalArgumentException.class, () -> service.rename(SESSION_ID, " "));
        assertThrows(NoSuchElementException.class, () -> service.rename("missing", "Title"));
    }

    @Test
    void failedWriteKeepsCommittedState() {
        StoragePort failing = spy(storage);
        SessionService service = newService(failing);
        service.getOrCreate(SESSION_ID);
        service.appendUserMessage(SESSION_ID, "kept", List.of());
        doReturn(CompletableFuture.failedFuture(new IOException("disk full")))
                .when(failing).putTextAtomic(eq("sessions"), anyString(), anyString());

        assertThrows(StoragePort.StorageException.class, () -> service.commitTurn(SESSION_ID, turn("lost")));

        ChatSession session = service.get(SESSION_ID).orElseThrow();
        assertEquals(1, session.getMessages().size());
        assertEquals("kept", session.getMessages().get(0).getContent());
    }

    @Test
    void failedAppendHandsBackBlobReferences() {
        StoragePort failing = spy(storage);
        SessionService service = newService(failing);
        service.getOrCreate("a");
        service.getOrCreate("b");
        service.appendUserMessage("a", "first", List.of(attachment("shared.txt", "shared body")));
        Path shared = tempDir.resolve("blobs")
                .resolve(ContentBlobStore.hash("shared body".getBytes(StandardCharsets.UTF_8)) + ".gz");
        Path fresh = tempDir.resolve("blobs")
                .resolve(ContentBlobStore.hash("fresh body".getBytes(StandardCharsets.UTF_8)) + ".gz");
        doReturn(CompletableFuture.failedFuture(new IOException("disk full")))
                .when(failing).putTextAtomic(eq("sessions"), anyString(), anyString());

        assertThrows(StoragePort.StorageException.class, () -> service.appendUserMessage("b", "second",
                List.of(attachment("shared.txt", "shared body"), attachment("fresh.txt", "fresh body"))));

        assertFalse(Files.exists(fresh));
        assertTrue(Files.exists(shared));
        assertTrue(service.get("b").orElseThrow().getMessages().isEmpty());

        doCallRealMethod().when(failing).putTextAtomic(eq("sessions"), anyString(), anyString());
        service.removeSource("a", 1, 0);
        assertFalse(Files.exists(shared));
    }

    @Test
    void concurrentRemoveAndAppendKeepSharedContentReadable() throws Exception {
        SessionService service = newService();
        byte[] body = "shared body".getBytes(StandardCharsets.UTF_8);
        String hash = ContentBlobStore.hash(body);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            for (int i = 0; i < 20; i++) {
                String owner = "owner-" + i;
                String reader = "reader-" + i;
                service.getOrCreate(owner);
                service.getOrCreate(reader);
                service.appendUserMessage(owner, "first", List.of(attachment("x.txt", "shared body")));
                CountDownLatch start = new CountDownLatch(1);
                Future<?> remove = pool.submit(() -> {
                    start.await();
                    service.removeSource(owner, 1, 0);
                    return null;
                });
                Future<?> append = pool.submit(() -> {
                    start.await();
                    service.appendUserMessage(reader, "second", List.of(attachment("y.txt", "shared body")));
                    return null;
                });
                start.countDown();
                remove.get(5, TimeUnit.SECONDS);
                append.get(5, TimeUnit.SECONDS);

                assertArrayEquals(body, service.readContent(hash).orElseThrow());
                service.delete(reader);
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void listAllIsNewestFirst() throws InterruptedException {
        SessionService service = newService();
        service.getOrCreate("older");
        service.appendUserMessage("older", "one", List.of());
        Thread.sleep(20);
        service.getOrCreate("newer");
        service.appendUserMessage("newer", "two", List.of());

        List<String> ids = newService().listAll().stream().map(ChatSession::getId).toList();

        assertEquals(List.of("newer", "older"), ids);
    }

    @Test
    void startupReconcileRestoresBlobReferences() throws IOException {
        SessionService service = newService();
        service.getOrCreate(SESSION_ID);
        service.appendUserMessage(SESSION_ID, "file", List.of(attachment("a.txt", "alpha")));
        String hash = ContentBlobStore.hash("alpha".getBytes(StandardCharsets.UTF_8));
        Files.delete(tempDir.resolve("blobs").resolve("index.json"));

        SessionService restarted = newService();

        assertArrayEquals("alpha".getBytes(StandardCharsets.UTF_8), restarted.readContent(hash).orElseThrow());
    }
}
