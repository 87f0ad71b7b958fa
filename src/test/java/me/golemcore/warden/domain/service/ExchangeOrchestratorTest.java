package me.golemcore.warden.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.warden.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.warden.domain.component.ToolComponent;
import me.golemcore.warden.domain.model.ApprovalDecision;
import me.golemcore.warden.domain.model.ApprovalState;
import me.golemcore.warden.domain.model.Attachment;
import me.golemcore.warden.domain.model.ChatSession;
import me.golemcore.warden.domain.model.ExchangeEvent;
import me.golemcore.warden.domain.model.ExchangeRequest;
import me.golemcore.warden.domain.model.LlmMessage;
import me.golemcore.warden.domain.model.LlmRequest;
import me.golemcore.warden.domain.model.LlmStreamEvent;
import me.golemcore.warden.domain.model.Message;
import me.golemcore.warden.domain.model.PolicyDecision;
import me.golemcore.warden.domain.model.TokenUsage;
import me.golemcore.warden.domain.model.ToolCall;
import me.golemcore.warden.domain.model.ToolDefinition;
import me.golemcore.warden.domain.model.ToolInvocation;
import me.golemcore.warden.domain.model.ToolInvocationStatus;
import me.golemcore.warden.domain.model.ToolResult;
import me.golemcore.warden.infrastructure.config.AutoConfiguration;
import me.golemcore.warden.infrastructure.config.WardenProperties;
import me.golemcore.warden.port.outbound.LlmPort;
import me.golemcore.warden.port.outbound.PermissionPolicyPort;
import me.golemcore.warden.port.outbound.SessionPort;
import me.golemcore.warden.port.outbound.StoragePort;
import me.golemcore.warden.security.SecurityGate;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doCallRealMethod;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ExchangeOrchestratorTest {

    private static final String SESSION_ID = "session-1";
    private static final String ECHO = "echo";
    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    @TempDir
    Path tempDir;

    private LlmPort llmPort;
    private PermissionPolicyPort policy;
    private ApprovalCoordinator coordinator;
    private ExchangeRegistry exchangeRegistry;
    private SessionService sessionService;
    private EchoTool echoTool;
    private WardenProperties properties;
    private ExchangeOrchestrator orchestrator;

    @BeforeEach
    void setUp() throws IOException {
        Path workspace = Files.createDirectories(tempDir.toRealPath().resolve("workspace"));
        properties = new WardenProperties();
        properties.getWorkspace().setRoot(workspace.toString());
        properties.getStorage().getLocal().setBasePath(tempDir.resolve("data").toString());
        properties.getLlm().setSystemPrompt("You are a test assistant.");

        LocalStorageAdapter storage = new LocalStorageAdapter(properties);
        storage.init();
        ObjectMapper objectMapper = AutoConfiguration.objectMapper();
        ContentBlobStore blobStore = new ContentBlobStore(storage, objectMapper, Clock.systemUTC());
        blobStore.init();
        sessionService = new SessionService(storage, objectMapper, Clock.systemUTC(), blobStore);

        llmPort = mock(LlmPort.class);
        when(llmPort.getCurrentModel()).thenReturn("test-model");
        policy = mock(PermissionPolicyPort.class);
        when(policy.decide(anyString(), any())).thenReturn(PolicyDecision.ASK);
        coordinator = new ApprovalCoordinator(Duration.ofMinutes(10), Clock.systemUTC());
        exchangeRegistry = new ExchangeRegistry();
        echoTool = new EchoTool();

        orchestrator = newOrchestrator();
    }

    @AfterEach
    void tearDown() {
        coordinator.destroy();
    }

    private ExchangeOrchestrator newOrchestrator() {
        return newOrchestrator(sessionService);
    }

    private ExchangeOrchestrator newOrchestrator(SessionPort sessionPort) {
        ToolRegistry registry = new ToolRegistry(List.of(echoTool));
        SecurityGate gate = new SecurityGate(properties.getWorkspace().resolveRoot(), ".wardenignore", List.of(),
                tempDir.resolve("home"));
        ToolCallPipeline pipeline = new ToolCallPipeline(registry, new ToolArgumentValidator(), gate, policy,
                coordinator, new ToolCallDescriber(), properties, Clock.systemUTC());
        return new ExchangeOrchestrator(llmPort, sessionPort, pipeline, registry, coordinator,
                exchangeRegistry, properties);
    }

    private static ExchangeRequest request(String message) {
        return ExchangeRequest.builder().message(message).sessionId(SESSION_ID).build();
    }

    private static ExchangeRequest requestWithAttachment(String message, String content) {
        return ExchangeRequest.builder()
                .message(message)
                .sessionId(SESSION_ID)
                .attachments(List.of(Attachment.builder().filename("notes.txt").content(content).build()))
                .build();
    }

    private static LlmStreamEvent echoCall(String id, String text) {
        return LlmStreamEvent.toolCall(ToolCall.builder()
                .id(id)
                .name(ECHO)
                .arguments(Map.of("text", text))
                .build());
    }

    private static void assertType(ExchangeEvent.Type type, ExchangeEvent event) {
        assertEquals(type, event.getType(), () -> "unexpected event " + event);
    }

    private void awaitReleased() throws InterruptedException {
        long deadline = System.nanoTime() + TIMEOUT.toNanos();
        while (exchangeRegistry.isActive(SESSION_ID) && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
    }

    private List<Message> storedMessages() {
        return sessionService.get(SESSION_ID).map(ChatSession::getMessages).orElseThrow();
    }

    @Test
    void streamsContentAndReasoningThenPersistsTurn() {
        when(llmPort.chatStream(any())).thenReturn(Flux.just(
                LlmStreamEvent.text("Hello <thi"),
                LlmStreamEvent.text("nk>weighing options</think>world"),
                LlmStreamEvent.usage(TokenUsage.builder().inputTokens(12).outputTokens(4).build()),
                LlmStreamEvent.complete("stop")));

        StepVerifier.create(orchestrator.run(request("Hi there")))
                .assertNext(event -> {
                    assertType(ExchangeEvent.Type.SESSION, event);
                    assertEquals(SESSION_ID, event.getSessionId());
                    assertNotNull(event.getExchangeId());
                })
                .assertNext(event -> assertEquals("Hello ", event.getContent()))
                .assertNext(event -> {
                    assertType(ExchangeEvent.Type.REASONING, event);
                    assertEquals("weighing options", event.getContent());
                })
                .assertNext(event -> assertEquals("world", event.getContent()))
                .assertNext(event -> {
                    assertType(ExchangeEvent.Type.USAGE, event);
                    assertEquals(12L, event.getInput().longValue());
                    assertEquals(4L, event.getOutput().longValue());
                })
                .assertNext(event -> assertType(ExchangeEvent.Type.DONE, event))
                .expectComplete()
                .verify(TIMEOUT);

        List<Message> messages = storedMessages();
        assertEquals(2, messages.size());
        Message reply = messages.get(1);
        assertEquals("Hello world", reply.getContent());
        assertEquals("weighing options", reply.getReasoning());
        assertEquals("test-model", sessionService.get(SESSION_ID).orElseThrow().getModelId());
        TokenUsage sessionUsage = sessionService.get(SESSION_ID).orElseThrow().getTokenUsage();
        assertEquals(16, sessionUsage.getTotalTokens());
        assertEquals(8192, sessionUsage.getContextWindow());
        assertEquals(16.0 / 8192, sessionUsage.getContextUtilization(), 1e-9);

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort).chatStream(captor.capture());
        List<LlmMessage> sent = captor.getValue().getMessages();
        assertEquals("system", sent.get(0).getRole());
        assertEquals("Hi there", sent.get(1).getContent());
        assertEquals(List.of(ECHO), captor.getValue().getTools().stream().map(ToolDefinition::getName).toList());
    }

    @Test
    void splicesToolResultsInRequestOrderEvenWhenLaterCallResolvesFirst() {
        when(llmPort.chatStream(any())).thenReturn(
                Flux.just(echoCall("call_a", "A"), echoCall("call_b", "B"), LlmStreamEvent.toolResultNeeded()),
                Flux.just(LlmStreamEvent.text("Both done."), LlmStreamEvent.complete("stop")));
        AtomicReference<String> ticketA = new AtomicReference<>();
        AtomicReference<String> ticketB = new AtomicReference<>();

        StepVerifier.create(orchestrator.run(request("Echo twice")))
                .assertNext(event -> assertType(ExchangeEvent.Type.SESSION, event))
                .assertNext(event -> {
                    assertType(ExchangeEvent.Type.TOOL_APPROVAL_REQUEST, event);
                    assertEquals("echo: {text=A}", event.getDescription());
                    ticketA.set(event.getTicketId());
                })
                .assertNext(event -> ticketB.set(event.getTicketId()))
                .then(() -> coordinator.resolve(ticketB.get(), ApprovalDecision.APPROVE))
                .expectNoEvent(Duration.ofMillis(200))
                .then(() -> coordinator.resolve(ticketA.get(), ApprovalDecision.APPROVE))
                .assertNext(event -> {
                    assertType(ExchangeEvent.Type.TOOL_INVOCATION_COMPLETED, event);
                    assertEquals("A", event.getResult());
                })
                .assertNext(event -> assertEquals("B", event.getResult()))
                .assertNext(event -> assertEquals("Both done.", event.getContent()))
                .assertNext(event -> assertType(ExchangeEvent.Type.USAGE, event))
                .assertNext(event -> assertType(ExchangeEvent.Type.DONE, event))
                .expectComplete()
                .verify(TIMEOUT);

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort, times(2)).chatStream(captor.capture());
        List<LlmMessage> second = captor.getAllValues().get(1).getMessages();
        LlmMessage assistant = second.get(second.size() - 3);
        assertEquals(List.of("call_a", "call_b"), assistant.getToolCalls().stream().map(ToolCall::getId).toList());
        assertEquals("call_a", second.get(second.size() - 2).getToolCallId());
        assertEquals("call_b", second.get(second.size() - 1).getToolCallId());

        Message reply = storedMessages().get(1);
        assertEquals(List.of("call_a", "call_b"),
                reply.getToolInvocations().stream().map(ToolInvocation::getToolCallId).toList());
        assertEquals("Both done.", reply.getContent());
    }

    @Test
    void abortSupersedesPendingTicketAndPersistsFinalizedPart() {
        when(llmPort.chatStream(any())).thenReturn(Flux.just(
                LlmStreamEvent.text("Let me check."),
                echoCall("call_a", "A"),
                LlmStreamEvent.toolResultNeeded()));
        AtomicReference<String> ticket = new AtomicReference<>();

        StepVerifier.create(orchestrator.run(request("Check something")))
                .assertNext(event -> assertType(ExchangeEvent.Type.SESSION, event))
                .assertNext(event -> assertEquals("Let me check.", event.getContent()))
                .assertNext(event -> ticket.set(event.getTicketId()))
                .then(() -> assertTrue(exchangeRegistry.abort(SESSION_ID)))
                .assertNext(event -> assertType(ExchangeEvent.Type.USAGE, event))
                .assertNext(event -> assertType(ExchangeEvent.Type.DONE, event))
                .expectComplete()
                .verify(TIMEOUT);

        assertEquals(ApprovalState.SUPERSEDED, coordinator.get(ticket.get()).orElseThrow().getState());
        assertThrows(ApprovalCoordinator.TicketAlreadyResolvedException.class,
                () -> coordinator.resolve(ticket.get(), ApprovalDecision.APPROVE));
        assertEquals(0, echoTool.executions.get());
        Message reply = storedMessages().get(1);
        assertEquals("Let me check.", reply.getContent());
        assertTrue(reply.getToolInvocations().isEmpty());
    }

    @Test
    void droppedClientSupersedesTicketAndPersistsPartialTurn() {
        when(llmPort.chatStream(any())).thenReturn(Flux.just(
                LlmStreamEvent.text("Working on it."),
                echoCall("call_a", "A"),
                LlmStreamEvent.toolResultNeeded()));
        AtomicReference<String> ticket = new AtomicReference<>();

        StepVerifier.create(orchestrator.run(request("Go")))
                .assertNext(event -> assertType(ExchangeEvent.Type.SESSION, event))
                .assertNext(event -> assertType(ExchangeEvent.Type.CONTENT, event))
                .assertNext(event -> ticket.set(event.getTicketId()))
                .thenCancel()
                .verify(TIMEOUT);

        assertEquals(ApprovalState.SUPERSEDED, coordinator.get(ticket.get()).orElseThrow().getState());
        assertEquals("Working on it.", storedMessages().get(1).getContent());
        assertFalse(exchangeRegistry.isActive(SESSION_ID));
    }

    @Test
    void transportErrorPersistsPartialTurnThenEmitsError() {
        when(llmPort.chatStream(any())).thenReturn(Flux.concat(
                Flux.just(LlmStreamEvent.text("Partial answer")),
                Flux.error(new LlmPort.LlmException("connection reset"))));

        StepVerifier.create(orchestrator.run(request("Explain")))
                .assertNext(event -> assertType(ExchangeEvent.Type.SESSION, event))
                .assertNext(event -> assertEquals("Partial answer", event.getContent()))
                .assertNext(event -> {
                    assertType(ExchangeEvent.Type.ERROR, event);
                    assertEquals("Model stream failed: connection reset", event.getMessage());
                })
                .expectComplete()
                .verify(TIMEOUT);

        assertEquals("Partial answer", storedMessages().get(1).getContent());
    }

    @Test
    void providerErrorEventEndsExchange() {
        when(llmPort.chatStream(any())).thenReturn(Flux.just(LlmStreamEvent.error("rate limited")));

        StepVerifier.create(orchestrator.run(request("Hello")))
                .assertNext(event -> assertType(ExchangeEvent.Type.SESSION, event))
                .assertNext(event -> assertEquals("Model stream failed: rate limited", event.getMessage()))
                .expectComplete()
                .verify(TIMEOUT);

        assertEquals(1, storedMessages().size());
    }

    @Test
    void deniedCallIsReportedAndModelContinues() {
        when(policy.decide(anyString(), any())).thenReturn(PolicyDecision.DENY);
        when(llmPort.chatStream(any())).thenReturn(
                Flux.just(echoCall("call_a", "A"), LlmStreamEvent.toolResultNeeded()),
                Flux.just(LlmStreamEvent.text("Understood."), LlmStreamEvent.complete("stop")));

        StepVerifier.create(orchestrator.run(request("Echo")))
                .assertNext(event -> assertType(ExchangeEvent.Type.SESSION, event))
                .assertNext(event -> {
                    assertType(ExchangeEvent.Type.TOOL_INVOCATION_COMPLETED, event);
                    assertEquals(ToolInvocationStatus.DENIED, event.getStatus());
                    assertEquals("policy_denied", event.getErrorKind());
                })
                .assertNext(event -> assertEquals("Understood.", event.getContent()))
                .assertNext(event -> assertType(ExchangeEvent.Type.USAGE, event))
                .assertNext(event -> assertType(ExchangeEvent.Type.DONE, event))
                .expectComplete()
                .verify(TIMEOUT);

        assertTrue(coordinator.listPending().isEmpty());
        assertEquals(0, echoTool.executions.get());
    }

    @Test
    void stopsAfterModelCallLimit() {
        properties.getExchange().setMaxModelCalls(1);
        orchestrator = newOrchestrator();
        when(policy.decide(anyString(), any())).thenReturn(PolicyDecision.ALLOW);
        when(llmPort.chatStream(any())).thenReturn(
                Flux.just(echoCall("call_a", "A"), LlmStreamEvent.toolResultNeeded()));

        StepVerifier.create(orchestrator.run(request("Loop")))
                .assertNext(event -> assertType(ExchangeEvent.Type.SESSION, event))
                .assertNext(event -> assertEquals(ToolInvocationStatus.COMPLETED, event.getStatus()))
                .assertNext(event -> assertTrue(event.getContent().contains("reached the limit of 1 model calls")))
                .assertNext(event -> assertType(ExchangeEvent.Type.USAGE, event))
                .assertNext(event -> assertType(ExchangeEvent.Type.DONE, event))
                .expectComplete()
                .verify(TIMEOUT);

        verify(llmPort, times(1)).chatStream(any());
    }

    @Test
    void attachmentsAreAnnouncedAndInlinedForModel() {
        when(llmPort.chatStream(any())).thenReturn(Flux.just(LlmStreamEvent.text("Read it."),
                LlmStreamEvent.complete("stop")));
        ExchangeRequest request = ExchangeRequest.builder()
                .message("Summarize")
                .sessionId(SESSION_ID)
                .attachments(List.of(Attachment.builder().filename("notes.txt").content("alpha beta").build()))
                .build();

        StepVerifier.create(orchestrator.run(request))
                .assertNext(event -> assertType(ExchangeEvent.Type.SESSION, event))
                .assertNext(event -> {
                    assertType(ExchangeEvent.Type.SOURCES, event);
                    assertEquals("notes.txt", event.getSources().get(0).getTitle());
                })
                .expectNextCount(3)
                .expectComplete()
                .verify(TIMEOUT);

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort).chatStream(captor.capture());
        String userContent = captor.getValue().getMessages().get(1).getContent();
        assertTrue(userContent.startsWith("Summarize"));
        assertTrue(userContent.contains("Attached file: notes.txt"));
        assertTrue(userContent.contains("alpha beta"));
    }

    @Test
    void secondConcurrentExchangeForSessionIsRejected() {
        exchangeRegistry.register(SESSION_ID, "other-exchange");

        StepVerifier.create(orchestrator.run(request("Hello")))
                .assertNext(event -> {
                    assertType(ExchangeEvent.Type.ERROR, event);
                    assertTrue(event.getMessage().contains("already has an active exchange"));
                })
                .expectComplete()
                .verify(TIMEOUT);
    }

    @Test
    void blankMessageIsRejected() {
        StepVerifier.create(orchestrator.run(request("  ")))
                .assertNext(event -> assertEquals("Message must not be empty", event.getMessage()))
                .expectComplete()
                .verify(TIMEOUT);
    }

    @Test
    void historyCarriesEarlierTurns() throws InterruptedException {
        when(llmPort.chatStream(any())).thenReturn(
                Flux.just(LlmStreamEvent.text("First reply"), LlmStreamEvent.complete("stop")),
                Flux.just(LlmStreamEvent.text("Second reply"), LlmStreamEvent.complete("stop")));

        orchestrator.run(request("First")).blockLast(TIMEOUT);
        awaitReleased();
        orchestrator.run(request("Second")).blockLast(TIMEOUT);

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort, times(2)).chatStream(captor.capture());
        List<String> contents = captor.getAllValues().get(1).getMessages().stream()
                .map(LlmMessage::getContent)
                .toList();
        assertEquals(List.of("You are a test assistant.", "First", "First reply", "Second"), contents);
        assertEquals(4, storedMessages().size());
    }

    @Test
    void failureBeforeStreamingReleasesSession() throws InterruptedException {
        SessionService failing = spy(sessionService);
        doThrow(new IllegalStateException("index corrupted")).when(failing).readContent(anyString());
        orchestrator = newOrchestrator(failing);
        when(llmPort.chatStream(any())).thenReturn(Flux.just(LlmStreamEvent.text("Read it."),
                LlmStreamEvent.complete("stop")));

        StepVerifier.create(orchestrator.run(requestWithAttachment("Summarize", "alpha beta")))
                .assertNext(event -> assertType(ExchangeEvent.Type.SESSION, event))
                .assertNext(event -> {
                    assertType(ExchangeEvent.Type.ERROR, event);
                    assertEquals("Failed to load conversation: index corrupted", event.getMessage());
                })
                .expectComplete()
                .verify(TIMEOUT);

        assertFalse(exchangeRegistry.isActive(SESSION_ID));

        doCallRealMethod().when(failing).readContent(anyString());
        StepVerifier.create(orchestrator.run(request("Again")))
                .assertNext(event -> assertType(ExchangeEvent.Type.SESSION, event))
                .assertNext(event -> assertEquals("Read it.", event.getContent()))
                .assertNext(event -> assertType(ExchangeEvent.Type.USAGE, event))
                .assertNext(event -> assertType(ExchangeEvent.Type.DONE, event))
                .expectComplete()
                .verify(TIMEOUT);
        awaitReleased();
        assertFalse(exchangeRegistry.isActive(SESSION_ID));
    }

    @Test
    void unreadableAttachmentIsReplacedAndSessionStaysUsable() throws Exception {
        when(llmPort.chatStream(any())).thenReturn(
                Flux.just(LlmStreamEvent.text("First reply"), LlmStreamEvent.complete("stop")),
                Flux.just(LlmStreamEvent.text("Second reply"), LlmStreamEvent.complete("stop")));
        orchestrator.run(requestWithAttachment("Summarize", "alpha beta")).blockLast(TIMEOUT);
        awaitReleased();
        String hash = ContentBlobStore.hash("alpha beta".getBytes(StandardCharsets.UTF_8));
        Files.writeString(tempDir.resolve("data").resolve("blobs").resolve(hash + ".gz"), "not gzip");

        StepVerifier.create(orchestrator.run(request("Again")))
                .assertNext(event -> assertType(ExchangeEvent.Type.SESSION, event))
                .assertNext(event -> assertEquals("Second reply", event.getContent()))
                .assertNext(event -> assertType(ExchangeEvent.Type.USAGE, event))
                .assertNext(event -> assertType(ExchangeEvent.Type.DONE, event))
                .expectComplete()
                .verify(TIMEOUT);

        ArgumentCaptor<LlmRequest> captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(llmPort, times(2)).chatStream(captor.capture());
        String earlier = captor.getAllValues().get(1).getMessages().get(1).getContent();
        assertTrue(earlier.contains("Attached file: notes.txt"));
        assertTrue(earlier.contains(ExchangeOrchestrator.CONTENT_UNAVAILABLE));
        awaitReleased();
        assertFalse(exchangeRegistry.isActive(SESSION_ID));
    }

    @Test
    void failedCommitEmitsErrorAndKeepsCommittedSession() throws InterruptedException {
        SessionService failing = spy(sessionService);
        doThrow(new StoragePort.StorageException("disk full", null)).when(failing).commitTurn(anyString(), any());
        orchestrator = newOrchestrator(failing);
        when(llmPort.chatStream(any())).thenReturn(Flux.just(LlmStreamEvent.text("Answer"),
                LlmStreamEvent.complete("stop")));

        StepVerifier.create(orchestrator.run(request("Question")))
                .assertNext(event -> assertType(ExchangeEvent.Type.SESSION, event))
                .assertNext(event -> assertEquals("Answer", event.getContent()))
                .assertNext(event -> {
                    assertType(ExchangeEvent.Type.ERROR, event);
                    assertEquals("Failed to save conversation: disk full", event.getMessage());
                })
                .expectComplete()
                .verify(TIMEOUT);

        awaitReleased();
        assertFalse(exchangeRegistry.isActive(SESSION_ID));
        List<Message> messages = storedMessages();
        assertEquals(1, messages.size());
        assertEquals("Question", messages.get(0).getContent());
    }

    @Test
    void failedCommitAfterStreamErrorStillReportsStreamFailure() throws InterruptedException {
        SessionService failing = spy(sessionService);
        doThrow(new StoragePort.StorageException("disk full", null)).when(failing).commitTurn(anyString(), any());
        orchestrator = newOrchestrator(failing);
        when(llmPort.chatStream(any())).thenReturn(Flux.concat(
                Flux.just(LlmStreamEvent.text("Partial")),
                Flux.error(new LlmPort.LlmException("connection reset"))));

        StepVerifier.create(orchestrator.run(request("Question")))
                .assertNext(event -> assertType(ExchangeEvent.Type.SESSION, event))
                .assertNext(event -> assertEquals("Partial", event.getContent()))
                .assertNext(event -> assertEquals("Model stream failed: connection reset", event.getMessage()))
                .expectComplete()
                .verify(TIMEOUT);

        awaitReleased();
        assertFalse(exchangeRegistry.isActive(SESSION_ID));
        assertEquals(1, storedMessages().size());
    }

    private static final class EchoTool implements ToolComponent {

        private final AtomicInteger executions = new AtomicInteger();

        @Override
        public ToolDefinition getDefinition() {
            return ToolDefinition.builder()
                    .name(ECHO)
                    .description("Echo text back")
                    .inputSchema(Map.of(
                            "type", "object",
                            "properties", Map.of("text", Map.of("type", "string")),
                            "required", List.of("text")))
                    .build();
        }

        @Override
        public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
            executions.incrementAndGet();
            return CompletableFuture.completedFuture(ToolResult.success(String.valueOf(parameters.get("text"))));
        }
    }
}
