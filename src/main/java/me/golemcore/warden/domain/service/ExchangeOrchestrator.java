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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.warden.domain.model.ChatSession;
import me.golemcore.warden.domain.model.ExchangeEvent;
import me.golemcore.warden.domain.model.ExchangeRequest;
import me.golemcore.warden.domain.model.LlmMessage;
import me.golemcore.warden.domain.model.LlmRequest;
import me.golemcore.warden.domain.model.LlmStreamEvent;
import me.golemcore.warden.domain.model.Message;
import me.golemcore.warden.domain.model.Source;
import me.golemcore.warden.domain.model.ToolCall;
import me.golemcore.warden.domain.model.ToolInvocation;
import me.golemcore.warden.domain.model.TurnRecord;
import me.golemcore.warden.infrastructure.config.WardenProperties;
import me.golemcore.warden.port.outbound.LlmPort;
import me.golemcore.warden.port.outbound.SessionPort;
import me.golemcore.warden.port.outbound.StoragePort;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.SignalType;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives one conversational exchange: streams the model, splits reasoning from
 * content, sends every tool call through the {@link ToolCallPipeline} and
 * feeds the results back to the model until it finishes.
 *
 * <p>
 * Tool calls start as soon as the model requests them, so approval prompts
 * for several calls reach the human together. Results are spliced into the
 * model context strictly in request order: a result that resolves early waits
 * until every earlier call of the same round has completed. Waiting for a
 * ticket or a tool never holds a thread.
 *
 * <p>
 * An abort (explicit or a dropped client) stops consuming model events,
 * supersedes the exchange's pending tickets, cancels running tools and
 * persists what was finalized so far. A model stream failure persists the
 * partial turn as well, then ends the stream with an {@code error} event.
 */
@Service
@Slf4j
public class ExchangeOrchestrator {

    static final String CONTENT_UNAVAILABLE = "[content unavailable]";

    private final LlmPort llmPort;
    private final SessionPort sessionPort;
    private final ToolCallPipeline toolCallPipeline;
    private final ToolRegistry toolRegistry;
    private final ApprovalCoordinator approvalCoordinator;
    private final ExchangeRegistry exchangeRegistry;
    private final WardenProperties properties;

    public ExchangeOrchestrator(LlmPort llmPort, SessionPort sessionPort, ToolCallPipeline toolCallPipeline,
            ToolRegistry toolRegistry, ApprovalCoordinator approvalCoordinator,
            ExchangeRegistry exchangeRegistry, WardenProperties properties) {
        this.llmPort = llmPort;
        this.sessionPort = sessionPort;
        this.toolCallPipeline = toolCallPipeline;
        this.toolRegistry = toolRegistry;
        this.approvalCoordinator = approvalCoordinator;
        this.exchangeRegistry = exchangeRegistry;
        this.properties = properties;
    }

    /**
     * Runs one user turn. The returned stream starts with a {@code session}
     * event and ends with {@code done} or {@code error}; cancelling the
     * subscription aborts the exchange.
     */
    public Flux<ExchangeEvent> run(ExchangeRequest request) {
        return Flux.defer(() -> {
            if (request.getMessage() == null || request.getMessage().isBlank()) {
                return Flux.just(ExchangeEvent.error("Message must not be empty"));
            }

            ChatSession session;
            ExchangeRegistry.ActiveExchange active;
            String exchangeId = UUID.randomUUID().toString();
            try {
                session = sessionPort.getOrCreate(request.getSessionId());
                active = exchangeRegistry.register(session.getId(), exchangeId);
            } catch (IllegalArgumentException | IllegalStateException | StoragePort.StorageException e) {
                log.warn("[Exchange] Rejected request: {}", e.getMessage());
                return Flux.just(ExchangeEvent.error(e.getMessage()));
            }

            Message userMessage;
            try {
                userMessage = sessionPort.appendUserMessage(session.getId(), request.getMessage(),
                        request.getAttachments());
            } catch (RuntimeException e) {
                return abandon(session.getId(), exchangeId, "Failed to save message: ", e);
            }

            ExchangeState state;
            try {
                state = new ExchangeState(session.getId(), exchangeId, UUID.randomUUID().toString(),
                        resolveModel(request, session), buildHistory(request, session.getId()));
            } catch (RuntimeException e) {
                return abandon(session.getId(), exchangeId, "Failed to load conversation: ", e);
            }
            log.info("[Exchange] Started {} for session {} (model {})", exchangeId, session.getId(),
                    state.modelId);

            Flux<ExchangeEvent> head = userMessage.getSources().isEmpty()
                    ? Flux.just(ExchangeEvent.session(session.getId(), exchangeId))
                    : Flux.just(ExchangeEvent.session(session.getId(), exchangeId),
                            ExchangeEvent.sources(List.copyOf(userMessage.getSources())));

            Flux<ExchangeEvent> body = runRound(state, 1)
                    .takeUntilOther(active.aborted().doOnNext(aborted -> state.aborted.set(true)))
                    .concatWith(Flux.defer(() -> finish(state)))
                    .onErrorResume(error -> fail(state, error));

            return head.concatWith(body)
                    .doFinally(signal -> onTerminate(state, signal));
        });
    }

    /**
     * Ends an exchange that failed before streaming started. The session is
     * released here because no terminal hook is attached yet.
     */
    private Flux<ExchangeEvent> abandon(String sessionId, String exchangeId, String prefix, RuntimeException error) {
        exchangeRegistry.release(sessionId, exchangeId);
        log.error("[Exchange] {} for session {} could not start", exchangeId, sessionId, error);
        String detail = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return Flux.just(ExchangeEvent.session(sessionId, exchangeId), ExchangeEvent.error(prefix + detail));
    }

    private Flux<ExchangeEvent> runRound(ExchangeState state, int round) {
        return Flux.defer(() -> {
            RoundState roundState = new RoundState(new ReasoningStreamParser(
                    properties.getReasoning().getOpenMarker(), properties.getReasoning().getCloseMarker()));
            LlmRequest request = LlmRequest.builder()
                    .model(state.modelId)
                    .sessionId(state.sessionId)
                    .messages(new ArrayList<>(state.history))
                    .tools(toolRegistry.getDefinitions())
                    .temperature(properties.getLlm().getTemperature())
                    .build();
            log.debug("[Exchange] {} round {} with {} messages", state.exchangeId, round,
                    request.getMessages().size());

            return llmPort.chatStream(request)
                    .concatMap(event -> onModelEvent(state, roundState, event))
                    .concatWith(Flux.defer(() -> endRound(state, roundState, round)));
        });
    }

    private Flux<ExchangeEvent> onModelEvent(ExchangeState state, RoundState roundState, LlmStreamEvent event) {
        return switch (event.getType()) {
        case TEXT_DELTA -> Flux.fromIterable(toEvents(state, roundState,
                roundState.parser.accept(event.getText())));
        case TOOL_CALL_REQUEST -> Flux.fromIterable(submitToolCall(state, roundState, event.getToolCall()));
        case USAGE -> {
            state.turn.addUsage(event.getUsage());
            yield Flux.empty();
        }
        case TOOL_RESULT_NEEDED, TURN_COMPLETE -> {
            if ("length".equals(event.getFinishReason())) {
                log.warn("[Exchange] {} response truncated by the output token limit", state.exchangeId);
            }
            yield Flux.empty();
        }
        case ERROR -> Flux.error(new LlmPort.LlmException(event.getError()));
        };
    }

    private List<ExchangeEvent> submitToolCall(ExchangeState state, RoundState roundState, ToolCall requested) {
        ToolCall call = requested.getId() != null && !requested.getId().isBlank()
                ? requested
                : ToolCall.builder()
                        .id("call_" + UUID.randomUUID())
                        .name(requested.getName())
                        .arguments(requested.getArguments())
                        .build();
        ToolCallPipeline.InFlightToolCall inFlight = toolCallPipeline.submit(
                new ToolCallPipeline.ToolCallContext(state.exchangeId, state.sessionId, state.messageId), call);
        roundState.pending.add(inFlight);
        state.inFlight.add(inFlight);
        return inFlight.getApprovalTicket()
                .map(ticket -> List.of(ExchangeEvent.approvalRequest(ticket)))
                .orElse(List.of());
    }

    private Flux<ExchangeEvent> endRound(ExchangeState state, RoundState roundState, int round) {
        List<ExchangeEvent> flushed = toEvents(state, roundState, roundState.parser.finish());
        String roundText = roundState.content.toString();

        if (roundState.pending.isEmpty()) {
            state.history.add(LlmMessage.assistant(roundText));
            return Flux.fromIterable(flushed);
        }

        state.history.add(LlmMessage.builder()
                .role("assistant")
                .content(roundText)
                .toolCalls(roundState.pending.stream().map(ToolCallPipeline.InFlightToolCall::getCall).toList())
                .build());

        Flux<ExchangeEvent> results = Flux.fromIterable(roundState.pending)
                .concatMap(inFlight -> Mono.fromFuture(inFlight.getOutcome(), true))
                .map(outcome -> {
                    ToolInvocation invocation = outcome.invocation();
                    state.turn.addInvocation(invocation);
                    state.history.add(LlmMessage.toolResult(outcome.call(), outcome.modelContent()));
                    return ExchangeEvent.invocationCompleted(invocation);
                });

        int maxModelCalls = properties.getExchange().getMaxModelCalls();
        Flux<ExchangeEvent> next;
        if (round >= maxModelCalls) {
            next = Flux.defer(() -> {
                log.warn("[Exchange] {} stopped after {} model calls", state.exchangeId, maxModelCalls);
                String note = "\n\n[Stopped: reached the limit of " + maxModelCalls
                        + " model calls for one exchange.]";
                state.turn.appendContent(note);
                return Flux.just(ExchangeEvent.content(note));
            });
        } else {
            next = runRound(state, round + 1);
        }
        return Flux.fromIterable(flushed).concatWith(results).concatWith(next);
    }

    private List<ExchangeEvent> toEvents(ExchangeState state, RoundState roundState,
            List<ReasoningStreamParser.Chunk> chunks) {
        List<ExchangeEvent> events = new ArrayList<>(chunks.size());
        for (ReasoningStreamParser.Chunk chunk : chunks) {
            if (chunk.kind() == ReasoningStreamParser.Chunk.Kind.REASONING) {
                state.turn.appendReasoning(chunk.text());
                events.add(ExchangeEvent.reasoning(chunk.text()));
            } else {
                state.turn.appendContent(chunk.text());
                roundState.content.append(chunk.text());
                events.add(ExchangeEvent.content(chunk.text()));
            }
        }
        return events;
    }

    private Flux<ExchangeEvent> finish(ExchangeState state) {
        if (state.aborted.get()) {
            log.info("[Exchange] {} aborted", state.exchangeId);
            stopPending(state);
        }
        Optional<Message> committed = commitOnce(state, state.aborted.get());
        return Flux.just(ExchangeEvent.usage(state.turn.getUsage()),
                ExchangeEvent.done(committed.map(Message::getId).orElse(state.messageId)));
    }

    private Flux<ExchangeEvent> fail(ExchangeState state, Throwable error) {
        stopPending(state);
        if (error instanceof StoragePort.StorageException) {
            log.error("[Exchange] {} storage failure", state.exchangeId, error);
            return Flux.just(ExchangeEvent.error("Failed to save conversation: " + error.getMessage()));
        }
        log.error("[Exchange] {} model stream failed: {}", state.exchangeId, error.getMessage());
        try {
            commitOnce(state, true);
        } catch (StoragePort.StorageException e) {
            log.error("[Exchange] {} failed to persist partial turn", state.exchangeId, e);
        }
        return Flux.just(ExchangeEvent.error("Model stream failed: " + error.getMessage()));
    }

    private void onTerminate(ExchangeState state, SignalType signal) {
        try {
            if (signal == SignalType.CANCEL) {
                log.info("[Exchange] {} cancelled by client", state.exchangeId);
                stopPending(state);
                commitOnce(state, true);
            }
        } catch (RuntimeException e) {
            log.error("[Exchange] {} failed to persist partial turn", state.exchangeId, e);
        } finally {
            approvalCoordinator.supersedeExchange(state.exchangeId);
            exchangeRegistry.release(state.sessionId, state.exchangeId);
        }
    }

    private void stopPending(ExchangeState state) {
        approvalCoordinator.supersedeExchange(state.exchangeId);
        for (ToolCallPipeline.InFlightToolCall inFlight : state.inFlight) {
            if (!inFlight.getOutcome().isDone()) {
                inFlight.cancel();
            }
        }
    }

    private Optional<Message> commitOnce(ExchangeState state, boolean interrupted) {
        if (!state.committed.compareAndSet(false, true)) {
            return Optional.empty();
        }
        if (interrupted && state.turn.isEmpty()) {
            return Optional.empty();
        }
        TurnRecord record = state.turn.toTurnRecord(state.messageId, state.modelId, interrupted);
        record.setContextWindow(properties.getLlm().getContextWindow());
        return Optional.of(sessionPort.commitTurn(state.sessionId, record));
    }

    private String resolveModel(ExchangeRequest request, ChatSession session) {
        if (request.getModel() != null && !request.getModel().isBlank()) {
            return request.getModel();
        }
        if (session.getModelId() != null) {
            return session.getModelId();
        }
        String current = llmPort.getCurrentModel();
        return current != null ? current : properties.getLlm().getModel();
    }

    private List<LlmMessage> buildHistory(ExchangeRequest request, String sessionId) {
        List<LlmMessage> history = new CopyOnWriteArrayList<>();
        String systemPrompt = request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()
                ? request.getSystemPrompt()
                : properties.getLlm().getSystemPrompt();
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            history.add(LlmMessage.system(systemPrompt));
        }
        ChatSession session = sessionPort.get(sessionId).orElseThrow();
        for (Message message : session.getMessages()) {
            if (message.isUserMessage()) {
                history.add(LlmMessage.user(userContent(message)));
            } else if (message.getContent() != null && !message.getContent().isBlank()) {
                history.add(LlmMessage.assistant(message.getContent()));
            }
        }
        return history;
    }

    private String userContent(Message message) {
        if (message.getSources().isEmpty()) {
            return message.getContent();
        }
        StringBuilder sb = new StringBuilder(message.getContent());
        for (Source source : message.getSources()) {
            String text = readSource(source)
                    .map(bytes -> new String(bytes, StandardCharsets.UTF_8))
                    .orElse(CONTENT_UNAVAILABLE);
            sb.append("\n\nAttached file: ").append(source.getTitle()).append("\n```\n").append(text)
                    .append("\n```");
        }
        return sb.toString();
    }

    private Optional<byte[]> readSource(Source source) {
        try {
            return sessionPort.readContent(source.getContentHash());
        } catch (StoragePort.StorageException e) {
            log.warn("[Exchange] Attachment {} ({}) is unreadable: {}", source.getTitle(), source.getContentHash(),
                    e.getMessage());
            return Optional.empty();
        }
    }

    private static final class ExchangeState {

        private final String sessionId;
        private final String exchangeId;
        private final String messageId;
        private final String modelId;
        private final List<LlmMessage> history;
        private final TurnAccumulator turn = new TurnAccumulator();
        private final List<ToolCallPipeline.InFlightToolCall> inFlight = new CopyOnWriteArrayList<>();
        private final AtomicBoolean aborted = new AtomicBoolean();
        private final AtomicBoolean committed = new AtomicBoolean();

        ExchangeState(String sessionId, String exchangeId, String messageId, String modelId,
                List<LlmMessage> history) {
            this.sessionId = sessionId;
            this.exchangeId = exchangeId;
            this.messageId = messageId;
            this.modelId = modelId;
            this.history = history;
        }
    }

    private static final class RoundState {

        private final ReasoningStreamParser parser;
        private final StringBuilder content = new StringBuilder();
        private final List<ToolCallPipeline.InFlightToolCall> pending = new ArrayList<>();

        RoundState(ReasoningStreamParser parser) {
            this.parser = parser;
        }
    }
}
