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

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.warden.domain.component.ToolComponent;
import me.golemcore.warden.domain.model.ApprovalTicket;
import me.golemcore.warden.domain.model.PolicyDecision;
import me.golemcore.warden.domain.model.ToolCall;
import me.golemcore.warden.domain.model.ToolFailureKind;
import me.golemcore.warden.domain.model.ToolInvocation;
import me.golemcore.warden.domain.model.ToolInvocationStatus;
import me.golemcore.warden.domain.model.ToolResult;
import me.golemcore.warden.infrastructure.config.WardenProperties;
import me.golemcore.warden.port.outbound.PermissionPolicyPort;
import me.golemcore.warden.security.GateVerdict;
import me.golemcore.warden.security.SecurityGate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs one model tool call through security gate, permission policy and human
 * approval, then executes it under a timeout.
 *
 * <p>
 * Gate and policy are evaluated synchronously in {@link #submit}; an
 * {@link PolicyDecision#ASK} opens an approval ticket and the returned
 * {@link InFlightToolCall} completes only once the ticket reaches a terminal
 * state. The gate runs again right before execution, whatever the policy or
 * the human decided. Work that follows a decision runs on a small dispatch
 * pool, never on the thread that resolved the ticket. No stage throws: every
 * outcome, including blocks and rejections, becomes a {@link ToolInvocation}
 * plus the text the model sees.
 */
@Service
@Slf4j
public class ToolCallPipeline {

    static final String MSG_DECLINED = "Tool execution declined by user.";
    static final String MSG_APPROVAL_TIMED_OUT = "Tool execution declined: the approval request timed out.";
    static final String MSG_SUPERSEDED = "Tool call was superseded because the exchange was cancelled.";
    private static final int TIMEOUT_GRACE_SECONDS = 2;

    private final ToolRegistry toolRegistry;
    private final ToolArgumentValidator argumentValidator;
    private final SecurityGate securityGate;
    private final PermissionPolicyPort permissionPolicy;
    private final ApprovalCoordinator approvalCoordinator;
    private final ToolCallDescriber describer;
    private final Clock clock;
    private final int defaultTimeoutSeconds;
    private final int maxTimeoutSeconds;
    private final int maxOutputChars;
    private final ExecutorService dispatchExecutor;

    public ToolCallPipeline(ToolRegistry toolRegistry, ToolArgumentValidator argumentValidator,
            SecurityGate securityGate, PermissionPolicyPort permissionPolicy,
            ApprovalCoordinator approvalCoordinator, ToolCallDescriber describer,
            WardenProperties properties, Clock clock) {
        this.toolRegistry = toolRegistry;
        this.argumentValidator = argumentValidator;
        this.securityGate = securityGate;
        this.permissionPolicy = permissionPolicy;
        this.approvalCoordinator = approvalCoordinator;
        this.describer = describer;
        this.clock = clock;
        this.defaultTimeoutSeconds = properties.getTools().getDefaultTimeoutSeconds();
        this.maxTimeoutSeconds = properties.getTools().getMaxTimeoutSeconds();
        this.maxOutputChars = properties.getTools().getMaxOutputChars();
        this.dispatchExecutor = Executors.newFixedThreadPool(
                Math.max(1, properties.getTools().getDispatchThreads()), r -> {
                    Thread t = new Thread(r, "tool-dispatch");
                    t.setDaemon(true);
                    return t;
                });
    }

    @PreDestroy
    public void shutdown() {
        dispatchExecutor.shutdownNow();
        try {
            if (!dispatchExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("[Tool] Dispatch executor did not terminate within timeout");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Starts processing a tool call. Returns immediately; the approval ticket,
     * if one was needed, is already open when this method returns.
     */
    public InFlightToolCall submit(ToolCallContext context, ToolCall call) {
        Map<String, Object> args = call.getArguments() != null ? call.getArguments() : Map.of();

        Optional<ToolComponent> found = toolRegistry.find(call.getName());
        if (found.isEmpty()) {
            return finished(context, call, null, ToolResult.failure(ToolFailureKind.NOT_FOUND,
                    "Unknown tool: " + call.getName() + ". Available tools: "
                            + String.join(", ", toolRegistry.getToolNames())));
        }
        ToolComponent tool = found.get();

        Optional<String> invalid = argumentValidator.validate(tool.getDefinition(), args);
        if (invalid.isPresent()) {
            return finished(context, call, null, ToolResult.failure(ToolFailureKind.INVALID_ARGUMENTS,
                    invalid.get()));
        }

        GateCheck gate = checkGate(tool, args);
        if (gate.blocked() != null) {
            return finished(context, call, null, gate.blocked());
        }

        List<String> scopes = tool.getScopeHints(args);
        String scopeHint = scopes.size() == 1 ? scopes.get(0) : null;
        PolicyDecision decision = decide(tool.getToolName(), scopes);
        log.debug("[Tool] Policy for {} (scopes {}): {}", tool.getToolName(), scopes, decision);

        return switch (decision) {
        case DENY -> finished(context, call, null, ToolResult.failure(ToolFailureKind.POLICY_DENIED,
                "Tool call '" + tool.getToolName() + "' was denied by policy."));
        case ALLOW -> {
            InFlightToolCall inFlight = new InFlightToolCall(call, null);
            inFlight.completeFrom(execute(context, call, tool, null, inFlight));
            yield inFlight;
        }
        case ASK -> {
            ApprovalCoordinator.ApprovalHandle handle = approvalCoordinator.openTicket(ApprovalTicket.builder()
                    .exchangeId(context.exchangeId())
                    .sessionId(context.sessionId())
                    .toolCallId(call.getId())
                    .toolName(tool.getToolName())
                    .arguments(args)
                    .description(describer.describe(call))
                    .scopeHint(scopeHint)
                    .build());
            InFlightToolCall inFlight = new InFlightToolCall(call, handle.ticket());
            String ticketId = handle.ticket().getId();
            inFlight.completeFrom(handle.decision().thenComposeAsync(ticket -> switch (ticket.getState()) {
            case APPROVED -> execute(context, call, tool, ticketId, inFlight);
            case SUPERSEDED -> CompletableFuture.completedFuture(
                    toOutcome(context, call, ticketId,
                            ToolResult.failure(ToolFailureKind.SUPERSEDED, MSG_SUPERSEDED)));
            default -> CompletableFuture.completedFuture(
                    toOutcome(context, call, ticketId, ToolResult.failure(ToolFailureKind.APPROVAL_REJECTED,
                            ApprovalCoordinator.REASON_TIMED_OUT.equals(ticket.getReason())
                                    ? MSG_APPROVAL_TIMED_OUT
                                    : MSG_DECLINED)));
            }, dispatchExecutor));
            yield inFlight;
        }
        };
    }

    /**
     * Combines the per-scope decisions: any deny wins, and the call runs
     * unattended only when every scope is allowed.
     */
    private PolicyDecision decide(String toolName, List<String> scopes) {
        if (scopes.isEmpty()) {
            return permissionPolicy.decide(toolName, null);
        }
        boolean allAllowed = true;
        for (String scope : scopes) {
            PolicyDecision decision = permissionPolicy.decide(toolName, scope);
            if (decision == PolicyDecision.DENY) {
                return PolicyDecision.DENY;
            }
            if (decision != PolicyDecision.ALLOW) {
                allAllowed = false;
            }
        }
        return allAllowed ? PolicyDecision.ALLOW : PolicyDecision.ASK;
    }

    private CompletableFuture<ToolCallOutcome> execute(ToolCallContext context, ToolCall call, ToolComponent tool,
            String ticketId, InFlightToolCall inFlight) {
        Map<String, Object> args = call.getArguments() != null ? call.getArguments() : Map.of();
        GateCheck gate = checkGate(tool, args);
        if (gate.blocked() != null) {
            return CompletableFuture.completedFuture(toOutcome(context, call, ticketId, gate.blocked()));
        }
        if (inFlight.isCancelled()) {
            return CompletableFuture.completedFuture(toOutcome(context, call, ticketId,
                    ToolResult.failure(ToolFailureKind.SUPERSEDED, MSG_SUPERSEDED)));
        }

        int timeout = resolveTimeout(tool.getRequestedTimeoutSeconds(args));
        log.info("[Tool] Executing {} (timeout {}s)", tool.getToolName(), timeout);
        CompletableFuture<ToolResult> execution;
        try {
            execution = tool.execute(gate.arguments());
        } catch (RuntimeException e) {
            log.error("[Tool] {} threw on start", tool.getToolName(), e);
            execution = CompletableFuture.completedFuture(ToolResult.failure(
                    "Tool execution failed: " + safeCauseMessage(e)));
        }
        inFlight.attach(execution);

        CompletableFuture<ToolResult> running = execution;
        return execution.copy()
                .orTimeout(timeout + (long) TIMEOUT_GRACE_SECONDS, TimeUnit.SECONDS)
                .handle((result, error) -> {
                    if (error == null) {
                        return result != null ? result : ToolResult.failure("Tool returned no result");
                    }
                    return failureFor(tool.getToolName(), unwrap(error), running, timeout);
                })
                .thenApply(result -> toOutcome(context, call, ticketId, result));
    }

    private ToolResult failureFor(String toolName, Throwable error, CompletableFuture<ToolResult> running,
            int timeout) {
        if (error instanceof TimeoutException) {
            running.cancel(true);
            log.warn("[Tool] {} timed out after {}s", toolName, timeout);
            return ToolResult.failure(ToolFailureKind.TIMEOUT,
                    "Tool '" + toolName + "' timed out after " + timeout + " seconds");
        }
        if (error instanceof CancellationException) {
            return ToolResult.failure(ToolFailureKind.SUPERSEDED, MSG_SUPERSEDED);
        }
        log.error("[Tool] {} failed", toolName, error);
        return ToolResult.failure("Tool execution failed: " + safeCauseMessage(error));
    }

    /**
     * Runs every path and command argument through the gate. Path arguments are
     * replaced by the resolved location the gate validated, so the tool acts on
     * exactly what was checked.
     */
    private GateCheck checkGate(ToolComponent tool, Map<String, Object> args) {
        Map<String, Object> resolved = new LinkedHashMap<>(args);
        for (String name : tool.getPathArguments()) {
            Object value = args.get(name);
            if (value == null) {
                continue;
            }
            String requested = value.toString();
            GateVerdict verdict = securityGate.validatePath(requested);
            if (verdict.isBlocked()) {
                return GateCheck.blocked(verdict.describeForModel(requested));
            }
            resolved.put(name, verdict.resolvedPath().toString());
        }
        String commandArgument = tool.getCommandArgument();
        if (commandArgument != null) {
            Object value = args.get(commandArgument);
            String command = value != null ? value.toString() : null;
            GateVerdict verdict = securityGate.validateCommand(command);
            if (verdict.isBlocked()) {
                return GateCheck.blocked(verdict.describeForModel(command));
            }
        }
        return new GateCheck(resolved, null);
    }

    private int resolveTimeout(Integer requested) {
        if (requested == null) {
            return defaultTimeoutSeconds;
        }
        return Math.max(1, Math.min(requested, maxTimeoutSeconds));
    }

    private InFlightToolCall finished(ToolCallContext context, ToolCall call, String ticketId, ToolResult result) {
        InFlightToolCall inFlight = new InFlightToolCall(call, null);
        inFlight.completeFrom(CompletableFuture.completedFuture(toOutcome(context, call, ticketId, result)));
        return inFlight;
    }

    private ToolCallOutcome toOutcome(ToolCallContext context, ToolCall call, String ticketId, ToolResult result) {
        ToolFailureKind kind = result.isSuccess() ? null
                : Optional.ofNullable(result.getFailureKind()).orElse(ToolFailureKind.EXECUTION_FAILED);
        ToolInvocation invocation = ToolInvocation.builder()
                .messageId(context.messageId())
                .toolCallId(call.getId())
                .toolName(call.getName())
                .arguments(call.getArguments())
                .result(result.isSuccess() ? result.getOutput() : null)
                .error(result.isSuccess() ? null : result.getError())
                .errorKind(kind != null ? kind.label() : null)
                .status(result.isSuccess() ? ToolInvocationStatus.COMPLETED : ToolInvocationStatus.fromFailure(kind))
                .ticketId(ticketId)
                .completedAt(clock.instant())
                .build();
        log.info("[Tool] {} ({}) -> {}", call.getName(), call.getId(), invocation.getStatus());
        return new ToolCallOutcome(call, invocation, truncate(modelContent(result, kind), call.getName()));
    }

    private static String modelContent(ToolResult result, ToolFailureKind kind) {
        if (result.isSuccess()) {
            String output = result.getOutput();
            return output == null || output.isBlank() ? "(no output)" : output;
        }
        return switch (kind) {
        case VALIDATION_BLOCKED, POLICY_DENIED, APPROVAL_REJECTED, SUPERSEDED -> result.getError();
        default -> "Error (" + kind.label() + "): " + result.getError();
        };
    }

    private String truncate(String content, String toolName) {
        if (content == null || maxOutputChars <= 0 || content.length() <= maxOutputChars) {
            return content;
        }
        String suffix = "\n\n[OUTPUT TRUNCATED: " + content.length() + " chars total, showing first "
                + maxOutputChars + " chars. Try a more specific query.]";
        log.warn("[Tool] Truncating '{}' result: {} chars", toolName, content.length());
        return content.substring(0, maxOutputChars) + suffix;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String safeCauseMessage(Throwable error) {
        Throwable cursor = error;
        while (cursor.getCause() != null && cursor.getCause() != cursor) {
            cursor = cursor.getCause();
        }
        String message = cursor.getMessage();
        return message == null || message.isBlank() ? cursor.getClass().getSimpleName() : message;
    }

    /**
     * Identifies the exchange and assistant message a tool call belongs to.
     */
    public record ToolCallContext(String exchangeId, String sessionId, String messageId) {
    }

    /**
     * Terminal result of one tool call: the durable record and the tool message
     * content handed back to the model.
     */
    public record ToolCallOutcome(ToolCall call, ToolInvocation invocation, String modelContent) {
    }

    private record GateCheck(Map<String, Object> arguments, ToolResult blocked) {

        static GateCheck blocked(String message) {
            return new GateCheck(null, ToolResult.failure(ToolFailureKind.VALIDATION_BLOCKED, message));
        }
    }

    /**
     * Handle on a tool call that is waiting for approval or running.
     */
    public static final class InFlightToolCall {

        private final ToolCall call;
        private final ApprovalTicket approvalTicket;
        private final CompletableFuture<ToolCallOutcome> outcome = new CompletableFuture<>();
        private final AtomicReference<CompletableFuture<ToolResult>> execution = new AtomicReference<>();
        private final AtomicBoolean cancelled = new AtomicBoolean();

        InFlightToolCall(ToolCall call, ApprovalTicket approvalTicket) {
            this.call = call;
            this.approvalTicket = approvalTicket;
        }

        public ToolCall getCall() {
            return call;
        }

        /**
         * Ticket opened for this call, if the policy asked for a human decision.
         */
        public Optional<ApprovalTicket> getApprovalTicket() {
            return Optional.ofNullable(approvalTicket);
        }

        public CompletableFuture<ToolCallOutcome> getOutcome() {
            return outcome;
        }

        public boolean isCancelled() {
            return cancelled.get();
        }

        /**
         * Stops a running executor. Pending approvals are superseded through
         * {@link ApprovalCoordinator#supersedeExchange(String)}.
         */
        public void cancel() {
            cancelled.set(true);
            CompletableFuture<ToolResult> running = execution.get();
            if (running != null) {
                running.cancel(true);
            }
        }

        void attach(CompletableFuture<ToolResult> running) {
            execution.set(running);
            if (cancelled.get()) {
                running.cancel(true);
            }
        }

        void completeFrom(CompletableFuture<ToolCallOutcome> source) {
            source.whenComplete((value, error) -> {
                if (error != null) {
                    outcome.completeExceptionally(error);
                } else {
                    outcome.complete(value);
                }
            });
        }
    }
}
