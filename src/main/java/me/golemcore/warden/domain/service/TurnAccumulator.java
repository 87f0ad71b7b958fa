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

import me.golemcore.warden.domain.model.ThinkingStep;
import me.golemcore.warden.domain.model.TokenUsage;
import me.golemcore.warden.domain.model.ToolInvocation;
import me.golemcore.warden.domain.model.TurnRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects what one exchange produced so far: display content, reasoning
 * segments, finalized tool invocations and usage. Thinking steps keep reasoning
 * and tool calls in the order they happened.
 */
class TurnAccumulator {

    private final StringBuilder content = new StringBuilder();
    private final List<String> reasoningSegments = new ArrayList<>();
    private final List<ToolInvocation> invocations = new ArrayList<>();
    private final List<ThinkingStep> thinkingSteps = new ArrayList<>();
    private final TokenUsage usage = TokenUsage.empty();
    private StringBuilder openSegment;

    synchronized void appendContent(String text) {
        closeReasoningSegment();
        content.append(text);
    }

    synchronized void appendReasoning(String text) {
        if (openSegment == null) {
            openSegment = new StringBuilder();
        }
        openSegment.append(text);
    }

    synchronized void addInvocation(ToolInvocation invocation) {
        closeReasoningSegment();
        invocations.add(invocation);
        thinkingSteps.add(ThinkingStep.builder()
                .order(thinkingSteps.size())
                .type(ThinkingStep.StepType.TOOL)
                .content(invocation.getToolName())
                .toolCallId(invocation.getToolCallId())
                .build());
    }

    synchronized void addUsage(TokenUsage delta) {
        usage.add(delta);
    }

    synchronized TokenUsage getUsage() {
        return TokenUsage.builder()
                .inputTokens(usage.getInputTokens())
                .outputTokens(usage.getOutputTokens())
                .reasoningTokens(usage.getReasoningTokens())
                .cacheTokens(usage.getCacheTokens())
                .totalTokens(usage.getTotalTokens())
                .build();
    }

    synchronized boolean isEmpty() {
        return content.length() == 0 && reasoningSegments.isEmpty() && openSegment == null
                && invocations.isEmpty();
    }

    synchronized TurnRecord toTurnRecord(String messageId, String modelId, boolean interrupted) {
        closeReasoningSegment();
        String reasoning = reasoningSegments.isEmpty() ? null : String.join("\n\n", reasoningSegments);
        return TurnRecord.builder()
                .messageId(messageId)
                .content(content.toString().strip())
                .reasoning(reasoning)
                .modelId(modelId)
                .toolInvocations(new ArrayList<>(invocations))
                .thinkingSteps(new ArrayList<>(thinkingSteps))
                .usage(getUsage())
                .interrupted(interrupted)
                .build();
    }

    private void closeReasoningSegment() {
        if (openSegment == null) {
            return;
        }
        String segment = openSegment.toString().strip();
        openSegment = null;
        if (segment.isEmpty()) {
            return;
        }
        reasoningSegments.add(segment);
        thinkingSteps.add(ThinkingStep.builder()
                .order(thinkingSteps.size())
                .type(ThinkingStep.StepType.REASONING)
                .content(segment)
                .build());
    }
}
