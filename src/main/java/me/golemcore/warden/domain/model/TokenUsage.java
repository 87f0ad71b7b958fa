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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Token counters, used both per model response and cumulatively per session.
 *
 * <p>
 * Session counters also carry the model's context window and the share of it
 * the conversation has used so far ({@code totalTokens / contextWindow}).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TokenUsage {

    private static final double APPROACHING_LIMIT = 0.8;

    private long inputTokens;
    private long outputTokens;
    private long reasoningTokens;
    private long cacheTokens;
    private long totalTokens;
    private int contextWindow;
    private double contextUtilization;

    public static TokenUsage empty() {
        return new TokenUsage();
    }

    /**
     * Adds another usage record to this one.
     */
    public void add(TokenUsage other) {
        if (other == null) {
            return;
        }
        inputTokens += other.inputTokens;
        outputTokens += other.outputTokens;
        reasoningTokens += other.reasoningTokens;
        cacheTokens += other.cacheTokens;
        totalTokens += other.totalTokens > 0 ? other.totalTokens : other.inputTokens + other.outputTokens;
        updateUtilization();
    }

    public void applyContextWindow(int window) {
        contextWindow = Math.max(0, window);
        updateUtilization();
    }

    public void updateUtilization() {
        contextUtilization = contextWindow > 0 ? (double) totalTokens / contextWindow : 0.0;
    }

    @JsonIgnore
    public boolean isApproachingLimit() {
        return contextUtilization > APPROACHING_LIMIT;
    }

    @JsonIgnore
    public boolean isOverLimit() {
        return contextUtilization > 1.0;
    }
}
