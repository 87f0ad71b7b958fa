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
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks the single active exchange of each session and carries its abort
 * signal.
 */
@Component
@Slf4j
public class ExchangeRegistry {

    private final Map<String, ActiveExchange> active = new ConcurrentHashMap<>();

    /**
     * Claims the session for a new exchange.
     *
     * @throws ExchangeInProgressException
     *             when another exchange of the session is still running
     */
    public ActiveExchange register(String sessionId, String exchangeId) {
        ActiveExchange exchange = new ActiveExchange(exchangeId, Sinks.one());
        ActiveExchange existing = active.putIfAbsent(sessionId, exchange);
        if (existing != null) {
            throw new ExchangeInProgressException(sessionId);
        }
        return exchange;
    }

    /**
     * Signals the session's active exchange to stop.
     *
     * @return true if an exchange was running
     */
    public boolean abort(String sessionId) {
        ActiveExchange exchange = active.get(sessionId);
        if (exchange == null) {
            return false;
        }
        log.info("[Exchange] Abort requested for session {} (exchange {})", sessionId, exchange.exchangeId());
        exchange.abortSignal().tryEmitValue(Boolean.TRUE);
        return true;
    }

    public boolean isActive(String sessionId) {
        return active.containsKey(sessionId);
    }

    void release(String sessionId, String exchangeId) {
        active.computeIfPresent(sessionId, (id, exchange) -> exchange.exchangeId().equals(exchangeId)
                ? null
                : exchange);
    }

    public record ActiveExchange(String exchangeId, Sinks.One<Boolean> abortSignal) {

        Mono<Boolean> aborted() {
            return abortSignal.asMono();
        }
    }

    public static class ExchangeInProgressException extends IllegalStateException {

        private static final long serialVersionUID = 1L;

        public ExchangeInProgressException(String sessionId) {
            super("Session " + sessionId + " already has an active exchange");
        }
    }
}
