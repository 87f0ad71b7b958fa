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

import me.golemcore.warden.domain.model.LlmRequest;
import me.golemcore.warden.domain.model.LlmStreamEvent;
import reactor.core.publisher.Flux;

/**
 * Port for the model transport. Delivers one response as an ordered, lazy
 * event stream that ends with {@code TURN_COMPLETE}, {@code TOOL_RESULT_NEEDED}
 * or an error signal.
 */
public interface LlmPort {

    /**
     * Streams one model response for the given context.
     */
    Flux<LlmStreamEvent> chatStream(LlmRequest request);

    /**
     * Model used when a request does not name one.
     */
    String getCurrentModel();

    boolean isAvailable();

    /**
     * The model connection failed or the provider reported an error mid-stream.
     */
    class LlmException extends RuntimeException {

        private static final long serialVersionUID = 1L;

        public LlmException(String message) {
            super(message);
        }

        public LlmException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
