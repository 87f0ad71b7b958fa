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

import java.util.ArrayList;
import java.util.List;

/**
 * Incrementally splits streamed model text into display content and reasoning
 * delimited by open/close markers ({@code <think>...</think>} by default).
 *
 * <p>
 * Each delta is scanned once. A marker split across deltas is held back until
 * the next delta decides whether it is a marker or plain text. Text after an
 * open marker stays reasoning until the close marker arrives, possibly many
 * deltas later; {@link #finish()} treats a still-open segment as closed.
 *
 * <p>
 * Not thread-safe: one parser per exchange round.
 */
public class ReasoningStreamParser {

    private final String openMarker;
    private final String closeMarker;
    private boolean inReasoning;
    private String carry = "";

    public ReasoningStreamParser(String openMarker, String closeMarker) {
        if (openMarker == null || openMarker.isEmpty() || closeMarker == null || closeMarker.isEmpty()) {
            throw new IllegalArgumentException("Reasoning markers must not be empty");
        }
        this.openMarker = openMarker;
        this.closeMarker = closeMarker;
    }

    public boolean isInReasoning() {
        return inReasoning;
    }

    /**
     * Consumes one text delta.
     *
     * @return the chunks that can be emitted now, in stream order
     */
    public List<Chunk> accept(String delta) {
        List<Chunk> chunks = new ArrayList<>();
        if (delta == null || delta.isEmpty()) {
            return chunks;
        }
        String buffer = carry + delta;
        carry = "";
        int pos = 0;
        while (pos < buffer.length()) {
            String marker = inReasoning ? closeMarker : openMarker;
            int idx = buffer.indexOf(marker, pos);
            if (idx >= 0) {
                emit(chunks, buffer.substring(pos, idx));
                inReasoning = !inReasoning;
                pos = idx + marker.length();
                continue;
            }
            int held = partialMarkerLength(buffer, pos, marker);
            emit(chunks, buffer.substring(pos, buffer.length() - held));
            carry = buffer.substring(buffer.length() - held);
            break;
        }
        return chunks;
    }

    /**
     * Flushes held-back text at stream end and closes an open reasoning segment.
     */
    public List<Chunk> finish() {
        List<Chunk> chunks = new ArrayList<>();
        emit(chunks, carry);
        carry = "";
        inReasoning = false;
        return chunks;
    }

    private void emit(List<Chunk> chunks, String text) {
        if (text.isEmpty()) {
            return;
        }
        chunks.add(new Chunk(inReasoning ? Chunk.Kind.REASONING : Chunk.Kind.CONTENT, text));
    }

    /**
     * Length of the longest buffer suffix that is a proper prefix of the marker.
     */
    private static int partialMarkerLength(String buffer, int from, String marker) {
        int max = Math.min(marker.length() - 1, buffer.length() - from);
        for (int len = max; len > 0; len--) {
            if (buffer.endsWith(marker.substring(0, len))) {
                return len;
            }
        }
        return 0;
    }

    public record Chunk(Kind kind, String text) {

        public enum Kind {
            CONTENT, REASONING
        }
    }
}
