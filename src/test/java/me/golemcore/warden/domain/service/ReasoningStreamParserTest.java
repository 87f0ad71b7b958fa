package me.golemcore.warden.domain.service;

import me.golemcore.warden.domain.service.ReasoningStreamParser.Chunk;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReasoningStreamParserTest {

    private static final String OPEN = "<think>";
    private static final String CLOSE = "</think>";

    private static Chunk content(String text) {
        return new Chunk(Chunk.Kind.CONTENT, text);
    }

    private static Chunk reasoning(String text) {
        return new Chunk(Chunk.Kind.REASONING, text);
    }

    @Test
    void splitsMarkersInsideOneDelta() {
        ReasoningStreamParser parser = new ReasoningStreamParser(OPEN, CLOSE);

        List<Chunk> chunks = parser.accept("Hello <think>plan</think>world");

        assertEquals(List.of(content("Hello "), reasoning("plan"), content("world")), chunks);
        assertFalse(parser.isInReasoning());
    }

    @Test
    void holdsBackMarkerSplitAcrossDeltas() {
        ReasoningStreamParser parser = new ReasoningStreamParser(OPEN, CLOSE);

        assertEquals(List.of(content("Hi ")), parser.accept("Hi <thi"));
        assertFalse(parser.isInReasoning());
        assertEquals(List.of(reasoning("deep")), parser.accept("nk>deep"));
        assertTrue(parser.isInReasoning());
        assertEquals(List.of(), parser.accept("</"));
        assertEquals(List.of(content(" done")), parser.accept("think> done"));
    }

    @Test
    void releasesHeldTextThatIsNotAMarker() {
        ReasoningStreamParser parser = new ReasoningStreamParser(OPEN, CLOSE);

        assertEquals(List.of(content("a ")), parser.accept("a <t"));
        assertEquals(List.of(content("<table>")), parser.accept("able>"));
    }

    @Test
    void unclosedReasoningIsClosedAtFinish() {
        ReasoningStreamParser parser = new ReasoningStreamParser(OPEN, CLOSE);

        assertEquals(List.of(reasoning("still going")), parser.accept("<think>still going"));
        assertTrue(parser.isInReasoning());
        assertEquals(List.of(), parser.finish());
        assertFalse(parser.isInReasoning());
    }

    @Test
    void finishFlushesPartialMarkerAsText() {
        ReasoningStreamParser parser = new ReasoningStreamParser(OPEN, CLOSE);

        parser.accept("x <thi");

        assertEquals(List.of(content("<thi")), parser.finish());
    }

    @Test
    void characterByCharacterStreamMatchesWholeText() {
        ReasoningStreamParser parser = new ReasoningStreamParser(OPEN, CLOSE);
        String text = "Before<think>step one\nstep two</think>After <b>bold</b>";
        List<Chunk> chunks = new ArrayList<>();

        for (char c : text.toCharArray()) {
            chunks.addAll(parser.accept(String.valueOf(c)));
        }
        chunks.addAll(parser.finish());

        StringBuilder contentText = new StringBuilder();
        StringBuilder reasoningText = new StringBuilder();
        for (Chunk chunk : chunks) {
            (chunk.kind() == Chunk.Kind.CONTENT ? contentText : reasoningText).append(chunk.text());
        }
        assertEquals("BeforeAfter <b>bold</b>", contentText.toString());
        assertEquals("step one\nstep two", reasoningText.toString());
    }

    @Test
    void supportsCustomMarkers() {
        ReasoningStreamParser parser = new ReasoningStreamParser("[[", "]]");

        assertEquals(List.of(content("a"), reasoning("b"), content("c")), parser.accept("a[[b]]c"));
    }

    @Test
    void ignoresEmptyDelta() {
        ReasoningStreamParser parser = new ReasoningStreamParser(OPEN, CLOSE);

        assertTrue(parser.accept("").isEmpty());
        assertTrue(parser.accept(null).isEmpty());
    }

    @Test
    void rejectsEmptyMarkers() {
        assertThrows(IllegalArgumentException.class, () -> new ReasoningStreamParser("", CLOSE));
        assertThrows(IllegalArgumentException.class, () -> new ReasoningStreamParser(OPEN, null));
    }
}
