package me.golemcore.warden.domain.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ChatSessionTest {

    private static Message message(String role, String content, long ordinal) {
        return Message.builder().role(role).content(content).ordinal(ordinal).build();
    }

    @Test
    void previewIsFirstUserMessage() {
        ChatSession session = ChatSession.builder()
                .messages(List.of(
                        message(Message.ROLE_USER, "Fix the parser", 1),
                        message(Message.ROLE_ASSISTANT, "Done", 2),
                        message(Message.ROLE_USER, "Thanks", 3)))
                .build();

        assertEquals("Fix the parser", session.preview());
    }

    @Test
    void longPreviewIsCut() {
        String content = "x".repeat(150);
        ChatSession session = ChatSession.builder()
                .messages(List.of(message(Message.ROLE_USER, content, 1)))
                .build();

        assertEquals("x".repeat(100) + "...", session.preview());
    }

    @Test
    void emptySessionHasNoPreview() {
        assertNull(ChatSession.builder().build().preview());
    }

    @Test
    void nextOrdinalFollowsLastMessage() {
        assertEquals(1, ChatSession.builder().build().nextOrdinal());
        ChatSession session = ChatSession.builder()
                .messages(List.of(message(Message.ROLE_USER, "a", 1), message(Message.ROLE_ASSISTANT, "b", 2)))
                .build();
        assertEquals(3, session.nextOrdinal());
    }
}
