package me.golemcore.warden.adapter.inbound.web.controller;

import me.golemcore.warden.adapter.inbound.web.dto.ChatRequest;
import me.golemcore.warden.domain.model.Attachment;
import me.golemcore.warden.domain.model.ExchangeEvent;
import me.golemcore.warden.domain.model.ExchangeRequest;
import me.golemcore.warden.domain.service.ExchangeOrchestrator;
import me.golemcore.warden.domain.service.ExchangeRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ChatControllerTest {

    private ExchangeOrchestrator orchestrator;
    private ExchangeRegistry exchangeRegistry;
    private ChatController controller;

    @BeforeEach
    void setUp() {
        orchestrator = mock(ExchangeOrchestrator.class);
        exchangeRegistry = new ExchangeRegistry();
        controller = new ChatController(orchestrator, exchangeRegistry);
    }

    @Test
    void shouldStreamEventsNamedByType() {
        when(orchestrator.run(any())).thenReturn(Flux.just(
                ExchangeEvent.session("s1", "e1"),
                ExchangeEvent.content("Hi"),
                ExchangeEvent.done("m1")));
        ChatRequest request = ChatRequest.builder()
                .message("Hello")
                .sessionId("s1")
                .attachments(List.of(new Attachment("a.txt", "alpha")))
                .build();

        StepVerifier.create(controller.chat(request))
                .assertNext(sse -> {
                    assertEquals("session", sse.event());
                    assertEquals("s1", sse.data().getSessionId());
                })
                .assertNext(sse -> assertEquals("content", sse.event()))
                .assertNext(sse -> assertEquals("done", sse.event()))
                .verifyComplete();

        ArgumentCaptor<ExchangeRequest> captor = ArgumentCaptor.forClass(ExchangeRequest.class);
        verify(orchestrator).run(captor.capture());
        assertEquals("Hello", captor.getValue().getMessage());
        assertEquals("s1", captor.getValue().getSessionId());
        assertEquals("a.txt", captor.getValue().getAttachments().get(0).getFilename());
    }

    @Test
    void shouldRejectBlankMessage() {
        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> controller.chat(ChatRequest.builder().message(" ").build()));

        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatusCode());
        verify(orchestrator, never()).run(any());
    }

    @Test
    void shouldAbortActiveExchange() {
        exchangeRegistry.register("s1", "e1");

        StepVerifier.create(controller.abort("s1"))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertEquals(true, response.getBody().get("aborted"));
                })
                .verifyComplete();
        assertTrue(exchangeRegistry.isActive("s1"));
    }

    @Test
    void shouldReportAbortWithoutActiveExchange() {
        assertFalse(exchangeRegistry.isActive("s2"));

        ResponseStatusException ex = assertThrows(ResponseStatusException.class, () -> controller.abort("s2"));

        assertEquals(HttpStatus.NOT_FOUND, ex.getStatusCode());
    }
}
