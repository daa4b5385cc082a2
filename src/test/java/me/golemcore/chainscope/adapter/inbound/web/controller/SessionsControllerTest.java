package me.golemcore.chainscope.adapter.inbound.web.controller;

import me.golemcore.chainscope.adapter.inbound.web.dto.SessionDetailDto;
import me.golemcore.chainscope.adapter.inbound.web.dto.SessionSummaryDto;
import me.golemcore.chainscope.domain.model.Message;
import me.golemcore.chainscope.domain.model.ResearchSession;
import me.golemcore.chainscope.port.outbound.SessionPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import reactor.test.StepVerifier;

class SessionsControllerTest {

    private static final Instant CREATED = Instant.parse("2026-03-01T10:00:00Z");
    private static final Instant ACTIVE = Instant.parse("2026-03-01T10:05:00Z");

    private SessionPort sessionPort;
    private SessionsController controller;

    @BeforeEach
    void setUp() {
        sessionPort = mock(SessionPort.class);
        controller = new SessionsController(sessionPort);
    }

    private static ResearchSession session(String id, String lastQuery) {
        Map<String, Object> context = new LinkedHashMap<>();
        if (lastQuery != null) {
            context.put(ResearchSession.CONTEXT_LAST_QUERY, lastQuery);
        }
        List<Message> messages = new ArrayList<>();
        messages.add(Message.user("btc price", CREATED));
        messages.add(Message.assistant("BTC is at 64k", ACTIVE, Map.of("query_intent", "market_data")));
        return ResearchSession.builder()
                .id(id)
                .messages(messages)
                .researchContext(context)
                .createdAt(CREATED)
                .lastActivity(ACTIVE)
                .build();
    }

    @Test
    void shouldListSessions() {
        when(sessionPort.listAll()).thenReturn(List.of(session("s1", "btc price"), session("s2", null)));

        StepVerifier.create(controller.listSessions())
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    List<SessionSummaryDto> body = response.getBody();
                    assertNotNull(body);
                    assertEquals(2, body.size());
                    assertEquals("s1", body.get(0).getId());
                    assertEquals(2, body.get(0).getMessageCount());
                    assertEquals("btc price", body.get(0).getLastQuery());
                    assertEquals("2026-03-01T10:05:00Z", body.get(0).getLastActivity());
                    assertNull(body.get(1).getLastQuery());
                })
                .verifyComplete();
    }

    @Test
    void shouldReturnSessionDetail() {
        when(sessionPort.get("s1")).thenReturn(Optional.of(session("s1", "btc price")));

        StepVerifier.create(controller.getSession("s1"))
                .assertNext(response -> {
                    SessionDetailDto body = response.getBody();
                    assertNotNull(body);
                    assertEquals("2026-03-01T10:00:00Z", body.getCreatedAt());
                    assertEquals(2, body.getMessages().size());
                    SessionDetailDto.MessageDto reply = body.getMessages().get(1);
                    assertEquals("assistant", reply.getRole());
                    assertEquals("market_data", reply.getMetadata().get("query_intent"));
                    assertEquals("btc price", body.getResearchContext().get(ResearchSession.CONTEXT_LAST_QUERY));
                })
                .verifyComplete();
    }

    @Test
    void shouldReturnNotFoundForUnknownSession() {
        when(sessionPort.get("missing")).thenReturn(Optional.empty());

        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> controller.getSession("missing"));

        assertEquals(HttpStatus.NOT_FOUND, ex.getStatusCode());
    }
}
