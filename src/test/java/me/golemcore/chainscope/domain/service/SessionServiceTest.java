package me.golemcore.chainscope.domain.service;

import me.golemcore.chainscope.domain.model.Message;
import me.golemcore.chainscope.domain.model.ResearchSession;
import me.golemcore.chainscope.infrastructure.config.ChainscopeProperties;
import me.golemcore.chainscope.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SessionServiceTest {

    private static final Instant START = Instant.parse("2026-01-01T10:00:00Z");

    private MutableClock clock;
    private ChainscopeProperties properties;
    private SessionService service;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        properties = new ChainscopeProperties();
        properties.getSessions().setMaxSessions(3);
        properties.getSessions().setIdleTimeout(Duration.ofHours(1));
        service = new SessionService(properties, clock);
    }

    // ==================== getOrCreate ====================

    @Test
    void getOrCreate_createsEmptySession() {
        ResearchSession session = service.getOrCreate("s1");

        assertEquals("s1", session.getId());
        assertEquals(0, session.getMessageCount());
        assertEquals(START, session.getCreatedAt());
        assertEquals(START, session.getLastActivity());
        assertTrue(session.getResearchContext().isEmpty());
    }

    @Test
    void getOrCreate_generatesIdWhenMissing() {
        ResearchSession session = service.getOrCreate(null);

        assertNotNull(session.getId());
        assertFalse(session.getId().isBlank());
    }

    @Test
    void getOrCreate_returnsExistingAndRefreshesActivity() {
        service.getOrCreate("s1");
        service.appendMessage("s1", Message.user("hello", clock.instant()));
        clock.advance(Duration.ofMinutes(5));

        ResearchSession session = service.getOrCreate("s1");

        assertEquals(1, session.getMessageCount());
        assertEquals(START, session.getCreatedAt());
        assertEquals(START.plus(Duration.ofMinutes(5)), session.getLastActivity());
    }

    @Test
    void getOrCreate_returnsSnapshotIsolatedFromStore() {
        ResearchSession snapshot = service.getOrCreate("s1");
        snapshot.getResearchContext().put("leak", true);

        assertFalse(service.get("s1").orElseThrow().getResearchContext().containsKey("leak"));
    }

    // ==================== expiry and eviction ====================

    @Test
    void shouldExpireIdleSessions() {
        service.getOrCreate("s1");
        clock.advance(Duration.ofHours(1).plusSeconds(1));

        assertTrue(service.get("s1").isEmpty());
        ResearchSession recreated = service.getOrCreate("s1");
        assertEquals(clock.instant(), recreated.getCreatedAt());
    }

    @Test
    void shouldKeepSessionAtExactlyIdleTimeout() {
        service.getOrCreate("s1");
        clock.advance(Duration.ofHours(1));

        assertTrue(service.get("s1").isPresent());
    }

    @Test
    void shouldEvictLeastRecentlyActiveWhenFull() {
        service.getOrCreate("a");
        clock.advance(Duration.ofSeconds(1));
        service.getOrCreate("b");
        clock.advance(Duration.ofSeconds(1));
        service.getOrCreate("c");
        clock.advance(Duration.ofSeconds(1));
        service.getOrCreate("a");
        clock.advance(Duration.ofSeconds(1));

        service.getOrCreate("d");

        assertTrue(service.get("b").isEmpty());
        assertTrue(service.get("a").isPresent());
        assertTrue(service.get("c").isPresent());
        assertTrue(service.get("d").isPresent());
        assertEquals(3, service.listAll().size());
    }

    @Test
    void shouldEvictEarliestTouchedOnActivityTie() {
        service.getOrCreate("a");
        service.getOrCreate("b");
        service.getOrCreate("c");

        service.getOrCreate("d");

        assertTrue(service.get("a").isEmpty());
        assertTrue(service.get("b").isPresent());
    }

    // ==================== append and context ====================

    @Test
    void appendMessage_recreatesMissingSession() {
        service.appendMessage("ghost", Message.user("hi", clock.instant()));

        Optional<ResearchSession> session = service.get("ghost");
        assertTrue(session.isPresent());
        assertEquals(1, session.get().getMessageCount());
    }

    @Test
    void updateContext_mergesKeys() {
        service.getOrCreate("s1");
        service.updateContext("s1", Map.of("last_query", "q1", "data_sources", List.of("etherscan")));
        service.updateContext("s1", Map.of("last_query", "q2"));

        Map<String, Object> context = service.get("s1").orElseThrow().getResearchContext();
        assertEquals("q2", context.get("last_query"));
        assertEquals(List.of("etherscan"), context.get("data_sources"));
    }

    // ==================== summarize ====================

    @Test
    void summarize_emptyForUnknownOrEmptySession() {
        assertEquals("", service.summarize("missing", 10));
        service.getOrCreate("s1");
        assertEquals("", service.summarize("s1", 10));
    }

    @Test
    void summarize_labelsRolesAndKeepsLastMessages() {
        service.getOrCreate("s1");
        service.appendMessage("s1", Message.user("first question", clock.instant()));
        service.appendMessage("s1", Message.assistant("first answer", clock.instant(), Map.of()));
        service.appendMessage("s1", Message.user("second question", clock.instant()));

        String summary = service.summarize("s1", 2);

        assertEquals("Assistant responded about: first answer\nUser asked: second question", summary);
    }

    @Test
    void summarize_truncatesLongContent() {
        properties.getSessions().setPreviewLength(10);
        service.getOrCreate("s1");
        service.appendMessage("s1", Message.user("abcdefghijklmnop", clock.instant()));

        assertEquals("User asked: abcdefghij...", service.summarize("s1", 10));
    }

    @Test
    void listAll_mostRecentFirst() {
        service.getOrCreate("old");
        clock.advance(Duration.ofMinutes(1));
        service.getOrCreate("new");

        List<ResearchSession> sessions = service.listAll();

        assertEquals("new", sessions.get(0).getId());
        assertEquals("old", sessions.get(1).getId());
    }
}
