package me.golemcore.chainscope.routing;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GreetingResponderTest {

    private final GreetingResponder responder = new GreetingResponder();

    @Test
    void shouldBeDeterministic() {
        assertEquals(responder.respond("Hello", 0), responder.respond("Hello", 0));
    }

    @Test
    void shouldAnswerTimeOfDay() {
        assertTrue(responder.respond("Good morning", 0).toLowerCase().contains("morning"));
        assertTrue(responder.respond("good evening", 0).toLowerCase().contains("evening"));
        assertTrue(responder.respond("good afternoon", 0).toLowerCase().contains("afternoon"));
    }

    @Test
    void shouldThank() {
        String reply = responder.respond("thanks a lot", 4);

        assertTrue(reply.contains("welcome") || reply.contains("pleasure"));
    }

    @Test
    void shouldGreetReturningSessionsDifferently() {
        String fresh = responder.respond("hello", 0);
        String returning = responder.respond("hello", 3);

        assertFalse(fresh.contains("again") || fresh.contains("back"));
        assertTrue(returning.contains("again") || returning.contains("back"));
    }

    @Test
    void shouldTreatTwoMessagesAsNewSession() {
        assertEquals(responder.respond("hello", 0), responder.respond("hello", 2));
    }

    @Test
    void shouldSayGoodbye() {
        String reply = responder.respond("bye", 5);

        assertTrue(reply.startsWith("Goodbye") || reply.startsWith("Take care"));
    }
}
