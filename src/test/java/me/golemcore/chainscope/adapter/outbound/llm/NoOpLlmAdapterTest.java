package me.golemcore.chainscope.adapter.outbound.llm;

import me.golemcore.chainscope.domain.model.LlmRequest;
import me.golemcore.chainscope.domain.model.LlmResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class NoOpLlmAdapterTest {

    private NoOpLlmAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = new NoOpLlmAdapter();
    }

    @Test
    void shouldReturnPlaceholderResponseFromChat() throws Exception {
        LlmResponse response = adapter.chat(LlmRequest.builder().prompt("anything").build()).get();

        assertEquals("[No LLM configured]", response.getContent());
        assertEquals("none", response.getModel());
        assertEquals("stop", response.getFinishReason());
    }

    @Test
    void shouldReportUnavailable() {
        assertFalse(adapter.isAvailable());
        assertEquals("none", adapter.getProviderId());
    }

    @Test
    void shouldSupportOnlyNoneProvider() {
        assertTrue(adapter.supports("none"));
        assertFalse(adapter.supports("openai"));
    }
}
