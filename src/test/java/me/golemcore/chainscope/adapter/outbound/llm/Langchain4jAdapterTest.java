package me.golemcore.chainscope.adapter.outbound.llm;

import me.golemcore.chainscope.domain.model.LlmRequest;
import me.golemcore.chainscope.domain.model.LlmResponse;
import me.golemcore.chainscope.domain.model.Message;
import me.golemcore.chainscope.infrastructure.config.ChainscopeProperties;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.FinishReason;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class Langchain4jAdapterTest {

    private static final String IS_RATE_LIMIT_ERROR = "isRateLimitError";
    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private ChainscopeProperties properties;
    private Langchain4jAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new ChainscopeProperties();
        adapter = new Langchain4jAdapter(properties);
    }

    // ==================== Provider selection ====================

    @ParameterizedTest
    @ValueSource(strings = { "openai", "anthropic" })
    void shouldSupportProvider(String provider) {
        assertTrue(adapter.supports(provider));
    }

    @Test
    void shouldNotSupportUnknownProvider() {
        assertFalse(adapter.supports("none"));
        assertFalse(adapter.supports("gemini"));
    }

    @Test
    void shouldBeUnavailableWithoutApiKey() {
        assertFalse(adapter.isAvailable());
        properties.getLlm().setApiKey("sk-test");
        assertTrue(adapter.isAvailable());
    }

    @Test
    void shouldFailChatWhenNotConfigured() {
        LlmRequest request = LlmRequest.builder().prompt("Hi").build();

        ExecutionException ex = assertThrows(ExecutionException.class, () -> adapter.chat(request).get());

        assertInstanceOf(IllegalStateException.class, ex.getCause());
        assertEquals("Langchain4j adapter not available", ex.getCause().getMessage());
    }

    // ==================== Message conversion ====================

    @Test
    void shouldConvertSystemHistoryAndPrompt() {
        LlmRequest request = LlmRequest.builder()
                .systemPrompt("You are an analyst")
                .history(List.of(
                        Message.user("btc price", NOW),
                        Message.assistant("BTC is at 64k", NOW, Map.of()),
                        Message.user("  ", NOW)))
                .prompt("and eth?")
                .build();

        List<ChatMessage> messages = adapter.convertMessages(request);

        assertEquals(4, messages.size());
        assertEquals("You are an analyst", ((SystemMessage) messages.get(0)).text());
        assertEquals("btc price", ((UserMessage) messages.get(1)).singleText());
        assertEquals("BTC is at 64k", ((AiMessage) messages.get(2)).text());
        assertEquals("and eth?", ((UserMessage) messages.get(3)).singleText());
    }

    @Test
    void shouldSkipBlankSystemPrompt() {
        List<ChatMessage> messages = adapter.convertMessages(LlmRequest.builder().systemPrompt(" ").prompt("q").build());

        assertEquals(1, messages.size());
        assertInstanceOf(UserMessage.class, messages.get(0));
    }

    // ==================== Chat ====================

    @Test
    @SuppressWarnings("unchecked")
    void shouldReturnModelAnswer() throws Exception {
        ChatModel model = mock(ChatModel.class);
        injectChatModel(model);
        ChatResponse chatResponse = ChatResponse.builder()
                .aiMessage(AiMessage.from("ETH looks strong."))
                .finishReason(FinishReason.STOP)
                .build();
        when(model.chat((List<ChatMessage>) any())).thenReturn(chatResponse);

        LlmResponse response = adapter.chat(LlmRequest.builder().prompt("eth?").build()).get();

        assertEquals("ETH looks strong.", response.getContent());
        assertEquals("STOP", response.getFinishReason());
        assertEquals(properties.getLlm().getModel(), response.getModel());
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldWrapModelFailure() {
        ChatModel model = mock(ChatModel.class);
        injectChatModel(model);
        when(model.chat((List<ChatMessage>) any())).thenThrow(new IllegalArgumentException("invalid model"));

        ExecutionException ex = assertThrows(ExecutionException.class,
                () -> adapter.chat(LlmRequest.builder().prompt("eth?").build()).get());

        assertInstanceOf(IllegalStateException.class, ex.getCause());
        assertTrue(ex.getCause().getMessage().contains("invalid model"));
    }

    // ==================== Rate limit detection ====================

    @Test
    void shouldDetectRateLimitErrors() {
        assertTrue((boolean) ReflectionTestUtils.invokeMethod(adapter, IS_RATE_LIMIT_ERROR,
                new RuntimeException("HTTP 429 Too Many Requests")));
        assertTrue((boolean) ReflectionTestUtils.invokeMethod(adapter, IS_RATE_LIMIT_ERROR,
                new RuntimeException("wrapper", new RuntimeException("rate_limit_exceeded"))));
        assertTrue((boolean) ReflectionTestUtils.invokeMethod(adapter, IS_RATE_LIMIT_ERROR,
                new dev.langchain4j.exception.RateLimitException("slow down")));
    }

    @Test
    void shouldNotTreatOtherErrorsAsRateLimit() {
        assertFalse((boolean) ReflectionTestUtils.invokeMethod(adapter, IS_RATE_LIMIT_ERROR,
                new RuntimeException("Connection refused")));
        assertFalse((boolean) ReflectionTestUtils.invokeMethod(adapter, IS_RATE_LIMIT_ERROR,
                new RuntimeException((String) null)));
    }

    private void injectChatModel(ChatModel model) {
        ReflectionTestUtils.setField(adapter, "chatModel", model);
        ReflectionTestUtils.setField(adapter, "initialized", true);
    }
}
