package me.golemcore.chainscope.adapter.outbound.llm;

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

import me.golemcore.chainscope.domain.model.LlmRequest;
import me.golemcore.chainscope.domain.model.LlmResponse;
import me.golemcore.chainscope.domain.model.Message;
import me.golemcore.chainscope.infrastructure.config.ChainscopeProperties;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Language model adapter backed by langchain4j. Serves the {@code openai}
 * provider (and any OpenAI-compatible endpoint through the base URL) and the
 * {@code anthropic} provider.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jAdapter implements LlmProviderAdapter {

    /**
     * Max retry attempts for rate limit errors (exponential backoff).
     */
    private static final int MAX_RETRIES = 3;
    private static final long INITIAL_BACKOFF_MS = 2_000;
    private static final double BACKOFF_MULTIPLIER = 2.0;
    private static final String PROVIDER_OPENAI = "openai";
    private static final String PROVIDER_ANTHROPIC = "anthropic";
    private static final Set<String> PROVIDERS = Set.of(PROVIDER_OPENAI, PROVIDER_ANTHROPIC);

    private final ChainscopeProperties properties;

    private ChatModel chatModel;
    private volatile boolean initialized = false;

    @Override
    public boolean supports(String provider) {
        return PROVIDERS.contains(provider);
    }

    @Override
    public synchronized void initialize() {
        if (initialized) {
            return;
        }
        ChainscopeProperties.LlmProperties llm = properties.getLlm();
        if (!hasApiKey()) {
            log.warn("Langchain4j adapter not initialized: no API key for provider {}", llm.getProvider());
            return;
        }
        try {
            this.chatModel = createModel(llm);
            initialized = true;
            log.info("Langchain4j adapter initialized with provider: {}, model: {}", llm.getProvider(),
                    llm.getModel());
        } catch (RuntimeException e) {
            log.warn("Failed to initialize Langchain4j adapter: {}", e.getMessage());
        }
    }

    private ChatModel createModel(ChainscopeProperties.LlmProperties llm) {
        if (PROVIDER_ANTHROPIC.equals(llm.getProvider())) {
            return createAnthropicModel(llm);
        }
        return createOpenAiModel(llm);
    }

    private ChatModel createAnthropicModel(ChainscopeProperties.LlmProperties llm) {
        var builder = AnthropicChatModel.builder()
                .apiKey(llm.getApiKey())
                .modelName(llm.getModel())
                .maxRetries(0) // Retry handled by our backoff logic
                .maxTokens(llm.getMaxTokens())
                .temperature(llm.getTemperature())
                .timeout(llm.getTimeout());

        if (llm.getBaseUrl() != null && !llm.getBaseUrl().isBlank()) {
            builder.baseUrl(llm.getBaseUrl());
        }
        return builder.build();
    }

    private ChatModel createOpenAiModel(ChainscopeProperties.LlmProperties llm) {
        var builder = OpenAiChatModel.builder()
                .apiKey(llm.getApiKey())
                .modelName(llm.getModel())
                .maxRetries(0) // Retry handled by our backoff logic
                .maxTokens(llm.getMaxTokens())
                .temperature(llm.getTemperature())
                .timeout(llm.getTimeout());

        if (llm.getBaseUrl() != null && !llm.getBaseUrl().isBlank()) {
            builder.baseUrl(llm.getBaseUrl());
        }
        return builder.build();
    }

    @Override
    public String getProviderId() {
        return "langchain4j";
    }

    @Override
    public boolean isAvailable() {
        return hasApiKey();
    }

    private boolean hasApiKey() {
        String apiKey = properties.getLlm().getApiKey();
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        return CompletableFuture.supplyAsync(() -> {
            if (!initialized) {
                initialize();
            }
            if (chatModel == null) {
                throw new IllegalStateException("Langchain4j adapter not available");
            }

            List<ChatMessage> messages = convertMessages(request);
            for (int attempt = 0; attempt <= MAX_RETRIES; attempt++) {
                try {
                    return convertResponse(chatModel.chat(messages));
                } catch (RuntimeException e) {
                    if (isRateLimitError(e) && attempt < MAX_RETRIES) {
                        long backoffMs = (long) (INITIAL_BACKOFF_MS * Math.pow(BACKOFF_MULTIPLIER, attempt));
                        log.warn("[LLM] Rate limit hit (attempt {}/{}), retrying in {}ms...",
                                attempt + 1, MAX_RETRIES, backoffMs);
                        sleep(backoffMs);
                    } else {
                        log.error("LLM chat failed", e);
                        throw new IllegalStateException("LLM chat failed: " + e.getMessage(), e);
                    }
                }
            }
            throw new IllegalStateException("LLM chat failed: max retries exhausted");
        });
    }

    private void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("LLM chat interrupted during retry backoff", ie);
        }
    }

    List<ChatMessage> convertMessages(LlmRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        if (request.getSystemPrompt() != null && !request.getSystemPrompt().isBlank()) {
            messages.add(SystemMessage.from(request.getSystemPrompt()));
        }
        if (request.getHistory() != null) {
            for (Message message : request.getHistory()) {
                if (message.getContent() == null || message.getContent().isBlank()) {
                    continue;
                }
                if (message.isAssistantMessage()) {
                    messages.add(AiMessage.from(message.getContent()));
                } else {
                    messages.add(UserMessage.from(message.getContent()));
                }
            }
        }
        messages.add(UserMessage.from(request.getPrompt()));
        return messages;
    }

    private LlmResponse convertResponse(ChatResponse response) {
        AiMessage aiMessage = response.aiMessage();
        return LlmResponse.builder()
                .content(aiMessage != null ? aiMessage.text() : null)
                .model(response.modelName() != null ? response.modelName() : properties.getLlm().getModel())
                .finishReason(response.finishReason() != null ? response.finishReason().name() : null)
                .build();
    }

    private boolean isRateLimitError(Throwable e) {
        Throwable current = e;
        while (current != null) {
            // langchain4j maps HTTP 429 to RateLimitException
            if (current instanceof dev.langchain4j.exception.RateLimitException) {
                return true;
            }
            String msg = current.getMessage();
            if (msg != null && (msg.contains("rate_limit") || msg.contains("Too Many Requests")
                    || msg.contains("429"))) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }
}
