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
import me.golemcore.chainscope.infrastructure.config.ChainscopeProperties;
import me.golemcore.chainscope.port.outbound.LlmPort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;

/**
 * Selects the language model adapter for the configured provider and exposes
 * it as the application's {@link LlmPort}. An unknown provider falls back to
 * the no-op adapter.
 */
@Component
@Primary
@RequiredArgsConstructor
@Slf4j
public class LlmAdapterFactory implements LlmPort {

    private final ChainscopeProperties properties;
    private final List<LlmProviderAdapter> adapters;

    private LlmProviderAdapter activeAdapter;

    @PostConstruct
    public void init() {
        String configured = properties.getLlm().getProvider();
        String provider = configured != null ? configured.trim().toLowerCase(Locale.ROOT) : NoOpLlmAdapter.PROVIDER_NONE;

        activeAdapter = find(provider);
        if (activeAdapter == null) {
            activeAdapter = find(NoOpLlmAdapter.PROVIDER_NONE);
            log.warn("Provider '{}' not supported, using: {}", provider,
                    activeAdapter != null ? activeAdapter.getProviderId() : NoOpLlmAdapter.PROVIDER_NONE);
        } else {
            activeAdapter.initialize();
            log.info("Active LLM provider: {} (adapter: {})", provider, activeAdapter.getProviderId());
        }
    }

    private LlmProviderAdapter find(String provider) {
        for (LlmProviderAdapter adapter : adapters) {
            if (adapter.supports(provider)) {
                return adapter;
            }
        }
        return null;
    }

    /**
     * Get the active LLM adapter based on current configuration.
     */
    public LlmPort getActiveAdapter() {
        return activeAdapter;
    }

    // ==================== LlmPort delegation ====================

    @Override
    public String getProviderId() {
        return activeAdapter != null ? activeAdapter.getProviderId() : NoOpLlmAdapter.PROVIDER_NONE;
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        if (activeAdapter == null) {
            return CompletableFuture.failedFuture(new IllegalStateException("No LLM adapter available"));
        }
        return activeAdapter.chat(request);
    }

    @Override
    public boolean isAvailable() {
        return activeAdapter != null && activeAdapter.isAvailable();
    }
}
