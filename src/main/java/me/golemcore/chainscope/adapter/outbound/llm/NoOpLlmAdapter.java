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
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Adapter used when no language model is configured. Reports itself as
 * unavailable, so research runs fail with a clear error instead of returning
 * placeholder prose.
 */
@Component
@Slf4j
public class NoOpLlmAdapter implements LlmProviderAdapter {

    static final String PROVIDER_NONE = "none";

    @Override
    public String getProviderId() {
        return PROVIDER_NONE;
    }

    @Override
    public boolean supports(String provider) {
        return PROVIDER_NONE.equals(provider);
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        log.warn("NoOpLlmAdapter: chat() called - no LLM configured");
        return CompletableFuture.completedFuture(LlmResponse.builder()
                .content("[No LLM configured]")
                .model(PROVIDER_NONE)
                .finishReason("stop")
                .build());
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
