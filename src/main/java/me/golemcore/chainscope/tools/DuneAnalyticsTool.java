package me.golemcore.chainscope.tools;

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

import me.golemcore.chainscope.domain.component.ToolComponent;
import me.golemcore.chainscope.domain.model.DataProviders;
import me.golemcore.chainscope.domain.model.ToolInvocation;
import me.golemcore.chainscope.domain.model.ToolResult;
import me.golemcore.chainscope.infrastructure.config.ChainscopeProperties;
import me.golemcore.chainscope.infrastructure.http.FeignClientFactory;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import feign.FeignException;
import feign.Headers;
import feign.Param;
import feign.RequestLine;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * DEX pair statistics from the Dune Analytics preset endpoints.
 *
 * <p>
 * Fetches the top pairs by 24h volume for the chain named in the query
 * (Ethereum when none is named). When the query asks about a specific
 * address, pairs are filtered to those containing that token.
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code chainscope.tools.dune.enabled} - Enable/disable
 * <li>{@code chainscope.tools.dune.api-key} - API key (required)
 * <li>{@code chainscope.tools.dune.base-url} - API base URL
 * </ul>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DuneAnalyticsTool implements ToolComponent {

    static final String ENDPOINT_DEX_PAIRS = "dex_pairs";
    static final String DEFAULT_CHAIN = "ethereum";
    static final List<String> SUPPORTED_CHAINS = List.of("ethereum", "arbitrum", "optimism", "polygon", "bsc",
            "avalanche", "solana", "base", "fantom", "zksync", "tron", "linea");

    private static final int PAIR_LIMIT = 100;
    private static final String SORT = "one_day_volume desc";
    private static final List<String> ADDRESS_HINTS = List.of("address", "wallet", "specific", "particular");

    private final FeignClientFactory feignClientFactory;
    private final ChainscopeProperties properties;
    private final ObjectMapper objectMapper;

    private DuneApi api;
    private boolean enabled;
    private String apiKey;

    @PostConstruct
    public void init() {
        var config = properties.getTools().getDune();
        this.enabled = config.isEnabled();
        this.apiKey = config.getApiKey();

        if (enabled && (apiKey == null || apiKey.isBlank())) {
            log.warn("Dune Analytics tool is enabled but API key is not configured. Disabling.");
            this.enabled = false;
        }

        if (enabled) {
            this.api = feignClientFactory.create(DuneApi.class, config.getBaseUrl());
            log.info("Dune Analytics tool initialized ({})", config.getBaseUrl());
        }
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public String getToolName() {
        return DataProviders.DUNE_ANALYTICS;
    }

    @Override
    public String getDescription() {
        return "DEX trading pairs, volumes and liquidity across EVM chains and Solana";
    }

    @Override
    public CompletableFuture<ToolResult> invoke(ToolInvocation invocation) {
        // runs on the calling dispatch thread
        if (!enabled) {
            return CompletableFuture.completedFuture(
                    ToolResult.failure(getToolName(), "Dune Analytics API key not configured"));
        }
        return CompletableFuture.completedFuture(fetch(invocation));
    }

    private ToolResult fetch(ToolInvocation invocation) {
        String chain = detectChain(invocation.getQuery());
        String filters = tokenFilter(invocation);
        try {
            JsonNode response = filters != null
                    ? api.dexPairs(apiKey, chain, PAIR_LIMIT, SORT, filters)
                    : api.dexPairs(apiKey, chain, PAIR_LIMIT, SORT);
            JsonNode rows = response != null ? response.path("result").path("rows") : null;
            if (rows == null || !rows.isArray()) {
                return ToolResult.failure(getToolName(), "Dune Analytics returned no result rows");
            }
            log.debug("[Dune] {} pairs on {} (filtered: {})", rows.size(), chain, filters != null);

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put(ToolResult.META_ENDPOINT, ENDPOINT_DEX_PAIRS);
            metadata.put("chain", chain);
            return ToolResult.success(getToolName(), rows, metadata);
        } catch (FeignException e) {
            String message = errorMessage(e);
            log.warn("[Dune] API error (status {}): {}", e.status(), message);
            return ToolResult.failure(getToolName(), message);
        } catch (Exception e) { // NOSONAR - broad catch for unexpected errors
            log.error("[Dune] Unexpected error", e);
            return ToolResult.failure(getToolName(), "Dune Analytics request failed: " + e.getMessage());
        }
    }

    static String detectChain(String query) {
        String lower = query.toLowerCase(Locale.ROOT);
        return SUPPORTED_CHAINS.stream()
                .filter(lower::contains)
                .findFirst()
                .orElse(DEFAULT_CHAIN);
    }

    static String tokenFilter(ToolInvocation invocation) {
        if (!invocation.hasAddress()) {
            return null;
        }
        String lower = invocation.getQuery().toLowerCase(Locale.ROOT);
        if (ADDRESS_HINTS.stream().noneMatch(lower::contains)) {
            return null;
        }
        String address = invocation.getAddress().toLowerCase(Locale.ROOT);
        return "token_a_address = '" + address + "' OR token_b_address = '" + address + "'";
    }

    private String errorMessage(FeignException e) {
        String body = e.contentUTF8();
        if (body != null && !body.isBlank()) {
            try {
                String error = objectMapper.readTree(body).path("error").asText("");
                if (!error.isBlank()) {
                    return error;
                }
            } catch (IOException parseError) {
                log.debug("[Dune] Unparsable error body: {}", parseError.getMessage());
            }
        }
        return "HTTP " + e.status();
    }

    // Feign API interface
    interface DuneApi {
        @RequestLine("GET /api/v1/dex/pairs/{chain}?limit={limit}&sort_by={sort}")
        @Headers({
                "Accept: application/json",
                "X-Dune-API-Key: {apiKey}"
        })
        JsonNode dexPairs(@Param("apiKey") String apiKey, @Param("chain") String chain,
                @Param("limit") int limit, @Param("sort") String sort);

        @RequestLine("GET /api/v1/dex/pairs/{chain}?limit={limit}&sort_by={sort}&filters={filters}")
        @Headers({
                "Accept: application/json",
                "X-Dune-API-Key: {apiKey}"
        })
        JsonNode dexPairs(@Param("apiKey") String apiKey, @Param("chain") String chain,
                @Param("limit") int limit, @Param("sort") String sort, @Param("filters") String filters);
    }
}
