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
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Market data from the CoinMarketCap Pro API.
 *
 * <p>
 * Routes by query:
 * <ul>
 * <li>a recognized asset with "what is", "tell me about" style phrasing -
 * token metadata ({@code /cryptocurrency/info})</li>
 * <li>any other recognized asset - latest quote
 * ({@code /cryptocurrency/quotes/latest})</li>
 * <li>"global" or "total market" - global metrics</li>
 * <li>otherwise the top listings by market cap</li>
 * </ul>
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code chainscope.tools.coinmarketcap.enabled} - Enable/disable
 * <li>{@code chainscope.tools.coinmarketcap.api-key} - API key (required)
 * <li>{@code chainscope.tools.coinmarketcap.base-url} - API base URL
 * </ul>
 *
 * @see <a href="https://coinmarketcap.com/api/documentation/v1/">CoinMarketCap
 *      API</a>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CoinMarketCapTool implements ToolComponent {

    static final String ENDPOINT_INFO = "info";
    static final String ENDPOINT_QUOTES = "quotes";
    static final String ENDPOINT_GLOBAL = "global";
    static final String ENDPOINT_LISTINGS = "listings";

    private static final int TOP_LISTINGS = 25;
    private static final int RANKING_LISTINGS = 20;
    private static final Pattern TOKEN = Pattern.compile("[A-Za-z]{2,10}");
    private static final List<String> INFO_PHRASES = List.of("info about", "information about", "what is",
            "tell me about", "details about");

    /**
     * Names and tickers in match order. The first entry found in the query
     * wins.
     */
    static final Map<String, String> SYMBOLS;

    static {
        Map<String, String> symbols = new LinkedHashMap<>();
        symbols.put("bitcoin", "BTC");
        symbols.put("btc", "BTC");
        symbols.put("ethereum", "ETH");
        symbols.put("eth", "ETH");
        symbols.put("cardano", "ADA");
        symbols.put("ada", "ADA");
        symbols.put("solana", "SOL");
        symbols.put("sol", "SOL");
        symbols.put("polkadot", "DOT");
        symbols.put("dot", "DOT");
        symbols.put("chainlink", "LINK");
        symbols.put("link", "LINK");
        symbols.put("litecoin", "LTC");
        symbols.put("ltc", "LTC");
        symbols.put("dogecoin", "DOGE");
        symbols.put("doge", "DOGE");
        symbols.put("ripple", "XRP");
        symbols.put("xrp", "XRP");
        symbols.put("binance coin", "BNB");
        symbols.put("bnb", "BNB");
        symbols.put("polygon", "MATIC");
        symbols.put("matic", "MATIC");
        symbols.put("avalanche", "AVAX");
        symbols.put("avax", "AVAX");
        symbols.put("tether", "USDT");
        symbols.put("usdt", "USDT");
        symbols.put("usd coin", "USDC");
        symbols.put("usdc", "USDC");
        SYMBOLS = Collections.unmodifiableMap(symbols);
    }

    private static final Set<String> KNOWN_SYMBOLS = Set.copyOf(SYMBOLS.values());

    private final FeignClientFactory feignClientFactory;
    private final ChainscopeProperties properties;
    private final ObjectMapper objectMapper;

    private CoinMarketCapApi api;
    private boolean enabled;
    private String apiKey;

    @PostConstruct
    public void init() {
        var config = properties.getTools().getCoinmarketcap();
        this.enabled = config.isEnabled();
        this.apiKey = config.getApiKey();

        if (enabled && (apiKey == null || apiKey.isBlank())) {
            log.warn("CoinMarketCap tool is enabled but API key is not configured. Disabling.");
            this.enabled = false;
        }

        if (enabled) {
            this.api = feignClientFactory.create(CoinMarketCapApi.class, config.getBaseUrl());
            log.info("CoinMarketCap tool initialized ({})", config.getBaseUrl());
        }
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public String getToolName() {
        return DataProviders.COINMARKETCAP;
    }

    @Override
    public String getDescription() {
        return "Cryptocurrency prices, market caps, rankings, token metadata and global market metrics";
    }

    @Override
    public CompletableFuture<ToolResult> invoke(ToolInvocation invocation) {
        // runs on the calling dispatch thread
        if (!enabled) {
            return CompletableFuture.completedFuture(
                    ToolResult.failure(getToolName(), "CoinMarketCap API key not configured"));
        }
        return CompletableFuture.completedFuture(fetch(invocation.getQuery()));
    }

    private ToolResult fetch(String query) {
        String lower = query.toLowerCase(Locale.ROOT);
        String symbol = detectSymbol(query);
        String endpoint = ENDPOINT_LISTINGS;
        try {
            JsonNode response;
            if (symbol != null && INFO_PHRASES.stream().anyMatch(lower::contains)) {
                endpoint = ENDPOINT_INFO;
                response = api.info(apiKey, symbol);
            } else if (symbol != null) {
                endpoint = ENDPOINT_QUOTES;
                response = api.quotes(apiKey, symbol);
            } else if (lower.contains("global") || lower.contains("total market")) {
                endpoint = ENDPOINT_GLOBAL;
                response = api.globalMetrics(apiKey);
            } else {
                boolean ranking = lower.contains("ranking") || lower.contains("market cap") || lower.contains("top");
                response = api.listings(apiKey, ranking ? RANKING_LISTINGS : TOP_LISTINGS);
            }
            log.debug("[CoinMarketCap] {} succeeded (symbol: {})", endpoint, symbol);

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put(ToolResult.META_ENDPOINT, endpoint);
            if (symbol != null) {
                metadata.put("symbol", symbol);
            }
            return ToolResult.success(getToolName(), response, metadata);
        } catch (FeignException e) {
            String message = errorMessage(e);
            log.warn("[CoinMarketCap] API error (status {}) on {}: {}", e.status(), endpoint, message);
            return ToolResult.failure(getToolName(), message);
        } catch (Exception e) { // NOSONAR - broad catch for unexpected errors
            log.error("[CoinMarketCap] Unexpected error on {}", endpoint, e);
            return ToolResult.failure(getToolName(), "CoinMarketCap request failed: " + e.getMessage());
        }
    }

    static String detectSymbol(String query) {
        String lower = query.toLowerCase(Locale.ROOT);
        Set<String> words = new HashSet<>(Arrays.asList(lower.split("[^a-z0-9]+")));
        for (Map.Entry<String, String> entry : SYMBOLS.entrySet()) {
            String name = entry.getKey();
            // short tickers match whole words only ("sol" must not match "solution")
            boolean hit = name.length() > 4 || name.contains(" ") ? lower.contains(name) : words.contains(name);
            if (hit) {
                return entry.getValue();
            }
        }
        Matcher matcher = TOKEN.matcher(query);
        while (matcher.find()) {
            String candidate = matcher.group().toUpperCase(Locale.ROOT);
            if (KNOWN_SYMBOLS.contains(candidate)) {
                return candidate;
            }
        }
        return null;
    }

    private String errorMessage(FeignException e) {
        String fallback = "HTTP " + e.status();
        String body = e.contentUTF8();
        if (body == null || body.isBlank()) {
            return fallback;
        }
        try {
            JsonNode status = objectMapper.readTree(body).path("status");
            String message = status.path("error_message").asText(null);
            return message != null && !message.isBlank() ? message : fallback;
        } catch (IOException parseError) {
            log.debug("[CoinMarketCap] Unparsable error body: {}", parseError.getMessage());
            return fallback;
        }
    }

    // Feign API interface
    interface CoinMarketCapApi {
        @RequestLine("GET /cryptocurrency/quotes/latest?symbol={symbol}&convert=USD")
        @Headers({
                "Accept: application/json",
                "X-CMC_PRO_API_KEY: {apiKey}"
        })
        JsonNode quotes(@Param("apiKey") String apiKey, @Param("symbol") String symbol);

        @RequestLine("GET /cryptocurrency/info?symbol={symbol}")
        @Headers({
                "Accept: application/json",
                "X-CMC_PRO_API_KEY: {apiKey}"
        })
        JsonNode info(@Param("apiKey") String apiKey, @Param("symbol") String symbol);

        @RequestLine("GET /global-metrics/quotes/latest")
        @Headers({
                "Accept: application/json",
                "X-CMC_PRO_API_KEY: {apiKey}"
        })
        JsonNode globalMetrics(@Param("apiKey") String apiKey);

        @RequestLine("GET /cryptocurrency/listings/latest?start=1&limit={limit}&convert=USD&sort=market_cap&sort_dir=desc")
        @Headers({
                "Accept: application/json",
                "X-CMC_PRO_API_KEY: {apiKey}"
        })
        JsonNode listings(@Param("apiKey") String apiKey, @Param("limit") int limit);
    }
}
