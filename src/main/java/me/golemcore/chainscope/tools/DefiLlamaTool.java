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
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import feign.FeignException;
import feign.Headers;
import feign.Param;
import feign.RequestLine;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import java.util.function.ToDoubleFunction;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

/**
 * Public DeFi data from DefiLlama. No API key is needed.
 *
 * <p>
 * Broad DeFi questions (TVL, stablecoins, DEX volume, fees, yields, bridges)
 * fan out to all six DefiLlama services in parallel on a small pool owned by
 * the tool and return one aggregate payload of the shape
 * {@code {aggregate: true, chain, tvl: {count, top}, ...}}. A section whose
 * request fails is left out. Price questions go to the coins service,
 * protocol questions to the protocol list, everything else to the chain TVL
 * list.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DefiLlamaTool implements ToolComponent {

    static final String ENDPOINT_AGGREGATE = "aggregate";
    static final String ENDPOINT_PRICES = "prices";
    static final String ENDPOINT_PROTOCOLS = "protocols";
    static final String ENDPOINT_CHAINS = "chains";

    private static final int TOP_ITEMS = 10;
    private static final int FAN_OUT_THREADS = 6;
    private static final List<String> AGGREGATE_KEYWORDS = List.of("all", "overview", "defi", "tvl", "stablecoin",
            "dex", "fees", "revenue", "yield", "apy", "bridge");
    private static final List<String> FOCUSED_KEYWORDS = List.of("price", "protocol", "historical", "chain tvl",
            "chart");
    private static final List<String> PRICE_KEYWORDS = List.of("price", "prices", "quote");
    private static final List<String> CHAINS = List.of("ethereum", "arbitrum", "optimism", "polygon", "bsc",
            "avalanche", "solana", "base", "fantom", "tron");
    private static final String DEFAULT_COINS = "coingecko:ethereum,coingecko:bitcoin";

    private static final Map<String, String> COINGECKO_IDS = Map.ofEntries(
            Map.entry("bitcoin", "coingecko:bitcoin"),
            Map.entry("btc", "coingecko:bitcoin"),
            Map.entry("ethereum", "coingecko:ethereum"),
            Map.entry("eth", "coingecko:ethereum"),
            Map.entry("solana", "coingecko:solana"),
            Map.entry("sol", "coingecko:solana"),
            Map.entry("cardano", "coingecko:cardano"),
            Map.entry("ada", "coingecko:cardano"),
            Map.entry("chainlink", "coingecko:chainlink"),
            Map.entry("link", "coingecko:chainlink"),
            Map.entry("avalanche", "coingecko:avalanche-2"),
            Map.entry("avax", "coingecko:avalanche-2"),
            Map.entry("dogecoin", "coingecko:dogecoin"),
            Map.entry("doge", "coingecko:dogecoin"),
            Map.entry("usdc", "coingecko:usd-coin"),
            Map.entry("usdt", "coingecko:tether"));

    private final FeignClientFactory feignClientFactory;
    private final ChainscopeProperties properties;
    private final ObjectMapper objectMapper;

    private DefiLlamaApi api;
    private StablecoinsApi stablecoinsApi;
    private YieldsApi yieldsApi;
    private BridgesApi bridgesApi;
    private CoinsApi coinsApi;
    private ExecutorService fanOutExecutor;
    private boolean enabled;

    @PostConstruct
    public void init() {
        var config = properties.getTools().getDefillama();
        this.enabled = config.isEnabled();
        if (enabled) {
            this.api = feignClientFactory.create(DefiLlamaApi.class, config.getBaseUrl());
            this.stablecoinsApi = feignClientFactory.create(StablecoinsApi.class, config.getStablecoinsUrl());
            this.yieldsApi = feignClientFactory.create(YieldsApi.class, config.getYieldsUrl());
            this.bridgesApi = feignClientFactory.create(BridgesApi.class, config.getBridgesUrl());
            this.coinsApi = feignClientFactory.create(CoinsApi.class, config.getCoinsUrl());
            AtomicInteger counter = new AtomicInteger();
            this.fanOutExecutor = Executors.newFixedThreadPool(FAN_OUT_THREADS, runnable -> {
                Thread thread = new Thread(runnable, "defillama-fanout-" + counter.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            });
            log.info("DefiLlama tool initialized ({})", config.getBaseUrl());
        }
    }

    @PreDestroy
    public void destroy() {
        if (fanOutExecutor != null) {
            fanOutExecutor.shutdownNow();
        }
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public String getToolName() {
        return DataProviders.DEFILLAMA;
    }

    @Override
    public String getDescription() {
        return "DeFi TVL, stablecoins, DEX volume, fees, yields, bridges and token prices";
    }

    @Override
    public CompletableFuture<ToolResult> invoke(ToolInvocation invocation) {
        // runs on the calling dispatch thread
        if (!enabled) {
            return CompletableFuture.completedFuture(
                    ToolResult.failure(getToolName(), "DefiLlama tool is disabled"));
        }
        return CompletableFuture.completedFuture(fetch(invocation.getQuery()));
    }

    private ToolResult fetch(String query) {
        String lower = query.toLowerCase(Locale.ROOT);
        String chain = detectChain(lower);
        String endpoint = selectEndpoint(lower);
        try {
            JsonNode data = switch (endpoint) {
            case ENDPOINT_AGGREGATE -> aggregate(chain);
            case ENDPOINT_PRICES -> coinsApi.currentPrices(coinIds(lower));
            case ENDPOINT_PROTOCOLS -> api.protocols();
            default -> api.chains();
            };
            if (data == null) {
                return ToolResult.failure(getToolName(), "DefiLlama returned no data");
            }
            log.debug("[DefiLlama] {} succeeded (chain: {})", endpoint, chain);

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put(ToolResult.META_ENDPOINT, endpoint);
            if (chain != null) {
                metadata.put("chain", chain);
            }
            return ToolResult.success(getToolName(), data, metadata);
        } catch (FeignException e) {
            log.warn("[DefiLlama] API error (status {}) on {}", e.status(), endpoint);
            return ToolResult.failure(getToolName(), "HTTP " + e.status());
        } catch (Exception e) { // NOSONAR - broad catch for unexpected errors
            log.error("[DefiLlama] Unexpected error on {}", endpoint, e);
            return ToolResult.failure(getToolName(), "DefiLlama request failed: " + e.getMessage());
        }
    }

    static String selectEndpoint(String lowerQuery) {
        boolean broad = AGGREGATE_KEYWORDS.stream().anyMatch(lowerQuery::contains);
        boolean focused = FOCUSED_KEYWORDS.stream().anyMatch(lowerQuery::contains);
        if (broad && !focused) {
            return ENDPOINT_AGGREGATE;
        }
        if (PRICE_KEYWORDS.stream().anyMatch(lowerQuery::contains)) {
            return ENDPOINT_PRICES;
        }
        if (lowerQuery.contains("protocol")) {
            return ENDPOINT_PROTOCOLS;
        }
        return ENDPOINT_CHAINS;
    }

    static String detectChain(String lowerQuery) {
        return CHAINS.stream().filter(lowerQuery::contains).findFirst().orElse(null);
    }

    static String coinIds(String lowerQuery) {
        Set<String> ids = new LinkedHashSet<>();
        for (String word : lowerQuery.split("[^a-z0-9]+")) {
            String id = COINGECKO_IDS.get(word);
            if (id != null) {
                ids.add(id);
            }
        }
        return ids.isEmpty() ? DEFAULT_COINS : String.join(",", ids);
    }

    private ObjectNode aggregate(String chain) {
        CompletableFuture<JsonNode> chains = fetchQuietly("chains", api::chains);
        CompletableFuture<JsonNode> stablecoins = fetchQuietly("stablecoins", stablecoinsApi::stablecoins);
        CompletableFuture<JsonNode> dexs = fetchQuietly("dexs",
                () -> chain != null ? api.dexOverview(chain) : api.dexOverview());
        CompletableFuture<JsonNode> fees = fetchQuietly("fees",
                () -> chain != null ? api.feesOverview(chain) : api.feesOverview());
        CompletableFuture<JsonNode> pools = fetchQuietly("pools", yieldsApi::pools);
        CompletableFuture<JsonNode> bridges = fetchQuietly("bridges", bridgesApi::bridges);
        CompletableFuture.allOf(chains, stablecoins, dexs, fees, pools, bridges).join();

        ObjectNode result = objectMapper.createObjectNode();
        result.put(ENDPOINT_AGGREGATE, true);
        if (chain != null) {
            result.put("chain", chain);
        } else {
            result.putNull("chain");
        }
        putSection(result, "tvl", chains.join(), node -> number(node, "tvl"));
        putSection(result, "stablecoins", child(stablecoins.join(), "peggedAssets"),
                node -> number(node.path("circulating"), "peggedUSD"));
        putSection(result, "dex", child(dexs.join(), "protocols"), node -> number(node, "total24h"));
        putSection(result, "fees", child(fees.join(), "protocols"), node -> number(node, "total24h"));
        putSection(result, "yields", filterPools(child(pools.join(), "data"), chain), node -> number(node, "apy"));
        putSection(result, "bridges", child(bridges.join(), "bridges"), node -> number(node, "lastDailyVolume"));

        if (result.size() <= 2) {
            throw new IllegalStateException("all DefiLlama services failed");
        }
        return result;
    }

    private CompletableFuture<JsonNode> fetchQuietly(String name, Supplier<JsonNode> call) {
        return CompletableFuture.supplyAsync(call, fanOutExecutor).exceptionally(e -> {
            log.warn("[DefiLlama] {} unavailable: {}", name, e.getMessage());
            return null;
        });
    }

    private static JsonNode child(JsonNode parent, String field) {
        return parent != null ? parent.get(field) : null;
    }

    private JsonNode filterPools(JsonNode pools, String chain) {
        if (pools == null || chain == null || !pools.isArray()) {
            return pools;
        }
        ArrayNode filtered = objectMapper.createArrayNode();
        for (JsonNode pool : pools) {
            if (chain.equalsIgnoreCase(pool.path("chain").asText(""))) {
                filtered.add(pool);
            }
        }
        return filtered;
    }

    private void putSection(ObjectNode target, String name, JsonNode items, ToDoubleFunction<JsonNode> metric) {
        if (items == null || !items.isArray() || items.isEmpty()) {
            return;
        }
        List<JsonNode> top = StreamSupport.stream(items.spliterator(), false)
                .sorted(Comparator.comparingDouble(metric).reversed())
                .limit(TOP_ITEMS)
                .collect(Collectors.toCollection(ArrayList::new));
        ObjectNode section = target.putObject(name);
        section.put("count", items.size());
        section.putArray("top").addAll(top);
    }

    private static double number(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isNumber() ? value.asDouble() : 0d;
    }

    // Feign API interfaces
    interface DefiLlamaApi {
        @RequestLine("GET /v2/chains")
        @Headers("Accept: application/json")
        JsonNode chains();

        @RequestLine("GET /protocols")
        @Headers("Accept: application/json")
        JsonNode protocols();

        @RequestLine("GET /overview/dexs?excludeTotalDataChart=true&excludeTotalDataChartBreakdown=true")
        @Headers("Accept: application/json")
        JsonNode dexOverview();

        @RequestLine("GET /overview/dexs/{chain}?excludeTotalDataChart=true&excludeTotalDataChartBreakdown=true")
        @Headers("Accept: application/json")
        JsonNode dexOverview(@Param("chain") String chain);

        @RequestLine("GET /overview/fees?excludeTotalDataChart=true&excludeTotalDataChartBreakdown=true")
        @Headers("Accept: application/json")
        JsonNode feesOverview();

        @RequestLine("GET /overview/fees/{chain}?excludeTotalDataChart=true&excludeTotalDataChartBreakdown=true")
        @Headers("Accept: application/json")
        JsonNode feesOverview(@Param("chain") String chain);
    }

    interface StablecoinsApi {
        @RequestLine("GET /stablecoins?includePrices=true")
        @Headers("Accept: application/json")
        JsonNode stablecoins();
    }

    interface YieldsApi {
        @RequestLine("GET /pools")
        @Headers("Accept: application/json")
        JsonNode pools();
    }

    interface BridgesApi {
        @RequestLine("GET /bridges")
        @Headers("Accept: application/json")
        JsonNode bridges();
    }

    interface CoinsApi {
        @RequestLine("GET /prices/current/{coins}")
        @Headers("Accept: application/json")
        JsonNode currentPrices(@Param("coins") String coins);
    }
}
