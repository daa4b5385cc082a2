package me.golemcore.chainscope.domain.fusion;

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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import me.golemcore.chainscope.domain.model.DataProviders;
import me.golemcore.chainscope.domain.model.ToolResult;
import me.golemcore.chainscope.domain.model.fusion.DefiOverview;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Recognizes DefiLlama payloads.
 *
 * <p>
 * The aggregate bundle is split into one overview per section (TVL,
 * stablecoins, DEX, fees, yields, bridges). Price responses become a single
 * prices overview under a provider-qualified key so they never compete with
 * market quotes. Chain and protocol lists become overviews, and stand-alone
 * stablecoin, protocol or bridge responses are summarized by their shape.
 */
@Component
public class DefiLlamaRecognizer implements ShapeRecognizer {

    static final String ENDPOINT_AGGREGATE = "aggregate";
    static final String ENDPOINT_PRICES = "prices";
    static final String ENDPOINT_CHAINS = "chains";
    static final String ENDPOINT_PROTOCOLS = "protocols";
    static final String PRICES_KEY = "defillama_prices";

    private static final int SAMPLE_SIZE = 5;
    private static final int TOP_ITEMS = 10;

    private static final Map<String, DefiOverview.Kind> AGGREGATE_SECTIONS = Map.of(
            "tvl", DefiOverview.Kind.TVL,
            "stablecoins", DefiOverview.Kind.STABLECOINS,
            "dex", DefiOverview.Kind.DEX,
            "fees", DefiOverview.Kind.FEES,
            "yields", DefiOverview.Kind.YIELDS,
            "bridges", DefiOverview.Kind.BRIDGES);

    @Override
    public boolean supports(String source) {
        return DataProviders.DEFILLAMA.equals(source);
    }

    @Override
    public List<RecognizedRecord> recognize(ToolResult result) {
        JsonNode data = result.getData();
        if (data == null || data.isNull()) {
            return List.of();
        }
        String endpoint = result.getEndpoint();
        String chain = chainOf(result);

        if (data.isObject() && data.path(ENDPOINT_AGGREGATE).asBoolean(false)) {
            return aggregateSections(data, chain);
        }
        if (ENDPOINT_PRICES.equals(endpoint) && data.has("coins")) {
            return prices(data.get("coins"), chain);
        }
        if (ENDPOINT_CHAINS.equals(endpoint) && data.isArray()) {
            return List.of(new RecognizedRecord("defillama_tvl",
                    overview(DefiOverview.Kind.TVL, chain, data.size(), topByNumber(data, "tvl", TOP_ITEMS))));
        }
        if (ENDPOINT_PROTOCOLS.equals(endpoint) && data.isArray()) {
            return List.of(new RecognizedRecord("defillama_protocols",
                    overview(DefiOverview.Kind.PROTOCOLS, chain, data.size(), topByNumber(data, "tvl", TOP_ITEMS))));
        }
        if (data.isObject()) {
            return byShape(data, chain);
        }
        return List.of();
    }

    private List<RecognizedRecord> aggregateSections(JsonNode data, String chain) {
        List<RecognizedRecord> records = new ArrayList<>();
        AGGREGATE_SECTIONS.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .forEach(section -> {
                    JsonNode summary = data.get(section.getKey());
                    if (summary != null && summary.isObject() && !summary.path("top").isEmpty()) {
                        int count = summary.path("count").asInt(0);
                        records.add(new RecognizedRecord("defillama_" + section.getKey(),
                                overview(section.getValue(), chain, count, JsonValues.all(summary.get("top")))));
                    }
                });
        return records;
    }

    private List<RecognizedRecord> prices(JsonNode coins, String chain) {
        List<JsonNode> items = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = coins.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (field.getValue().isObject()) {
                ObjectNode item = ((ObjectNode) field.getValue()).deepCopy();
                item.put("id", field.getKey());
                items.add(item);
            }
        }
        if (items.isEmpty()) {
            return List.of();
        }
        items.sort(Comparator.comparing((JsonNode item) -> item.path("id").asText()));
        // spot prices are context, never market quotes
        return List.of(new RecognizedRecord(PRICES_KEY,
                overview(DefiOverview.Kind.PRICES, chain, items.size(), List.copyOf(items))));
    }

    private List<RecognizedRecord> byShape(JsonNode data, String chain) {
        if (data.has("peggedAssets") || data.has("chains")) {
            JsonNode assets = data.get("peggedAssets");
            return List.of(new RecognizedRecord("stablecoins_overview", overview(DefiOverview.Kind.STABLECOINS,
                    chain, sizeOf(assets), JsonValues.head(assets, SAMPLE_SIZE))));
        }
        if (data.has("protocols") || data.has("totalDataChart")) {
            JsonNode protocols = data.get("protocols");
            return List.of(new RecognizedRecord("defi_overview", overview(DefiOverview.Kind.PROTOCOLS,
                    chain, sizeOf(protocols), JsonValues.head(protocols, SAMPLE_SIZE))));
        }
        if (data.has("bridges")) {
            JsonNode bridges = data.get("bridges");
            return List.of(new RecognizedRecord("bridges_overview", overview(DefiOverview.Kind.BRIDGES,
                    chain, sizeOf(bridges), JsonValues.head(bridges, SAMPLE_SIZE))));
        }
        return List.of();
    }

    private static DefiOverview overview(DefiOverview.Kind kind, String chain, int count, List<JsonNode> top) {
        return DefiOverview.builder()
                .source(DataProviders.DEFILLAMA)
                .kind(kind)
                .chain(chain)
                .itemCount(count)
                .topItems(top)
                .build();
    }

    private static List<JsonNode> topByNumber(JsonNode array, String field, int limit) {
        List<JsonNode> items = new ArrayList<>(JsonValues.all(array));
        Comparator<JsonNode> byValue = Comparator.comparing(
                (JsonNode item) -> {
                    BigDecimal value = JsonValues.decimal(item, field);
                    return value != null ? value : BigDecimal.ZERO;
                });
        items.sort(byValue.reversed());
        return List.copyOf(items.subList(0, Math.min(limit, items.size())));
    }

    private static int sizeOf(JsonNode node) {
        return node != null && node.isArray() ? node.size() : 0;
    }

    private static String chainOf(ToolResult result) {
        Object chain = result.getMetadata() != null ? result.getMetadata().get("chain") : null;
        return chain != null ? chain.toString() : null;
    }
}
