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
import me.golemcore.chainscope.domain.model.DataProviders;
import me.golemcore.chainscope.domain.model.ToolResult;
import me.golemcore.chainscope.domain.model.fusion.GlobalMetrics;
import me.golemcore.chainscope.domain.model.fusion.MarketQuote;
import me.golemcore.chainscope.domain.model.fusion.TokenInfo;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes CoinMarketCap payloads: token metadata from the info route,
 * quotes keyed by symbol, listings and global metrics.
 *
 * <p>
 * Token metadata often carries the latest price, 24h change and supply only in
 * its English description, so those figures are parsed from the text when no
 * quote is attached.
 */
@Component
public class CoinMarketCapRecognizer implements ShapeRecognizer {

    static final String INFO_ENDPOINT = "info";

    private static final Pattern PRICE = Pattern.compile("last known price of .+ is ([\\d,]+\\.\\d+) USD");
    private static final Pattern CHANGE_UP = Pattern.compile("and is up (\\d+(?:\\.\\d+)?)");
    private static final Pattern CHANGE_DOWN = Pattern.compile("and is down (\\d+(?:\\.\\d+)?)");
    private static final Pattern SUPPLY = Pattern.compile("current supply of ([\\d,]+\\.\\d+)");

    @Override
    public boolean supports(String source) {
        return DataProviders.COINMARKETCAP.equals(source);
    }

    @Override
    public List<RecognizedRecord> recognize(ToolResult result) {
        JsonNode data = result.getData() != null ? result.getData().get("data") : null;
        if (data == null || data.isNull()) {
            return List.of();
        }
        if (INFO_ENDPOINT.equals(result.getEndpoint())) {
            return data.isObject() ? tokenInfos(data) : List.of();
        }
        if (data.isObject() && hasQuotedEntries(data)) {
            return quotesBySymbol(data);
        }
        if (data.isArray()) {
            List<RecognizedRecord> records = new ArrayList<>();
            for (JsonNode entry : data) {
                if (entry.isObject()) {
                    MarketQuote quote = quote(entry, JsonValues.text(entry, "symbol"));
                    records.add(new RecognizedRecord(marketKey(quote.getSymbol()), quote));
                }
            }
            return records;
        }
        if (data.isObject() && data.has("quote")) {
            return List.of(new RecognizedRecord("global_metrics", globalMetrics(data)));
        }
        return List.of();
    }

    private static boolean hasQuotedEntries(JsonNode data) {
        for (JsonNode value : data) {
            if (value.isObject() && value.has("quote")) {
                return true;
            }
        }
        return false;
    }

    private List<RecognizedRecord> quotesBySymbol(JsonNode data) {
        List<RecognizedRecord> records = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = data.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode entry = field.getValue();
            if (!entry.isObject()) {
                continue;
            }
            String symbol = JsonValues.text(entry, "symbol");
            MarketQuote quote = quote(entry, symbol != null && !symbol.isBlank() ? symbol : field.getKey());
            records.add(new RecognizedRecord(marketKey(quote.getSymbol()), quote));
        }
        return records;
    }

    private MarketQuote quote(JsonNode entry, String symbol) {
        JsonNode usd = JsonValues.path(entry, "quote", "USD");
        return MarketQuote.builder()
                .source(DataProviders.COINMARKETCAP)
                .name(JsonValues.text(entry, "name"))
                .symbol(symbol != null ? symbol : "UNKNOWN")
                .providerId(JsonValues.longValue(entry, "id"))
                .rank(JsonValues.integer(entry, "cmc_rank"))
                .price(JsonValues.decimal(usd, "price"))
                .marketCap(JsonValues.decimal(usd, "market_cap"))
                .volume24h(JsonValues.decimal(usd, "volume_24h"))
                .percentChange24h(JsonValues.decimal(usd, "percent_change_24h"))
                .percentChange7d(JsonValues.decimal(usd, "percent_change_7d"))
                .circulatingSupply(JsonValues.decimal(entry, "circulating_supply"))
                .totalSupply(JsonValues.decimal(entry, "total_supply"))
                .maxSupply(JsonValues.decimal(entry, "max_supply"))
                .build();
    }

    private List<RecognizedRecord> tokenInfos(JsonNode data) {
        List<RecognizedRecord> records = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = data.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode info = field.getValue();
            if (!info.isObject()) {
                continue;
            }
            String symbol = JsonValues.text(info, "symbol");
            String id = JsonValues.text(info, "id");
            String providerId = id != null ? id : field.getKey();
            String key = (symbol != null ? symbol : "UNKNOWN") + "_" + providerId;
            records.add(new RecognizedRecord(key, tokenInfo(providerId, info, symbol)));
        }
        return records;
    }

    private TokenInfo tokenInfo(String id, JsonNode info, String symbol) {
        String description = JsonValues.text(info, "description");
        BigDecimal price = match(PRICE, description);
        BigDecimal change = match(CHANGE_UP, description);
        if (change == null) {
            BigDecimal down = match(CHANGE_DOWN, description);
            change = down != null ? down.negate() : null;
        }
        JsonNode usd = JsonValues.path(info, "quote", "USD");
        if (price == null) {
            price = JsonValues.decimal(usd, "price");
        }
        if (change == null) {
            change = JsonValues.decimal(usd, "percent_change_24h");
        }
        return TokenInfo.builder()
                .source(DataProviders.COINMARKETCAP)
                .providerId(id)
                .name(JsonValues.text(info, "name"))
                .symbol(symbol)
                .description(description)
                .category(JsonValues.text(info, "category"))
                .dateAdded(JsonValues.text(info, "date_added"))
                .platform(JsonValues.text(info, "platform"))
                .tags(JsonValues.textList(info, "tags"))
                .logo(JsonValues.text(info, "logo"))
                .currentPrice(price)
                .percentChange24h(change)
                .circulatingSupply(match(SUPPLY, description))
                .totalSupply(JsonValues.decimal(info, "total_supply"))
                .maxSupply(JsonValues.decimal(info, "max_supply"))
                .marketCap(JsonValues.decimal(usd, "market_cap"))
                .volume24h(JsonValues.decimal(usd, "volume_24h"))
                .rank(JsonValues.integer(info, "cmc_rank"))
                .build();
    }

    private GlobalMetrics globalMetrics(JsonNode data) {
        JsonNode usd = JsonValues.path(data, "quote", "USD");
        return GlobalMetrics.builder()
                .source(DataProviders.COINMARKETCAP)
                .totalMarketCap(JsonValues.decimal(usd, "total_market_cap"))
                .totalVolume24h(JsonValues.decimal(usd, "total_volume_24h"))
                .btcDominance(JsonValues.decimal(data, "btc_dominance"))
                .activeCryptocurrencies(JsonValues.integer(data, "active_cryptocurrencies"))
                .build();
    }

    private static BigDecimal match(Pattern pattern, String text) {
        if (text == null) {
            return null;
        }
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? JsonValues.parseDecimal(matcher.group(1)) : null;
    }

    static String marketKey(String symbol) {
        return "market_" + symbol;
    }
}
