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
import me.golemcore.chainscope.domain.model.fusion.AnalyticsData;
import me.golemcore.chainscope.domain.model.fusion.DexPairAggregate;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;

/**
 * Recognizes Dune row sets. Rows that look like DEX pairs are aggregated into
 * totals plus the leading pairs; any other non-empty row set is kept as
 * analytics rows.
 */
@Component
public class DuneAnalyticsRecognizer implements ShapeRecognizer {

    static final String DEX_TRADING_KEY = "dex_trading";
    static final String ANALYTICS_KEY = "blockchain_analytics";

    private static final int TOP_PAIRS = 5;
    private static final List<String> PAIR_FIELDS = List.of("token_pair", "pair_address", "one_day_volume",
            "seven_day_volume");

    @Override
    public boolean supports(String source) {
        return DataProviders.DUNE_ANALYTICS.equals(source);
    }

    @Override
    public List<RecognizedRecord> recognize(ToolResult result) {
        JsonNode rows = result.getData();
        if (rows == null || !rows.isArray() || rows.isEmpty()) {
            return List.of();
        }
        if (looksLikePairs(rows.get(0))) {
            return List.of(new RecognizedRecord(DEX_TRADING_KEY, aggregate(rows, chainOf(result))));
        }
        AnalyticsData analytics = AnalyticsData.builder()
                .source(DataProviders.DUNE_ANALYTICS)
                .rows(JsonValues.all(rows))
                .build();
        return List.of(new RecognizedRecord(ANALYTICS_KEY, analytics));
    }

    private static boolean looksLikePairs(JsonNode first) {
        return first.isObject() && PAIR_FIELDS.stream().anyMatch(first::has);
    }

    private static DexPairAggregate aggregate(JsonNode rows, String chain) {
        BigDecimal volume24h = BigDecimal.ZERO;
        BigDecimal volume7d = BigDecimal.ZERO;
        BigDecimal liquidity = BigDecimal.ZERO;
        for (JsonNode pair : rows) {
            volume24h = volume24h.add(JsonValues.decimalOrZero(pair, "one_day_volume"));
            volume7d = volume7d.add(JsonValues.decimalOrZero(pair, "seven_day_volume"));
            liquidity = liquidity.add(JsonValues.decimalOrZero(pair, "usd_liquidity"));
        }
        return DexPairAggregate.builder()
                .source(DataProviders.DUNE_ANALYTICS)
                .chain(chain)
                .totalPairs(rows.size())
                .total24hVolume(volume24h)
                .total7dVolume(volume7d)
                .totalLiquidity(liquidity)
                .topPairs(JsonValues.head(rows, TOP_PAIRS))
                .build();
    }

    private static String chainOf(ToolResult result) {
        Object chain = result.getMetadata() != null ? result.getMetadata().get("chain") : null;
        return chain != null ? chain.toString() : null;
    }
}
