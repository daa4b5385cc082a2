package me.golemcore.chainscope.domain.model.fusion;

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
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Aggregation over DEX trading pairs: counts and exact sums of 24h volume,
 * 7d volume and liquidity, plus the leading pairs verbatim.
 */
@Value
@Builder
public class DexPairAggregate implements FusedRecord {

    String source;
    String chain;
    int totalPairs;
    BigDecimal total24hVolume;
    BigDecimal total7dVolume;
    BigDecimal totalLiquidity;
    List<JsonNode> topPairs;

    @Override
    public RecordType getType() {
        return RecordType.DEX_PAIRS;
    }
}
