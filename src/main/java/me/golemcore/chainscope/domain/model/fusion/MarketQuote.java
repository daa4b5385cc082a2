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

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Spot market quote for one asset.
 */
@Value
@Builder
public class MarketQuote implements FusedRecord {

    String source;
    String name;
    String symbol;
    Long providerId;
    Integer rank;
    BigDecimal price;
    BigDecimal marketCap;
    BigDecimal volume24h;
    BigDecimal percentChange24h;
    BigDecimal percentChange7d;
    BigDecimal circulatingSupply;
    BigDecimal totalSupply;
    BigDecimal maxSupply;

    @Override
    public RecordType getType() {
        return RecordType.MARKET_QUOTE;
    }
}
