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
import java.util.List;

/**
 * Descriptive metadata for one asset. Price, change and supply may be parsed
 * out of the provider's free-text description when no quote block is present.
 */
@Value
@Builder
public class TokenInfo implements FusedRecord {

    String source;
    String providerId;
    String name;
    String symbol;
    String description;
    String category;
    String dateAdded;
    String platform;
    List<String> tags;
    String logo;
    BigDecimal currentPrice;
    BigDecimal percentChange24h;
    BigDecimal circulatingSupply;
    BigDecimal totalSupply;
    BigDecimal maxSupply;
    BigDecimal marketCap;
    BigDecimal volume24h;
    Integer rank;

    @Override
    public RecordType getType() {
        return RecordType.TOKEN_INFO;
    }
}
