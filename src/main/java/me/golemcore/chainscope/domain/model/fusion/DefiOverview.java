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

import java.util.List;

/**
 * Ecosystem overview from a DeFi aggregator (TVL by chain, stablecoins, DEX or
 * fee volumes, yield pools, bridges, protocol lists, token spot prices).
 */
@Value
@Builder
public class DefiOverview implements FusedRecord {

    public enum Kind {
        TVL, STABLECOINS, DEX, FEES, YIELDS, BRIDGES, PROTOCOLS, PRICES
    }

    String source;
    Kind kind;
    String chain;
    int itemCount;
    List<JsonNode> topItems;

    @Override
    public RecordType getType() {
        return RecordType.DEFI_OVERVIEW;
    }
}
