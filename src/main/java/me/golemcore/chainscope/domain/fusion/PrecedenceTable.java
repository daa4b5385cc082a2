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

import me.golemcore.chainscope.domain.model.DataProviders;
import me.golemcore.chainscope.domain.model.fusion.CanonicalField;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * The provider trusted for each canonical field. Only the listed provider may
 * supply a field; records from other providers never reach the canonical view
 * for it.
 */
@Component
public class PrecedenceTable {

    private final Map<CanonicalField, String> preferred;

    public PrecedenceTable() {
        Map<CanonicalField, String> table = new EnumMap<>(CanonicalField.class);
        table.put(CanonicalField.TVL, DataProviders.DEFILLAMA);
        table.put(CanonicalField.STABLECOINS, DataProviders.DEFILLAMA);
        table.put(CanonicalField.DEX_OVERVIEW, DataProviders.DEFILLAMA);
        table.put(CanonicalField.FEES_OVERVIEW, DataProviders.DEFILLAMA);
        table.put(CanonicalField.YIELDS, DataProviders.DEFILLAMA);
        table.put(CanonicalField.BRIDGES, DataProviders.DEFILLAMA);
        table.put(CanonicalField.MARKET, DataProviders.COINMARKETCAP);
        table.put(CanonicalField.DEX_TRADING, DataProviders.DUNE_ANALYTICS);
        table.put(CanonicalField.WALLET_BALANCE, DataProviders.ETHERSCAN);
        table.put(CanonicalField.TRANSACTIONS, DataProviders.ETHERSCAN);
        this.preferred = Collections.unmodifiableMap(table);
    }

    public Optional<String> preferredSource(CanonicalField field) {
        return Optional.ofNullable(preferred.get(field));
    }

    public Map<CanonicalField, String> asMap() {
        return preferred;
    }
}
