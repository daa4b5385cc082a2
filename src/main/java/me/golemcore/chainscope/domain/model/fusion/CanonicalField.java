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

import java.util.Locale;
import java.util.function.Predicate;

/**
 * Semantic field of the canonical view. Each field knows which records could
 * supply it; the precedence table decides which provider is trusted for it.
 */
public enum CanonicalField {

    TVL(overviewOf(DefiOverview.Kind.TVL)),
    STABLECOINS(overviewOf(DefiOverview.Kind.STABLECOINS)),
    DEX_OVERVIEW(overviewOf(DefiOverview.Kind.DEX)),
    FEES_OVERVIEW(overviewOf(DefiOverview.Kind.FEES)),
    YIELDS(overviewOf(DefiOverview.Kind.YIELDS)),
    BRIDGES(overviewOf(DefiOverview.Kind.BRIDGES)),
    MARKET(record -> record instanceof MarketQuote),
    DEX_TRADING(record -> record instanceof DexPairAggregate),
    WALLET_BALANCE(record -> record instanceof WalletBalance),
    TRANSACTIONS(record -> record instanceof TransactionList);

    private final Predicate<FusedRecord> candidate;

    CanonicalField(Predicate<FusedRecord> candidate) {
        this.candidate = candidate;
    }

    public boolean accepts(FusedRecord record) {
        return candidate.test(record);
    }

    public String getWireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    private static Predicate<FusedRecord> overviewOf(DefiOverview.Kind kind) {
        return record -> record instanceof DefiOverview overview && overview.getKind() == kind;
    }
}
