package me.golemcore.chainscope.domain.service;

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

import me.golemcore.chainscope.domain.model.Intent;
import me.golemcore.chainscope.domain.model.ResearchPlan;
import me.golemcore.chainscope.domain.model.ResearchRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import static me.golemcore.chainscope.domain.model.DataProviders.COINMARKETCAP;
import static me.golemcore.chainscope.domain.model.DataProviders.DEFILLAMA;
import static me.golemcore.chainscope.domain.model.DataProviders.DUNE_ANALYTICS;
import static me.golemcore.chainscope.domain.model.DataProviders.ETHERSCAN;
import static me.golemcore.chainscope.domain.model.DataProviders.SAMPLE_ADDRESS;

/**
 * Decides which data providers to query for a request.
 *
 * <p>
 * Rules, applied in order:
 * <ol>
 * <li>market data is always included</li>
 * <li>on-chain analytics for trading keywords and major asset names</li>
 * <li>the DeFi aggregator for TVL, yield, stablecoin, fee and bridge
 * keywords</li>
 * <li>the explorer when an address is supplied, or with a sample address for
 * major-asset and analysis queries</li>
 * <li>investment-flavored queries get analytics, aggregator and explorer</li>
 * <li>at least two providers, topped up with analytics then the
 * aggregator</li>
 * </ol>
 * A synthesized address is flagged on the plan and stated in the rationale.
 */
@Service
@Slf4j
public class ResearchPlanner {

    private static final int MIN_TOOLS = 2;

    private static final List<String> ANALYTICS_KEYWORDS = List.of("bitcoin", "btc", "ethereum", "eth",
            "analysis", "investment", "trading", "volume", "dex", "swap", "whale", "performance", "trend");
    private static final List<String> DEFI_KEYWORDS = List.of("tvl", "protocol", "defi", "stablecoin", "apy",
            "yield", "fees", "revenue", "bridge");
    private static final List<String> SAMPLE_ADDRESS_KEYWORDS = List.of("bitcoin", "btc", "ethereum", "eth",
            "analysis", "investment");
    private static final List<String> INVESTMENT_KEYWORDS = List.of("invest", "investment", "analysis", "should i",
            "good idea", "recommend");

    public ResearchPlan plan(ResearchRequest request, Intent intent) {
        String query = request.getQuery().toLowerCase(Locale.ROOT);
        Set<String> tools = new LinkedHashSet<>();
        List<String> rationale = new ArrayList<>();
        String address = request.getAddress();
        boolean synthesized = false;

        rationale.add("Query analysis completed (intent: " + intent.getWireName() + ")");

        tools.add(COINMARKETCAP);
        rationale.add("Selected CoinMarketCap for market data and price analysis");

        if (containsAny(query, ANALYTICS_KEYWORDS)) {
            tools.add(DUNE_ANALYTICS);
            rationale.add("Selected Dune Analytics for blockchain metrics and trading data");
        }

        if (containsAny(query, DEFI_KEYWORDS)) {
            tools.add(DEFILLAMA);
            rationale.add("Selected DefiLlama for TVL, yields, stablecoins, fees and bridges");
        }

        if (address == null && containsAny(query, SAMPLE_ADDRESS_KEYWORDS)) {
            address = SAMPLE_ADDRESS;
            synthesized = true;
            rationale.add(sampleAddressNote());
        }
        if (address != null) {
            tools.add(ETHERSCAN);
            rationale.add("Selected Etherscan for on-chain transaction analysis");
        }

        if (containsAny(query, INVESTMENT_KEYWORDS)) {
            if (tools.add(DUNE_ANALYTICS)) {
                rationale.add("Added Dune Analytics for comprehensive investment analysis");
            }
            if (tools.add(DEFILLAMA)) {
                rationale.add("Added DefiLlama for protocol TVL and yields context");
            }
            if (!tools.contains(ETHERSCAN)) {
                if (address == null) {
                    address = SAMPLE_ADDRESS;
                    synthesized = true;
                    rationale.add(sampleAddressNote());
                }
                tools.add(ETHERSCAN);
                rationale.add("Added Etherscan for blockchain network health analysis");
            }
        }

        if (tools.size() < MIN_TOOLS && tools.add(DUNE_ANALYTICS)) {
            rationale.add("Added Dune Analytics for broader data coverage");
        }
        if (tools.size() < MIN_TOOLS && tools.add(DEFILLAMA)) {
            rationale.add("Added DefiLlama for broader DeFi coverage");
        }

        rationale.add("Final tool selection: " + tools.size() + " tools");
        log.debug("[Planner] tools={}, address={}, synthesized={}", tools, address, synthesized);

        return ResearchPlan.builder()
                .tools(tools)
                .rationale(rationale)
                .address(address)
                .addressSynthesized(synthesized)
                .build();
    }

    private static String sampleAddressNote() {
        return "Using sample Ethereum address " + SAMPLE_ADDRESS
                + " for on-chain analysis (synthesized, not user-supplied)";
    }

    private static boolean containsAny(String query, List<String> keywords) {
        return keywords.stream().anyMatch(query::contains);
    }
}
