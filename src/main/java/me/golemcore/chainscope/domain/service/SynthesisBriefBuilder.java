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
import me.golemcore.chainscope.domain.model.fusion.AnalyticsData;
import me.golemcore.chainscope.domain.model.fusion.CanonicalEntry;
import me.golemcore.chainscope.domain.model.fusion.CanonicalView;
import me.golemcore.chainscope.domain.model.fusion.DefiOverview;
import me.golemcore.chainscope.domain.model.fusion.DexPairAggregate;
import me.golemcore.chainscope.domain.model.fusion.FusedRecord;
import me.golemcore.chainscope.domain.model.fusion.GlobalMetrics;
import me.golemcore.chainscope.domain.model.fusion.MarketQuote;
import me.golemcore.chainscope.domain.model.fusion.MergedDataset;
import me.golemcore.chainscope.domain.model.fusion.RawRecord;
import me.golemcore.chainscope.domain.model.fusion.TokenInfo;
import me.golemcore.chainscope.domain.model.fusion.TransactionList;
import me.golemcore.chainscope.domain.model.fusion.WalletBalance;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Map;

/**
 * Renders the research brief handed to the language model.
 *
 * <p>
 * The brief states the request, the trusted provider per canonical field and
 * every merged record. Numbers are written with {@link BigDecimal#toPlainString()}
 * so the model sees provider figures at full precision.
 */
@Component
public class SynthesisBriefBuilder {

    static final String SYSTEM_PROMPT = """
            You are an expert Web3 research analyst. You turn data gathered from several crypto data \
            providers into a clear, well structured research report that answers exactly what the user asked.

            Rules:
            1. The CANONICAL DATA section names the single provider trusted for each field. Use that \
            provider's figures and do not blend numbers from different providers for the same field.
            2. Quote figures exactly as given. Do not invent numbers that are not in the brief.
            3. Say plainly when data for a topic is missing or a provider failed.
            4. If the address is marked as a sample, do not present its activity as the user's own.
            5. Build on the conversation history when the user refers to earlier questions.
            6. Cite the providers you used and end with two or three useful follow-up questions.
            """;

    private static final int MAX_PAYLOAD_CHARS = 2000;

    private static final Map<Intent, String> FORMATS = Map.of(
            Intent.ANALYSIS, "Executive summary, market analysis, network health, trading metrics, "
                    + "investment assessment (strengths, risks, sentiment), data sources, follow-up questions",
            Intent.INFORMATION, "Project overview, technology, current metrics, ecosystem",
            Intent.MARKET_DATA, "Market snapshot: price action, volume, liquidity and global market context",
            Intent.TECHNICAL, "Technical data: DEX activity, on-chain metrics and transaction patterns",
            Intent.COMPARISON, "Side-by-side comparison of the key metrics followed by the main differences",
            Intent.GENERAL, "Concise research summary with the key figures and their sources");

    public String systemPrompt() {
        return SYSTEM_PROMPT;
    }

    public String build(ResearchRequest request, Intent intent, ResearchPlan plan, String conversationSummary,
            MergedDataset dataset, CanonicalView view) {
        StringBuilder sb = new StringBuilder();

        sb.append("RESEARCH REQUEST\n");
        sb.append("Query: ").append(request.getQuery()).append('\n');
        sb.append("Intent: ").append(intent.getDisplayName()).append('\n');
        sb.append("Preferred format: ").append(FORMATS.getOrDefault(intent, FORMATS.get(Intent.GENERAL)))
                .append('\n');
        sb.append("Time range: ").append(request.getTimeRange()).append('\n');
        sb.append("Address: ").append(describeAddress(plan)).append('\n');

        if (conversationSummary != null && !conversationSummary.isBlank()) {
            sb.append("\nCONVERSATION SUMMARY\n").append(conversationSummary).append('\n');
        }

        sb.append("\nCANONICAL DATA\n");
        if (view.isEmpty()) {
            sb.append("- none\n");
        }
        for (CanonicalEntry entry : view.getEntries().values()) {
            sb.append("- Use ").append(entry.getSource()).append(" for ").append(entry.getField().getWireName())
                    .append(" (").append(entry.getKey()).append(")\n");
        }

        sb.append("\nMERGED DATA (").append(dataset.getTotalRecords()).append(" records from ")
                .append(dataset.getSourcesUsed().isEmpty() ? "no providers" : String.join(", ", dataset.getSourcesUsed()))
                .append(")\n");
        if (dataset.isEmpty()) {
            sb.append("- No provider returned usable data.\n");
        }
        dataset.records().forEach(entry -> sb.append("- ").append(entry.getKey()).append(": ")
                .append(describe(entry.getValue())).append('\n'));

        if (!dataset.getConflicts().isEmpty()) {
            sb.append("\nCONFLICTS\n");
            dataset.getConflicts().forEach(conflict -> sb.append("- ").append(conflict).append('\n'));
        }
        if (!dataset.getFailedSources().isEmpty()) {
            sb.append("\nFAILED SOURCES\n");
            dataset.getFailedSources().forEach((source, error) -> sb.append("- ").append(source).append(": ")
                    .append(error).append('\n'));
        }

        sb.append("\nData completeness: ")
                .append(String.format(Locale.ROOT, "%.0f%%", dataset.getCompletenessScore()))
                .append('\n');
        return sb.toString();
    }

    private static String describeAddress(ResearchPlan plan) {
        if (plan.getAddress() == null) {
            return "not specified";
        }
        return plan.isAddressSynthesized()
                ? plan.getAddress() + " (sample address, not supplied by the user)"
                : plan.getAddress();
    }

    static String describe(FusedRecord record) {
        if (record instanceof MarketQuote quote) {
            return "[" + quote.getSource() + "] " + nameOf(quote.getName(), quote.getSymbol())
                    + " price " + plain(quote.getPrice()) + " USD"
                    + ", 24h change " + plain(quote.getPercentChange24h()) + "%"
                    + ", 7d change " + plain(quote.getPercentChange7d()) + "%"
                    + ", market cap " + plain(quote.getMarketCap())
                    + ", volume 24h " + plain(quote.getVolume24h())
                    + ", rank " + (quote.getRank() != null ? quote.getRank() : "n/a")
                    + ", circulating supply " + plain(quote.getCirculatingSupply());
        }
        if (record instanceof TokenInfo info) {
            return "[" + info.getSource() + "] " + nameOf(info.getName(), info.getSymbol())
                    + ", category " + (info.getCategory() != null ? info.getCategory() : "n/a")
                    + ", added " + (info.getDateAdded() != null ? info.getDateAdded() : "n/a")
                    + ", price " + plain(info.getCurrentPrice()) + " USD"
                    + ", 24h change " + plain(info.getPercentChange24h()) + "%"
                    + ", circulating supply " + plain(info.getCirculatingSupply())
                    + ", tags " + (info.getTags() == null || info.getTags().isEmpty() ? "none"
                            : String.join(", ", info.getTags()))
                    + (info.getDescription() != null ? "\n  " + info.getDescription() : "");
        }
        if (record instanceof DexPairAggregate dex) {
            return "[" + dex.getSource() + "] DEX pairs on " + (dex.getChain() != null ? dex.getChain() : "ethereum")
                    + ": " + dex.getTotalPairs() + " pairs, 24h volume " + plain(dex.getTotal24hVolume())
                    + ", 7d volume " + plain(dex.getTotal7dVolume())
                    + ", liquidity " + plain(dex.getTotalLiquidity())
                    + ", top pairs " + dex.getTopPairs();
        }
        if (record instanceof GlobalMetrics global) {
            return "[" + global.getSource() + "] total market cap " + plain(global.getTotalMarketCap())
                    + ", total volume 24h " + plain(global.getTotalVolume24h())
                    + ", BTC dominance " + plain(global.getBtcDominance()) + "%"
                    + ", active cryptocurrencies " + (global.getActiveCryptocurrencies() != null
                            ? global.getActiveCryptocurrencies()
                            : "n/a");
        }
        if (record instanceof WalletBalance balance) {
            return "[" + balance.getSource() + "] balance of " + balance.getAddress() + ": "
                    + balance.getBalanceEth().toPlainString() + " ETH (" + balance.getBalanceWei() + " wei)";
        }
        if (record instanceof TransactionList transactions) {
            return "[" + transactions.getSource() + "] " + transactions.getTotalCount() + " transactions for "
                    + transactions.getAddress() + ", most recent " + transactions.getTransactions();
        }
        if (record instanceof DefiOverview overview) {
            return "[" + overview.getSource() + "] " + overview.getKind().name().toLowerCase(Locale.ROOT)
                    + " overview" + (overview.getChain() != null ? " for " + overview.getChain() : "")
                    + ": " + overview.getItemCount() + " items, top " + overview.getTopItems();
        }
        if (record instanceof AnalyticsData analytics) {
            return "[" + analytics.getSource() + "] " + analytics.getRows().size() + " rows "
                    + abbreviate(analytics.getRows().toString());
        }
        if (record instanceof RawRecord raw) {
            return "[" + raw.getSource() + "] raw " + abbreviate(String.valueOf(raw.getPayload()));
        }
        return "[" + record.getSource() + "] " + record;
    }

    private static String nameOf(String name, String symbol) {
        if (name == null) {
            return symbol != null ? symbol : "unknown";
        }
        return symbol != null ? name + " (" + symbol + ")" : name;
    }

    private static String abbreviate(String text) {
        return text.length() > MAX_PAYLOAD_CHARS ? text.substring(0, MAX_PAYLOAD_CHARS) + "..." : text;
    }

    private static String plain(BigDecimal value) {
        return value != null ? value.toPlainString() : "n/a";
    }
}
