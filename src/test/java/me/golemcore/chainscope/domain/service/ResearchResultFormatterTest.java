package me.golemcore.chainscope.domain.service;

import me.golemcore.chainscope.domain.model.DataProviders;
import me.golemcore.chainscope.domain.model.Intent;
import me.golemcore.chainscope.domain.model.fusion.MarketQuote;
import me.golemcore.chainscope.domain.model.fusion.MergedDataset;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResearchResultFormatterTest {

    private final ResearchResultFormatter formatter = new ResearchResultFormatter();

    @Test
    void shouldWrapProseWithHeaderAndSummary() {
        MergedDataset dataset = new MergedDataset();
        dataset.put("market_ETH", MarketQuote.builder().source(DataProviders.COINMARKETCAP).symbol("ETH").build());
        dataset.setCompletenessScore(62.0);

        String result = formatter.format("  ETH is up.\n", Intent.MARKET_DATA, dataset);

        assertEquals("""
                **MARKET ANALYSIS** [Data quality: good]

                ETH is up.

                ---
                **Data Summary**
                - Sources Used: coinmarketcap
                - Data Completeness: 62%
                - Query Intent: Market Data""", result);
    }

    @Test
    void shouldReportNoSources() {
        String result = formatter.format("Nothing found.", Intent.GENERAL, new MergedDataset());

        assertTrue(result.startsWith("**RESEARCH RESULTS** [Data quality: limited]"));
        assertTrue(result.contains("- Sources Used: none"));
    }

    @Test
    void shouldMapHeadersAndQualityLabels() {
        assertEquals("COMPREHENSIVE ANALYSIS", ResearchResultFormatter.header(Intent.ANALYSIS));
        assertEquals("CRYPTOCURRENCY INFORMATION", ResearchResultFormatter.header(Intent.INFORMATION));
        assertEquals("TECHNICAL DATA ANALYSIS", ResearchResultFormatter.header(Intent.TECHNICAL));
        assertEquals("COMPARATIVE ANALYSIS", ResearchResultFormatter.header(Intent.COMPARISON));
        assertEquals("high", ResearchResultFormatter.qualityLabel(80));
        assertEquals("good", ResearchResultFormatter.qualityLabel(60));
        assertEquals("partial", ResearchResultFormatter.qualityLabel(40));
        assertEquals("limited", ResearchResultFormatter.qualityLabel(39.9));
    }
}
