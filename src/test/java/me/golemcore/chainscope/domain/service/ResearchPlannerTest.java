package me.golemcore.chainscope.domain.service;

import me.golemcore.chainscope.domain.model.DataProviders;
import me.golemcore.chainscope.domain.model.Intent;
import me.golemcore.chainscope.domain.model.ResearchPlan;
import me.golemcore.chainscope.domain.model.ResearchRequest;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResearchPlannerTest {

    private static final String USER_ADDRESS = "0x1111111111111111111111111111111111111111";

    private final ResearchPlanner planner = new ResearchPlanner();

    private ResearchPlan plan(String query, String address, Intent intent) {
        return planner.plan(ResearchRequest.builder().query(query).address(address).build(), intent);
    }

    @Test
    void shouldAlwaysStartWithMarketData() {
        ResearchPlan plan = plan("governance proposals", null, Intent.GENERAL);

        assertEquals(DataProviders.COINMARKETCAP, plan.getTools().get(0));
    }

    @Test
    void shouldForceMinimumOfTwoTools() {
        ResearchPlan plan = plan("governance proposals", null, Intent.GENERAL);

        assertEquals(List.of(DataProviders.COINMARKETCAP, DataProviders.DUNE_ANALYTICS), plan.getTools());
        assertTrue(plan.getRationale().contains("Added Dune Analytics for broader data coverage"));
        assertNull(plan.getAddress());
    }

    @Test
    void shouldSelectDefiLlamaForTvlQueries() {
        ResearchPlan plan = plan("top protocols by tvl", null, Intent.GENERAL);

        assertEquals(List.of(DataProviders.COINMARKETCAP, DataProviders.DEFILLAMA), plan.getTools());
    }

    @Test
    void shouldUseSuppliedAddress() {
        ResearchPlan plan = plan("wallet activity", USER_ADDRESS, Intent.GENERAL);

        assertEquals(List.of(DataProviders.COINMARKETCAP, DataProviders.ETHERSCAN), plan.getTools());
        assertEquals(USER_ADDRESS, plan.getAddress());
        assertFalse(plan.isAddressSynthesized());
    }

    @Test
    void shouldSynthesizeSampleAddressForAnalysis() {
        ResearchPlan plan = plan("Analyze Bitcoin's performance", null, Intent.ANALYSIS);

        assertTrue(plan.getTools().size() >= 3);
        assertTrue(plan.getTools().contains(DataProviders.ETHERSCAN));
        assertEquals(DataProviders.SAMPLE_ADDRESS, plan.getAddress());
        assertTrue(plan.isAddressSynthesized());
        assertTrue(plan.getRationale().stream()
                .anyMatch(step -> step.contains(DataProviders.SAMPLE_ADDRESS) && step.contains("synthesized")));
    }

    @Test
    void shouldAddAllProvidersForInvestmentQuestions() {
        ResearchPlan plan = plan("Should I invest in Solana?", null, Intent.GENERAL);

        assertEquals(List.of(DataProviders.COINMARKETCAP, DataProviders.DUNE_ANALYTICS, DataProviders.DEFILLAMA,
                DataProviders.ETHERSCAN), plan.getTools());
        assertTrue(plan.isAddressSynthesized());
    }

    @Test
    void shouldNotSynthesizeWhenAddressSupplied() {
        ResearchPlan plan = plan("ethereum investment analysis", USER_ADDRESS, Intent.ANALYSIS);

        assertEquals(USER_ADDRESS, plan.getAddress());
        assertFalse(plan.isAddressSynthesized());
        assertTrue(plan.getRationale().stream().noneMatch(step -> step.contains(DataProviders.SAMPLE_ADDRESS)));
    }

    @Test
    void shouldRecordIntentAndFinalCount() {
        ResearchPlan plan = plan("eth tvl", null, Intent.MARKET_DATA);

        assertEquals("Query analysis completed (intent: market_data)", plan.getRationale().get(0));
        assertEquals("Final tool selection: " + plan.getTools().size() + " tools",
                plan.getRationale().get(plan.getRationale().size() - 1));
    }
}
