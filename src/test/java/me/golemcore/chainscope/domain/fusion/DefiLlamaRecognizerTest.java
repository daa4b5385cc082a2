package me.golemcore.chainscope.domain.fusion;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.chainscope.domain.model.DataProviders;
import me.golemcore.chainscope.domain.model.ToolResult;
import me.golemcore.chainscope.domain.model.fusion.DefiOverview;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DefiLlamaRecognizerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final DefiLlamaRecognizer recognizer = new DefiLlamaRecognizer();

    @Test
    void shouldSplitAggregateIntoSections() throws JsonProcessingException {
        ToolResult result = ToolResult.success(DataProviders.DEFILLAMA, mapper.readTree("""
                {"aggregate": true, "chain": null,
                 "tvl": {"count": 2, "top": [{"name": "Ethereum", "tvl": 6}, {"name": "Tron", "tvl": 1}]},
                 "yields": {"count": 1, "top": [{"project": "aave-v3", "apy": 4.2}]},
                 "bridges": {"count": 0, "top": []}}
                """), Map.of(ToolResult.META_ENDPOINT, "aggregate"));

        List<RecognizedRecord> records = recognizer.recognize(result);

        assertEquals(List.of("defillama_tvl", "defillama_yields"),
                records.stream().map(RecognizedRecord::key).toList());
        DefiOverview tvl = (DefiOverview) records.get(0).record();
        assertEquals(DefiOverview.Kind.TVL, tvl.getKind());
        assertEquals(2, tvl.getItemCount());
        assertEquals("Ethereum", tvl.getTopItems().get(0).get("name").asText());
    }

    @Test
    void shouldRankChainsByTvl() throws JsonProcessingException {
        ToolResult result = ToolResult.success(DataProviders.DEFILLAMA, mapper.readTree("""
                [{"name": "Tron", "tvl": 8}, {"name": "Ethereum", "tvl": 60}, {"name": "Base", "tvl": 3}]
                """), Map.of(ToolResult.META_ENDPOINT, "chains"));

        DefiOverview overview = (DefiOverview) recognizer.recognize(result).get(0).record();

        assertEquals(3, overview.getItemCount());
        assertEquals("Ethereum", overview.getTopItems().get(0).get("name").asText());
    }

    @Test
    void shouldSummarizePricesUnderProviderKey() throws JsonProcessingException {
        ToolResult result = ToolResult.success(DataProviders.DEFILLAMA, mapper.readTree("""
                {"coins": {"coingecko:ethereum": {"symbol": "ETH", "price": 3100.5},
                           "coingecko:bitcoin": {"symbol": "BTC", "price": 64000.1}}}
                """), Map.of(ToolResult.META_ENDPOINT, "prices"));

        List<RecognizedRecord> records = recognizer.recognize(result);

        assertEquals(1, records.size());
        assertEquals("defillama_prices", records.get(0).key());
        DefiOverview prices = (DefiOverview) records.get(0).record();
        assertEquals(DefiOverview.Kind.PRICES, prices.getKind());
        assertEquals(2, prices.getItemCount());
        assertEquals("coingecko:bitcoin", prices.getTopItems().get(0).get("id").asText());
        assertEquals("BTC", prices.getTopItems().get(0).get("symbol").asText());
    }

    @Test
    void shouldRecognizeStablecoinShape() throws JsonProcessingException {
        ToolResult result = ToolResult.success(DataProviders.DEFILLAMA, mapper.readTree("""
                {"peggedAssets": [{"symbol": "USDT"}, {"symbol": "USDC"}]}
                """));

        List<RecognizedRecord> records = recognizer.recognize(result);

        assertEquals("stablecoins_overview", records.get(0).key());
        assertEquals(DefiOverview.Kind.STABLECOINS, ((DefiOverview) records.get(0).record()).getKind());
    }

    @Test
    void shouldLeaveUnknownShapeUnrecognized() throws JsonProcessingException {
        ToolResult result = ToolResult.success(DataProviders.DEFILLAMA, mapper.readTree("{\"foo\": 1}"));

        assertTrue(recognizer.recognize(result).isEmpty());
    }
}
