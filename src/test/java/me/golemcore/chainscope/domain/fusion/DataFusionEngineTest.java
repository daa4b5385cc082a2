package me.golemcore.chainscope.domain.fusion;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.chainscope.domain.model.DataProviders;
import me.golemcore.chainscope.domain.model.Intent;
import me.golemcore.chainscope.domain.model.ToolResult;
import me.golemcore.chainscope.domain.model.fusion.CanonicalEntry;
import me.golemcore.chainscope.domain.model.fusion.CanonicalField;
import me.golemcore.chainscope.domain.model.fusion.CanonicalView;
import me.golemcore.chainscope.domain.model.fusion.DefiOverview;
import me.golemcore.chainscope.domain.model.fusion.MarketQuote;
import me.golemcore.chainscope.domain.model.fusion.MergedDataset;
import me.golemcore.chainscope.domain.model.fusion.RawRecord;
import me.golemcore.chainscope.domain.model.fusion.RecordType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DataFusionEngineTest {

    private final ObjectMapper mapper = new ObjectMapper()
            .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);

    private DataFusionEngine engine;

    @BeforeEach
    void setUp() {
        engine = new DataFusionEngine(List.of(new CoinMarketCapRecognizer(), new DuneAnalyticsRecognizer(),
                new EtherscanRecognizer(), new DefiLlamaRecognizer()), new CompletenessScorer(),
                new PrecedenceTable());
    }

    private JsonNode json(String text) throws JsonProcessingException {
        return mapper.readTree(text);
    }

    private ToolResult cmcQuotes() throws JsonProcessingException {
        return ToolResult.success(DataProviders.COINMARKETCAP, json("""
                {"data": {"BTC": {"id": 1, "name": "Bitcoin", "symbol": "BTC", "cmc_rank": 1,
                  "circulating_supply": 19700000,
                  "quote": {"USD": {"price": 64123.456789012345, "market_cap": 1263000000000.5,
                    "volume_24h": 31000000000.25, "percent_change_24h": -1.234567}}}}}
                """), Map.of(ToolResult.META_ENDPOINT, "quotes"));
    }

    private ToolResult duneRows() throws JsonProcessingException {
        return ToolResult.success(DataProviders.DUNE_ANALYTICS, json("""
                [{"token_pair": "WETH-USDC", "one_day_volume": 1000.5, "seven_day_volume": 7000, "usd_liquidity": 50},
                 {"token_pair": "WBTC-WETH", "one_day_volume": 500.25, "seven_day_volume": 3500, "usd_liquidity": 25}]
                """), Map.of(ToolResult.META_ENDPOINT, "dex_pairs", "chain", "ethereum"));
    }

    private ToolResult etherscanBalance() throws JsonProcessingException {
        return ToolResult.success(DataProviders.ETHERSCAN,
                json("{\"status\": \"1\", \"message\": \"OK\", \"result\": \"1500000000000000000\"}"),
                Map.of(ToolResult.META_ENDPOINT, "balance", "address", "0xabc"));
    }

    private ToolResult defillamaChains() throws JsonProcessingException {
        return ToolResult.success(DataProviders.DEFILLAMA, json("""
                [{"name": "Ethereum", "tvl": 60000000000}, {"name": "Tron", "tvl": 8000000000}]
                """), Map.of(ToolResult.META_ENDPOINT, "chains"));
    }

    private ToolResult defillamaPrices() throws JsonProcessingException {
        return ToolResult.success(DataProviders.DEFILLAMA, json("""
                {"coins": {"coingecko:bitcoin": {"symbol": "BTC", "price": 64000.1, "confidence": 0.99}}}
                """), Map.of(ToolResult.META_ENDPOINT, "prices"));
    }

    // ==================== merge ====================

    @Test
    void shouldRecognizeEachProvider() throws JsonProcessingException {
        MergedDataset dataset = engine.merge(List.of(cmcQuotes(), duneRows(), etherscanBalance(),
                defillamaChains()), Intent.ANALYSIS);

        assertTrue(dataset.getPrimary().containsKey("market_BTC"));
        assertTrue(dataset.getPrimary().containsKey("dex_trading"));
        assertTrue(dataset.getSupplementary().containsKey("wallet_balance"));
        assertTrue(dataset.getSupplementary().containsKey("defillama_tvl"));
        assertEquals(4, dataset.getSourcesUsed().size());
        assertTrue(dataset.getCompletenessScore() > 20 && dataset.getCompletenessScore() <= 100);
    }

    @Test
    void shouldPreserveProviderPrecision() throws JsonProcessingException {
        MergedDataset dataset = engine.merge(List.of(cmcQuotes()), Intent.MARKET_DATA);

        MarketQuote quote = (MarketQuote) dataset.getPrimary().get("market_BTC");
        assertEquals(new BigDecimal("64123.456789012345"), quote.getPrice());
        assertEquals(new BigDecimal("-1.234567"), quote.getPercentChange24h());
        assertEquals(1, quote.getRank());
    }

    @Test
    void shouldBeInvariantToResultOrder() throws JsonProcessingException {
        List<ToolResult> results = new ArrayList<>(List.of(cmcQuotes(), duneRows(), etherscanBalance(),
                defillamaChains(), ToolResult.failure(DataProviders.DEFILLAMA, "HTTP 500")));
        MergedDataset reference = engine.merge(results, Intent.GENERAL);
        CanonicalView referenceView = engine.canonicalize(reference);

        Random random = new Random(42);
        for (int i = 0; i < 10; i++) {
            Collections.shuffle(results, random);
            MergedDataset shuffled = engine.merge(results, Intent.GENERAL);

            assertEquals(reference, shuffled);
            assertEquals(referenceView, engine.canonicalize(shuffled));
        }
    }

    @Test
    void shouldStoreUnrecognizedPayloadVerbatim() throws JsonProcessingException {
        ToolResult odd = ToolResult.success(DataProviders.DEFILLAMA, json("{\"unexpected\": [1, 2, 3]}"),
                Map.of(ToolResult.META_ENDPOINT, "mystery"));

        MergedDataset dataset = engine.merge(List.of(odd), Intent.GENERAL);

        RawRecord raw = assertInstanceOf(RawRecord.class, dataset.getSupplementary().get("defillama_mystery"));
        assertEquals(odd.getData(), raw.getPayload());
        assertEquals(1, dataset.getTotalRecords());
    }

    @Test
    void shouldStoreUnknownProviderPayload() throws JsonProcessingException {
        ToolResult unknown = ToolResult.success("coingecko", json("{\"bitcoin\": {\"usd\": 1}}"));

        MergedDataset dataset = engine.merge(List.of(unknown), Intent.GENERAL);

        assertInstanceOf(RawRecord.class, dataset.getSupplementary().get("coingecko_data"));
    }

    @Test
    void shouldRecordFailuresWithoutRecords() {
        MergedDataset dataset = engine.merge(List.of(ToolResult.failure(DataProviders.ETHERSCAN, "Invalid API Key")),
                Intent.GENERAL);

        assertTrue(dataset.isEmpty());
        assertEquals(0.0, dataset.getCompletenessScore());
        assertEquals("Invalid API Key", dataset.getFailedSources().get(DataProviders.ETHERSCAN));
    }

    @Test
    void shouldKeepLexicographicallyFirstSourceOnKeyConflict() throws JsonProcessingException {
        ShapeRecognizer sharedKey = new ShapeRecognizer() {
            @Override
            public boolean supports(String source) {
                return true;
            }

            @Override
            public List<RecognizedRecord> recognize(ToolResult result) {
                return List.of(new RecognizedRecord("market_BTC", MarketQuote.builder()
                        .source(result.getSource()).symbol("BTC").price(BigDecimal.ONE).build()));
            }
        };
        DataFusionEngine sharedEngine = new DataFusionEngine(List.of(sharedKey), new CompletenessScorer(),
                new PrecedenceTable());

        MergedDataset dataset = sharedEngine.merge(List.of(defillamaChains(), cmcQuotes()), Intent.MARKET_DATA);

        assertEquals(DataProviders.COINMARKETCAP, dataset.getPrimary().get("market_BTC").getSource());
        assertEquals(1, dataset.getConflicts().size());
        assertTrue(dataset.getConflicts().get(0).contains("dropped defillama"));
    }

    @Test
    void shouldKeepDefiLlamaPricesBesideMarketQuotes() throws JsonProcessingException {
        MergedDataset dataset = engine.merge(List.of(defillamaPrices(), cmcQuotes()), Intent.MARKET_DATA);

        assertTrue(dataset.getConflicts().isEmpty());
        assertEquals(DataProviders.COINMARKETCAP, dataset.getPrimary().get("market_BTC").getSource());
        DefiOverview prices = assertInstanceOf(DefiOverview.class,
                dataset.getSupplementary().get("defillama_prices"));
        assertEquals(DefiOverview.Kind.PRICES, prices.getKind());
        assertEquals(List.of(DataProviders.COINMARKETCAP, DataProviders.DEFILLAMA),
                List.copyOf(dataset.getSourcesUsed()));
    }

    @Test
    void shouldNotTreatDefiLlamaPricesAsMarketData() throws JsonProcessingException {
        MergedDataset dataset = engine.merge(List.of(defillamaPrices()), Intent.MARKET_DATA);

        assertFalse(dataset.has(RecordType.MARKET_QUOTE));
        assertTrue(dataset.has(RecordType.DEFI_OVERVIEW));
        assertFalse(engine.canonicalize(dataset).has(CanonicalField.MARKET));
    }

    // ==================== canonicalize ====================

    @Test
    void shouldAttributeTvlToDefiLlama() {
        MergedDataset dataset = new MergedDataset();
        dataset.put("cmc_tvl", DefiOverview.builder().source(DataProviders.COINMARKETCAP)
                .kind(DefiOverview.Kind.TVL).itemCount(1).topItems(List.of()).build());
        dataset.put("defillama_tvl", DefiOverview.builder().source(DataProviders.DEFILLAMA)
                .kind(DefiOverview.Kind.TVL).itemCount(2).topItems(List.of()).build());

        CanonicalEntry tvl = engine.canonicalize(dataset).get(CanonicalField.TVL).orElseThrow();

        assertEquals(DataProviders.DEFILLAMA, tvl.getSource());
        assertEquals("defillama_tvl", tvl.getKey());
    }

    @Test
    void shouldNotAttributeMarketFieldToNonPreferredSource() {
        MergedDataset dataset = new MergedDataset();
        dataset.put("market_BTC", MarketQuote.builder().source(DataProviders.DEFILLAMA).symbol("BTC")
                .price(BigDecimal.TEN).build());

        CanonicalView view = engine.canonicalize(dataset);

        assertFalse(view.has(CanonicalField.MARKET));
    }

    @Test
    void shouldPickTopRankedMarketQuote() {
        MergedDataset dataset = new MergedDataset();
        dataset.put("market_ETH", MarketQuote.builder().source(DataProviders.COINMARKETCAP).symbol("ETH")
                .rank(2).build());
        dataset.put("market_BTC", MarketQuote.builder().source(DataProviders.COINMARKETCAP).symbol("BTC")
                .rank(1).build());
        dataset.put("market_XYZ", MarketQuote.builder().source(DataProviders.COINMARKETCAP).symbol("XYZ")
                .build());

        CanonicalEntry market = engine.canonicalize(dataset).get(CanonicalField.MARKET).orElseThrow();

        assertEquals("market_BTC", market.getKey());
    }

    @Test
    void shouldMapEachFieldToSingleSource() throws JsonProcessingException {
        MergedDataset dataset = engine.merge(List.of(cmcQuotes(), duneRows(), etherscanBalance(),
                defillamaChains()), Intent.ANALYSIS);

        CanonicalView view = engine.canonicalize(dataset);

        assertEquals(DataProviders.COINMARKETCAP, view.get(CanonicalField.MARKET).orElseThrow().getSource());
        assertEquals(DataProviders.DUNE_ANALYTICS, view.get(CanonicalField.DEX_TRADING).orElseThrow().getSource());
        assertEquals(DataProviders.ETHERSCAN, view.get(CanonicalField.WALLET_BALANCE).orElseThrow().getSource());
        assertEquals(DataProviders.DEFILLAMA, view.get(CanonicalField.TVL).orElseThrow().getSource());
        assertFalse(view.has(CanonicalField.TRANSACTIONS));
    }
}
