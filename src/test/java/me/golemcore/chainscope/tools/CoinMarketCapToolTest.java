package me.golemcore.chainscope.tools;

import me.golemcore.chainscope.domain.model.ToolInvocation;
import me.golemcore.chainscope.domain.model.ToolResult;
import me.golemcore.chainscope.infrastructure.config.ChainscopeProperties;
import me.golemcore.chainscope.infrastructure.http.FeignClientFactory;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import feign.FeignException;
import feign.Request;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.when;

class CoinMarketCapToolTest {

    private static final String TEST_KEY = "test-key";

    private final ObjectMapper objectMapper = new ObjectMapper();
    private FeignClientFactory feignClientFactory;
    private ChainscopeProperties properties;
    private CoinMarketCapTool.CoinMarketCapApi api;

    @BeforeEach
    void setUp() {
        feignClientFactory = mock(FeignClientFactory.class);
        properties = new ChainscopeProperties();
        api = mock(CoinMarketCapTool.CoinMarketCapApi.class);
        when(feignClientFactory.create(eq(CoinMarketCapTool.CoinMarketCapApi.class), anyString())).thenReturn(api);
    }

    private CoinMarketCapTool createTool(String apiKey) {
        properties.getTools().getCoinmarketcap().setApiKey(apiKey);
        CoinMarketCapTool tool = new CoinMarketCapTool(feignClientFactory, properties, objectMapper);
        tool.init();
        return tool;
    }

    private static ToolInvocation invocation(String query) {
        return ToolInvocation.builder().query(query).build();
    }

    // ==================== Configuration ====================

    @Test
    void shouldDisableWithoutApiKey() throws ExecutionException, InterruptedException {
        CoinMarketCapTool tool = createTool("  ");

        assertFalse(tool.isEnabled());
        ToolResult result = tool.invoke(invocation("bitcoin price")).get();
        assertFalse(result.isSuccess());
        assertEquals("coinmarketcap", result.getSource());
        assertEquals("CoinMarketCap API key not configured", result.getError());
        verify(feignClientFactory, never()).create(any(), anyString());
    }

    @Test
    void shouldEnableWithApiKey() {
        CoinMarketCapTool tool = createTool(TEST_KEY);

        assertTrue(tool.isEnabled());
        assertFalse(tool.requiresAddress());
        verify(feignClientFactory).create(CoinMarketCapTool.CoinMarketCapApi.class,
                "https://pro-api.coinmarketcap.com/v1");
    }

    // ==================== Routing ====================

    @Test
    void shouldFetchQuotesForKnownAsset() throws Exception {
        JsonNode payload = objectMapper.readTree("{\"data\":{\"ETH\":{\"symbol\":\"ETH\"}}}");
        when(api.quotes(TEST_KEY, "ETH")).thenReturn(payload);
        CoinMarketCapTool tool = createTool(TEST_KEY);

        ToolResult result = tool.invoke(invocation("How is Ethereum doing today?")).get();

        assertTrue(result.isSuccess());
        assertSame(payload, result.getData());
        assertEquals(CoinMarketCapTool.ENDPOINT_QUOTES, result.getEndpoint());
        assertEquals("ETH", result.getMetadata().get("symbol"));
    }

    @Test
    void shouldFetchInfoForDescriptiveQuestion() throws Exception {
        when(api.info(TEST_KEY, "SOL")).thenReturn(objectMapper.createObjectNode());
        CoinMarketCapTool tool = createTool(TEST_KEY);

        ToolResult result = tool.invoke(invocation("What is Solana?")).get();

        assertTrue(result.isSuccess());
        assertEquals(CoinMarketCapTool.ENDPOINT_INFO, result.getEndpoint());
    }

    @Test
    void shouldFetchGlobalMetrics() throws Exception {
        when(api.globalMetrics(TEST_KEY)).thenReturn(objectMapper.createObjectNode());
        CoinMarketCapTool tool = createTool(TEST_KEY);

        ToolResult result = tool.invoke(invocation("total market overview")).get();

        assertEquals(CoinMarketCapTool.ENDPOINT_GLOBAL, result.getEndpoint());
        assertFalse(result.getMetadata().containsKey("symbol"));
    }

    @Test
    void shouldFetchRankingListings() throws Exception {
        when(api.listings(TEST_KEY, 20)).thenReturn(objectMapper.createObjectNode());
        CoinMarketCapTool tool = createTool(TEST_KEY);

        ToolResult result = tool.invoke(invocation("top coins by market cap")).get();

        assertTrue(result.isSuccess());
        assertEquals(CoinMarketCapTool.ENDPOINT_LISTINGS, result.getEndpoint());
        verify(api).listings(TEST_KEY, 20);
    }

    @Test
    void shouldFetchDefaultListings() throws Exception {
        when(api.listings(TEST_KEY, 25)).thenReturn(objectMapper.createObjectNode());
        CoinMarketCapTool tool = createTool(TEST_KEY);

        tool.invoke(invocation("what's happening in crypto")).get();

        verify(api).listings(TEST_KEY, 25);
    }

    // ==================== Symbol detection ====================

    @Test
    void shouldDetectNamesAndTickers() {
        assertEquals("BTC", CoinMarketCapTool.detectSymbol("Analyze Bitcoin's performance"));
        assertEquals("BNB", CoinMarketCapTool.detectSymbol("binance coin outlook"));
        assertEquals("SOL", CoinMarketCapTool.detectSymbol("sol price"));
        assertEquals("AVAX", CoinMarketCapTool.detectSymbol("Is $AVAX undervalued"));
    }

    @Test
    void shouldNotMatchTickersInsideWords() {
        assertNull(CoinMarketCapTool.detectSymbol("a scaling solution for rollups"));
        assertNull(CoinMarketCapTool.detectSymbol("market overview"));
    }

    // ==================== Errors ====================

    @Test
    void shouldReportProviderErrorMessage() throws Exception {
        when(api.quotes(TEST_KEY, "BTC")).thenThrow(createFeignException(401,
                "{\"status\":{\"error_code\":1001,\"error_message\":\"This API Key is invalid.\"}}"));
        CoinMarketCapTool tool = createTool(TEST_KEY);

        ToolResult result = tool.invoke(invocation("btc")).get();

        assertFalse(result.isSuccess());
        assertEquals("This API Key is invalid.", result.getError());
    }

    @Test
    void shouldFallBackToHttpStatus() throws Exception {
        when(api.quotes(TEST_KEY, "BTC")).thenThrow(createFeignException(503, "<html>down</html>"));
        CoinMarketCapTool tool = createTool(TEST_KEY);

        ToolResult result = tool.invoke(invocation("btc")).get();

        assertEquals("HTTP 503", result.getError());
    }

    @Test
    void shouldHandleUnexpectedError() throws Exception {
        when(api.quotes(TEST_KEY, "BTC")).thenThrow(new IllegalStateException("boom"));
        CoinMarketCapTool tool = createTool(TEST_KEY);

        ToolResult result = tool.invoke(invocation("btc")).get();

        assertFalse(result.isSuccess());
        assertTrue(result.getError().contains("boom"));
    }

    private static FeignException createFeignException(int status, String body) {
        Request request = Request.create(Request.HttpMethod.GET, "url", Collections.emptyMap(), null, null, null);
        return FeignException.errorStatus("quotes", feign.Response.builder()
                .status(status)
                .reason("Error")
                .request(request)
                .headers(Collections.emptyMap())
                .body(body, StandardCharsets.UTF_8)
                .build());
    }
}
