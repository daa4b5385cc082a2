package me.golemcore.chainscope.domain.fusion;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.chainscope.domain.model.DataProviders;
import me.golemcore.chainscope.domain.model.ToolResult;
import me.golemcore.chainscope.domain.model.fusion.TransactionList;
import me.golemcore.chainscope.domain.model.fusion.WalletBalance;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EtherscanRecognizerTest {

    private static final String ADDRESS = "0xde0B295669a9FD93d5F28D9Ec85E40f4cb697BAe";

    private final ObjectMapper mapper = new ObjectMapper();
    private final EtherscanRecognizer recognizer = new EtherscanRecognizer();

    private ToolResult result(String json) throws JsonProcessingException {
        return ToolResult.success(DataProviders.ETHERSCAN, mapper.readTree(json),
                Map.of(ToolResult.META_ENDPOINT, "txlist", "address", ADDRESS));
    }

    @Test
    void shouldReadBalanceInWei() throws JsonProcessingException {
        List<RecognizedRecord> records = recognizer.recognize(result(
                "{\"status\": \"1\", \"result\": \"123456789012345678901\"}"));

        WalletBalance balance = (WalletBalance) records.get(0).record();
        assertEquals(ADDRESS, balance.getAddress());
        assertEquals(new BigDecimal("123.456789012345678901"), balance.getBalanceEth());
    }

    @Test
    void shouldKeepTenMostRecentTransactions() throws JsonProcessingException {
        StringBuilder txs = new StringBuilder("[");
        for (int i = 0; i < 15; i++) {
            txs.append(i > 0 ? "," : "").append("{\"hash\": \"0x").append(i).append("\"}");
        }
        txs.append(']');

        List<RecognizedRecord> records = recognizer.recognize(result(
                "{\"status\": \"1\", \"result\": " + txs + "}"));

        TransactionList list = (TransactionList) records.get(0).record();
        assertEquals("transactions", records.get(0).key());
        assertEquals(15, list.getTotalCount());
        assertEquals(10, list.getTransactions().size());
    }

    @Test
    void shouldIgnoreEmptyResults() throws JsonProcessingException {
        assertTrue(recognizer.recognize(result("{\"status\": \"0\", \"result\": []}")).isEmpty());
        assertTrue(recognizer.recognize(result("{\"status\": \"0\", \"result\": \"Max rate limit reached\"}"))
                .isEmpty());
    }
}
