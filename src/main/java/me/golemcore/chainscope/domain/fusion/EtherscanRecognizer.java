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

import com.fasterxml.jackson.databind.JsonNode;
import me.golemcore.chainscope.domain.model.DataProviders;
import me.golemcore.chainscope.domain.model.ToolResult;
import me.golemcore.chainscope.domain.model.fusion.TransactionList;
import me.golemcore.chainscope.domain.model.fusion.WalletBalance;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.List;

/**
 * Recognizes Etherscan account responses: a decimal {@code result} string is a
 * balance in wei, a non-empty {@code result} array a transaction list.
 */
@Component
public class EtherscanRecognizer implements ShapeRecognizer {

    static final String BALANCE_KEY = "wallet_balance";
    static final String TRANSACTIONS_KEY = "transactions";

    private static final int RECENT_TRANSACTIONS = 10;

    @Override
    public boolean supports(String source) {
        return DataProviders.ETHERSCAN.equals(source);
    }

    @Override
    public List<RecognizedRecord> recognize(ToolResult result) {
        JsonNode payload = result.getData() != null ? result.getData().get("result") : null;
        if (payload == null) {
            return List.of();
        }
        String address = addressOf(result);
        if (payload.isTextual() && isDigits(payload.asText())) {
            WalletBalance balance = WalletBalance.builder()
                    .source(DataProviders.ETHERSCAN)
                    .address(address)
                    .balanceWei(new BigInteger(payload.asText()))
                    .build();
            return List.of(new RecognizedRecord(BALANCE_KEY, balance));
        }
        if (payload.isArray() && !payload.isEmpty()) {
            TransactionList transactions = TransactionList.builder()
                    .source(DataProviders.ETHERSCAN)
                    .address(address)
                    .transactions(JsonValues.head(payload, RECENT_TRANSACTIONS))
                    .totalCount(payload.size())
                    .build();
            return List.of(new RecognizedRecord(TRANSACTIONS_KEY, transactions));
        }
        return List.of();
    }

    private static boolean isDigits(String text) {
        return !text.isEmpty() && text.chars().allMatch(ch -> ch >= '0' && ch <= '9');
    }

    private static String addressOf(ToolResult result) {
        Object address = result.getMetadata() != null ? result.getMetadata().get("address") : null;
        return address != null ? address.toString() : null;
    }
}
