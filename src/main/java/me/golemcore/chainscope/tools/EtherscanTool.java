package me.golemcore.chainscope.tools;

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

import me.golemcore.chainscope.domain.component.ToolComponent;
import me.golemcore.chainscope.domain.model.DataProviders;
import me.golemcore.chainscope.domain.model.ToolInvocation;
import me.golemcore.chainscope.domain.model.ToolResult;
import me.golemcore.chainscope.infrastructure.config.ChainscopeProperties;
import me.golemcore.chainscope.infrastructure.http.FeignClientFactory;
import com.fasterxml.jackson.databind.JsonNode;
import feign.FeignException;
import feign.Headers;
import feign.Param;
import feign.RequestLine;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Account data from the Etherscan API: ETH balance, normal transactions or
 * ERC-20 token transfers for one address.
 *
 * <p>
 * Needs an address; the dispatcher never calls this tool without one.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EtherscanTool implements ToolComponent {

    static final String ACTION_BALANCE = "balance";
    static final String ACTION_TXLIST = "txlist";
    static final String ACTION_TOKENTX = "tokentx";

    private static final int PAGE_SIZE = 100;
    private static final String NO_TRANSACTIONS = "No transactions found";

    private final FeignClientFactory feignClientFactory;
    private final ChainscopeProperties properties;

    private EtherscanApi api;
    private boolean enabled;
    private String apiKey;

    @PostConstruct
    public void init() {
        var config = properties.getTools().getEtherscan();
        this.enabled = config.isEnabled();
        this.apiKey = config.getApiKey();

        if (enabled && (apiKey == null || apiKey.isBlank())) {
            log.warn("Etherscan tool is enabled but API key is not configured. Disabling.");
            this.enabled = false;
        }

        if (enabled) {
            this.api = feignClientFactory.create(EtherscanApi.class, config.getBaseUrl());
            log.info("Etherscan tool initialized ({})", config.getBaseUrl());
        }
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public String getToolName() {
        return DataProviders.ETHERSCAN;
    }

    @Override
    public String getDescription() {
        return "On-chain Ethereum account balance, transactions and token transfers";
    }

    @Override
    public boolean requiresAddress() {
        return true;
    }

    @Override
    public CompletableFuture<ToolResult> invoke(ToolInvocation invocation) {
        // runs on the calling dispatch thread
        if (!enabled) {
            return CompletableFuture.completedFuture(
                    ToolResult.failure(getToolName(), "Etherscan API key not configured"));
        }
        if (!invocation.hasAddress()) {
            return CompletableFuture.completedFuture(
                    ToolResult.failure(getToolName(), "Etherscan requires an address"));
        }
        return CompletableFuture.completedFuture(fetch(invocation));
    }

    private ToolResult fetch(ToolInvocation invocation) {
        String action = selectAction(invocation.getQuery());
        String address = invocation.getAddress();
        try {
            JsonNode response = switch (action) {
            case ACTION_BALANCE -> api.balance(address, apiKey);
            case ACTION_TOKENTX -> api.tokenTransfers(address, PAGE_SIZE, apiKey);
            default -> api.transactions(address, PAGE_SIZE, apiKey);
            };
            if (response == null) {
                return ToolResult.failure(getToolName(), "Etherscan returned an empty response");
            }

            String status = response.path("status").asText("");
            String message = response.path("message").asText("");
            if ("0".equals(status) && !NO_TRANSACTIONS.equalsIgnoreCase(message)) {
                String detail = response.path("result").isTextual() ? response.get("result").asText() : message;
                log.warn("[Etherscan] {} rejected: {}", action, detail);
                return ToolResult.failure(getToolName(), "Etherscan error: " + detail);
            }
            log.debug("[Etherscan] {} succeeded for {}", action, address);

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put(ToolResult.META_ENDPOINT, action);
            metadata.put("address", address);
            return ToolResult.success(getToolName(), response, metadata);
        } catch (FeignException e) {
            log.warn("[Etherscan] API error (status {}) on {}", e.status(), action);
            return ToolResult.failure(getToolName(), "HTTP " + e.status());
        } catch (Exception e) { // NOSONAR - broad catch for unexpected errors
            log.error("[Etherscan] Unexpected error on {}", action, e);
            return ToolResult.failure(getToolName(), "Etherscan request failed: " + e.getMessage());
        }
    }

    static String selectAction(String query) {
        String lower = query.toLowerCase(Locale.ROOT);
        if (lower.contains("balance")) {
            return ACTION_BALANCE;
        }
        if (lower.contains("token")) {
            return ACTION_TOKENTX;
        }
        return ACTION_TXLIST;
    }

    // Feign API interface
    interface EtherscanApi {
        @RequestLine("GET /api?module=account&action=balance&address={address}&tag=latest&apikey={apiKey}")
        @Headers("Accept: application/json")
        JsonNode balance(@Param("address") String address, @Param("apiKey") String apiKey);

        @RequestLine("GET /api?module=account&action=txlist&address={address}&startblock=0&endblock=99999999&page=1&offset={offset}&sort=desc&apikey={apiKey}")
        @Headers("Accept: application/json")
        JsonNode transactions(@Param("address") String address, @Param("offset") int offset,
                @Param("apiKey") String apiKey);

        @RequestLine("GET /api?module=account&action=tokentx&address={address}&page=1&offset={offset}&sort=desc&apikey={apiKey}")
        @Headers("Accept: application/json")
        JsonNode tokenTransfers(@Param("address") String address, @Param("offset") int offset,
                @Param("apiKey") String apiKey);
    }
}
