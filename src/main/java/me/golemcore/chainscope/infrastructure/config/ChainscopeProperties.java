package me.golemcore.chainscope.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized configuration properties, bound from application.properties.
 *
 * <p>
 * All configuration is organized under the {@code chainscope.*} prefix:
 * <ul>
 * <li>{@link SessionProperties} - session capacity and expiry</li>
 * <li>{@link DispatchProperties} - parallel tool invocation</li>
 * <li>{@link ToolsProperties} - data provider credentials and endpoints</li>
 * <li>{@link LlmProperties} - language model used for synthesis</li>
 * <li>{@link HttpProperties} - shared OkHttp client</li>
 * <li>{@link WebProperties} - HTTP front end</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "chainscope")
@Data
public class ChainscopeProperties {

    private SessionProperties sessions = new SessionProperties();
    private DispatchProperties dispatch = new DispatchProperties();
    private ToolsProperties tools = new ToolsProperties();
    private LlmProperties llm = new LlmProperties();
    private HttpProperties http = new HttpProperties();
    private WebProperties web = new WebProperties();

    @Data
    public static class SessionProperties {
        private int maxSessions = 100;
        private Duration idleTimeout = Duration.ofHours(24);
        private int summaryMessages = 10;
        private int previewLength = 100;
    }

    @Data
    public static class DispatchProperties {
        /**
         * Upper bound for a single provider invocation. A slower provider is
         * treated as failed and omitted from the results.
         */
        private Duration adapterTimeout = Duration.ofSeconds(30);
        private int poolSize = 8;
    }

    // ==================== TOOLS ====================

    @Data
    public static class ToolsProperties {
        private ToolProperties coinmarketcap = new ToolProperties("https://pro-api.coinmarketcap.com/v1");
        private ToolProperties dune = new ToolProperties("https://api.dune.com");
        private ToolProperties etherscan = new ToolProperties("https://api.etherscan.io");
        private DefiLlamaToolProperties defillama = new DefiLlamaToolProperties();
    }

    @Data
    public static class ToolProperties {
        private boolean enabled = true;
        private String apiKey;
        private String baseUrl;

        public ToolProperties() {
        }

        public ToolProperties(String baseUrl) {
            this.baseUrl = baseUrl;
        }
    }

    @Data
    public static class DefiLlamaToolProperties {
        private boolean enabled = true;
        private String baseUrl = "https://api.llama.fi";
        private String stablecoinsUrl = "https://stablecoins.llama.fi";
        private String yieldsUrl = "https://yields.llama.fi";
        private String bridgesUrl = "https://bridges.llama.fi";
        private String coinsUrl = "https://coins.llama.fi";
    }

    // ==================== LLM ====================

    @Data
    public static class LlmProperties {
        /**
         * One of {@code openai}, {@code anthropic} or {@code none}.
         */
        private String provider = "openai";
        private String apiKey;
        private String model = "gpt-4o-mini";
        private String baseUrl;
        private double temperature = 0.1;
        private int maxTokens = 4000;
        private Duration timeout = Duration.ofSeconds(120);
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 20;
        private long keepAliveDuration = 300000;
    }

    @Data
    public static class WebProperties {
        /**
         * Comma separated list of origins allowed to call {@code /api/**}. Empty
         * means any origin.
         */
        private String allowedOrigins = "";
    }
}
