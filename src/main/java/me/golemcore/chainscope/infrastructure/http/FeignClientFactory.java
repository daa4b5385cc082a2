package me.golemcore.chainscope.infrastructure.http;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import feign.Feign;
import feign.Logger;
import feign.jackson.JacksonDecoder;
import feign.jackson.JacksonEncoder;
import feign.okhttp.OkHttpClient;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Factory for declarative provider clients with OkHttp transport and Jackson
 * decoding.
 *
 * <p>
 * Every provider tool describes its REST endpoints as a Feign interface and
 * obtains an implementation here:
 *
 * <pre>{@code
 * CoinMarketCapApi api = factory.create(CoinMarketCapApi.class, "https://pro-api.coinmarketcap.com/v1");
 * }</pre>
 *
 * <p>
 * Responses decode through the shared {@link ObjectMapper}, so endpoints typed
 * as {@link com.fasterxml.jackson.databind.JsonNode} keep provider numbers at
 * full precision. Feign does not retry; non-2xx responses surface as
 * {@link feign.FeignException} to the calling tool.
 *
 * @since 1.0
 */
@Component
@RequiredArgsConstructor
public class FeignClientFactory {

    private final okhttp3.OkHttpClient okHttpClient;
    private final ObjectMapper objectMapper;

    /**
     * Create a Feign client for the given API interface.
     */
    public <T> T create(Class<T> apiType, String baseUrl) {
        return Feign.builder()
                .client(new OkHttpClient(okHttpClient))
                .encoder(new JacksonEncoder(objectMapper))
                .decoder(new JacksonDecoder(objectMapper))
                .logLevel(Logger.Level.NONE)
                .retryer(feign.Retryer.NEVER_RETRY)
                .target(apiType, baseUrl);
    }
}
