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

import me.golemcore.chainscope.domain.component.ToolComponent;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Spring configuration for shared infrastructure beans and startup logging.
 *
 * <p>
 * This configuration:
 * <ul>
 * <li>Provides the {@link Clock} used for session timing</li>
 * <li>Provides the shared {@link ObjectMapper}; floating point numbers are
 * read as {@link java.math.BigDecimal} so provider figures keep their full
 * precision</li>
 * <li>Provides the executor that runs provider invocations in parallel</li>
 * <li>Logs the enabled data providers and LLM settings on startup</li>
 * </ul>
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final ChainscopeProperties properties;
    private final List<ToolComponent> tools;

    @Bean
    public static Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
        return mapper;
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService toolDispatchExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(properties.getDispatch().getPoolSize(), runnable -> {
            Thread thread = new Thread(runnable, "tool-dispatch-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @PostConstruct
    public void init() {
        log.info("Chainscope starting...");
        log.info("LLM Provider: {} (model: {})", properties.getLlm().getProvider(), properties.getLlm().getModel());
        log.info("Adapter timeout: {}, dispatch pool: {}", properties.getDispatch().getAdapterTimeout(),
                properties.getDispatch().getPoolSize());
        for (ToolComponent tool : tools) {
            log.info("Data provider {}: {}", tool.getToolName(), tool.isEnabled() ? "enabled" : "disabled");
        }
    }
}
