package me.golemcore.chainscope;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for Chainscope.
 *
 * <p>
 * Chainscope answers natural-language Web3 research questions by querying
 * several independent data providers in parallel, fusing their responses into
 * one canonical dataset and handing that dataset to a language model for prose
 * synthesis.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports & Adapters):
 *
 * <pre>
 * Input Layer        → ResearchController, SessionsController
 * Domain Layer       → ResearchOrchestrator, Planner, Dispatcher, Fusion
 * Infrastructure     → Provider tools (Feign), LLM adapters (langchain4j)
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under
 * {@code chainscope.*} prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ChainscopeApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChainscopeApplication.class, args);
    }

}
