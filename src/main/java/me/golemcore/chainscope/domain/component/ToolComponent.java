package me.golemcore.chainscope.domain.component;

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

import me.golemcore.chainscope.domain.model.ToolInvocation;
import me.golemcore.chainscope.domain.model.ToolResult;

import java.util.concurrent.CompletableFuture;

/**
 * Data provider adapter with a uniform invocation contract. Implementations
 * wrap one provider (market data, on-chain analytics, explorer, DeFi
 * aggregator) and tag every result with their {@link #getToolName() name}.
 *
 * <p>
 * Provider errors should be reported as {@link ToolResult#failure} rather than
 * thrown. Retries, if any, are the adapter's own business.
 */
public interface ToolComponent extends Component {

    @Override
    default String getComponentType() {
        return "tool";
    }

    /**
     * Returns the unique name of this tool, which is also the {@code source}
     * of its results.
     *
     * @return the tool name
     */
    String getToolName();

    /**
     * Returns a short description of the data this tool provides.
     *
     * @return the description
     */
    String getDescription();

    /**
     * Whether the tool cannot run without an address. The dispatcher skips
     * such tools when no address is resolvable.
     *
     * @return true if an address is mandatory
     */
    default boolean requiresAddress() {
        return false;
    }

    /**
     * Invokes the provider.
     *
     * @param invocation
     *            query, address and time range
     * @return a future containing the provider result
     */
    CompletableFuture<ToolResult> invoke(ToolInvocation invocation);
}
