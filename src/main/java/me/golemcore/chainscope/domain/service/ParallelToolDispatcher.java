package me.golemcore.chainscope.domain.service;

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
import me.golemcore.chainscope.domain.model.DispatchOutcome;
import me.golemcore.chainscope.domain.model.ToolInvocation;
import me.golemcore.chainscope.domain.model.ToolResult;
import me.golemcore.chainscope.infrastructure.config.ChainscopeProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Invokes the planned tools concurrently and collects what they return.
 *
 * <p>
 * Every invocation starts on the dispatch executor and is bounded by the
 * configured adapter timeout. An invocation that throws or times out is logged
 * and omitted; it never affects its siblings. Failure results returned by a
 * tool are kept. Tools that need an address are skipped up front when none is
 * available. Nothing is retried here.
 */
@Service
@Slf4j
public class ParallelToolDispatcher {

    private final Map<String, ToolComponent> toolsByName = new LinkedHashMap<>();
    private final ExecutorService executor;
    private final Duration adapterTimeout;

    public ParallelToolDispatcher(List<ToolComponent> tools, ExecutorService toolDispatchExecutor,
            ChainscopeProperties properties) {
        for (ToolComponent tool : tools) {
            toolsByName.put(tool.getToolName(), tool);
        }
        this.executor = toolDispatchExecutor;
        this.adapterTimeout = properties.getDispatch().getAdapterTimeout();
    }

    public DispatchOutcome execute(ToolInvocation invocation, Collection<String> plannedTools) {
        DispatchOutcome.DispatchOutcomeBuilder outcome = DispatchOutcome.builder();
        List<CompletableFuture<Optional<ToolResult>>> futures = new ArrayList<>();

        for (String name : plannedTools) {
            ToolComponent tool = toolsByName.get(name);
            if (tool == null) {
                log.warn("[Dispatch] No tool registered for '{}', skipping", name);
                outcome.note("Skipped " + name + ": no such data provider");
                continue;
            }
            if (tool.requiresAddress() && !invocation.hasAddress()) {
                log.info("[Dispatch] Skipping {}: no address available", name);
                outcome.note("Skipped " + name + ": requires an address");
                continue;
            }
            futures.add(start(tool, invocation));
        }
        outcome.invocations(futures.size());

        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).get();
        } catch (InterruptedException e) {
            futures.forEach(future -> future.cancel(true));
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Dispatch interrupted", e);
        } catch (ExecutionException e) {
            // per-tool failures are already folded into empty results
            throw new IllegalStateException("Unexpected dispatch failure", e.getCause());
        }

        for (CompletableFuture<Optional<ToolResult>> future : futures) {
            future.join().ifPresent(outcome::result);
        }
        DispatchOutcome result = outcome.build();
        log.debug("[Dispatch] {} of {} invocations returned a result", result.getResults().size(),
                result.getInvocations());
        return result;
    }

    private CompletableFuture<Optional<ToolResult>> start(ToolComponent tool, ToolInvocation invocation) {
        String name = tool.getToolName();
        return CompletableFuture.supplyAsync(() -> tool.invoke(invocation), executor)
                .thenCompose(future -> future)
                .orTimeout(adapterTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((result, error) -> {
                    if (error != null) {
                        logOmission(name, unwrap(error));
                        return Optional.<ToolResult>empty();
                    }
                    if (result == null) {
                        log.warn("[Dispatch] {} returned no result, omitting", name);
                        return Optional.<ToolResult>empty();
                    }
                    if (!result.isSuccess()) {
                        log.warn("[Dispatch] {} reported failure: {}", name, result.getError());
                    }
                    return Optional.of(result);
                });
    }

    private void logOmission(String name, Throwable error) {
        if (error instanceof TimeoutException) {
            log.warn("[Dispatch] {} timed out after {}, omitting", name, adapterTimeout);
        } else if (error instanceof CancellationException) {
            log.warn("[Dispatch] {} was cancelled, omitting", name);
        } else {
            log.error("[Dispatch] {} failed, omitting: {}", name, error.getMessage(), error);
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
