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

import me.golemcore.chainscope.domain.fusion.DataFusionEngine;
import me.golemcore.chainscope.domain.model.Citation;
import me.golemcore.chainscope.domain.model.DispatchOutcome;
import me.golemcore.chainscope.domain.model.Intent;
import me.golemcore.chainscope.domain.model.LlmRequest;
import me.golemcore.chainscope.domain.model.LlmResponse;
import me.golemcore.chainscope.domain.model.Message;
import me.golemcore.chainscope.domain.model.ResearchPlan;
import me.golemcore.chainscope.domain.model.ResearchRequest;
import me.golemcore.chainscope.domain.model.ResearchResponse;
import me.golemcore.chainscope.domain.model.ResearchSession;
import me.golemcore.chainscope.domain.model.ToolResult;
import me.golemcore.chainscope.domain.model.fusion.CanonicalView;
import me.golemcore.chainscope.domain.model.fusion.MergedDataset;
import me.golemcore.chainscope.infrastructure.config.ChainscopeProperties;
import me.golemcore.chainscope.port.outbound.LlmPort;
import me.golemcore.chainscope.port.outbound.SessionPort;
import me.golemcore.chainscope.routing.GreetingResponder;
import me.golemcore.chainscope.routing.IntentClassifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;

/**
 * Runs one research request end to end.
 *
 * <p>
 * Greetings are answered directly without planning or calling any provider.
 * Other queries are planned, dispatched to the providers in parallel, fused
 * and synthesized into prose by the language model. Runs for the same session
 * are serialized, so the history reflects request arrival order.
 *
 * <p>
 * The user message is recorded before planning and stays recorded when the
 * run fails. The assistant message is recorded only after synthesis succeeds.
 * A failed run returns the reasoning steps collected so far with a short
 * error.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ResearchOrchestrator {

    static final double GREETING_COMPLETENESS = 1.0;
    private static final int QUERY_CONTEXT_LENGTH = 100;

    private final SessionPort sessionPort;
    private final SessionRunCoordinator runCoordinator;
    private final IntentClassifier intentClassifier;
    private final GreetingResponder greetingResponder;
    private final ResearchPlanner planner;
    private final ParallelToolDispatcher dispatcher;
    private final DataFusionEngine fusionEngine;
    private final SynthesisBriefBuilder briefBuilder;
    private final ResearchResultFormatter resultFormatter;
    private final LlmPort llmPort;
    private final ChainscopeProperties properties;
    private final Clock clock;

    public ResearchResponse research(ResearchRequest request) {
        return runCoordinator.runExclusive(request.getSessionId(), () -> run(request));
    }

    private ResearchResponse run(ResearchRequest request) {
        Instant started = clock.instant();
        ResearchSession session = sessionPort.getOrCreate(request.getSessionId());
        Intent intent = intentClassifier.classify(request.getQuery());
        log.info("[Research] Session {} query intent: {}", session.getId(), intent.getWireName());

        if (intent == Intent.GREETING) {
            return greet(request, session, started);
        }

        List<String> steps = new ArrayList<>();
        try {
            int summaryMessages = properties.getSessions().getSummaryMessages();
            String summary = sessionPort.summarize(session.getId(), summaryMessages);
            sessionPort.appendMessage(session.getId(), Message.user(request.getQuery(), clock.instant()));
            if (!summary.isEmpty()) {
                steps.add("Referencing conversation history: " + session.getMessageCount() + " previous messages");
            }
            steps.add("Analyzing query and planning approach (Intent: " + intent.getWireName() + ")");

            ResearchPlan plan = planner.plan(request, intent);
            steps.addAll(plan.getRationale());

            DispatchOutcome outcome = dispatcher.execute(plan.toInvocation(request), plan.getTools());
            steps.addAll(outcome.getNotes());

            steps.add("Merging and analyzing data from all sources");
            MergedDataset dataset = fusionEngine.merge(outcome.getResults(), intent);
            CanonicalView view = fusionEngine.canonicalize(dataset);

            steps.add("Synthesizing comprehensive response based on merged data");
            String brief = briefBuilder.build(request, intent, plan, summary, dataset, view);
            String prose = synthesize(session, brief, summaryMessages);
            String result = resultFormatter.format(prose, intent, dataset);

            List<String> sources = successfulSources(outcome.getResults());
            record(session.getId(), request, intent, result, steps, sources, dataset.getCompletenessScore());

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("is_greeting", false);
            metadata.put("api_calls_made", outcome.getInvocations());
            metadata.put("address_synthesized", plan.isAddressSynthesized());
            metadata.put("conflicts", dataset.getConflicts());
            metadata.put("failed_sources", dataset.getFailedSources());

            ResearchResponse response = ResearchResponse.builder()
                    .success(true)
                    .result(result)
                    .reasoningSteps(List.copyOf(steps))
                    .citations(citations(sources, request.getQuery()))
                    .dataSourcesUsed(sources)
                    .executionTime(secondsSince(started))
                    .queryIntent(intent)
                    .completenessScore(dataset.getCompletenessScore())
                    .sessionId(session.getId())
                    .metadata(metadata)
                    .build();
            log.info("[Research] Session {} completed in {}s with sources {} (completeness {})",
                    session.getId(), response.getExecutionTime(), sources, dataset.getCompletenessScore());
            return response;
        } catch (RuntimeException e) { // NOSONAR - any failure ends the run in the failed state
            log.error("[Research] Session {} failed: {}", session.getId(), e.getMessage(), e);
            return ResearchResponse.builder()
                    .success(false)
                    .error(conciseError(e))
                    .reasoningSteps(List.copyOf(steps))
                    .executionTime(secondsSince(started))
                    .queryIntent(intent)
                    .sessionId(session.getId())
                    .build();
        }
    }

    private ResearchResponse greet(ResearchRequest request, ResearchSession session, Instant started) {
        String reply = greetingResponder.respond(request.getQuery(), session.getMessageCount());
        sessionPort.appendMessage(session.getId(), Message.user(request.getQuery(), clock.instant()));
        List<String> steps = List.of("Detected greeting message - provided friendly response");
        record(session.getId(), request, Intent.GREETING, reply, steps, List.of(), GREETING_COMPLETENESS);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("is_greeting", true);
        metadata.put("api_calls_made", 0);
        metadata.put("sources_used", List.of());
        metadata.put("response_type", "greeting");

        return ResearchResponse.builder()
                .success(true)
                .result(reply)
                .reasoningSteps(steps)
                .executionTime(secondsSince(started))
                .queryIntent(Intent.GREETING)
                .completenessScore(GREETING_COMPLETENESS)
                .sessionId(session.getId())
                .metadata(metadata)
                .build();
    }

    private String synthesize(ResearchSession session, String brief, int historyMessages) {
        if (!llmPort.isAvailable()) {
            throw new SynthesisException("Language model is not configured");
        }
        List<Message> messages = session.getMessages();
        List<Message> history = new ArrayList<>(
                messages.subList(Math.max(0, messages.size() - historyMessages), messages.size()));
        LlmRequest llmRequest = LlmRequest.builder()
                .systemPrompt(briefBuilder.systemPrompt())
                .history(history)
                .prompt(brief)
                .sessionId(session.getId())
                .build();

        LlmResponse response;
        try {
            response = llmPort.chat(llmRequest).join();
        } catch (CompletionException | CancellationException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new SynthesisException("Language model call failed: " + cause.getMessage(), cause);
        }
        if (response == null || !response.hasContent()) {
            throw new SynthesisException("Language model returned empty content");
        }
        return response.getContent();
    }

    private void record(String sessionId, ResearchRequest request, Intent intent, String result, List<String> steps,
            List<String> sources, double completeness) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("reasoning_steps", List.copyOf(steps));
        metadata.put("data_sources", sources);
        metadata.put("completeness_score", completeness);
        metadata.put("query_intent", intent.getWireName());
        sessionPort.appendMessage(sessionId, Message.assistant(result, clock.instant(), metadata));

        Map<String, Object> context = new LinkedHashMap<>();
        context.put(ResearchSession.CONTEXT_LAST_QUERY, request.getQuery());
        context.put(ResearchSession.CONTEXT_LAST_RESULT, result);
        context.put(ResearchSession.CONTEXT_QUERY_INTENT, intent.getWireName());
        context.put(ResearchSession.CONTEXT_DATA_SOURCES, sources);
        sessionPort.updateContext(sessionId, context);
    }

    // every provider that answered is cited, even when its records lost a key to another source
    private List<String> successfulSources(List<ToolResult> results) {
        return results.stream()
                .filter(ToolResult::isSuccess)
                .map(ToolResult::getSource)
                .filter(Objects::nonNull)
                .distinct()
                .sorted()
                .toList();
    }

    private List<Citation> citations(List<String> sources, String query) {
        Instant now = clock.instant();
        String context = query.length() > QUERY_CONTEXT_LENGTH ? query.substring(0, QUERY_CONTEXT_LENGTH) : query;
        return sources.stream()
                .map(source -> Citation.builder()
                        .source(source)
                        .timestamp(now)
                        .queryContext(context)
                        .build())
                .toList();
    }

    private double secondsSince(Instant started) {
        return Duration.between(started, clock.instant()).toMillis() / 1000.0;
    }

    private static String conciseError(RuntimeException e) {
        return e.getMessage() != null && !e.getMessage().isBlank() ? e.getMessage() : e.getClass().getSimpleName();
    }
}
