package me.golemcore.chainscope.routing;

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

import me.golemcore.chainscope.domain.model.Intent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Maps a raw query to an {@link Intent}.
 *
 * <p>
 * Greetings are detected first and short-circuit classification. Otherwise the
 * rule table is scanned in priority order (analysis, information, market data,
 * comparison, technical) and the first rule whose keywords occur in the query
 * wins; queries matching no rule are {@link Intent#GENERAL}. No state, no I/O.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class IntentClassifier {

    static final List<IntentRule> RULES = List.of(
            new IntentRule(Intent.ANALYSIS, List.of("analyze", "analysis", "performance", "how is", "doing")),
            new IntentRule(Intent.INFORMATION, List.of("info about", "information about", "what is",
                    "tell me about", "details about")),
            new IntentRule(Intent.MARKET_DATA, List.of("price", "trading", "volume", "market", "trends")),
            new IntentRule(Intent.COMPARISON, List.of("compare", "vs", "versus", "difference")),
            new IntentRule(Intent.TECHNICAL, List.of("dex", "whale", "technical", "data")));

    private final GreetingDetector greetingDetector;

    public Intent classify(String query) {
        if (greetingDetector.isGreeting(query)) {
            return Intent.GREETING;
        }
        String normalized = query == null ? "" : query.toLowerCase(Locale.ROOT);
        for (IntentRule rule : RULES) {
            if (rule.matches(normalized)) {
                log.debug("[Intent] '{}' classified as {}", query, rule.intent().getWireName());
                return rule.intent();
            }
        }
        return Intent.GENERAL;
    }
}
