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

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Detects greetings and small talk so they can be answered without fetching
 * any provider data.
 *
 * <p>
 * A query is a greeting when, after lower-casing and trimming, it equals one
 * of the curated phrases, starts with a phrase followed by a space or a comma,
 * or starts with one of the greeting patterns (time-of-day greetings, "how are
 * you", thanks, "what's up"). The check is a pure function of the query.
 */
@Component
public class GreetingDetector {

    private static final List<String> PHRASES = List.of(
            "hi", "hello", "hey", "hiya", "howdy", "greetings",
            "good morning", "good afternoon", "good evening", "good day",
            "what's up", "whats up", "how are you", "how're you", "how are you doing",
            "how's it going", "hows it going", "how's everything", "hows everything",
            "nice to meet you", "pleasure to meet you", "thanks", "thank you",
            "bye", "goodbye", "see you", "catch you later", "take care",
            "how do you do", "sup", "yo", "cheers");

    private static final List<Pattern> PATTERNS = List.of(
            Pattern.compile("\\b(hi|hello|hey)\\b.*"),
            Pattern.compile("good\\s+(morning|afternoon|evening|day)"),
            Pattern.compile("how\\s+(are|is)\\s+you"),
            Pattern.compile("what['\u2019]?s\\s+up"),
            Pattern.compile("nice\\s+to\\s+meet\\s+you"),
            Pattern.compile("thanks?\\s+(you)?"),
            Pattern.compile("thank\\s+you"));

    public boolean isGreeting(String query) {
        if (query == null) {
            return false;
        }
        String normalized = query.trim().toLowerCase(Locale.ROOT);
        if (normalized.isEmpty()) {
            return false;
        }
        for (String phrase : PHRASES) {
            if (normalized.equals(phrase)
                    || normalized.startsWith(phrase + " ")
                    || normalized.startsWith(phrase + ",")) {
                return true;
            }
        }
        for (Pattern pattern : PATTERNS) {
            if (pattern.matcher(normalized).lookingAt()) {
                return true;
            }
        }
        return false;
    }
}
