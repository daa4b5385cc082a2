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
 * Produces the reply for a detected greeting.
 *
 * <p>
 * The reply category follows the greeting (time of day, "how are you", "what's
 * up", thanks, hello, farewell). Hellos from a session that already holds more
 * than two messages get a welcome-back reply. Within a category the reply is
 * picked from the query hash, so the same query always gets the same reply.
 */
@Component
public class GreetingResponder {

    private static final int RETURNING_MESSAGE_THRESHOLD = 2;
    private static final Pattern HELLO = Pattern.compile("\\b(hi|hello|hey|hiya|howdy)\\b");
    private static final Pattern FAREWELL = Pattern.compile("\\b(bye|goodbye|see you|catch you later|take care)\\b");

    private static final List<String> MORNING = List.of(
            "Good morning! Ready for some Web3 research? I can analyze crypto markets, track DeFi protocols or dig into on-chain data.",
            "Morning! Which crypto insights are you after today? Market data, DeFi analytics and blockchain metrics are all at hand.");
    private static final List<String> AFTERNOON = List.of(
            "Good afternoon! What crypto research can I help you with?",
            "Afternoon! Time for some Web3 analysis? Ask me about market data, protocols or blockchain metrics.");
    private static final List<String> EVENING = List.of(
            "Good evening! Crypto markets never close. What Web3 data are you curious about?",
            "Evening! Ready to explore some blockchain insights, from DeFi yields to market trends?");
    private static final List<String> HOW_ARE_YOU = List.of(
            "Doing great, thanks for asking! What's on your crypto research list today?",
            "All good here and ready to dig into blockchain analytics. How can I help?",
            "Excellent, with fresh market feeds at hand. Which crypto insights are you looking for?");
    private static final List<String> WHATS_UP = List.of(
            "Just keeping an eye on the crypto markets. Anything you'd like to research?",
            "Watching DeFi protocols and blockchain metrics. Got a crypto question for me?");
    private static final List<String> THANKS = List.of(
            "You're welcome! Happy to help with your Web3 research anytime.",
            "My pleasure! Come back whenever you need crypto insights or on-chain analysis.");
    private static final List<String> HELLO_NEW = List.of(
            "Hello! I'm your Web3 research assistant. I can analyze crypto markets, DeFi protocols and blockchain data. What would you like to explore?",
            "Hi there! I can pull live market data, DeFi metrics and on-chain activity and turn them into a research report. What interests you today?");
    private static final List<String> HELLO_RETURNING = List.of(
            "Welcome back! Ready for another round of Web3 research?",
            "Hello again! What are we digging into this time?");
    private static final List<String> FAREWELLS = List.of(
            "Goodbye! Come back anytime for more crypto insights.",
            "Take care! I'll be here whenever you need more blockchain analysis.");
    private static final List<String> DEFAULT = List.of(
            "Hello! I'm your Web3 research assistant, connected to live crypto data. How can I help you today?",
            "Hi! Ask me about token markets, DeFi protocols or on-chain activity.");

    public String respond(String query, int sessionMessageCount) {
        String normalized = query == null ? "" : query.trim().toLowerCase(Locale.ROOT);
        return pick(category(normalized, sessionMessageCount > RETURNING_MESSAGE_THRESHOLD), normalized);
    }

    private List<String> category(String q, boolean returning) {
        if (q.contains("morning")) {
            return MORNING;
        }
        if (q.contains("evening")) {
            return EVENING;
        }
        if (q.contains("afternoon")) {
            return AFTERNOON;
        }
        if (q.contains("how are you") || q.contains("how're you") || q.contains("how's it going")
                || q.contains("hows it going")) {
            return HOW_ARE_YOU;
        }
        if (q.contains("what's up") || q.contains("whats up") || q.startsWith("sup") || q.contains("wassup")) {
            return WHATS_UP;
        }
        if (q.contains("thanks") || q.contains("thank you")) {
            return THANKS;
        }
        if (HELLO.matcher(q).find()) {
            return returning ? HELLO_RETURNING : HELLO_NEW;
        }
        if (FAREWELL.matcher(q).find()) {
            return FAREWELLS;
        }
        return DEFAULT;
    }

    private String pick(List<String> replies, String normalized) {
        return replies.get(Math.floorMod(normalized.hashCode(), replies.size()));
    }
}
