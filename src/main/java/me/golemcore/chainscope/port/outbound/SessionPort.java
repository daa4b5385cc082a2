package me.golemcore.chainscope.port.outbound;

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

import me.golemcore.chainscope.domain.model.Message;
import me.golemcore.chainscope.domain.model.ResearchSession;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Port for research session state. Implementations own the sessions
 * exclusively: callers receive snapshots and change state only through this
 * interface.
 */
public interface SessionPort {

    /**
     * Returns the live session with the given id, creating it when absent or
     * expired. Expired sessions are purged and capacity is enforced first.
     *
     * @param sessionId
     *            session id, or null for a fresh random id
     * @return snapshot of the session
     */
    ResearchSession getOrCreate(String sessionId);

    /**
     * Returns a snapshot of a live session. Expired and evicted sessions are
     * reported as absent.
     */
    Optional<ResearchSession> get(String sessionId);

    void appendMessage(String sessionId, Message message);

    /**
     * Merges the given entries into the session's research context.
     */
    void updateContext(String sessionId, Map<String, Object> patch);

    /**
     * Renders the last {@code maxMessages} messages as "User asked" /
     * "Assistant responded about" lines. Empty for unknown or empty sessions.
     */
    String summarize(String sessionId, int maxMessages);

    List<ResearchSession> listAll();
}
