package me.golemcore.chainscope.domain.model;

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

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Conversation state for one research session: the ordered message history and
 * the context of the last research run.
 *
 * <p>
 * Instances are owned by the session store. Callers outside the store only see
 * copies produced by {@link #snapshot()}.
 */
@Data
@Builder
public class ResearchSession {

    public static final String CONTEXT_LAST_QUERY = "last_query";
    public static final String CONTEXT_LAST_RESULT = "last_result";
    public static final String CONTEXT_QUERY_INTENT = "query_intent";
    public static final String CONTEXT_DATA_SOURCES = "data_sources";

    private String id;

    @Builder.Default
    private List<Message> messages = new ArrayList<>();

    @Builder.Default
    private Map<String, Object> researchContext = new LinkedHashMap<>();

    private Instant createdAt;
    private Instant lastActivity;

    public void addMessage(Message message) {
        if (messages == null) {
            messages = new ArrayList<>();
        }
        messages.add(message);
    }

    public int getMessageCount() {
        return messages != null ? messages.size() : 0;
    }

    public ResearchSession snapshot() {
        return ResearchSession.builder()
                .id(id)
                .messages(List.copyOf(messages))
                .researchContext(new LinkedHashMap<>(researchContext))
                .createdAt(createdAt)
                .lastActivity(lastActivity)
                .build();
    }
}
