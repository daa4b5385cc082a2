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
import lombok.Value;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single conversation message. Messages are appended to a session and never
 * changed afterwards; assistant messages carry a snapshot of the research run
 * (reasoning steps, sources, completeness) in their metadata.
 */
@Value
@Builder
public class Message {

    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";

    String role;
    String content;
    Instant timestamp;
    Map<String, Object> metadata;

    public static Message user(String content, Instant timestamp) {
        return Message.builder()
                .role(ROLE_USER)
                .content(content)
                .timestamp(timestamp)
                .metadata(Map.of())
                .build();
    }

    public static Message assistant(String content, Instant timestamp, Map<String, Object> metadata) {
        return Message.builder()
                .role(ROLE_ASSISTANT)
                .content(content)
                .timestamp(timestamp)
                .metadata(Collections.unmodifiableMap(new LinkedHashMap<>(metadata)))
                .build();
    }

    public boolean isUserMessage() {
        return ROLE_USER.equals(role);
    }

    public boolean isAssistantMessage() {
        return ROLE_ASSISTANT.equals(role);
    }
}
