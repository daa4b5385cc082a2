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

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one provider invocation. Contains the provider tag, a success
 * flag, the raw provider payload and an error message on failure.
 *
 * <p>
 * Metadata carries routing hints set by the tool, most notably
 * {@link #META_ENDPOINT}, which tells the fusion engine which provider route
 * produced the payload.
 */
@Value
@Builder
public class ToolResult {

    public static final String META_ENDPOINT = "endpoint";

    String source;
    boolean success;
    JsonNode data;
    String error;
    Map<String, Object> metadata;

    /**
     * Creates a successful result.
     */
    public static ToolResult success(String source, JsonNode data) {
        return success(source, data, Map.of());
    }

    /**
     * Creates a successful result with routing metadata.
     */
    public static ToolResult success(String source, JsonNode data, Map<String, Object> metadata) {
        return ToolResult.builder()
                .source(source)
                .success(true)
                .data(data)
                .metadata(Collections.unmodifiableMap(new LinkedHashMap<>(metadata)))
                .build();
    }

    /**
     * Creates a failure result with an error message.
     */
    public static ToolResult failure(String source, String error) {
        return ToolResult.builder()
                .source(source)
                .success(false)
                .error(error)
                .metadata(Map.of())
                .build();
    }

    public String getEndpoint() {
        Object endpoint = metadata != null ? metadata.get(META_ENDPOINT) : null;
        return endpoint != null ? endpoint.toString() : null;
    }
}
