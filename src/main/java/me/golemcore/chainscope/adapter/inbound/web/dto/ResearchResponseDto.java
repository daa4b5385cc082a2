package me.golemcore.chainscope.adapter.inbound.web.dto;

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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Wire form of a research result. {@code result} is omitted on failure and
 * {@code error} on success.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ResearchResponseDto {
    private boolean success;
    private String result;
    private String error;

    @JsonProperty("reasoning_steps")
    private List<String> reasoningSteps;

    private List<CitationDto> citations;

    @JsonProperty("data_sources_used")
    private List<String> dataSourcesUsed;

    @JsonProperty("execution_time")
    private double executionTime;

    @JsonProperty("query_intent")
    private String queryIntent;

    @JsonProperty("completeness_score")
    private double completenessScore;

    @JsonProperty("session_id")
    private String sessionId;

    private Map<String, Object> metadata;
}
