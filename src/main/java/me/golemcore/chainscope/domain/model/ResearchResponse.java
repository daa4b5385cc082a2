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

import java.util.List;
import java.util.Map;

/**
 * Terminal outcome of a research request. A failed response keeps the
 * reasoning steps accumulated before the failure and a concise error.
 */
@Value
@Builder
public class ResearchResponse {

    boolean success;
    String result;
    String error;

    @Builder.Default
    List<String> reasoningSteps = List.of();

    @Builder.Default
    List<Citation> citations = List.of();

    @Builder.Default
    List<String> dataSourcesUsed = List.of();

    /**
     * Wall-clock duration in seconds.
     */
    double executionTime;

    Intent queryIntent;

    double completenessScore;

    String sessionId;

    @Builder.Default
    Map<String, Object> metadata = Map.of();
}
