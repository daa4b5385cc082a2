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
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Tools selected for a request, in rule order, with the rationale behind each
 * selection. {@code address} is the address handed to tools; when
 * {@code addressSynthesized} is set it is a well-known sample address rather
 * than one the user supplied.
 */
@Value
@Builder
public class ResearchPlan {

    @Singular
    List<String> tools;

    @Singular("rationale")
    List<String> rationale;

    String address;
    boolean addressSynthesized;

    public ToolInvocation toInvocation(ResearchRequest request) {
        return ToolInvocation.builder()
                .query(request.getQuery())
                .address(address)
                .timeRange(request.getTimeRange())
                .build();
    }
}
