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

import java.util.UUID;

/**
 * Immutable research request. A missing session id is replaced with a fresh
 * random identifier, a missing time range with {@link TimeRange#SEVEN_DAYS}.
 */
@Value
public class ResearchRequest {

    String query;
    String address;
    TimeRange timeRange;
    String sessionId;

    @Builder
    private ResearchRequest(String query, String address, TimeRange timeRange, String sessionId) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("Query is required");
        }
        this.query = query.trim();
        this.address = address == null || address.isBlank() ? null : address.trim();
        this.timeRange = timeRange != null ? timeRange : TimeRange.SEVEN_DAYS;
        this.sessionId = sessionId == null || sessionId.isBlank() ? UUID.randomUUID().toString() : sessionId.trim();
    }

    public boolean hasAddress() {
        return address != null;
    }
}
