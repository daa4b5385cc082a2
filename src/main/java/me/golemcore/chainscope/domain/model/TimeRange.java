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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Analysis window requested by the caller.
 */
public enum TimeRange {

    ONE_DAY("1d"), SEVEN_DAYS("7d"), THIRTY_DAYS("30d"), NINETY_DAYS("90d");

    private final String value;

    TimeRange(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static TimeRange fromValue(String value) {
        if (value == null || value.isBlank()) {
            return SEVEN_DAYS;
        }
        for (TimeRange range : values()) {
            if (range.value.equalsIgnoreCase(value.trim())) {
                return range;
            }
        }
        throw new IllegalArgumentException("Unsupported time range: " + value + " (expected 1d, 7d, 30d or 90d)");
    }

    @Override
    public String toString() {
        return value;
    }
}
