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

import me.golemcore.chainscope.domain.model.Intent;

import java.util.List;

/**
 * One row of the intent rule table: the intent applies when the lower-cased
 * query contains any of the keywords.
 */
public record IntentRule(Intent intent, List<String> keywords) {

    public IntentRule {
        keywords = List.copyOf(keywords);
    }

    public boolean matches(String normalizedQuery) {
        return keywords.stream().anyMatch(normalizedQuery::contains);
    }
}
