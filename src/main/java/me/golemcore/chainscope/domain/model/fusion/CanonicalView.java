package me.golemcore.chainscope.domain.model.fusion;

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

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Conflict-free mapping from semantic field to the one provider record trusted
 * for it. Used to brief the language model; never persisted.
 */
@EqualsAndHashCode
@ToString
public class CanonicalView {

    private final Map<CanonicalField, CanonicalEntry> entries;

    public CanonicalView(Map<CanonicalField, CanonicalEntry> entries) {
        Map<CanonicalField, CanonicalEntry> copy = new EnumMap<>(CanonicalField.class);
        copy.putAll(entries);
        this.entries = Collections.unmodifiableMap(copy);
    }

    public Optional<CanonicalEntry> get(CanonicalField field) {
        return Optional.ofNullable(entries.get(field));
    }

    public boolean has(CanonicalField field) {
        return entries.containsKey(field);
    }

    public Map<CanonicalField, CanonicalEntry> getEntries() {
        return entries;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
