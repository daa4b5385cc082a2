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

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * Result of fusing the provider responses of one request.
 *
 * <p>
 * Records are partitioned into primary and supplementary maps keyed by a
 * record name. A provider appears in {@link #getSourcesUsed()} only after it
 * contributed at least one record. Once a key is taken, a later record for the
 * same key is rejected and noted in {@link #getConflicts()}; insertion order
 * is therefore significant and the fusion engine feeds records in a canonical
 * order.
 *
 * <p>
 * Instances are built fresh per request and are not thread-safe.
 */
@EqualsAndHashCode
@ToString
public class MergedDataset {

    private final SortedMap<String, FusedRecord> primary = new TreeMap<>();
    private final SortedMap<String, FusedRecord> supplementary = new TreeMap<>();
    private final SortedSet<String> sourcesUsed = new TreeSet<>();
    private final List<String> conflicts = new ArrayList<>();
    private final SortedMap<String, String> failedSources = new TreeMap<>();
    private double completenessScore;

    /**
     * Adds a record under the given key, in the partition of its type.
     *
     * @return false if the key was already taken; the record is dropped and a
     *         conflict is noted
     */
    public boolean put(String key, FusedRecord record) {
        SortedMap<String, FusedRecord> target = record.getType().isPrimary() ? primary : supplementary;
        FusedRecord existing = target.get(key);
        if (existing != null) {
            conflicts.add(key + ": kept " + existing.getSource() + ", dropped " + record.getSource());
            return false;
        }
        target.put(key, record);
        sourcesUsed.add(record.getSource());
        return true;
    }

    public void recordFailure(String source, String error) {
        String message = error != null ? error : "unknown error";
        failedSources.merge(source != null ? source : "unknown", message, (first, second) -> first + "; " + second);
    }

    public SortedMap<String, FusedRecord> getPrimary() {
        return Collections.unmodifiableSortedMap(primary);
    }

    public SortedMap<String, FusedRecord> getSupplementary() {
        return Collections.unmodifiableSortedMap(supplementary);
    }

    public SortedSet<String> getSourcesUsed() {
        return Collections.unmodifiableSortedSet(sourcesUsed);
    }

    public List<String> getConflicts() {
        return Collections.unmodifiableList(conflicts);
    }

    public SortedMap<String, String> getFailedSources() {
        return Collections.unmodifiableSortedMap(failedSources);
    }

    public double getCompletenessScore() {
        return completenessScore;
    }

    public void setCompletenessScore(double completenessScore) {
        this.completenessScore = completenessScore;
    }

    public boolean isEmpty() {
        return primary.isEmpty() && supplementary.isEmpty();
    }

    public int getTotalRecords() {
        return primary.size() + supplementary.size();
    }

    public Set<RecordType> getRecordTypes() {
        Set<RecordType> types = EnumSet.noneOf(RecordType.class);
        records().forEach(entry -> types.add(entry.getValue().getType()));
        return types;
    }

    public boolean has(RecordType type) {
        return records().anyMatch(entry -> entry.getValue().getType() == type);
    }

    /**
     * All records, primary first, each partition in key order.
     */
    public Stream<Map.Entry<String, FusedRecord>> records() {
        return Stream.concat(primary.entrySet().stream(), supplementary.entrySet().stream());
    }
}
