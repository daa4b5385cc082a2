package me.golemcore.chainscope.domain.fusion;

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
import me.golemcore.chainscope.domain.model.ToolResult;
import me.golemcore.chainscope.domain.model.fusion.CanonicalEntry;
import me.golemcore.chainscope.domain.model.fusion.CanonicalField;
import me.golemcore.chainscope.domain.model.fusion.CanonicalView;
import me.golemcore.chainscope.domain.model.fusion.FusedRecord;
import me.golemcore.chainscope.domain.model.fusion.MarketQuote;
import me.golemcore.chainscope.domain.model.fusion.MergedDataset;
import me.golemcore.chainscope.domain.model.fusion.RawRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Merges provider results into one dataset and derives the canonical view.
 *
 * <p>
 * Failed results only contribute to the failure list. Successful results are
 * fed to the recognizers in a canonical order (by source, endpoint, then
 * payload), so the merged dataset does not depend on the order in which
 * providers completed. A payload no recognizer understands is kept verbatim
 * under {@code <source>_<endpoint>}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DataFusionEngine {

    private static final Comparator<ToolResult> CANONICAL_ORDER = Comparator
            .comparing(ToolResult::getSource, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(ToolResult::getEndpoint, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(result -> Objects.toString(result.getData(), ""));

    private static final Comparator<MarketQuote> BY_RANK = Comparator.comparing(MarketQuote::getRank,
            Comparator.nullsLast(Comparator.naturalOrder()));

    private final List<ShapeRecognizer> recognizers;
    private final CompletenessScorer scorer;
    private final PrecedenceTable precedence;

    public MergedDataset merge(List<ToolResult> results, Intent intent) {
        MergedDataset dataset = new MergedDataset();
        List<ToolResult> successes = new ArrayList<>();
        List<ToolResult> failures = new ArrayList<>();
        for (ToolResult result : results) {
            if (result != null) {
                (result.isSuccess() ? successes : failures).add(result);
            }
        }
        successes.sort(CANONICAL_ORDER);
        failures.sort(Comparator.comparing(ToolResult::getSource, Comparator.nullsFirst(Comparator.naturalOrder()))
                .thenComparing(result -> Objects.toString(result.getError(), "")));
        failures.forEach(failure -> dataset.recordFailure(failure.getSource(), failure.getError()));

        for (ToolResult result : successes) {
            if (result.getData() == null || result.getData().isNull()) {
                log.debug("[Fusion] {} returned no payload", result.getSource());
                continue;
            }
            List<RecognizedRecord> records = recognize(result);
            if (records.isEmpty()) {
                String key = result.getSource() + "_" + Optional.ofNullable(result.getEndpoint()).orElse("data");
                records = List.of(new RecognizedRecord(key, RawRecord.builder()
                        .source(result.getSource())
                        .endpoint(result.getEndpoint())
                        .payload(result.getData())
                        .build()));
                log.debug("[Fusion] Unrecognized payload from {}, stored as {}", result.getSource(), key);
            }
            for (RecognizedRecord record : records) {
                if (!dataset.put(record.key(), record.record())) {
                    log.debug("[Fusion] Conflict on {}: dropped record from {}", record.key(),
                            record.record().getSource());
                }
            }
        }

        dataset.setCompletenessScore(scorer.score(dataset, intent));
        log.info("[Fusion] Merged {} records from {} (completeness {}, {} conflicts, {} failed)",
                dataset.getTotalRecords(), dataset.getSourcesUsed(), dataset.getCompletenessScore(),
                dataset.getConflicts().size(), dataset.getFailedSources().size());
        return dataset;
    }

    public CanonicalView canonicalize(MergedDataset dataset) {
        Map<CanonicalField, CanonicalEntry> entries = new EnumMap<>(CanonicalField.class);
        for (CanonicalField field : CanonicalField.values()) {
            Optional<String> source = precedence.preferredSource(field);
            if (source.isEmpty()) {
                continue;
            }
            List<Map.Entry<String, FusedRecord>> candidates = dataset.records()
                    .filter(entry -> field.accepts(entry.getValue()))
                    .filter(entry -> source.get().equals(entry.getValue().getSource()))
                    .toList();
            choose(field, candidates).ifPresent(chosen -> entries.put(field,
                    new CanonicalEntry(field, source.get(), chosen.getKey(), chosen.getValue())));
        }
        return new CanonicalView(entries);
    }

    private List<RecognizedRecord> recognize(ToolResult result) {
        for (ShapeRecognizer recognizer : recognizers) {
            if (recognizer.supports(result.getSource())) {
                return recognizer.recognize(result);
            }
        }
        return List.of();
    }

    private static Optional<Map.Entry<String, FusedRecord>> choose(CanonicalField field,
            List<Map.Entry<String, FusedRecord>> candidates) {
        if (field == CanonicalField.MARKET) {
            Comparator<Map.Entry<String, FusedRecord>> byRankThenKey = Comparator
                    .comparing((Map.Entry<String, FusedRecord> entry) -> (MarketQuote) entry.getValue(), BY_RANK)
                    .thenComparing(Map.Entry::getKey);
            return candidates.stream().min(byRankThenKey);
        }
        return candidates.stream().min(Map.Entry.comparingByKey());
    }
}
