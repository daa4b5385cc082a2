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
import me.golemcore.chainscope.domain.model.fusion.MergedDataset;
import me.golemcore.chainscope.domain.model.fusion.RecordType;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Set;

/**
 * Scores how much of the data an intent calls for was gathered, from 0 to
 * 100.
 *
 * <p>
 * The score is the sum of a base for any data, a bonus per expected record
 * type (weighted per intent), a source-diversity bonus and a data-richness
 * bonus. It is floored at 20 when any record is present and capped at 100. An
 * empty dataset scores 0. The function depends only on its arguments.
 */
@Component
public class CompletenessScorer {

    static final double BASE = 15.0;
    static final double FLOOR = 20.0;
    static final double MAX = 100.0;
    static final double COMPREHENSIVE_BONUS = 10.0;
    static final int COMPREHENSIVE_TYPES = 4;

    private static final Map<RecordType, Double> INFORMATION = Map.of(
            RecordType.TOKEN_INFO, 35.0,
            RecordType.MARKET_QUOTE, 20.0,
            RecordType.GLOBAL_METRICS, 10.0);

    private static final Map<RecordType, Double> MARKET_DATA = Map.of(
            RecordType.MARKET_QUOTE, 40.0,
            RecordType.GLOBAL_METRICS, 20.0,
            RecordType.DEX_PAIRS, 25.0);

    private static final Map<RecordType, Double> TECHNICAL = Map.of(
            RecordType.DEX_PAIRS, 35.0,
            RecordType.ANALYTICS, 25.0,
            RecordType.TRANSACTIONS, 15.0);

    private static final Map<RecordType, Double> ANALYSIS = Map.of(
            RecordType.MARKET_QUOTE, 25.0,
            RecordType.TOKEN_INFO, 20.0,
            RecordType.DEX_PAIRS, 15.0,
            RecordType.GLOBAL_METRICS, 10.0,
            RecordType.TRANSACTIONS, 10.0,
            RecordType.ANALYTICS, 10.0);

    private static final Map<RecordType, Double> GENERAL = Map.of(
            RecordType.MARKET_QUOTE, 30.0,
            RecordType.TOKEN_INFO, 20.0,
            RecordType.DEX_PAIRS, 15.0,
            RecordType.GLOBAL_METRICS, 10.0,
            RecordType.ANALYTICS, 10.0);

    public double score(MergedDataset dataset, Intent intent) {
        if (dataset.isEmpty()) {
            return 0.0;
        }
        Set<RecordType> present = dataset.getRecordTypes();
        double score = BASE;

        Map<RecordType, Double> weights = weightsFor(intent);
        int expectedPresent = 0;
        for (Map.Entry<RecordType, Double> weight : weights.entrySet()) {
            if (present.contains(weight.getKey())) {
                score += weight.getValue();
                expectedPresent++;
            }
        }
        if (intent == Intent.ANALYSIS && expectedPresent >= COMPREHENSIVE_TYPES) {
            score += COMPREHENSIVE_BONUS;
        }

        score += sourceDiversityBonus(dataset.getSourcesUsed().size());
        score += richnessBonus(dataset.getTotalRecords());

        return Math.min(MAX, Math.max(FLOOR, score));
    }

    static Map<RecordType, Double> weightsFor(Intent intent) {
        return switch (intent) {
        case INFORMATION -> INFORMATION;
        case MARKET_DATA -> MARKET_DATA;
        case TECHNICAL -> TECHNICAL;
        case ANALYSIS -> ANALYSIS;
        default -> GENERAL;
        };
    }

    static double sourceDiversityBonus(int sources) {
        if (sources >= 3) {
            return 15.0;
        }
        if (sources == 2) {
            return 10.0;
        }
        return sources == 1 ? 5.0 : 0.0;
    }

    static double richnessBonus(int records) {
        if (records >= 5) {
            return 10.0;
        }
        return records >= 3 ? 5.0 : 0.0;
    }
}
