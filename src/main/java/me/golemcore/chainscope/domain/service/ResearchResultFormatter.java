package me.golemcore.chainscope.domain.service;

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
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Wraps synthesized prose with an intent header, a data quality label and a
 * data summary footer.
 */
@Component
public class ResearchResultFormatter {

    public String format(String prose, Intent intent, MergedDataset dataset) {
        StringBuilder sb = new StringBuilder();
        sb.append("**").append(header(intent)).append("** [Data quality: ")
                .append(qualityLabel(dataset.getCompletenessScore())).append("]\n\n");
        sb.append(prose.strip());
        sb.append("\n\n---\n**Data Summary**\n");
        sb.append("- Sources Used: ")
                .append(dataset.getSourcesUsed().isEmpty() ? "none" : String.join(", ", dataset.getSourcesUsed()))
                .append('\n');
        sb.append("- Data Completeness: ")
                .append(String.format(Locale.ROOT, "%.0f%%", dataset.getCompletenessScore()))
                .append('\n');
        sb.append("- Query Intent: ").append(intent.getDisplayName());
        return sb.toString();
    }

    static String header(Intent intent) {
        return switch (intent) {
        case ANALYSIS -> "COMPREHENSIVE ANALYSIS";
        case INFORMATION -> "CRYPTOCURRENCY INFORMATION";
        case MARKET_DATA -> "MARKET ANALYSIS";
        case TECHNICAL -> "TECHNICAL DATA ANALYSIS";
        case COMPARISON -> "COMPARATIVE ANALYSIS";
        default -> "RESEARCH RESULTS";
        };
    }

    static String qualityLabel(double completeness) {
        if (completeness >= 80) {
            return "high";
        }
        if (completeness >= 60) {
            return "good";
        }
        if (completeness >= 40) {
            return "partial";
        }
        return "limited";
    }
}
