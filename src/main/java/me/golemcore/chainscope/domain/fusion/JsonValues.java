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

import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Lenient readers for provider JSON. Missing, null and unparsable values read
 * as {@code null}; numbers keep their exact decimal representation.
 */
final class JsonValues {

    private JsonValues() {
    }

    static BigDecimal decimal(JsonNode parent, String field) {
        return parent == null ? null : decimal(parent.get(field));
    }

    static BigDecimal decimal(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return node.decimalValue();
        }
        if (node.isTextual()) {
            return parseDecimal(node.asText());
        }
        return null;
    }

    static BigDecimal parseDecimal(String text) {
        if (text == null) {
            return null;
        }
        String cleaned = text.replace(",", "").trim();
        if (cleaned.isEmpty()) {
            return null;
        }
        try {
            return new BigDecimal(cleaned);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static BigDecimal decimalOrZero(JsonNode parent, String field) {
        BigDecimal value = decimal(parent, field);
        return value != null ? value : BigDecimal.ZERO;
    }

    static Integer integer(JsonNode parent, String field) {
        BigDecimal value = decimal(parent, field);
        return value != null ? value.intValue() : null;
    }

    static Long longValue(JsonNode parent, String field) {
        BigDecimal value = decimal(parent, field);
        return value != null ? value.longValue() : null;
    }

    static String text(JsonNode parent, String field) {
        if (parent == null) {
            return null;
        }
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        return node.isValueNode() ? node.asText() : node.toString();
    }

    static List<String> textList(JsonNode parent, String field) {
        JsonNode node = parent == null ? null : parent.get(field);
        if (node == null || !node.isArray()) {
            return List.of();
        }
        List<String> values = new ArrayList<>();
        node.forEach(item -> {
            if (!item.isNull()) {
                values.add(item.asText());
            }
        });
        return Collections.unmodifiableList(values);
    }

    static List<JsonNode> head(JsonNode array, int limit) {
        if (array == null || !array.isArray()) {
            return List.of();
        }
        List<JsonNode> items = new ArrayList<>();
        for (JsonNode item : array) {
            if (items.size() >= limit) {
                break;
            }
            items.add(item);
        }
        return Collections.unmodifiableList(items);
    }

    static List<JsonNode> all(JsonNode array) {
        return head(array, Integer.MAX_VALUE);
    }

    static JsonNode path(JsonNode node, String... fields) {
        JsonNode current = node;
        for (String field : fields) {
            if (current == null) {
                return null;
            }
            current = current.get(field);
        }
        return current;
    }
}
