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

/**
 * Normalized record extracted from a provider payload. Implementations are
 * immutable value objects; numeric fields keep the provider's precision.
 */
public interface FusedRecord {

    /**
     * Returns the kind of this record, which decides its partition.
     *
     * @return the record type
     */
    RecordType getType();

    /**
     * Returns the provider that produced this record.
     *
     * @return the provider tag, e.g. {@code "coinmarketcap"}
     */
    String getSource();
}
