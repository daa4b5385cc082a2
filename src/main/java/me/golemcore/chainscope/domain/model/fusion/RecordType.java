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
 * Kind of normalized record the fusion engine extracts from provider payloads.
 * Each kind belongs to exactly one partition of the merged dataset.
 */
public enum RecordType {

    TOKEN_INFO(Partition.PRIMARY),
    MARKET_QUOTE(Partition.PRIMARY),
    DEX_PAIRS(Partition.PRIMARY),
    GLOBAL_METRICS(Partition.SUPPLEMENTARY),
    WALLET_BALANCE(Partition.SUPPLEMENTARY),
    TRANSACTIONS(Partition.SUPPLEMENTARY),
    ANALYTICS(Partition.SUPPLEMENTARY),
    DEFI_OVERVIEW(Partition.SUPPLEMENTARY),
    RAW(Partition.SUPPLEMENTARY);

    /**
     * Primary records identify an entity (token, market, DEX pairs);
     * supplementary records give context around it.
     */
    public enum Partition {
        PRIMARY, SUPPLEMENTARY
    }

    private final Partition partition;

    RecordType(Partition partition) {
        this.partition = partition;
    }

    public Partition getPartition() {
        return partition;
    }

    public boolean isPrimary() {
        return partition == Partition.PRIMARY;
    }
}
