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

/**
 * Names of the data provider tools. The name doubles as the {@code source} tag
 * of every result a provider returns.
 */
public final class DataProviders {

    public static final String COINMARKETCAP = "coinmarketcap";
    public static final String DUNE_ANALYTICS = "dune_analytics";
    public static final String ETHERSCAN = "etherscan";
    public static final String DEFILLAMA = "defillama";

    /**
     * Ethereum Foundation address used when an analysis needs explorer data but
     * the user gave no address.
     */
    public static final String SAMPLE_ADDRESS = "0xde0B295669a9FD93d5F28D9Ec85E40f4cb697BAe";

    private DataProviders() {
    }
}
