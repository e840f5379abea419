package me.golemcore.elephantasm.domain.model;

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
 * How {@code ScoreEngine} obtains recency/decay for a stored memory.
 */
public enum ScoreMode {
    /** Always recompute from importance, confidence and age. */
    FRESH,
    /**
     * Use the cached {@code recencyScore}/{@code decayScore} when both are present,
     * otherwise recompute. Staleness is the caller's tradeoff.
     */
    CACHED
}
