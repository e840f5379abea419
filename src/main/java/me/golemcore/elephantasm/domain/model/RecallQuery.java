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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parameters for ranking recall candidates.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class RecallQuery {

    private String queryText;

    @Builder.Default
    private RecallWeights weights = RecallWeights.defaults();

    @Builder.Default
    private ScoringPolicy scoringPolicy = ScoringPolicy.defaults();

    @Builder.Default
    private int topK = 10;

    /**
     * Maximum number of results per {@code meta.category}. Categories not listed
     * here, and uncategorized memories, are not capped.
     */
    @Builder.Default
    private Map<String, Integer> perCategoryCap = new LinkedHashMap<>();

    private boolean includeArchived;

    @Builder.Default
    private ScoreMode scoreMode = ScoreMode.FRESH;
}
