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

import java.util.ArrayList;
import java.util.List;

/**
 * Result of merging near-duplicate clusters.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MergeReport {

    /** Clusters that had a survivor written. */
    private int merged;
    /** Members moved to ARCHIVED. */
    private int archived;
    /** Clusters or members skipped (too small, missing, or concurrent write). */
    private int skipped;

    @Builder.Default
    private List<SweepError> errors = new ArrayList<>();

    @Builder.Default
    private List<String> survivorIds = new ArrayList<>();

    public static MergeReport empty() {
        return MergeReport.builder().build();
    }
}
