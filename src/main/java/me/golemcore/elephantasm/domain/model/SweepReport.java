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
 * Result of a lifecycle sweep.
 *
 * <p>
 * {@code transitioned = toDecaying + toArchived}. {@code completed} is false
 * when the sweep stopped early (interrupt or a failed page fetch); in that case
 * {@code lastProcessedId} is the checkpoint to resume from.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SweepReport {

    private String spiritId;
    private int scanned;
    private int transitioned;
    private int toDecaying;
    private int toArchived;
    private int skipped;

    @Builder.Default
    private List<SweepError> errors = new ArrayList<>();

    private String lastProcessedId;
    private boolean completed;

    public int getErrorCount() {
        return errors != null ? errors.size() : 0;
    }

    public static SweepReport empty(String spiritId) {
        return SweepReport.builder()
                .spiritId(spiritId)
                .completed(true)
                .build();
    }
}
