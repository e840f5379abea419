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

import java.time.Instant;

/**
 * One lifecycle sweep over a spirit's memories.
 *
 * <p>
 * {@code resumeAfterId} is an optional checkpoint: the sweep starts after that
 * id in stable id order. Pass {@link SweepReport#getLastProcessedId()} of an
 * interrupted sweep to continue it.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SweepRequest {

    private String spiritId;
    private Instant now;

    @Builder.Default
    private int batchSize = 100;

    private String resumeAfterId;

    @Builder.Default
    private LifecyclePolicy lifecyclePolicy = LifecyclePolicy.defaults();

    @Builder.Default
    private ScoringPolicy scoringPolicy = ScoringPolicy.defaults();
}
