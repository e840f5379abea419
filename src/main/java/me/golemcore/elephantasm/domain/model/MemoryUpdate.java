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
import java.util.Map;

/**
 * Partial update of a memory. {@code null} fields are left unchanged; a non-null
 * {@code meta} replaces the stored map.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MemoryUpdate {

    private MemoryState state;
    private Double importance;
    private Double confidence;
    private Double recencyScore;
    private Double decayScore;
    private Instant decayingSince;
    private String summary;
    private Instant timeStart;
    private Instant timeEnd;
    private Map<String, Object> meta;
    private Boolean deleted;
}
