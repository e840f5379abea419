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
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Stored, scored unit of agent recollection owned by a spirit.
 *
 * <p>
 * Only the scoring-relevant part of the schema lives here. {@code updatedAt} is
 * the optimistic-concurrency token for conditional writes; the persistence
 * adapter advances it on every successful update.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class Memory {

    private String id;
    private String spiritId;
    private String summary;
    private double importance;
    private double confidence;

    @Builder.Default
    private MemoryState state = MemoryState.ACTIVE;

    private Double recencyScore;
    private Double decayScore;
    private Instant timeStart;
    private Instant timeEnd;
    private Instant createdAt;
    private Instant updatedAt;

    /**
     * Reference time of the sweep that moved this memory to DECAYING. A memory is
     * archived only by a later sweep.
     */
    private Instant decayingSince;

    @Builder.Default
    private Map<String, Object> meta = new LinkedHashMap<>();

    private boolean deleted;

    /**
     * Copy safe to hand out of the store: the meta map and every nested map or
     * collection in it are detached from the stored instance.
     */
    public Memory copy() {
        return toBuilder()
                .meta(copyMeta(meta))
                .build();
    }

    /**
     * Deep copy of a meta map. Maps and collections are copied recursively, other
     * values are shared.
     */
    public static Map<String, Object> copyMeta(Map<String, Object> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        if (source != null) {
            source.forEach((key, value) -> copy.put(key, copyValue(value)));
        }
        return copy;
    }

    private static Object copyValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            map.forEach((key, nested) -> copy.put(key, copyValue(nested)));
            return copy;
        }
        if (value instanceof Set<?> set) {
            Set<Object> copy = new LinkedHashSet<>();
            set.forEach(nested -> copy.add(copyValue(nested)));
            return copy;
        }
        if (value instanceof Collection<?> collection) {
            List<Object> copy = new ArrayList<>(collection.size());
            collection.forEach(nested -> copy.add(copyValue(nested)));
            return copy;
        }
        return value;
    }
}
