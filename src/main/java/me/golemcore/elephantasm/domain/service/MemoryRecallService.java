package me.golemcore.elephantasm.domain.service;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.elephantasm.domain.exception.MemoryValidationException;
import me.golemcore.elephantasm.domain.model.Memory;
import me.golemcore.elephantasm.domain.model.MemoryState;
import me.golemcore.elephantasm.domain.model.RankedMemory;
import me.golemcore.elephantasm.domain.model.RecallCandidate;
import me.golemcore.elephantasm.domain.model.RecallQuery;
import me.golemcore.elephantasm.port.outbound.MemoryStorePort;
import me.golemcore.elephantasm.port.outbound.SemanticRelevancePort;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Retrieval path: loads a spirit's memories, attaches semantic relevance and
 * hands the candidates to {@link RecallRanker}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MemoryRecallService {

    private final MemoryStorePort memoryStorePort;
    private final SemanticRelevancePort semanticRelevancePort;
    private final RecallRanker recallRanker;
    private final MemoryPolicyService memoryPolicyService;

    public List<RankedMemory> recall(String spiritId, String queryText, Instant now) {
        RecallQuery query = memoryPolicyService.getDefaultRecallQuery().toBuilder()
                .queryText(queryText)
                .build();
        return recall(spiritId, query, now);
    }

    public List<RankedMemory> recall(String spiritId, RecallQuery query, Instant now) {
        if (spiritId == null || spiritId.isBlank()) {
            throw new MemoryValidationException("spiritId is required");
        }
        if (query == null) {
            throw new MemoryValidationException("Recall query is required");
        }
        if (query.getTopK() == 0) {
            return List.of();
        }

        List<Memory> memories = loadMemories(spiritId, query.isIncludeArchived());
        List<RecallCandidate> candidates = new ArrayList<>(memories.size());
        for (Memory memory : memories) {
            try {
                double relevance = semanticRelevancePort.relevance(query.getQueryText(), memory);
                candidates.add(new RecallCandidate(memory, relevance));
            } catch (RuntimeException e) {
                log.warn("[Recall] Relevance lookup failed for {}: {}", memory.getId(), e.getMessage());
            }
        }

        List<RankedMemory> ranked = recallRanker.rank(candidates, query, now);
        log.debug("[Recall] spirit={} memories={} candidates={} ranked={}",
                spiritId, memories.size(), candidates.size(), ranked.size());
        return ranked;
    }

    private List<Memory> loadMemories(String spiritId, boolean includeArchived) {
        Set<MemoryState> states = includeArchived
                ? EnumSet.allOf(MemoryState.class)
                : EnumSet.of(MemoryState.ACTIVE, MemoryState.DECAYING);
        int pageSize = memoryPolicyService.getBatchSize();
        List<Memory> memories = new ArrayList<>();
        String cursor = null;
        while (true) {
            List<Memory> page = memoryStorePort.listMemories(spiritId, states, cursor, pageSize);
            if (page == null || page.isEmpty()) {
                break;
            }
            memories.addAll(page);
            String next = page.get(page.size() - 1).getId();
            if (page.size() < pageSize || next == null || (cursor != null && next.compareTo(cursor) <= 0)) {
                break;
            }
            cursor = next;
        }
        return memories;
    }
}
