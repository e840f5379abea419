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
import me.golemcore.elephantasm.domain.model.MergeReport;
import me.golemcore.elephantasm.domain.model.SweepReport;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single-flight guard per spirit. A request for a spirit that is already being
 * curated returns empty immediately instead of waiting.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SweepCoordinator {

    private final LifecycleManager lifecycleManager;
    private final MemoryPolicyService memoryPolicyService;

    private final Set<String> runningSpirits = ConcurrentHashMap.newKeySet();

    public Optional<SweepReport> trySweep(String spiritId, Instant now) {
        requireSpiritId(spiritId);
        if (!runningSpirits.add(spiritId)) {
            log.info("[Sweep] Spirit {} is already being swept, skipping", spiritId);
            return Optional.empty();
        }
        try {
            return Optional.of(lifecycleManager.sweep(spiritId, now, memoryPolicyService.getBatchSize()));
        } finally {
            runningSpirits.remove(spiritId);
        }
    }

    public Optional<MergeReport> tryMerge(String spiritId, Instant now) {
        requireSpiritId(spiritId);
        if (!runningSpirits.add(spiritId)) {
            log.info("[Sweep] Spirit {} is already being curated, skipping merge", spiritId);
            return Optional.empty();
        }
        try {
            return Optional.of(lifecycleManager.mergeNearDuplicates(spiritId, now));
        } finally {
            runningSpirits.remove(spiritId);
        }
    }

    public boolean isRunning(String spiritId) {
        return spiritId != null && runningSpirits.contains(spiritId);
    }

    private static void requireSpiritId(String spiritId) {
        if (spiritId == null || spiritId.isBlank()) {
            throw new MemoryValidationException("spiritId is required");
        }
    }
}
