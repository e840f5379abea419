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
import me.golemcore.elephantasm.domain.exception.MemoryNotFoundException;
import me.golemcore.elephantasm.domain.exception.MemoryValidationException;
import me.golemcore.elephantasm.domain.model.LifecyclePolicy;
import me.golemcore.elephantasm.domain.model.Memory;
import me.golemcore.elephantasm.domain.model.MemoryCluster;
import me.golemcore.elephantasm.domain.model.MemoryScores;
import me.golemcore.elephantasm.domain.model.MemoryState;
import me.golemcore.elephantasm.domain.model.MemoryUpdate;
import me.golemcore.elephantasm.domain.model.MergeReport;
import me.golemcore.elephantasm.domain.model.RestoreResult;
import me.golemcore.elephantasm.domain.model.ScoreMode;
import me.golemcore.elephantasm.domain.model.ScoringPolicy;
import me.golemcore.elephantasm.domain.model.SweepError;
import me.golemcore.elephantasm.domain.model.SweepReport;
import me.golemcore.elephantasm.domain.model.SweepRequest;
import me.golemcore.elephantasm.domain.model.UpdateResult;
import me.golemcore.elephantasm.port.outbound.MemoryStorePort;
import me.golemcore.elephantasm.port.outbound.SimilarityPort;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Drives the memory lifecycle ACTIVE -> DECAYING -> ARCHIVED.
 *
 * <p>
 * A sweep re-scores a spirit's non-archived memories in stable id order, one
 * batch at a time, and moves each memory at most one state forward. Writes are
 * conditional on the {@code updatedAt} token read with the memory:
 * <ul>
 * <li>a conflicting write is counted as skipped and left for the next
 * sweep;</li>
 * <li>a failing memory is recorded in the report and does not stop the
 * sweep;</li>
 * <li>re-running with the same {@code now} transitions nothing.</li>
 * </ul>
 *
 * <p>
 * This is the only component that changes {@link MemoryState}. Besides the
 * sweep it accepts two explicit curation signals: restore (back to ACTIVE) and
 * near-duplicate merge (straight to ARCHIVED).
 *
 * <p>
 * Concurrent sweeps of the same spirit are not prevented here; see
 * {@link SweepCoordinator}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LifecycleManager {

    public static final String MERGED_FROM_META_KEY = "merged_from";

    private static final Set<MemoryState> SWEEPABLE_STATES = EnumSet.of(MemoryState.ACTIVE, MemoryState.DECAYING);

    private final MemoryStorePort memoryStorePort;
    private final ScoreEngine scoreEngine;
    private final SimilarityPort similarityPort;
    private final MemoryPolicyService memoryPolicyService;

    // ==================== SWEEP ====================

    /**
     * Sweep with the configured lifecycle and scoring policies.
     */
    public SweepReport sweep(String spiritId, Instant now, int batchSize) {
        return sweep(SweepRequest.builder()
                .spiritId(spiritId)
                .now(now)
                .batchSize(batchSize)
                .lifecyclePolicy(memoryPolicyService.getLifecyclePolicy())
                .scoringPolicy(memoryPolicyService.getScoringPolicy())
                .build());
    }

    public SweepReport sweep(SweepRequest request) {
        validate(request);
        String spiritId = request.getSpiritId();
        SweepTally tally = new SweepTally(request.getResumeAfterId());
        String cursor = request.getResumeAfterId();

        while (true) {
            if (Thread.currentThread().isInterrupted()) {
                log.info("[Lifecycle] Sweep of spirit {} interrupted after {}", spiritId, tally.lastProcessedId);
                return tally.toReport(spiritId, false);
            }

            List<Memory> batch;
            try {
                batch = memoryStorePort.listMemories(spiritId, SWEEPABLE_STATES, cursor, request.getBatchSize());
            } catch (RuntimeException e) {
                log.warn("[Lifecycle] Failed to fetch batch for spirit {} after {}: {}", spiritId, cursor,
                        e.getMessage());
                tally.errors.add(new SweepError(null, "Batch fetch failed after '" + cursor + "': " + e.getMessage()));
                return tally.toReport(spiritId, false);
            }
            if (batch == null || batch.isEmpty()) {
                break;
            }

            for (Memory memory : batch) {
                evaluate(memory, request, tally);
                if (memory != null && memory.getId() != null) {
                    tally.lastProcessedId = memory.getId();
                }
            }

            if (batch.size() < request.getBatchSize()) {
                break;
            }
            if (!advances(cursor, tally.lastProcessedId)) {
                log.warn("[Lifecycle] Sweep of spirit {} cannot advance past {}", spiritId, cursor);
                tally.errors.add(new SweepError(null, "Store returned a page that does not advance past '"
                        + cursor + "'"));
                return tally.toReport(spiritId, false);
            }
            cursor = tally.lastProcessedId;
        }

        SweepReport report = tally.toReport(spiritId, true);
        log.info("[Lifecycle] Sweep spirit={} scanned={} transitioned={} (decaying={}, archived={}) skipped={} errors={}",
                spiritId, report.getScanned(), report.getTransitioned(), report.getToDecaying(),
                report.getToArchived(), report.getSkipped(), report.getErrorCount());
        return report;
    }

    /**
     * State a memory should move to this sweep: at most one step forward, never
     * backward.
     */
    public MemoryState nextState(MemoryState current, double decayScore, LifecyclePolicy policy) {
        if (current == null) {
            throw new MemoryValidationException("Memory state is required");
        }
        return switch (current) {
        case ACTIVE -> decayScore >= policy.decayingThreshold() ? MemoryState.DECAYING : MemoryState.ACTIVE;
        case DECAYING -> decayScore >= policy.archivedThreshold() ? MemoryState.ARCHIVED : MemoryState.DECAYING;
        case ARCHIVED -> MemoryState.ARCHIVED;
        };
    }

    private void evaluate(Memory memory, SweepRequest request, SweepTally tally) {
        tally.scanned++;
        String memoryId = memory != null ? memory.getId() : null;
        try {
            if (memory == null || memoryId == null) {
                throw new MemoryValidationException("Store returned a memory without id");
            }
            MemoryScores scores = scoreEngine.score(memory, request.getNow(), request.getScoringPolicy(),
                    ScoreMode.FRESH);
            MemoryState current = memory.getState();
            MemoryState target = nextState(current, scores.decayScore(), request.getLifecyclePolicy());
            if (target == MemoryState.ARCHIVED && !decayedBefore(memory, request.getNow())) {
                target = current;
            }
            if (target == current) {
                return;
            }

            MemoryUpdate update = MemoryUpdate.builder()
                    .state(target)
                    .recencyScore(scores.recencyScore())
                    .decayScore(scores.decayScore())
                    .decayingSince(target == MemoryState.DECAYING ? request.getNow() : null)
                    .build();
            UpdateResult result = memoryStorePort.updateMemory(memoryId, update, memory.getUpdatedAt());
            switch (result) {
            case UPDATED -> {
                tally.recordTransition(target);
                log.debug("[Lifecycle] {} {} -> {} (decay={})", memoryId, current, target, scores.decayScore());
            }
            case CONFLICT, NOT_FOUND -> {
                tally.skipped++;
                log.debug("[Lifecycle] Skipped {}: {}", memoryId, result);
            }
            }
        } catch (RuntimeException e) {
            log.warn("[Lifecycle] Failed to evaluate memory {}: {}", memoryId, e.getMessage());
            tally.errors.add(new SweepError(memoryId, e.getMessage()));
        }
    }

    private static boolean advances(String cursor, String next) {
        return next != null && (cursor == null || next.compareTo(cursor) > 0);
    }

    /**
     * A memory that entered DECAYING at this same reference time stays there until
     * a later sweep, so re-running a sweep never archives what it just demoted.
     */
    private boolean decayedBefore(Memory memory, Instant now) {
        Instant decayingSince = memory.getDecayingSince();
        return decayingSince == null || decayingSince.isBefore(now);
    }

    private void validate(SweepRequest request) {
        if (request == null) {
            throw new MemoryValidationException("Sweep request is required");
        }
        if (request.getSpiritId() == null || request.getSpiritId().isBlank()) {
            throw new MemoryValidationException("spiritId is required");
        }
        if (request.getNow() == null) {
            throw new MemoryValidationException("Reference time 'now' is required");
        }
        if (request.getBatchSize() <= 0) {
            throw new MemoryValidationException("batchSize must be positive, got " + request.getBatchSize());
        }
        if (request.getLifecyclePolicy() == null || request.getScoringPolicy() == null) {
            throw new MemoryValidationException("Lifecycle and scoring policies are required");
        }
    }

    // ==================== RESTORE ====================

    /**
     * Move a memory back to ACTIVE. Restoring an ACTIVE memory is a no-op. The
     * memory keeps its age, so an old memory may decay again on the next sweep;
     * use {@link #reinforce} to reset the age as well.
     *
     * @throws MemoryNotFoundException
     *             if the memory does not exist or is soft-deleted
     */
    public RestoreResult restore(String memoryId, Instant now) {
        Memory memory = memoryStorePort.getMemory(memoryId)
                .filter(found -> !found.isDeleted())
                .orElseThrow(() -> new MemoryNotFoundException(memoryId));
        if (memory.getState() == MemoryState.ACTIVE) {
            return RestoreResult.ALREADY_ACTIVE;
        }

        MemoryScores scores = scoreEngine.score(memory, now, memoryPolicyService.getScoringPolicy(),
                ScoreMode.FRESH);
        MemoryUpdate update = MemoryUpdate.builder()
                .state(MemoryState.ACTIVE)
                .recencyScore(scores.recencyScore())
                .decayScore(scores.decayScore())
                .build();
        UpdateResult result = memoryStorePort.updateMemory(memoryId, update, memory.getUpdatedAt());
        return switch (result) {
        case UPDATED -> {
            log.info("[Lifecycle] Restored {} from {} to ACTIVE", memoryId, memory.getState());
            yield RestoreResult.RESTORED;
        }
        case CONFLICT -> RestoreResult.CONFLICT;
        case NOT_FOUND -> throw new MemoryNotFoundException(memoryId);
        };
    }

    /**
     * Explicit reinforcement: move the memory to ACTIVE and reset its effective
     * age by setting {@code timeEnd = now}. Unlike {@link #restore}, this also
     * applies to ACTIVE memories and keeps the memory out of the next sweeps.
     *
     * @return {@link RestoreResult#RESTORED} when written,
     *         {@link RestoreResult#CONFLICT} when the memory changed concurrently
     * @throws MemoryNotFoundException
     *             if the memory does not exist or is soft-deleted
     */
    public RestoreResult reinforce(String memoryId, Instant now) {
        if (now == null) {
            throw new MemoryValidationException("Reference time 'now' is required");
        }
        Memory memory = memoryStorePort.getMemory(memoryId)
                .filter(found -> !found.isDeleted())
                .orElseThrow(() -> new MemoryNotFoundException(memoryId));

        Memory reinforced = memory.toBuilder().timeEnd(now).build();
        MemoryScores scores = scoreEngine.score(reinforced, now, memoryPolicyService.getScoringPolicy(),
                ScoreMode.FRESH);
        MemoryUpdate update = MemoryUpdate.builder()
                .state(MemoryState.ACTIVE)
                .timeEnd(now)
                .timeStart(memory.getTimeStart() != null && memory.getTimeStart().isAfter(now) ? now : null)
                .recencyScore(scores.recencyScore())
                .decayScore(scores.decayScore())
                .build();
        UpdateResult result = memoryStorePort.updateMemory(memoryId, update, memory.getUpdatedAt());
        return switch (result) {
        case UPDATED -> {
            log.info("[Lifecycle] Reinforced {} ({} -> ACTIVE)", memoryId, memory.getState());
            yield RestoreResult.RESTORED;
        }
        case CONFLICT -> RestoreResult.CONFLICT;
        case NOT_FOUND -> throw new MemoryNotFoundException(memoryId);
        };
    }

    // ==================== MERGE ====================

    /**
     * Fetch a spirit's non-archived memories, cluster them through
     * {@link SimilarityPort} and merge the clusters.
     */
    public MergeReport mergeNearDuplicates(String spiritId, Instant now) {
        List<Memory> memories = new ArrayList<>();
        int batchSize = memoryPolicyService.getBatchSize();
        String cursor = null;
        while (true) {
            List<Memory> batch = memoryStorePort.listMemories(spiritId, SWEEPABLE_STATES, cursor, batchSize);
            if (batch == null || batch.isEmpty()) {
                break;
            }
            memories.addAll(batch);
            String next = batch.get(batch.size() - 1).getId();
            if (batch.size() < batchSize || !advances(cursor, next)) {
                break;
            }
            cursor = next;
        }
        if (memories.size() < 2) {
            return MergeReport.empty();
        }
        return merge(similarityPort.cluster(memories), now);
    }

    /**
     * Merge each cluster into its highest-importance member. Members that are not
     * ARCHIVED are preferred as survivor, so a live cluster never loses all of its
     * live members. The other members go straight to ARCHIVED and their ids are
     * appended to the survivor's {@code meta.merged_from}.
     *
     * <p>
     * The survivor's provenance is written first; if that write conflicts the
     * whole cluster is skipped so no member is archived without a record.
     */
    public MergeReport merge(List<MemoryCluster> clusters, Instant now) {
        MergeReport report = MergeReport.empty();
        if (clusters == null || clusters.isEmpty()) {
            return report;
        }
        ScoringPolicy scoringPolicy = memoryPolicyService.getScoringPolicy();

        for (MemoryCluster cluster : clusters) {
            try {
                mergeCluster(cluster, now, scoringPolicy, report);
            } catch (RuntimeException e) {
                log.warn("[Lifecycle] Failed to merge cluster {}: {}", cluster, e.getMessage());
                report.getErrors().add(new SweepError(null, "Cluster merge failed: " + e.getMessage()));
            }
        }
        log.info("[Lifecycle] Merge clusters={} merged={} archived={} skipped={} errors={}",
                clusters.size(), report.getMerged(), report.getArchived(), report.getSkipped(),
                report.getErrors().size());
        return report;
    }

    private void mergeCluster(MemoryCluster cluster, Instant now, ScoringPolicy scoringPolicy,
            MergeReport report) {
        List<Memory> members = resolveMembers(cluster != null ? cluster.memoryIds() : List.of());
        if (members.size() < 2) {
            report.setSkipped(report.getSkipped() + 1);
            return;
        }

        Memory survivor = members.stream()
                .min(Comparator.comparing((Memory member) -> member.getState() == MemoryState.ARCHIVED)
                        .thenComparing(Comparator.comparingDouble(Memory::getImportance).reversed())
                        .thenComparing(Comparator.comparingDouble(Memory::getConfidence).reversed())
                        .thenComparing(Memory::getId))
                .orElseThrow();
        List<Memory> redundant = members.stream()
                .filter(member -> !member.getId().equals(survivor.getId()))
                .toList();

        Map<String, Object> meta = survivor.getMeta() != null
                ? new LinkedHashMap<>(survivor.getMeta())
                : new LinkedHashMap<>();
        meta.put(MERGED_FROM_META_KEY, mergeProvenance(meta.get(MERGED_FROM_META_KEY), redundant));
        UpdateResult survivorResult = memoryStorePort.updateMemory(survivor.getId(),
                MemoryUpdate.builder().meta(meta).build(), survivor.getUpdatedAt());
        if (survivorResult != UpdateResult.UPDATED) {
            log.debug("[Lifecycle] Skipped cluster with survivor {}: {}", survivor.getId(), survivorResult);
            report.setSkipped(report.getSkipped() + 1);
            return;
        }
        report.setMerged(report.getMerged() + 1);
        report.getSurvivorIds().add(survivor.getId());

        for (Memory member : redundant) {
            archiveMerged(member, now, scoringPolicy, report);
        }
    }

    private void archiveMerged(Memory member, Instant now, ScoringPolicy scoringPolicy, MergeReport report) {
        if (member.getState() == MemoryState.ARCHIVED) {
            return;
        }
        try {
            MemoryScores scores = scoreEngine.score(member, now, scoringPolicy, ScoreMode.FRESH);
            MemoryUpdate update = MemoryUpdate.builder()
                    .state(MemoryState.ARCHIVED)
                    .recencyScore(scores.recencyScore())
                    .decayScore(scores.decayScore())
                    .build();
            UpdateResult result = memoryStorePort.updateMemory(member.getId(), update, member.getUpdatedAt());
            if (result == UpdateResult.UPDATED) {
                report.setArchived(report.getArchived() + 1);
            } else {
                report.setSkipped(report.getSkipped() + 1);
            }
        } catch (RuntimeException e) {
            log.warn("[Lifecycle] Failed to archive merged memory {}: {}", member.getId(), e.getMessage());
            report.getErrors().add(new SweepError(member.getId(), e.getMessage()));
        }
    }

    private List<Memory> resolveMembers(List<String> memoryIds) {
        Map<String, Memory> members = new LinkedHashMap<>();
        for (String memoryId : memoryIds) {
            if (memoryId == null || members.containsKey(memoryId)) {
                continue;
            }
            Optional<Memory> memory = memoryStorePort.getMemory(memoryId);
            if (memory.isPresent() && !memory.get().isDeleted()) {
                members.put(memoryId, memory.get());
            }
        }
        return new ArrayList<>(members.values());
    }

    private List<String> mergeProvenance(Object existing, List<Memory> redundant) {
        Set<String> ids = new LinkedHashSet<>();
        if (existing instanceof Collection<?> previous) {
            for (Object id : previous) {
                if (id != null) {
                    ids.add(id.toString());
                }
            }
        }
        for (Memory member : redundant) {
            ids.add(member.getId());
        }
        return new ArrayList<>(ids);
    }

    private static final class SweepTally {

        private final List<SweepError> errors = new ArrayList<>();
        private int scanned;
        private int toDecaying;
        private int toArchived;
        private int skipped;
        private String lastProcessedId;

        private SweepTally(String resumeAfterId) {
            this.lastProcessedId = resumeAfterId;
        }

        private void recordTransition(MemoryState target) {
            if (target == MemoryState.DECAYING) {
                toDecaying++;
            } else if (target == MemoryState.ARCHIVED) {
                toArchived++;
            }
        }

        private SweepReport toReport(String spiritId, boolean completed) {
            return SweepReport.builder()
                    .spiritId(spiritId)
                    .scanned(scanned)
                    .transitioned(toDecaying + toArchived)
                    .toDecaying(toDecaying)
                    .toArchived(toArchived)
                    .skipped(skipped)
                    .errors(new ArrayList<>(errors))
                    .lastProcessedId(lastProcessedId)
                    .completed(completed)
                    .build();
        }
    }
}
