package me.golemcore.elephantasm.adapter.outbound.storage;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.elephantasm.domain.exception.MemoryStoreException;
import me.golemcore.elephantasm.domain.exception.MemoryValidationException;
import me.golemcore.elephantasm.domain.model.Memory;
import me.golemcore.elephantasm.domain.model.MemoryState;
import me.golemcore.elephantasm.domain.model.MemoryUpdate;
import me.golemcore.elephantasm.domain.model.UpdateResult;
import me.golemcore.elephantasm.domain.service.MemoryValidation;
import me.golemcore.elephantasm.infrastructure.config.ElephantasmProperties;
import me.golemcore.elephantasm.port.outbound.MemoryStorePort;
import me.golemcore.elephantasm.port.outbound.StoragePort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.CompletionException;
import java.util.regex.Pattern;

/**
 * File-backed {@link MemoryStorePort}.
 *
 * <p>
 * Each spirit's memories are kept in one JSON array,
 * {@code <directory>/<spiritId>.json}, loaded into memory at startup and
 * rewritten atomically through {@link StoragePort#putTextAtomic} on every
 * write. Writes are serialized on this adapter; reads see the last committed
 * state.
 *
 * <p>
 * {@code updatedAt} is advanced strictly on every successful write, even when
 * the clock has not moved, so conditional updates behave as compare-and-set.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalMemoryStoreAdapter implements MemoryStorePort {

    private static final String JSON_EXTENSION = ".json";
    private static final Pattern SPIRIT_ID_PATTERN = Pattern.compile("[A-Za-z0-9._-]+");
    private static final TypeReference<List<Memory>> MEMORY_LIST_TYPE = new TypeReference<>() {
    };

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final ElephantasmProperties properties;
    private final Clock clock;

    private final Map<String, NavigableMap<String, Memory>> memoriesBySpirit = new TreeMap<>();
    private final Map<String, String> spiritByMemoryId = new LinkedHashMap<>();

    @PostConstruct
    public synchronized void init() {
        String directory = directory();
        try {
            storagePort.ensureDirectory(directory).join();
            List<String> files = storagePort.listObjects(directory, "").join();
            int loaded = 0;
            for (String file : files) {
                if (!file.endsWith(JSON_EXTENSION) || file.contains("/") || file.contains("\\")) {
                    continue;
                }
                loaded += loadSpiritFile(directory, file);
            }
            log.info("[MemoryStore] Loaded {} memories for {} spirits", loaded, memoriesBySpirit.size());
        } catch (CompletionException e) {
            throw new MemoryStoreException("Failed to load memories from " + directory, unwrap(e));
        }
    }

    @Override
    public synchronized List<Memory> listMemories(String spiritId, Set<MemoryState> states, String afterId,
            int limit) {
        if (limit <= 0) {
            throw new MemoryValidationException("limit must be positive, got " + limit);
        }
        NavigableMap<String, Memory> memories = memoriesBySpirit.get(spiritId);
        if (memories == null || states == null || states.isEmpty()) {
            return List.of();
        }
        NavigableMap<String, Memory> page = afterId != null ? memories.tailMap(afterId, false) : memories;
        List<Memory> result = new ArrayList<>();
        for (Memory memory : page.values()) {
            if (memory.isDeleted() || !states.contains(memory.getState())) {
                continue;
            }
            result.add(memory.copy());
            if (result.size() >= limit) {
                break;
            }
        }
        return result;
    }

    @Override
    public synchronized Optional<Memory> getMemory(String id) {
        return findStored(id).map(Memory::copy);
    }

    @Override
    public synchronized UpdateResult updateMemory(String id, MemoryUpdate update, Instant expectedUpdatedAt) {
        MemoryValidation.validateUpdate(update);
        Optional<Memory> found = findStored(id);
        if (found.isEmpty()) {
            return UpdateResult.NOT_FOUND;
        }
        Memory stored = found.get();
        if (!Objects.equals(stored.getUpdatedAt(), expectedUpdatedAt)) {
            log.debug("[MemoryStore] Conflict on {}: expected {}, stored {}", id, expectedUpdatedAt,
                    stored.getUpdatedAt());
            return UpdateResult.CONFLICT;
        }

        Memory updated = apply(stored.copy(), update);
        updated.setUpdatedAt(nextUpdatedAt(stored.getUpdatedAt()));
        NavigableMap<String, Memory> spiritMemories = memoriesBySpirit.get(stored.getSpiritId());
        spiritMemories.put(id, updated);
        try {
            persist(stored.getSpiritId());
        } catch (MemoryStoreException e) {
            spiritMemories.put(id, stored);
            throw e;
        }
        return UpdateResult.UPDATED;
    }

    @Override
    public synchronized Memory createMemory(Memory memory) {
        MemoryValidation.validateNew(memory);
        String spiritId = requireSpiritId(memory.getSpiritId());
        Memory created = memory.copy();
        if (created.getId() == null || created.getId().isBlank()) {
            created.setId(UUID.randomUUID().toString());
        }
        if (spiritByMemoryId.containsKey(created.getId())) {
            throw new MemoryValidationException("Memory already exists: " + created.getId());
        }
        Instant now = clock.instant();
        if (created.getState() == null) {
            created.setState(MemoryState.ACTIVE);
        }
        if (created.getCreatedAt() == null) {
            created.setCreatedAt(now);
        }
        created.setUpdatedAt(now);

        NavigableMap<String, Memory> spiritMemories = memoriesBySpirit.computeIfAbsent(spiritId,
                key -> new TreeMap<>());
        spiritMemories.put(created.getId(), created);
        spiritByMemoryId.put(created.getId(), spiritId);
        try {
            persist(spiritId);
        } catch (MemoryStoreException e) {
            spiritMemories.remove(created.getId());
            spiritByMemoryId.remove(created.getId());
            if (spiritMemories.isEmpty()) {
                memoriesBySpirit.remove(spiritId);
            }
            throw e;
        }
        log.debug("[MemoryStore] Created {} for spirit {}", created.getId(), spiritId);
        return created.copy();
    }

    @Override
    public synchronized List<String> listSpiritIds() {
        List<String> spiritIds = new ArrayList<>();
        for (Map.Entry<String, NavigableMap<String, Memory>> entry : memoriesBySpirit.entrySet()) {
            boolean hasLiveMemory = entry.getValue().values().stream().anyMatch(memory -> !memory.isDeleted());
            if (hasLiveMemory) {
                spiritIds.add(entry.getKey());
            }
        }
        return spiritIds;
    }

    private int loadSpiritFile(String directory, String file) {
        String content = storagePort.getText(directory, file).join();
        if (content == null || content.isBlank()) {
            return 0;
        }
        List<Memory> memories;
        try {
            memories = objectMapper.readValue(content, MEMORY_LIST_TYPE);
        } catch (JsonProcessingException e) {
            throw new MemoryStoreException("Corrupted memory file: " + directory + "/" + file, e);
        }
        String spiritId = file.substring(0, file.length() - JSON_EXTENSION.length());
        NavigableMap<String, Memory> spiritMemories = memoriesBySpirit.computeIfAbsent(spiritId,
                key -> new TreeMap<>());
        int loaded = 0;
        for (Memory memory : memories) {
            if (memory == null || memory.getId() == null) {
                log.warn("[MemoryStore] Skipping memory without id in {}", file);
                continue;
            }
            memory.setSpiritId(spiritId);
            if (memory.getMeta() == null) {
                memory.setMeta(new LinkedHashMap<>());
            }
            spiritMemories.put(memory.getId(), memory);
            spiritByMemoryId.put(memory.getId(), spiritId);
            loaded++;
        }
        return loaded;
    }

    private void persist(String spiritId) {
        NavigableMap<String, Memory> memories = memoriesBySpirit.getOrDefault(spiritId, new TreeMap<>());
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValueAsString(new ArrayList<>(memories.values()));
            storagePort.putTextAtomic(directory(), spiritId + JSON_EXTENSION, json, true).join();
        } catch (JsonProcessingException e) {
            throw new MemoryStoreException("Failed to serialize memories of spirit " + spiritId, e);
        } catch (CompletionException e) {
            throw new MemoryStoreException("Failed to persist memories of spirit " + spiritId, unwrap(e));
        }
    }

    private Memory apply(Memory memory, MemoryUpdate update) {
        if (update.getState() != null) {
            memory.setState(update.getState());
        }
        if (update.getImportance() != null) {
            memory.setImportance(update.getImportance());
        }
        if (update.getConfidence() != null) {
            memory.setConfidence(update.getConfidence());
        }
        if (update.getRecencyScore() != null) {
            memory.setRecencyScore(update.getRecencyScore());
        }
        if (update.getDecayScore() != null) {
            memory.setDecayScore(update.getDecayScore());
        }
        if (update.getDecayingSince() != null) {
            memory.setDecayingSince(update.getDecayingSince());
        }
        if (update.getSummary() != null) {
            memory.setSummary(update.getSummary());
        }
        if (update.getTimeStart() != null) {
            memory.setTimeStart(update.getTimeStart());
        }
        if (update.getTimeEnd() != null) {
            memory.setTimeEnd(update.getTimeEnd());
        }
        if (update.getMeta() != null) {
            memory.setMeta(Memory.copyMeta(update.getMeta()));
        }
        if (update.getDeleted() != null) {
            memory.setDeleted(update.getDeleted());
        }
        return memory;
    }

    private Instant nextUpdatedAt(Instant previous) {
        Instant now = clock.instant();
        if (previous != null && !now.isAfter(previous)) {
            return previous.plusNanos(1);
        }
        return now;
    }

    private Optional<Memory> findStored(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String spiritId = spiritByMemoryId.get(id);
        if (spiritId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(memoriesBySpirit.get(spiritId)).map(memories -> memories.get(id));
    }

    private String requireSpiritId(String spiritId) {
        if (!SPIRIT_ID_PATTERN.matcher(spiritId).matches()) {
            throw new MemoryValidationException("Unsupported spiritId: " + spiritId);
        }
        return spiritId;
    }

    private String directory() {
        return properties.getStorage().getDirectory();
    }

    private static Throwable unwrap(CompletionException e) {
        return e.getCause() != null ? e.getCause() : e;
    }
}
