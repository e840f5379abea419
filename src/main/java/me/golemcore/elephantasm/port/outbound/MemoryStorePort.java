package me.golemcore.elephantasm.port.outbound;

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

import me.golemcore.elephantasm.domain.model.Memory;
import me.golemcore.elephantasm.domain.model.MemoryState;
import me.golemcore.elephantasm.domain.model.MemoryUpdate;
import me.golemcore.elephantasm.domain.model.UpdateResult;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Port for Memory persistence. Implementations hand out copies, so callers may
 * not mutate stored state except through {@link #updateMemory}.
 *
 * <p>
 * Failures are reported as
 * {@link me.golemcore.elephantasm.domain.exception.MemoryStoreException}.
 */
public interface MemoryStorePort {

    /**
     * List a spirit's non-deleted memories whose state is in {@code states}, in
     * ascending id order.
     *
     * @param spiritId
     *            owner spirit
     * @param states
     *            accepted states
     * @param afterId
     *            exclusive lower bound on id, or {@code null} to start from the
     *            beginning
     * @param limit
     *            maximum number of memories to return
     */
    List<Memory> listMemories(String spiritId, Set<MemoryState> states, String afterId, int limit);

    /**
     * Get a memory by id, including soft-deleted ones.
     */
    Optional<Memory> getMemory(String id);

    /**
     * Conditionally apply {@code update}: succeeds only if the stored
     * {@code updatedAt} equals {@code expectedUpdatedAt}. The check and the write
     * are atomic.
     *
     * @throws me.golemcore.elephantasm.domain.exception.MemoryValidationException
     *             if the update would put a score outside [0.0, 1.0]
     */
    UpdateResult updateMemory(String id, MemoryUpdate update, Instant expectedUpdatedAt);

    /**
     * Insert a new memory on behalf of the synthesis collaborator.
     */
    Memory createMemory(Memory memory);

    /**
     * Spirits owning at least one non-deleted memory, sorted.
     */
    List<String> listSpiritIds();
}
