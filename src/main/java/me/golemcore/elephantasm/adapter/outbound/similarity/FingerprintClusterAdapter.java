package me.golemcore.elephantasm.adapter.outbound.similarity;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.elephantasm.domain.model.Memory;
import me.golemcore.elephantasm.domain.model.MemoryCluster;
import me.golemcore.elephantasm.port.outbound.SimilarityPort;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Groups memories whose normalized summaries hash to the same fingerprint.
 * Memories without a summary are never clustered.
 */
@Component
@Slf4j
public class FingerprintClusterAdapter implements SimilarityPort {

    private static final int FINGERPRINT_BYTES = 12;

    @Override
    public List<MemoryCluster> cluster(List<Memory> memories) {
        if (memories == null || memories.size() < 2) {
            return List.of();
        }
        Map<String, List<String>> byFingerprint = new LinkedHashMap<>();
        for (Memory memory : memories) {
            if (memory == null || memory.getId() == null || memory.isDeleted()) {
                continue;
            }
            String normalized = normalizeForFingerprint(memory.getSummary());
            if (normalized.isEmpty()) {
                continue;
            }
            byFingerprint.computeIfAbsent(computeFingerprint(normalized), key -> new ArrayList<>())
                    .add(memory.getId());
        }

        List<MemoryCluster> clusters = new ArrayList<>();
        for (List<String> ids : byFingerprint.values()) {
            if (ids.size() > 1) {
                clusters.add(new MemoryCluster(ids));
            }
        }
        log.debug("[Similarity] memories={} clusters={}", memories.size(), clusters.size());
        return clusters;
    }

    String computeFingerprint(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(content.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < FINGERPRINT_BYTES && i < hash.length; i++) {
                sb.append(String.format("%02x", hash[i]));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    static String normalizeForFingerprint(String text) {
        if (text == null) {
            return "";
        }
        return text.replace('\r', ' ').replace('\n', ' ').trim()
                .toLowerCase(Locale.ROOT)
                .replaceAll("\\s+", " ");
    }
}
