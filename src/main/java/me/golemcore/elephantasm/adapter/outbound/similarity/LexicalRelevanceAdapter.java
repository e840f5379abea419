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

import me.golemcore.elephantasm.domain.model.Memory;
import me.golemcore.elephantasm.port.outbound.SemanticRelevancePort;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Token-overlap stand-in for embedding similarity: the share of query tokens
 * found in the memory's summary, topics and tags.
 */
@Component
public class LexicalRelevanceAdapter implements SemanticRelevancePort {

    private static final List<String> SEARCHABLE_META_KEYS = List.of("topics", "tags");
    private static final int MIN_TOKEN_LENGTH = 3;

    @Override
    public double relevance(String query, Memory memory) {
        if (query == null || query.isBlank() || memory == null) {
            return 0.0;
        }
        Set<String> queryTokens = tokenize(query);
        if (queryTokens.isEmpty()) {
            return 0.0;
        }

        Set<String> contentTokens = tokenize(buildSearchableText(memory));
        if (contentTokens.isEmpty()) {
            return 0.0;
        }

        int matches = 0;
        for (String token : queryTokens) {
            if (contentTokens.contains(token)) {
                matches++;
            }
        }
        return (double) matches / queryTokens.size();
    }

    private String buildSearchableText(Memory memory) {
        StringBuilder sb = new StringBuilder();
        if (memory.getSummary() != null) {
            sb.append(memory.getSummary()).append(' ');
        }
        Map<String, Object> meta = memory.getMeta();
        if (meta != null) {
            for (String key : SEARCHABLE_META_KEYS) {
                Object value = meta.get(key);
                if (value instanceof Collection<?> values) {
                    for (Object item : values) {
                        sb.append(item).append(' ');
                    }
                } else if (value != null) {
                    sb.append(value).append(' ');
                }
            }
        }
        return sb.toString();
    }

    private Set<String> tokenize(String text) {
        Set<String> tokens = new LinkedHashSet<>();
        if (text == null || text.isBlank()) {
            return tokens;
        }
        String[] raw = text.toLowerCase(Locale.ROOT).split("[^a-zа-я0-9_./#-]+");
        for (String token : raw) {
            if (token.length() >= MIN_TOKEN_LENGTH) {
                tokens.add(token);
            }
        }
        return tokens;
    }
}
