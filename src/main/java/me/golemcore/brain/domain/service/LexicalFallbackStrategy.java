package me.golemcore.brain.domain.service;

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
import me.golemcore.brain.domain.component.VectorRetrievalStrategy;
import me.golemcore.brain.domain.model.ResultSource;
import me.golemcore.brain.domain.model.VectorHit;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Degraded tier: line search over the daily files. Hits carry the fixed
 * {@link VectorHit#LEXICAL_SCORE} so callers can tell them from semantic
 * matches. The limit is not applied; the per-file cap bounds the result.
 */
@Component
@RequiredArgsConstructor
public class LexicalFallbackStrategy implements VectorRetrievalStrategy {

    private final TieredMemoryStore tieredMemoryStore;

    @Override
    public String getComponentType() {
        return "lexical";
    }

    @Override
    public ResultSource source() {
        return ResultSource.FILES;
    }

    @Override
    public List<VectorHit> search(String text, int limit) {
        return tieredMemoryStore.lexicalSearch(text);
    }
}
