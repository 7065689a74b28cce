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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.brain.domain.component.VectorRetrievalStrategy;
import me.golemcore.brain.domain.model.ResultSource;
import me.golemcore.brain.domain.model.VectorBackendUnavailableException;
import me.golemcore.brain.domain.model.VectorHit;
import me.golemcore.brain.port.outbound.EmbeddingPort;
import me.golemcore.brain.port.outbound.VectorStorePort;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Semantic tier: embed the query once and search every configured collection
 * in parallel, each call bounded by the configured vector timeout. A failing
 * collection is skipped; only an embedding failure or the failure of every
 * collection makes the tier unavailable.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SemanticVectorStrategy implements VectorRetrievalStrategy {

    private static final int CONTENT_PREVIEW = 200;

    private final EmbeddingPort embeddingPort;
    private final VectorStorePort vectorStorePort;
    private final BrainConfigService configService;

    @Override
    public String getComponentType() {
        return "semantic";
    }

    @Override
    public ResultSource source() {
        return ResultSource.VECTORS;
    }

    @Override
    public List<VectorHit> search(String text, int limit) {
        int timeoutSeconds = configService.getVectorTimeoutSeconds();
        float[] vector;
        try {
            vector = embeddingPort.embed(text).orTimeout(timeoutSeconds, TimeUnit.SECONDS).join();
        } catch (RuntimeException e) {
            throw new VectorBackendUnavailableException("Embedding failed: " + rootMessage(e), e);
        }

        Map<String, CompletableFuture<List<VectorStorePort.ScoredPayload>>> pending = new LinkedHashMap<>();
        for (String collection : configService.getConfig().getCollections().keySet()) {
            CompletableFuture<List<VectorStorePort.ScoredPayload>> future;
            try {
                future = vectorStorePort.querySimilar(collection, vector, limit);
            } catch (RuntimeException e) {
                future = CompletableFuture.failedFuture(e);
            }
            pending.put(collection, future.orTimeout(timeoutSeconds, TimeUnit.SECONDS));
        }

        List<VectorHit> hits = new ArrayList<>();
        int failed = 0;
        for (Map.Entry<String, CompletableFuture<List<VectorStorePort.ScoredPayload>>> entry : pending.entrySet()) {
            try {
                for (VectorStorePort.ScoredPayload scored : entry.getValue().join()) {
                    if (scored.score() <= VectorHit.LEXICAL_SCORE) {
                        continue;
                    }
                    String content = scored.payload() != null && scored.payload().getContent() != null
                            ? scored.payload().getContent()
                            : "";
                    hits.add(VectorHit.builder()
                            .collection(entry.getKey())
                            .content(content.length() > CONTENT_PREVIEW ? content.substring(0, CONTENT_PREVIEW)
                                    : content)
                            .score(scored.score())
                            .sourceFile(scored.payload() != null ? scored.payload().getSourceFile() : null)
                            .build());
                }
            } catch (RuntimeException e) {
                failed++;
                log.debug("[Retrieval] Collection {} failed: {}", entry.getKey(), rootMessage(e));
            }
        }
        if (!pending.isEmpty() && failed == pending.size()) {
            throw new VectorBackendUnavailableException("All " + failed + " collections failed");
        }
        if (failed > 0) {
            log.warn("[Retrieval] {} of {} collections failed, returning partial results", failed, pending.size());
        }

        hits.sort(Comparator.comparingDouble(VectorHit::getScore).reversed());
        return hits.size() > limit ? new ArrayList<>(hits.subList(0, limit)) : hits;
    }

    private static String rootMessage(Throwable e) {
        Throwable current = e;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current.getMessage() != null ? current.getMessage() : current.getClass().getSimpleName();
    }
}
