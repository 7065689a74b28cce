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
import me.golemcore.brain.domain.model.BrainStatus;
import me.golemcore.brain.domain.model.TrackingLedger;
import me.golemcore.brain.port.outbound.EmbeddingPort;
import me.golemcore.brain.port.outbound.VectorStorePort;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Builds a status snapshot. Point counts are queried per collection; an
 * unreachable collection reports {@code -1}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BrainStatusService {

    private final TieredMemoryStore tieredMemoryStore;
    private final VectorStorePort vectorStorePort;
    private final EmbeddingPort embeddingPort;
    private final BrainConfigService configService;

    public BrainStatus status(TrackingLedger ledger) {
        Map<String, Long> points = new LinkedHashMap<>();
        for (String collection : configService.getConfig().getCollections().keySet()) {
            try {
                points.put(collection, vectorStorePort.getCollectionStats(collection)
                        .orTimeout(configService.getVectorTimeoutSeconds(), TimeUnit.SECONDS)
                        .join());
            } catch (RuntimeException e) {
                log.debug("[Status] Collection {} unavailable: {}", collection, e.getMessage());
                points.put(collection, -1L);
            }
        }
        return BrainStatus.builder()
                .dailyFiles(tieredMemoryStore.listDailyFileNames().size())
                .weeklySummaries(tieredMemoryStore.countWeeklySummaries())
                .pendingEntities(ledger.getQuarantine().size())
                .validatedEntities(ledger.getValidatedEntities().size())
                .collectionPoints(points)
                .lastConsolidation(ledger.getLastConsolidation())
                .embeddingModel(embeddingPort.getModel())
                .embeddingAvailable(embeddingPort.isAvailable())
                .build();
    }
}
