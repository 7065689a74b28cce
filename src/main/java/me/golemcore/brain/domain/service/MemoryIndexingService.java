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
import me.golemcore.brain.domain.model.BrainConfig;
import me.golemcore.brain.domain.model.IndexingSummary;
import me.golemcore.brain.domain.model.VectorPayload;
import me.golemcore.brain.port.outbound.EmbeddingPort;
import me.golemcore.brain.port.outbound.VectorStorePort;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Pushes the daily and weekly tier files into the vector backend.
 *
 * <p>
 * Files are cut into fixed-size chunks and routed to one collection each.
 * Point ids are derived from the file stem and chunk index, so indexing the
 * same file again replaces its points instead of adding new ones.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MemoryIndexingService {

    static final int CHUNK_SIZE = 800;

    private final TieredMemoryStore tieredMemoryStore;
    private final EmbeddingPort embeddingPort;
    private final VectorStorePort vectorStorePort;
    private final BrainConfigService configService;
    private final Clock clock;

    /**
     * Create every configured collection that does not exist yet.
     *
     * @return number of collections confirmed
     */
    public int ensureCollections() {
        int ready = 0;
        for (String collection : configService.getConfig().getCollections().keySet()) {
            try {
                vectorStorePort.ensureCollection(collection, embeddingPort.getDimension()).join();
                ready++;
            } catch (RuntimeException e) {
                log.warn("[Indexing] Cannot create collection {}: {}", collection, e.getMessage());
            }
        }
        return ready;
    }

    public IndexingSummary indexTierFiles() {
        ensureCollections();
        int files = 0;
        int chunks = 0;
        int failed = 0;

        List<String[]> targets = new ArrayList<>();
        for (String name : tieredMemoryStore.listDailyFileNames()) {
            targets.add(new String[] { tieredMemoryStore.dailyDirectory(), name });
        }
        for (String name : tieredMemoryStore.listWeeklyFileNames()) {
            targets.add(new String[] { tieredMemoryStore.weeklyDirectory(), name });
        }

        for (String[] target : targets) {
            try {
                int indexed = indexFile(target[0], target[1]);
                if (indexed > 0) {
                    files++;
                    chunks += indexed;
                }
            } catch (RuntimeException e) {
                failed++;
                log.warn("[Indexing] Failed to index {}/{}: {}", target[0], target[1], e.getMessage());
            }
        }
        log.info("[Indexing] Indexed {} files ({} chunks), {} failed", files, chunks, failed);
        return IndexingSummary.builder()
                .filesIndexed(files)
                .chunksIndexed(chunks)
                .failedFiles(failed)
                .build();
    }

    /**
     * Index one tier file.
     *
     * @return number of chunks upserted
     */
    int indexFile(String directory, String name) {
        boolean weekly = name.startsWith(TieredMemoryStore.WEEKLY_PREFIX);
        Optional<String> text = weekly ? tieredMemoryStore.readWeekly(name) : tieredMemoryStore.readDaily(name);
        if (text.isEmpty() || text.get().isBlank()) {
            return 0;
        }
        String content = text.get();
        String stem = TieredMemoryStore.stem(name);
        String collection = weekly ? distilledCollection(content, stem) : detectCollection(content, stem);
        VectorPayload.Tier tier = weekly ? VectorPayload.Tier.WEEKLY : dailyTier(stem);
        String date = weekly ? stem.substring(TieredMemoryStore.WEEKLY_PREFIX.length()) : stem;
        String storedAt = clock.instant().toString();

        List<String> chunks = chunk(content);
        List<VectorStorePort.VectorPoint> points = new ArrayList<>();
        for (int i = 0; i < chunks.size(); i++) {
            float[] vector = embeddingPort.embed(chunks.get(i)).join();
            VectorPayload payload = VectorPayload.builder()
                    .content(chunks.get(i))
                    .chunkIndex(i)
                    .totalChunks(chunks.size())
                    .memoryTier(tier)
                    .collection(collection)
                    .storedAt(storedAt)
                    .sourceFile(directory + "/" + name)
                    .date(TieredMemoryStore.parseDate(date).map(LocalDate::toString).orElse(null))
                    .build();
            points.add(new VectorStorePort.VectorPoint(pointId(stem, i), vector, payload));
        }
        vectorStorePort.upsert(collection, points).join();
        log.debug("[Indexing] {} -> {} ({} chunks)", name, collection, chunks.size());
        return points.size();
    }

    /**
     * First configured collection whose keyword occurs in the content or the
     * file stem.
     */
    String detectCollection(String content, String stem) {
        String contentLower = content.toLowerCase(Locale.ROOT);
        String stemLower = stem.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, BrainConfig.CollectionConfig> entry : configService.getConfig().getCollections()
                .entrySet()) {
            for (String keyword : entry.getValue().getKeywords()) {
                String needle = keyword.toLowerCase(Locale.ROOT);
                if (!needle.isEmpty() && (contentLower.contains(needle) || stemLower.contains(needle))) {
                    return entry.getKey();
                }
            }
        }
        return BrainConfig.FALLBACK_COLLECTION;
    }

    static List<String> chunk(String content) {
        List<String> chunks = new ArrayList<>();
        for (int start = 0; start < content.length(); start += CHUNK_SIZE) {
            chunks.add(content.substring(start, Math.min(content.length(), start + CHUNK_SIZE)));
        }
        return chunks;
    }

    static String pointId(String stem, int chunkIndex) {
        return UUID.nameUUIDFromBytes((stem + "_" + chunkIndex).getBytes(StandardCharsets.UTF_8)).toString();
    }

    private String distilledCollection(String content, String stem) {
        if (configService.getConfig().getCollections().containsKey(BrainConfig.DISTILLED_COLLECTION)) {
            return BrainConfig.DISTILLED_COLLECTION;
        }
        return detectCollection(content, stem);
    }

    private VectorPayload.Tier dailyTier(String stem) {
        LocalDate workingCutoff = LocalDate.now(clock).minusDays(configService.getShortTermVectorDays());
        return TieredMemoryStore.parseDate(stem)
                .filter(date -> !date.isBefore(workingCutoff))
                .map(date -> VectorPayload.Tier.WORKING)
                .orElse(VectorPayload.Tier.DAILY);
    }
}
