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
import me.golemcore.brain.domain.model.KeywordHit;
import me.golemcore.brain.domain.model.RetrievalQuery;
import me.golemcore.brain.domain.model.RetrievalResult;
import me.golemcore.brain.domain.model.TrackingLedger;
import me.golemcore.brain.domain.model.VectorBackendUnavailableException;
import me.golemcore.brain.domain.model.VectorHit;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Unified query across the tiers.
 *
 * <p>
 * Daily and weekly sections always come from the file keyword scan. The vector
 * section comes from the semantic strategy when it can serve the request and
 * from the lexical fallback otherwise; {@link RetrievalResult#getSource()}
 * names the one that was used.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RetrievalRouter {

    static final int MAX_ACCESS_LOGS = 500;

    private final SemanticVectorStrategy semanticStrategy;
    private final LexicalFallbackStrategy lexicalStrategy;
    private final TieredMemoryStore tieredMemoryStore;
    private final Clock clock;

    public RetrievalResult query(TrackingLedger ledger, RetrievalQuery query) {
        String text = query.getText();
        List<KeywordHit> daily = query.isIncludeDaily()
                ? tieredMemoryStore.queryByKeyword(text, query.getDailyWindowDays())
                : List.of();
        List<KeywordHit> weekly = query.isIncludeWeekly()
                ? tieredMemoryStore.queryWeekly(text)
                : List.of();

        VectorRetrievalStrategy strategy = query.isForceLexical() ? lexicalStrategy : semanticStrategy;
        List<VectorHit> vectors;
        try {
            vectors = strategy.search(text, query.getLimit());
        } catch (VectorBackendUnavailableException e) {
            log.warn("[Retrieval] Vector backend unavailable ({}), falling back to file search", e.getMessage());
            strategy = lexicalStrategy;
            vectors = strategy.search(text, query.getLimit());
        }

        log.debug("[Retrieval] {} strategy returned {} hits", strategy.getComponentType(), vectors.size());

        RetrievalResult result = RetrievalResult.builder()
                .daily(daily)
                .weekly(weekly)
                .vectors(vectors)
                .source(strategy.source())
                .build();
        recordAccess(ledger, text, result);
        return result;
    }

    private void recordAccess(TrackingLedger ledger, String text, RetrievalResult result) {
        List<TrackingLedger.AccessLogEntry> logs = ledger.getAccessLogs();
        logs.add(TrackingLedger.AccessLogEntry.builder()
                .query(text)
                .source(result.getSource())
                .hits(result.totalHits())
                .timestamp(clock.instant())
                .build());
        if (logs.size() > MAX_ACCESS_LOGS) {
            logs.subList(0, logs.size() - MAX_ACCESS_LOGS).clear();
        }
    }
}
