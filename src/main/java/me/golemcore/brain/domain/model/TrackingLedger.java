package me.golemcore.brain.domain.model;

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

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable lifecycle metadata: tier membership, quarantine state and
 * consolidation history. Loaded once per invocation and handed explicitly to
 * every lifecycle operation.
 *
 * <p>
 * An entity slug appears in at most one of {@link #quarantine} and
 * {@link #validatedEntities}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TrackingLedger {

    @Builder.Default
    private List<AccessLogEntry> accessLogs = new ArrayList<>();

    /** Entries written per calendar date. */
    @Builder.Default
    private Map<String, Integer> memoryMetrics = new LinkedHashMap<>();

    private Instant lastConsolidation;

    @Builder.Default
    private Map<String, List<DailyEntrySummary>> dailyFiles = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, WeeklySummaryRecord> weeklySummaries = new LinkedHashMap<>();

    @Builder.Default
    private List<QuarantineRecord> quarantine = new ArrayList<>();

    @Builder.Default
    private List<EntityRecord> validatedEntities = new ArrayList<>();

    /**
     * Pending record for a name, matched by {@link EntityRecord#slug} so that
     * spelling variants resolve to the record that owns the file.
     */
    public Optional<QuarantineRecord> findPending(String name) {
        String key = EntityRecord.slug(name);
        return quarantine.stream()
                .filter(record -> EntityRecord.slug(record.getName()).equals(key))
                .findFirst();
    }

    public boolean isPending(String name) {
        return findPending(name).isPresent();
    }

    public boolean isValidated(String name) {
        String key = EntityRecord.slug(name);
        return validatedEntities.stream().anyMatch(entity -> EntityRecord.slug(entity.getName()).equals(key));
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class AccessLogEntry {
        private String query;
        private ResultSource source;
        private int hits;
        private Instant timestamp;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class DailyEntrySummary {
        private String content;
        private String category;
        private String importance;
        private Instant timestamp;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class WeeklySummaryRecord {
        private String file;
        private int entriesConsolidated;
        private Instant timestamp;
    }
}
