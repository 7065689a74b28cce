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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runtime configuration persisted as {@code config/user_config.json}.
 * Collection iteration order is the declared order; the first collection is the
 * default validation target.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class BrainConfig {

    public static final String FALLBACK_COLLECTION = "mem_sessions";
    public static final String DISTILLED_COLLECTION = "mem_distilled";

    @Builder.Default
    private PruningConfig pruning = new PruningConfig();

    @Builder.Default
    private Map<String, CollectionConfig> collections = defaultCollections();

    @Builder.Default
    private VectorConfig vector = new VectorConfig();

    @Builder.Default
    private EmbeddingConfig embedding = new EmbeddingConfig();

    public String getDefaultCollection() {
        if (collections == null || collections.isEmpty()) {
            return defaultCollections().keySet().iterator().next();
        }
        return collections.keySet().iterator().next();
    }

    public static Map<String, CollectionConfig> defaultCollections() {
        Map<String, CollectionConfig> defaults = new LinkedHashMap<>();
        defaults.put("mem_user", new CollectionConfig("User preferences, personal facts and habits",
                List.of("prefer", "like", "my ", "i am", "i use", "favorite")));
        defaults.put("mem_projects", new CollectionConfig("Project context, code and technical decisions",
                List.of("project", "code", "repo", "build", "deploy", "bug", "feature")));
        defaults.put("mem_business", new CollectionConfig("Business, clients and finance",
                List.of("client", "invoice", "revenue", "contract", "meeting", "customer")));
        defaults.put("mem_agents", new CollectionConfig("Agent configuration and behaviour",
                List.of("agent", "prompt", "model", "skill", "tool")));
        defaults.put(FALLBACK_COLLECTION, new CollectionConfig("Raw session memories",
                new ArrayList<>()));
        defaults.put(DISTILLED_COLLECTION, new CollectionConfig("Consolidated weekly summaries",
                List.of("summary", "weekly", "consolidated")));
        return defaults;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class PruningConfig {
        @Builder.Default
        private Integer dailyFileRetentionDays = 7;
        /** Daily files younger than this are indexed as the working tier. */
        @Builder.Default
        private Integer shortTermVectorDays = 30;
        @Builder.Default
        private Boolean autoPruneEnabled = false;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class CollectionConfig {
        private String description;
        private List<String> keywords = new ArrayList<>();
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class VectorConfig {
        @Builder.Default
        private String url = "http://127.0.0.1:6333";
        @Builder.Default
        private Integer timeoutSeconds = 5;
        private String apiKey;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class EmbeddingConfig {
        @Builder.Default
        private String provider = "local";
        @Builder.Default
        private String model = "all-MiniLM-L6-v2";
        private String apiKey;
    }
}
