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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Fixed payload schema of every point stored in the vector backend.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public class VectorPayload {

    public enum Tier {
        WORKING("working"), DAILY("daily"), WEEKLY("weekly");

        private final String code;

        Tier(String code) {
            this.code = code;
        }

        @JsonValue
        public String getCode() {
            return code;
        }
    }

    private String content;
    private int chunkIndex;
    private int totalChunks;
    private Tier memoryTier;
    private String collection;
    private String storedAt;
    private String sourceFile;
    private String date;

    /**
     * Checks the schema before a payload leaves the process.
     *
     * @throws IllegalArgumentException
     *             when a required field is missing or the chunk position is
     *             inconsistent
     */
    public void validate() {
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("Vector payload content is empty");
        }
        if (collection == null || collection.isBlank()) {
            throw new IllegalArgumentException("Vector payload collection is missing");
        }
        if (memoryTier == null) {
            throw new IllegalArgumentException("Vector payload tier is missing");
        }
        if (chunkIndex < 0 || totalChunks <= chunkIndex) {
            throw new IllegalArgumentException(
                    "Invalid chunk position " + chunkIndex + "/" + totalChunks + " for " + sourceFile);
        }
    }
}
