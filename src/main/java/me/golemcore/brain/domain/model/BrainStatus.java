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

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Snapshot of the memory workspace. Collection point counts are {@code -1} when
 * the backend could not be reached for that collection.
 */
@Value
@Builder
public class BrainStatus {

    int dailyFiles;
    int weeklySummaries;
    int pendingEntities;
    int validatedEntities;
    Map<String, Long> collectionPoints;
    Instant lastConsolidation;
    String embeddingModel;
    boolean embeddingAvailable;
}
