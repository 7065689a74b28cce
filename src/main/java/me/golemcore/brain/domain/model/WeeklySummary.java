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
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * Consolidated view of the daily files in {@code [weekStart, weekStart + 6]}.
 * The week start date is the idempotency key.
 */
@Value
@Builder
public class WeeklySummary {

    public static final int MAX_ITEMS_PER_BUCKET = 5;

    LocalDate weekStart;
    LocalDate weekEnd;

    @Singular
    List<String> decisions;

    @Singular
    List<String> preferences;

    @Singular
    List<String> actions;

    int dailyFilesConsolidated;
    Instant generatedAt;
    String file;

    public String getLabel() {
        return weekStart + "_to_" + weekEnd;
    }
}
