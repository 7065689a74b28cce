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

/**
 * Two retrieved memories whose wording suggests they contradict each other.
 */
@Value
@Builder
public class MemoryConflict {

    public static final String TYPE_CONTRADICTION = "contradiction";
    public static final String RESOLUTION_ASK_USER = "ASK_USER";

    String memory1;
    String memory2;
    String collection1;
    String collection2;
    double score1;
    double score2;

    @Builder.Default
    String conflictType = TYPE_CONTRADICTION;

    @Builder.Default
    String resolution = RESOLUTION_ASK_USER;
}
