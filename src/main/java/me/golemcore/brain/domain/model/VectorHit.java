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
 * A scored memory from either retrieval tier. Lexical hits use the
 * {@code file} collection label and a fixed score. Semantic hits always score
 * strictly above {@link #LEXICAL_SCORE}; backend matches at or below it are
 * discarded as unrelated.
 */
@Value
@Builder
public class VectorHit {

    public static final String FILE_COLLECTION = "file";
    public static final double LEXICAL_SCORE = 0.0;

    String collection;
    String content;
    double score;
    String sourceFile;
}
