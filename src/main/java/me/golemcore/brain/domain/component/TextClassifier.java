package me.golemcore.brain.domain.component;

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

import java.util.Set;

/**
 * Pluggable text heuristic: maps a text to the set of labels it matches.
 * Consolidation bucketing, contradiction indicators and entity candidate
 * extraction are all expressed through this seam so that a better classifier
 * can replace a keyword one without touching the callers.
 */
public interface TextClassifier extends Component {

    /**
     * Classify a text.
     *
     * @param text
     *            input text, may be empty
     * @return matching labels in the classifier's declared order, never null
     */
    Set<String> classify(String text);
}
