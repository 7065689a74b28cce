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

import me.golemcore.brain.domain.component.TextClassifier;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Keyword classifier for weekly consolidation. Labels come back in priority
 * order (decision, preference, action); consolidation files a text under the
 * first one only.
 */
@Component
public class ConsolidationBucketClassifier implements TextClassifier {

    public static final String DECISION = "decision";
    public static final String PREFERENCE = "preference";
    public static final String ACTION = "action";

    private static final Map<String, List<String>> KEYWORDS = new LinkedHashMap<>();

    static {
        KEYWORDS.put(DECISION, List.of("decision", "decided"));
        KEYWORDS.put(PREFERENCE, List.of("prefer", "like"));
        KEYWORDS.put(ACTION, List.of("action", "make sure"));
    }

    @Override
    public String getComponentType() {
        return "consolidation-buckets";
    }

    @Override
    public Set<String> classify(String text) {
        Set<String> labels = new LinkedHashSet<>();
        if (text == null) {
            return labels;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        KEYWORDS.forEach((label, keywords) -> {
            if (keywords.stream().anyMatch(lower::contains)) {
                labels.add(label);
            }
        });
        return labels;
    }
}
