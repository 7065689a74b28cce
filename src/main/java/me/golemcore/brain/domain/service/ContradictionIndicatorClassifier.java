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
 * Reports which contradiction-indicator groups a text echoes. Two memories
 * sharing a group label are conflict candidates.
 */
@Component
public class ContradictionIndicatorClassifier implements TextClassifier {

    public static final String ALTERNATIVE = "alternative";
    public static final String NEGATION = "negation";
    public static final String CORRECTION = "correction";
    public static final String CHANGE = "change";

    private static final Map<String, List<String>> GROUPS = new LinkedHashMap<>();

    static {
        GROUPS.put(ALTERNATIVE, List.of("use", "prefer", "instead"));
        GROUPS.put(NEGATION, List.of("instead of", "not", "rather than"));
        GROUPS.put(CORRECTION, List.of("actually", "really"));
        GROUPS.put(CHANGE, List.of("change", "update", "switch"));
    }

    @Override
    public String getComponentType() {
        return "contradiction-indicators";
    }

    @Override
    public Set<String> classify(String text) {
        Set<String> labels = new LinkedHashSet<>();
        if (text == null) {
            return labels;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        GROUPS.forEach((label, phrases) -> {
            if (phrases.stream().anyMatch(lower::contains)) {
                labels.add(label);
            }
        });
        return labels;
    }
}
