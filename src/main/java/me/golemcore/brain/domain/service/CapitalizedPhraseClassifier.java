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

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Entity candidate extractor: runs of two to four capitalized words. Leading
 * sentence openers ("The", "When", ...) are stripped from a run before its
 * length is checked, so "When Jane Doe" yields "Jane Doe".
 */
@Component
public class CapitalizedPhraseClassifier implements TextClassifier {

    private static final Pattern CAPITALIZED_RUN = Pattern.compile("\\b([A-Z][a-z]+(?:\\s+[A-Z][a-z]+)+)\\b");
    private static final int MIN_WORDS = 2;
    private static final int MAX_WORDS = 4;

    private static final Set<String> STOPWORDS = Set.of(
            "I", "We", "You", "He", "She", "It", "They",
            "The", "A", "An", "This", "That", "These", "Those",
            "When", "Where", "How", "Why");

    @Override
    public String getComponentType() {
        return "entity-candidates";
    }

    @Override
    public Set<String> classify(String text) {
        Set<String> candidates = new LinkedHashSet<>();
        if (text == null || text.isEmpty()) {
            return candidates;
        }
        Matcher matcher = CAPITALIZED_RUN.matcher(text);
        while (matcher.find()) {
            String[] words = matcher.group(1).trim().split("\\s+");
            int start = 0;
            while (start < words.length && STOPWORDS.contains(words[start])) {
                start++;
            }
            int length = words.length - start;
            if (length < MIN_WORDS || length > MAX_WORDS) {
                continue;
            }
            candidates.add(String.join(" ", Arrays.copyOfRange(words, start, words.length)));
        }
        return candidates;
    }
}
