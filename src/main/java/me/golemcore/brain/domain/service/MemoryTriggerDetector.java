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

import me.golemcore.brain.domain.model.MemoryEntry.Importance;
import me.golemcore.brain.domain.model.MemoryTrigger;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Detects explicit requests to remember something ("remember this", "we
 * decided", ...) in free text. The first phrase in declaration order that
 * occurs in the text wins; everything after it becomes the memory content.
 */
@Service
public class MemoryTriggerDetector {

    private static final Map<String, Importance> TRIGGERS = new LinkedHashMap<>();

    static {
        TRIGGERS.put("remember this", Importance.NORMAL);
        TRIGGERS.put("don't forget", Importance.HIGH);
        TRIGGERS.put("make sure to", Importance.ACTION);
        TRIGGERS.put("we decided", Importance.DECISION);
        TRIGGERS.put("this is important", Importance.HIGH);
        TRIGGERS.put("for future reference", Importance.LONG_TERM);
    }

    public Optional<MemoryTrigger> detect(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String lower = text.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, Importance> trigger : TRIGGERS.entrySet()) {
            int index = lower.indexOf(trigger.getKey());
            if (index < 0) {
                continue;
            }
            String remainder = text.substring(index + trigger.getKey().length())
                    .replaceFirst("^[\\s:,.\\-]+", "")
                    .trim();
            String content = remainder.isEmpty() ? text.trim() : remainder;
            return Optional.of(MemoryTrigger.builder()
                    .phrase(trigger.getKey())
                    .content(content)
                    .importance(trigger.getValue())
                    .category(categoryFor(trigger.getKey()))
                    .build());
        }
        return Optional.empty();
    }

    private String categoryFor(String phrase) {
        if (phrase.contains("decided")) {
            return "decision";
        }
        if (phrase.contains("make sure")) {
            return "action";
        }
        if (phrase.contains("important")) {
            return "important";
        }
        return "general";
    }
}
