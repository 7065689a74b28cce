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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.brain.domain.model.ConversationTurn;
import me.golemcore.brain.domain.model.MemoryEntry;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Decides which conversation turns are worth remembering. Pure predicate: the
 * content of a kept turn is never altered.
 *
 * <p>
 * Rules, applied in order:
 * <ol>
 * <li>role must be {@code user} or {@code assistant}</li>
 * <li>text must not contain a noise marker</li>
 * <li>text must be at least {@value #MIN_LENGTH} characters long</li>
 * </ol>
 */
@Service
@Slf4j
public class SignificanceFilter {

    public static final int MIN_LENGTH = 50;
    public static final String CATEGORY = "conversation";

    private static final List<String> NOISE_MARKERS = List.of(
            "HEARTBEAT_OK",
            "Read HEARTBEAT.md",
            "system:",
            "{");

    public boolean keep(ConversationTurn turn) {
        if (turn == null || turn.getText() == null) {
            return false;
        }
        if (MemoryEntry.Role.fromCode(turn.getRole()).isEmpty()) {
            return false;
        }
        String text = turn.getText();
        for (String marker : NOISE_MARKERS) {
            if (text.contains(marker)) {
                return false;
            }
        }
        return text.length() >= MIN_LENGTH;
    }

    /**
     * Keep the significant turns and convert them into entries, preserving
     * order.
     */
    public List<MemoryEntry> filter(List<ConversationTurn> turns) {
        List<MemoryEntry> entries = new ArrayList<>();
        for (ConversationTurn turn : turns) {
            toEntry(turn).ifPresent(entries::add);
        }
        log.debug("[Significance] Kept {} of {} turns", entries.size(), turns.size());
        return entries;
    }

    public Optional<MemoryEntry> toEntry(ConversationTurn turn) {
        if (!keep(turn) || turn.getTimestamp() == null) {
            return Optional.empty();
        }
        return Optional.of(MemoryEntry.builder()
                .content(turn.getText())
                .role(MemoryEntry.Role.fromCode(turn.getRole()).orElseThrow())
                .category(CATEGORY)
                .importance(MemoryEntry.Importance.NORMAL)
                .timestamp(turn.getTimestamp())
                .build());
    }
}
