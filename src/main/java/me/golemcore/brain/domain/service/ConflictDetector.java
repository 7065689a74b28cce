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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.brain.domain.model.ConflictReport;
import me.golemcore.brain.domain.model.MemoryConflict;
import me.golemcore.brain.domain.model.RetrievalQuery;
import me.golemcore.brain.domain.model.RetrievalResult;
import me.golemcore.brain.domain.model.TrackingLedger;
import me.golemcore.brain.domain.model.VectorHit;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Flags pairs of retrieved memories that look contradictory.
 *
 * <p>
 * Deliberately lexical: a pair is flagged only when both texts echo the same
 * contradiction-indicator group and the texts differ. Nothing is resolved
 * automatically; every conflict is handed back to the user with a clarifying
 * question.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConflictDetector {

    private static final int QUESTION_PREVIEW = 100;

    private final RetrievalRouter retrievalRouter;
    private final ContradictionIndicatorClassifier indicatorClassifier;

    public ConflictReport detect(TrackingLedger ledger, String query, int limit) {
        RetrievalResult result = retrievalRouter.query(ledger, RetrievalQuery.builder()
                .text(query)
                .includeDaily(false)
                .includeWeekly(false)
                .limit(limit)
                .build());
        List<MemoryConflict> conflicts = findConflicts(result.getVectors());
        log.info("[Conflicts] {} conflicts among {} memories for '{}'", conflicts.size(),
                result.getVectors().size(), query);
        return ConflictReport.builder()
                .query(query)
                .conflicts(conflicts)
                .clarifyingQuestion(clarifyingQuestion(conflicts).orElse(null))
                .source(result.getSource())
                .build();
    }

    /**
     * Every unordered pair of memories that shares an indicator group and is
     * not textually identical.
     */
    public List<MemoryConflict> findConflicts(List<VectorHit> memories) {
        List<MemoryConflict> conflicts = new ArrayList<>();
        if (memories.size() < 2) {
            return conflicts;
        }
        List<Set<String>> labels = new ArrayList<>();
        for (VectorHit memory : memories) {
            labels.add(indicatorClassifier.classify(memory.getContent()));
        }
        for (int i = 0; i < memories.size(); i++) {
            for (int j = i + 1; j < memories.size(); j++) {
                VectorHit first = memories.get(i);
                VectorHit second = memories.get(j);
                if (sameText(first.getContent(), second.getContent())) {
                    continue;
                }
                Set<String> shared = new HashSet<>(labels.get(i));
                shared.retainAll(labels.get(j));
                if (!shared.isEmpty()) {
                    log.debug("[Conflicts] {} shared {} between hits {} and {}",
                            indicatorClassifier.getComponentType(), shared, i, j);
                    conflicts.add(MemoryConflict.builder()
                            .memory1(first.getContent())
                            .memory2(second.getContent())
                            .collection1(first.getCollection())
                            .collection2(second.getCollection())
                            .score1(first.getScore())
                            .score2(second.getScore())
                            .build());
                }
            }
        }
        return conflicts;
    }

    /**
     * One question for the user, quoting the conflict with the shortest
     * combined text.
     */
    public Optional<String> clarifyingQuestion(List<MemoryConflict> conflicts) {
        return conflicts.stream()
                .min(Comparator.comparingInt(c -> c.getMemory1().length() + c.getMemory2().length()))
                .map(conflict -> "Memory Conflict Detected\n\n"
                        + "I found potentially conflicting memories:\n\n"
                        + "**Memory A**: \"" + preview(conflict.getMemory1()) + "\"\n"
                        + "**Memory B**: \"" + preview(conflict.getMemory2()) + "\"\n\n"
                        + "Are these separate contexts (e.g., \"venv for apps, conda for data science\"), "
                        + "or should I update your preference?");
    }

    private static boolean sameText(String first, String second) {
        return first.toLowerCase(Locale.ROOT).equals(second.toLowerCase(Locale.ROOT));
    }

    private static String preview(String text) {
        return text.length() > QUESTION_PREVIEW ? text.substring(0, QUESTION_PREVIEW) + "..." : text;
    }
}
