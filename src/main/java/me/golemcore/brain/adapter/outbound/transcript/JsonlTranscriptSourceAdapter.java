package me.golemcore.brain.adapter.outbound.transcript;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.brain.domain.model.ConversationTurn;
import me.golemcore.brain.port.outbound.TranscriptSourcePort;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Reads clean transcripts stored as JSON Lines, one
 * {@code {"role": ..., "text": ..., "timestamp": ...}} object per line.
 *
 * <p>
 * Timestamps keep their own offset so that a turn lands in the daily file of
 * its own calendar date. Timestamps without an offset are read in the clock's
 * zone; epoch numbers are read as epoch seconds. Lines that are not valid
 * records are skipped with a warning.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JsonlTranscriptSourceAdapter implements TranscriptSourcePort {

    static final String EXTENSION = ".jsonl";

    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public List<ConversationTurn> read(Path transcript) {
        List<ConversationTurn> turns = new ArrayList<>();
        int skipped = 0;
        try (BufferedReader reader = Files.newBufferedReader(transcript, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                ConversationTurn turn = parseLine(line, transcript, lineNumber);
                if (turn == null) {
                    skipped++;
                } else {
                    turns.add(turn);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read transcript: " + transcript, e);
        }
        if (skipped > 0) {
            log.warn("[Transcript] Skipped {} malformed records in {}", skipped, transcript.getFileName());
        }
        return turns;
    }

    @Override
    public List<Path> listTranscripts(Path location) {
        if (!Files.isDirectory(location)) {
            return List.of(location);
        }
        try (Stream<Path> files = Files.list(location)) {
            return files
                    .filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().endsWith(EXTENSION))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list transcripts in " + location, e);
        }
    }

    private ConversationTurn parseLine(String line, Path transcript, int lineNumber) {
        try {
            JsonNode node = objectMapper.readTree(line);
            if (!node.isObject() || !node.hasNonNull("role") || !node.hasNonNull("text")) {
                log.debug("[Transcript] {}:{} is not a turn record", transcript.getFileName(), lineNumber);
                return null;
            }
            OffsetDateTime timestamp = parseTimestamp(node.get("timestamp"));
            if (timestamp == null) {
                log.debug("[Transcript] {}:{} has no usable timestamp", transcript.getFileName(), lineNumber);
                return null;
            }
            return ConversationTurn.builder()
                    .role(node.get("role").asText())
                    .text(node.get("text").asText())
                    .timestamp(timestamp)
                    .build();
        } catch (JsonProcessingException e) {
            log.debug("[Transcript] {}:{} is not JSON: {}", transcript.getFileName(), lineNumber,
                    e.getOriginalMessage());
            return null;
        }
    }

    private OffsetDateTime parseTimestamp(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return OffsetDateTime.ofInstant(Instant.ofEpochSecond(node.asLong()), clock.getZone());
        }
        String value = node.asText();
        try {
            return OffsetDateTime.parse(value);
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(value).atZone(clock.getZone()).toOffsetDateTime();
            } catch (DateTimeParseException nested) {
                return null;
            }
        }
    }
}
