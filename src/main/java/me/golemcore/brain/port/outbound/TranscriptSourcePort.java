package me.golemcore.brain.port.outbound;

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

import me.golemcore.brain.domain.model.ConversationTurn;

import java.nio.file.Path;
import java.util.List;

/**
 * Port for reading already-parsed conversation transcripts. Raw
 * assistant-specific session formats are converted upstream; this port only
 * sees clean timestamped role/text turns.
 */
public interface TranscriptSourcePort {

    /**
     * Read every turn of a transcript, in file order. Unreadable records are
     * skipped.
     *
     * @param transcript
     *            transcript file
     * @return turns in original order
     * @throws java.io.UncheckedIOException
     *             if the file itself cannot be read
     */
    List<ConversationTurn> read(Path transcript);

    /**
     * Resolve a location to transcript files: a file resolves to itself, a
     * directory to the transcripts directly inside it, sorted by name.
     *
     * @throws java.io.UncheckedIOException
     *             if the directory cannot be listed
     */
    List<Path> listTranscripts(Path location);
}
