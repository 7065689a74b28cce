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

import me.golemcore.brain.domain.model.VectorPayload;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Port for the external vector-search backend (Qdrant in production).
 *
 * <p>
 * Every call addresses a single collection and fails independently: callers
 * iterating over several collections are expected to isolate failures per
 * collection. Failures complete the future exceptionally with
 * {@link me.golemcore.brain.domain.model.VectorBackendUnavailableException}.
 */
public interface VectorStorePort {

    /**
     * Create the collection (cosine distance) if it does not exist yet.
     */
    CompletableFuture<Void> ensureCollection(String collection, int dimension);

    /**
     * Insert or replace points in a collection.
     */
    CompletableFuture<Void> upsert(String collection, List<VectorPoint> points);

    /**
     * Top-k similarity query.
     *
     * @return hits ranked by descending score
     */
    CompletableFuture<List<ScoredPayload>> querySimilar(String collection, float[] vector, int limit);

    /**
     * Number of points stored in the collection.
     */
    CompletableFuture<Long> getCollectionStats(String collection);

    /**
     * A point to store.
     */
    record VectorPoint(String id, float[] vector, VectorPayload payload) {
    }

    /**
     * A similarity hit with its stored payload.
     */
    record ScoredPayload(double score, VectorPayload payload) {
    }
}
