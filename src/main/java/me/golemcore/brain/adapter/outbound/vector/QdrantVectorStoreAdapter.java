package me.golemcore.brain.adapter.outbound.vector;

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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.brain.domain.model.BrainConfig;
import me.golemcore.brain.domain.model.VectorBackendUnavailableException;
import me.golemcore.brain.domain.model.VectorPayload;
import me.golemcore.brain.domain.service.BrainConfigService;
import me.golemcore.brain.port.outbound.VectorStorePort;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Qdrant adapter over the Qdrant REST API.
 *
 * <p>
 * Endpoints:
 * <ul>
 * <li>PUT /collections/{name} - Create a collection (cosine distance)
 * <li>PUT /collections/{name}/points - Upsert points
 * <li>POST /collections/{name}/points/search - Similarity search
 * <li>GET /collections/{name} - Collection info (point count)
 * </ul>
 *
 * <p>
 * Configuration comes from the runtime config:
 * <ul>
 * <li>{@code vector.url} - Qdrant base URL
 * <li>{@code vector.api_key} - Optional API key
 * <li>{@code vector.timeout_seconds} - call timeout, kept short so retrieval
 * can fall back quickly
 * </ul>
 *
 * <p>
 * Any transport error or non-2xx answer completes the future with
 * {@link VectorBackendUnavailableException}.
 */
@Component
@Slf4j
public class QdrantVectorStoreAdapter implements VectorStorePort {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final String DISTANCE = "Cosine";

    private final BrainConfigService configService;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public QdrantVectorStoreAdapter(BrainConfigService configService, OkHttpClient baseHttpClient,
            ObjectMapper objectMapper) {
        this.configService = configService;
        this.objectMapper = objectMapper;

        // Dedicated client with the vector-specific timeout
        int timeoutSeconds = configService.getVectorTimeoutSeconds();
        this.httpClient = baseHttpClient.newBuilder()
                .callTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .readTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .build();
    }

    @Override
    public CompletableFuture<Void> ensureCollection(String collection, int dimension) {
        return CompletableFuture.runAsync(() -> {
            ObjectNode body = objectMapper.createObjectNode();
            ObjectNode vectors = body.putObject("vectors");
            vectors.put("size", dimension);
            vectors.put("distance", DISTANCE);

            Request request = newRequest(url(collection))
                    .put(RequestBody.create(body.toString(), JSON))
                    .build();
            try (Response response = httpClient.newCall(request).execute()) {
                if (response.isSuccessful()) {
                    log.info("[Qdrant] Created collection {}", collection);
                    return;
                }
                String error = bodyOf(response);
                if (response.code() == 409 || error.contains("already exists")) {
                    log.debug("[Qdrant] Collection {} exists", collection);
                    return;
                }
                throw new VectorBackendUnavailableException(
                        "Create collection " + collection + " failed: HTTP " + response.code());
            } catch (IOException e) {
                throw new VectorBackendUnavailableException("Qdrant unreachable: " + e.getMessage(), e);
            }
        });
    }

    @Override
    public CompletableFuture<Void> upsert(String collection, List<VectorPoint> points) {
        return CompletableFuture.runAsync(() -> {
            ObjectNode body = objectMapper.createObjectNode();
            ArrayNode pointsNode = body.putArray("points");
            for (VectorPoint point : points) {
                point.payload().validate();
                ObjectNode pointNode = pointsNode.addObject();
                pointNode.put("id", point.id());
                ArrayNode vector = pointNode.putArray("vector");
                for (float value : point.vector()) {
                    vector.add(value);
                }
                pointNode.set("payload", objectMapper.valueToTree(point.payload()));
            }

            HttpUrl url = url(collection, "points").newBuilder()
                    .addQueryParameter("wait", "true")
                    .build();
            Request request = newRequest(url)
                    .put(RequestBody.create(body.toString(), JSON))
                    .build();
            execute(request, "upsert into " + collection);
            log.debug("[Qdrant] Upserted {} points into {}", points.size(), collection);
        });
    }

    @Override
    public CompletableFuture<List<ScoredPayload>> querySimilar(String collection, float[] vector, int limit) {
        return CompletableFuture.supplyAsync(() -> {
            ObjectNode body = objectMapper.createObjectNode();
            ArrayNode vectorNode = body.putArray("vector");
            for (float value : vector) {
                vectorNode.add(value);
            }
            body.put("limit", limit);
            body.put("with_payload", true);

            Request request = newRequest(url(collection, "points", "search"))
                    .post(RequestBody.create(body.toString(), JSON))
                    .build();
            JsonNode result = execute(request, "search " + collection).path("result");

            List<ScoredPayload> hits = new ArrayList<>();
            for (JsonNode hit : result) {
                hits.add(new ScoredPayload(hit.path("score").asDouble(), parsePayload(hit.path("payload"))));
            }
            return hits;
        });
    }

    @Override
    public CompletableFuture<Long> getCollectionStats(String collection) {
        return CompletableFuture.supplyAsync(() -> {
            Request request = newRequest(url(collection)).get().build();
            JsonNode result = execute(request, "info " + collection).path("result");
            return result.path("points_count").asLong(0);
        });
    }

    private JsonNode execute(Request request, String operation) {
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                log.debug("[Qdrant] {} failed: HTTP {}", operation, response.code());
                throw new VectorBackendUnavailableException(operation + " failed: HTTP " + response.code());
            }
            String body = bodyOf(response);
            return body.isEmpty() ? objectMapper.createObjectNode() : objectMapper.readTree(body);
        } catch (IOException e) {
            throw new VectorBackendUnavailableException("Qdrant unreachable: " + e.getMessage(), e);
        }
    }

    private VectorPayload parsePayload(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return VectorPayload.builder().content("").build();
        }
        try {
            return objectMapper.treeToValue(node, VectorPayload.class);
        } catch (IOException | IllegalArgumentException e) {
            log.debug("[Qdrant] Payload does not match schema, keeping content only: {}", e.getMessage());
            return VectorPayload.builder()
                    .content(node.path("content").asText(""))
                    .sourceFile(node.path("source_file").asText(null))
                    .build();
        }
    }

    private Request.Builder newRequest(HttpUrl url) {
        Request.Builder builder = new Request.Builder().url(url);
        String apiKey = configService.getConfig().getVector().getApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("api-key", apiKey);
        }
        return builder;
    }

    private HttpUrl url(String collection, String... segments) {
        BrainConfig.VectorConfig vector = configService.getConfig().getVector();
        HttpUrl base = HttpUrl.parse(vector.getUrl());
        if (base == null) {
            throw new VectorBackendUnavailableException("Invalid vector url: " + vector.getUrl());
        }
        HttpUrl.Builder builder = base.newBuilder()
                .addPathSegment("collections")
                .addPathSegment(collection);
        for (String segment : segments) {
            builder.addPathSegment(segment);
        }
        return builder.build();
    }

    private static String bodyOf(Response response) throws IOException {
        ResponseBody body = response.body();
        return body != null ? body.string() : "";
    }
}
