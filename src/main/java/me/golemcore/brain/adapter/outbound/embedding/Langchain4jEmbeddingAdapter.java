package me.golemcore.brain.adapter.outbound.embedding;

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

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.embedding.onnx.allminilml6v2q.AllMiniLmL6V2QuantizedEmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import dev.langchain4j.model.output.Response;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.brain.domain.model.BrainConfig;
import me.golemcore.brain.domain.model.VectorBackendUnavailableException;
import me.golemcore.brain.domain.service.BrainConfigService;
import me.golemcore.brain.port.outbound.EmbeddingPort;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.CompletableFuture;

/**
 * Embedding adapter using langchain4j.
 *
 * <p>
 * Two providers, chosen by {@code embedding.provider} in the runtime config:
 * <ul>
 * <li>{@code local} - in-process quantized all-MiniLM-L6-v2 (384 dimensions),
 * no network needed
 * <li>{@code openai} - OpenAI embeddings API, text-embedding-3-small by default
 * (1536 dimensions)
 * </ul>
 *
 * <p>
 * The model is created on first use. When it cannot be created every call
 * completes with {@link VectorBackendUnavailableException}.
 *
 * @see me.golemcore.brain.port.outbound.EmbeddingPort
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class Langchain4jEmbeddingAdapter implements EmbeddingPort {

    static final String PROVIDER_LOCAL = "local";
    static final String PROVIDER_OPENAI = "openai";
    private static final String LOCAL_MODEL = "all-MiniLM-L6-v2";
    private static final String DEFAULT_OPENAI_MODEL = "text-embedding-3-small";
    private static final int LOCAL_DIMENSION = 384;
    private static final int OPENAI_DIMENSION = 1536;

    private final BrainConfigService configService;

    private volatile EmbeddingModel embeddingModel;
    private volatile boolean initialized = false;

    private synchronized void ensureInitialized() {
        if (initialized)
            return;

        try {
            if (isOpenAi()) {
                String apiKey = configService.getConfig().getEmbedding().getApiKey();
                if (apiKey == null || apiKey.isBlank()) {
                    log.warn("[Embedding] OpenAI API key not configured, embedding service unavailable");
                } else {
                    embeddingModel = OpenAiEmbeddingModel.builder()
                            .apiKey(apiKey)
                            .modelName(getModel())
                            .build();
                }
            } else {
                embeddingModel = new AllMiniLmL6V2QuantizedEmbeddingModel();
            }
            if (embeddingModel != null) {
                log.info("[Embedding] Model initialized: {}", getModel());
            }
        } catch (RuntimeException | LinkageError e) {
            log.error("[Embedding] Failed to initialize embedding model", e);
        }

        initialized = true;
    }

    @Override
    public CompletableFuture<float[]> embed(String text) {
        return CompletableFuture.supplyAsync(() -> {
            ensureInitialized();

            if (embeddingModel == null) {
                throw new VectorBackendUnavailableException("Embedding model not available");
            }

            try {
                Response<Embedding> response = embeddingModel.embed(text);
                return response.content().vector();
            } catch (RuntimeException e) {
                throw new VectorBackendUnavailableException("Embedding failed: " + e.getMessage(), e);
            }
        });
    }

    @Override
    public int getDimension() {
        return isOpenAi() ? OPENAI_DIMENSION : LOCAL_DIMENSION;
    }

    @Override
    public String getModel() {
        if (!isOpenAi()) {
            return LOCAL_MODEL;
        }
        String model = configService.getConfig().getEmbedding().getModel();
        return model != null && !model.isBlank() && !LOCAL_MODEL.equals(model) ? model : DEFAULT_OPENAI_MODEL;
    }

    @Override
    public boolean isAvailable() {
        ensureInitialized();
        return embeddingModel != null;
    }

    private boolean isOpenAi() {
        BrainConfig.EmbeddingConfig embedding = configService.getConfig().getEmbedding();
        return PROVIDER_OPENAI.equals(embedding.getProvider().toLowerCase(Locale.ROOT));
    }
}
