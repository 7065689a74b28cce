package me.golemcore.brain.adapter.outbound.embedding;

import me.golemcore.brain.domain.model.BrainConfig;
import me.golemcore.brain.domain.model.VectorBackendUnavailableException;
import me.golemcore.brain.domain.service.BrainConfigService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class Langchain4jEmbeddingAdapterTest {

    private BrainConfig config;
    private Langchain4jEmbeddingAdapter adapter;

    @BeforeEach
    void setUp() {
        config = BrainConfig.builder().build();
        BrainConfigService configService = mock(BrainConfigService.class);
        when(configService.getConfig()).thenReturn(config);
        adapter = new Langchain4jEmbeddingAdapter(configService);
    }

    @Test
    void shouldDescribeLocalModelByDefault() {
        assertEquals(384, adapter.getDimension());
        assertEquals("all-MiniLM-L6-v2", adapter.getModel());
    }

    @Test
    void shouldDescribeOpenAiModel() {
        config.getEmbedding().setProvider("OpenAI");

        assertEquals(1536, adapter.getDimension());
        assertEquals("text-embedding-3-small", adapter.getModel());

        config.getEmbedding().setModel("text-embedding-3-large");
        assertEquals("text-embedding-3-large", adapter.getModel());
    }

    @Test
    void shouldBeUnavailableWithoutOpenAiKey() {
        config.getEmbedding().setProvider("openai");

        assertFalse(adapter.isAvailable());
        CompletionException error = assertThrows(CompletionException.class, () -> adapter.embed("hello").join());
        assertTrue(error.getCause() instanceof VectorBackendUnavailableException);
    }

    @Test
    void shouldBuildOpenAiModelWhenKeyIsConfigured() {
        config.getEmbedding().setProvider("openai");
        config.getEmbedding().setApiKey("sk-test");

        assertTrue(adapter.isAvailable());
    }
}
