package com.example.procurement.assistantservice.provider;

import com.example.procurement.assistantservice.exception.EmbeddingException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LangChainEmbeddingProviderTest {

    @Mock
    private EmbeddingModel embeddingModel;

    private LangChainEmbeddingProvider provider;

    @BeforeEach
    void setUp() {
        provider = new LangChainEmbeddingProvider(embeddingModel, "text-embedding-3-small");
    }

    @Test
    void normalizesSingleEmbedding() {
        when(embeddingModel.embed("sugar")).thenReturn(Response.from(Embedding.from(new float[]{3, 4})));

        float[] v = provider.embed("sugar");

        assertThat(v[0]).isCloseTo(0.6f, within(1e-6f));
        assertThat(v[1]).isCloseTo(0.8f, within(1e-6f));
    }

    @Test
    void normalizesBatchInOrder() {
        when(embeddingModel.embedAll(anyList())).thenReturn(Response.from(List.of(
                Embedding.from(new float[]{2, 0}),
                Embedding.from(new float[]{0, 5}))));

        List<float[]> vectors = provider.embedAll(List.of("a", "b"));

        assertThat(vectors).hasSize(2);
        assertThat(vectors.get(0)).containsExactly(1f, 0f);
        assertThat(vectors.get(1)).containsExactly(0f, 1f);
    }

    @Test
    void shortBatchIsAnEmbeddingError() {
        when(embeddingModel.embedAll(anyList())).thenReturn(Response.<List<Embedding>>from(
                List.of(Embedding.from(new float[]{1, 0}))));

        assertThatThrownBy(() -> provider.embedAll(List.of("a", "b")))
                .isInstanceOf(EmbeddingException.class)
                .hasMessageContaining("Expected 2");
    }

    @Test
    void providerFailureIsWrapped() {
        when(embeddingModel.embed("sugar")).thenThrow(new RuntimeException("401 Unauthorized"));

        assertThatThrownBy(() -> provider.embed("sugar"))
                .isInstanceOf(EmbeddingException.class)
                .hasMessageContaining("401");
    }

    @Test
    void zeroVectorIsRejected() {
        when(embeddingModel.embed("sugar")).thenReturn(Response.from(Embedding.from(new float[]{0, 0})));

        assertThatThrownBy(() -> provider.embed("sugar")).isInstanceOf(EmbeddingException.class);
    }

    @Test
    void modelIdNamesModelAndNormalization() {
        assertThat(provider.modelId()).isEqualTo("text-embedding-3-small+l2");
        assertThat(provider.embedAll(List.<String>of())).isEmpty();
    }
}
