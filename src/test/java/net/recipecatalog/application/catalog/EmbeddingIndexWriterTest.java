package net.recipecatalog.application.catalog;

import static net.recipecatalog.testutil.RecipeTestData.EMBEDDINGS_KEY;
import static net.recipecatalog.testutil.RecipeTestData.noPausePolicy;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.Map;
import net.recipecatalog.domain.catalog.EmbeddingIndex;
import net.recipecatalog.exception.RetryBudgetExhaustedException;
import net.recipecatalog.testutil.InMemoryVersionedDocumentStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class EmbeddingIndexWriterTest {

    private InMemoryVersionedDocumentStore<EmbeddingIndex> embeddingStore;
    private EmbeddingIndexWriter writer;

    @BeforeEach
    void setUp() {
        embeddingStore = new InMemoryVersionedDocumentStore<>(EMBEDDINGS_KEY, EmbeddingIndex.empty());
        writer = new EmbeddingIndexWriter(embeddingStore, noPausePolicy(), new SimpleMeterRegistry());
    }

    @Test
    void should_AddEntries_When_IndexExists() {
        embeddingStore.seed(EmbeddingIndex.of(Map.of("1", new double[] {1.0, 0.0})));

        EmbeddingIndex merged = writer.merge(Map.of("2", new double[] {0.0, 1.0}));

        assertThat(merged.keys()).containsExactlyInAnyOrder("1", "2");
        assertThat(embeddingStore.current()).isEqualTo(merged);
        assertThat(embeddingStore.current().vector("2")).hasValueSatisfying(
            vector -> assertThat(vector).containsExactly(0.0, 1.0));
    }

    @Test
    void should_KeepConcurrentEntries_When_FirstSaveConflicts() {
        embeddingStore.interleaveBeforeNextSave(index -> index.with("7", new double[] {0.3, 0.4}));

        writer.merge(Map.of("8", new double[] {0.6, 0.8}));

        assertThat(embeddingStore.current().keys()).containsExactlyInAnyOrder("7", "8");
        assertThat(embeddingStore.saveAttempts()).isEqualTo(2);
    }

    @Test
    void should_ThrowRetryBudgetExhausted_When_EverySaveConflicts() {
        embeddingStore.conflictOnEverySave();

        assertThatThrownBy(() -> writer.merge(Map.of("1", new double[] {1.0})))
            .isInstanceOf(RetryBudgetExhaustedException.class)
            .extracting("attempts")
            .isEqualTo(3);
        assertThat(embeddingStore.successfulSaves()).isZero();
    }

    @Test
    void should_NotWrite_When_NoEntriesGiven() {
        EmbeddingIndex result = writer.merge(Map.of());

        assertThat(result.isEmpty()).isTrue();
        assertThat(embeddingStore.saveAttempts()).isZero();
    }
}
