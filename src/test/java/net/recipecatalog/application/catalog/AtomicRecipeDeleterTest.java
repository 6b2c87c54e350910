package net.recipecatalog.application.catalog;

import static net.recipecatalog.testutil.RecipeTestData.CATALOG_KEY;
import static net.recipecatalog.testutil.RecipeTestData.EMBEDDINGS_KEY;
import static net.recipecatalog.testutil.RecipeTestData.catalogWithKeys;
import static net.recipecatalog.testutil.RecipeTestData.recordingPolicy;
import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.recipecatalog.domain.catalog.EmbeddingIndex;
import net.recipecatalog.domain.catalog.RecipeCatalog;
import net.recipecatalog.exception.DocumentStoreException;
import net.recipecatalog.testutil.InMemoryVersionedDocumentStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class AtomicRecipeDeleterTest {

    private InMemoryVersionedDocumentStore<RecipeCatalog> catalogStore;
    private InMemoryVersionedDocumentStore<EmbeddingIndex> embeddingStore;
    private List<Duration> pauses;
    private AtomicRecipeDeleter deleter;

    @BeforeEach
    void setUp() {
        catalogStore = new InMemoryVersionedDocumentStore<>(CATALOG_KEY, RecipeCatalog.empty());
        embeddingStore = new InMemoryVersionedDocumentStore<>(EMBEDDINGS_KEY, EmbeddingIndex.empty());
        catalogStore.seed(catalogWithKeys("1", "2"));
        embeddingStore.seed(EmbeddingIndex.of(Map.of("1", new double[] {1.0, 0.0}, "2", new double[] {0.0, 1.0})));
        pauses = new ArrayList<>();
        deleter = new AtomicRecipeDeleter(catalogStore, embeddingStore, recordingPolicy(pauses), new SimpleMeterRegistry());
    }

    @Test
    void should_RemoveKeyFromBothDocuments_When_KeyExists() {
        DeleteOutcome outcome = deleter.delete("1");

        assertThat(outcome).isEqualTo(DeleteOutcome.succeeded());
        assertThat(catalogStore.current().asMap()).containsOnlyKeys("2");
        assertThat(embeddingStore.current().keys()).containsOnly("2");
    }

    @Test
    @DisplayName("Deleting the same key twice succeeds both times without a second write")
    void should_SucceedWithoutWrites_When_KeyWasAlreadyDeleted() {
        deleter.delete("1");
        int catalogSaves = catalogStore.saveAttempts();
        int indexSaves = embeddingStore.saveAttempts();

        DeleteOutcome second = deleter.delete("1");

        assertThat(second.success()).isTrue();
        assertThat(second.error()).isNull();
        assertThat(catalogStore.saveAttempts()).isEqualTo(catalogSaves);
        assertThat(embeddingStore.saveAttempts()).isEqualTo(indexSaves);
    }

    @Test
    void should_SkipIndexWrite_When_KeyOnlyExistsInCatalog() {
        embeddingStore.seed(EmbeddingIndex.of(Map.of("2", new double[] {0.0, 1.0})));

        DeleteOutcome outcome = deleter.delete("1");

        assertThat(outcome.success()).isTrue();
        assertThat(catalogStore.current().containsKey("1")).isFalse();
        assertThat(embeddingStore.saveAttempts()).isZero();
    }

    @Test
    void should_ReloadBothDocuments_When_IndexSaveConflicts() {
        embeddingStore.interleaveBeforeNextSave(index -> index.with("3", new double[] {0.5, 0.5}));

        DeleteOutcome outcome = deleter.delete("1");

        assertThat(outcome.success()).isTrue();
        assertThat(catalogStore.successfulSaves()).isEqualTo(1);
        assertThat(catalogStore.loads()).isEqualTo(2);
        assertThat(embeddingStore.current().keys()).containsExactlyInAnyOrder("2", "3");
        assertThat(pauses).hasSize(1);
    }

    @Test
    void should_KeepConcurrentCatalogChanges_When_CatalogSaveConflicts() {
        catalogStore.interleaveBeforeNextSave(catalog -> catalogWithKeys("1", "2", "3"));

        DeleteOutcome outcome = deleter.delete("1");

        assertThat(outcome.success()).isTrue();
        assertThat(catalogStore.current().asMap()).containsOnlyKeys("2", "3");
    }

    @Test
    void should_ReportMaxRetries_When_CatalogAlwaysConflicts() {
        catalogStore.conflictOnEverySave();

        DeleteOutcome outcome = deleter.delete("1");

        assertThat(outcome.success()).isFalse();
        assertThat(outcome.error()).isEqualTo("Max retries exceeded updating " + CATALOG_KEY);
        assertThat(catalogStore.saveAttempts()).isEqualTo(3);
        assertThat(pauses).hasSize(2);
    }

    @Test
    void should_NameIndexDocument_When_IndexAlwaysConflicts() {
        embeddingStore.conflictOnEverySave();

        DeleteOutcome outcome = deleter.delete("1");

        assertThat(outcome.error()).isEqualTo("Max retries exceeded updating " + EMBEDDINGS_KEY);
        assertThat(catalogStore.current().containsKey("1")).isFalse();
    }

    @Test
    void should_FailImmediately_When_IndexStoreFaults() {
        embeddingStore.failSavesWith(new DocumentStoreException(EMBEDDINGS_KEY, "Access Denied"));

        DeleteOutcome outcome = deleter.delete("1");

        assertThat(outcome.success()).isFalse();
        assertThat(outcome.error()).isEqualTo("Error updating " + EMBEDDINGS_KEY + ": Access Denied");
        assertThat(embeddingStore.saveAttempts()).isEqualTo(1);
        assertThat(pauses).isEmpty();
    }
}
