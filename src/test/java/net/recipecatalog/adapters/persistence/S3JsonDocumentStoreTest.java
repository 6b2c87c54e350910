package net.recipecatalog.adapters.persistence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import net.recipecatalog.domain.catalog.EmbeddingIndex;
import net.recipecatalog.domain.catalog.Recipe;
import net.recipecatalog.domain.catalog.RecipeCatalog;
import net.recipecatalog.domain.catalog.VersionedDocument;
import net.recipecatalog.exception.DocumentStoreException;
import net.recipecatalog.support.s3.S3ObjectStorageGateway;
import net.recipecatalog.support.s3.StoredObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tools.jackson.databind.ObjectMapper;

@ExtendWith(MockitoExtension.class)
class S3JsonDocumentStoreTest {

    private static final String CATALOG_KEY = "jsondata/combined_data.json";
    private static final String EMBEDDINGS_KEY = "jsondata/recipe_embeddings.json";

    @Mock
    private S3ObjectStorageGateway gateway;

    private ObjectMapper objectMapper;
    private S3JsonDocumentStore<RecipeCatalog> catalogStore;
    private S3JsonDocumentStore<EmbeddingIndex> embeddingStore;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper();
        catalogStore = new S3JsonDocumentStore<>(gateway, CATALOG_KEY, new RecipeCatalogCodec(objectMapper));
        embeddingStore = new S3JsonDocumentStore<>(gateway, EMBEDDINGS_KEY, new EmbeddingIndexCodec(objectMapper));
    }

    @Test
    void should_ReturnEmptyWithoutVersion_When_DocumentMissing() {
        when(gateway.fetchUtf8Object(CATALOG_KEY)).thenReturn(Optional.empty());

        VersionedDocument<RecipeCatalog> loaded = catalogStore.load();

        assertThat(loaded.document().isEmpty()).isTrue();
        assertThat(loaded.version()).isNull();
        assertThat(loaded.exists()).isFalse();
    }

    @Test
    void should_DecodeRecipesAndKeepUnknownFields_When_CatalogLoaded() {
        String json = """
            {"1": {"Title": "Soup", "Servings": 4, "Type": ["dinner"], "key": "1",
                   "Ingredients": {"base": ["water"]}, "custom": true}}
            """;
        when(gateway.fetchUtf8Object(CATALOG_KEY)).thenReturn(Optional.of(new StoredObject(json, "\"e1\"")));

        VersionedDocument<RecipeCatalog> loaded = catalogStore.load();

        assertThat(loaded.version()).isEqualTo("\"e1\"");
        Recipe soup = loaded.document().find("1").orElseThrow();
        assertThat(soup.title()).isEqualTo("Soup");
        assertThat(soup.fields()).containsEntry("custom", true).containsEntry("Type", List.of("dinner"));
        assertThat(soup.fields()).containsKeys("Title", "Servings", "Type", "key", "Ingredients", "custom");
    }

    @Test
    void should_RaiseStoreFailure_When_BodyIsCorrupt() {
        when(gateway.fetchUtf8Object(CATALOG_KEY)).thenReturn(Optional.of(new StoredObject("{\"1\": [", "\"e1\"")));

        assertThatThrownBy(() -> catalogStore.load())
            .isInstanceOf(DocumentStoreException.class)
            .hasMessageStartingWith("Corrupt JSON in " + CATALOG_KEY);
    }

    @Test
    void should_RaiseStoreFailure_When_CatalogEntryIsNotAnObject() {
        when(gateway.fetchUtf8Object(CATALOG_KEY)).thenReturn(Optional.of(new StoredObject("{\"1\": null}", "\"e1\"")));

        assertThatThrownBy(() -> catalogStore.load()).isInstanceOf(DocumentStoreException.class);
    }

    @Test
    void should_WriteJsonWithExpectedVersion_When_Saving() {
        when(gateway.putJsonConditionally(eq(CATALOG_KEY), anyString(), eq("\"e1\""))).thenReturn(true);
        RecipeCatalog catalog = RecipeCatalog.of(Map.of("1", Recipe.of(Map.of("Title", "Soup"))));

        boolean saved = catalogStore.save(catalog, "\"e1\"");

        assertThat(saved).isTrue();
        ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
        verify(gateway).putJsonConditionally(eq(CATALOG_KEY), body.capture(), eq("\"e1\""));
        assertThat(objectMapper.readTree(body.getValue()).get("1").get("Title").asString()).isEqualTo("Soup");
    }

    @Test
    void should_PassConflictThrough_When_GatewayReportsPreconditionFailure() {
        when(gateway.putJsonConditionally(eq(EMBEDDINGS_KEY), anyString(), eq("\"old\""))).thenReturn(false);

        assertThat(embeddingStore.save(EmbeddingIndex.of(Map.of("1", new double[] {1.0})), "\"old\"")).isFalse();
    }

    @Test
    void should_DecodeIntegerComponentsAsDoubles_When_IndexLoaded() {
        when(gateway.fetchUtf8Object(EMBEDDINGS_KEY))
            .thenReturn(Optional.of(new StoredObject("{\"1\": [1, 0.5, -2]}", "\"e9\"")));

        EmbeddingIndex index = embeddingStore.load().document();

        assertThat(index.vector("1")).hasValueSatisfying(
            vector -> assertThat(vector).containsExactly(1.0, 0.5, -2.0));
    }

    @Test
    void should_RoundTripVectors_When_IndexEncoded() {
        EmbeddingIndexCodec codec = new EmbeddingIndexCodec(objectMapper);
        EmbeddingIndex index = EmbeddingIndex.of(Map.of("4", new double[] {0.25, -0.75}));

        assertThat(codec.decode(codec.encode(index))).isEqualTo(index);
    }
}
