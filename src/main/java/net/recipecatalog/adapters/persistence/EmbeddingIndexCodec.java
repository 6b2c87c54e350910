package net.recipecatalog.adapters.persistence;

import java.util.LinkedHashMap;
import java.util.Map;
import net.recipecatalog.domain.catalog.EmbeddingIndex;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

/**
 * JSON form of the embedding index: {@code {"<recipe_key>": [float, ...]}}.
 */
public class EmbeddingIndexCodec implements JsonDocumentCodec<EmbeddingIndex> {

    private static final TypeReference<LinkedHashMap<String, double[]>> INDEX_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public EmbeddingIndexCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public EmbeddingIndex empty() {
        return EmbeddingIndex.empty();
    }

    @Override
    public EmbeddingIndex decode(String json) {
        if (json == null || json.isBlank()) {
            return EmbeddingIndex.empty();
        }
        LinkedHashMap<String, double[]> raw = objectMapper.readValue(json, INDEX_TYPE);
        if (raw == null) {
            return EmbeddingIndex.empty();
        }
        raw.forEach((key, vector) -> {
            if (vector == null) {
                throw new IllegalArgumentException("Embedding for recipe " + key + " is null");
            }
        });
        return EmbeddingIndex.of(raw);
    }

    @Override
    public String encode(EmbeddingIndex index) {
        Map<String, double[]> raw = index.asMap();
        return objectMapper.writeValueAsString(raw);
    }
}
