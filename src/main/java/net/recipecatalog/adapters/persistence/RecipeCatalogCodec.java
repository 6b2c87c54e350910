package net.recipecatalog.adapters.persistence;

import java.util.LinkedHashMap;
import java.util.Map;
import net.recipecatalog.domain.catalog.Recipe;
import net.recipecatalog.domain.catalog.RecipeCatalog;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

/**
 * JSON form of the catalog: one object keyed by recipe key, each value a recipe object.
 */
public class RecipeCatalogCodec implements JsonDocumentCodec<RecipeCatalog> {

    private static final TypeReference<LinkedHashMap<String, LinkedHashMap<String, Object>>> CATALOG_TYPE =
        new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public RecipeCatalogCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public RecipeCatalog empty() {
        return RecipeCatalog.empty();
    }

    @Override
    public RecipeCatalog decode(String json) {
        if (json == null || json.isBlank()) {
            return RecipeCatalog.empty();
        }
        LinkedHashMap<String, LinkedHashMap<String, Object>> raw = objectMapper.readValue(json, CATALOG_TYPE);
        if (raw == null) {
            return RecipeCatalog.empty();
        }
        Map<String, Recipe> recipes = new LinkedHashMap<>();
        raw.forEach((key, fields) -> {
            if (fields == null) {
                throw new IllegalArgumentException("Catalog entry " + key + " is null");
            }
            recipes.put(key, Recipe.of(fields));
        });
        return RecipeCatalog.of(recipes);
    }

    @Override
    public String encode(RecipeCatalog catalog) {
        Map<String, Map<String, Object>> raw = new LinkedHashMap<>();
        catalog.asMap().forEach((key, recipe) -> raw.put(key, recipe.fields()));
        return objectMapper.writeValueAsString(raw);
    }
}
